package io.intellixity.quill.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "quill")
public class QuillProperties {
  /** "memory" (default) or "mongo". */
  private String store = "memory";

  /** Fail on fields without a stored name instead of skipping them with a warning. */
  private boolean strictFields;

  private final Mongo mongo = new Mongo();

  public String getStore() { return store; }
  public void setStore(String store) { this.store = store; }
  public boolean isStrictFields() { return strictFields; }
  public void setStrictFields(boolean strictFields) { this.strictFields = strictFields; }
  public Mongo getMongo() { return mongo; }

  public static class Mongo {
    private String uri = "mongodb://localhost:27017";
    private String database = "quill";

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }
}
