package io.intellixity.quill.examples.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.quill.compile.UnresolvedFieldPolicy;
import io.intellixity.quill.exec.Quill;
import io.intellixity.quill.mongo.MongoDocumentStore;
import io.intellixity.quill.mongo.MongoHandle;
import io.intellixity.quill.spi.memory.InMemoryDocumentStore;
import io.intellixity.quill.store.DocumentStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(QuillProperties.class)
public class QuillExampleConfig {

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "quill", name = "store", havingValue = "mongo")
  public MongoClient mongoClient(QuillProperties props) {
    return MongoClients.create(props.getMongo().getUri());
  }

  @Bean
  @ConditionalOnProperty(prefix = "quill", name = "store", havingValue = "mongo")
  public DocumentStore mongoDocumentStore(MongoClient client, QuillProperties props) {
    return new MongoDocumentStore(new MongoHandle("mongo", client, props.getMongo().getDatabase()));
  }

  @Bean
  @ConditionalOnProperty(prefix = "quill", name = "store", havingValue = "memory", matchIfMissing = true)
  public DocumentStore inMemoryDocumentStore() {
    return new InMemoryDocumentStore();
  }

  @Bean
  public Quill quill(DocumentStore store, QuillProperties props) {
    return Quill.builder(store)
        .unresolvedFieldPolicy(props.isStrictFields() ? UnresolvedFieldPolicy.FAIL : UnresolvedFieldPolicy.SKIP)
        .build();
  }
}
