package io.intellixity.quill.mongo;

import com.mongodb.client.MongoClient;

import java.util.Objects;

/** Mongo client plus target database (resolved by application code). */
public final class MongoHandle {
  private final String id;
  private final MongoClient client;
  private final String database;

  public MongoHandle(String id, MongoClient client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
  }

  public String id() { return id; }
  public MongoClient client() { return client; }
  public String database() { return database; }
}
