package io.intellixity.quill.mongo;

import org.bson.Document;

/** Rendered find: target collection, filter, sort and optional limit. */
public record MongoStatement(String collection, Document filter, Document sort, Integer limit) {}
