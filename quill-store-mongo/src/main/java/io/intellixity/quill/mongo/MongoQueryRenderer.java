package io.intellixity.quill.mongo;

import io.intellixity.quill.query.Condition;
import io.intellixity.quill.query.QueryDescriptor;
import io.intellixity.quill.query.SortField;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link QueryDescriptor} to a MongoDB find ({@link MongoStatement}).
 *
 * Conditions are AND-ed in order. Every sort field also gets an {@code $exists} filter, so documents
 * without the field drop out of ordered results. Results are always ordered by {@code _id} last.
 */
final class MongoQueryRenderer {
  private MongoQueryRenderer() {}

  static MongoStatement render(QueryDescriptor q) {
    return new MongoStatement(MongoPaths.collectionName(q.collection()), toFilter(q), toSort(q.sort()), q.limit());
  }

  static Document toFilter(QueryDescriptor q) {
    List<Document> parts = new ArrayList<>();
    String parent = MongoPaths.parentKey(q.collection());
    if (parent != null) parts.add(new Document(MongoPaths.PARENT, parent));
    for (Condition c : q.conditions()) parts.add(toBson(c));
    for (SortField s : q.sort()) parts.add(new Document(s.field(), new Document("$exists", true)));

    if (parts.isEmpty()) return new Document();
    if (parts.size() == 1) return parts.get(0);
    return new Document("$and", parts);
  }

  static Document toSort(List<SortField> sort) {
    Document d = new Document();
    for (SortField s : sort) d.append(s.field(), s.sign());
    if (!d.containsKey(MongoPaths.ID)) d.append(MongoPaths.ID, 1);
    return d;
  }

  static Document toBson(Condition c) {
    String path = c.field();
    return switch (c.operator()) {
      case EQ -> (c.value() == null)
          ? new Document(path, new Document("$type", "null"))
          : new Document(path, new Document("$eq", c.value()));
      case LT -> new Document(path, new Document("$lt", c.value()));
      case LE -> new Document(path, new Document("$lte", c.value()));
      case GT -> new Document(path, new Document("$gt", c.value()));
      case GE -> new Document(path, new Document("$gte", c.value()));
      case IN -> new Document(path, new Document("$in", c.values()));
      case ARRAY_CONTAINS -> new Document(path, new Document("$elemMatch", new Document("$eq", c.value())));
      case ARRAY_CONTAINS_ANY -> new Document(path, new Document("$elemMatch", new Document("$in", c.values())));
    };
  }
}
