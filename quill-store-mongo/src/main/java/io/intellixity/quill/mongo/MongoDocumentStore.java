package io.intellixity.quill.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.result.UpdateResult;
import io.intellixity.quill.query.QueryDescriptor;
import io.intellixity.quill.spi.AbstractDocumentStore;
import io.intellixity.quill.store.CollectionPath;
import io.intellixity.quill.store.DocumentRef;
import io.intellixity.quill.store.DocumentSnapshot;
import io.intellixity.quill.store.StoreException;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;

import java.util.*;

/**
 * Document store backed by the official MongoDB Java sync driver.
 * <p>
 * See {@link MongoPaths} for how collection paths map onto Mongo collections and {@code _id} values.
 */
public final class MongoDocumentStore extends AbstractDocumentStore {
  private final MongoDatabase db;

  public MongoDocumentStore(MongoHandle handle) {
    super(Objects.requireNonNull(handle, "handle").id());
    this.db = handle.client().getDatabase(handle.database());
  }

  @Override
  protected String doNewDocumentId(CollectionPath collection) {
    return new ObjectId().toHexString();
  }

  @Override
  protected List<DocumentSnapshot> doFind(QueryDescriptor query) {
    MongoStatement st = MongoQueryRenderer.render(query);
    FindIterable<Document> find = collection(st.collection()).find(st.filter()).sort(st.sort());
    if (st.limit() != null) find = find.limit(st.limit());

    List<DocumentSnapshot> out = new ArrayList<>();
    for (Document d : find) {
      out.add(DocumentSnapshot.of(MongoPaths.refOf(query.collection(), d.get(MongoPaths.ID)), dataOf(d)));
    }
    return out;
  }

  @Override
  protected long doCount(QueryDescriptor query) {
    MongoStatement st = MongoQueryRenderer.render(query);
    CountOptions opts = new CountOptions();
    if (st.limit() != null) opts.limit(st.limit());
    return collection(st.collection()).countDocuments(st.filter(), opts);
  }

  @Override
  protected DocumentSnapshot doGet(DocumentRef ref) {
    Document d = collection(ref).find(byKey(ref)).first();
    return (d == null) ? DocumentSnapshot.missing(ref) : DocumentSnapshot.of(ref, dataOf(d));
  }

  @Override
  protected void doSet(DocumentRef ref, Map<String, Object> data, boolean merge) {
    MongoCollection<Document> col = collection(ref);
    String parent = MongoPaths.parentKey(ref.collection());

    if (!merge) {
      Document doc = new Document(MongoPaths.ID, MongoPaths.documentKey(ref));
      if (parent != null) doc.append(MongoPaths.PARENT, parent);
      doc.putAll(data);
      col.replaceOne(byKey(ref), doc, new ReplaceOptions().upsert(true));
      return;
    }

    Document stored = col.find(byKey(ref)).first();
    Document set = new Document();
    flatten("", data, stored, set);
    if (parent != null) set.append(MongoPaths.PARENT, parent);
    if (set.isEmpty()) {
      // $set must not be empty; only make sure the document exists
      if (stored == null) col.insertOne(new Document(MongoPaths.ID, MongoPaths.documentKey(ref)));
      return;
    }
    col.updateOne(byKey(ref), new Document("$set", set), new UpdateOptions().upsert(true));
  }

  @Override
  protected void doUpdate(DocumentRef ref, Map<String, Object> fields) {
    UpdateResult r = collection(ref).updateOne(byKey(ref), new Document("$set", new Document(fields)));
    if (r.getMatchedCount() == 0) throw new StoreException("No document to update: " + ref);
  }

  @Override
  protected void doDelete(DocumentRef ref) {
    collection(ref).deleteOne(byKey(ref));
  }

  /**
   * Builds the {@code $set} of a merge write. A nested map becomes dotted keys only where the stored document
   * already holds a map at that key, so sibling fields survive; anywhere else the value replaces what is
   * stored, the same way {@code InMemoryDocumentStore} merges.
   *
   * @param stored stored map at this level, or null when there is none
   */
  @SuppressWarnings("unchecked")
  static void flatten(String prefix, Map<String, Object> data, Map<String, Object> stored, Document out) {
    for (var e : data.entrySet()) {
      String key = prefix + e.getKey();
      Object v = e.getValue();
      Object current = (stored == null) ? null : stored.get(e.getKey());
      if (v instanceof Map<?, ?> m && current instanceof Map<?, ?> cm) {
        flatten(key + ".", (Map<String, Object>) m, (Map<String, Object>) cm, out);
      } else {
        out.append(key, v);
      }
    }
  }

  static Map<String, Object> dataOf(Document d) {
    Map<String, Object> data = new LinkedHashMap<>(d);
    data.remove(MongoPaths.ID);
    data.remove(MongoPaths.PARENT);
    return data;
  }

  private MongoCollection<Document> collection(String name) {
    return db.getCollection(name);
  }

  private MongoCollection<Document> collection(DocumentRef ref) {
    return collection(MongoPaths.collectionName(ref.collection()));
  }

  private static Bson byKey(DocumentRef ref) {
    return Filters.eq(MongoPaths.ID, MongoPaths.documentKey(ref));
  }
}
