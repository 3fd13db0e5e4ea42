package io.intellixity.quill.spi.memory;

import io.intellixity.quill.exec.QueryException;
import io.intellixity.quill.exec.Quill;
import io.intellixity.quill.query.Update;
import io.intellixity.quill.record.Field;
import io.intellixity.quill.record.RecordType;
import io.intellixity.quill.store.DocumentRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Query builder against the in-memory store, end to end through the Jackson codec. */
final class InMemoryQueryTest {
  public record Item(String id, String name, Integer price, List<String> tags) {
    static final Field<Item, String> NAME = Field.of("name", String.class);
    static final Field<Item, Integer> PRICE = Field.of("price", Integer.class);
    static final Field<Item, List<String>> TAGS = Field.list("tags", String.class);
    static final Field<Item, String> COLOR = Field.of("color", String.class);

    static final RecordType<Item> TYPE = RecordType.builder(Item.class, "items")
        .idProperty("id")
        .fields(NAME, PRICE, TAGS)
        .build();
  }

  public enum Status { ACTIVE, RETIRED }

  public record Listing(String id, String name, Status status) {
    static final Field<Listing, String> NAME = Field.of("name", String.class);
    static final Field<Listing, Status> STATUS = Field.of("status", Status.class);

    static final RecordType<Listing> TYPE = RecordType.builder(Listing.class, "listings")
        .idProperty("id")
        .fields(NAME, STATUS)
        .build();
  }

  private final InMemoryDocumentStore store = new InMemoryDocumentStore();
  private final Quill quill = Quill.of(store);

  @BeforeEach
  void seed() {
    int[] prices = {5, 12, 8, 20, 15, 10, 3, 30};
    for (int i = 0; i < prices.length; i++) {
      List<String> tags = (prices[i] % 2 == 0) ? List.of("even") : List.of("odd");
      quill.query(Item.TYPE).set(new Item(null, "item-" + i, prices[i], tags), "i" + i);
    }
  }

  @Test
  void rangeSortAndLimit() {
    List<Item> top = quill.query(Item.TYPE)
        .whereGreaterThanOrEqualTo(Item.PRICE, 10)
        .orderBy(Item.PRICE, true)
        .limit(5)
        .all();

    assertEquals(List.of(30, 20, 15, 12, 10), top.stream().map(Item::price).toList());
  }

  @Test
  void unresolvableFilter_returnsSameAsOmitted() {
    List<Item> with = quill.query(Item.TYPE).whereEqualTo(Item.COLOR, "red").whereLessThan(Item.PRICE, 10).all();
    List<Item> without = quill.query(Item.TYPE).whereLessThan(Item.PRICE, 10).all();

    assertEquals(without, with);
    assertEquals(3, with.size());
  }

  @Test
  void arrayFilters() {
    assertEquals(5, quill.query(Item.TYPE).whereArrayContains(Item.TAGS, "even").whereGreaterThan(Item.PRICE, 5).count());
    assertEquals(8, quill.query(Item.TYPE).whereArrayContainsAny(Item.TAGS, List.of("even", "odd")).count());
  }

  @Test
  void whereIn_andFirst() {
    Item cheapest = quill.query(Item.TYPE)
        .whereIn(Item.PRICE, List.of(3, 5, 8))
        .orderBy(Item.PRICE)
        .first()
        .orElseThrow();

    assertEquals(new Item("i6", "item-6", 3, List.of("odd")), cheapest);
    assertTrue(quill.query(Item.TYPE).whereEqualTo(Item.NAME, "none").first().isEmpty());
  }

  @Test
  void generatedId_isRetrievable() {
    DocumentRef ref = quill.query(Item.TYPE).set(new Item(null, "new", 1, List.of()));

    Item back = quill.query(Item.TYPE).getByDocumentId(ref.id());

    assertEquals(ref.id(), back.id());
    assertEquals("new", back.name());
  }

  @Test
  void merge_preservesAbsentFields_replaceDropsThem() {
    quill.query(Item.TYPE).set(Map.of("price", 99), "i0", true);
    assertEquals(new Item("i0", "item-0", 99, List.of("odd")), quill.query(Item.TYPE).getByDocumentId("i0"));

    quill.query(Item.TYPE).set(Map.of("price", 42), "i0", false);
    assertEquals(new Item("i0", null, 42, null), quill.query(Item.TYPE).getByDocumentId("i0"));
  }

  @Test
  void typedMerge_keepsFieldsTheRecordLeavesNull() {
    quill.query(Item.TYPE).set(new Item(null, null, 99, null), "i0", true);
    assertEquals(new Item("i0", "item-0", 99, List.of("odd")), quill.query(Item.TYPE).getByDocumentId("i0"));

    quill.query(Item.TYPE).set(new Item(null, null, 42, null), "i0");
    assertEquals(new Item("i0", null, 42, null), quill.query(Item.TYPE).getByDocumentId("i0"));
  }

  @Test
  void enumFields_filterAndUpdateInStoredForm() {
    quill.query(Listing.TYPE).set(new Listing(null, "lamp", Status.ACTIVE), "l1");
    quill.query(Listing.TYPE).set(new Listing(null, "desk", Status.RETIRED), "l2");

    assertEquals(List.of("l1"),
        quill.query(Listing.TYPE).whereEqualTo(Listing.STATUS, Status.ACTIVE).all().stream().map(Listing::id).toList());
    assertEquals(2, quill.query(Listing.TYPE).whereIn(Listing.STATUS, List.of(Status.ACTIVE, Status.RETIRED)).count());

    quill.query(Listing.TYPE).update(Update.of(Listing.TYPE).set(Listing.STATUS, Status.RETIRED), "l1");

    assertEquals("RETIRED", store.get(DocumentRef.parse("listings/l1")).data().get("status"));
    assertEquals(2, quill.query(Listing.TYPE).whereEqualTo(Listing.STATUS, Status.RETIRED).count());
  }

  @Test
  void typedUpdate_andDelete() {
    quill.query(Item.TYPE).update(Update.of(Item.TYPE).set(Item.TAGS, List.of("sale")), "i1");
    assertEquals(List.of("sale"), quill.query(Item.TYPE).getByDocumentId("i1").tags());

    quill.query(Item.TYPE).delete("i1");
    QueryException ex = assertThrows(QueryException.class, () -> quill.query(Item.TYPE).getByDocumentId("i1"));
    assertTrue(ex.isNotFound());
  }

  @Test
  void updateOfMissingDocument_isStoreError() {
    QueryException ex = assertThrows(QueryException.class,
        () -> quill.query(Item.TYPE).update(Update.of(Item.TYPE).set(Item.PRICE, 1), "ghost"));
    assertEquals(QueryException.Kind.STORE_ERROR, ex.kind());
  }

  @Test
  void invalidLimit_isStoreErrorAtExecution() {
    QueryException ex = assertThrows(QueryException.class, () -> quill.query(Item.TYPE).limit(0).all());
    assertEquals(QueryException.Kind.STORE_ERROR, ex.kind());
  }

  @Test
  void subcollectionQueries_areScopedToParent() {
    DocumentRef shop = DocumentRef.parse("shops/s1");
    quill.query(Item.TYPE, shop).set(new Item(null, "nested", 7, List.of()), "n1");

    assertEquals(List.of("n1"), quill.query(Item.TYPE, shop).all().stream().map(Item::id).toList());
    assertEquals(8, quill.query(Item.TYPE).count());
    assertEquals("nested", quill.load(Item.TYPE, DocumentRef.parse("shops/s1/items/n1")).name());
  }
}
