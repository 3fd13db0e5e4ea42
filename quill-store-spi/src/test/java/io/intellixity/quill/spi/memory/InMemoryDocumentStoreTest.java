package io.intellixity.quill.spi.memory;

import io.intellixity.quill.query.Condition;
import io.intellixity.quill.query.Operator;
import io.intellixity.quill.query.QueryDescriptor;
import io.intellixity.quill.query.SortField;
import io.intellixity.quill.store.CollectionPath;
import io.intellixity.quill.store.DocumentRef;
import io.intellixity.quill.store.DocumentSnapshot;
import io.intellixity.quill.store.StoreException;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryDocumentStoreTest {
  private static final CollectionPath ITEMS = CollectionPath.of("items");

  private final InMemoryDocumentStore store = new InMemoryDocumentStore();

  @Test
  void numbers_compareAcrossIntegerAndFloatingTypes() {
    put("a", doc("price", 10));
    put("b", doc("price", 10.5));
    put("c", doc("price", 11L));

    assertEquals(List.of("a"), ids(query().withCondition(Condition.of("price", Operator.EQ, 10.0))));
    assertEquals(List.of("b", "c"), ids(query().withCondition(Condition.of("price", Operator.GT, 10))));
  }

  @Test
  void rangeFilter_onlyMatchesSameTypeClass() {
    put("a", doc("v", 5));
    put("b", doc("v", "5"));
    put("c", doc("v", true));

    assertEquals(List.of("a"), ids(query().withCondition(Condition.of("v", Operator.GE, 0))));
    assertEquals(List.of("b"), ids(query().withCondition(Condition.of("v", Operator.GE, ""))));
  }

  @Test
  void missingField_neverMatches_butExplicitNullDoes() {
    put("a", doc("name", "lamp"));
    put("b", doc("name", "desk", "color", null));

    assertEquals(List.of("b"), ids(query().withCondition(Condition.of("color", Operator.EQ, null))));
    assertEquals(List.of(), ids(query().withCondition(Condition.of("color", Operator.IN, List.of("red")))));
  }

  @Test
  void nestedPaths_areMatched() {
    put("a", doc("dims", doc("w", 3)));
    put("b", doc("dims", doc("w", 9)));
    assertEquals(List.of("b"), ids(query().withCondition(Condition.of("dims.w", Operator.GT, 4))));
  }

  @Test
  void arrayOperators() {
    put("a", doc("tags", List.of("home", "sale")));
    put("b", doc("tags", List.of("office")));
    put("c", doc("tags", "home"));

    assertEquals(List.of("a"), ids(query().withCondition(Condition.of("tags", Operator.ARRAY_CONTAINS, "home"))));
    assertEquals(List.of("a", "b"),
        ids(query().withCondition(Condition.of("tags", Operator.ARRAY_CONTAINS_ANY, List.of("sale", "office")))));
    assertEquals(List.of("c"), ids(query().withCondition(Condition.of("tags", Operator.IN, List.of("home")))));
  }

  @Test
  void orderBy_excludesDocumentsMissingTheField_andBreaksTiesById() {
    put("d", doc("rank", 2));
    put("a", doc("rank", 1));
    put("c", doc("other", 0));
    put("b", doc("rank", 2));

    assertEquals(List.of("a", "b", "d"), ids(query().withSort(SortField.asc("rank"))));
    assertEquals(List.of("b", "d", "a"), ids(query().withSort(SortField.desc("rank"))));
  }

  @Test
  void orderBy_mixedTypes_followsTypeRank() {
    put("s", doc("v", "x"));
    put("n", doc("v", 1));
    put("z", doc("v", null));
    put("b", doc("v", false));
    put("l", doc("v", List.of(1)));
    put("t", doc("v", new Date(0)));

    assertEquals(List.of("z", "b", "n", "t", "s", "l"), ids(query().withSort(SortField.asc("v"))));
  }

  @Test
  void defaultOrder_isDocumentId_andLimitApplies() {
    put("c", doc());
    put("a", doc());
    put("b", doc());

    assertEquals(List.of("a", "b", "c"), ids(query()));
    assertEquals(List.of("a", "b"), ids(query().withLimit(2)));
    assertEquals(3, store.count(query()));
  }

  @Test
  void nonPositiveLimit_isRejectedAtExecution() {
    assertThrows(StoreException.class, () -> store.find(query().withLimit(0)));
    assertThrows(StoreException.class, () -> store.count(query().withLimit(-1)));
  }

  @Test
  void merge_keepsOtherFields_andMergesNestedMaps() {
    put("a", doc("name", "lamp", "dims", doc("w", 1, "h", 2)));

    store.set(ref("a"), doc("price", 3, "dims", doc("h", 5)), true);

    assertEquals(doc("name", "lamp", "dims", doc("w", 1, "h", 5), "price", 3), store.get(ref("a")).data());
  }

  @Test
  void replace_dropsOtherFields() {
    put("a", doc("name", "lamp", "price", 1));
    store.set(ref("a"), doc("price", 3), false);
    assertEquals(doc("price", 3), store.get(ref("a")).data());
  }

  @Test
  void update_setsDottedPaths_andRequiresDocument() {
    put("a", doc("name", "lamp", "dims", doc("w", 1)));

    store.update(ref("a"), Map.of("dims.h", 4, "name", "desk"));

    assertEquals(doc("name", "desk", "dims", doc("w", 1, "h", 4)), store.get(ref("a")).data());
    assertThrows(StoreException.class, () -> store.update(ref("ghost"), Map.of("name", "x")));
  }

  @Test
  void storedData_isIsolatedFromCallerMutation() {
    Map<String, Object> data = doc("tags", new ArrayList<>(List.of("a")));
    store.set(ref("a"), data, false);
    ((List<Object>) data.get("tags")).add("b");

    assertEquals(List.of("a"), store.get(ref("a")).data().get("tags"));
  }

  @Test
  void subcollections_areSeparateFromTopLevel() {
    DocumentRef nested = DocumentRef.parse("shops/s1/items/a");
    store.set(nested, doc("name", "lamp"), false);

    assertFalse(store.get(ref("a")).exists());
    assertTrue(store.get(nested).exists());
    assertEquals(1, store.size("shops/s1/items"));
    assertEquals(List.of(), store.find(query()));
  }

  @Test
  void delete_removes_andMissingIsNoOp() {
    put("a", doc());
    store.delete(ref("a"));
    store.delete(ref("a"));
    assertFalse(store.get(ref("a")).exists());
  }

  @Test
  void generatedIds_areUnique() {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 100; i++) assertTrue(seen.add(store.newDocumentId(ITEMS)));
  }

  private static QueryDescriptor query() {
    return QueryDescriptor.of(ITEMS);
  }

  private static DocumentRef ref(String id) {
    return ITEMS.document(id);
  }

  private void put(String id, Map<String, Object> data) {
    store.set(ref(id), data, false);
  }

  private List<String> ids(QueryDescriptor q) {
    return store.find(q).stream().map(DocumentSnapshot::id).toList();
  }

  private static Map<String, Object> doc(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }
}
