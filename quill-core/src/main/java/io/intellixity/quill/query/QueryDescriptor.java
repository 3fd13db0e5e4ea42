package io.intellixity.quill.query;

import io.intellixity.quill.store.CollectionPath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a collection query: target collection, predicates in the order they were added,
 * sort keys and an optional limit.
 * <p>
 * Each {@code with*} call returns a new descriptor; conditions and sort keys are only ever appended.
 */
public final class QueryDescriptor {
  private final CollectionPath collection;
  private final List<Condition> conditions;
  private final List<SortField> sort;
  private final Integer limit;

  private QueryDescriptor(CollectionPath collection, List<Condition> conditions, List<SortField> sort, Integer limit) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.conditions = conditions;
    this.sort = sort;
    this.limit = limit;
  }

  public static QueryDescriptor of(CollectionPath collection) {
    return new QueryDescriptor(collection, List.of(), List.of(), null);
  }

  public CollectionPath collection() { return collection; }
  public List<Condition> conditions() { return conditions; }
  public List<SortField> sort() { return sort; }

  /** Maximum number of documents, null when unlimited. */
  public Integer limit() { return limit; }

  public QueryDescriptor withCondition(Condition condition) {
    return new QueryDescriptor(collection, append(conditions, Objects.requireNonNull(condition, "condition")), sort, limit);
  }

  public QueryDescriptor withSort(SortField sortField) {
    return new QueryDescriptor(collection, conditions, append(sort, Objects.requireNonNull(sortField, "sortField")), limit);
  }

  /** Replaces any earlier limit. */
  public QueryDescriptor withLimit(int limit) {
    return new QueryDescriptor(collection, conditions, sort, limit);
  }

  private static <E> List<E> append(List<E> list, E element) {
    List<E> out = new ArrayList<>(list.size() + 1);
    out.addAll(list);
    out.add(element);
    return Collections.unmodifiableList(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QueryDescriptor q)) return false;
    return collection.equals(q.collection)
        && conditions.equals(q.conditions)
        && sort.equals(q.sort)
        && Objects.equals(limit, q.limit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(collection, conditions, sort, limit);
  }

  @Override
  public String toString() {
    return "QueryDescriptor{collection=" + collection + ", conditions=" + conditions + ", sort=" + sort + ", limit=" + limit + "}";
  }
}
