package io.intellixity.quill.spi.memory;

import io.intellixity.quill.query.Condition;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

/**
 * Value semantics of document data: path lookup, type-ranked ordering, equality and predicate matching.
 * <p>
 * Ordering by type rank: null, boolean, number, timestamp, string, list, map. Integer and floating point
 * numbers compare by numeric value.
 */
final class DocumentValues {
  /** Marker for a path that is absent from the document (as opposed to present with a null value). */
  static final Object MISSING = new Object();

  private DocumentValues() {}

  static Object getByPath(Map<String, Object> root, String path) {
    Object cur = root;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m) || !m.containsKey(p)) return MISSING;
      cur = m.get(p);
    }
    return cur;
  }

  static boolean matches(Map<String, Object> data, Condition c) {
    Object v = getByPath(data, c.field());
    if (v == MISSING) return false;
    return switch (c.operator()) {
      case EQ -> equal(v, c.value());
      case LT -> comparable(v, c.value()) && compare(v, c.value()) < 0;
      case LE -> comparable(v, c.value()) && compare(v, c.value()) <= 0;
      case GT -> comparable(v, c.value()) && compare(v, c.value()) > 0;
      case GE -> comparable(v, c.value()) && compare(v, c.value()) >= 0;
      case IN -> containsEqual(c.values(), v);
      case ARRAY_CONTAINS -> (v instanceof List<?> l) && containsEqual(l, c.value());
      case ARRAY_CONTAINS_ANY -> (v instanceof List<?> l) && c.values().stream().anyMatch(x -> containsEqual(l, x));
    };
  }

  static boolean equal(Object a, Object b) {
    return rank(a) == rank(b) && compare(a, b) == 0;
  }

  static int compare(Object a, Object b) {
    int ra = rank(a), rb = rank(b);
    if (ra != rb) return Integer.compare(ra, rb);
    return switch (ra) {
      case 0 -> 0;
      case 1 -> Boolean.compare((Boolean) a, (Boolean) b);
      case 2 -> compareNumbers((Number) a, (Number) b);
      case 3 -> toInstant(a).compareTo(toInstant(b));
      case 4 -> a.toString().compareTo(b.toString());
      case 5 -> compareLists((List<?>) a, (List<?>) b);
      case 6 -> compareMaps((Map<?, ?>) a, (Map<?, ?>) b);
      default -> a.toString().compareTo(b.toString());
    };
  }

  /** Range filters only match values of the operand's type class. */
  private static boolean comparable(Object v, Object operand) {
    return v != null && operand != null && rank(v) == rank(operand);
  }

  private static boolean containsEqual(Collection<?> values, Object v) {
    for (Object x : values) {
      if (equal(x, v)) return true;
    }
    return false;
  }

  private static int rank(Object v) {
    if (v == null) return 0;
    if (v instanceof Boolean) return 1;
    if (v instanceof Number) return 2;
    if (v instanceof Date || v instanceof Instant) return 3;
    if (v instanceof CharSequence) return 4;
    if (v instanceof List<?>) return 5;
    if (v instanceof Map<?, ?>) return 6;
    return 7;
  }

  private static int compareNumbers(Number a, Number b) {
    if (isIntegral(a) && isIntegral(b)) return Long.compare(a.longValue(), b.longValue());
    if (a instanceof BigDecimal x && b instanceof BigDecimal y) return x.compareTo(y);
    return Double.compare(a.doubleValue(), b.doubleValue());
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
  }

  private static Instant toInstant(Object v) {
    return (v instanceof Date d) ? d.toInstant() : (Instant) v;
  }

  private static int compareLists(List<?> a, List<?> b) {
    int n = Math.min(a.size(), b.size());
    for (int i = 0; i < n; i++) {
      int c = compare(a.get(i), b.get(i));
      if (c != 0) return c;
    }
    return Integer.compare(a.size(), b.size());
  }

  private static int compareMaps(Map<?, ?> a, Map<?, ?> b) {
    List<String> ka = sortedKeys(a), kb = sortedKeys(b);
    int n = Math.min(ka.size(), kb.size());
    for (int i = 0; i < n; i++) {
      int c = ka.get(i).compareTo(kb.get(i));
      if (c != 0) return c;
      c = compare(a.get(ka.get(i)), b.get(kb.get(i)));
      if (c != 0) return c;
    }
    return Integer.compare(ka.size(), kb.size());
  }

  private static List<String> sortedKeys(Map<?, ?> m) {
    List<String> keys = new ArrayList<>();
    for (Object k : m.keySet()) keys.add(String.valueOf(k));
    Collections.sort(keys);
    return keys;
  }

  // ---------- copying / merging ----------

  @SuppressWarnings("unchecked")
  static Object deepCopy(Object v) {
    if (v instanceof Map<?, ?> m) return deepCopyMap((Map<String, Object>) m);
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object e : c) out.add(deepCopy(e));
      return out;
    }
    if (v instanceof Object[] a) return deepCopy(Arrays.asList(a));
    if (v instanceof Date d) return new Date(d.getTime());
    return v;
  }

  static Map<String, Object> deepCopyMap(Map<String, Object> m) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) out.put(e.getKey(), deepCopy(e.getValue()));
    return out;
  }

  /** Merges {@code patch} into {@code target}; nested maps merge, everything else replaces. */
  @SuppressWarnings("unchecked")
  static void deepMerge(Map<String, Object> target, Map<String, Object> patch) {
    for (var e : patch.entrySet()) {
      Object cur = target.get(e.getKey());
      if (cur instanceof Map<?, ?> cm && e.getValue() instanceof Map<?, ?> pm) {
        deepMerge((Map<String, Object>) cm, (Map<String, Object>) pm);
      } else {
        target.put(e.getKey(), deepCopy(e.getValue()));
      }
    }
  }

  /** Sets a dotted path, creating (or replacing non-map) intermediate maps. */
  @SuppressWarnings("unchecked")
  static void setByPath(Map<String, Object> root, String path, Object value) {
    String[] parts = path.split("\\.");
    Map<String, Object> cur = root;
    for (int i = 0; i < parts.length - 1; i++) {
      Object next = cur.get(parts[i]);
      if (!(next instanceof Map<?, ?>)) {
        next = new LinkedHashMap<String, Object>();
        cur.put(parts[i], next);
      }
      cur = (Map<String, Object>) next;
    }
    cur.put(parts[parts.length - 1], deepCopy(value));
  }
}
