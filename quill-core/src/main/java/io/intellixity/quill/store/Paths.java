package io.intellixity.quill.store;

import java.util.List;

final class Paths {
  private Paths() {}

  static String requireSegment(String segment, String label) {
    if (segment == null || segment.isBlank()) throw new IllegalArgumentException(label + " is required");
    if (segment.contains("/")) throw new IllegalArgumentException(label + " must not contain '/': " + segment);
    return segment;
  }

  static List<String> split(String path) {
    if (path == null || path.isBlank()) throw new IllegalArgumentException("path is required");
    String p = path.startsWith("/") ? path.substring(1) : path;
    if (p.endsWith("/")) p = p.substring(0, p.length() - 1);
    List<String> segments = List.of(p.split("/", -1));
    for (String s : segments) {
      if (s.isBlank()) throw new IllegalArgumentException("Empty segment in path: " + path);
    }
    return segments;
  }
}
