package io.axis.backend.changes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Field-level comparison of two entity snapshots. */
public final class SnapshotDiff {

  /** A field whose value differs between the two snapshots. Absent fields count as null. */
  public record FieldDiff(String fieldName, Object oldValue, Object newValue) {}

  private SnapshotDiff() {}

  /**
   * Returns the differing fields, in order of first appearance (before-snapshot keys first). A null
   * snapshot is treated as empty, so a creation diff lists every field of {@code after}.
   */
  public static List<FieldDiff> diff(Map<String, Object> before, Map<String, Object> after) {
    Map<String, Object> left = before != null ? before : Map.of();
    Map<String, Object> right = after != null ? after : Map.of();

    var fieldNames = new LinkedHashSet<String>(left.keySet());
    fieldNames.addAll(right.keySet());

    var diffs = new ArrayList<FieldDiff>();
    for (String field : fieldNames) {
      Object oldValue = left.get(field);
      Object newValue = right.get(field);
      if (!Objects.equals(oldValue, newValue)) {
        diffs.add(new FieldDiff(field, oldValue, newValue));
      }
    }
    return diffs;
  }
}
