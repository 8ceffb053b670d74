package io.dbkit.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Orders descriptors so that every referenced (parent) table precedes the tables that reference
 * it.
 *
 * <p>Kahn's topological sort over the foreign keys of the given descriptors, with input order
 * as the tie-break, so an input that is already parent-first comes back unchanged.
 * <ul>
 *   <li>References to tables outside the collection are ignored.</li>
 *   <li>Self-references are ignored.</li>
 *   <li>Tables caught in a cycle are appended in input order after the acyclic part.</li>
 *   <li>A repeated table name keeps its first occurrence.</li>
 * </ul>
 */
public final class SchemaOrdering {

  private SchemaOrdering() {}

  public static <T extends SchemaDescriptor> List<T> parentFirst(Collection<T> descriptors) {
    Map<String, T> byName = new LinkedHashMap<>();
    for (T descriptor : descriptors) {
      byName.putIfAbsent(descriptor.tableName(), descriptor);
    }
    List<String> names = new ArrayList<>(byName.keySet());
    Map<String, Integer> position = new HashMap<>();
    for (int i = 0; i < names.size(); i++) {
      position.put(names.get(i), i);
    }

    Map<String, Set<String>> children = new HashMap<>();
    Map<String, Integer> inDegree = new HashMap<>();
    for (String name : names) {
      children.put(name, new LinkedHashSet<>());
      inDegree.put(name, 0);
    }
    for (T descriptor : byName.values()) {
      String child = descriptor.tableName();
      for (ForeignKey fk : descriptor.foreignKeys()) {
        String parent = fk.referencedTable();
        if (parent.equals(child) || !byName.containsKey(parent)) {
          continue;
        }
        if (children.get(parent).add(child)) {
          inDegree.merge(child, 1, Integer::sum);
        }
      }
    }

    PriorityQueue<String> ready = new PriorityQueue<>((a, b) -> position.get(a) - position.get(b));
    for (String name : names) {
      if (inDegree.get(name) == 0) {
        ready.add(name);
      }
    }
    List<T> ordered = new ArrayList<>(names.size());
    Set<String> emitted = new LinkedHashSet<>();
    while (!ready.isEmpty()) {
      String next = ready.poll();
      ordered.add(byName.get(next));
      emitted.add(next);
      for (String child : children.get(next)) {
        if (inDegree.merge(child, -1, Integer::sum) == 0) {
          ready.add(child);
        }
      }
    }
    for (String name : names) {
      if (!emitted.contains(name)) {
        ordered.add(byName.get(name));
      }
    }
    return ordered;
  }
}
