package io.github.panghy.flowsim.process;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The processes registered with one clock, keyed by id.
 */
public class ProcessTable {

  private final Map<Object, SimProcess> processes = new LinkedHashMap<>();

  /**
   * Returns {@code id} if it is free, otherwise the next free id in its sequence:
   * integers count up, doubles move to the next representable value and strings
   * get a {@code #n} suffix ("A", "A#1", "A#2").
   *
   * @param id The requested id
   * @return A free id
   * @throws IllegalArgumentException for any other id type
   */
  public Object uniqueId(Object id) {
    if (!(id instanceof Integer || id instanceof Long || id instanceof Double
        || id instanceof String)) {
      throw new IllegalArgumentException("Process id must be an integer, a double or a string, got "
          + (id == null ? "null" : id.getClass().getName()));
    }
    Object candidate = id;
    while (processes.containsKey(candidate)) {
      candidate = next(candidate);
    }
    return candidate;
  }

  private static Object next(Object id) {
    if (id instanceof Integer i) {
      return i + 1;
    }
    if (id instanceof Long l) {
      return l + 1;
    }
    if (id instanceof Double d) {
      return Math.nextUp(d);
    }
    String s = (String) id;
    int hash = s.lastIndexOf('#');
    if (hash >= 0 && hash < s.length() - 1) {
      try {
        int n = Integer.parseInt(s.substring(hash + 1));
        return s.substring(0, hash) + "#" + (n + 1);
      } catch (NumberFormatException e) {
        // not a counter suffix
        return s + "#1";
      }
    }
    return s + "#1";
  }

  void add(SimProcess process) {
    if (processes.putIfAbsent(process.getId(), process) != null) {
      throw new IllegalStateException("Duplicate process id " + process.getId());
    }
  }

  void remove(SimProcess process) {
    processes.remove(process.getId(), process);
  }

  public SimProcess get(Object id) {
    return processes.get(id);
  }

  public boolean contains(Object id) {
    return processes.containsKey(id);
  }

  public int size() {
    return processes.size();
  }

  public boolean isEmpty() {
    return processes.isEmpty();
  }

  public Collection<SimProcess> values() {
    return Collections.unmodifiableCollection(new ArrayList<>(processes.values()));
  }

  /**
   * @return The processes that ended with an uncaught fault
   */
  public List<SimProcess> failed() {
    List<SimProcess> result = new ArrayList<>();
    for (SimProcess process : processes.values()) {
      if (process.getState() == SimProcess.ProcessState.FAILED) {
        result.add(process);
      }
    }
    return result;
  }

  public void clear() {
    processes.clear();
  }
}
