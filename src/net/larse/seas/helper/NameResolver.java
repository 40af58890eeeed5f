package net.larse.seas.helper;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps user supplied names onto constants. A name matches an alias exactly (ignoring case), or
 * is an unambiguous prefix of the aliases of a single constant.
 */
public class NameResolver<T> {
  private final Map<String, T> aliases = new LinkedHashMap<>();

  public NameResolver<T> add(T value, String... names) {
    for (String name : names) {
      aliases.put(name.toLowerCase(Locale.ROOT), value);
    }
    return this;
  }

  /** Returns the matching constant, or null if the name is unknown or ambiguous. */
  public T resolve(String name) {
    if (name == null) {
      return null;
    }
    String key = name.trim().toLowerCase(Locale.ROOT);
    if (key.isEmpty()) {
      return null;
    }
    T exact = aliases.get(key);
    if (exact != null) {
      return exact;
    }
    Set<T> matches = new LinkedHashSet<>();
    for (Map.Entry<String, T> entry : aliases.entrySet()) {
      if (entry.getKey().startsWith(key)) {
        matches.add(entry.getValue());
      }
    }
    return matches.size() == 1 ? matches.iterator().next() : null;
  }
}
