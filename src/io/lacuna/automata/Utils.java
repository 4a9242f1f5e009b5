package io.lacuna.automata;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.function.Function;

/**
 * Collection helpers for building automata.
 */
public class Utils {

  public static <K, V> LinearMap<K, V> zipMap(Iterable<K> keys, Function<K, V> f) {
    LinearMap<K, V> m = new LinearMap<>();
    keys.forEach(k -> m.put(k, f.apply(k)));
    return m;
  }

  public static <U, V> LinearSet<V> map(Iterable<U> vals, Function<U, V> f) {
    LinearSet<V> s = new LinearSet<>();
    vals.forEach(v -> s.add(f.apply(v)));
    return s;
  }

  public static <V> boolean containsAny(ISet<V> set, Iterable<V> vals) {
    for (V v : vals) {
      if (set.contains(v)) {
        return true;
      }
    }
    return false;
  }
}
