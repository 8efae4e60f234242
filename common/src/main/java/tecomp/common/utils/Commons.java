package tecomp.common.utils;

import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

public interface Commons {
  /** Merge two maps into a fresh sorted map, preferring the right one on conflict. */
  static <K extends Comparable<? super K>, V> Map<K, V> merge(Map<K, V> original, Map<K, V> update) {
    final Map<K, V> merged = new TreeMap<>(original);
    merged.putAll(update);
    return merged;
  }

  static <K, V> String joining(Map<K, V> map, Function<? super K, String> keyStr) {
    final StringBuilder builder = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<K, V> entry : map.entrySet()) {
      if (!first) builder.append(", ");
      builder.append(keyStr.apply(entry.getKey())).append(": ").append(entry.getValue());
      first = false;
    }
    return builder.append('}').toString();
  }

  static long gcd(long a, long b) {
    a = Math.abs(a);
    b = Math.abs(b);
    while (b != 0) {
      final long tmp = b;
      b = a % b;
      a = tmp;
    }
    return a;
  }

  static long lcm(long a, long b) {
    if (a == 0 || b == 0) return 0;
    return Math.abs(Math.multiplyExact(a / gcd(a, b), b));
  }
}
