package tecomp.zeroelim;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Knobs of the zero-elimination pass. Each key is looked up as a system property first
 * ({@code tecomp.ze.simplify_iterations}) and then as an environment variable
 * ({@code TECOMP_ZE_SIMPLIFY_ITERATIONS}).
 *
 * @param simplifyIterations rounds of {equations, deskew} in domain simplification
 * @param eliminateDivMod whether domain simplification starts with div/mod elimination
 * @param traceStart first traced step (inclusive)
 * @param traceEnd last traced step (exclusive); tracing is off when not above traceStart
 * @param smt whether undecided conditions are handed to Z3
 * @param smtTimeoutMs Z3 timeout per query
 */
public record ZeConfig(
    int simplifyIterations,
    boolean eliminateDivMod,
    long traceStart,
    long traceEnd,
    boolean smt,
    int smtTimeoutMs) {
  private static final String PREFIX = "tecomp.ze.";

  public ZeConfig {
    checkArgument(simplifyIterations >= 0, "simplify_iterations must be non-negative");
    checkArgument(smtTimeoutMs > 0, "smt_timeout must be positive");
  }

  public static ZeConfig defaults() {
    return new ZeConfig(2, true, 0, 0, false, 2000);
  }

  public static ZeConfig fromSystem() {
    return from(System::getProperty, System::getenv);
  }

  static ZeConfig from(Function<String, String> properties, Function<String, String> env) {
    final Lookup lookup = new Lookup(properties, env);
    final ZeConfig d = defaults();
    return new ZeConfig(
        lookup.getInt("simplify_iterations", d.simplifyIterations),
        lookup.getBool("eliminate_div_mod", d.eliminateDivMod),
        lookup.getLong("trace_start", d.traceStart),
        lookup.getLong("trace_end", d.traceEnd),
        lookup.getBool("smt", d.smt),
        lookup.getInt("smt_timeout", d.smtTimeoutMs));
  }

  public boolean tracing() {
    return traceEnd > traceStart;
  }

  public ZeConfig withEliminateDivMod(boolean eliminateDivMod) {
    return new ZeConfig(simplifyIterations, eliminateDivMod, traceStart, traceEnd, smt, smtTimeoutMs);
  }

  public ZeConfig withTraceWindow(long start, long end) {
    return new ZeConfig(simplifyIterations, eliminateDivMod, start, end, smt, smtTimeoutMs);
  }

  private record Lookup(Function<String, String> properties, Function<String, String> env) {
    private String raw(String key) {
      final String value = properties.apply(PREFIX + key);
      if (value != null) return value.trim();
      final String fromEnv = env.apply("TECOMP_ZE_" + key.toUpperCase());
      return fromEnv == null ? null : fromEnv.trim();
    }

    private long getLong(String key, long defaultValue) {
      final String value = raw(key);
      if (value == null || value.isEmpty()) return defaultValue;
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("malformed value for " + key + ": " + value, ex);
      }
    }

    private int getInt(String key, int defaultValue) {
      final long value = getLong(key, defaultValue);
      checkArgument(value == (int) value, "value out of range for %s: %s", key, value);
      return (int) value;
    }

    private boolean getBool(String key, boolean defaultValue) {
      final String value = raw(key);
      if (value == null || value.isEmpty()) return defaultValue;
      if (value.equalsIgnoreCase("true") || value.equals("1")) return true;
      if (value.equalsIgnoreCase("false") || value.equals("0")) return false;
      throw new IllegalArgumentException("malformed value for " + key + ": " + value);
    }
  }
}
