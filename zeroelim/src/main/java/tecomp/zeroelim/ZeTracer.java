package tecomp.zeroelim;

/**
 * Observer of the pass' steps. Every {@link #enter} is matched by exactly one {@link #exit}.
 * Implementations must not alter the objects they are shown.
 */
public interface ZeTracer {
  ZeTracer NOOP =
      new ZeTracer() {
        @Override
        public void enter(String step, Object... args) {}

        @Override
        public void value(String name, Object value) {}

        @Override
        public <T> T exit(T result) {
          return result;
        }
      };

  void enter(String step, Object... args);

  void value(String name, Object value);

  /** Closes the innermost step and passes its result through. */
  <T> T exit(T result);
}
