package tecomp.zeroelim;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes an indented trace of the steps numbered within {@code [start, end)} to a JUL logger at
 * INFO. Steps are numbered by their {@link #enter} calls. Not thread-safe.
 */
public class LoggingTracer implements ZeTracer {
  private static final Logger LOG = Logger.getLogger(LoggingTracer.class.getName());

  private final Logger logger;
  private final long start, end;
  private long step;
  private int depth;
  private boolean[] verbose = new boolean[16];

  public LoggingTracer(long start, long end) {
    this(LOG, start, end);
  }

  LoggingTracer(Logger logger, long start, long end) {
    this.logger = logger;
    this.start = start;
    this.end = end;
  }

  long steps() {
    return step;
  }

  private boolean on() {
    return depth > 0 && verbose[depth - 1];
  }

  private String indent() {
    return "  ".repeat(Math.max(depth - 1, 0));
  }

  @Override
  public void enter(String step, Object... args) {
    final boolean v = this.step >= start && this.step < end;
    ++this.step;
    if (depth == verbose.length) {
      final boolean[] grown = new boolean[depth * 2];
      System.arraycopy(verbose, 0, grown, 0, depth);
      verbose = grown;
    }
    verbose[depth++] = v;
    if (!v || !logger.isLoggable(Level.INFO)) return;

    final StringBuilder builder = new StringBuilder(indent()).append("-> ").append(step);
    builder.append('(');
    for (int i = 0; i < args.length; ++i) {
      if (i > 0) builder.append(", ");
      builder.append(args[i]);
    }
    logger.info(builder.append(')').toString());
  }

  @Override
  public void value(String name, Object value) {
    if (on()) logger.info(indent() + "   " + name + " = " + value);
  }

  @Override
  public <T> T exit(T result) {
    if (depth == 0) throw new IllegalStateException("exit without a matching enter");
    if (on()) logger.info(indent() + "<- " + result);
    --depth;
    return result;
  }
}
