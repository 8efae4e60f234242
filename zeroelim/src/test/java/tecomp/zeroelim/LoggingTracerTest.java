package tecomp.zeroelim;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("fast")
public class LoggingTracerTest {
  private static final class Collector extends Handler {
    private final List<String> messages = new ArrayList<>();

    @Override
    public void publish(LogRecord record) {
      messages.add(record.getMessage());
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
  }

  private static Logger logger(Collector collector) {
    final Logger logger = Logger.getAnonymousLogger();
    logger.setUseParentHandlers(false);
    logger.addHandler(collector);
    return logger;
  }

  @Test
  public void testOnlyStepsInWindowAreLogged() {
    final Collector collector = new Collector();
    final LoggingTracer tracer = new LoggingTracer(logger(collector), 1, 2);

    tracer.enter("outer", "a");
    tracer.enter("inner", "b", 3);
    tracer.value("x", 42);
    assertEquals("r", tracer.exit("r"));
    tracer.enter("sibling");
    tracer.exit(null);
    tracer.exit("done");

    assertEquals(3, tracer.steps());
    assertEquals(3, collector.messages.size(), collector.messages::toString);
    assertEquals("-> inner(b, 3)", collector.messages.get(0).trim());
    assertTrue(collector.messages.get(1).contains("x = 42"));
    assertTrue(collector.messages.get(2).contains("<- r"));
  }

  @Test
  public void testUnbalancedExit() {
    final LoggingTracer tracer = new LoggingTracer(logger(new Collector()), 0, 10);
    assertThrows(IllegalStateException.class, () -> tracer.exit(1));
  }

  @Test
  public void testNoopPassesThrough() {
    final Object result = new Object();
    ZeTracer.NOOP.enter("step", 1, 2);
    ZeTracer.NOOP.value("v", result);
    assertSame(result, ZeTracer.NOOP.exit(result));
  }
}
