package tecomp.zeroelim;

import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.expr.eval.ExprInterpreter;
import tecomp.zeroelim.domain.Domain;
import tecomp.zeroelim.domain.DomainTransformation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Checks by enumeration over small constant ranges. */
public final class BruteForce {
  public static final ExprInterpreter INTERPRETER = new ExprInterpreter();

  private BruteForce() {}

  /**
   * Calls {@code fn} on every assignment of {@code vars} within their ranges, on top of {@code
   * base}. A range may depend on the variables before it.
   */
  public static void forEachPoint(
      List<Var> vars, Map<Var, Range> ranges, Map<Var, Long> base, Consumer<Map<Var, Long>> fn) {
    final Map<Var, Long> env = new HashMap<>(base);
    iterate(vars, 0, ranges, env, fn);
  }

  public static void forEachPoint(
      List<Var> vars, Map<Var, Range> ranges, Consumer<Map<Var, Long>> fn) {
    forEachPoint(vars, ranges, Map.of(), fn);
  }

  private static void iterate(
      List<Var> vars,
      int idx,
      Map<Var, Range> ranges,
      Map<Var, Long> env,
      Consumer<Map<Var, Long>> fn) {
    if (idx == vars.size()) {
      fn.accept(new HashMap<>(env));
      return;
    }
    final Var v = vars.get(idx);
    final Range range = ranges.get(v);
    assertNotNull(range, "no range for " + v);
    final long min = INTERPRETER.evalInt(range.min(), env);
    final long extent = INTERPRETER.evalInt(range.extent(), env);
    for (long x = min; x < min + extent; ++x) {
      env.put(v, x);
      iterate(vars, idx + 1, ranges, env, fn);
    }
    env.remove(v);
  }

  /** The points of a domain whose ranges and conditions only mention its own variables. */
  public static List<Map<Var, Long>> points(Domain domain) {
    final List<Map<Var, Long>> result = new ArrayList<>();
    forEachPoint(
        domain.variables(),
        domain.ranges(),
        p -> {
          if (INTERPRETER.evalBool(domain.condition(), p)) result.add(p);
        });
    return result;
  }

  /**
   * Asserts that the transformation is a bijection between the points of its domains, with
   * {@code newToOld} mapping forth and {@code oldToNew} back.
   */
  public static void assertBijection(DomainTransformation transf) {
    final List<Map<Var, Long>> oldPoints = points(transf.oldDomain());
    final List<Map<Var, Long>> newPoints = points(transf.newDomain());
    assertEquals(oldPoints.size(), newPoints.size(), () -> "point counts differ: " + transf);

    final Domain newDomain = transf.newDomain();
    for (Map<Var, Long> p : oldPoints) {
      final Map<Var, Long> q = new HashMap<>();
      for (Var v : newDomain.variables())
        q.put(v, INTERPRETER.evalInt(transf.newToOld().get(v), p));

      for (Var v : newDomain.variables()) {
        final Range range = newDomain.ranges().get(v);
        final long min = INTERPRETER.evalInt(range.min(), q);
        final long x = q.get(v);
        assertTrue(
            min <= x && x < min + INTERPRETER.evalInt(range.extent(), q),
            () -> "image " + q + " of " + p + " is out of range in " + transf);
      }
      assertTrue(
          INTERPRETER.evalBool(newDomain.condition(), q),
          () -> "image " + q + " of " + p + " violates the conditions of " + transf);
      for (Var v : transf.oldDomain().variables())
        assertEquals(
            (long) p.get(v),
            INTERPRETER.evalInt(transf.oldToNew().get(v), q),
            () -> "cannot map " + q + " back to " + p + " in " + transf);
    }
  }
}
