package tecomp.zeroelim.domain;

import tecomp.common.utils.Commons;
import tecomp.expr.Expr;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.zeroelim.logic.FormulaSupport;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The integer points of {@code variables}, each within its range, that satisfy every condition.
 * Conditions may mention outer variables; those are expected to have a range too, or to be bound
 * by the caller.
 */
public record Domain(List<Var> variables, List<Expr> conditions, Map<Var, Range> ranges) {
  public Domain {
    variables = List.copyOf(variables);
    conditions = List.copyOf(conditions);
    ranges = Collections.unmodifiableMap(new TreeMap<>(ranges));
  }

  /** A domain whose conditions are the atomic formulas of {@code condition} and its residual. */
  public static Domain of(List<Var> variables, Expr condition, Map<Var, Range> ranges) {
    return new Domain(variables, FormulaSupport.factorOutAtomicFormulas(condition).toList(), ranges);
  }

  public Expr condition() {
    return Expr.mkAnd(conditions);
  }

  /** The number of points of the bounding box if all extents are constants, else null. */
  public Long boxVolume() {
    long volume = 1;
    for (Var v : variables) {
      final Range range = ranges.get(v);
      if (range == null || range.extent().constValue() == null) return null;
      volume *= Math.max(range.extent().constValue(), 0);
    }
    return volume;
  }

  @Override
  public String toString() {
    final Long volume = boxVolume();
    return "Domain(box_volume="
        + (volume == null ? "inf" : volume.toString())
        + ", variables="
        + variables
        + ", conditions="
        + conditions
        + ", ranges="
        + Commons.joining(ranges, Var::toString)
        + ")";
  }
}
