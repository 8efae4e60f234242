package tecomp.zeroelim.solver;

import tecomp.expr.Expr;
import tecomp.expr.Range;
import tecomp.expr.Var;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The outcome of replacing divisions and remainders by constants with fresh variables.
 *
 * @param expr the rewritten expression
 * @param substitution each fresh variable expressed over the original variables
 * @param newVariables the fresh variables, quotient before remainder, in creation order
 * @param conditions the definitions of the fresh variables
 * @param ranges the input ranges extended with those of the fresh variables
 */
public record DivModResult(
    Expr expr,
    Map<Var, Expr> substitution,
    List<Var> newVariables,
    List<Expr> conditions,
    Map<Var, Range> ranges) {
  public DivModResult {
    substitution = Collections.unmodifiableMap(new TreeMap<>(substitution));
    newVariables = List.copyOf(newVariables);
    conditions = List.copyOf(conditions);
    ranges = Collections.unmodifiableMap(new TreeMap<>(ranges));
  }
}
