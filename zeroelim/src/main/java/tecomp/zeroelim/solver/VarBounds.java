package tecomp.zeroelim.solver;

import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.Var;

import java.util.List;
import java.util.Map;

import static tecomp.common.utils.ListSupport.map;

/**
 * Bounds on {@code coef * v} for some variable {@code v}: it equals every element of {@code
 * equal}, is at least every element of {@code lower} and at most every element of {@code upper}.
 * The lists are sorted by the structural order and pairwise disjoint.
 */
public record VarBounds(long coef, List<Expr> equal, List<Expr> lower, List<Expr> upper) {
  public VarBounds {
    equal = List.copyOf(equal);
    lower = List.copyOf(lower);
    upper = List.copyOf(upper);
  }

  public VarBounds substitute(Map<Var, ? extends Expr> vmap) {
    return new VarBounds(
        coef,
        map(equal, e -> ExprSupport.substitute(e, vmap)),
        map(lower, e -> ExprSupport.substitute(e, vmap)),
        map(upper, e -> ExprSupport.substitute(e, vmap)));
  }
}
