package tecomp.zeroelim.solver;

import tecomp.expr.Expr;
import tecomp.expr.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;
import static tecomp.expr.Expr.mkConst;
import static tecomp.expr.Expr.mkEq;
import static tecomp.expr.Expr.mkGe;
import static tecomp.expr.Expr.mkLe;
import static tecomp.expr.Expr.mkMul;

/** A system of inequalities solved for its variables in order, plus what could not be solved. */
public record InequalitySystem(
    List<Var> variables, Map<Var, VarBounds> bounds, List<Expr> otherConditions) {
  public InequalitySystem {
    variables = List.copyOf(variables);
    bounds = Collections.unmodifiableMap(new LinkedHashMap<>(bounds));
    otherConditions = List.copyOf(otherConditions);
  }

  /** The bounds of each variable as comparisons, followed by the other conditions. */
  public List<Expr> asConditions() {
    final List<Expr> result = new ArrayList<>();
    for (Var v : variables) {
      final VarBounds bnd = bounds.get(v);
      checkState(bnd != null, "no bounds for %s", v);
      final Expr lhs = bnd.coef() == 1 ? v : mkMul(mkConst(v.type(), bnd.coef()), v);
      for (Expr rhs : bnd.equal()) result.add(mkEq(lhs, rhs));
      for (Expr rhs : bnd.lower()) result.add(mkGe(lhs, rhs));
      for (Expr rhs : bnd.upper()) result.add(mkLe(lhs, rhs));
    }
    result.addAll(otherConditions);
    return result;
  }
}
