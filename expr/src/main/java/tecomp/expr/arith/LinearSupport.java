package tecomp.expr.arith;

import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.Var;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public abstract class LinearSupport {
  private LinearSupport() {}

  /** {@code expr == sum(coefs[i] * vars[i]) + base}, where base does not mention the variables. */
  public record LinearEquation(List<Long> coefs, Expr base) {}

  /**
   * Decomposes an integer expression as a linear combination of {@code vars} plus a remainder free
   * of them. Returns null when some variable occurs non-linearly.
   */
  public static LinearEquation detectLinearEquation(Expr expr, List<Var> vars) {
    if (!expr.type().isInt()) return null;
    final Simplifier simplifier = new Simplifier(Map.of());
    LinearForm form = simplifier.toLinear(expr);

    final List<Long> coefs = new ArrayList<>(vars.size());
    for (Var v : vars) {
      coefs.add(form.coef(v));
      form = form.withoutAtom(v);
    }
    for (Expr atom : form.terms().keySet()) if (ExprSupport.usesAnyVar(atom, vars)) return null;

    return new LinearEquation(coefs, simplifier.fromLinear(form));
  }
}
