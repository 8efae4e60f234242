package tecomp.zeroelim.logic;

import tecomp.expr.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * A boolean formula split as {@code AND(atomicFormulas) && rest}. The atomic formulas are sorted
 * by the structural order and contain no duplicates.
 */
public record FactoredFormula(List<Expr> atomicFormulas, Expr rest) {
  public FactoredFormula {
    atomicFormulas = List.copyOf(atomicFormulas);
  }

  public Expr toExpr() {
    Expr result = rest;
    for (Expr atomic : atomicFormulas) result = FormulaSupport.and(atomic, result);
    return result;
  }

  /** The atomic formulas followed by the residual. */
  public List<Expr> toList() {
    final List<Expr> result = new ArrayList<>(atomicFormulas.size() + 1);
    result.addAll(atomicFormulas);
    result.add(rest);
    return result;
  }
}
