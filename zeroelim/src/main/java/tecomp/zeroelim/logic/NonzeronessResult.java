package tecomp.zeroelim.logic;

import tecomp.expr.Expr;

/** An expression known to equal {@code select(cond, value, 0)}. */
public record NonzeronessResult(Expr cond, Expr value) {
  public Expr toExpr() {
    return FormulaSupport.selectElseZero(cond, value);
  }

  @Override
  public String toString() {
    return toExpr().toString();
  }
}
