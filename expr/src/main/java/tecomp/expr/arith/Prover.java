package tecomp.expr.arith;

import tecomp.expr.Expr;
import tecomp.expr.Range;
import tecomp.expr.Var;

import java.util.Map;

/** A decision procedure consulted when rewriting alone cannot settle a condition. */
public interface Prover {
  /** True only if {@code cond} holds for every assignment within {@code ranges}. */
  boolean prove(Expr cond, Map<Var, Range> ranges);
}
