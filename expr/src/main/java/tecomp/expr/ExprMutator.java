package tecomp.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up rebuilding traversal. Subclasses override the hooks for the kinds they rewrite; every
 * hook's default recurses and rebuilds a node only when some child changed.
 */
public class ExprMutator {
  public Expr mutate(Expr e) {
    return switch (e.kind()) {
      case INT_IMM, FLOAT_IMM -> mutateConst(e);
      case VAR -> mutateVar((Var) e);
      case ADD, SUB, MUL, DIV, MOD, FLOOR_DIV, FLOOR_MOD, MIN, MAX, EQ, NE, LT, LE, GT, GE, AND, OR ->
          mutateBinary((BinaryOp) e);
      case NOT -> mutateNot((NotOp) e);
      case SELECT -> mutateSelect((Select) e);
      case CAST -> mutateCast((Cast) e);
      case CALL -> mutateCall((Call) e);
      case REDUCE -> mutateReduce((Reduce) e);
    };
  }

  protected Expr mutateConst(Expr e) {
    return e;
  }

  protected Expr mutateVar(Var v) {
    return v;
  }

  protected Expr mutateBinary(BinaryOp e) {
    final Expr a = mutate(e.a()), b = mutate(e.b());
    if (a == e.a() && b == e.b()) return e;
    return Expr.mkBinary(e.kind(), a, b);
  }

  protected Expr mutateNot(NotOp e) {
    final Expr a = mutate(e.a());
    return a == e.a() ? e : Expr.mkNot(a);
  }

  protected Expr mutateSelect(Select e) {
    final Expr c = mutate(e.cond()), t = mutate(e.trueValue()), f = mutate(e.falseValue());
    if (c == e.cond() && t == e.trueValue() && f == e.falseValue()) return e;
    return Expr.mkSelect(c, t, f);
  }

  protected Expr mutateCast(Cast e) {
    final Expr v = mutate(e.value());
    return v == e.value() ? e : Expr.mkCast(e.type(), v);
  }

  protected Expr mutateCall(Call e) {
    final List<Expr> args = mutateAll(e.args());
    return args == e.args() ? e : e.withArgs(args);
  }

  protected Expr mutateReduce(Reduce e) {
    final List<IterVar> axis = mutateAxis(e.axis());
    final List<Expr> source = mutateAll(e.source());
    final Expr cond = mutate(e.condition());
    if (axis == e.axis() && source == e.source() && cond == e.condition()) return e;
    return Reduce.mk(e.combiner(), source, axis, cond, e.valueIndex());
  }

  protected List<IterVar> mutateAxis(List<IterVar> axis) {
    List<IterVar> result = null;
    for (int i = 0; i < axis.size(); ++i) {
      final IterVar iv = axis.get(i);
      final Expr min = mutate(iv.dom().min()), extent = mutate(iv.dom().extent());
      if (result == null && (min != iv.dom().min() || extent != iv.dom().extent()))
        result = new ArrayList<>(axis.subList(0, i));
      if (result != null)
        result.add(
            min == iv.dom().min() && extent == iv.dom().extent()
                ? iv
                : new IterVar(iv.var(), new Range(min, extent)));
    }
    return result == null ? axis : result;
  }

  /** Mutates each element; returns the input list itself when nothing changed. */
  public List<Expr> mutateAll(List<Expr> exprs) {
    List<Expr> result = null;
    for (int i = 0; i < exprs.size(); ++i) {
      final Expr before = exprs.get(i), after = mutate(before);
      if (result == null && after != before) result = new ArrayList<>(exprs.subList(0, i));
      if (result != null) result.add(after);
    }
    return result == null ? exprs : result;
  }
}
