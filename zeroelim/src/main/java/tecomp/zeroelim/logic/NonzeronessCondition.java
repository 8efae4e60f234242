package tecomp.zeroelim.logic;

import tecomp.expr.BinaryOp;
import tecomp.expr.Call;
import tecomp.expr.Cast;
import tecomp.expr.Expr;
import tecomp.expr.Select;
import tecomp.zeroelim.ZeContext;

import static tecomp.expr.Expr.mkBool;
import static tecomp.zeroelim.logic.FormulaSupport.and;
import static tecomp.zeroelim.logic.FormulaSupport.not;
import static tecomp.zeroelim.logic.FormulaSupport.or;

/**
 * Derives structurally, for an expression {@code e}, a condition {@code c} and a value {@code v}
 * with {@code e == select(c, v, 0)}. Branches that are zero under their guard are pruned from
 * {@code v}. Every condition built is simplified before it is passed upwards.
 */
public final class NonzeronessCondition {
  private final ZeContext ctx;

  public NonzeronessCondition(ZeContext ctx) {
    this.ctx = ctx;
  }

  public NonzeronessResult apply(Expr e) {
    // a boolean is nonzero exactly when it holds
    if (e.type().isBool()) return new NonzeronessResult(e, mkBool(true));

    return switch (e.kind()) {
      case INT_IMM, FLOAT_IMM -> new NonzeronessResult(mkBool(!e.isZero()), e);
      case ADD, SUB, MIN, MAX -> addLike((BinaryOp) e);
      case MUL -> mulLike((BinaryOp) e);
      case DIV, MOD, FLOOR_DIV, FLOOR_MOD -> divLike((BinaryOp) e);
      case CAST -> cast((Cast) e);
      case SELECT -> select((Select) e);
      case CALL -> call((Call) e);
      default -> trivial(e);
    };
  }

  private static NonzeronessResult trivial(Expr e) {
    return new NonzeronessResult(mkBool(true), e);
  }

  private Expr simplify(Expr cond) {
    return ctx.simplify(cond);
  }

  /** The result is nonzero if either operand is. */
  private NonzeronessResult addLike(BinaryOp e) {
    final NonzeronessResult a = apply(e.a()), b = apply(e.b());

    if (a.cond().equals(b.cond())) {
      if (a.value() == e.a() && b.value() == e.b()) return new NonzeronessResult(a.cond(), e);
      return new NonzeronessResult(a.cond(), Expr.mkBinary(e.kind(), a.value(), b.value()));
    }

    final Expr cond = simplify(or(a.cond(), b.cond()));
    // an operand needs its own guard only if it is weaker than the combined one
    final Expr newA = a.cond().equals(cond) ? a.value() : a.toExpr();
    final Expr newB = b.cond().equals(cond) ? b.value() : b.toExpr();
    return new NonzeronessResult(cond, Expr.mkBinary(e.kind(), newA, newB));
  }

  /** The result is nonzero only if both operands are. */
  private NonzeronessResult mulLike(BinaryOp e) {
    final NonzeronessResult a = apply(e.a()), b = apply(e.b());
    final Expr cond = simplify(and(a.cond(), b.cond()));
    if (a.value() == e.a() && b.value() == e.b()) return new NonzeronessResult(cond, e);
    return new NonzeronessResult(cond, Expr.mkBinary(e.kind(), a.value(), b.value()));
  }

  /** Only the numerator matters. */
  private NonzeronessResult divLike(BinaryOp e) {
    final NonzeronessResult a = apply(e.a());
    if (a.value() == e.a()) return new NonzeronessResult(a.cond(), e);
    return new NonzeronessResult(a.cond(), Expr.mkBinary(e.kind(), a.value(), e.b()));
  }

  private NonzeronessResult cast(Cast e) {
    final NonzeronessResult a = apply(e.value());
    if (a.value() == e.value()) return new NonzeronessResult(a.cond(), e);
    return new NonzeronessResult(a.cond(), Expr.mkCast(e.type(), a.value()));
  }

  private NonzeronessResult select(Select e) {
    final Expr cond = e.cond();
    final NonzeronessResult a = apply(e.trueValue()), b = apply(e.falseValue());

    if (b.value().isZero())
      return new NonzeronessResult(simplify(and(a.cond(), cond)), a.value());
    if (a.value().isZero())
      return new NonzeronessResult(simplify(and(b.cond(), not(cond))), b.value());

    final Expr newCond = simplify(or(and(cond, a.cond()), and(not(cond), b.cond())));
    if (a.value() == e.trueValue() && b.value() == e.falseValue())
      return new NonzeronessResult(newCond, e);
    return new NonzeronessResult(newCond, Expr.mkSelect(cond, a.value(), b.value()));
  }

  private NonzeronessResult call(Call e) {
    if (!e.isIfThenElse()) return trivial(e);

    // unlike select, the branch must be kept
    final Expr cond = e.args().get(0), t = e.args().get(1), f = e.args().get(2);
    final NonzeronessResult a = apply(t), b = apply(f);
    final Expr newCond = simplify(or(and(cond, a.cond()), and(not(cond), b.cond())));
    if (a.value() == t && b.value() == f) return new NonzeronessResult(newCond, e);
    return new NonzeronessResult(newCond, Expr.mkIfThenElse(cond, a.value(), b.value()));
  }
}
