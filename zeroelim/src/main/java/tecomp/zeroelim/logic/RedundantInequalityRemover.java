package tecomp.zeroelim.logic;

import tecomp.expr.BinaryOp;
import tecomp.expr.Call;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.ExprMutator;
import tecomp.expr.Reduce;
import tecomp.expr.Select;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.domain.DomainSupport;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static tecomp.common.utils.ListSupport.concat;
import static tecomp.expr.Expr.mkBool;

/**
 * Replaces comparisons that coincide, after simplification, with a known fact by {@code true}. The
 * condition of a select or an {@code if_then_else} is known inside its true branch, and the axis
 * bounds and the condition of a reduction are known inside its sources. Nothing is learnt for a
 * false branch.
 */
public final class RedundantInequalityRemover extends ExprMutator {
  private final ZeContext ctx;
  private final List<Expr> known;

  public RedundantInequalityRemover(Collection<? extends Expr> known, ZeContext ctx) {
    this.ctx = ctx;
    this.known = new ArrayList<>(known.size());
    for (Expr fact : known) this.known.add(ctx.simplify(fact));
  }

  public static Expr removeRedundantInequalities(
      Expr e, Collection<? extends Expr> known, ZeContext ctx) {
    return new RedundantInequalityRemover(known, ctx).mutate(e);
  }

  private RedundantInequalityRemover knowingAlso(List<Expr> facts) {
    return new RedundantInequalityRemover(concat(known, facts), ctx);
  }

  @Override
  protected Expr mutateSelect(Select e) {
    final Expr cond = ctx.simplify(mutate(e.cond()));
    if (cond.isTrue()) return mutate(e.trueValue());
    if (cond.isFalse()) return mutate(e.falseValue());

    final Expr t = knowingAlso(FormulaSupport.atomicFormulasOf(cond)).mutate(e.trueValue());
    final Expr f = mutate(e.falseValue());
    return Expr.mkSelect(cond, t, f);
  }

  @Override
  protected Expr mutateCall(Call e) {
    if (!e.isIfThenElse()) return super.mutateCall(e);

    final Expr cond = ctx.simplify(mutate(e.args().get(0)));
    if (cond.isTrue()) return mutate(e.args().get(1));
    if (cond.isFalse()) return mutate(e.args().get(2));

    final Expr t = knowingAlso(FormulaSupport.atomicFormulasOf(cond)).mutate(e.args().get(1));
    final Expr f = mutate(e.args().get(2));
    return Expr.mkIfThenElse(cond, t, f);
  }

  @Override
  protected Expr mutateReduce(Reduce e) {
    final RedundantInequalityRemover inAxis =
        knowingAlso(DomainSupport.iterVarsToInequalities(e.axis()));
    final Expr cond = inAxis.mutate(e.condition());
    final List<Expr> source =
        inAxis.knowingAlso(FormulaSupport.atomicFormulasOf(cond)).mutateAll(e.source());
    return Reduce.mk(e.combiner(), source, e.axis(), cond, e.valueIndex());
  }

  @Override
  protected Expr mutateBinary(BinaryOp e) {
    if (e.kind() == ExprKind.AND) return FormulaSupport.and(mutate(e.a()), mutate(e.b()));
    if (!e.kind().isComparison()) return super.mutateBinary(e);

    final Expr simplified = ctx.simplify(e);
    for (Expr fact : known) if (fact.equals(simplified)) return mkBool(true);
    return simplified;
  }
}
