package tecomp.zeroelim.extract;

import tecomp.expr.Call;
import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.expr.tensor.Tensor;
import tecomp.expr.tensor.TensorSupport;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.ZeTracer;
import tecomp.zeroelim.domain.Domain;
import tecomp.zeroelim.domain.DomainSimplifier;
import tecomp.zeroelim.domain.DomainSupport;
import tecomp.zeroelim.domain.DomainTransformation;
import tecomp.zeroelim.logic.RedundantInequalityRemover;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static tecomp.expr.Expr.mkInt;
import static tecomp.expr.Expr.mkLe;
import static tecomp.expr.Expr.mkMul;

public abstract class TensorExtractor {
  public static final String EXTRACTED_TENSOR = "extracted_tensor";

  private TensorExtractor() {}

  /**
   * Moves {@code expr}, which only matters where {@code cond} holds, into a tensor over the
   * simplified domain of {@code cond} and returns a call to it. The expression is kept as is when
   * the new tensor would not be provably smaller than the box of {@code outerAxis}, or when it
   * already is a tensor call. If it turns out not to depend on the new variables at all, its
   * simplified form is returned inline.
   */
  public static Expr extractAsTensorMaybe(
      Expr expr, Expr cond, List<Var> outerAxis, Map<Var, Range> vranges, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("extractAsTensorMaybe", expr, cond, outerAxis);

    final Domain domain = Domain.of(outerAxis, cond, vranges);
    final DomainTransformation res = DomainSimplifier.simplifyDomain(domain, ctx);
    final Domain newDomain = res.newDomain();

    Expr newExpr =
        ctx.simplify(ExprSupport.substitute(expr, res.oldToNew()), newDomain.ranges());
    // the simplifier knows nothing of if_then_else
    newExpr =
        RedundantInequalityRemover.removeRedundantInequalities(
            newExpr, newDomain.conditions(), ctx);

    final List<Var> used = new ArrayList<>();
    for (Var v : newDomain.variables()) if (ExprSupport.usesVar(newExpr, v)) used.add(v);

    // free of the new variables, so it may stand for the original
    if (used.isEmpty()) return tracer.exit(newExpr);

    if (newExpr instanceof Call call && call.isTensorCall()) return tracer.exit(expr);

    Expr oldVolume = mkInt(1);
    for (Var v : outerAxis) oldVolume = mkMul(oldVolume, vranges.get(v).extent());
    Expr newVolume = mkInt(1);
    for (Var v : used) newVolume = mkMul(newVolume, newDomain.ranges().get(v).extent());
    if (ctx.canProve(mkLe(oldVolume, newVolume), vranges)) return tracer.exit(expr);

    final Tensor tensor =
        TensorSupport.tensorFromExpr(
            newExpr,
            DomainSupport.iterVarsFromMap(used, newDomain.ranges()),
            EXTRACTED_TENSOR,
            true);
    final List<Expr> args = new ArrayList<>(used.size());
    for (Var v : used) args.add(res.newToOld().get(v));
    return tracer.exit(tensor.call(args));
  }
}
