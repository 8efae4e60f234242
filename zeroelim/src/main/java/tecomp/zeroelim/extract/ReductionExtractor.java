package tecomp.zeroelim.extract;

import org.apache.commons.lang3.tuple.Pair;
import tecomp.expr.Expr;
import tecomp.expr.ExprMutator;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Range;
import tecomp.expr.Reduce;
import tecomp.expr.Var;
import tecomp.expr.tensor.Tensor;
import tecomp.expr.tensor.TensorSupport;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.ZeTracer;
import tecomp.zeroelim.domain.DomainSupport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static tecomp.common.utils.Commons.merge;
import static tecomp.common.utils.ListSupport.concat;

/**
 * Moves every reduction into a tensor of its own, indexed by the outer variables it uses, and
 * replaces it by a call to that tensor. Nested reductions are extracted first.
 */
public class ReductionExtractor extends ExprMutator {
  public static final String EXTRACTED_REDUCTION = "extracted_reduction";

  private final List<Var> outerAxis;
  private final Map<Var, Range> vranges;
  private final String name;
  private final ZeContext ctx;

  public ReductionExtractor(
      List<Var> outerAxis, Map<Var, Range> vranges, String name, ZeContext ctx) {
    this.outerAxis = outerAxis;
    this.vranges = vranges;
    this.name = name;
    this.ctx = ctx;
  }

  public static Expr extractReductions(
      Expr expr, List<Var> outerAxis, Map<Var, Range> vranges, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("extractReductions", expr, outerAxis);
    return tracer.exit(
        new ReductionExtractor(outerAxis, vranges, EXTRACTED_REDUCTION, ctx).mutate(expr));
  }

  /** Like {@link #extractReductions}, but a reduction at the top is kept in place. */
  public static Expr extractNonTopReductions(
      Expr expr, List<Var> outerAxis, Map<Var, Range> vranges, ZeContext ctx) {
    if (!(expr instanceof Reduce red)) return extractReductions(expr, outerAxis, vranges, ctx);

    final ZeTracer tracer = ctx.tracer();
    tracer.enter("extractNonTopReductions", expr, outerAxis);
    final List<Var> newOuter = concat(red.axisVars(), outerAxis);
    final Map<Var, Range> newRanges = merge(vranges, TensorSupport.axisRanges(red.axis()));
    final List<Expr> source = new ArrayList<>(red.source().size());
    for (Expr src : red.source()) source.add(extractReductions(src, newOuter, newRanges, ctx));
    final Expr cond = extractReductions(red.condition(), newOuter, newRanges, ctx);
    return tracer.exit(Reduce.mk(red.combiner(), source, red.axis(), cond, red.valueIndex()));
  }

  @Override
  protected Expr mutateReduce(Reduce e) {
    final ReductionExtractor inner =
        new ReductionExtractor(
            concat(e.axisVars(), outerAxis),
            merge(vranges, TensorSupport.axisRanges(e.axis())),
            name,
            ctx);
    final Reduce newReduce = e.withSource(inner.mutateAll(e.source()));

    final Set<Var> free = new HashSet<>(ExprSupport.freeVars(newReduce));
    final List<Var> vars = new ArrayList<>();
    for (Var v : outerAxis) if (free.contains(v)) vars.add(v);

    final Pair<List<IterVar>, Map<Var, Expr>> clone =
        TensorSupport.cloneIterVars(DomainSupport.iterVarsFromMap(vars, vranges));
    final List<IterVar> newAxis = clone.getLeft();
    final Expr body =
        ctx.simplify(
            ExprSupport.substitute(newReduce, clone.getRight()),
            TensorSupport.axisRanges(newAxis));

    final Tensor tensor = TensorSupport.tensorFromExpr(body, newAxis, name, false);
    return tensor.call(vars);
  }
}
