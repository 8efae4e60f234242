package tecomp.zeroelim.extract;

import tecomp.expr.Call;
import tecomp.expr.Expr;
import tecomp.expr.ExprMutator;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Reduce;
import tecomp.expr.Var;
import tecomp.expr.tensor.ComputeOp;
import tecomp.expr.tensor.Tensor;
import tecomp.expr.tensor.TensorSupport;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces calls to compute tensors by their bodies. Only the tensors listed as inlineable are
 * touched, or all of them if the list is empty; reductions only if allowed. Inlining is repeated
 * on the result, so chains of compute tensors collapse.
 */
public class TensorInliner extends ExprMutator {
  private final Set<Tensor> inlineable;
  private final boolean inlineReductions;

  public TensorInliner(Collection<Tensor> inlineable, boolean inlineReductions) {
    this.inlineable = new HashSet<>(inlineable);
    this.inlineReductions = inlineReductions;
  }

  /**
   * Inlines {@code expr} itself if it is a call to a compute tensor. A reduction obtained this way
   * gets fresh axis variables.
   */
  public static Expr inlineThisCall(Expr expr) {
    if (!(expr instanceof Call call) || !call.isTensorCall()) return expr;
    if (!(call.tensor().op() instanceof ComputeOp op)) return expr;

    final Map<Var, Expr> vmap = new HashMap<>();
    final List<IterVar> axis = op.axis();
    for (int i = 0; i < axis.size(); ++i) vmap.put(axis.get(i).var(), call.args().get(i));
    final Expr body = op.body().get(call.tensor().valueIndex());
    return TensorSupport.cloneReduction(ExprSupport.substitute(body, vmap));
  }

  /** Inlines the call the body of {@code tensor} consists of, if it does. */
  public static Tensor inlineTailCall(Tensor tensor) {
    return TensorSupport.transformBody(tensor, (body, axis) -> inlineThisCall(body));
  }

  public static Expr inlineTensors(
      Expr expr, Collection<Tensor> inlineable, boolean inlineReductions) {
    return new TensorInliner(inlineable, inlineReductions).mutate(expr);
  }

  public static Tensor inlineTensors(
      Tensor tensor, Collection<Tensor> inlineable, boolean inlineReductions) {
    return TensorSupport.transformBody(
        tensor, (body, axis) -> inlineTensors(body, inlineable, inlineReductions));
  }

  @Override
  protected Expr mutateCall(Call e) {
    if (e.isTensorCall()
        && e.tensor().op() instanceof ComputeOp op
        && (inlineable.isEmpty() || inlineable.contains(e.tensor()))
        && (inlineReductions || !(op.body().get(0) instanceof Reduce))) {
      return mutate(inlineThisCall(e));
    }
    return super.mutateCall(e);
  }
}
