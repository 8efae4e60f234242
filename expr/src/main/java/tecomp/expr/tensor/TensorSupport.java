package tecomp.expr.tensor;

import org.apache.commons.lang3.tuple.Pair;
import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Range;
import tecomp.expr.Reduce;
import tecomp.expr.Var;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

import static tecomp.expr.Expr.mkInt;

public abstract class TensorSupport {
  private TensorSupport() {}

  public static Tensor placeholder(String name, DataType dtype, long... shape) {
    final List<Expr> dims = new ArrayList<>(shape.length);
    for (long d : shape) dims.add(mkInt(d));
    return new PlaceholderOp(name, dims, dtype).output(0);
  }

  /** A compute tensor over {@code [0, shape[i])}, with axis variables named {@code ax0, ax1...}. */
  public static Tensor compute(String name, long[] shape, Function<List<Var>, Expr> fcompute) {
    final List<String> names = new ArrayList<>(shape.length);
    for (int i = 0; i < shape.length; ++i) names.add("ax" + i);
    return compute(name, names, shape, fcompute);
  }

  public static Tensor compute(
      String name, List<String> axisNames, long[] shape, Function<List<Var>, Expr> fcompute) {
    final List<IterVar> axis = new ArrayList<>(shape.length);
    final List<Var> vars = new ArrayList<>(shape.length);
    for (int i = 0; i < shape.length; ++i) {
      final IterVar iv = IterVar.mk(axisNames.get(i), 0, shape[i]);
      axis.add(iv);
      vars.add(iv.var());
    }
    return new ComputeOp(name, axis, List.of(fcompute.apply(vars))).output(0);
  }

  /** Fresh copies of the axis variables, and the substitution from old to new. */
  public static Pair<List<IterVar>, Map<Var, Expr>> cloneIterVars(List<IterVar> axis) {
    final List<IterVar> cloned = new ArrayList<>(axis.size());
    final Map<Var, Expr> vmap = new HashMap<>();
    for (IterVar iv : axis) {
      final Var fresh = iv.var().copyWithSuffix("");
      vmap.put(iv.var(), fresh);
      cloned.add(new IterVar(fresh, ExprSupport.substitute(iv.dom(), vmap)));
    }
    return Pair.of(cloned, vmap);
  }

  /** Renames the axis of a reduction to fresh variables. Other expressions are returned as is. */
  public static Expr cloneReduction(Expr expr) {
    if (!(expr instanceof Reduce r)) return expr;
    final Pair<List<IterVar>, Map<Var, Expr>> clone = cloneIterVars(r.axis());
    return Reduce.mk(
        r.combiner(),
        ExprSupport.substitute(r.source(), clone.getRight()),
        clone.getLeft(),
        ExprSupport.substitute(r.condition(), clone.getRight()),
        r.valueIndex());
  }

  /**
   * Wraps {@code expr} into a compute tensor over {@code axis}. A multi-valued reduction yields one
   * output per value, and the tensor returned is the one for the reduction's value index.
   */
  public static Tensor tensorFromExpr(Expr expr, List<IterVar> axis, String name, boolean cloneAxis) {
    List<IterVar> newAxis = axis;
    if (cloneAxis) {
      final Pair<List<IterVar>, Map<Var, Expr>> clone = cloneIterVars(axis);
      newAxis = clone.getLeft();
      expr = ExprSupport.substitute(expr, clone.getRight());
    }

    if (expr instanceof Reduce r && r.combiner().arity() > 1) {
      final List<Expr> bodies = new ArrayList<>(r.combiner().arity());
      for (int i = 0; i < r.combiner().arity(); ++i)
        bodies.add(Reduce.mk(r.combiner(), r.source(), r.axis(), r.condition(), i));
      return new ComputeOp(name, newAxis, bodies).output(r.valueIndex());
    }
    return new ComputeOp(name, newAxis, List.of(expr)).output(0);
  }

  public static Tensor tensorFromExpr(Expr expr, List<IterVar> axis) {
    return tensorFromExpr(expr, axis, "extracted_tensor", true);
  }

  /**
   * Applies {@code func} to the body of a compute tensor. Returns the same tensor if the body did
   * not change, and placeholders unchanged.
   */
  public static Tensor transformBody(Tensor tensor, BiFunction<Expr, List<IterVar>, Expr> func) {
    if (!(tensor.op() instanceof ComputeOp op)) return tensor;
    final Expr body = op.body().get(tensor.valueIndex());
    final Expr newBody = func.apply(body, op.axis());
    if (newBody.equals(body)) return tensor;
    return new ComputeOp(op.name(), op.axis(), List.of(newBody)).output(0);
  }

  /** The ranges of an axis as a map, in axis order. */
  public static Map<Var, Range> axisRanges(List<IterVar> axis) {
    final Map<Var, Range> ranges = new LinkedHashMap<>();
    for (IterVar iv : axis) ranges.put(iv.var(), iv.dom());
    return ranges;
  }
}
