package tecomp.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Reduction of {@code source} over the box spanned by {@code axis}, restricted to the points where
 * {@code condition} holds. The node evaluates to component {@code valueIndex} of the result.
 */
public final class Reduce extends Expr {
  private final CommReducer combiner;
  private final List<Expr> source;
  private final List<IterVar> axis;
  private final Expr condition;
  private final int valueIndex;

  private Reduce(
      CommReducer combiner, List<Expr> source, List<IterVar> axis, Expr condition, int valueIndex) {
    checkArgument(source.size() == combiner.arity(), "source count differs from combiner arity");
    checkArgument(valueIndex >= 0 && valueIndex < source.size(), "bad value index %s", valueIndex);
    checkArgument(condition.type().isBool(), "reduction condition must be boolean");
    this.combiner = combiner;
    this.source = List.copyOf(source);
    this.axis = List.copyOf(axis);
    this.condition = condition;
    this.valueIndex = valueIndex;
  }

  public static Reduce mk(
      CommReducer combiner, List<Expr> source, List<IterVar> axis, Expr condition, int valueIndex) {
    return new Reduce(combiner, source, axis, condition, valueIndex);
  }

  /** Sum of a single source over the axis. */
  public static Reduce mkSum(Expr source, List<IterVar> axis, Expr condition) {
    return new Reduce(CommReducer.mkSum(source.type()), List.of(source), axis, condition, 0);
  }

  public static Reduce mkSum(Expr source, List<IterVar> axis) {
    return mkSum(source, axis, mkBool(true));
  }

  public Reduce withSource(List<Expr> newSource) {
    return new Reduce(combiner, newSource, axis, condition, valueIndex);
  }

  public Reduce withCondition(Expr newCondition) {
    return new Reduce(combiner, source, axis, newCondition, valueIndex);
  }

  public CommReducer combiner() {
    return combiner;
  }

  public List<Expr> source() {
    return source;
  }

  public List<IterVar> axis() {
    return axis;
  }

  public List<Var> axisVars() {
    final List<Var> vars = new ArrayList<>(axis.size());
    for (IterVar iv : axis) vars.add(iv.var());
    return vars;
  }

  public Expr condition() {
    return condition;
  }

  public int valueIndex() {
    return valueIndex;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.REDUCE;
  }

  @Override
  public DataType type() {
    return source.get(valueIndex).type();
  }

  @Override
  public List<Expr> children() {
    final List<Expr> children = new ArrayList<>(source.size() + 1 + 2 * axis.size());
    children.addAll(source);
    children.add(condition);
    for (IterVar iv : axis) {
      children.add(iv.dom().min());
      children.add(iv.dom().extent());
    }
    return children;
  }

  @Override
  protected int computeHash() {
    return Objects.hash(combiner, source, axis, condition, valueIndex);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Reduce that)) return false;
    return valueIndex == that.valueIndex
        && combiner == that.combiner
        && axis.equals(that.axis)
        && condition.equals(that.condition)
        && source.equals(that.source);
  }
}
