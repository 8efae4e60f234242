package tecomp.expr;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/** Eager conditional: both branches are considered evaluated. */
public final class Select extends Expr {
  private final Expr cond, trueValue, falseValue;

  Select(Expr cond, Expr trueValue, Expr falseValue) {
    checkArgument(cond.type().isBool(), "select condition must be boolean: %s", cond);
    checkArgument(trueValue.type() == falseValue.type(), "select branch types differ");
    this.cond = cond;
    this.trueValue = trueValue;
    this.falseValue = falseValue;
  }

  public Expr cond() {
    return cond;
  }

  public Expr trueValue() {
    return trueValue;
  }

  public Expr falseValue() {
    return falseValue;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.SELECT;
  }

  @Override
  public DataType type() {
    return trueValue.type();
  }

  @Override
  public List<Expr> children() {
    return List.of(cond, trueValue, falseValue);
  }

  @Override
  protected int computeHash() {
    return ((cond.hashCode() * 31) + trueValue.hashCode()) * 31 + falseValue.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Select that)) return false;
    return cond.equals(that.cond)
        && trueValue.equals(that.trueValue)
        && falseValue.equals(that.falseValue);
  }
}
