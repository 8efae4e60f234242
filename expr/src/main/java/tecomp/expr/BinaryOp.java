package tecomp.expr;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/** Arithmetic, comparison and binary logical nodes. */
public final class BinaryOp extends Expr {
  private final ExprKind kind;
  private final Expr a, b;

  BinaryOp(ExprKind kind, Expr a, Expr b) {
    checkArgument(kind.isBinary(), "not a binary kind: %s", kind);
    checkArgument(
        a.type() == b.type(), "operand types differ in %s: %s vs %s", kind, a.type(), b.type());
    checkArgument(
        !kind.isLogical() || a.type().isBool(), "logical operator %s over %s", kind, a.type());
    checkArgument(
        !kind.isDivLike() || !a.type().isBool(), "division %s over booleans", kind);
    this.kind = kind;
    this.a = a;
    this.b = b;
  }

  public Expr a() {
    return a;
  }

  public Expr b() {
    return b;
  }

  @Override
  public ExprKind kind() {
    return kind;
  }

  @Override
  public DataType type() {
    return kind.isComparison() || kind.isLogical() ? DataType.BOOL : a.type();
  }

  @Override
  public List<Expr> children() {
    return List.of(a, b);
  }

  @Override
  protected int computeHash() {
    return (kind.hashCode() * 31 + a.hashCode()) * 31 + b.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BinaryOp that)) return false;
    return kind == that.kind && hashCode() == that.hashCode() && a.equals(that.a) && b.equals(that.b);
  }
}
