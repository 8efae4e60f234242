package tecomp.expr;

import java.util.List;

public final class Cast extends Expr {
  private final DataType type;
  private final Expr value;

  Cast(DataType type, Expr value) {
    this.type = type;
    this.value = value;
  }

  public Expr value() {
    return value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.CAST;
  }

  @Override
  public DataType type() {
    return type;
  }

  @Override
  public List<Expr> children() {
    return List.of(value);
  }

  @Override
  protected int computeHash() {
    return type.hashCode() * 31 + value.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Cast that)) return false;
    return type == that.type && value.equals(that.value);
  }
}
