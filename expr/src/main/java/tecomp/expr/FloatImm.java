package tecomp.expr;

import java.util.List;

public final class FloatImm extends Expr {
  private final double value;

  FloatImm(double value) {
    this.value = value;
  }

  public double value() {
    return value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.FLOAT_IMM;
  }

  @Override
  public DataType type() {
    return DataType.FLOAT;
  }

  @Override
  public List<Expr> children() {
    return List.of();
  }

  @Override
  protected int computeHash() {
    return Double.hashCode(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FloatImm that)) return false;
    return Double.compare(value, that.value) == 0;
  }
}
