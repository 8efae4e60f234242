package tecomp.expr;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/** Integer or boolean constant. Booleans are stored as 0 and 1. */
public final class IntImm extends Expr {
  private final DataType type;
  private final long value;

  IntImm(DataType type, long value) {
    checkArgument(!type.isFloat(), "float constant must be a FloatImm");
    checkArgument(!type.isBool() || value == 0 || value == 1, "bad boolean constant %s", value);
    this.type = type;
    this.value = value;
  }

  public long value() {
    return value;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.INT_IMM;
  }

  @Override
  public DataType type() {
    return type;
  }

  @Override
  public List<Expr> children() {
    return List.of();
  }

  @Override
  protected int computeHash() {
    return 31 * type.hashCode() + Long.hashCode(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof IntImm that)) return false;
    return type == that.type && value == that.value;
  }
}
