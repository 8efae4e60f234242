package tecomp.expr;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

public final class NotOp extends Expr {
  private final Expr a;

  NotOp(Expr a) {
    checkArgument(a.type().isBool(), "negating a non-boolean: %s", a);
    this.a = a;
  }

  public Expr a() {
    return a;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.NOT;
  }

  @Override
  public DataType type() {
    return DataType.BOOL;
  }

  @Override
  public List<Expr> children() {
    return List.of(a);
  }

  @Override
  protected int computeHash() {
    return 17 + a.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof NotOp that && a.equals(that.a);
  }
}
