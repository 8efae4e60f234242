package tecomp.expr;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable node of the tensor expression IR.
 *
 * <p>Equality is structural except for {@link Var}, which compares by identity. Nodes are built
 * through the static {@code mkXXX} factories, which check operand types but do not fold
 * constants; folding is the job of {@link tecomp.expr.arith.Analyzer}.
 */
public abstract class Expr {
  private int hash;

  public abstract ExprKind kind();

  public abstract DataType type();

  /** Direct sub-expressions, in a fixed order. Reductions also list their axis bounds. */
  public abstract List<Expr> children();

  protected abstract int computeHash();

  @Override
  public final int hashCode() {
    int h = hash;
    if (h == 0) {
      h = computeHash();
      if (h == 0) h = 1;
      hash = h;
    }
    return h;
  }

  @Override
  public String toString() {
    return ExprPrinter.print(this);
  }

  public boolean isIntConst() {
    return kind() == ExprKind.INT_IMM;
  }

  /** Returns the value of an integer or boolean constant, or null for anything else. */
  public Long constValue() {
    return this instanceof IntImm imm ? imm.value() : null;
  }

  public boolean isConst(long v) {
    if (this instanceof IntImm imm) return imm.value() == v;
    if (this instanceof FloatImm imm) return imm.value() == v;
    return false;
  }

  public boolean isZero() {
    return isConst(0);
  }

  public boolean isTrue() {
    return type().isBool() && isConst(1);
  }

  public boolean isFalse() {
    return type().isBool() && isConst(0);
  }

  public static IntImm mkInt(long v) {
    return new IntImm(DataType.INT, v);
  }

  public static IntImm mkBool(boolean b) {
    return new IntImm(DataType.BOOL, b ? 1 : 0);
  }

  public static FloatImm mkFloat(double v) {
    return new FloatImm(v);
  }

  public static Expr mkConst(DataType type, long v) {
    return switch (type) {
      case INT -> mkInt(v);
      case BOOL -> mkBool(v != 0);
      case FLOAT -> mkFloat(v);
    };
  }

  public static Expr mkZero(DataType type) {
    return mkConst(type, 0);
  }

  public static Expr mkOne(DataType type) {
    return mkConst(type, 1);
  }

  public static Expr mkBinary(ExprKind kind, Expr a, Expr b) {
    return new BinaryOp(kind, a, b);
  }

  public static Expr mkAdd(Expr a, Expr b) {
    return new BinaryOp(ExprKind.ADD, a, b);
  }

  public static Expr mkSub(Expr a, Expr b) {
    return new BinaryOp(ExprKind.SUB, a, b);
  }

  public static Expr mkMul(Expr a, Expr b) {
    return new BinaryOp(ExprKind.MUL, a, b);
  }

  /** Division truncating toward zero. */
  public static Expr mkDiv(Expr a, Expr b) {
    return new BinaryOp(ExprKind.DIV, a, b);
  }

  /** Remainder of the truncating division; takes the sign of the dividend. */
  public static Expr mkMod(Expr a, Expr b) {
    return new BinaryOp(ExprKind.MOD, a, b);
  }

  public static Expr mkFloorDiv(Expr a, Expr b) {
    return new BinaryOp(ExprKind.FLOOR_DIV, a, b);
  }

  public static Expr mkFloorMod(Expr a, Expr b) {
    return new BinaryOp(ExprKind.FLOOR_MOD, a, b);
  }

  public static Expr mkMin(Expr a, Expr b) {
    return new BinaryOp(ExprKind.MIN, a, b);
  }

  public static Expr mkMax(Expr a, Expr b) {
    return new BinaryOp(ExprKind.MAX, a, b);
  }

  public static Expr mkEq(Expr a, Expr b) {
    return new BinaryOp(ExprKind.EQ, a, b);
  }

  public static Expr mkNe(Expr a, Expr b) {
    return new BinaryOp(ExprKind.NE, a, b);
  }

  public static Expr mkLt(Expr a, Expr b) {
    return new BinaryOp(ExprKind.LT, a, b);
  }

  public static Expr mkLe(Expr a, Expr b) {
    return new BinaryOp(ExprKind.LE, a, b);
  }

  public static Expr mkGt(Expr a, Expr b) {
    return new BinaryOp(ExprKind.GT, a, b);
  }

  public static Expr mkGe(Expr a, Expr b) {
    return new BinaryOp(ExprKind.GE, a, b);
  }

  public static Expr mkAnd(Expr a, Expr b) {
    return new BinaryOp(ExprKind.AND, a, b);
  }

  public static Expr mkOr(Expr a, Expr b) {
    return new BinaryOp(ExprKind.OR, a, b);
  }

  /** Left-associated conjunction. The empty conjunction is {@code true}. */
  public static Expr mkAnd(List<? extends Expr> operands) {
    Expr result = null;
    for (Expr operand : operands) result = result == null ? operand : mkAnd(result, operand);
    return result == null ? mkBool(true) : result;
  }

  /** Left-associated disjunction. The empty disjunction is {@code false}. */
  public static Expr mkOr(List<? extends Expr> operands) {
    Expr result = null;
    for (Expr operand : operands) result = result == null ? operand : mkOr(result, operand);
    return result == null ? mkBool(false) : result;
  }

  public static Expr mkNot(Expr a) {
    return new NotOp(a);
  }

  public static Expr mkSelect(Expr cond, Expr trueValue, Expr falseValue) {
    return new Select(cond, trueValue, falseValue);
  }

  public static Expr mkCast(DataType type, Expr value) {
    return new Cast(type, value);
  }

  /** Calls the {@code if_then_else} intrinsic, the lazily evaluated twin of select. */
  public static Expr mkIfThenElse(Expr cond, Expr trueValue, Expr falseValue) {
    checkArgument(trueValue.type() == falseValue.type(), "branch types differ");
    return Call.mkIntrinsic(
        Call.IF_THEN_ELSE, trueValue.type(), List.of(cond, trueValue, falseValue));
  }
}
