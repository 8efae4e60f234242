package tecomp.expr;

public enum ExprKind {
  INT_IMM(""),
  FLOAT_IMM(""),
  VAR(""),
  ADD("+"),
  SUB("-"),
  MUL("*"),
  DIV("/"),
  MOD("%"),
  FLOOR_DIV("floordiv"),
  FLOOR_MOD("floormod"),
  MIN("min"),
  MAX("max"),
  EQ("=="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  AND("&&"),
  OR("||"),
  NOT("!"),
  SELECT("select"),
  CAST("cast"),
  CALL("call"),
  REDUCE("reduce");

  private final String text;

  ExprKind(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }

  public boolean isConst() {
    return this == INT_IMM || this == FLOAT_IMM;
  }

  public boolean isBinary() {
    return ordinal() >= ADD.ordinal() && ordinal() <= OR.ordinal();
  }

  public boolean isArithmetic() {
    return ordinal() >= ADD.ordinal() && ordinal() <= MAX.ordinal();
  }

  public boolean isDivLike() {
    return this == DIV || this == MOD || this == FLOOR_DIV || this == FLOOR_MOD;
  }

  public boolean isComparison() {
    return ordinal() >= EQ.ordinal() && ordinal() <= GE.ordinal();
  }

  public boolean isLogical() {
    return this == AND || this == OR || this == NOT;
  }

  /** The comparison that holds exactly when this one does not. */
  public ExprKind negated() {
    return switch (this) {
      case EQ -> NE;
      case NE -> EQ;
      case LT -> GE;
      case LE -> GT;
      case GT -> LE;
      case GE -> LT;
      default -> throw new IllegalStateException("not a comparison: " + this);
    };
  }

  /** The comparison obtained by swapping the operands. */
  public ExprKind flipped() {
    return switch (this) {
      case EQ, NE -> this;
      case LT -> GT;
      case LE -> GE;
      case GT -> LT;
      case GE -> LE;
      default -> throw new IllegalStateException("not a comparison: " + this);
    };
  }
}
