package tecomp.expr;

import java.util.List;

/** Infix rendering with the minimum of parentheses. */
final class ExprPrinter {
  private final StringBuilder builder = new StringBuilder();

  private ExprPrinter() {}

  static String print(Expr e) {
    final ExprPrinter printer = new ExprPrinter();
    printer.print(e, 0);
    return printer.builder.toString();
  }

  private static int precedence(ExprKind kind) {
    return switch (kind) {
      case OR -> 1;
      case AND -> 2;
      case EQ, NE -> 3;
      case LT, LE, GT, GE -> 4;
      case ADD, SUB -> 5;
      case MUL, DIV, MOD -> 6;
      case NOT -> 7;
      default -> 8;
    };
  }

  private void print(Expr e, int outer) {
    switch (e.kind()) {
      case INT_IMM -> {
        final long v = ((IntImm) e).value();
        if (e.type().isBool()) builder.append(v != 0);
        else if (v < 0 && outer > 0) builder.append('(').append(v).append(')');
        else builder.append(v);
      }
      case FLOAT_IMM -> builder.append(((FloatImm) e).value()).append('f');
      case VAR -> builder.append(((Var) e).name());
      case ADD, SUB, MUL, DIV, MOD, EQ, NE, LT, LE, GT, GE, AND, OR -> {
        final BinaryOp op = (BinaryOp) e;
        final int prec = precedence(e.kind());
        if (prec < outer) builder.append('(');
        print(op.a(), prec);
        builder.append(' ').append(e.kind().text()).append(' ');
        // all binary operators are left-associative
        print(op.b(), prec + 1);
        if (prec < outer) builder.append(')');
      }
      case FLOOR_DIV, FLOOR_MOD, MIN, MAX -> printCall(e.kind().text(), e.children());
      case NOT -> {
        builder.append('!');
        print(((NotOp) e).a(), precedence(ExprKind.NOT));
      }
      case SELECT -> printCall("select", e.children());
      case CAST -> printCall(e.type().text(), e.children());
      case CALL -> printCall(((Call) e).name(), ((Call) e).args());
      case REDUCE -> printReduce((Reduce) e);
    }
  }

  private void printCall(String name, List<Expr> args) {
    builder.append(name).append('(');
    for (int i = 0; i < args.size(); ++i) {
      if (i > 0) builder.append(", ");
      print(args.get(i), 0);
    }
    builder.append(')');
  }

  private void printReduce(Reduce r) {
    builder.append("reduce(combiner=").append(r.combiner().result()).append(", source=[");
    for (int i = 0; i < r.source().size(); ++i) {
      if (i > 0) builder.append(", ");
      print(r.source().get(i), 0);
    }
    builder.append("], axis=").append(r.axis());
    builder.append(", where=");
    print(r.condition(), 0);
    builder.append(", value_index=").append(r.valueIndex()).append(')');
  }
}
