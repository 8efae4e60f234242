package tecomp.expr;

import tecomp.expr.tensor.Tensor;

import java.util.Comparator;
import java.util.List;

/**
 * A total order on expressions, consistent with {@link Expr#equals}. Used wherever a
 * deterministic order is needed: sorted conjunctions, atom order of linear forms, map keys.
 */
public final class ExprComparator implements Comparator<Expr> {
  public static final ExprComparator INSTANCE = new ExprComparator();

  private ExprComparator() {}

  @Override
  public int compare(Expr x, Expr y) {
    if (x == y) return 0;
    int res = x.kind().compareTo(y.kind());
    if (res != 0) return res;
    res = x.type().compareTo(y.type());
    if (res != 0) return res;

    return switch (x.kind()) {
      case INT_IMM -> Long.compare(((IntImm) x).value(), ((IntImm) y).value());
      case FLOAT_IMM -> Double.compare(((FloatImm) x).value(), ((FloatImm) y).value());
      case VAR -> ((Var) x).compareTo((Var) y);
      case ADD, SUB, MUL, DIV, MOD, FLOOR_DIV, FLOOR_MOD, MIN, MAX, EQ, NE, LT, LE, GT, GE, AND, OR -> {
        final BinaryOp bx = (BinaryOp) x, by = (BinaryOp) y;
        final int r = compare(bx.a(), by.a());
        yield r != 0 ? r : compare(bx.b(), by.b());
      }
      case NOT -> compare(((NotOp) x).a(), ((NotOp) y).a());
      case SELECT, CAST -> compareLists(x.children(), y.children());
      case CALL -> compareCalls((Call) x, (Call) y);
      case REDUCE -> compareReductions((Reduce) x, (Reduce) y);
    };
  }

  public int compareLists(List<? extends Expr> xs, List<? extends Expr> ys) {
    final int n = Math.min(xs.size(), ys.size());
    for (int i = 0; i < n; ++i) {
      final int res = compare(xs.get(i), ys.get(i));
      if (res != 0) return res;
    }
    return Integer.compare(xs.size(), ys.size());
  }

  private int compareCalls(Call x, Call y) {
    int res = x.callType().compareTo(y.callType());
    if (res != 0) return res;
    res = x.name().compareTo(y.name());
    if (res != 0) return res;
    if (x.isTensorCall()) {
      final Tensor tx = x.tensor(), ty = y.tensor();
      res = tx.op().compareTo(ty.op());
      if (res != 0) return res;
      res = Integer.compare(tx.valueIndex(), ty.valueIndex());
      if (res != 0) return res;
    }
    return compareLists(x.args(), y.args());
  }

  private int compareReductions(Reduce x, Reduce y) {
    int res = x.combiner().compareTo(y.combiner());
    if (res != 0) return res;
    res = Integer.compare(x.valueIndex(), y.valueIndex());
    if (res != 0) return res;
    res = compareLists(x.axisVars(), y.axisVars());
    if (res != 0) return res;
    return compareLists(x.children(), y.children());
  }
}
