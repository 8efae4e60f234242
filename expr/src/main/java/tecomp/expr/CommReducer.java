package tecomp.expr;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkZero;

/**
 * A commutative reducer: {@code result[i]} combines the accumulators {@code lhs} with the
 * incoming values {@code rhs}, starting from {@code identity}. Reducers compare by identity.
 */
public final class CommReducer implements Comparable<CommReducer> {
  private static final AtomicLong SERIAL = new AtomicLong();

  private final List<Var> lhs;
  private final List<Var> rhs;
  private final List<Expr> result;
  private final List<Expr> identity;
  private final long serial;

  public CommReducer(List<Var> lhs, List<Var> rhs, List<Expr> result, List<Expr> identity) {
    checkArgument(
        lhs.size() == rhs.size() && lhs.size() == result.size() && lhs.size() == identity.size(),
        "reducer arity mismatch");
    this.lhs = List.copyOf(lhs);
    this.rhs = List.copyOf(rhs);
    this.result = List.copyOf(result);
    this.identity = List.copyOf(identity);
    this.serial = SERIAL.incrementAndGet();
  }

  /** The usual single-valued sum reducer over the given type. */
  public static CommReducer mkSum(DataType type) {
    final Var x = Var.mk("x", type), y = Var.mk("y", type);
    return new CommReducer(List.of(x), List.of(y), List.of(mkAdd(x, y)), List.of(mkZero(type)));
  }

  public List<Var> lhs() {
    return lhs;
  }

  public List<Var> rhs() {
    return rhs;
  }

  public List<Expr> result() {
    return result;
  }

  public List<Expr> identity() {
    return identity;
  }

  public int arity() {
    return result.size();
  }

  /** Same bound variables, new bodies. */
  public CommReducer withBodies(List<Expr> newResult, List<Expr> newIdentity) {
    return new CommReducer(lhs, rhs, newResult, newIdentity);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(serial);
  }

  @Override
  public int compareTo(CommReducer o) {
    return Long.compare(serial, o.serial);
  }

  @Override
  public String toString() {
    return "comm_reducer(result=" + result + ", lhs=" + lhs + ", rhs=" + rhs
        + ", identity=" + identity + ")";
  }
}
