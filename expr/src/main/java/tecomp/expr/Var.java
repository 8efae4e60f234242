package tecomp.expr;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A named variable. Two variables with the same name are still distinct: equality is identity.
 * The creation serial only breaks ties between equally named variables when ordering.
 */
public final class Var extends Expr implements Comparable<Var> {
  private static final AtomicLong SERIAL = new AtomicLong();

  private final String name;
  private final DataType type;
  private final long serial;

  private Var(String name, DataType type) {
    this.name = name;
    this.type = type;
    this.serial = SERIAL.incrementAndGet();
  }

  public static Var mk(String name) {
    return new Var(name, DataType.INT);
  }

  public static Var mk(String name, DataType type) {
    return new Var(name, type);
  }

  /** A fresh variable with the same type whose name is this one's plus the suffix. */
  public Var copyWithSuffix(String suffix) {
    return new Var(name + suffix, type);
  }

  public String name() {
    return name;
  }

  public long serial() {
    return serial;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.VAR;
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
    return Long.hashCode(serial);
  }

  @Override
  public boolean equals(Object o) {
    return this == o;
  }

  @Override
  public int compareTo(Var o) {
    final int res = name.compareTo(o.name);
    return res != 0 ? res : Long.compare(serial, o.serial);
  }
}
