package tecomp.expr.tensor;

import tecomp.expr.DataType;
import tecomp.expr.Expr;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** Producer of one or more tensors. Operations compare by identity. */
public abstract class Operation implements Comparable<Operation> {
  private static final AtomicLong SERIAL = new AtomicLong();

  private final String name;
  private final long serial;

  protected Operation(String name) {
    this.name = name;
    this.serial = SERIAL.incrementAndGet();
  }

  public String name() {
    return name;
  }

  public abstract int numOutputs();

  public abstract List<Expr> outputShape(int valueIndex);

  public abstract DataType outputType(int valueIndex);

  public Tensor output(int valueIndex) {
    return new Tensor(this, valueIndex);
  }

  @Override
  public int hashCode() {
    return Long.hashCode(serial);
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj;
  }

  @Override
  public int compareTo(Operation o) {
    final int res = name.compareTo(o.name);
    return res != 0 ? res : Long.compare(serial, o.serial);
  }

  @Override
  public String toString() {
    return name;
  }
}
