package tecomp.expr.tensor;

import tecomp.expr.Call;
import tecomp.expr.DataType;
import tecomp.expr.Expr;

import java.util.List;

/** Output {@code valueIndex} of an operation. */
public record Tensor(Operation op, int valueIndex) {
  public String name() {
    return op.name();
  }

  public List<Expr> shape() {
    return op.outputShape(valueIndex);
  }

  public int ndim() {
    return shape().size();
  }

  public DataType dtype() {
    return op.outputType(valueIndex);
  }

  public Call call(List<? extends Expr> args) {
    return Call.mkTensorCall(this, args);
  }

  public Call call(Expr... args) {
    return Call.mkTensorCall(this, List.of(args));
  }

  @Override
  public String toString() {
    return op.numOutputs() == 1 ? op.name() : op.name() + ".v" + valueIndex;
  }
}
