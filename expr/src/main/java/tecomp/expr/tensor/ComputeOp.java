package tecomp.expr.tensor;

import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.IterVar;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A tensor defined pointwise: element {@code x} of output {@code k} is {@code body[k]} with the
 * axis variables bound to {@code x}. The shape is the list of axis extents.
 */
public final class ComputeOp extends Operation {
  private final List<IterVar> axis;
  private final List<Expr> body;

  public ComputeOp(String name, List<IterVar> axis, List<Expr> body) {
    super(name);
    checkArgument(!body.isEmpty(), "compute op %s has no body", name);
    this.axis = List.copyOf(axis);
    this.body = List.copyOf(body);
  }

  public List<IterVar> axis() {
    return axis;
  }

  public List<Expr> body() {
    return body;
  }

  @Override
  public int numOutputs() {
    return body.size();
  }

  @Override
  public List<Expr> outputShape(int valueIndex) {
    final List<Expr> shape = new ArrayList<>(axis.size());
    for (IterVar iv : axis) shape.add(iv.dom().extent());
    return shape;
  }

  @Override
  public DataType outputType(int valueIndex) {
    return body.get(valueIndex).type();
  }
}
