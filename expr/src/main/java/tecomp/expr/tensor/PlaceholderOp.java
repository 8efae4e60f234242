package tecomp.expr.tensor;

import tecomp.expr.DataType;
import tecomp.expr.Expr;

import java.util.List;

/** An input tensor with no body. */
public final class PlaceholderOp extends Operation {
  private final List<Expr> shape;
  private final DataType dtype;

  public PlaceholderOp(String name, List<Expr> shape, DataType dtype) {
    super(name);
    this.shape = List.copyOf(shape);
    this.dtype = dtype;
  }

  public List<Expr> shape() {
    return shape;
  }

  @Override
  public int numOutputs() {
    return 1;
  }

  @Override
  public List<Expr> outputShape(int valueIndex) {
    return shape;
  }

  @Override
  public DataType outputType(int valueIndex) {
    return dtype;
  }
}
