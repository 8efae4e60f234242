package tecomp.expr;

import tecomp.expr.tensor.Tensor;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/** Either an intrinsic call, identified by name, or an element access of a tensor. */
public final class Call extends Expr {
  public static final String IF_THEN_ELSE = "if_then_else";

  public enum CallType {
    INTRINSIC,
    TENSOR
  }

  private final String name;
  private final DataType type;
  private final List<Expr> args;
  private final CallType callType;
  private final Tensor tensor;

  private Call(String name, DataType type, List<Expr> args, CallType callType, Tensor tensor) {
    this.name = name;
    this.type = type;
    this.args = List.copyOf(args);
    this.callType = callType;
    this.tensor = tensor;
  }

  public static Call mkIntrinsic(String name, DataType type, List<? extends Expr> args) {
    if (IF_THEN_ELSE.equals(name)) {
      checkArgument(args.size() == 3, "if_then_else takes 3 arguments");
      checkArgument(args.get(0).type().isBool(), "if_then_else condition must be boolean");
    }
    return new Call(name, type, List.copyOf(args), CallType.INTRINSIC, null);
  }

  public static Call mkTensorCall(Tensor tensor, List<? extends Expr> args) {
    checkArgument(
        args.size() == tensor.ndim(),
        "tensor %s has %s dimensions, called with %s arguments",
        tensor.name(),
        tensor.ndim(),
        args.size());
    for (Expr arg : args) checkArgument(arg.type().isInt(), "tensor index must be int: %s", arg);
    return new Call(tensor.name(), tensor.dtype(), List.copyOf(args), CallType.TENSOR, tensor);
  }

  /** Same callee, new arguments. */
  public Call withArgs(List<? extends Expr> newArgs) {
    return new Call(name, type, List.copyOf(newArgs), callType, tensor);
  }

  public String name() {
    return name;
  }

  public List<Expr> args() {
    return args;
  }

  public CallType callType() {
    return callType;
  }

  public boolean isTensorCall() {
    return callType == CallType.TENSOR;
  }

  public boolean isIfThenElse() {
    return callType == CallType.INTRINSIC && IF_THEN_ELSE.equals(name);
  }

  /** The accessed tensor, or null for intrinsics. */
  public Tensor tensor() {
    return tensor;
  }

  @Override
  public ExprKind kind() {
    return ExprKind.CALL;
  }

  @Override
  public DataType type() {
    return type;
  }

  @Override
  public List<Expr> children() {
    return args;
  }

  @Override
  protected int computeHash() {
    return Objects.hash(name, type, args, callType, tensor);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Call that)) return false;
    return callType == that.callType
        && type == that.type
        && name.equals(that.name)
        && Objects.equals(tensor, that.tensor)
        && args.equals(that.args);
  }
}
