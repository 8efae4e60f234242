package tecomp.expr.eval;

import tecomp.expr.BinaryOp;
import tecomp.expr.Call;
import tecomp.expr.Cast;
import tecomp.expr.CommReducer;
import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.FloatImm;
import tecomp.expr.IterVar;
import tecomp.expr.NotOp;
import tecomp.expr.Reduce;
import tecomp.expr.Select;
import tecomp.expr.Var;
import tecomp.expr.tensor.ComputeOp;
import tecomp.expr.tensor.Operation;
import tecomp.expr.tensor.Tensor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Direct evaluator of the IR. Integers and booleans evaluate to {@link Long} (booleans as 0 and
 * 1), floats to {@link Double}. Placeholder tensors read from the supplied input functions.
 */
public final class ExprInterpreter {
  private final Map<Operation, Function<long[], Number>> inputs;

  public ExprInterpreter(Map<Operation, Function<long[], Number>> inputs) {
    this.inputs = inputs;
  }

  public ExprInterpreter() {
    this(Map.of());
  }

  public long evalInt(Expr e, Map<Var, ? extends Number> env) {
    return eval(e, env).longValue();
  }

  public boolean evalBool(Expr e, Map<Var, ? extends Number> env) {
    return eval(e, env).longValue() != 0;
  }

  public double evalFloat(Expr e, Map<Var, ? extends Number> env) {
    return eval(e, env).doubleValue();
  }

  public Number eval(Expr e, Map<Var, ? extends Number> env) {
    return switch (e.kind()) {
      case INT_IMM -> e.constValue();
      case FLOAT_IMM -> ((FloatImm) e).value();
      case VAR -> {
        final Number v = env.get(e);
        if (v == null) throw new IllegalArgumentException("unbound variable " + e);
        yield e.type().isFloat() ? (Number) v.doubleValue() : (Number) v.longValue();
      }
      case ADD, SUB, MUL, DIV, MOD, FLOOR_DIV, FLOOR_MOD, MIN, MAX, EQ, NE, LT, LE, GT, GE ->
          evalBinary((BinaryOp) e, env);
      case AND -> evalBool(((BinaryOp) e).a(), env) && evalBool(((BinaryOp) e).b(), env) ? 1L : 0L;
      case OR -> evalBool(((BinaryOp) e).a(), env) || evalBool(((BinaryOp) e).b(), env) ? 1L : 0L;
      case NOT -> evalBool(((NotOp) e).a(), env) ? 0L : 1L;
      case SELECT -> {
        final Select s = (Select) e;
        yield eval(evalBool(s.cond(), env) ? s.trueValue() : s.falseValue(), env);
      }
      case CAST -> convert(eval(((Cast) e).value(), env), e.type());
      case CALL -> evalCall((Call) e, env);
      case REDUCE -> evalReduce((Reduce) e, env);
    };
  }

  private static Number convert(Number v, DataType type) {
    return switch (type) {
      case INT -> v instanceof Double d ? (long) d.doubleValue() : v.longValue();
      case BOOL -> v.doubleValue() != 0 ? 1L : 0L;
      case FLOAT -> v.doubleValue();
    };
  }

  private Number evalBinary(BinaryOp e, Map<Var, ? extends Number> env) {
    final Number a = eval(e.a(), env), b = eval(e.b(), env);
    if (e.a().type().isFloat()) {
      final double x = a.doubleValue(), y = b.doubleValue();
      return switch (e.kind()) {
        case ADD -> x + y;
        case SUB -> x - y;
        case MUL -> x * y;
        case DIV -> x / y;
        case MIN -> Math.min(x, y);
        case MAX -> Math.max(x, y);
        case EQ -> x == y ? 1L : 0L;
        case NE -> x != y ? 1L : 0L;
        case LT -> x < y ? 1L : 0L;
        case LE -> x <= y ? 1L : 0L;
        case GT -> x > y ? 1L : 0L;
        case GE -> x >= y ? 1L : 0L;
        default -> throw new UnsupportedOperationException(e.kind() + " over floats");
      };
    }
    final long x = a.longValue(), y = b.longValue();
    return switch (e.kind()) {
      case ADD -> x + y;
      case SUB -> x - y;
      case MUL -> x * y;
      case DIV -> x / y;
      case MOD -> x % y;
      case FLOOR_DIV -> Math.floorDiv(x, y);
      case FLOOR_MOD -> Math.floorMod(x, y);
      case MIN -> Math.min(x, y);
      case MAX -> Math.max(x, y);
      case EQ -> x == y ? 1L : 0L;
      case NE -> x != y ? 1L : 0L;
      case LT -> x < y ? 1L : 0L;
      case LE -> x <= y ? 1L : 0L;
      case GT -> x > y ? 1L : 0L;
      case GE -> x >= y ? 1L : 0L;
      default -> throw new IllegalStateException(e.kind().toString());
    };
  }

  private Number evalCall(Call call, Map<Var, ? extends Number> env) {
    if (call.isIfThenElse()) {
      final List<Expr> args = call.args();
      return eval(evalBool(args.get(0), env) ? args.get(1) : args.get(2), env);
    }
    if (!call.isTensorCall())
      throw new UnsupportedOperationException("cannot evaluate intrinsic " + call.name());

    final long[] indices = new long[call.args().size()];
    for (int i = 0; i < indices.length; ++i) indices[i] = evalInt(call.args().get(i), env);

    final Tensor tensor = call.tensor();
    if (tensor.op() instanceof ComputeOp compute) {
      final Map<Var, Number> inner = new HashMap<>(env);
      for (int i = 0; i < indices.length; ++i) inner.put(compute.axis().get(i).var(), indices[i]);
      return eval(compute.body().get(tensor.valueIndex()), inner);
    }
    final Function<long[], Number> input = inputs.get(tensor.op());
    if (input == null) throw new IllegalArgumentException("no data for tensor " + tensor);
    return convert(input.apply(indices), call.type());
  }

  private Number evalReduce(Reduce r, Map<Var, ? extends Number> env) {
    final CommReducer combiner = r.combiner();
    final Number[] acc = new Number[combiner.arity()];
    for (int i = 0; i < acc.length; ++i) acc[i] = eval(combiner.identity().get(i), env);

    final Map<Var, Number> inner = new HashMap<>(env);
    iterate(r, 0, inner, acc);
    return acc[r.valueIndex()];
  }

  private void iterate(Reduce r, int dim, Map<Var, Number> env, Number[] acc) {
    if (dim == r.axis().size()) {
      if (!evalBool(r.condition(), env)) return;
      final CommReducer combiner = r.combiner();
      final Map<Var, Number> cenv = new HashMap<>(env);
      for (int i = 0; i < acc.length; ++i) {
        cenv.put(combiner.lhs().get(i), acc[i]);
        cenv.put(combiner.rhs().get(i), eval(r.source().get(i), env));
      }
      for (int i = 0; i < acc.length; ++i) acc[i] = eval(combiner.result().get(i), cenv);
      return;
    }
    final IterVar iv = r.axis().get(dim);
    final long min = evalInt(iv.dom().min(), env), extent = evalInt(iv.dom().extent(), env);
    for (long x = min; x < min + extent; ++x) {
      env.put(iv.var(), x);
      iterate(r, dim + 1, env, acc);
    }
    env.remove(iv.var());
  }
}
