package tecomp.zeroelim.extract;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tecomp.expr.Call;
import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Reduce;
import tecomp.expr.Var;
import tecomp.expr.eval.ExprInterpreter;
import tecomp.expr.tensor.ComputeOp;
import tecomp.expr.tensor.Tensor;
import tecomp.expr.tensor.TensorSupport;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tecomp.expr.Expr.*;

@Tag("fast")
public class TensorInlinerTest {
  private static final Tensor A = TensorSupport.placeholder("A", DataType.INT, 4);
  private static final ExprInterpreter INTERPRETER =
      new ExprInterpreter(Map.of(A.op(), idx -> idx[0] * 3 + 1));

  private static Tensor compute(String name, Function<Var, Expr> fcompute) {
    return TensorSupport.compute(name, new long[] {4}, ax -> fcompute.apply(ax.get(0)));
  }

  private static Expr body(Tensor t) {
    return ((ComputeOp) t.op()).body().get(t.valueIndex());
  }

  private static boolean calls(Expr e, Predicate<Tensor> pred) {
    if (e instanceof Call call && call.isTensorCall() && pred.test(call.tensor())) return true;
    for (Expr child : e.children()) if (calls(child, pred)) return true;
    return false;
  }

  private static void assertSameValues(Tensor expected, Tensor actual) {
    for (long x = 0; x < 4; ++x)
      assertEquals(
          INTERPRETER.evalInt(expected.call(mkInt(x)), Map.of()),
          INTERPRETER.evalInt(actual.call(mkInt(x)), Map.of()));
  }

  @Test
  public void testInlineChain() {
    final Tensor b = compute("B", x -> mkAdd(A.call(x), mkInt(1)));
    final Tensor c = compute("C", x -> mkMul(b.call(x), mkInt(2)));
    final Tensor d = compute("D", x -> mkSub(c.call(x), b.call(x)));

    final Tensor inlined = TensorInliner.inlineTensors(d, List.of(), false);
    assertNotSame(d, inlined);
    assertFalse(calls(body(inlined), t -> t.op() instanceof ComputeOp));
    assertTrue(calls(body(inlined), t -> t.equals(A)));
    assertSameValues(d, inlined);

    final Tensor onlyC = TensorInliner.inlineTensors(d, List.of(c), false);
    assertTrue(calls(body(onlyC), t -> t.equals(b)));
    assertFalse(calls(body(onlyC), t -> t.equals(c)));
    assertSameValues(d, onlyC);

    final Tensor placeholderOnly = TensorInliner.inlineTensors(d, List.of(A), false);
    assertSame(d, placeholderOnly);
    assertSame(A, TensorInliner.inlineTensors(A, List.of(), true));
  }

  @Test
  public void testReductionsAreInlinedOnRequest() {
    final IterVar k = IterVar.mk("k", 0, 4);
    final Tensor r = compute("R", x -> Reduce.mkSum(mkMul(A.call(k.var()), x), List.of(k)));
    final Tensor user = compute("U", x -> mkAdd(r.call(x), mkInt(1)));

    assertSame(user, TensorInliner.inlineTensors(user, List.of(), false));

    final Tensor inlined = TensorInliner.inlineTensors(user, List.of(), true);
    assertTrue(ExprSupport.containsReduce(body(inlined)));
    assertSameValues(user, inlined);
  }

  @Test
  public void testInlineThisCall() {
    final IterVar k = IterVar.mk("k", 0, 4);
    final Tensor r = compute("R", x -> Reduce.mkSum(mkMul(A.call(k.var()), x), List.of(k)));
    final Var i = Var.mk("i");
    final Reduce first = (Reduce) TensorInliner.inlineThisCall(r.call(i));
    final Reduce second = (Reduce) TensorInliner.inlineThisCall(r.call(i));
    assertNotSame(first.axis().get(0).var(), second.axis().get(0).var());
    assertTrue(ExprSupport.usesVar(first.source().get(0), i));

    assertSame(i, TensorInliner.inlineThisCall(i));
    final Expr placeholderCall = A.call(i);
    assertSame(placeholderCall, TensorInliner.inlineThisCall(placeholderCall));
  }

  @Test
  public void testInlineTailCall() {
    final Tensor b = compute("B", x -> mkAdd(A.call(x), mkInt(1)));
    final Tensor tail = compute("T", x -> b.call(x));
    final Tensor inlined = TensorInliner.inlineTailCall(tail);
    assertFalse(calls(body(inlined), t -> t.equals(b)));
    assertSameValues(tail, inlined);

    final Tensor notTail = compute("N", x -> mkAdd(b.call(x), mkInt(1)));
    assertSame(notTail, TensorInliner.inlineTailCall(notTail));
  }
}
