package tecomp.zeroelim;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tecomp.expr.Call;
import tecomp.expr.CommReducer;
import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Range;
import tecomp.expr.Reduce;
import tecomp.expr.Var;
import tecomp.expr.eval.ExprInterpreter;
import tecomp.expr.tensor.ComputeOp;
import tecomp.expr.tensor.Tensor;
import tecomp.expr.tensor.TensorSupport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tecomp.expr.Expr.*;

@Tag("fast")
public class ZeroEliminatorTest {
  private static final ZeContext CTX = ZeContext.defaults();
  private static final Tensor A = TensorSupport.placeholder("A", DataType.INT, 10);
  private static final ExprInterpreter INTERPRETER =
      new ExprInterpreter(Map.of(A.op(), idx -> 2 * idx[0] - 7));

  private static CommReducer reducer(Function<List<Var>, Expr> result, long identity) {
    final Var x = Var.mk("x"), y = Var.mk("y");
    return new CommReducer(
        List.of(x), List.of(y), List.of(result.apply(List.of(x, y))), List.of(mkInt(identity)));
  }

  private static Tensor compute(Function<Var, Expr> fcompute) {
    return TensorSupport.compute("C", new long[] {10}, ax -> fcompute.apply(ax.get(0)));
  }

  private static void assertSameValues(Tensor expected, Tensor actual) {
    for (long k = 0; k < 10; ++k)
      assertEquals(
          INTERPRETER.evalInt(expected.call(mkInt(k)), Map.of()),
          INTERPRETER.evalInt(actual.call(mkInt(k)), Map.of()),
          "at " + k);
  }

  private static boolean containsSelect(Expr e) {
    if (e.kind() == ExprKind.SELECT) return true;
    for (Expr child : e.children()) if (containsSelect(child)) return true;
    return false;
  }

  /** Reductions of {@code e} and of the compute tensors it calls. */
  private static void collectReductions(Expr e, List<Reduce> out) {
    if (e instanceof Reduce red) out.add(red);
    if (e instanceof Call call && call.isTensorCall() && call.tensor().op() instanceof ComputeOp op)
      collectReductions(op.body().get(call.tensor().valueIndex()), out);
    for (Expr child : e.children()) collectReductions(child, out);
  }

  @Test
  public void testCombiners() {
    assertTrue(ZeroEliminator.isSumCombiner(CommReducer.mkSum(DataType.INT), Map.of(), CTX));
    final CommReducer swapped = reducer(v -> mkAdd(v.get(1), v.get(0)), 0);
    assertTrue(ZeroEliminator.isSumCombiner(swapped, Map.of(), CTX));

    final CommReducer product = reducer(v -> mkMul(v.get(0), v.get(1)), 1);
    final CommReducer max = reducer(v -> mkMax(v.get(0), v.get(1)), 0);
    assertFalse(ZeroEliminator.isSumCombiner(product, Map.of(), CTX));
    assertFalse(ZeroEliminator.isSumCombiner(max, Map.of(), CTX));
    final CommReducer offset = reducer(v -> mkAdd(v.get(0), v.get(1)), 1);
    assertFalse(ZeroEliminator.isSumCombiner(offset, Map.of(), CTX));

    final Var m = Var.mk("m");
    final CommReducer guarded =
        reducer(
            v -> mkSelect(mkLt(m, mkInt(0)), mkAdd(v.get(0), v.get(1)), mkMul(v.get(0), v.get(1))),
            0);
    assertTrue(ZeroEliminator.isSumCombiner(guarded, Map.of(m, Range.mk(-5, 4)), CTX));
    assertFalse(ZeroEliminator.isSumCombiner(guarded, Map.of(m, Range.mk(-5, 10)), CTX));

    assertTrue(ZeroEliminator.canFactorZeroFromCombiner(max, 0, Map.of(), CTX));
    final CommReducer sum = CommReducer.mkSum(DataType.INT);
    assertTrue(ZeroEliminator.canFactorZeroFromCombiner(sum, 0, Map.of(), CTX));
    assertFalse(ZeroEliminator.canFactorZeroFromCombiner(product, 0, Map.of(), CTX));
  }

  @Test
  public void testLiftNonzeronessCondition() {
    final Var i = Var.mk("i");
    final Expr expr =
        mkMul(mkSelect(mkLt(i, mkInt(3)), A.call(i), mkInt(0)), mkAdd(i, mkInt(1)));
    final Expr lifted = ZeroEliminator.liftNonzeronessCondition(expr, CTX);
    assertEquals(ExprKind.SELECT, lifted.kind());
    for (long x = 0; x < 10; ++x) {
      final Map<Var, Long> env = Map.of(i, x);
      assertEquals(INTERPRETER.evalInt(expr, env), INTERPRETER.evalInt(lifted, env));
    }
  }

  @Test
  public void testLiftConditionsThroughReduction() {
    final IterVar i = IterVar.mk("i", 0, 10), k = IterVar.mk("k", 0, 10);
    final Expr cond =
        mkAnd(
            mkAnd(mkLt(i.var(), k.var()), mkLt(k.var(), mkInt(5))), mkGe(i.var(), mkInt(2)));
    final Pair<Expr, Expr> lifted =
        ZeroEliminator.liftConditionsThroughReduction(cond, List.of(i), List.of(k), CTX);
    final Expr outer = lifted.getLeft(), inner = lifted.getRight();
    assertFalse(ExprSupport.usesVar(outer, i.var()));

    for (long kv = 0; kv < 10; ++kv) {
      final Map<Var, Long> env = Map.of(k.var(), kv);
      assertEquals(kv >= 3 && kv < 5, INTERPRETER.evalBool(outer, env), "at k = " + kv);
      for (long iv = 0; iv < 10; ++iv) {
        final Map<Var, Long> point = Map.of(i.var(), iv, k.var(), kv);
        assertEquals(
            INTERPRETER.evalBool(cond, point),
            INTERPRETER.evalBool(outer, point) && INTERPRETER.evalBool(inner, point));
      }
    }
  }

  @Test
  public void testTriangularSum() {
    final Tensor c =
        compute(
            k -> {
              final IterVar i = IterVar.mk("i", 0, 10);
              return Reduce.mkSum(
                  mkSelect(mkLt(i.var(), k), A.call(i.var()), mkInt(0)), List.of(i));
            });
    final Tensor optimized = ZeroEliminator.optimizeAndLiftNonzeronessConditions(c, Map.of(), CTX);
    assertNotSame(c, optimized);
    assertSameValues(c, optimized);

    final List<Reduce> reductions = new ArrayList<>();
    collectReductions(optimized.call(Var.mk("k")), reductions);
    assertFalse(reductions.isEmpty());
    for (Reduce red : reductions)
      for (Expr src : red.source()) assertFalse(containsSelect(src), red::toString);
  }

  @Test
  public void testOtherCombiners() {
    final CommReducer product = reducer(v -> mkMul(v.get(0), v.get(1)), 1);
    final Tensor prod =
        compute(
            k -> {
              final IterVar i = IterVar.mk("i", 0, 10);
              return Reduce.mk(
                  product,
                  List.of(mkSelect(mkLt(i.var(), k), A.call(i.var()), mkInt(1))),
                  List.of(i),
                  mkLt(i.var(), mkInt(5)),
                  0);
            });
    assertSameValues(
        prod, ZeroEliminator.optimizeAndLiftNonzeronessConditions(prod, Map.of(), CTX));

    final CommReducer max = reducer(v -> mkMax(v.get(0), v.get(1)), 0);
    final Tensor maxed =
        compute(
            k -> {
              final IterVar i = IterVar.mk("i", 0, 10);
              return Reduce.mk(
                  max,
                  List.of(mkSelect(mkLe(k, i.var()), A.call(i.var()), mkInt(0))),
                  List.of(i),
                  mkBool(true),
                  0);
            });
    assertSameValues(
        maxed, ZeroEliminator.optimizeAndLiftNonzeronessConditions(maxed, Map.of(), CTX));
  }

  @Test
  public void testElementwiseBody() {
    final Tensor c = compute(k -> mkSelect(mkLt(k, mkInt(3)), A.call(k), mkInt(0)));
    assertSameValues(c, ZeroEliminator.optimizeAndLiftNonzeronessConditions(c, Map.of(), CTX));
    assertSame(A, ZeroEliminator.optimizeAndLiftNonzeronessConditions(A, Map.of(), CTX));
  }

  @Test
  public void testFacade() {
    assertTrue(ZeroElimSupport.isSumCombiner(CommReducer.mkSum(DataType.INT), Map.of()));
    final Tensor c = compute(k -> mkSelect(mkLt(k, mkInt(3)), A.call(k), mkInt(0)));
    assertSameValues(c, ZeroElimSupport.optimizeAndLiftNonzeronessConditions(c, Map.of()));
  }
}
