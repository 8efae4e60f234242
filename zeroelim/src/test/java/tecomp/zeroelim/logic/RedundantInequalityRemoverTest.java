package tecomp.zeroelim.logic;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.IterVar;
import tecomp.expr.Range;
import tecomp.expr.Reduce;
import tecomp.expr.Select;
import tecomp.expr.Var;
import tecomp.expr.tensor.Tensor;
import tecomp.expr.tensor.TensorSupport;
import tecomp.zeroelim.ZeContext;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tecomp.expr.Expr.*;
import static tecomp.zeroelim.BruteForce.INTERPRETER;
import static tecomp.zeroelim.BruteForce.forEachPoint;
import static tecomp.zeroelim.logic.RedundantInequalityRemover.removeRedundantInequalities;

@Tag("fast")
public class RedundantInequalityRemoverTest {
  private static final Var I = Var.mk("i"), J = Var.mk("j");
  private static final ZeContext CTX = ZeContext.defaults();

  private static void assertEquivalent(Expr expected, Expr actual) {
    forEachPoint(
        List.of(I, J),
        Map.of(I, Range.mk(-3, 7), J, Range.mk(-3, 7)),
        p -> assertEquals(INTERPRETER.evalInt(expected, p), INTERPRETER.evalInt(actual, p)));
  }

  @Test
  public void testConditionKnownInTrueBranch() {
    final Expr e = mkSelect(mkLt(I, J), mkSelect(mkLt(I, J), I, mkInt(1)), mkInt(2));
    final Expr res = removeRedundantInequalities(e, List.of(), CTX);
    assertTrue(res instanceof Select);
    assertSame(I, ((Select) res).trueValue());
    assertEquivalent(e, res);
  }

  @Test
  public void testNothingLearntInFalseBranch() {
    final Expr e = mkSelect(mkLt(I, J), mkInt(1), mkSelect(mkLt(I, J), mkInt(2), mkInt(3)));
    final Expr res = removeRedundantInequalities(e, List.of(), CTX);
    assertTrue(((Select) res).falseValue() instanceof Select);
    assertEquivalent(e, res);
  }

  @Test
  public void testKnownFactsAndConjunctions() {
    final Expr e = mkAnd(mkLt(I, J), mkGe(I, mkInt(0)));
    final Expr res = removeRedundantInequalities(e, List.of(mkGe(I, mkInt(0))), CTX);
    assertNotEquals(ExprKind.AND, res.kind());
    assertEquivalent(mkSelect(mkLt(I, J), mkInt(1), mkInt(0)), mkSelect(res, mkInt(1), mkInt(0)));

    final Expr ite = mkIfThenElse(mkLe(I, mkInt(2)), mkSelect(mkLe(I, mkInt(2)), J, mkInt(0)), I);
    final Expr simplified = removeRedundantInequalities(ite, List.of(), CTX);
    assertEquivalent(ite, simplified);
  }

  @Test
  public void testReductionAxisIsKnownInSource() {
    final Tensor a = TensorSupport.placeholder("A", DataType.INT, 10);
    final IterVar k = IterVar.mk("k", 0, 10);
    final Reduce sum =
        Reduce.mkSum(mkSelect(mkLt(k.var(), mkInt(10)), a.call(k.var()), mkInt(0)), List.of(k));
    final Reduce res = (Reduce) removeRedundantInequalities(sum, List.of(), CTX);
    assertEquals(a.call(k.var()), res.source().get(0));
  }
}
