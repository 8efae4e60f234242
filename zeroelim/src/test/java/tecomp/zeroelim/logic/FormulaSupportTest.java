package tecomp.zeroelim.logic;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tecomp.expr.BinaryOp;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.ExprSupport;
import tecomp.expr.Range;
import tecomp.expr.Var;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tecomp.expr.Expr.*;
import static tecomp.zeroelim.BruteForce.INTERPRETER;
import static tecomp.zeroelim.BruteForce.forEachPoint;

@Tag("fast")
public class FormulaSupportTest {
  private static final Var I = Var.mk("i"), J = Var.mk("j");
  private static final Map<Var, Range> RANGES = Map.of(I, Range.mk(-3, 7), J, Range.mk(-3, 7));

  private static void assertEquivalent(Expr expected, Expr actual) {
    forEachPoint(
        List.of(I, J),
        RANGES,
        p ->
            assertEquals(
                INTERPRETER.evalBool(expected, p),
                INTERPRETER.evalBool(actual, p),
                () -> expected + " and " + actual + " differ at " + p));
  }

  @Test
  public void testFoldingConnectives() {
    final Expr lt = mkLt(I, J);
    assertEquals(lt, FormulaSupport.and(mkBool(true), lt));
    assertEquals(lt, FormulaSupport.and(lt, mkBool(true)));
    assertTrue(FormulaSupport.and(lt, mkBool(false)).isFalse());
    assertTrue(FormulaSupport.or(mkBool(true), lt).isTrue());
    assertEquals(lt, FormulaSupport.or(mkBool(false), lt));
    assertTrue(FormulaSupport.not(mkBool(true)).isFalse());
    assertEquals(mkNot(lt), FormulaSupport.not(lt));
    assertTrue(FormulaSupport.and(List.of(lt, mkBool(true), mkEq(I, J))).type().isBool());

    assertEquals(I, FormulaSupport.selectElseZero(mkBool(true), I));
    assertTrue(FormulaSupport.selectElseZero(mkBool(false), I).isZero());
    assertEquals(mkSelect(lt, I, mkInt(0)), FormulaSupport.selectElseZero(lt, I));
  }

  @Test
  public void testFactorOutCommonAtomics() {
    final Expr a = mkLt(I, J), b = mkEq(I, mkInt(1)), c = mkEq(J, mkInt(2));
    final Expr e = mkOr(mkAnd(a, b), mkAnd(a, c));
    final FactoredFormula f = FormulaSupport.factorOutAtomicFormulas(e);
    assertEquals(List.of(a), f.atomicFormulas());
    assertEquals(mkOr(b, c), f.rest());
    assertEquivalent(e, f.toExpr());
  }

  @Test
  public void testFactorOutAtomicFormulasIsEquivalent() {
    final Expr a = mkLt(I, J), b = mkEq(I, mkInt(1)), c = mkLe(J, mkInt(0));
    final List<Expr> formulas =
        List.of(
            mkAnd(a, mkAnd(b, a)),
            mkNot(mkOr(a, b)),
            mkNot(mkAnd(a, mkOr(b, c))),
            mkSelect(a, b, c),
            mkNot(mkSelect(a, b, c)),
            mkOr(mkAnd(a, mkNot(b)), mkAnd(c, mkNot(b))),
            mkAnd(mkOr(a, b), mkOr(a, c)));
    for (Expr e : formulas) {
      final FactoredFormula f = FormulaSupport.factorOutAtomicFormulas(e);
      assertEquivalent(e, f.toExpr());
      assertEquivalent(e, mkAnd(f.toList()));
      for (Expr atomic : f.atomicFormulas()) {
        assertNotEquals(ExprKind.AND, atomic.kind());
        assertNotEquals(ExprKind.OR, atomic.kind());
      }
    }

    final FactoredFormula f = FormulaSupport.factorOutAtomicFormulas(mkAnd(a, mkAnd(b, a)));
    assertEquals(2, f.atomicFormulas().size());
    assertTrue(f.rest().isTrue());
  }

  @Test
  public void testFactorRejectsNonBoolean() {
    assertThrows(IllegalArgumentException.class, () -> FormulaSupport.factorOutAtomicFormulas(I));
  }

  @Test
  public void testNormalizeComparisons() {
    final List<Expr> comparisons =
        List.of(
            mkLt(I, J),
            mkGt(I, mkAdd(J, mkInt(2))),
            mkGe(mkMul(I, mkInt(2)), J),
            mkLe(I, mkInt(3)),
            mkEq(I, J),
            mkNe(mkAdd(I, J), mkInt(1)));
    for (Expr e : comparisons) {
      final Expr normalized = FormulaSupport.normalizeComparisons(e);
      assertEquivalent(e, normalized);
      final BinaryOp op = (BinaryOp) normalized;
      assertTrue(op.b().isZero(), normalized::toString);
    }
    assertEquals(ExprKind.LE, FormulaSupport.normalizeComparisons(mkLt(I, J)).kind());
    assertEquals(ExprKind.LE, FormulaSupport.normalizeComparisons(mkGe(I, J)).kind());
    assertEquals(ExprKind.NE, FormulaSupport.normalizeComparisons(mkNe(I, J)).kind());

    final Expr nested = mkAnd(mkLt(I, J), mkNot(mkGt(I, mkInt(0))));
    assertEquivalent(nested, FormulaSupport.normalizeComparisons(nested));
  }

  @Test
  public void testImplicationOfConjunction() {
    final Pair<Expr, Expr> res =
        FormulaSupport.implicationNotContainingVars(
            mkAnd(mkLt(I, mkInt(3)), mkLt(J, I)), Set.of(J));
    assertEquals(mkLt(I, mkInt(3)), res.getLeft());
    assertEquals(mkLt(J, I), res.getRight());
  }

  @Test
  public void testImplicationIsSound() {
    final List<Expr> conditions =
        List.of(
            mkOr(mkAnd(mkLt(I, mkInt(0)), mkLt(J, I)), mkAnd(mkGt(I, mkInt(2)), mkEq(J, mkInt(1)))),
            mkOr(mkLt(I, mkInt(1)), mkLt(J, mkInt(0))),
            mkAnd(mkEq(J, I), mkOr(mkLt(I, J), mkLe(I, mkInt(0)))),
            mkLt(J, I));
    for (Expr cond : conditions) {
      final Pair<Expr, Expr> res = FormulaSupport.implicationNotContainingVars(cond, Set.of(J));
      final Expr outer = res.getLeft(), inner = res.getRight();
      assertFalse(ExprSupport.usesVar(outer, J), outer::toString);
      assertEquivalent(cond, mkAnd(outer, inner));
      forEachPoint(
          List.of(I, J),
          RANGES,
          p -> {
            if (INTERPRETER.evalBool(cond, p)) assertTrue(INTERPRETER.evalBool(outer, p));
          });
    }
  }

  @Test
  public void testAtomicFormulasOf() {
    final Expr a = mkLt(I, J), b = mkEq(I, mkInt(1));
    assertEquals(2, FormulaSupport.atomicFormulasOf(mkAnd(b, a)).size());
    assertTrue(FormulaSupport.atomicFormulasOf(mkOr(a, b)).isEmpty());
  }
}
