package tecomp.expr;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tecomp.expr.Expr.*;

@Tag("fast")
public class ExprSupportTest {
  @Test
  public void testStructuralEquality() {
    final Var x = Var.mk("x"), y = Var.mk("x");
    assertEquals(mkAdd(x, mkInt(1)), mkAdd(x, mkInt(1)));
    assertNotEquals(mkAdd(x, mkInt(1)), mkAdd(y, mkInt(1)));
    assertEquals(mkAdd(x, mkInt(1)).hashCode(), mkAdd(x, mkInt(1)).hashCode());
    assertNotEquals(mkBool(true), mkInt(1));
  }

  @Test
  public void testOperandTypesChecked() {
    final Var x = Var.mk("x");
    final Var f = Var.mk("f", DataType.FLOAT);
    assertThrows(IllegalArgumentException.class, () -> mkAdd(x, f));
    assertThrows(IllegalArgumentException.class, () -> mkAnd(x, x));
    assertThrows(IllegalArgumentException.class, () -> mkSelect(x, x, x));
  }

  @Test
  public void testSubstitute() {
    final Var x = Var.mk("x"), y = Var.mk("y");
    final Expr e = mkAdd(mkMul(x, mkInt(2)), y);
    final Expr replaced = ExprSupport.substitute(e, Map.of(x, mkInt(3)));
    assertEquals(mkAdd(mkMul(mkInt(3), mkInt(2)), y), replaced);
    assertTrue(ExprSupport.substitute(e, Map.of()) == e);
  }

  @Test
  public void testFreeVarsSkipReductionAxis() {
    final Var i = Var.mk("i"), n = Var.mk("n");
    final IterVar k = new IterVar(Var.mk("k"), new Range(mkInt(0), n));
    final Expr sum = Reduce.mkSum(mkAdd(i, k.var()), List.of(k));
    assertEquals(List.of(n, i), ExprSupport.freeVars(sum));
    assertTrue(ExprSupport.usesVar(sum, n));
    assertFalse(ExprSupport.usesAnyVar(mkInt(1), List.of(i)));
  }

  @Test
  public void testFlatten() {
    final Var a = Var.mk("a", DataType.BOOL), b = Var.mk("b", DataType.BOOL);
    final Var c = Var.mk("c", DataType.BOOL);
    assertEquals(List.of(a, b, c), ExprSupport.flatten(mkAnd(mkAnd(a, b), c), ExprKind.AND));
    assertEquals(List.of(mkAnd(a, b)), ExprSupport.flatten(mkAnd(a, b), ExprKind.OR));
  }

  @Test
  public void testPrinter() {
    final Var x = Var.mk("x"), y = Var.mk("y");
    assertEquals("x + y * 2", mkAdd(x, mkMul(y, mkInt(2))).toString());
    assertEquals("(x + y) * 2", mkMul(mkAdd(x, y), mkInt(2)).toString());
    assertEquals("x - (y - 1)", mkSub(x, mkSub(y, mkInt(1))).toString());
    assertEquals("!(x < y) && true", mkAnd(mkNot(mkLt(x, y)), mkBool(true)).toString());
    assertEquals("floordiv(x, 3)", mkFloorDiv(x, mkInt(3)).toString());
  }

  @Test
  public void testComparatorIsTotal() {
    final Var x = Var.mk("x"), y = Var.mk("y");
    final List<Expr> exprs =
        List.of(x, y, mkInt(1), mkAdd(x, y), mkAdd(y, x), mkLe(x, y), mkNot(mkLe(x, y)));
    for (Expr a : exprs) {
      for (Expr b : exprs) {
        final int ab = ExprComparator.INSTANCE.compare(a, b);
        final int ba = ExprComparator.INSTANCE.compare(b, a);
        assertEquals(Integer.signum(ab), -Integer.signum(ba));
        assertEquals(a.equals(b), ab == 0);
      }
    }
  }
}
