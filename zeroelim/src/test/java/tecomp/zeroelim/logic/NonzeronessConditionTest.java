package tecomp.zeroelim.logic;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tecomp.expr.Call;
import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.zeroelim.ZeContext;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tecomp.expr.Expr.*;
import static tecomp.zeroelim.BruteForce.INTERPRETER;
import static tecomp.zeroelim.BruteForce.forEachPoint;

@Tag("fast")
public class NonzeronessConditionTest {
  private static final Var I = Var.mk("i"), J = Var.mk("j");
  private static final Map<Var, Range> RANGES = Map.of(I, Range.mk(-4, 9), J, Range.mk(-4, 9));

  private final NonzeronessCondition nz = new NonzeronessCondition(ZeContext.defaults());

  private static void assertSound(Expr e, NonzeronessResult res) {
    forEachPoint(
        List.of(I, J),
        RANGES,
        p -> {
          final long expected = INTERPRETER.evalInt(e, p);
          assertEquals(expected, INTERPRETER.evalInt(res.toExpr(), p), () -> res + " at " + p);
          if (!INTERPRETER.evalBool(res.cond(), p))
            assertEquals(0, expected, () -> "condition of " + res + " fails at " + p);
        });
  }

  @Test
  public void testConstants() {
    assertTrue(nz.apply(mkInt(0)).cond().isFalse());
    assertTrue(nz.apply(mkInt(3)).cond().isTrue());
    assertTrue(nz.apply(I).cond().isTrue());
    assertSame(I, nz.apply(I).value());
  }

  @Test
  public void testBooleanIsItsOwnCondition() {
    final Expr lt = mkLt(I, J);
    final NonzeronessResult res = nz.apply(lt);
    assertSame(lt, res.cond());
    assertTrue(res.value().isTrue());
  }

  @Test
  public void testSelectElseZero() {
    final Expr e = mkSelect(mkLt(I, J), mkAdd(I, mkInt(1)), mkInt(0));
    final NonzeronessResult res = nz.apply(e);
    assertEquals(mkAdd(I, mkInt(1)), res.value());
    assertSound(e, res);
  }

  @Test
  public void testZeroTrueBranchIsPruned() {
    final Expr e = mkSelect(mkLt(I, J), mkInt(0), J);
    final NonzeronessResult res = nz.apply(e);
    assertSame(J, res.value());
    assertSound(e, res);
  }

  @Test
  public void testIfThenElseKeepsBranches() {
    final Expr e = mkIfThenElse(mkLt(I, J), I, mkInt(0));
    final NonzeronessResult res = nz.apply(e);
    assertTrue(res.value() instanceof Call call && call.isIfThenElse());
    assertSound(e, res);
  }

  @Test
  public void testSoundness() {
    final Expr ltIJ = mkLt(I, J), eq = mkEq(I, mkInt(2)), pos = mkGt(J, mkInt(0));
    final List<Expr> exprs =
        List.of(
            mkMul(mkSelect(ltIJ, mkAdd(I, mkInt(1)), mkInt(0)), J),
            mkAdd(mkSelect(eq, I, mkInt(0)), mkSelect(pos, J, mkInt(0))),
            mkSub(mkSelect(eq, J, mkInt(0)), mkSelect(eq, I, mkInt(0))),
            mkMax(mkSelect(ltIJ, I, mkInt(0)), mkSelect(pos, mkInt(3), mkInt(0))),
            mkMin(mkSelect(pos, J, mkInt(0)), mkInt(0)),
            mkFloorDiv(mkSelect(ltIJ, mkMul(I, J), mkInt(0)), mkInt(2)),
            mkMod(mkSelect(pos, I, mkInt(0)), mkInt(3)),
            mkSelect(ltIJ, mkSelect(pos, I, mkInt(0)), mkSelect(eq, J, mkInt(0))),
            mkMul(mkIfThenElse(pos, mkSelect(eq, J, mkInt(0)), mkInt(0)), mkInt(5)),
            mkCast(DataType.INT, mkSelect(eq, I, mkInt(0))));
    for (Expr e : exprs) assertSound(e, nz.apply(e));
  }
}
