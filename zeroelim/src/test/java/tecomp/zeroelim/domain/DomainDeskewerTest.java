package tecomp.zeroelim.domain;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.zeroelim.ZeContext;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tecomp.expr.Expr.*;
import static tecomp.zeroelim.BruteForce.assertBijection;

@Tag("fast")
public class DomainDeskewerTest {
  private static final ZeContext CTX = ZeContext.defaults();
  private static final Var X = Var.mk("x"), Y = Var.mk("y");

  @Test
  public void testShiftedInterval() {
    final Domain domain =
        Domain.of(
            List.of(X),
            mkAnd(mkLe(mkInt(3), X), mkLt(X, mkInt(8))),
            Map.of(X, Range.mk(0, 20)));
    final DomainTransformation res = DomainDeskewer.deskew(domain, CTX);
    final List<Var> vars = res.newDomain().variables();
    assertEquals(1, vars.size());
    assertEquals("x.shifted", vars.get(0).name());
    assertEquals(5L, (long) res.newDomain().boxVolume());
    assertBijection(res);
  }

  @Test
  public void testPinnedVariableDisappears() {
    final Domain domain =
        Domain.of(
            List.of(X, Y),
            mkAnd(mkLe(X, Y), mkLe(Y, X)),
            Map.of(X, Range.mk(0, 6), Y, Range.mk(0, 6)));
    final DomainTransformation res = DomainDeskewer.deskew(domain, CTX);
    assertEquals(1, res.newDomain().variables().size());
    assertBijection(res);
  }

  @Test
  public void testSkewedBand() {
    final Domain domain =
        Domain.of(
            List.of(X, Y),
            mkAnd(mkLe(Y, mkAdd(X, mkInt(1))), mkLe(X, Y)),
            Map.of(X, Range.mk(0, 8), Y, Range.mk(0, 8)));
    final DomainTransformation res = DomainDeskewer.deskew(domain, CTX);
    assertTrue(res.newDomain().boxVolume() < 64, res::toString);
    assertBijection(res);
  }

  @Test
  public void testScaledBounds() {
    final Domain domain =
        Domain.of(
            List.of(X, Y),
            mkAnd(mkLe(mkMul(X, mkInt(2)), Y), mkLe(Y, mkAdd(mkMul(X, mkInt(2)), mkInt(3)))),
            Map.of(X, Range.mk(0, 6), Y, Range.mk(0, 12)));
    assertBijection(DomainDeskewer.deskew(domain, CTX));
  }

  @Test
  public void testMissingRange() {
    final Domain domain = Domain.of(List.of(X), mkLe(X, mkInt(3)), Map.of());
    assertThrows(IllegalArgumentException.class, () -> DomainDeskewer.deskew(domain, CTX));
  }
}
