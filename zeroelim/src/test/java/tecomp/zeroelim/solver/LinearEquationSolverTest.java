package tecomp.zeroelim.solver;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tecomp.expr.Expr;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.domain.Domain;
import tecomp.zeroelim.domain.DomainSupport;
import tecomp.zeroelim.domain.DomainTransformation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tecomp.expr.Expr.*;
import static tecomp.zeroelim.BruteForce.assertBijection;

@Tag("fast")
public class LinearEquationSolverTest {
  private static final ZeContext CTX = ZeContext.defaults();
  private static final Var X = Var.mk("x"), Y = Var.mk("y"), Z = Var.mk("z");

  private static Domain domain(List<Var> vars, Expr cond, long extent) {
    final Map<Var, Range> ranges = new HashMap<>();
    for (Var v : vars) ranges.put(v, Range.mk(0, extent));
    return Domain.of(vars, cond, ranges);
  }

  @Test
  public void testXgcd() {
    final long[][] pairs = {{12, 18}, {18, 12}, {7, 5}, {-4, 6}, {9, -3}, {1, 1}, {0, 5}};
    for (long[] p : pairs) {
      final long[] r = LinearEquationSolver.xgcd(p[0], p[1]);
      assertEquals(r[0], r[1] * p[0] + r[2] * p[1]);
      assertEquals(0, p[0] % r[0]);
      assertEquals(0, p[1] % r[0]);
    }
    assertEquals(6, Math.abs(LinearEquationSolver.xgcd(12, 18)[0]));
  }

  @Test
  public void testSingleEquation() {
    final DomainTransformation res =
        LinearEquationSolver.solve(domain(List.of(X, Y), mkEq(X, mkAdd(Y, mkInt(1))), 10), CTX);
    assertEquals(1, res.newDomain().variables().size());
    assertBijection(res);
  }

  @Test
  public void testScaledEquation() {
    final DomainTransformation res =
        LinearEquationSolver.solve(domain(List.of(X, Y), mkEq(X, mkMul(Y, mkInt(2))), 10), CTX);
    assertEquals(1, res.newDomain().variables().size());
    assertBijection(res);
  }

  @Test
  public void testSystem() {
    final Expr cond =
        mkAnd(mkEq(mkAdd(mkAdd(X, Y), Z), mkInt(4)), mkEq(mkSub(X, Y), mkInt(1)));
    final DomainTransformation res =
        LinearEquationSolver.solve(domain(List.of(X, Y, Z), cond, 5), CTX);
    assertEquals(1, res.newDomain().variables().size());
    assertBijection(res);
  }

  @Test
  public void testNonUnitCoefficients() {
    final Expr cond = mkEq(mkAdd(mkMul(X, mkInt(4)), mkMul(Y, mkInt(6))), mkAdd(Z, mkInt(2)));
    final DomainTransformation res =
        LinearEquationSolver.solve(domain(List.of(X, Y, Z), cond, 6), CTX);
    assertEquals(2, res.newDomain().variables().size());
    assertBijection(res);
  }

  @Test
  public void testOtherConditionsAreCarried() {
    final Expr cond = mkAnd(mkEq(X, Y), mkLt(X, mkInt(3)));
    final DomainTransformation res =
        LinearEquationSolver.solve(domain(List.of(X, Y), cond, 10), CTX);
    assertBijection(res);

    final DomainTransformation none =
        LinearEquationSolver.solve(domain(List.of(X, Y), mkLe(X, Y), 4), CTX);
    assertEquals(2, none.newDomain().variables().size());
    assertBijection(none);
  }

  @Test
  public void testContradictions() {
    final DomainTransformation twoValues =
        LinearEquationSolver.solve(
            domain(List.of(X), mkAnd(mkEq(X, mkInt(1)), mkEq(X, mkInt(2))), 10), CTX);
    assertTrue(DomainSupport.isEmpty(twoValues.newDomain()));
    assertBijection(twoValues);

    final DomainTransformation indivisible =
        LinearEquationSolver.solve(
            domain(List.of(X), mkEq(mkMul(X, mkInt(2)), mkInt(3)), 10), CTX);
    assertTrue(DomainSupport.isEmpty(indivisible.newDomain()));
  }
}
