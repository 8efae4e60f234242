package tecomp.expr.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Global;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import tecomp.expr.BinaryOp;
import tecomp.expr.Call;
import tecomp.expr.Cast;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.ExprSupport;
import tecomp.expr.NotOp;
import tecomp.expr.Range;
import tecomp.expr.Select;
import tecomp.expr.Var;
import tecomp.expr.arith.Prover;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Proves integer and boolean facts with Z3 by refuting their negation under the range
 * assumptions. Anything Z3 cannot translate, decide within the timeout, or that makes it fail is
 * reported as not proven.
 */
public class SmtProver implements Prover {
  private static final Logger LOG = Logger.getLogger(SmtProver.class.getName());

  static {
    Global.setParameter("smt.random_seed", "9876543210");
  }

  private final int timeoutMs;

  public SmtProver(int timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  @Override
  public boolean prove(Expr cond, Map<Var, Range> ranges) {
    try (final Context z3 = new Context()) {
      final Translator translator = new Translator(z3);
      final BoolExpr goal = translator.toBool(cond);

      final Solver solver = z3.mkSolver(z3.tryFor(z3.mkTactic("qflia"), timeoutMs));
      for (Var v : ExprSupport.freeVars(cond)) {
        final Range range = ranges.get(v);
        if (range == null || !v.type().isInt()) continue;
        final com.microsoft.z3.Expr<IntSort> x = translator.toInt(v);
        final com.microsoft.z3.Expr<IntSort> min = translator.toInt(range.min());
        final com.microsoft.z3.Expr<IntSort> extent = translator.toInt(range.extent());
        solver.add(z3.mkLe(min, x), z3.mkLt(x, z3.mkAdd(min, extent)));
      }
      solver.add(z3.mkNot(goal));
      return solver.check() == Status.UNSATISFIABLE;

    } catch (UntranslatableException ex) {
      LOG.fine(() -> "not translatable to SMT: " + ex.getMessage());
      return false;
    } catch (Z3Exception ex) {
      LOG.fine(() -> "z3 failed on " + cond + ": " + ex.getMessage());
      return false;
    }
  }

  private static class UntranslatableException extends RuntimeException {
    UntranslatableException(Expr e) {
      super(e.toString());
    }
  }

  private static class Translator {
    private final Context z3;
    private final Map<Var, IntExpr> intVars = new HashMap<>();
    private final Map<Var, BoolExpr> boolVars = new HashMap<>();

    Translator(Context z3) {
      this.z3 = z3;
    }

    com.microsoft.z3.Expr<IntSort> toInt(Expr e) {
      if (!e.type().isInt()) throw new UntranslatableException(e);
      return switch (e.kind()) {
        case INT_IMM -> z3.mkInt(e.constValue());
        case VAR -> intVars.computeIfAbsent((Var) e, v -> z3.mkIntConst(name(v)));
        case ADD -> z3.mkAdd(toInt(((BinaryOp) e).a()), toInt(((BinaryOp) e).b()));
        case SUB -> z3.mkSub(toInt(((BinaryOp) e).a()), toInt(((BinaryOp) e).b()));
        case MUL -> z3.mkMul(toInt(((BinaryOp) e).a()), toInt(((BinaryOp) e).b()));
        case DIV, MOD, FLOOR_DIV, FLOOR_MOD -> divMod((BinaryOp) e);
        case MIN, MAX -> {
          final BinaryOp op = (BinaryOp) e;
          final com.microsoft.z3.Expr<IntSort> a = toInt(op.a()), b = toInt(op.b());
          final BoolExpr aFirst = e.kind() == ExprKind.MIN ? z3.mkLe(a, b) : z3.mkGe(a, b);
          yield z3.mkITE(aFirst, a, b);
        }
        case SELECT -> {
          final Select s = (Select) e;
          yield z3.mkITE(toBool(s.cond()), toInt(s.trueValue()), toInt(s.falseValue()));
        }
        case CAST -> {
          final Expr v = ((Cast) e).value();
          if (!v.type().isBool()) throw new UntranslatableException(e);
          yield z3.<IntSort>mkITE(toBool(v), z3.mkInt(1), z3.mkInt(0));
        }
        case CALL -> {
          final Call call = (Call) e;
          if (!call.isIfThenElse()) throw new UntranslatableException(e);
          yield z3.mkITE(
              toBool(call.args().get(0)), toInt(call.args().get(1)), toInt(call.args().get(2)));
        }
        default -> throw new UntranslatableException(e);
      };
    }

    private com.microsoft.z3.Expr<IntSort> divMod(BinaryOp e) {
      final Long divisor = e.b().constValue();
      if (divisor == null || divisor == 0) throw new UntranslatableException(e);
      final long c = divisor;
      final com.microsoft.z3.Expr<IntSort> a = toInt(e.a());
      final com.microsoft.z3.Expr<IntSort> q = switch (e.kind()) {
        case FLOOR_DIV, FLOOR_MOD -> floorDiv(a, c);
        default -> truncDiv(a, c);
      };
      return switch (e.kind()) {
        case DIV, FLOOR_DIV -> q;
        default -> z3.mkSub(a, z3.mkMul(z3.mkInt(c), q));
      };
    }

    // z3's div is euclidean, which is flooring for positive divisors
    private com.microsoft.z3.Expr<IntSort> floorDiv(com.microsoft.z3.Expr<IntSort> a, long c) {
      if (c > 0) return z3.mkDiv(a, z3.mkInt(c));
      return z3.mkDiv(z3.mkUnaryMinus(a), z3.mkInt(-c));
    }

    private com.microsoft.z3.Expr<IntSort> truncDiv(com.microsoft.z3.Expr<IntSort> a, long c) {
      final long k = Math.abs(c);
      final com.microsoft.z3.Expr<IntSort> magnitude =
          z3.mkITE(
              z3.mkGe(a, z3.mkInt(0)),
              z3.mkDiv(a, z3.mkInt(k)),
              z3.mkUnaryMinus(z3.mkDiv(z3.mkUnaryMinus(a), z3.mkInt(k))));
      return c > 0 ? magnitude : z3.mkUnaryMinus(magnitude);
    }

    BoolExpr toBool(Expr e) {
      if (!e.type().isBool()) throw new UntranslatableException(e);
      return switch (e.kind()) {
        case INT_IMM -> z3.mkBool(e.constValue() != 0);
        case VAR -> boolVars.computeIfAbsent((Var) e, v -> z3.mkBoolConst(name(v)));
        case EQ, NE, LT, LE, GT, GE -> comparison((BinaryOp) e);
        case AND -> z3.mkAnd(toBool(((BinaryOp) e).a()), toBool(((BinaryOp) e).b()));
        case OR -> z3.mkOr(toBool(((BinaryOp) e).a()), toBool(((BinaryOp) e).b()));
        case NOT -> z3.mkNot(toBool(((NotOp) e).a()));
        case SELECT -> {
          final Select s = (Select) e;
          yield (BoolExpr) z3.mkITE(toBool(s.cond()), toBool(s.trueValue()), toBool(s.falseValue()));
        }
        default -> throw new UntranslatableException(e);
      };
    }

    private BoolExpr comparison(BinaryOp e) {
      if (e.a().type().isBool()) {
        final BoolExpr a = toBool(e.a()), b = toBool(e.b());
        return switch (e.kind()) {
          case EQ -> z3.mkEq(a, b);
          case NE -> z3.mkNot(z3.mkEq(a, b));
          default -> throw new UntranslatableException(e);
        };
      }
      final com.microsoft.z3.Expr<IntSort> a = toInt(e.a()), b = toInt(e.b());
      return switch (e.kind()) {
        case EQ -> z3.mkEq(a, b);
        case NE -> z3.mkNot(z3.mkEq(a, b));
        case LT -> z3.mkLt(a, b);
        case LE -> z3.mkLe(a, b);
        case GT -> z3.mkGt(a, b);
        default -> z3.mkGe(a, b);
      };
    }

    private static String name(Var v) {
      return v.name() + "#" + v.serial();
    }
  }
}
