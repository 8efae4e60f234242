package tecomp.expr.arith;

import tecomp.common.utils.Commons;
import tecomp.expr.BinaryOp;
import tecomp.expr.Call;
import tecomp.expr.Cast;
import tecomp.expr.CommReducer;
import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.ExprComparator;
import tecomp.expr.ExprKind;
import tecomp.expr.ExprSupport;
import tecomp.expr.FloatImm;
import tecomp.expr.IterVar;
import tecomp.expr.NotOp;
import tecomp.expr.Range;
import tecomp.expr.Reduce;
import tecomp.expr.Select;
import tecomp.expr.Var;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import static tecomp.expr.ExprKind.AND;
import static tecomp.expr.ExprKind.EQ;
import static tecomp.expr.ExprKind.LE;
import static tecomp.expr.ExprKind.NE;
import static tecomp.expr.ExprKind.OR;
import static tecomp.expr.Expr.mkBool;
import static tecomp.expr.Expr.mkInt;

/**
 * Rewrites expressions into a canonical form under fixed variable ranges.
 *
 * <p>Integer arithmetic is normalized through {@link LinearForm}. Integer comparisons become either
 * {@code P <= N + c} or {@code P == N + c} (or {@code !=}) where P and N have positive coefficients
 * with gcd one and P's first atom is positive for (in)equalities. Conjunctions and disjunctions are
 * flattened, deduplicated and sorted; bounds on the same linear form are merged.
 */
final class Simplifier {
  private final Map<Var, Range> ranges;
  private final ConstIntBound bounds;
  private final Map<Expr, Expr> memo = new HashMap<>();

  Simplifier(Map<Var, Range> ranges) {
    this.ranges = ranges;
    this.bounds = new ConstIntBound(ranges);
  }

  ConstIntBound bounds() {
    return bounds;
  }

  Expr rewrite(Expr e) {
    if (e.kind().isConst() || e.kind() == ExprKind.VAR) return e;
    final Expr cached = memo.get(e);
    if (cached != null) return cached;
    final Expr result = rewrite0(e);
    memo.put(e, result);
    return result;
  }

  private Expr rewrite0(Expr e) {
    return switch (e.kind()) {
      case INT_IMM, FLOAT_IMM, VAR -> e;
      case ADD, SUB, MUL, DIV, MOD, FLOOR_DIV, FLOOR_MOD -> {
        if (e.type().isInt()) yield fromLinear(toLinear(e));
        if (e.type().isBool() && e.kind() == ExprKind.MUL) {
          final BinaryOp op = (BinaryOp) e;
          yield rewrite(Expr.mkAnd(op.a(), op.b()));
        }
        yield rewriteFloatArith((BinaryOp) e);
      }
      case MIN, MAX -> rewriteMinMax((BinaryOp) e);
      case EQ, NE, LT, LE, GT, GE -> rewriteComparison((BinaryOp) e);
      case AND -> rewriteAnd(e);
      case OR -> rewriteOr(e);
      case NOT -> rewriteNot((NotOp) e);
      case SELECT -> rewriteSelect((Select) e);
      case CAST -> rewriteCast((Cast) e);
      case CALL -> rewriteCall((Call) e);
      case REDUCE -> rewriteReduce((Reduce) e);
    };
  }

  // ---------------- linear arithmetic ----------------

  LinearForm toLinear(Expr e) {
    return switch (e.kind()) {
      case INT_IMM -> LinearForm.constant(e.constValue());
      case VAR -> LinearForm.atom(e, 1);
      case ADD -> toLinear(((BinaryOp) e).a()).add(toLinear(((BinaryOp) e).b()));
      case SUB -> toLinear(((BinaryOp) e).a()).sub(toLinear(((BinaryOp) e).b()));
      case MUL -> mulLinear(toLinear(((BinaryOp) e).a()), toLinear(((BinaryOp) e).b()));
      case DIV, MOD, FLOOR_DIV, FLOOR_MOD -> divModLinear((BinaryOp) e);
      default -> {
        final Expr r = rewrite(e);
        if (r.kind() != e.kind() && (r.kind().isArithmetic() || r.kind().isConst() || r.kind() == ExprKind.VAR))
          yield toLinear(r);
        yield LinearForm.atom(r, 1);
      }
    };
  }

  private LinearForm mulLinear(LinearForm a, LinearForm b) {
    if (a.isConst()) return b.scale(a.constant());
    if (b.isConst()) return a.scale(b.constant());
    final long ga = signedContent(a), gb = signedContent(b);
    Expr x = fromLinear(a.divideExact(ga)), y = fromLinear(b.divideExact(gb));
    if (ExprComparator.INSTANCE.compare(x, y) > 0) {
      final Expr tmp = x;
      x = y;
      y = tmp;
    }
    return LinearForm.atom(Expr.mkMul(x, y), Math.multiplyExact(ga, gb));
  }

  /** Content of the form, signed so that dividing by it makes the first coefficient positive. */
  private static long signedContent(LinearForm f) {
    final long g = f.content();
    return f.leadingCoef() < 0 ? -g : g;
  }

  private LinearForm divModLinear(BinaryOp e) {
    final ExprKind kind = e.kind();
    final LinearForm a = toLinear(e.a()), b = toLinear(e.b());
    if (!b.isConst() || b.constant() == 0)
      return LinearForm.atom(Expr.mkBinary(kind, fromLinear(a), fromLinear(b)), 1);

    final long c = b.constant();
    final boolean isDiv = kind == ExprKind.DIV || kind == ExprKind.FLOOR_DIV;
    if (a.isConst()) return LinearForm.constant(foldDivMod(kind, a.constant(), c));
    if (c == 1 || c == -1) return isDiv ? a.scale(c) : LinearForm.constant(0);

    boolean floor = kind == ExprKind.FLOOR_DIV || kind == ExprKind.FLOOR_MOD;
    if (!floor) {
      final ConstIntBound.Bound bound = boundOf(a);
      // truncation agrees with flooring on non-negative dividends
      if (c > 0 && bound.min() >= 0) floor = true;
      else if (bound.min() > -Math.abs(c) && bound.max() < Math.abs(c))
        return isDiv ? LinearForm.constant(0) : a;
      else return LinearForm.atom(Expr.mkBinary(kind, fromLinear(a), mkInt(c)), 1);
    }
    if (c < 0) return LinearForm.atom(Expr.mkBinary(kind, fromLinear(a), mkInt(c)), 1);

    // a = c * q + r where q collects the terms whose coefficients are multiples of c
    final LinearForm q = a.multiplesOf(c).plusConstant(Math.floorDiv(a.constant(), c));
    LinearForm r = a.nonMultiplesOf(c).plusConstant(Math.floorMod(a.constant(), c));
    final ConstIntBound.Bound rb = boundOf(r);
    if (rb.hasMin() && rb.hasMax()) {
      final long lo = Math.floorDiv(rb.min(), c), hi = Math.floorDiv(rb.max(), c);
      if (lo == hi) return isDiv ? q.plusConstant(lo) : r.plusConstant(-lo * c);
    }

    long divisor = c;
    final long g = Commons.gcd(r.content(), c);
    if (g > 1) {
      r = r.divideExact(g);
      divisor = c / g;
    }
    final Expr residual = fromLinear(r);
    if (isDiv) return q.add(LinearForm.atom(Expr.mkFloorDiv(residual, mkInt(divisor)), 1));
    return LinearForm.atom(Expr.mkFloorMod(residual, mkInt(divisor)), g);
  }

  static long foldDivMod(ExprKind kind, long a, long c) {
    return switch (kind) {
      case DIV -> a / c;
      case MOD -> a % c;
      case FLOOR_DIV -> Math.floorDiv(a, c);
      case FLOOR_MOD -> Math.floorMod(a, c);
      default -> throw new IllegalArgumentException(kind.toString());
    };
  }

  ConstIntBound.Bound boundOf(LinearForm f) {
    ConstIntBound.Bound result = ConstIntBound.Bound.single(f.constant());
    for (Map.Entry<Expr, Long> t : f.terms().entrySet())
      result = result.plus(bounds.eval(t.getKey()).scale(t.getValue()));
    return result;
  }

  Expr fromLinear(LinearForm f) {
    if (f.isConst()) return mkInt(f.constant());
    Expr acc = null;
    boolean constantUsed = false;
    for (Map.Entry<Expr, Long> t : f.terms().entrySet()) {
      if (t.getValue() <= 0) continue;
      final Expr term = t.getValue() == 1 ? t.getKey() : Expr.mkMul(t.getKey(), mkInt(t.getValue()));
      acc = acc == null ? term : Expr.mkAdd(acc, term);
    }
    if (acc == null && f.constant() > 0) {
      acc = mkInt(f.constant());
      constantUsed = true;
    }
    for (Map.Entry<Expr, Long> t : f.terms().entrySet()) {
      final long coef = t.getValue();
      if (coef >= 0) continue;
      if (acc == null) acc = Expr.mkMul(t.getKey(), mkInt(coef));
      else acc = Expr.mkSub(acc, coef == -1 ? t.getKey() : Expr.mkMul(t.getKey(), mkInt(-coef)));
    }
    if (!constantUsed && f.constant() > 0) acc = Expr.mkAdd(acc, mkInt(f.constant()));
    if (!constantUsed && f.constant() < 0) acc = Expr.mkSub(acc, mkInt(-f.constant()));
    return acc;
  }

  private Expr rewriteFloatArith(BinaryOp e) {
    final Expr a = rewrite(e.a()), b = rewrite(e.b());
    if (a instanceof FloatImm x && b instanceof FloatImm y) {
      final double u = x.value(), v = y.value();
      switch (e.kind()) {
        case ADD: return Expr.mkFloat(u + v);
        case SUB: return Expr.mkFloat(u - v);
        case MUL: return Expr.mkFloat(u * v);
        case DIV: if (v != 0) return Expr.mkFloat(u / v); break;
        default: break;
      }
    }
    if (e.type().isFloat()) {
      switch (e.kind()) {
        case ADD:
          if (a.isZero()) return b;
          if (b.isZero()) return a;
          break;
        case SUB:
          if (b.isZero()) return a;
          break;
        case MUL:
          if (a.isZero() || b.isZero()) return Expr.mkZero(e.type());
          if (a.isConst(1)) return b;
          if (b.isConst(1)) return a;
          break;
        case DIV:
          if (b.isConst(1)) return a;
          if (a.isZero()) return a;
          break;
        default:
          break;
      }
    }
    if (a == e.a() && b == e.b()) return e;
    return Expr.mkBinary(e.kind(), a, b);
  }

  private Expr rewriteMinMax(BinaryOp e) {
    final boolean isMin = e.kind() == ExprKind.MIN;
    Expr a = rewrite(e.a()), b = rewrite(e.b());
    if (a.equals(b)) return a;
    if (a instanceof FloatImm x && b instanceof FloatImm y)
      return Expr.mkFloat(isMin ? Math.min(x.value(), y.value()) : Math.max(x.value(), y.value()));
    if (e.type().isInt()) {
      final ConstIntBound.Bound diff = boundOf(toLinear(a).sub(toLinear(b)));
      if (diff.max() <= 0) return isMin ? a : b;
      if (diff.min() >= 0) return isMin ? b : a;
    }
    if (ExprComparator.INSTANCE.compare(a, b) > 0) {
      final Expr tmp = a;
      a = b;
      b = tmp;
    }
    return Expr.mkBinary(e.kind(), a, b);
  }

  // ---------------- comparisons ----------------

  private Expr rewriteComparison(BinaryOp e) {
    if (e.a().type().isInt())
      return rewriteIntComparison(e.kind(), toLinear(e.a()).sub(toLinear(e.b())));

    final Expr a = rewrite(e.a()), b = rewrite(e.b());
    if (a.kind().isConst() && b.kind().isConst()) {
      final double u = constAsDouble(a), v = constAsDouble(b);
      return mkBool(
          switch (e.kind()) {
            case EQ -> u == v;
            case NE -> u != v;
            case LT -> u < v;
            case LE -> u <= v;
            case GT -> u > v;
            default -> u >= v;
          });
    }
    if (a.type().isBool()) {
      if (e.kind() == EQ && b.isTrue() || e.kind() == NE && b.isFalse()) return a;
      if (e.kind() == EQ && a.isTrue() || e.kind() == NE && a.isFalse()) return b;
      if (e.kind() == EQ && b.isFalse() || e.kind() == NE && b.isTrue()) return rewrite(Expr.mkNot(a));
      if (e.kind() == EQ && a.isFalse() || e.kind() == NE && a.isTrue()) return rewrite(Expr.mkNot(b));
    }
    if (a == e.a() && b == e.b()) return e;
    return Expr.mkBinary(e.kind(), a, b);
  }

  private static double constAsDouble(Expr e) {
    return e instanceof FloatImm f ? f.value() : e.constValue();
  }

  /** Canonical form of {@code d kind 0}. */
  Expr rewriteIntComparison(ExprKind kind, LinearForm d) {
    switch (kind) {
      case GT -> {
        kind = ExprKind.LE;
        d = d.negate().plusConstant(1);
      }
      case GE -> {
        kind = ExprKind.LE;
        d = d.negate();
      }
      case LT -> {
        kind = ExprKind.LE;
        d = d.plusConstant(1);
      }
      default -> {}
    }

    final ConstIntBound.Bound bound = boundOf(d);
    if (kind == LE) {
      if (bound.max() <= 0) return mkBool(true);
      if (bound.min() > 0) return mkBool(false);
    } else {
      final boolean isEq = kind == EQ;
      if (bound.min() > 0 || bound.max() < 0) return mkBool(!isEq);
      if (bound.min() == 0 && bound.max() == 0) return mkBool(isEq);
    }

    final long g = d.termContent();
    if (kind == LE) {
      d = d.withConstant(0).divideExact(g).withConstant(-Math.floorDiv(-d.constant(), g));
    } else {
      if (d.constant() % g != 0) return mkBool(kind == NE);
      d = d.divideExact(g);
      if (d.leadingCoef() < 0) d = d.negate();
    }

    final LinearForm pos = d.positivePart(), neg = d.negativePart().negate();
    final long c = d.constant();
    if (kind == LE) {
      if (pos.isConst()) return Expr.mkLe(mkInt(c), fromLinear(neg));
      return Expr.mkLe(fromLinear(pos), fromLinear(neg.plusConstant(-c)));
    }
    return Expr.mkBinary(kind, fromLinear(pos), fromLinear(neg.plusConstant(-c)));
  }

  /** Recovers {@code d} from a canonical integer comparison {@code lhs op rhs}, as lhs - rhs. */
  private LinearForm comparisonForm(BinaryOp cmp) {
    return toLinear(cmp.a()).sub(toLinear(cmp.b()));
  }

  private static boolean isIntComparison(Expr e) {
    return e.kind().isComparison() && ((BinaryOp) e).a().type().isInt();
  }

  // ---------------- logic ----------------

  private Expr rewriteNot(NotOp e) {
    final Expr a = rewrite(e.a());
    if (a.isTrue()) return mkBool(false);
    if (a.isFalse()) return mkBool(true);
    if (a instanceof NotOp inner) return inner.a();
    if (isIntComparison(a))
      return rewriteIntComparison(a.kind().negated(), comparisonForm((BinaryOp) a));
    if (a.kind() == EQ || a.kind() == NE) {
      final BinaryOp cmp = (BinaryOp) a;
      return Expr.mkBinary(a.kind().negated(), cmp.a(), cmp.b());
    }
    if (a.kind() == AND) {
      final List<Expr> negated = new ArrayList<>();
      for (Expr x : ExprSupport.flatten(a, AND)) negated.add(Expr.mkNot(x));
      return rewrite(Expr.mkOr(negated));
    }
    if (a.kind() == OR) {
      final List<Expr> negated = new ArrayList<>();
      for (Expr x : ExprSupport.flatten(a, OR)) negated.add(Expr.mkNot(x));
      return rewrite(Expr.mkAnd(negated));
    }
    return a == e.a() ? e : Expr.mkNot(a);
  }

  private Expr rewriteAnd(Expr e) {
    final TreeSet<Expr> operands = new TreeSet<>(ExprComparator.INSTANCE);
    for (Expr x : ExprSupport.flatten(e, AND)) {
      for (Expr y : ExprSupport.flatten(rewrite(x), AND)) {
        if (y.isFalse()) return mkBool(false);
        if (!y.isTrue()) operands.add(y);
      }
    }
    for (Expr x : operands)
      if (x instanceof NotOp not && operands.contains(not.a())) return mkBool(false);
    // absorption: a && (a || b) = a
    operands.removeIf(x -> x.kind() == OR && containsAny(ExprSupport.flatten(x, OR), operands, x));

    if (!mergeBounds(operands, true)) return mkBool(false);
    return Expr.mkAnd(new ArrayList<>(operands));
  }

  private Expr rewriteOr(Expr e) {
    final TreeSet<Expr> operands = new TreeSet<>(ExprComparator.INSTANCE);
    for (Expr x : ExprSupport.flatten(e, OR)) {
      for (Expr y : ExprSupport.flatten(rewrite(x), OR)) {
        if (y.isTrue()) return mkBool(true);
        if (!y.isFalse()) operands.add(y);
      }
    }
    for (Expr x : operands)
      if (x instanceof NotOp not && operands.contains(not.a())) return mkBool(true);
    // absorption: a || (a && b) = a
    operands.removeIf(x -> x.kind() == AND && containsAny(ExprSupport.flatten(x, AND), operands, x));

    if (!mergeBounds(operands, false)) return mkBool(true);
    return Expr.mkOr(new ArrayList<>(operands));
  }

  private static boolean containsAny(List<Expr> parts, TreeSet<Expr> set, Expr self) {
    for (Expr p : parts) if (p != self && set.contains(p)) return true;
    return false;
  }

  /** Bounds on one primitive linear form {@code key}, collected from several comparisons. */
  private static final class BoundGroup {
    final List<Expr> members = new ArrayList<>();
    final List<Long> excluded = new ArrayList<>();
    long lo = ConstIntBound.NEG_INF, hi = ConstIntBound.POS_INF;
    // for disjunctions: the loosest bounds seen
    long orLo = ConstIntBound.POS_INF, orHi = ConstIntBound.NEG_INF;
    boolean hasEq;
  }

  /**
   * Merges the integer comparisons of a flattened conjunction (or disjunction) that constrain the
   * same linear form. Returns false when the conjunction is unsatisfiable (or the disjunction is a
   * tautology).
   */
  private boolean mergeBounds(TreeSet<Expr> operands, boolean isAnd) {
    final TreeMap<Expr, BoundGroup> groups = new TreeMap<>(ExprComparator.INSTANCE);
    for (Expr x : operands) {
      if (!isIntComparison(x)) continue;
      if (!isAnd && x.kind() != LE) continue;
      final LinearForm d = comparisonForm((BinaryOp) x);
      final long g = d.termContent();
      if (g == 0) continue;
      final long s = d.leadingCoef() > 0 ? 1 : -1;
      final LinearForm key = d.withConstant(0).divideExact(s * g);
      final long c = d.constant();
      if (x.kind() != LE && c % g != 0) continue;
      final BoundGroup group = groups.computeIfAbsent(fromLinear(key), k -> new BoundGroup());
      group.members.add(x);

      // d = s*g*key + c
      switch (x.kind()) {
        case LE -> {
          if (s > 0) {
            final long hi = Math.floorDiv(-c, g);
            group.hi = Math.min(group.hi, hi);
            group.orHi = Math.max(group.orHi, hi);
          } else {
            final long lo = -Math.floorDiv(-c, g);
            group.lo = Math.max(group.lo, lo);
            group.orLo = Math.min(group.orLo, lo);
          }
        }
        case EQ, NE -> {
          final long v = -c / (s * g);
          if (x.kind() == EQ) {
            group.lo = Math.max(group.lo, v);
            group.hi = Math.min(group.hi, v);
            group.hasEq = true;
          } else {
            group.excluded.add(v);
          }
        }
        default -> {}
      }
    }

    for (Map.Entry<Expr, BoundGroup> entry : groups.entrySet()) {
      final BoundGroup group = entry.getValue();
      if (group.members.size() < 2) continue;
      final LinearForm key = toLinear(entry.getKey());
      if (isAnd) {
        long lo = group.lo, hi = group.hi;
        final TreeSet<Long> excluded = new TreeSet<>(group.excluded);
        while (lo != ConstIntBound.NEG_INF && excluded.remove(lo)) ++lo;
        while (hi != ConstIntBound.POS_INF && excluded.remove(hi)) --hi;
        if (lo > hi) return false;
        operands.removeAll(group.members);
        if (lo == hi) {
          addOperand(operands, rewriteIntComparison(EQ, key.plusConstant(-lo)), true);
          continue;
        }
        if (lo != ConstIntBound.NEG_INF)
          addOperand(operands, rewriteIntComparison(LE, key.negate().plusConstant(lo)), true);
        if (hi != ConstIntBound.POS_INF)
          addOperand(operands, rewriteIntComparison(LE, key.plusConstant(-hi)), true);
        for (long v : excluded)
          if (v > lo && v < hi) addOperand(operands, rewriteIntComparison(NE, key.plusConstant(-v)), true);
      } else {
        final long lo = group.orLo, hi = group.orHi;
        if (lo != ConstIntBound.POS_INF && hi != ConstIntBound.NEG_INF && lo <= hi + 1) return false;
        operands.removeAll(group.members);
        if (lo != ConstIntBound.POS_INF)
          addOperand(operands, rewriteIntComparison(LE, key.negate().plusConstant(lo)), false);
        if (hi != ConstIntBound.NEG_INF)
          addOperand(operands, rewriteIntComparison(LE, key.plusConstant(-hi)), false);
      }
    }
    return true;
  }

  private static void addOperand(TreeSet<Expr> operands, Expr x, boolean isAnd) {
    // neutral elements vanish; absorbing ones are impossible here since bounds were checked
    if (isAnd ? x.isTrue() : x.isFalse()) return;
    operands.add(x);
  }

  // ---------------- the rest ----------------

  private Expr rewriteSelect(Select e) {
    final Expr cond = rewrite(e.cond());
    if (cond.isTrue()) return rewrite(e.trueValue());
    if (cond.isFalse()) return rewrite(e.falseValue());
    final Expr t = rewrite(e.trueValue()), f = rewrite(e.falseValue());
    if (t.equals(f)) return t;
    if (e.type().isBool()) {
      if (t.isTrue() && f.isFalse()) return cond;
      if (t.isFalse()) return rewrite(Expr.mkAnd(Expr.mkNot(cond), f));
      if (f.isFalse()) return rewrite(Expr.mkAnd(cond, t));
      if (t.isTrue()) return rewrite(Expr.mkOr(cond, f));
      if (f.isTrue()) return rewrite(Expr.mkOr(Expr.mkNot(cond), t));
    }
    if (cond == e.cond() && t == e.trueValue() && f == e.falseValue()) return e;
    return Expr.mkSelect(cond, t, f);
  }

  private Expr rewriteCast(Cast e) {
    final Expr v = rewrite(e.value());
    final DataType target = e.type();
    if (v.type() == target) return v;
    if (v.kind() == ExprKind.INT_IMM) {
      final long x = v.constValue();
      return target.isFloat() ? Expr.mkFloat(x) : Expr.mkConst(target, x);
    }
    if (v instanceof FloatImm f) {
      return target.isBool() ? mkBool(f.value() != 0) : mkInt((long) f.value());
    }
    return v == e.value() ? e : Expr.mkCast(target, v);
  }

  private Expr rewriteCall(Call e) {
    final List<Expr> args = new ArrayList<>(e.args().size());
    boolean changed = false;
    for (Expr arg : e.args()) {
      final Expr r = rewrite(arg);
      changed |= r != arg;
      args.add(r);
    }
    if (e.isIfThenElse()) {
      if (args.get(0).isTrue()) return args.get(1);
      if (args.get(0).isFalse()) return args.get(2);
      if (args.get(1).equals(args.get(2))) return args.get(1);
    }
    return changed ? e.withArgs(args) : e;
  }

  private Expr rewriteReduce(Reduce e) {
    final List<IterVar> axis = new ArrayList<>(e.axis().size());
    final Map<Var, Range> innerRanges = new TreeMap<>(ranges);
    for (IterVar iv : e.axis()) {
      final Range dom = new Range(rewrite(iv.dom().min()), rewrite(iv.dom().extent()));
      final Long extent = dom.extent().constValue();
      if (extent != null && extent <= 0) return rewrite(e.combiner().identity().get(e.valueIndex()));
      axis.add(dom.equals(iv.dom()) ? iv : new IterVar(iv.var(), dom));
      innerRanges.put(iv.var(), dom);
    }

    final CommReducer combiner = rewriteCombiner(e.combiner());
    final Simplifier inner = new Simplifier(innerRanges);
    final Expr cond = inner.rewrite(e.condition());
    final Expr identity = combiner.identity().get(e.valueIndex());
    if (cond.isFalse()) return identity;

    final List<Expr> source = new ArrayList<>(e.source().size());
    for (Expr src : e.source()) source.add(inner.rewrite(src));

    if (axis.isEmpty()) {
      final Map<Var, Expr> vmap = new HashMap<>();
      for (int i = 0; i < combiner.arity(); ++i) {
        vmap.put(combiner.lhs().get(i), combiner.identity().get(i));
        vmap.put(combiner.rhs().get(i), source.get(i));
      }
      final Expr combined = ExprSupport.substitute(combiner.result().get(e.valueIndex()), vmap);
      return rewrite(Expr.mkSelect(cond, combined, identity));
    }

    final Reduce result = Reduce.mk(combiner, source, axis, cond, e.valueIndex());
    return result.equals(e) ? e : result;
  }

  private CommReducer rewriteCombiner(CommReducer combiner) {
    final List<Expr> result = new ArrayList<>(), identity = new ArrayList<>();
    for (Expr x : combiner.result()) result.add(rewrite(x));
    for (Expr x : combiner.identity()) identity.add(rewrite(x));
    if (result.equals(combiner.result()) && identity.equals(combiner.identity())) return combiner;
    return combiner.withBodies(result, identity);
  }
}
