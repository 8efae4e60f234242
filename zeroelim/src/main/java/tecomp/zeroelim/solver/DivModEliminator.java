package tecomp.zeroelim.solver;

import org.apache.commons.lang3.tuple.Pair;
import tecomp.expr.BinaryOp;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.ExprMutator;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Range;
import tecomp.expr.Reduce;
import tecomp.expr.Var;
import tecomp.expr.arith.Analyzer;
import tecomp.expr.arith.IntSet;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.ZeTracer;
import tecomp.zeroelim.domain.Domain;
import tecomp.zeroelim.domain.DomainSupport;
import tecomp.zeroelim.domain.DomainTransformation;
import tecomp.zeroelim.logic.FormulaSupport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import static tecomp.common.utils.ListSupport.concat;
import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkConst;
import static tecomp.expr.Expr.mkEq;
import static tecomp.expr.Expr.mkGe;
import static tecomp.expr.Expr.mkLe;
import static tecomp.expr.Expr.mkMul;
import static tecomp.expr.Expr.mkSelect;
import static tecomp.expr.Expr.mkSub;
import static tecomp.expr.Expr.mkZero;

/**
 * Replaces every {@code e / c} and {@code e % c} by a positive or negative constant {@code c}, for
 * both the truncating and the flooring flavour, with a fresh quotient and remainder variable.
 * Structurally equal dividends share their variables. A dividend whose bounds cannot be inferred
 * is left alone. One instance serves a single call.
 */
public class DivModEliminator extends ExprMutator {
  private static final Logger LOG = Logger.getLogger(DivModEliminator.class.getName());

  private enum Mode {
    TRUNC,
    FLOOR
  }

  private record Key(Mode mode, Expr dividend, long divisor) {}

  private final ZeContext ctx;
  private final Map<Var, Expr> substitution = new HashMap<>();
  private final List<Var> newVariables = new ArrayList<>();
  private final List<Expr> conditions = new ArrayList<>();
  private final Map<Var, Range> ranges;
  private final Map<Key, Pair<Var, Var>> exprToVars = new HashMap<>();
  private int idx;

  private DivModEliminator(Map<Var, Range> ranges, ZeContext ctx) {
    this.ranges = new TreeMap<>(ranges);
    this.ctx = ctx;
  }

  public static DivModResult eliminateDivMod(Expr expr, Map<Var, Range> ranges, ZeContext ctx) {
    final DivModEliminator eliminator = new DivModEliminator(ranges, ctx);
    final Expr result = eliminator.mutate(expr);
    return new DivModResult(
        result,
        eliminator.substitution,
        eliminator.newVariables,
        eliminator.conditions,
        eliminator.ranges);
  }

  /**
   * Eliminates div and mod from the conditions of {@code domain}. The fresh variables are appended
   * to the domain variables.
   */
  public static DomainTransformation eliminateDivModFromDomainConditions(
      Domain domain, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("eliminateDivModFromDomainConditions", domain);

    final DivModResult elim = eliminateDivMod(domain.condition(), domain.ranges(), ctx);
    final Expr newCond = FormulaSupport.and(elim.expr(), Expr.mkAnd(elim.conditions()));
    final Domain newDomain =
        Domain.of(concat(domain.variables(), elim.newVariables()), newCond, elim.ranges());

    final Map<Var, Expr> oldToNew = new HashMap<>();
    final Map<Var, Expr> newToOld = new HashMap<>(elim.substitution());
    for (Var v : domain.variables()) {
      oldToNew.put(v, v);
      newToOld.put(v, v);
    }
    return tracer.exit(new DomainTransformation(newDomain, domain, newToOld, oldToNew));
  }

  /**
   * Eliminates div and mod from the condition of a reduction. The fresh variables become new
   * reduction axes. Anything but a reduction is returned as is.
   */
  public static Expr eliminateDivModFromReductionCondition(
      Expr expr, Map<Var, Range> outerRanges, ZeContext ctx) {
    if (!(expr instanceof Reduce red)) return expr;
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("eliminateDivModFromReductionCondition", expr);

    final Map<Var, Range> vranges = new TreeMap<>(outerRanges);
    for (IterVar iv : red.axis()) vranges.put(iv.var(), iv.dom());

    final DivModResult elim = eliminateDivMod(red.condition(), vranges, ctx);
    final List<IterVar> newAxis =
        concat(red.axis(), DomainSupport.iterVarsFromMap(elim.newVariables(), elim.ranges()));
    final Expr newCond = FormulaSupport.and(elim.expr(), Expr.mkAnd(elim.conditions()));
    return tracer.exit(
        Reduce.mk(red.combiner(), red.source(), newAxis, newCond, red.valueIndex()));
  }

  @Override
  protected Expr mutateBinary(BinaryOp e) {
    if (!e.kind().isDivLike() || !e.type().isInt()) return super.mutateBinary(e);
    final Long c = e.b().constValue();
    if (c == null || c == 0) return super.mutateBinary(e);

    final Expr a = e.a();
    final Expr negC = mkConst(e.type(), -c);
    final Expr zero = mkZero(e.type());
    switch (e.kind()) {
      case DIV:
        // x / -c == -(x / c) when truncating
        if (c < 0) return mkSub(zero, mutate(Expr.mkDiv(a, negC)));
        return eliminate(e, Mode.TRUNC, c, true);
      case MOD:
        // x % -c == x % c when truncating
        if (c < 0) return mutate(Expr.mkMod(a, negC));
        return eliminate(e, Mode.TRUNC, c, false);
      case FLOOR_DIV:
        // x // -c == (-x) // c when flooring
        if (c < 0) return mutate(Expr.mkFloorDiv(mkSub(zero, a), negC));
        return eliminate(e, Mode.FLOOR, c, true);
      case FLOOR_MOD:
        // x %% -c == -((-x) %% c) when flooring
        if (c < 0) return mutate(mkSub(zero, Expr.mkFloorMod(mkSub(zero, a), negC)));
        return eliminate(e, Mode.FLOOR, c, false);
      default:
        throw new IllegalStateException("not a division: " + e);
    }
  }

  private Expr eliminate(BinaryOp e, Mode mode, long c, boolean quotient) {
    final Pair<Var, Var> known = exprToVars.get(new Key(mode, e.a(), c));
    if (known != null) return quotient ? known.getLeft() : known.getRight();

    final Expr mutated = mutate(e.a());
    final Pair<Var, Var> pair = addNewVarPair(e.a(), mutated, c, mode);
    if (pair != null) return quotient ? pair.getLeft() : pair.getRight();
    return Expr.mkBinary(e.kind(), mutated, e.b());
  }

  private static Expr divImpl(Expr a, Expr b, Mode mode) {
    return mode == Mode.TRUNC ? Expr.mkDiv(a, b) : Expr.mkFloorDiv(a, b);
  }

  private static Expr modImpl(Expr a, Expr b, Mode mode) {
    return mode == Mode.TRUNC ? Expr.mkMod(a, b) : Expr.mkFloorMod(a, b);
  }

  private Pair<Var, Var> addNewVarPair(Expr e, Expr mutated, long c, Mode mode) {
    if (mutated != e) {
      final Pair<Var, Var> known = exprToVars.get(new Key(mode, mutated, c));
      if (known != null) return known;
    }

    final Expr cExpr = mkConst(e.type(), c);
    ++idx;

    final Map<Var, IntSet> intSets = new HashMap<>();
    for (Map.Entry<Var, Range> entry : ranges.entrySet())
      intSets.put(entry.getKey(), IntSet.fromRange(entry.getValue()));

    final Analyzer analyzer = ctx.analyzer(ranges);
    final Range divRange =
        analyzer.evalSet(divImpl(mutated, cExpr, mode), intSets).coverRange(analyzer);
    final Range modRange =
        analyzer.evalSet(modImpl(mutated, cExpr, mode), intSets).coverRange(analyzer);
    if (divRange == null) {
      LOG.warning(
          () ->
              "won't eliminate "
                  + divImpl(e, cExpr, mode)
                  + " because its bounds cannot be inferred");
      return null;
    }
    if (modRange == null) {
      LOG.warning(
          () ->
              "won't eliminate "
                  + modImpl(e, cExpr, mode)
                  + " because its bounds cannot be inferred");
      return null;
    }

    final String prefix = mode == Mode.TRUNC ? "t" : "f";
    final Var div = Var.mk(prefix + "div" + idx, e.type());
    final Var mod = Var.mk(prefix + "mod" + idx, e.type());
    newVariables.add(div);
    newVariables.add(mod);

    // the dividend may itself mention variables introduced earlier
    final Expr original = ExprSupport.substitute(mutated, substitution);
    substitution.put(div, divImpl(original, cExpr, mode));
    substitution.put(mod, modImpl(original, cExpr, mode));
    ranges.put(div, divRange);
    ranges.put(mod, modRange);

    conditions.add(mkEq(mutated, mkAdd(mkMul(div, cExpr), mod)));

    if (!ctx.canProve(mkLe(modRange.extent(), cExpr), ranges)) {
      // the remainder is not determined by the equation alone when the dividend may change sign
      LOG.warning(
          () ->
              "cannot fully eliminate div or mod because "
                  + modImpl(e, cExpr, mode)
                  + " probably may change its sign");
      final Expr zero = mkZero(e.type());
      conditions.add(mkSelect(mkGe(mutated, zero), mkGe(mod, zero), mkLe(mod, zero)));
    }

    final Pair<Var, Var> pair = Pair.of(div, mod);
    exprToVars.put(new Key(mode, e, c), pair);
    if (mutated != e) exprToVars.put(new Key(mode, mutated, c), pair);
    return pair;
  }
}
