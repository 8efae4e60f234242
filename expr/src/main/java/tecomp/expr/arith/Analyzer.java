package tecomp.expr.arith;

import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.Range;
import tecomp.expr.Var;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Simplification and proving under a fixed map of variable ranges. Instances are immutable apart
 * from an internal rewrite cache, and are meant to be created per call, not shared across threads.
 */
public final class Analyzer {
  private static final int MAX_ROUNDS = 4;

  private final Map<Var, Range> ranges;
  private final Prover fallback;
  private Simplifier simplifier;

  private Analyzer(Map<Var, Range> ranges, Prover fallback) {
    this.ranges = Collections.unmodifiableMap(ranges);
    this.fallback = fallback;
  }

  public static Analyzer of(Map<Var, Range> ranges) {
    return new Analyzer(new TreeMap<>(ranges), null);
  }

  public static Analyzer empty() {
    return of(Map.of());
  }

  /** Same ranges; conditions the rewriter cannot decide are handed to {@code prover}. */
  public Analyzer withFallback(Prover prover) {
    return new Analyzer(new TreeMap<>(ranges), prover);
  }

  /** A new analyzer knowing additionally (or instead) the given ranges. */
  public Analyzer bind(Map<Var, Range> more) {
    final TreeMap<Var, Range> merged = new TreeMap<>(ranges);
    merged.putAll(more);
    return new Analyzer(merged, fallback);
  }

  public Map<Var, Range> ranges() {
    return ranges;
  }

  public Prover fallback() {
    return fallback;
  }

  private Simplifier simplifier() {
    if (simplifier == null) simplifier = new Simplifier(ranges);
    return simplifier;
  }

  /**
   * Substitutes variables whose range has extent one by the range minimum, then rewrites until a
   * fixpoint is reached.
   */
  public Expr simplify(Expr e) {
    final Map<Var, Expr> singletons = new HashMap<>();
    for (Map.Entry<Var, Range> entry : ranges.entrySet())
      if (entry.getValue().extent().isConst(1)) singletons.put(entry.getKey(), entry.getValue().min());

    Expr current = ExprSupport.substitute(e, singletons);
    for (int i = 0; i < MAX_ROUNDS; ++i) {
      final Expr next = simplifier().rewrite(current);
      if (next.equals(current)) return next;
      current = next;
    }
    return current;
  }

  public boolean canProve(Expr cond) {
    final Expr simplified = simplify(cond);
    if (simplified.isTrue()) return true;
    if (simplified.isFalse() || fallback == null) return false;
    return fallback.prove(simplified, ranges);
  }

  public ConstIntBound.Bound constBound(Expr e) {
    return simplifier().bounds().eval(simplify(e));
  }

  /** The symbolic interval {@code e} ranges over when the variables of {@code dom} vary. */
  public IntSet evalSet(Expr e, Map<Var, IntSet> dom) {
    return new IntSetEvaluator(this, dom).eval(e);
  }
}
