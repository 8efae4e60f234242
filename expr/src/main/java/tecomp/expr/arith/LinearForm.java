package tecomp.expr.arith;

import tecomp.common.utils.Commons;
import tecomp.expr.Expr;
import tecomp.expr.ExprComparator;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import static java.util.Collections.unmodifiableNavigableMap;

/** {@code sum(coef * atom) + constant} with atoms kept in {@link ExprComparator} order. */
final class LinearForm {
  private static final LinearForm ZERO = new LinearForm(new TreeMap<>(ExprComparator.INSTANCE), 0);

  private final NavigableMap<Expr, Long> terms;
  private final long constant;

  private LinearForm(TreeMap<Expr, Long> terms, long constant) {
    this.terms = unmodifiableNavigableMap(terms);
    this.constant = constant;
  }

  static LinearForm constant(long c) {
    return c == 0 ? ZERO : new LinearForm(new TreeMap<>(ExprComparator.INSTANCE), c);
  }

  static LinearForm atom(Expr atom, long coef) {
    final TreeMap<Expr, Long> terms = new TreeMap<>(ExprComparator.INSTANCE);
    if (coef != 0) terms.put(atom, coef);
    return new LinearForm(terms, 0);
  }

  NavigableMap<Expr, Long> terms() {
    return terms;
  }

  long constant() {
    return constant;
  }

  boolean isConst() {
    return terms.isEmpty();
  }

  long coef(Expr atom) {
    return terms.getOrDefault(atom, 0L);
  }

  /** Coefficient of the first atom. Zero for constants. */
  long leadingCoef() {
    return terms.isEmpty() ? 0 : terms.firstEntry().getValue();
  }

  LinearForm add(LinearForm other) {
    final TreeMap<Expr, Long> sum = new TreeMap<>(terms);
    for (Map.Entry<Expr, Long> t : other.terms.entrySet()) {
      final long coef = Math.addExact(sum.getOrDefault(t.getKey(), 0L), t.getValue());
      if (coef == 0) sum.remove(t.getKey());
      else sum.put(t.getKey(), coef);
    }
    return new LinearForm(sum, Math.addExact(constant, other.constant));
  }

  LinearForm sub(LinearForm other) {
    return add(other.scale(-1));
  }

  LinearForm scale(long k) {
    if (k == 0) return ZERO;
    if (k == 1) return this;
    final TreeMap<Expr, Long> scaled = new TreeMap<>(ExprComparator.INSTANCE);
    for (Map.Entry<Expr, Long> t : terms.entrySet())
      scaled.put(t.getKey(), Math.multiplyExact(t.getValue(), k));
    return new LinearForm(scaled, Math.multiplyExact(constant, k));
  }

  LinearForm negate() {
    return scale(-1);
  }

  LinearForm plusConstant(long c) {
    if (c == 0) return this;
    return new LinearForm(new TreeMap<>(terms), Math.addExact(constant, c));
  }

  LinearForm withConstant(long c) {
    if (c == constant) return this;
    return new LinearForm(new TreeMap<>(terms), c);
  }

  /** Gcd of the term coefficients, or 0 when there are none. */
  long termContent() {
    long g = 0;
    for (long coef : terms.values()) g = Commons.gcd(g, coef);
    return g;
  }

  /** Gcd of the term coefficients and the constant. */
  long content() {
    return Commons.gcd(termContent(), constant);
  }

  /** Divides every coefficient and the constant; all must be multiples of {@code k}. */
  LinearForm divideExact(long k) {
    if (k == 1) return this;
    final TreeMap<Expr, Long> divided = new TreeMap<>(ExprComparator.INSTANCE);
    for (Map.Entry<Expr, Long> t : terms.entrySet()) divided.put(t.getKey(), t.getValue() / k);
    return new LinearForm(divided, constant / k);
  }

  /** Only the terms whose coefficient is a multiple of k, each divided by k. */
  LinearForm multiplesOf(long k) {
    final TreeMap<Expr, Long> picked = new TreeMap<>(ExprComparator.INSTANCE);
    for (Map.Entry<Expr, Long> t : terms.entrySet())
      if (t.getValue() % k == 0) picked.put(t.getKey(), t.getValue() / k);
    return new LinearForm(picked, 0);
  }

  /** The terms whose coefficient is not a multiple of k, without the constant. */
  LinearForm nonMultiplesOf(long k) {
    final TreeMap<Expr, Long> picked = new TreeMap<>(ExprComparator.INSTANCE);
    for (Map.Entry<Expr, Long> t : terms.entrySet())
      if (t.getValue() % k != 0) picked.put(t.getKey(), t.getValue());
    return new LinearForm(picked, 0);
  }

  LinearForm positivePart() {
    final TreeMap<Expr, Long> picked = new TreeMap<>(ExprComparator.INSTANCE);
    for (Map.Entry<Expr, Long> t : terms.entrySet())
      if (t.getValue() > 0) picked.put(t.getKey(), t.getValue());
    return new LinearForm(picked, 0);
  }

  LinearForm negativePart() {
    final TreeMap<Expr, Long> picked = new TreeMap<>(ExprComparator.INSTANCE);
    for (Map.Entry<Expr, Long> t : terms.entrySet())
      if (t.getValue() < 0) picked.put(t.getKey(), t.getValue());
    return new LinearForm(picked, 0);
  }

  LinearForm withoutAtom(Expr atom) {
    if (!terms.containsKey(atom)) return this;
    final TreeMap<Expr, Long> rest = new TreeMap<>(terms);
    rest.remove(atom);
    return new LinearForm(rest, constant);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LinearForm that)) return false;
    return constant == that.constant && terms.equals(that.terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode() * 31 + Long.hashCode(constant);
  }

  @Override
  public String toString() {
    return terms + " + " + constant;
  }
}
