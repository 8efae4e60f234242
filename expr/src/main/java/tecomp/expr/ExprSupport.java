package tecomp.expr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

public abstract class ExprSupport {
  private ExprSupport() {}

  /** Replaces free occurrences of the mapped variables. Reduction axes are never substituted. */
  public static Expr substitute(Expr e, Map<Var, ? extends Expr> vmap) {
    if (vmap.isEmpty()) return e;
    return new Substituter(vmap).mutate(e);
  }

  public static List<Expr> substitute(List<Expr> exprs, Map<Var, ? extends Expr> vmap) {
    if (vmap.isEmpty()) return exprs;
    return new Substituter(vmap).mutateAll(exprs);
  }

  public static Range substitute(Range range, Map<Var, ? extends Expr> vmap) {
    return new Range(substitute(range.min(), vmap), substitute(range.extent(), vmap));
  }

  /** Free variables in order of first occurrence. */
  public static List<Var> freeVars(Expr e) {
    final Set<Var> vars = new LinkedHashSet<>();
    collectFreeVars(e, vars, Set.of());
    return new ArrayList<>(vars);
  }

  private static void collectFreeVars(Expr e, Set<Var> out, Set<Var> bound) {
    if (e instanceof Var v) {
      if (!bound.contains(v)) out.add(v);
      return;
    }
    if (e instanceof Reduce r) {
      final Set<Var> inner = new LinkedHashSet<>(bound);
      for (IterVar iv : r.axis()) {
        collectFreeVars(iv.dom().min(), out, bound);
        collectFreeVars(iv.dom().extent(), out, bound);
        inner.add(iv.var());
      }
      for (Expr src : r.source()) collectFreeVars(src, out, inner);
      collectFreeVars(r.condition(), out, inner);
      return;
    }
    for (Expr child : e.children()) collectFreeVars(child, out, bound);
  }

  public static boolean usesVar(Expr e, Predicate<Var> pred) {
    if (e instanceof Var v) return pred.test(v);
    for (Expr child : e.children()) if (usesVar(child, pred)) return true;
    return false;
  }

  public static boolean usesVar(Expr e, Var var) {
    return usesVar(e, v -> v == var);
  }

  public static boolean usesAnyVar(Expr e, Collection<Var> vars) {
    if (vars.isEmpty()) return false;
    return usesVar(e, vars::contains);
  }

  public static boolean containsReduce(Expr e) {
    if (e.kind() == ExprKind.REDUCE) return true;
    for (Expr child : e.children()) if (containsReduce(child)) return true;
    return false;
  }

  /** Flattens nested applications of {@code kind} (AND or OR) into a list of operands. */
  public static List<Expr> flatten(Expr e, ExprKind kind) {
    final List<Expr> out = new ArrayList<>();
    flatten0(e, kind, out);
    return out;
  }

  private static void flatten0(Expr e, ExprKind kind, List<Expr> out) {
    if (e.kind() == kind && e instanceof BinaryOp op) {
      flatten0(op.a(), kind, out);
      flatten0(op.b(), kind, out);
    } else {
      out.add(e);
    }
  }

  private static class Substituter extends ExprMutator {
    private final Map<Var, ? extends Expr> vmap;

    private Substituter(Map<Var, ? extends Expr> vmap) {
      this.vmap = vmap;
    }

    @Override
    protected Expr mutateVar(Var v) {
      final Expr replacement = vmap.get(v);
      return replacement == null ? v : replacement;
    }
  }
}
