package tecomp.zeroelim.domain;

import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.zeroelim.ZeContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkBool;
import static tecomp.expr.Expr.mkGe;
import static tecomp.expr.Expr.mkLt;
import static tecomp.expr.Expr.mkZero;

public abstract class DomainSupport {
  private DomainSupport() {}

  /**
   * {@code first} followed by {@code second}. The maps are substituted into each other and
   * simplified under the ranges of the domain they are expressed over.
   */
  public static DomainTransformation compose(
      DomainTransformation first, DomainTransformation second, ZeContext ctx) {
    checkArgument(
        second.oldDomain().equals(first.newDomain()),
        "cannot compose transformations over different domains: %s and %s",
        first.newDomain(),
        second.oldDomain());

    final Map<Var, Expr> newToOld = new HashMap<>();
    for (Map.Entry<Var, Expr> e : second.newToOld().entrySet()) {
      final Expr composed = ExprSupport.substitute(e.getValue(), first.newToOld());
      newToOld.put(e.getKey(), ctx.simplify(composed, first.oldDomain().ranges()));
    }
    final Map<Var, Expr> oldToNew = new HashMap<>();
    for (Map.Entry<Var, Expr> e : first.oldToNew().entrySet()) {
      final Expr composed = ExprSupport.substitute(e.getValue(), second.oldToNew());
      oldToNew.put(e.getKey(), ctx.simplify(composed, second.newDomain().ranges()));
    }
    return new DomainTransformation(second.newDomain(), first.oldDomain(), newToOld, oldToNew);
  }

  public static DomainTransformation id(Domain domain) {
    final Map<Var, Expr> vmap = new HashMap<>();
    for (Var v : domain.variables()) vmap.put(v, v);
    return new DomainTransformation(domain, domain, vmap, vmap);
  }

  /** The transformation into the canonical empty domain: no variables, condition {@code false}. */
  public static DomainTransformation empty(Domain domain) {
    final Map<Var, Expr> oldToNew = new HashMap<>();
    for (Var v : domain.variables()) oldToNew.put(v, mkZero(v.type()));
    final Domain newDomain = new Domain(List.of(), List.of(mkBool(false)), Map.of());
    return new DomainTransformation(newDomain, domain, Map.of(), oldToNew);
  }

  public static boolean isEmpty(Domain domain) {
    return domain.variables().isEmpty()
        && domain.conditions().size() == 1
        && domain.conditions().get(0).isFalse();
  }

  /** {@code min <= v} and {@code v < min + extent} for each axis variable. */
  public static List<Expr> iterVarsToInequalities(List<IterVar> axis) {
    final List<Expr> result = new ArrayList<>(axis.size() * 2);
    for (IterVar iv : axis) {
      result.add(mkGe(iv.var(), iv.dom().min()));
      result.add(mkLt(iv.var(), mkAdd(iv.dom().min(), iv.dom().extent())));
    }
    return result;
  }

  public static List<IterVar> iterVarsFromMap(List<Var> vars, Map<Var, Range> ranges) {
    final List<IterVar> axis = new ArrayList<>(vars.size());
    for (Var v : vars) {
      final Range range = ranges.get(v);
      checkArgument(range != null, "no range for variable %s in %s", v, ranges);
      axis.add(new IterVar(v, range));
    }
    return axis;
  }

  public static List<Var> iterVarsToVars(List<IterVar> axis) {
    final List<Var> vars = new ArrayList<>(axis.size());
    for (IterVar iv : axis) vars.add(iv.var());
    return vars;
  }
}
