package tecomp.zeroelim.domain;

import tecomp.common.utils.Commons;
import tecomp.expr.Expr;
import tecomp.expr.Var;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A change of variables between two domains. {@code newToOld} expresses the new variables over the
 * old ones, {@code oldToNew} the old variables over the new ones.
 */
public record DomainTransformation(
    Domain newDomain, Domain oldDomain, Map<Var, Expr> newToOld, Map<Var, Expr> oldToNew) {
  public DomainTransformation {
    newToOld = Collections.unmodifiableMap(new TreeMap<>(newToOld));
    oldToNew = Collections.unmodifiableMap(new TreeMap<>(oldToNew));
  }

  @Override
  public String toString() {
    return "DomainTransformation(new_domain="
        + newDomain
        + ", old_domain="
        + oldDomain
        + ", new_to_old="
        + Commons.joining(newToOld, Var::toString)
        + ", old_to_new="
        + Commons.joining(oldToNew, Var::toString)
        + ")";
  }
}
