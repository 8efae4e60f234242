package tecomp.zeroelim;

import tecomp.expr.CommReducer;
import tecomp.expr.Expr;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.expr.tensor.Tensor;
import tecomp.zeroelim.domain.Domain;
import tecomp.zeroelim.domain.DomainSimplifier;
import tecomp.zeroelim.domain.DomainTransformation;
import tecomp.zeroelim.extract.ReductionExtractor;
import tecomp.zeroelim.extract.TensorInliner;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Entry points of the pass for callers that do not carry a {@link ZeContext}. Each call builds
 * one from system properties and the environment.
 */
public interface ZeroElimSupport {
  static DomainTransformation simplifyDomain(Domain domain) {
    return DomainSimplifier.simplifyDomain(domain, ZeContext.fromSystem());
  }

  static Expr simplifyReductionDomain(Expr expr, Map<Var, Range> outerRanges) {
    return DomainSimplifier.simplifyReductionDomain(expr, outerRanges, ZeContext.fromSystem());
  }

  static Expr liftNonzeronessCondition(Expr expr) {
    return ZeroEliminator.liftNonzeronessCondition(expr, ZeContext.fromSystem());
  }

  static boolean isSumCombiner(CommReducer combiner, Map<Var, Range> ranges) {
    return ZeroEliminator.isSumCombiner(combiner, ranges, ZeContext.fromSystem());
  }

  static boolean canFactorZeroFromCombiner(
      CommReducer combiner, int valueIndex, Map<Var, Range> ranges) {
    return ZeroEliminator.canFactorZeroFromCombiner(
        combiner, valueIndex, ranges, ZeContext.fromSystem());
  }

  static Tensor inlineTailCall(Tensor tensor) {
    return TensorInliner.inlineTailCall(tensor);
  }

  static Tensor inlineTensors(
      Tensor tensor, Collection<Tensor> inlineable, boolean inlineReductions) {
    return TensorInliner.inlineTensors(tensor, inlineable, inlineReductions);
  }

  static Expr extractReductions(Expr expr, List<Var> outerAxis, Map<Var, Range> ranges) {
    return ReductionExtractor.extractReductions(expr, outerAxis, ranges, ZeContext.fromSystem());
  }

  static Tensor optimizeAndLiftNonzeronessConditions(Tensor tensor, Map<Var, Range> ranges) {
    return ZeroEliminator.optimizeAndLiftNonzeronessConditions(
        tensor, ranges, ZeContext.fromSystem());
  }
}
