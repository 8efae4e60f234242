package tecomp.zeroelim;

import tecomp.expr.Expr;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.expr.arith.Analyzer;
import tecomp.expr.arith.Prover;
import tecomp.expr.smt.SmtProver;

import java.util.Map;

/**
 * What every step of the pass needs besides its input: the configuration, the tracer, and the
 * oracle used to simplify and prove under variable ranges.
 */
public final class ZeContext {
  private final ZeConfig config;
  private final ZeTracer tracer;
  private final Prover prover;

  private ZeContext(ZeConfig config, ZeTracer tracer, Prover prover) {
    this.config = config;
    this.tracer = tracer;
    this.prover = prover;
  }

  public static ZeContext of(ZeConfig config) {
    final ZeTracer tracer =
        config.tracing() ? new LoggingTracer(config.traceStart(), config.traceEnd()) : ZeTracer.NOOP;
    final Prover prover = config.smt() ? new SmtProver(config.smtTimeoutMs()) : null;
    return new ZeContext(config, tracer, prover);
  }

  /** Configured from system properties and the environment. */
  public static ZeContext fromSystem() {
    return of(ZeConfig.fromSystem());
  }

  public static ZeContext defaults() {
    return of(ZeConfig.defaults());
  }

  public ZeContext withTracer(ZeTracer tracer) {
    return new ZeContext(config, tracer, prover);
  }

  public ZeContext withProver(Prover prover) {
    return new ZeContext(config, tracer, prover);
  }

  public ZeConfig config() {
    return config;
  }

  public ZeTracer tracer() {
    return tracer;
  }

  public Analyzer analyzer(Map<Var, Range> ranges) {
    final Analyzer analyzer = Analyzer.of(ranges);
    return prover == null ? analyzer : analyzer.withFallback(prover);
  }

  public Expr simplify(Expr e, Map<Var, Range> ranges) {
    return analyzer(ranges).simplify(e);
  }

  public Expr simplify(Expr e) {
    return simplify(e, Map.of());
  }

  public boolean canProve(Expr cond, Map<Var, Range> ranges) {
    return analyzer(ranges).canProve(cond);
  }

  public boolean canProve(Expr cond) {
    return canProve(cond, Map.of());
  }
}
