package tecomp.expr;

/** A reduction or compute axis: a variable together with the range it iterates. */
public record IterVar(Var var, Range dom) {
  public static IterVar mk(String name, long min, long extent) {
    return new IterVar(Var.mk(name), Range.mk(min, extent));
  }

  @Override
  public String toString() {
    return var.name() + " in " + dom;
  }
}
