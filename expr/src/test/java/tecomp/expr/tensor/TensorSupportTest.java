package tecomp.expr.tensor;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tecomp.expr.DataType;
import tecomp.expr.Expr;
import tecomp.expr.ExprSupport;
import tecomp.expr.IterVar;
import tecomp.expr.Reduce;
import tecomp.expr.Var;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkInt;

@Tag("fast")
public class TensorSupportTest {
  @Test
  public void testPlaceholderCall() {
    final Tensor a = TensorSupport.placeholder("A", DataType.FLOAT, 10, 10);
    assertEquals(2, a.ndim());
    assertEquals(DataType.FLOAT, a.dtype());
    assertEquals("A(1, 2)", a.call(mkInt(1), mkInt(2)).toString());
    assertThrows(IllegalArgumentException.class, () -> a.call(mkInt(1)));
  }

  @Test
  public void testCloneReduction() {
    final Var i = Var.mk("i");
    final IterVar k = IterVar.mk("k", 0, 10);
    final Reduce sum = Reduce.mkSum(mkAdd(i, k.var()), List.of(k));
    final Reduce cloned = (Reduce) TensorSupport.cloneReduction(sum);
    assertNotSame(k.var(), cloned.axis().get(0).var());
    assertEquals("k", cloned.axis().get(0).var().name());
    assertFalse(ExprSupport.usesVar(cloned.source().get(0), k.var()));
    assertSame(sum.combiner(), cloned.combiner());
  }

  @Test
  public void testTensorFromExprAndTransformBody() {
    final IterVar i = IterVar.mk("i", 0, 4);
    final Tensor t = TensorSupport.tensorFromExpr(mkAdd(i.var(), mkInt(1)), List.of(i));
    assertEquals("extracted_tensor", t.name());
    final ComputeOp op = (ComputeOp) t.op();
    assertNotSame(i.var(), op.axis().get(0).var());

    assertSame(t, TensorSupport.transformBody(t, (body, axis) -> body));
    final Tensor changed = TensorSupport.transformBody(t, (body, axis) -> axis.get(0).var());
    final Expr body = ((ComputeOp) changed.op()).body().get(0);
    assertSame(op.axis().get(0).var(), body);
  }
}
