package tecomp.common.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

public interface ListSupport {
  static <X, Y> List<Y> map(Collection<? extends X> xs, Function<? super X, ? extends Y> func) {
    final List<Y> ys = new ArrayList<>(xs.size());
    for (X x : xs) ys.add(func.apply(x));
    return ys;
  }

  static <X> List<X> concat(List<? extends X> xs, List<? extends X> ys) {
    final List<X> zs = new ArrayList<>(xs.size() + ys.size());
    zs.addAll(xs);
    zs.addAll(ys);
    return zs;
  }
}
