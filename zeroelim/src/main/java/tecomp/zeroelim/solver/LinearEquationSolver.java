package tecomp.zeroelim.solver;

import tecomp.expr.BinaryOp;
import tecomp.expr.Expr;
import tecomp.expr.ExprKind;
import tecomp.expr.ExprSupport;
import tecomp.expr.Range;
import tecomp.expr.Var;
import tecomp.expr.arith.Analyzer;
import tecomp.expr.arith.IntSet;
import tecomp.expr.arith.LinearSupport;
import tecomp.expr.arith.LinearSupport.LinearEquation;
import tecomp.zeroelim.ZeContext;
import tecomp.zeroelim.ZeTracer;
import tecomp.zeroelim.domain.Domain;
import tecomp.zeroelim.domain.DomainSupport;
import tecomp.zeroelim.domain.DomainTransformation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static tecomp.expr.Expr.mkAdd;
import static tecomp.expr.Expr.mkConst;
import static tecomp.expr.Expr.mkEq;
import static tecomp.expr.Expr.mkFloorDiv;
import static tecomp.expr.Expr.mkFloorMod;
import static tecomp.expr.Expr.mkLe;
import static tecomp.expr.Expr.mkLt;
import static tecomp.expr.Expr.mkMul;
import static tecomp.expr.Expr.mkSub;
import static tecomp.expr.Expr.mkZero;

/**
 * Solves the linear equalities among the conditions of a domain over the integers.
 *
 * <p>The coefficient matrix is brought to diagonal form (Smith-like, without the divisibility
 * chain) by unimodular row and column operations. Row operations are mirrored on the right hand
 * sides, column operations on the change of variables. A zero diagonal entry leaves its variable
 * free; any other entry determines its variable, provided it divides the right hand side.
 */
public class LinearEquationSolver {
  private final Domain domain;
  private final ZeContext ctx;
  private final int nVars;

  private final List<long[]> matrix = new ArrayList<>();
  private final List<Expr> rhs = new ArrayList<>();
  // row i: the old variable i as a combination of the new ones
  private final long[][] oldToNew;
  // entry j: the new variable j expressed over the old ones
  private final Expr[] newToOld;
  private final List<Expr> rest = new ArrayList<>();

  private LinearEquationSolver(Domain domain, ZeContext ctx) {
    this.domain = domain;
    this.ctx = ctx;
    this.nVars = domain.variables().size();
    this.oldToNew = new long[nVars][nVars];
    this.newToOld = new Expr[nVars];
    for (int i = 0; i < nVars; ++i) {
      oldToNew[i][i] = 1;
      newToOld[i] = domain.variables().get(i);
    }
  }

  public static DomainTransformation solve(Domain domain, ZeContext ctx) {
    final ZeTracer tracer = ctx.tracer();
    tracer.enter("solveSystemOfEquations", domain);
    return tracer.exit(new LinearEquationSolver(domain, ctx).solve());
  }

  /** Returns {@code (g, s, t)} with {@code g == s*a + t*b} and {@code g} dividing both. */
  static long[] xgcd(long a, long b) {
    long s = 0, oldS = 1;
    long t = 1, oldT = 0;
    long r = b, oldR = a;
    while (r != 0) {
      final long q = oldR / r;
      long tmp = r;
      r = oldR - q * r;
      oldR = tmp;
      tmp = s;
      s = oldS - q * s;
      oldS = tmp;
      tmp = t;
      t = oldT - q * t;
      oldT = tmp;
    }
    return new long[] {oldR, oldS, oldT};
  }

  private Expr simplify(Expr e) {
    return ctx.simplify(e, domain.ranges());
  }

  private void buildRows() {
    for (Expr formula : domain.conditions()) {
      if (formula.kind() == ExprKind.EQ && nVars > 0) {
        final BinaryOp eq = (BinaryOp) formula;
        final LinearEquation lin =
            LinearSupport.detectLinearEquation(
                simplify(mkSub(eq.a(), eq.b())), domain.variables());
        if (lin != null) {
          final long[] row = new long[nVars];
          for (int j = 0; j < nVars; ++j) row[j] = lin.coefs().get(j);
          matrix.add(row);
          rhs.add(mkSub(mkZero(lin.base().type()), lin.base()));
          continue;
        }
      }
      rest.add(formula);
    }
  }

  private void diagonalize() {
    for (int index = 0; index < Math.min(matrix.size(), nVars); ++index) {
      // rows and columns before index are already diagonal

      // the row with the smallest nonzero entry in this column goes to the diagonal
      int bestI = index;
      for (int i = bestI; i < matrix.size(); ++i) {
        final long mOld = matrix.get(bestI)[index], mNew = matrix.get(i)[index];
        if (mNew != 0 && (mOld == 0 || Math.abs(mNew) < Math.abs(mOld))) bestI = i;
      }
      Collections.swap(matrix, index, bestI);
      Collections.swap(rhs, index, bestI);

      final long[] pivotRow = matrix.get(index);
      if (pivotRow[index] == 0) {
        for (int j = index + 1; j < nVars; ++j) {
          if (pivotRow[j] != 0) {
            swapColumns(index, j);
            break;
          }
        }
      }
      // both the row and the column are zero
      if (pivotRow[index] == 0) continue;

      eliminateBelow(index);
      if (eliminateRight(index)) {
        // a column operation may have refilled the column below the diagonal
        --index;
      }
    }
  }

  private void swapColumns(int a, int b) {
    for (int i = a; i < matrix.size(); ++i) {
      final long[] row = matrix.get(i);
      final long tmp = row[a];
      row[a] = row[b];
      row[b] = tmp;
    }
    final Expr tmp = newToOld[a];
    newToOld[a] = newToOld[b];
    newToOld[b] = tmp;
    for (long[] row : oldToNew) {
      final long t = row[a];
      row[a] = row[b];
      row[b] = t;
    }
  }

  private void eliminateBelow(int index) {
    final long[] pivot = matrix.get(index);
    for (int i = index + 1; i < matrix.size(); ++i) {
      final long[] row = matrix.get(i);
      if (row[index] == 0) continue;

      final long g, a, b;
      if (row[index] % pivot[index] != 0) {
        final long[] r = xgcd(pivot[index], row[index]);
        g = r[0];
        a = r[1];
        b = r[2];
      } else {
        // keep the pivot row as is, or the loop would not terminate
        g = pivot[index];
        a = 1;
        b = 0;
      }

      // [a n/g; b -m/g] is unimodular and zeroes row[index]
      final long mG = pivot[index] / g, nG = row[index] / g;
      for (int j = index; j < nVars; ++j) {
        final long newPivotJ = a * pivot[j] + b * row[j];
        final long newRowJ = nG * pivot[j] - mG * row[j];
        pivot[j] = newPivotJ;
        row[j] = newRowJ;
      }

      final Expr rIndex = rhs.get(index), rI = rhs.get(i);
      final Expr newRIndex =
          mkAdd(mkMul(mkConst(rIndex.type(), a), rIndex), mkMul(mkConst(rI.type(), b), rI));
      final Expr newRI =
          mkSub(mkMul(mkConst(rIndex.type(), nG), rIndex), mkMul(mkConst(rI.type(), mG), rI));
      rhs.set(index, newRIndex);
      rhs.set(i, newRI);
    }
  }

  private boolean eliminateRight(int index) {
    final long[] pivot = matrix.get(index);
    boolean changed = false;
    for (int j = index + 1; j < nVars; ++j) {
      if (pivot[j] == 0) continue;

      final long g, a, b;
      if (pivot[j] % pivot[index] != 0) {
        final long[] r = xgcd(pivot[index], pivot[j]);
        g = r[0];
        a = r[1];
        b = r[2];
        changed = true;
      } else {
        g = pivot[index];
        a = 1;
        b = 0;
      }

      final long mG = pivot[index] / g, nG = pivot[j] / g;
      for (int i = index; i < matrix.size(); ++i) {
        final long[] row = matrix.get(i);
        final long newIIndex = a * row[index] + b * row[j];
        final long newIJ = nG * row[index] - mG * row[j];
        row[index] = newIIndex;
        row[j] = newIJ;
      }
      for (long[] row : oldToNew) {
        final long newIIndex = a * row[index] + b * row[j];
        final long newIJ = nG * row[index] - mG * row[j];
        row[index] = newIIndex;
        row[j] = newIJ;
      }

      // the inverse column operation [m/g n/g; b -a] applies to the new variables
      final Expr ntoIndex = newToOld[index], ntoJ = newToOld[j];
      newToOld[index] =
          mkAdd(mkMul(mkConst(ntoIndex.type(), mG), ntoIndex), mkMul(mkConst(ntoJ.type(), nG), ntoJ));
      newToOld[j] =
          mkSub(mkMul(mkConst(ntoIndex.type(), b), ntoIndex), mkMul(mkConst(ntoJ.type(), a), ntoJ));
    }
    return changed;
  }

  private DomainTransformation solve() {
    buildRows();
    diagonalize();

    for (int i = 0; i < rhs.size(); ++i) rhs.set(i, simplify(rhs.get(i)));

    final List<Expr> conditions = new ArrayList<>();
    for (int j = 0; j < matrix.size(); ++j) {
      final Expr r = rhs.get(j);
      Expr cond;
      if (j >= nVars || matrix.get(j)[j] == 0) {
        cond = mkEq(r, mkZero(r.type()));
      } else {
        final long d = Math.abs(matrix.get(j)[j]);
        cond = mkEq(mkFloorMod(r, mkConst(r.type(), d)), mkZero(r.type()));
      }
      cond = simplify(cond);
      if (cond.isFalse()) return DomainSupport.empty(domain);
      if (!cond.isTrue()) conditions.add(cond);
    }

    final List<Var> newVars = new ArrayList<>();
    final Map<Var, Expr> newToOldMap = new HashMap<>();
    final List<Expr> solution = new ArrayList<>(nVars);
    for (int j = 0; j < nVars; ++j) {
      if (j >= matrix.size() || matrix.get(j)[j] == 0) {
        final Expr toOld = simplify(newToOld[j]);
        String name = "n" + newVars.size();
        if (toOld instanceof Var v) name += "_" + v.name();
        final Var v = Var.mk(name, newToOld[j].type());
        solution.add(v);
        newVars.add(v);
        newToOldMap.put(v, toOld);
      } else {
        final long d = matrix.get(j)[j];
        final Expr r = rhs.get(j);
        if (d >= 0) solution.add(simplify(mkFloorDiv(r, mkConst(r.type(), d))));
        else solution.add(simplify(mkFloorDiv(mkSub(mkZero(r.type()), r), mkConst(r.type(), -d))));
      }
    }

    final Map<Var, Expr> oldToNewMap = new HashMap<>();
    for (int i = 0; i < nVars; ++i) {
      final Var old = domain.variables().get(i);
      Expr e = mkZero(old.type());
      for (int j = 0; j < nVars; ++j)
        e = mkAdd(e, mkMul(mkConst(old.type(), oldToNew[i][j]), solution.get(j)));
      oldToNewMap.put(old, ctx.simplify(e));
    }

    final Set<Var> domainVars = new HashSet<>(domain.variables());
    final Map<Var, Range> ranges = new TreeMap<>();
    final Map<Var, IntSet> intSets = new HashMap<>();
    for (Map.Entry<Var, Range> entry : domain.ranges().entrySet()) {
      if (!domainVars.contains(entry.getKey())) ranges.put(entry.getKey(), entry.getValue());
      intSets.put(entry.getKey(), IntSet.fromRange(entry.getValue()));
    }

    final Analyzer analyzer = ctx.analyzer(domain.ranges());
    for (Map.Entry<Var, Expr> entry : newToOldMap.entrySet()) {
      final Range range = analyzer.evalSet(entry.getValue(), intSets).coverRange(analyzer);
      if (range != null) ranges.put(entry.getKey(), range);
    }

    // the new ranges alone rarely imply the old ones
    for (Map.Entry<Var, Range> entry : domain.ranges().entrySet()) {
      final Expr inNew = oldToNewMap.get(entry.getKey());
      if (inNew == null) continue;
      final Range range = entry.getValue();
      final Expr lower = ctx.simplify(mkLe(range.min(), inNew), ranges);
      final Expr upper = ctx.simplify(mkLt(inNew, mkAdd(range.min(), range.extent())), ranges);
      if (!lower.isTrue()) conditions.add(lower);
      if (!upper.isTrue()) conditions.add(upper);
    }

    for (Expr cond : rest) conditions.add(ExprSupport.substitute(cond, oldToNewMap));

    final Domain newDomain = new Domain(newVars, conditions, ranges);
    return new DomainTransformation(newDomain, domain, newToOldMap, oldToNewMap);
  }
}
