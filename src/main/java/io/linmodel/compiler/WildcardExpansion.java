// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package io.linmodel.compiler;

import com.google.common.collect.ImmutableList;
import io.linmodel.expr.AccessExpr;
import io.linmodel.expr.BinaryExpr;
import io.linmodel.expr.CompareExpr;
import io.linmodel.expr.ConstantExpr;
import io.linmodel.expr.Expr;
import io.linmodel.expr.ExprVisitor;
import io.linmodel.expr.IndexExpr;
import io.linmodel.expr.ListExpr;
import io.linmodel.expr.NegateExpr;
import io.linmodel.expr.RangeExpr;
import io.linmodel.expr.RefExpr;
import io.linmodel.expr.SumExpr;
import io.linmodel.expr.WildcardExpr;
import io.linmodel.expr.WildcardIndexExpr;
import io.linmodel.modelbuilder.Model;
import io.linmodel.modelbuilder.ModelException;
import io.linmodel.modelbuilder.VariableFamily;
import io.linmodel.value.NumberValue;
import io.linmodel.value.Value;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expansion of a wildcard used as a container key, as in {@code sum(cost[_] * qty(_))}.
 *
 * <p>All the wildcards of such an expression stand for one shared index. Its domain is the
 * intersection of the keys of every container accessed with a wildcard key and of the values at the
 * first wildcard position of every wildcard family reference. The expression is instantiated once
 * per domain value, in the order of the first source found, with each wildcard replaced by the
 * value. Nested {@code sum} expressions are left alone.
 *
 * <p>Keys are matched by their rendered text, as container access does, so the mapping key
 * {@code "1"} meets the family index {@code 1}. When a family takes part, the substituted value is
 * the family's own index value.
 */
public final class WildcardExpansion {
  private WildcardExpansion() {}

  /** Returns true if {@code expr} accesses a container with a wildcard key. */
  public static boolean hasContainerWildcard(Expr expr) {
    Collector collector = new Collector();
    expr.accept(collector);
    return !collector.containers.isEmpty();
  }

  /**
   * Returns one copy of {@code expr} per value of the shared wildcard index.
   *
   * @throws ModelException.NotEnumerable if a wildcard container is not a sequence or a mapping, or
   *     if the domains of the sources do not overlap
   * @throws ModelException.UndefinedVariable if a wildcard family reference names no family
   */
  public static ImmutableList<Expr> expand(Expr expr, CompileContext context, Model model) {
    ImmutableList.Builder<Expr> instances = ImmutableList.builder();
    for (Value value : domain(expr, context, model)) {
      instances.add(substitute(expr, value));
    }
    return instances.build();
  }

  /** Returns the domain of the shared wildcard index of {@code expr}. */
  public static ImmutableList<Value> domain(Expr expr, CompileContext context, Model model) {
    Collector collector = new Collector();
    expr.accept(collector);
    List<Map<String, Value>> sources = new ArrayList<>();
    Map<String, Value> familySource = null;
    for (int i = 0; i < collector.order.size(); ++i) {
      Expr source = collector.order.get(i);
      if (source instanceof AccessExpr) {
        sources.add(byRendering(containerKeys(((AccessExpr) source).getContainer(), context)));
      } else {
        Map<String, Value> values = byRendering(familyValues(source, model));
        if (familySource == null) {
          familySource = values;
        }
        sources.add(values);
      }
    }
    if (sources.isEmpty()) {
      throw new ModelException.NotEnumerable(
          "WildcardExpansion.domain",
          "no domain can be inferred for the wildcard in " + expr);
    }
    Set<String> domain = new LinkedHashSet<>(sources.get(0).keySet());
    for (int i = 1; i < sources.size(); ++i) {
      domain.retainAll(sources.get(i).keySet());
    }
    if (domain.isEmpty() && sources.size() > 1) {
      throw new ModelException.NotEnumerable(
          "WildcardExpansion.domain",
          "the wildcard domains of " + expr + " do not overlap; variable indices and container"
              + " keys must share values");
    }
    Map<String, Value> representatives = familySource == null ? sources.get(0) : familySource;
    ImmutableList.Builder<Value> values = ImmutableList.builder();
    for (String key : domain) {
      values.add(representatives.get(key));
    }
    return values.build();
  }

  private static Map<String, Value> byRendering(Set<Value> values) {
    Map<String, Value> rendered = new LinkedHashMap<>();
    for (Value value : values) {
      rendered.putIfAbsent(value.render(), value);
    }
    return rendered;
  }

  private static Set<Value> containerKeys(Expr containerExpr, CompileContext context) {
    Value container = ConstantEvaluator.evaluate(containerExpr, context);
    Set<Value> keys = new LinkedHashSet<>();
    switch (container.kind()) {
      case MAPPING:
        keys.addAll(container.asMapping().entries().keySet());
        return keys;
      case SEQUENCE:
        for (int i = 0; i < container.asSequence().size(); ++i) {
          keys.add(NumberValue.of(i));
        }
        return keys;
      case NUMBER:
      case TEXT:
      case UNBOUNDED:
        break;
    }
    throw new ModelException.NotEnumerable(
        "WildcardExpansion.domain",
        "container " + containerExpr + " accessed with _ must be a sequence or a mapping, got "
            + container.describe());
  }

  private static Set<Value> familyValues(Expr reference, Model model) {
    String name;
    List<Expr> indices;
    if (reference instanceof IndexExpr) {
      name = ((IndexExpr) reference).getName();
      indices = ((IndexExpr) reference).getIndices();
    } else {
      name = ((WildcardIndexExpr) reference).getName();
      indices = ((WildcardIndexExpr) reference).getPattern();
    }
    VariableFamily family = model.getFamily(name);
    if (family == null) {
      throw new ModelException.UndefinedVariable(
          "WildcardExpansion.domain", name, model.getFamilies().keySet());
    }
    if (family.getArity() != indices.size()) {
      throw new ModelException.ArityMismatch(
          "WildcardExpansion.domain", name, family.getArity(), indices.size());
    }
    int position = 0;
    while (!(indices.get(position) instanceof WildcardExpr)) {
      position++;
    }
    Set<Value> values = new LinkedHashSet<>();
    for (ImmutableList<Value> key : family.getMembers().keySet()) {
      values.add(key.get(position));
    }
    return values;
  }

  /** Returns {@code expr} with every wildcard outside nested sums replaced by {@code value}. */
  public static Expr substitute(Expr expr, Value value) {
    return expr.accept(new Substituter(new ConstantExpr(value)));
  }

  private static boolean isWildcardReference(List<Expr> indices) {
    for (Expr index : indices) {
      if (index instanceof WildcardExpr) {
        return true;
      }
    }
    return false;
  }

  /** Finds the sources of the wildcard domain in traversal order. */
  private static final class Collector implements ExprVisitor<Void> {
    private final List<Expr> order = new ArrayList<>();
    private final List<AccessExpr> containers = new ArrayList<>();

    @Override
    public Void visitConstant(ConstantExpr expr) {
      return null;
    }

    @Override
    public Void visitRef(RefExpr expr) {
      return null;
    }

    @Override
    public Void visitIndex(IndexExpr expr) {
      if (isWildcardReference(expr.getIndices())) {
        order.add(expr);
      }
      for (Expr index : expr.getIndices()) {
        index.accept(this);
      }
      return null;
    }

    @Override
    public Void visitWildcardIndex(WildcardIndexExpr expr) {
      if (isWildcardReference(expr.getPattern())) {
        order.add(expr);
      }
      for (Expr index : expr.getPattern()) {
        index.accept(this);
      }
      return null;
    }

    @Override
    public Void visitWildcard(WildcardExpr expr) {
      return null;
    }

    @Override
    public Void visitBinary(BinaryExpr expr) {
      expr.getLeft().accept(this);
      expr.getRight().accept(this);
      return null;
    }

    @Override
    public Void visitNegate(NegateExpr expr) {
      expr.getExpr().accept(this);
      return null;
    }

    @Override
    public Void visitSum(SumExpr expr) {
      return null;
    }

    @Override
    public Void visitAccess(AccessExpr expr) {
      if (expr.getKey() instanceof WildcardExpr) {
        order.add(expr);
        containers.add(expr);
      } else {
        expr.getKey().accept(this);
      }
      expr.getContainer().accept(this);
      return null;
    }

    @Override
    public Void visitCompare(CompareExpr expr) {
      expr.getLeft().accept(this);
      expr.getRight().accept(this);
      return null;
    }

    @Override
    public Void visitRange(RangeExpr expr) {
      expr.getFrom().accept(this);
      expr.getTo().accept(this);
      return null;
    }

    @Override
    public Void visitList(ListExpr expr) {
      for (Expr element : expr.getElements()) {
        element.accept(this);
      }
      return null;
    }
  }

  /** Rebuilds an expression with the wildcards replaced. */
  private static final class Substituter implements ExprVisitor<Expr> {
    private final ConstantExpr replacement;

    Substituter(ConstantExpr replacement) {
      this.replacement = replacement;
    }

    private ImmutableList<Expr> all(List<Expr> exprs) {
      ImmutableList.Builder<Expr> result = ImmutableList.builder();
      for (Expr e : exprs) {
        result.add(e.accept(this));
      }
      return result.build();
    }

    @Override
    public Expr visitConstant(ConstantExpr expr) {
      return expr;
    }

    @Override
    public Expr visitRef(RefExpr expr) {
      return expr;
    }

    @Override
    public Expr visitIndex(IndexExpr expr) {
      return new IndexExpr(expr.getName(), all(expr.getIndices()));
    }

    @Override
    public Expr visitWildcardIndex(WildcardIndexExpr expr) {
      return new WildcardIndexExpr(expr.getName(), all(expr.getPattern()));
    }

    @Override
    public Expr visitWildcard(WildcardExpr expr) {
      return replacement;
    }

    @Override
    public Expr visitBinary(BinaryExpr expr) {
      return new BinaryExpr(
          expr.getOperator(), expr.getLeft().accept(this), expr.getRight().accept(this));
    }

    @Override
    public Expr visitNegate(NegateExpr expr) {
      return new NegateExpr(expr.getExpr().accept(this));
    }

    @Override
    public Expr visitSum(SumExpr expr) {
      return expr;
    }

    @Override
    public Expr visitAccess(AccessExpr expr) {
      return new AccessExpr(expr.getContainer().accept(this), expr.getKey().accept(this));
    }

    @Override
    public Expr visitCompare(CompareExpr expr) {
      return new CompareExpr(
          expr.getOperator(), expr.getLeft().accept(this), expr.getRight().accept(this));
    }

    @Override
    public Expr visitRange(RangeExpr expr) {
      return new RangeExpr(expr.getFrom().accept(this), expr.getTo().accept(this));
    }

    @Override
    public Expr visitList(ListExpr expr) {
      return new ListExpr(all(expr.getElements()));
    }
  }
}
