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

package io.linmodel.modelbuilder;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A sparse sum of monomials with coefficients.
 *
 * <p>Terms with a zero coefficient are never stored, so the zero polynomial is the empty map.
 * Equality is structural and ignores term order; iteration follows insertion order, which keeps
 * the LP export deterministic.
 */
public final class Polynomial {
  private static final Polynomial ZERO = new Polynomial(ImmutableMap.of());

  private final ImmutableMap<Monomial, Double> terms;

  private Polynomial(ImmutableMap<Monomial, Double> terms) {
    this.terms = terms;
  }

  /** Returns the empty polynomial. */
  public static Polynomial zero() {
    return ZERO;
  }

  /** Returns the constant polynomial {@code value}. */
  public static Polynomial constant(double value) {
    if (value == 0.0) {
      return ZERO;
    }
    return new Polynomial(ImmutableMap.of(Monomial.constant(), value));
  }

  /** Returns {@code 1 * variable}. */
  public static Polynomial variable(String variable) {
    return new Polynomial(ImmutableMap.of(Monomial.of(variable), 1.0));
  }

  /** Returns a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns {@code p + q}: union of monomials, coefficients summed, zero terms pruned. */
  public static Polynomial add(Polynomial p, Polynomial q) {
    if (p.terms.isEmpty()) {
      return q;
    }
    if (q.terms.isEmpty()) {
      return p;
    }
    return builder().add(p).add(q).build();
  }

  /** Returns {@code p * c}. Scaling by zero yields {@link #zero()}. */
  public static Polynomial scale(Polynomial p, double c) {
    if (c == 0.0) {
      return ZERO;
    }
    if (c == 1.0) {
      return p;
    }
    return builder().addTerm(p, c).build();
  }

  /** Shortcut for {@code add(this, other)}. */
  public Polynomial add(Polynomial other) {
    return add(this, other);
  }

  /** Shortcut for {@code add(this, scale(other, -1))}. */
  public Polynomial subtract(Polynomial other) {
    return builder().add(this).addTerm(other, -1.0).build();
  }

  /** Shortcut for {@code scale(this, c)}. */
  public Polynomial scale(double c) {
    return scale(this, c);
  }

  /** Shortcut for {@code scale(this, -1)}. */
  public Polynomial negate() {
    return scale(this, -1.0);
  }

  /** Returns true iff the only monomial, if any, has arity 0. */
  public boolean isConstant() {
    for (Monomial m : terms.keySet()) {
      if (!m.isConstant()) {
        return false;
      }
    }
    return true;
  }

  public boolean isZero() {
    return terms.isEmpty();
  }

  /** Returns true if every monomial has arity at most one. */
  public boolean isLinear() {
    for (Monomial m : terms.keySet()) {
      if (m.arity() > 1) {
        return false;
      }
    }
    return true;
  }

  /** Returns the coefficient of the arity 0 monomial, 0 when absent. */
  public double constantValue() {
    Double value = terms.get(Monomial.constant());
    return value == null ? 0.0 : value;
  }

  /** Separates the arity 0 term from the rest. */
  public ConstantSplit splitConstant() {
    if (!terms.containsKey(Monomial.constant())) {
      return new ConstantSplit(this, 0.0);
    }
    ImmutableMap.Builder<Monomial, Double> rest = ImmutableMap.builder();
    for (Map.Entry<Monomial, Double> entry : terms.entrySet()) {
      if (!entry.getKey().isConstant()) {
        rest.put(entry);
      }
    }
    return new ConstantSplit(new Polynomial(rest.buildOrThrow()), constantValue());
  }

  /** Returns the coefficient of the linear term of {@code variable}, 0 when absent. */
  public double getCoefficient(String variable) {
    Double value = terms.get(Monomial.of(variable));
    return value == null ? 0.0 : value;
  }

  /** Returns the terms in insertion order. */
  public ImmutableMap<Monomial, Double> getTerms() {
    return terms;
  }

  /** Returns the number of stored terms, the constant one included. */
  public int numTerms() {
    return terms.size();
  }

  /** Returns the variable names appearing in the polynomial, in term order. */
  public ImmutableSet<String> variables() {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (Monomial m : terms.keySet()) {
      builder.addAll(m.getVariables());
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Polynomial && ((Polynomial) o).terms.equals(terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public String toString() {
    if (terms.isEmpty()) {
      return "0";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Monomial, Double> entry : terms.entrySet()) {
      double coeff = entry.getValue();
      if (sb.length() > 0) {
        sb.append(coeff < 0 ? " - " : " + ");
        coeff = Math.abs(coeff);
      }
      if (entry.getKey().isConstant()) {
        sb.append(coeff);
      } else if (coeff == 1.0) {
        sb.append(entry.getKey());
      } else if (coeff == -1.0) {
        sb.append('-').append(entry.getKey());
      } else {
        sb.append(coeff).append(" * ").append(entry.getKey());
      }
    }
    return sb.toString();
  }

  /** The result of {@link #splitConstant()}. */
  public static final class ConstantSplit {
    private final Polynomial nonConstant;
    private final double constant;

    ConstantSplit(Polynomial nonConstant, double constant) {
      this.nonConstant = nonConstant;
      this.constant = constant;
    }

    /** Returns the polynomial without its constant term. */
    public Polynomial getNonConstant() {
      return nonConstant;
    }

    /** Returns the constant term. */
    public double getConstant() {
      return constant;
    }
  }

  /** Builder class for the Polynomial container. */
  public static final class Builder {
    private final LinkedHashMap<Monomial, Double> coefficients;

    Builder() {
      this.coefficients = new LinkedHashMap<>();
    }

    public Builder add(Polynomial p) {
      return addTerm(p, 1.0);
    }

    public Builder add(double constant) {
      coefficients.merge(Monomial.constant(), constant, Double::sum);
      return this;
    }

    /** Adds {@code p * coeff}. */
    public Builder addTerm(Polynomial p, double coeff) {
      for (Map.Entry<Monomial, Double> entry : p.terms.entrySet()) {
        coefficients.merge(entry.getKey(), entry.getValue() * coeff, Double::sum);
      }
      return this;
    }

    /** Adds {@code coeff * variable}. */
    public Builder addTerm(String variable, double coeff) {
      coefficients.merge(Monomial.of(variable), coeff, Double::sum);
      return this;
    }

    /** Adds {@code coeff * v1 * ... * vn}. */
    public Builder addTerm(ImmutableList<String> variables, double coeff) {
      coefficients.merge(Monomial.of(variables), coeff, Double::sum);
      return this;
    }

    public Polynomial build() {
      ImmutableMap.Builder<Monomial, Double> terms = ImmutableMap.builder();
      int numTerms = 0;
      for (Map.Entry<Monomial, Double> entry : coefficients.entrySet()) {
        if (entry.getValue() != 0.0) {
          terms.put(entry);
          numTerms++;
        }
      }
      if (numTerms == 0) {
        return ZERO;
      }
      return new Polynomial(terms.buildOrThrow());
    }
  }
}
