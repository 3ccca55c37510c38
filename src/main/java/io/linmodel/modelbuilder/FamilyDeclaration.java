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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.linmodel.expr.Clause;
import io.linmodel.expr.Expr;
import java.util.List;

/**
 * The declaration of a variable family: one variable per binding of the generator clauses.
 *
 * <p>Bounds are expressions evaluated for each binding, so they may use the generator symbols and
 * the model parameters. A null bound, or one that evaluates to unbounded, means no bound.
 */
public final class FamilyDeclaration {
  private final String name;
  private final ImmutableList<Clause> clauses;
  private final VariableType type;
  private final Expr lowerBound;
  private final Expr upperBound;
  private final String nameTemplate;
  private final String description;

  private FamilyDeclaration(Builder builder) {
    this.name = builder.name;
    this.clauses = builder.clauses.build();
    this.type = builder.type;
    this.lowerBound = builder.lowerBound;
    this.upperBound = builder.upperBound;
    this.nameTemplate = builder.nameTemplate;
    this.description = builder.description;
  }

  /** Returns a builder for the family {@code name}, continuous and unbounded by default. */
  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Clause> getClauses() {
    return clauses;
  }

  public VariableType getType() {
    return type;
  }

  /** Returns the lower bound expression, or null. */
  public Expr getLowerBound() {
    return lowerBound;
  }

  /** Returns the upper bound expression, or null. */
  public Expr getUpperBound() {
    return upperBound;
  }

  /** Returns the template of the concrete variable names, or null for the default one. */
  public String getNameTemplate() {
    return nameTemplate;
  }

  /** Returns the description template, or null. */
  public String getDescription() {
    return description;
  }

  @Override
  public String toString() {
    return name + clauses + " " + type;
  }

  /** Builder class for the FamilyDeclaration container. */
  public static final class Builder {
    private final String name;
    private final ImmutableList.Builder<Clause> clauses = ImmutableList.builder();
    private VariableType type = VariableType.CONTINUOUS;
    private Expr lowerBound;
    private Expr upperBound;
    private String nameTemplate;
    private String description;

    Builder(String name) {
      checkArgument(name != null && !name.isEmpty(), "family name must not be empty");
      this.name = name;
    }

    /** Adds {@code symbol <- domain}. */
    public Builder addGenerator(String symbol, Expr domain) {
      clauses.add(Clause.generator(symbol, domain));
      return this;
    }

    /** Adds {@code symbol <- from..to}. */
    public Builder addGenerator(String symbol, long from, long to) {
      clauses.add(Clause.generator(symbol, from, to));
      return this;
    }

    public Builder addFilter(Expr predicate) {
      clauses.add(Clause.filter(predicate));
      return this;
    }

    public Builder addClauses(List<Clause> moreClauses) {
      clauses.addAll(moreClauses);
      return this;
    }

    public Builder setType(VariableType type) {
      this.type = checkNotNull(type);
      return this;
    }

    public Builder setLowerBound(Expr lowerBound) {
      this.lowerBound = lowerBound;
      return this;
    }

    public Builder setLowerBound(double lowerBound) {
      this.lowerBound = Expr.constant(lowerBound);
      return this;
    }

    public Builder setUpperBound(Expr upperBound) {
      this.upperBound = upperBound;
      return this;
    }

    public Builder setUpperBound(double upperBound) {
      this.upperBound = Expr.constant(upperBound);
      return this;
    }

    /** Sets the template of the concrete names, with {@code {symbol}} placeholders. */
    public Builder setNameTemplate(String nameTemplate) {
      this.nameTemplate = nameTemplate;
      return this;
    }

    /** Sets the description template, with {@code {symbol}} placeholders. */
    public Builder setDescription(String description) {
      this.description = description;
      return this;
    }

    public FamilyDeclaration build() {
      return new FamilyDeclaration(this);
    }
  }
}
