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

package io.linmodel.expr;

/** Visitor over the expression node kinds. */
public interface ExprVisitor<R> {
  R visitConstant(ConstantExpr expr);

  R visitRef(RefExpr expr);

  R visitIndex(IndexExpr expr);

  R visitWildcardIndex(WildcardIndexExpr expr);

  R visitWildcard(WildcardExpr expr);

  R visitBinary(BinaryExpr expr);

  R visitNegate(NegateExpr expr);

  R visitSum(SumExpr expr);

  R visitAccess(AccessExpr expr);

  R visitCompare(CompareExpr expr);

  R visitRange(RangeExpr expr);

  R visitList(ListExpr expr);
}
