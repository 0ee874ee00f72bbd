// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** {@code a..b} or {@code a..=b}, where either bound may be missing. */
public class RangeExpr extends Expr {

  private final Expr start;
  private final Expr end;
  private final String operator;

  public RangeExpr(SourceRange range, Expr start, String operator, Expr end) {
    super(range);
    this.start = start;
    this.operator = operator;
    this.end = end;
  }

  public Expr getStart() {
    return start;
  }

  public Expr getEnd() {
    return end;
  }

  public boolean isInclusive() {
    return !operator.equals("..");
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitRangeExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    acceptIfNotNull(start, consumer);
    acceptIfNotNull(end, consumer);
  }
}
