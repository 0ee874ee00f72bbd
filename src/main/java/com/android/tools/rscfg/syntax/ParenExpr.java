// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class ParenExpr extends Expr {

  private final Expr expr;

  public ParenExpr(SourceRange range, Expr expr) {
    super(range);
    this.expr = expr;
  }

  public Expr getExpr() {
    return expr;
  }

  @Override
  public boolean isNeverTyped() {
    return expr.isNeverTyped();
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitParenExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(expr);
  }
}
