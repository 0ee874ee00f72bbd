// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class CastExpr extends Expr {

  private final Expr expr;
  private final String typeText;

  public CastExpr(SourceRange range, Expr expr, String typeText) {
    super(range);
    this.expr = expr;
    this.typeText = typeText;
  }

  public Expr getExpr() {
    return expr;
  }

  public String getTypeText() {
    return typeText;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitCastExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(expr);
  }
}
