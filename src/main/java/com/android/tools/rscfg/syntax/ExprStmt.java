// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class ExprStmt extends Stmt {

  private final Expr expr;
  private final boolean hasSemicolon;

  public ExprStmt(SourceRange range, Expr expr, boolean hasSemicolon) {
    super(range);
    this.expr = expr;
    this.hasSemicolon = hasSemicolon;
  }

  public Expr getExpr() {
    return expr;
  }

  public boolean hasSemicolon() {
    return hasSemicolon;
  }

  @Override
  public String getPresentableText() {
    return expr.getPresentableText() + ";";
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitExprStmt(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(expr);
  }
}
