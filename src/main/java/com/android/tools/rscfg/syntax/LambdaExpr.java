// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/**
 * A closure. Its body runs in a separate activation and is therefore not part of the enclosing
 * function's control flow.
 */
public class LambdaExpr extends Expr {

  private final Expr body;

  public LambdaExpr(SourceRange range, Expr body) {
    super(range);
    this.body = body;
  }

  public Expr getBody() {
    return body;
  }

  @Override
  public String getPresentableText() {
    return "CLOSURE";
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitLambdaExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(body);
  }
}
