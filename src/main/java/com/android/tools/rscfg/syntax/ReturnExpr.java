// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class ReturnExpr extends Expr {

  private final Expr value;

  public ReturnExpr(SourceRange range, Expr value) {
    super(range);
    this.value = value;
  }

  public Expr getValue() {
    return value;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitReturnExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    acceptIfNotNull(value, consumer);
  }
}
