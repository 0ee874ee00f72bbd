// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class IndexExpr extends Expr {

  private final Expr base;
  private final Expr index;

  public IndexExpr(SourceRange range, Expr base, Expr index) {
    super(range);
    this.base = base;
    this.index = index;
  }

  public Expr getBase() {
    return base;
  }

  public Expr getIndex() {
    return index;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitIndexExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(base);
    consumer.accept(index);
  }
}
