// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class ForExpr extends LooplikeExpr {

  private final Pat pat;
  private final Expr iterable;

  public ForExpr(SourceRange range, String label, Pat pat, Expr iterable, Block body) {
    super(range, label, body);
    this.pat = pat;
    this.iterable = iterable;
  }

  public Pat getPat() {
    return pat;
  }

  public Expr getIterable() {
    return iterable;
  }

  @Override
  public String getPresentableText() {
    return "FOR";
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitForExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(pat);
    consumer.accept(iterable);
    consumer.accept(getBody());
  }
}
