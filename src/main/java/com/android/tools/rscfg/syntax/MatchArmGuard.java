// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** The {@code if cond} part of a match arm. */
public class MatchArmGuard extends SyntaxElement {

  private final Expr condition;

  public MatchArmGuard(SourceRange range, Expr condition) {
    super(range);
    this.condition = condition;
  }

  public Expr getCondition() {
    return condition;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitMatchArmGuard(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(condition);
  }
}
