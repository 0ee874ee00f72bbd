// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class WhileExpr extends LooplikeExpr {

  private final Condition condition;

  public WhileExpr(SourceRange range, String label, Condition condition, Block body) {
    super(range, label, body);
    this.condition = condition;
  }

  public Condition getCondition() {
    return condition;
  }

  @Override
  public String getPresentableText() {
    return "WHILE";
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitWhileExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(condition.getExpr());
    condition.getPats().forEach(consumer);
    consumer.accept(getBody());
  }
}
