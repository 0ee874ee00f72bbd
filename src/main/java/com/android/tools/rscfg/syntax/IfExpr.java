// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class IfExpr extends Expr {

  private final Condition condition;
  private final Block thenBranch;
  private final Block elseBlock;
  private final IfExpr elseIf;

  public IfExpr(
      SourceRange range, Condition condition, Block thenBranch, Block elseBlock, IfExpr elseIf) {
    super(range);
    assert elseBlock == null || elseIf == null;
    this.condition = condition;
    this.thenBranch = thenBranch;
    this.elseBlock = elseBlock;
    this.elseIf = elseIf;
  }

  public Condition getCondition() {
    return condition;
  }

  public Block getThenBranch() {
    return thenBranch;
  }

  public boolean hasElseBranch() {
    return elseBlock != null || elseIf != null;
  }

  /** Returns the else branch, either a {@link Block} or an {@code else if} {@link IfExpr}. */
  public SyntaxElement getElseBranch() {
    return elseBlock != null ? elseBlock : elseIf;
  }

  @Override
  public boolean isBlockLike() {
    return true;
  }

  @Override
  public String getPresentableText() {
    return "IF";
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitIfExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(condition.getExpr());
    condition.getPats().forEach(consumer);
    consumer.accept(thenBranch);
    acceptIfNotNull(getElseBranch(), consumer);
  }
}
