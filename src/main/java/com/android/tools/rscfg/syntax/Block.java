// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/** A brace delimited sequence of statements with an optional trailing value expression. */
public class Block extends SyntaxElement {

  private final List<Stmt> stmts;
  private final Expr tailExpr;

  public Block(SourceRange range, List<Stmt> stmts, Expr tailExpr) {
    super(range);
    this.stmts = ImmutableList.copyOf(stmts);
    this.tailExpr = tailExpr;
  }

  public List<Stmt> getStmts() {
    return stmts;
  }

  public Expr getTailExpr() {
    return tailExpr;
  }

  public boolean hasTailExpr() {
    return tailExpr != null;
  }

  @Override
  public String getPresentableText() {
    return "BLOCK";
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitBlock(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    stmts.forEach(consumer);
    acceptIfNotNull(tailExpr, consumer);
  }
}
