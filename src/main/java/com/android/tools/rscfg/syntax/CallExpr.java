// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

public class CallExpr extends Expr {

  private final Expr callee;
  private final List<Expr> arguments;
  private boolean isNeverTyped = false;

  public CallExpr(SourceRange range, Expr callee, List<Expr> arguments) {
    super(range);
    this.callee = callee;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public Expr getCallee() {
    return callee;
  }

  public List<Expr> getArguments() {
    return arguments;
  }

  void markNeverTyped() {
    isNeverTyped = true;
  }

  @Override
  public boolean isNeverTyped() {
    return isNeverTyped;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitCallExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(callee);
    arguments.forEach(consumer);
  }
}
