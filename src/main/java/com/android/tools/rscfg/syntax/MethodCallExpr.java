// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

public class MethodCallExpr extends Expr {

  private final Expr receiver;
  private final String methodName;
  private final List<Expr> arguments;

  public MethodCallExpr(
      SourceRange range, Expr receiver, String methodName, List<Expr> arguments) {
    super(range);
    this.receiver = receiver;
    this.methodName = methodName;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public Expr getReceiver() {
    return receiver;
  }

  public String getMethodName() {
    return methodName;
  }

  public List<Expr> getArguments() {
    return arguments;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitMethodCallExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(receiver);
    arguments.forEach(consumer);
  }
}
