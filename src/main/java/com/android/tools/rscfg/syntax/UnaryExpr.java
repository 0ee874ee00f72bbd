// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** Negation, logical not, dereference or borrow. */
public class UnaryExpr extends Expr {

  private final String operator;
  private final Expr operand;

  public UnaryExpr(SourceRange range, String operator, Expr operand) {
    super(range);
    this.operator = operator;
    this.operand = operand;
  }

  /** One of {@code -}, {@code !}, {@code *}, {@code &} and {@code &mut}. */
  public String getOperator() {
    return operator;
  }

  public Expr getOperand() {
    return operand;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitUnaryExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(operand);
  }
}
