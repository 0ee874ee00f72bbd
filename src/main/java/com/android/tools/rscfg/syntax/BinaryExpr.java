// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.function.Consumer;

/** Binary operators, including assignment and compound assignment. */
public class BinaryExpr extends Expr {

  private static final Set<String> ASSIGNMENT_OPERATORS =
      ImmutableSet.of("=", "+=", "-=", "*=", "/=", "%=", "^=", "&=", "|=", "<<=", ">>=");

  private final String operator;
  private final Expr left;
  private final Expr right;

  public BinaryExpr(SourceRange range, String operator, Expr left, Expr right) {
    super(range);
    this.operator = operator;
    this.left = left;
    this.right = right;
  }

  public String getOperator() {
    return operator;
  }

  public Expr getLeft() {
    return left;
  }

  public Expr getRight() {
    return right;
  }

  /** Returns true for the short-circuiting operators {@code &&} and {@code ||}. */
  public boolean isLazy() {
    return operator.equals("&&") || operator.equals("||");
  }

  public boolean isAssignment() {
    return ASSIGNMENT_OPERATORS.contains(operator);
  }

  public static boolean isAssignmentOperator(String operator) {
    return ASSIGNMENT_OPERATORS.contains(operator);
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitBinaryExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(left);
    consumer.accept(right);
  }
}
