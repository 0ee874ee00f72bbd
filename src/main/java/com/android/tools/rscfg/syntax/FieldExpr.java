// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** Field access {@code a.b}, tuple field access {@code a.0} or {@code a.await}. */
public class FieldExpr extends Expr {

  private final Expr receiver;
  private final String fieldName;

  public FieldExpr(SourceRange range, Expr receiver, String fieldName) {
    super(range);
    this.receiver = receiver;
    this.fieldName = fieldName;
  }

  public Expr getReceiver() {
    return receiver;
  }

  public String getFieldName() {
    return fieldName;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitFieldExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(receiver);
  }
}
