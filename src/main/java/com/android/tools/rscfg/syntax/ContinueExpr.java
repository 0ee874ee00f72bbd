// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class ContinueExpr extends Expr {

  private final String label;

  public ContinueExpr(SourceRange range, String label) {
    super(range);
    this.label = label;
  }

  /** Returns the target label including its leading quote, or null for the innermost loop. */
  public String getLabel() {
    return label;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitContinueExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {}
}
