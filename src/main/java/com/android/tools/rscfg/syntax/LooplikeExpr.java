// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

/** Common base of {@code loop}, {@code while} and {@code for}. */
public abstract class LooplikeExpr extends Expr {

  private final String label;
  private final Block body;

  LooplikeExpr(SourceRange range, String label, Block body) {
    super(range);
    this.label = label;
    this.body = body;
  }

  /** Returns the label including its leading quote, e.g. {@code 'outer}, or null. */
  public String getLabel() {
    return label;
  }

  public boolean hasLabel() {
    return label != null;
  }

  public Block getBody() {
    return body;
  }

  @Override
  public boolean isBlockLike() {
    return true;
  }
}
