// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** A block in expression position, optionally labelled ({@code 'a: { ... }}) or unsafe. */
public class BlockExpr extends Expr {

  private final String label;
  private final Block block;

  public BlockExpr(SourceRange range, String label, Block block) {
    super(range);
    this.label = label;
    this.block = block;
  }

  /** Returns the label including its leading quote, e.g. {@code 'a}, or null. */
  public String getLabel() {
    return label;
  }

  public boolean hasLabel() {
    return label != null;
  }

  public Block getBlock() {
    return block;
  }

  @Override
  public boolean isBlockLike() {
    return true;
  }

  @Override
  public String getPresentableText() {
    return "BLOCK";
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitBlockExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(block);
  }
}
