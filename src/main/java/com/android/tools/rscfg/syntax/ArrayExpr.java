// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/** An array {@code [a, b]}, or a repeat expression {@code [a; n]} with two elements. */
public class ArrayExpr extends Expr {

  private final List<Expr> elements;
  private final boolean isRepeat;

  public ArrayExpr(SourceRange range, List<Expr> elements, boolean isRepeat) {
    super(range);
    assert !isRepeat || elements.size() == 2;
    this.elements = ImmutableList.copyOf(elements);
    this.isRepeat = isRepeat;
  }

  public List<Expr> getElements() {
    return elements;
  }

  public boolean isRepeat() {
    return isRepeat;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitArrayExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    elements.forEach(consumer);
  }
}
