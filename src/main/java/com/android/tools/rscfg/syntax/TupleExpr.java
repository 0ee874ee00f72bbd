// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/** A tuple {@code (a, b)}, or the unit value {@code ()} when there are no elements. */
public class TupleExpr extends Expr {

  private final List<Expr> elements;

  public TupleExpr(SourceRange range, List<Expr> elements) {
    super(range);
    this.elements = ImmutableList.copyOf(elements);
  }

  public List<Expr> getElements() {
    return elements;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitTupleExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    elements.forEach(consumer);
  }
}
