// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/**
 * Base class of all elements of a parsed function body.
 *
 * <p>Elements are immutable and keep the exact source text they were parsed from, which is what
 * control flow graph nodes display.
 */
public abstract class SyntaxElement {

  private final SourceRange range;

  SyntaxElement(SourceRange range) {
    this.range = range;
  }

  public SourceRange getRange() {
    return range;
  }

  public String getText() {
    return range.getText();
  }

  /** Returns the text shown for this element in control flow graph dumps. */
  public String getPresentableText() {
    return getText().trim();
  }

  public abstract <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter);

  /** Calls {@code consumer} on each direct child element, in source order. */
  public abstract void forEachChild(Consumer<? super SyntaxElement> consumer);

  static void acceptIfNotNull(SyntaxElement element, Consumer<? super SyntaxElement> consumer) {
    if (element != null) {
      consumer.accept(element);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + getText() + ")";
  }
}
