// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** A reference pattern {@code &pat} or {@code &mut pat}. */
public class PatRef extends Pat {

  private final Pat pat;

  public PatRef(SourceRange range, Pat pat) {
    super(range);
    this.pat = pat;
  }

  public Pat getPat() {
    return pat;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitPatRef(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(pat);
  }
}
