// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** An identifier pattern {@code x}, {@code mut x} or {@code x @ subpattern}. */
public class PatIdent extends Pat {

  private final PatBinding binding;
  private final Pat subPat;

  public PatIdent(SourceRange range, PatBinding binding, Pat subPat) {
    super(range);
    this.binding = binding;
    this.subPat = subPat;
  }

  public PatBinding getBinding() {
    return binding;
  }

  public Pat getSubPat() {
    return subPat;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitPatIdent(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(binding);
    acceptIfNotNull(subPat, consumer);
  }
}
