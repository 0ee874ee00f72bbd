// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

public class PatSlice extends Pat {

  private final List<Pat> pats;

  public PatSlice(SourceRange range, List<Pat> pats) {
    super(range);
    this.pats = ImmutableList.copyOf(pats);
  }

  public List<Pat> getPats() {
    return pats;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitPatSlice(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    pats.forEach(consumer);
  }
}
