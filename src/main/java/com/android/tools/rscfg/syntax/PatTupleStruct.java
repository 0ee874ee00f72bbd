// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

/** A tuple struct or tuple variant pattern such as {@code Some(x)}. */
public class PatTupleStruct extends Pat {

  private final String path;
  private final List<Pat> pats;

  public PatTupleStruct(SourceRange range, String path, List<Pat> pats) {
    super(range);
    this.path = path;
    this.pats = ImmutableList.copyOf(pats);
  }

  public String getPath() {
    return path;
  }

  public List<Pat> getPats() {
    return pats;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitPatTupleStruct(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    pats.forEach(consumer);
  }
}
