// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** A reference to a local, an item or a unit-like variant, e.g. {@code x} or {@code E::A}. */
public class PathExpr extends Expr {

  public PathExpr(SourceRange range) {
    super(range);
  }

  /** Returns the path without generic arguments, {@code Vec::new} for {@code Vec::<T>::new}. */
  public String getPath() {
    return getText().replaceAll("::<[^:]*>", "").replaceAll("\\s+", "");
  }

  public String getLastSegment() {
    String path = getPath();
    int index = path.lastIndexOf("::");
    return index < 0 ? path : path.substring(index + 2);
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitPathExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {}
}
