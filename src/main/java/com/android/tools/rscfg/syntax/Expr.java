// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

public abstract class Expr extends SyntaxElement {

  Expr(SourceRange range) {
    super(range);
  }

  /** Returns true if the static type of this expression is the never type {@code !}. */
  public boolean isNeverTyped() {
    return false;
  }

  public boolean isBlockLike() {
    return false;
  }
}
