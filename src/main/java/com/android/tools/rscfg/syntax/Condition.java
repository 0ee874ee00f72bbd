// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The condition of an {@code if} or {@code while}.
 *
 * <p>For {@code if let} and {@code while let} the condition has one pattern per alternative of a
 * top-level or-pattern ({@code A(x) | B(x)}); for plain conditions there are no patterns.
 */
public class Condition {

  private final List<Pat> pats;
  private final Expr expr;

  public Condition(List<Pat> pats, Expr expr) {
    this.pats = ImmutableList.copyOf(pats);
    this.expr = expr;
  }

  public List<Pat> getPats() {
    return pats;
  }

  public Expr getExpr() {
    return expr;
  }

  public boolean isLet() {
    return !pats.isEmpty();
  }
}
