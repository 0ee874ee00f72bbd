// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** A single {@code P1 | P2 if guard => body} arm of a match expression. */
public class MatchArm {

  private final List<Pat> pats;
  private final MatchArmGuard guard;
  private final Expr body;

  public MatchArm(List<Pat> pats, MatchArmGuard guard, Expr body) {
    assert !pats.isEmpty();
    this.pats = ImmutableList.copyOf(pats);
    this.guard = guard;
    this.body = body;
  }

  public List<Pat> getPats() {
    return pats;
  }

  public MatchArmGuard getGuard() {
    return guard;
  }

  public boolean hasGuard() {
    return guard != null;
  }

  public Expr getBody() {
    return body;
  }
}
