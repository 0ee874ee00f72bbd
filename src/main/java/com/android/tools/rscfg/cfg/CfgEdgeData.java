// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.cfg;

import com.android.tools.rscfg.scope.Scope;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Data of a control flow edge: the scopes that are exited when control takes the edge. */
public final class CfgEdgeData {

  private static final CfgEdgeData FALL_THROUGH = new CfgEdgeData(ImmutableList.of());

  private final List<Scope> exitingScopes;

  private CfgEdgeData(List<Scope> exitingScopes) {
    this.exitingScopes = exitingScopes;
  }

  public static CfgEdgeData fallThrough() {
    return FALL_THROUGH;
  }

  public static CfgEdgeData exiting(List<Scope> exitingScopes) {
    return exitingScopes.isEmpty()
        ? FALL_THROUGH
        : new CfgEdgeData(ImmutableList.copyOf(exitingScopes));
  }

  /** Returns the exited scopes, innermost first. */
  public List<Scope> getExitingScopes() {
    return exitingScopes;
  }

  public boolean isExiting() {
    return !exitingScopes.isEmpty();
  }

  @Override
  public String toString() {
    return exitingScopes.isEmpty() ? "" : "exiting " + exitingScopes;
  }
}
