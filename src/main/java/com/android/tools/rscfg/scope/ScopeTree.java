// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.scope;

import java.util.ArrayList;
import java.util.List;

/** Read-only view of the nesting of the scopes of a function body. */
public interface ScopeTree {

  /** Returns the parent of {@code scope}, or {@code null} for the root or an unknown scope. */
  Scope getEnclosingScope(Scope scope);

  /**
   * Returns the scopes that are left when control jumps from {@code from} to {@code target},
   * innermost first. A {@code null} target exits every scope up to and including the root.
   */
  default List<Scope> getExitingScopes(Scope from, Scope target) {
    List<Scope> exitingScopes = new ArrayList<>();
    Scope scope = from;
    while (scope != null && !scope.equals(target)) {
      exitingScopes.add(scope);
      scope = getEnclosingScope(scope);
    }
    return exitingScopes;
  }
}
