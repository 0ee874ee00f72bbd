// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Marks the calls whose type is the never type {@code !}.
 *
 * <p>A call is never-typed when its callee names a function of the same file that is declared
 * {@code -> !}, or one of the process terminating functions of the standard library.
 */
final class NeverTypeResolver {

  private static final Set<String> NEVER_RETURNING_LIBRARY_FUNCTIONS =
      ImmutableSet.of(
          "std::process::exit",
          "process::exit",
          "::std::process::exit",
          "std::process::abort",
          "process::abort",
          "::std::process::abort");

  private final Set<String> neverReturningFunctions = new HashSet<>();

  private NeverTypeResolver(SourceFile file) {
    for (FunctionDecl function : file.getFunctions()) {
      if (function.isNeverReturning()) {
        neverReturningFunctions.add(function.getName());
        neverReturningFunctions.add("self::" + function.getName());
        neverReturningFunctions.add("crate::" + function.getName());
      }
    }
  }

  static void resolve(SourceFile file) {
    NeverTypeResolver resolver = new NeverTypeResolver(file);
    for (FunctionDecl function : file.getFunctions()) {
      if (function.getBody() != null) {
        resolver.visit(function.getBody());
      }
    }
  }

  private void visit(SyntaxElement element) {
    if (element instanceof CallExpr) {
      CallExpr call = (CallExpr) element;
      if (isNeverReturningCallee(call.getCallee())) {
        call.markNeverTyped();
      }
    }
    element.forEachChild(this::visit);
  }

  private boolean isNeverReturningCallee(Expr callee) {
    if (!(callee instanceof PathExpr)) {
      return false;
    }
    String path = ((PathExpr) callee).getPath();
    return neverReturningFunctions.contains(path)
        || NEVER_RETURNING_LIBRARY_FUNCTIONS.contains(path);
  }
}
