// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.scope;

import com.android.tools.rscfg.errors.Unreachable;
import com.android.tools.rscfg.syntax.Block;
import com.android.tools.rscfg.syntax.SyntaxElement;

/**
 * A region of a function body.
 *
 * <p>Each syntax element has a {@link Kind#NODE} scope. Terminating elements are in addition
 * wrapped in a {@link Kind#DESTRUCTION} scope, where their temporaries are dropped. A {@code let}
 * statement opens a {@link Kind#REMAINDER} scope that covers the rest of its block, starting at
 * the statement.
 */
public final class Scope {

  public enum Kind {
    NODE,
    DESTRUCTION,
    REMAINDER
  }

  private final Kind kind;
  private final SyntaxElement element;
  private final int firstStatementIndex;

  private Scope(Kind kind, SyntaxElement element, int firstStatementIndex) {
    assert element != null;
    this.kind = kind;
    this.element = element;
    this.firstStatementIndex = firstStatementIndex;
  }

  public static Scope node(SyntaxElement element) {
    return new Scope(Kind.NODE, element, -1);
  }

  public static Scope destruction(SyntaxElement element) {
    return new Scope(Kind.DESTRUCTION, element, -1);
  }

  public static Scope remainder(Block block, int firstStatementIndex) {
    assert firstStatementIndex >= 0 && firstStatementIndex < block.getStmts().size();
    return new Scope(Kind.REMAINDER, block, firstStatementIndex);
  }

  public Kind getKind() {
    return kind;
  }

  public SyntaxElement getElement() {
    return element;
  }

  /** Only defined for {@link Kind#REMAINDER} scopes. */
  public int getFirstStatementIndex() {
    assert kind == Kind.REMAINDER;
    return firstStatementIndex;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Scope)) {
      return false;
    }
    Scope scope = (Scope) other;
    // Syntax elements are compared by identity.
    return kind == scope.kind
        && element == scope.element
        && firstStatementIndex == scope.firstStatementIndex;
  }

  @Override
  public int hashCode() {
    return (System.identityHashCode(element) * 31 + kind.ordinal()) * 31 + firstStatementIndex;
  }

  @Override
  public String toString() {
    switch (kind) {
      case NODE:
        return "Node(" + element.getPresentableText() + ")";
      case DESTRUCTION:
        return "Destruction(" + element.getPresentableText() + ")";
      case REMAINDER:
        return "Remainder(" + element.getPresentableText() + ", " + firstStatementIndex + ")";
      default:
        throw new Unreachable();
    }
  }
}
