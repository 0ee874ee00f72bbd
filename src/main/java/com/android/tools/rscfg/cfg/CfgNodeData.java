// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.cfg;

import com.android.tools.rscfg.errors.Unreachable;
import com.android.tools.rscfg.syntax.SyntaxElement;

public final class CfgNodeData {

  public enum Kind {
    ENTRY,
    EXIT,
    /** A synthetic join point: loop heads, pattern joins, guard starts and {@code ?} checks. */
    DUMMY,
    AST
  }

  private static final CfgNodeData ENTRY = new CfgNodeData(Kind.ENTRY, null);
  private static final CfgNodeData EXIT = new CfgNodeData(Kind.EXIT, null);
  private static final CfgNodeData DUMMY = new CfgNodeData(Kind.DUMMY, null);

  private final Kind kind;
  private final SyntaxElement element;

  private CfgNodeData(Kind kind, SyntaxElement element) {
    this.kind = kind;
    this.element = element;
  }

  public static CfgNodeData entry() {
    return ENTRY;
  }

  public static CfgNodeData exit() {
    return EXIT;
  }

  public static CfgNodeData dummy() {
    return DUMMY;
  }

  public static CfgNodeData ast(SyntaxElement element) {
    assert element != null;
    return new CfgNodeData(Kind.AST, element);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isAst() {
    return kind == Kind.AST;
  }

  /** Returns the wrapped syntax element, or {@code null} for synthetic nodes. */
  public SyntaxElement getElement() {
    return element;
  }

  @Override
  public String toString() {
    switch (kind) {
      case ENTRY:
        return "Entry";
      case EXIT:
        return "Exit";
      case DUMMY:
        return "Dummy";
      case AST:
        return element.getPresentableText();
      default:
        throw new Unreachable("Unexpected node kind " + kind);
    }
  }
}
