// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

public class LetDecl extends Stmt {

  private final Pat pat;
  private final String typeText;
  private final Expr initializer;
  private final Block elseBlock;

  public LetDecl(
      SourceRange range, Pat pat, String typeText, Expr initializer, Block elseBlock) {
    super(range);
    assert elseBlock == null || initializer != null;
    this.pat = pat;
    this.typeText = typeText;
    this.initializer = initializer;
    this.elseBlock = elseBlock;
  }

  public Pat getPat() {
    return pat;
  }

  /** Returns the text of the declared type, or null if the type is inferred. */
  public String getTypeText() {
    return typeText;
  }

  public Expr getInitializer() {
    return initializer;
  }

  /** Returns the diverging block of a {@code let ... else} statement, if any. */
  public Block getElseBlock() {
    return elseBlock;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitLetDecl(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(pat);
    acceptIfNotNull(initializer, consumer);
    acceptIfNotNull(elseBlock, consumer);
  }
}
