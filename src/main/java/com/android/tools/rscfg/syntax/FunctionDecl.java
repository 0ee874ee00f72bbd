// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

public class FunctionDecl {

  private final SourceRange range;
  private final String name;
  private final String returnTypeText;
  private final Block body;

  public FunctionDecl(SourceRange range, String name, String returnTypeText, Block body) {
    this.range = range;
    this.name = name;
    this.returnTypeText = returnTypeText;
    this.body = body;
  }

  public SourceRange getRange() {
    return range;
  }

  public String getName() {
    return name;
  }

  /** Returns the text of the declared return type, or null for functions returning unit. */
  public String getReturnTypeText() {
    return returnTypeText;
  }

  public boolean isNeverReturning() {
    return "!".equals(returnTypeText);
  }

  /** Returns the body, or null for a declaration without a body. */
  public Block getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "fn " + name;
  }
}
