// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A macro invocation such as {@code vec![1, 2]}.
 *
 * <p>Macro arguments are not expanded, the invocation is an opaque leaf.
 */
public class MacroExpr extends Expr {

  private static final Set<String> DIVERGING_MACROS =
      ImmutableSet.of("panic", "unreachable", "todo", "unimplemented");

  private final String macroName;
  private final char delimiter;

  public MacroExpr(SourceRange range, String macroName, char delimiter) {
    super(range);
    this.macroName = macroName;
    this.delimiter = delimiter;
  }

  /** Returns the last path segment of the macro name, e.g. {@code panic} for {@code std::panic}. */
  public String getMacroName() {
    int index = macroName.lastIndexOf("::");
    return index < 0 ? macroName : macroName.substring(index + 2);
  }

  public char getDelimiter() {
    return delimiter;
  }

  @Override
  public boolean isNeverTyped() {
    return DIVERGING_MACROS.contains(getMacroName());
  }

  @Override
  public boolean isBlockLike() {
    return delimiter == '{';
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitMacroExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {}
}
