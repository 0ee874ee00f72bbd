// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import java.util.function.Consumer;

/** The name bound by an identifier pattern, with its {@code ref} and {@code mut} modifiers. */
public class PatBinding extends Pat {

  private final String name;
  private final boolean isMutable;
  private final boolean isRef;

  public PatBinding(SourceRange range, String name, boolean isMutable, boolean isRef) {
    super(range);
    this.name = name;
    this.isMutable = isMutable;
    this.isRef = isRef;
  }

  public String getName() {
    return name;
  }

  public boolean isMutable() {
    return isMutable;
  }

  public boolean isRef() {
    return isRef;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitPatBinding(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {}
}
