// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

public class StructLiteralExpr extends Expr {

  public static class Field {

    private final String name;
    private final Expr value;

    public Field(String name, Expr value) {
      this.name = name;
      this.value = value;
    }

    public String getName() {
      return name;
    }

    /** Returns the initializer, or null for the shorthand form {@code S { name }}. */
    public Expr getValue() {
      return value;
    }

    public boolean isShorthand() {
      return value == null;
    }
  }

  private final String path;
  private final List<Field> fields;
  private final Expr base;

  public StructLiteralExpr(SourceRange range, String path, List<Field> fields, Expr base) {
    super(range);
    this.path = path;
    this.fields = ImmutableList.copyOf(fields);
    this.base = base;
  }

  public String getPath() {
    return path;
  }

  public List<Field> getFields() {
    return fields;
  }

  /** Returns the functional update base of {@code S { a: 1, ..base }}, if any. */
  public Expr getBase() {
    return base;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitStructLiteralExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    for (Field field : fields) {
      acceptIfNotNull(field.getValue(), consumer);
    }
    acceptIfNotNull(base, consumer);
  }
}
