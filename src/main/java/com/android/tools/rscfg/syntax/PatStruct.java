// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

public class PatStruct extends Pat {

  /** Either {@code name: pat} or the shorthand binding form {@code ref mut name}. */
  public static class Field {

    private final String name;
    private final Pat pat;
    private final PatBinding binding;

    public Field(String name, Pat pat, PatBinding binding) {
      assert (pat == null) != (binding == null);
      this.name = name;
      this.pat = pat;
      this.binding = binding;
    }

    public String getName() {
      return name;
    }

    public Pat getPat() {
      return pat;
    }

    public PatBinding getBinding() {
      return binding;
    }

    /** Returns the pattern the field value is matched against. */
    public Pat getSubPat() {
      return pat != null ? pat : binding;
    }
  }

  private final String path;
  private final List<Field> fields;
  private final boolean hasRest;

  public PatStruct(SourceRange range, String path, List<Field> fields, boolean hasRest) {
    super(range);
    this.path = path;
    this.fields = ImmutableList.copyOf(fields);
    this.hasRest = hasRest;
  }

  public String getPath() {
    return path;
  }

  public List<Field> getFields() {
    return fields;
  }

  public boolean hasRest() {
    return hasRest;
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitPatStruct(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    for (Field field : fields) {
      consumer.accept(field.getSubPat());
    }
  }
}
