// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;

public class SourceFile {

  private final String text;
  private final List<FunctionDecl> functions;

  public SourceFile(String text, List<FunctionDecl> functions) {
    this.text = text;
    this.functions = ImmutableList.copyOf(functions);
  }

  public String getText() {
    return text;
  }

  public List<FunctionDecl> getFunctions() {
    return functions;
  }

  /** Returns the first function with the given name, or null if there is none. */
  public FunctionDecl getFunction(String name) {
    for (FunctionDecl function : functions) {
      if (function.getName().equals(name)) {
        return function;
      }
    }
    return null;
  }
}
