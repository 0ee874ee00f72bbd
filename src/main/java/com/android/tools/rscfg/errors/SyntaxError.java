// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.errors;

public class SyntaxError extends RuntimeException {

  private final int offset;

  public SyntaxError(String message, int offset) {
    super(message + " at offset " + offset);
    this.offset = offset;
  }

  public int getOffset() {
    return offset;
  }
}
