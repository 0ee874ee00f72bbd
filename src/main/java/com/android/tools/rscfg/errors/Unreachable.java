// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.errors;

/**
 * Exception used for code paths that are assumed to never be executed.
 *
 * <p>Reaching one of these means that the caller violated a structural precondition, for example
 * by handing the control flow graph builder a syntax tree the parser could never have produced.
 */
public class Unreachable extends RuntimeException {

  public Unreachable() {}

  public Unreachable(String message) {
    super(message);
  }

  public Unreachable(Throwable cause) {
    super(cause);
  }
}
