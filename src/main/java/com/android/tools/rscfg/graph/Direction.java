// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.graph;

public enum Direction {
  OUTGOING(0),
  INCOMING(1);

  final int index;

  Direction(int index) {
    this.index = index;
  }

  public Direction reverse() {
    return this == OUTGOING ? INCOMING : OUTGOING;
  }
}
