// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.utils;

import java.util.concurrent.atomic.AtomicInteger;

/** Hit counter that lets tests observe which branch of an analysis was taken. */
public final class Testmark {

  private final String name;
  private final AtomicInteger hits = new AtomicInteger();

  public Testmark(String name) {
    this.name = name;
  }

  public void hit() {
    hits.incrementAndGet();
  }

  public int getHitCount() {
    return hits.get();
  }

  public boolean isHit() {
    return getHitCount() > 0;
  }

  public void reset() {
    hits.set(0);
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name + "(" + getHitCount() + ")";
  }
}
