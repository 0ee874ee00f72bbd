// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.rscfg.evaluation;

import static com.android.tools.rscfg.evaluation.ThreeValuedLogic.FALSE;
import static com.android.tools.rscfg.evaluation.ThreeValuedLogic.TRUE;
import static com.android.tools.rscfg.evaluation.ThreeValuedLogic.UNKNOWN;
import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class ThreeValuedLogicTest {

  @Parameters(name = "{0}, {1}")
  public static Collection<Object[]> data() {
    // left, right, left & right, left | right
    return ImmutableList.of(
        new Object[] {TRUE, TRUE, TRUE, TRUE},
        new Object[] {TRUE, FALSE, FALSE, TRUE},
        new Object[] {TRUE, UNKNOWN, UNKNOWN, TRUE},
        new Object[] {FALSE, TRUE, FALSE, TRUE},
        new Object[] {FALSE, FALSE, FALSE, FALSE},
        new Object[] {FALSE, UNKNOWN, FALSE, UNKNOWN},
        new Object[] {UNKNOWN, TRUE, UNKNOWN, TRUE},
        new Object[] {UNKNOWN, FALSE, FALSE, UNKNOWN},
        new Object[] {UNKNOWN, UNKNOWN, UNKNOWN, UNKNOWN});
  }

  private final ThreeValuedLogic left;
  private final ThreeValuedLogic right;
  private final ThreeValuedLogic expectedAnd;
  private final ThreeValuedLogic expectedOr;

  public ThreeValuedLogicTest(
      ThreeValuedLogic left,
      ThreeValuedLogic right,
      ThreeValuedLogic expectedAnd,
      ThreeValuedLogic expectedOr) {
    this.left = left;
    this.right = right;
    this.expectedAnd = expectedAnd;
    this.expectedOr = expectedOr;
  }

  @Test
  public void testAnd() {
    assertEquals(expectedAnd, left.and(right));
  }

  @Test
  public void testOr() {
    assertEquals(expectedOr, left.or(right));
  }

  @Test
  public void testDeMorgan() {
    assertEquals(left.and(right).not(), left.not().or(right.not()));
  }

  @Test
  public void testNot() {
    ThreeValuedLogic expected = left == TRUE ? FALSE : left == FALSE ? TRUE : UNKNOWN;
    assertEquals(expected, left.not());
    assertEquals(left, left.not().not());
  }
}
