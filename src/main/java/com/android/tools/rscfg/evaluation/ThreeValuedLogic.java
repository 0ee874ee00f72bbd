// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.evaluation;

import com.android.tools.rscfg.errors.Unreachable;

/**
 * Kleene's three-valued logic.
 *
 * <ul>
 *   <li>{@code !UNKNOWN == UNKNOWN}
 *   <li>{@code TRUE && UNKNOWN == UNKNOWN}, {@code FALSE && UNKNOWN == FALSE}
 *   <li>{@code TRUE || UNKNOWN == TRUE}, {@code FALSE || UNKNOWN == UNKNOWN}
 * </ul>
 */
public enum ThreeValuedLogic {
  TRUE,
  FALSE,
  UNKNOWN;

  public static ThreeValuedLogic fromBoolean(boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean isTrue() {
    return this == TRUE;
  }

  public boolean isFalse() {
    return this == FALSE;
  }

  public boolean isUnknown() {
    return this == UNKNOWN;
  }

  public ThreeValuedLogic and(ThreeValuedLogic other) {
    switch (this) {
      case TRUE:
        return other;
      case FALSE:
        return FALSE;
      case UNKNOWN:
        return other == FALSE ? FALSE : UNKNOWN;
      default:
        throw new Unreachable("Unexpected value " + this);
    }
  }

  public ThreeValuedLogic or(ThreeValuedLogic other) {
    switch (this) {
      case TRUE:
        return TRUE;
      case FALSE:
        return other;
      case UNKNOWN:
        return other == TRUE ? TRUE : UNKNOWN;
      default:
        throw new Unreachable("Unexpected value " + this);
    }
  }

  public ThreeValuedLogic not() {
    switch (this) {
      case TRUE:
        return FALSE;
      case FALSE:
        return TRUE;
      case UNKNOWN:
        return UNKNOWN;
      default:
        throw new Unreachable("Unexpected value " + this);
    }
  }
}
