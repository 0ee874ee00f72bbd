// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.utils;

import java.io.PrintStream;

public class AnalysisOptions {

  public boolean printTimes = System.getProperty("com.android.tools.rscfg.printtimes") != null;

  public long printTimesMinimumMicros =
      parseSystemPropertyOrDefault("com.android.tools.rscfg.printtimes.minvalue_us", 0);

  public PrintStream timingOutput = System.out;

  private final TestingOptions testing = new TestingOptions();

  public TestingOptions testing() {
    return testing;
  }

  private static long parseSystemPropertyOrDefault(String propertyName, long defaultValue) {
    String propertyValue = System.getProperty(propertyName);
    if (propertyValue == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(propertyValue);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Expected value of " + propertyName + " to be a number, but was: " + propertyValue, e);
    }
  }

  public static class TestingOptions {

    // The `test` cfg flag is only meaningful when analysing code under test, so it is left
    // undecided unless explicitly requested.
    public boolean evaluateTestCfgLiterally = false;

    public final Testmark cfgEvaluatesTrue = new Testmark("evaluatesTrue");
    public final Testmark cfgEvaluatesFalse = new Testmark("evaluatesFalse");
    public final Testmark cfgEvaluatesUnknown = new Testmark("evaluatesUnknown");
  }
}
