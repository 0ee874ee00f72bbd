// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.utils;

import com.google.common.base.Joiner;
import java.util.Arrays;
import java.util.List;

public class StringUtils {

  public static final String LINE_SEPARATOR = "\n";

  public static String lines(String... lines) {
    return lines(Arrays.asList(lines));
  }

  public static String lines(List<String> lines) {
    StringBuilder builder = new StringBuilder();
    for (String line : lines) {
      builder.append(line).append(LINE_SEPARATOR);
    }
    return builder.toString();
  }

  public static String joinLines(Iterable<String> lines) {
    return Joiner.on(LINE_SEPARATOR).join(lines);
  }
}
