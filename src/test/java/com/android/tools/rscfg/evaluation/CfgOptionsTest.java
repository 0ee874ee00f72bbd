// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.rscfg.evaluation;

import static com.android.tools.rscfg.utils.StringUtils.lines;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.android.tools.rscfg.errors.SyntaxError;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

public class CfgOptionsTest {

  private static final String RUSTC_PRINT_CFG =
      lines(
          "debug_assertions",
          "panic=\"unwind\"",
          "target_arch=\"x86_64\"",
          "target_endian=\"little\"",
          "target_env=\"gnu\"",
          "target_family=\"unix\"",
          "target_feature=\"fxsr\"",
          "target_feature=\"sse\"",
          "target_feature=\"sse2\"",
          "target_os=\"linux\"",
          "target_pointer_width=\"64\"",
          "target_vendor=\"unknown\"",
          "unix");

  @Test
  public void testParse() {
    CfgOptions options = CfgOptions.parse(RUSTC_PRINT_CFG);
    assertTrue(options.isComplete());
    assertEquals(ImmutableSet.of("debug_assertions", "unix"), options.getEnabledNames());
    assertEquals(
        ImmutableSet.of("fxsr", "sse", "sse2"), options.getNameValues().get("target_feature"));
    assertTrue(options.isNameValueEnabled("target_os", "linux"));
    assertFalse(options.isNameValueEnabled("target_os", "windows"));
  }

  @Test
  public void testParsedOptionsAreComplete() {
    CfgOptions options = CfgOptions.parse(RUSTC_PRINT_CFG);
    assertTrue(options.isNameDefined("windows"));
    assertFalse(options.isNameEnabled("windows"));
    assertTrue(options.isNameValueDefined("target_has_atomic"));
    CfgEvaluator evaluator = new CfgEvaluator(options);
    assertEquals(
        ThreeValuedLogic.TRUE,
        evaluator.evaluate(MetaItemParser.parseAll("cfg(all(unix, not(windows)))")));
    assertEquals(
        ThreeValuedLogic.FALSE,
        evaluator.evaluate(MetaItemParser.parseAll("cfg(target_pointer_width = \"32\")")));
  }

  @Test
  public void testBuiltOptionsDefineOnlyWhatTheyMention() {
    CfgOptions options =
        CfgOptions.builder().enable("unix").disable("windows").defineKey("target_env").build();
    assertFalse(options.isComplete());
    assertTrue(options.isNameDefined("unix"));
    assertTrue(options.isNameDefined("windows"));
    assertFalse(options.isNameDefined("debug_assertions"));
    assertTrue(options.isNameValueDefined("target_env"));
    assertFalse(options.isNameValueEnabled("target_env", "gnu"));
    assertFalse(options.isNameValueDefined("target_os"));
    assertFalse(CfgOptions.empty().isNameDefined("unix"));
  }

  @Test
  public void testParseRejectsPredicates() {
    assertThrows(SyntaxError.class, () -> CfgOptions.parse("all(unix)"));
    assertThrows(SyntaxError.class, () -> CfgOptions.parse("\"unix\""));
  }
}
