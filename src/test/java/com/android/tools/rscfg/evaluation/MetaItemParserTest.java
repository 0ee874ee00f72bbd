// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.rscfg.evaluation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.android.tools.rscfg.errors.SyntaxError;
import com.android.tools.rscfg.syntax.Lexer;
import org.junit.Test;

public class MetaItemParserTest {

  @Test
  public void testNestedList() {
    MetaItem item = MetaItemParser.parse("#[cfg(all(unix, target_os = \"linux\"))]");
    assertEquals("cfg", item.getName());
    assertEquals(1, item.getArgs().size());
    MetaItem all = item.getArgs().get(0);
    assertEquals("all", all.getName());
    assertEquals(MetaItem.word("unix").toString(), all.getArgs().get(0).toString());
    MetaItem targetOs = all.getArgs().get(1);
    assertEquals("target_os", targetOs.getName());
    assertEquals("linux", targetOs.getValue());
    assertFalse(targetOs.hasArgs());
    assertEquals("cfg(all(unix, target_os = \"linux\"))", item.toString());
  }

  @Test
  public void testInnerAttribute() {
    MetaItem item = MetaItemParser.parse("#![cfg(test)]");
    assertEquals("cfg(test)", item.toString());
  }

  @Test
  public void testEmptyArgumentList() {
    MetaItem item = MetaItemParser.parse("cfg()");
    assertTrue(item.hasArgs());
    assertTrue(item.getArgs().isEmpty());
    assertFalse(MetaItemParser.parse("cfg").hasArgs());
  }

  @Test
  public void testPathsAndLiterals() {
    MetaItem item = MetaItemParser.parse("cfg(std::foo, \"lit\", 1)");
    assertEquals("std::foo", item.getArgs().get(0).getName());
    assertNull(item.getArgs().get(1).getName());
    assertEquals("lit", item.getArgs().get(1).getValue());
    assertNull(item.getArgs().get(2).getValue());
  }

  @Test
  public void testNonStringValueKeepsName() {
    MetaItem item = MetaItemParser.parse("cfg(feature = 1)").getArgs().get(0);
    assertEquals("feature", item.getName());
    assertNull(item.getValue());
  }

  @Test
  public void testStringValues() {
    assertEquals("a\tb\"c\\", value("\"a\\tb\\\"c\\\\\""));
    assertEquals("\u00e9", value("\"\\u{e9}\""));
    assertEquals("a\\n", value("r\"a\\n\""));
    assertEquals("x\"y", value("r#\"x\"y\"#"));
    assertEquals("ab", value("\"a\\\n    b\""));
    assertNull(value("b\"bytes\""));
    assertNull(value("42"));
  }

  @Test
  public void testHexAndUnicodeEscapes() {
    assertEquals("linux", value("\"\\x6cinux\""));
    assertEquals("linux", value("\"\\u{6_c}inux\""));
    assertEquals(new String(Character.toChars(0x1F600)), value("\"\\u{1_F600}\""));
  }

  @Test
  public void testEscapedValuesEvaluate() {
    CfgEvaluator evaluator =
        new CfgEvaluator(CfgOptions.builder().addNameValue("target_os", "linux").build());
    assertTrue(
        evaluator.evaluate(MetaItemParser.parseAll("#[cfg(target_os = \"\\x6cinux\")]")).isTrue());
    assertTrue(
        evaluator
            .evaluate(MetaItemParser.parseAll("#[cfg(target_os = \"\\u{6_c}inux\")]"))
            .isTrue());
  }

  @Test
  public void testMalformedHexAndUnicodeEscapes() {
    assertThrows(SyntaxError.class, () -> value("\"\\x8f\""));
    assertThrows(SyntaxError.class, () -> value("\"\\xg1\""));
    assertThrows(SyntaxError.class, () -> value("\"\\x6\""));
    assertThrows(SyntaxError.class, () -> value("\"\\u{}\""));
    assertThrows(SyntaxError.class, () -> value("\"\\u{zz}\""));
    assertThrows(SyntaxError.class, () -> value("\"\\u{110000}\""));
    assertThrows(SyntaxError.class, () -> value("\"\\u{d800}\""));
  }

  @Test
  public void testUnknownEscape() {
    assertThrows(SyntaxError.class, () -> value("\"\\q\""));
  }

  @Test
  public void testErrors() {
    SyntaxError unclosed = assertThrows(SyntaxError.class, () -> MetaItemParser.parse("cfg(unix"));
    assertEquals(8, unclosed.getOffset());
    assertThrows(SyntaxError.class, () -> MetaItemParser.parse("cfg(unix))"));
    assertThrows(SyntaxError.class, () -> MetaItemParser.parse("cfg(a = b)"));
    assertThrows(SyntaxError.class, () -> MetaItemParser.parse("#[cfg(unix)"));
  }

  @Test
  public void testParseAll() {
    assertEquals(2, MetaItemParser.parseAll("cfg(unix)", "#[cfg(windows)]").size());
  }

  private static String value(String literal) {
    return MetaItemParser.stringValue(Lexer.tokenize(literal).get(0));
  }
}
