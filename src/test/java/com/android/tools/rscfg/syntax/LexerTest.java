// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.rscfg.syntax;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import com.android.tools.rscfg.errors.SyntaxError;
import com.android.tools.rscfg.syntax.Token.Kind;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class LexerTest {

  private static List<String> texts(String source) {
    List<String> texts = new ArrayList<>();
    for (Token token : Lexer.tokenize(source)) {
      if (token.kind != Kind.EOF) {
        texts.add(token.text);
      }
    }
    return texts;
  }

  private static List<Kind> kinds(String source) {
    List<Kind> kinds = new ArrayList<>();
    for (Token token : Lexer.tokenize(source)) {
      kinds.add(token.kind);
    }
    return kinds;
  }

  @Test
  public void testRangeIsNotAFloat() {
    assertEquals(ImmutableList.of("0", "..", "x", ".", "len"), texts("0..x.len"));
    assertEquals(ImmutableList.of("0", "...", "10"), texts("0...10"));
    assertEquals(ImmutableList.of("1", "..=", "2"), texts("1..=2"));
  }

  @Test
  public void testNumbers() {
    assertEquals(
        ImmutableList.of(
            Kind.INTEGER, Kind.FLOAT, Kind.FLOAT, Kind.INTEGER, Kind.INTEGER, Kind.EOF),
        kinds("42u32 1.5e3f64 1e10 0xff_u8 0b1010"));
    assertEquals(ImmutableList.of("0xE5"), texts("0xE5"));
  }

  @Test
  public void testLifetimesAndChars() {
    assertEquals(
        ImmutableList.of(Kind.LIFETIME, Kind.PUNCTUATION, Kind.CHAR, Kind.CHAR, Kind.EOF),
        kinds("'a: 'c' '\\n'"));
    assertEquals(ImmutableList.of("break", "'outer"), texts("break 'outer"));
  }

  @Test
  public void testStrings() {
    assertEquals(ImmutableList.of("\"a\\\"b\""), texts("\"a\\\"b\""));
    assertEquals(ImmutableList.of("r#\"a\"b\"#"), texts("r#\"a\"b\"#"));
    assertEquals(ImmutableList.of(Kind.STRING, Kind.EOF), kinds("b\"bytes\""));
  }

  @Test
  public void testCommentsAreSkipped() {
    assertEquals(
        ImmutableList.of("a", "b"), texts("a // line\n /* block /* nested */ still */ b"));
  }

  @Test
  public void testLongestPunctuation() {
    assertEquals(ImmutableList.of("a", ">>=", "b", "=>", "c", "::", "d"), texts("a >>= b => c::d"));
  }

  @Test
  public void testOffsets() {
    List<Token> tokens = Lexer.tokenize("  foo(1)");
    assertEquals(2, tokens.get(0).startOffset);
    assertEquals(5, tokens.get(0).endOffset);
    assertEquals(8, tokens.get(tokens.size() - 1).startOffset);
  }

  @Test
  public void testUnterminatedString() {
    SyntaxError error = assertThrows(SyntaxError.class, () -> Lexer.tokenize("x = \"abc"));
    assertEquals(4, error.getOffset());
  }
}
