// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.android.tools.rscfg.errors.SyntaxError;
import com.android.tools.rscfg.syntax.Token.Kind;
import java.util.ArrayList;
import java.util.List;

/** Splits Rust source text into tokens, skipping whitespace and comments. */
public final class Lexer {

  // Longest operators first.
  private static final String[] PUNCTUATION = {
    "<<=", ">>=", "...", "..=", "..", "::", "->", "=>", "==", "!=", "<=", ">=", "&&", "||", "+=",
    "-=", "*=", "/=", "%=", "^=", "&=", "|=", "<<", ">>", "+", "-", "*", "/", "%", "^", "!", "&",
    "|", "=", "<", ">", "@", ".", ",", ";", ":", "#", "$", "?", "(", ")", "[", "]", "{", "}", "~"
  };

  private final String text;
  private int offset = 0;

  private Lexer(String text) {
    this.text = text;
  }

  /** Returns the tokens of {@code text}, terminated by an {@link Kind#EOF} token. */
  public static List<Token> tokenize(String text) {
    return new Lexer(text).run();
  }

  private List<Token> run() {
    List<Token> tokens = new ArrayList<>();
    while (true) {
      skipWhitespaceAndComments();
      if (offset >= text.length()) {
        tokens.add(new Token(Kind.EOF, "", offset, offset));
        return tokens;
      }
      tokens.add(next());
    }
  }

  private void skipWhitespaceAndComments() {
    while (offset < text.length()) {
      char c = text.charAt(offset);
      if (Character.isWhitespace(c)) {
        offset++;
      } else if (text.startsWith("//", offset)) {
        int end = text.indexOf('\n', offset);
        offset = end < 0 ? text.length() : end + 1;
      } else if (text.startsWith("/*", offset)) {
        skipBlockComment();
      } else {
        return;
      }
    }
  }

  private void skipBlockComment() {
    int start = offset;
    int depth = 0;
    do {
      if (offset >= text.length()) {
        throw new SyntaxError("Unterminated block comment", start);
      }
      if (text.startsWith("/*", offset)) {
        depth++;
        offset += 2;
      } else if (text.startsWith("*/", offset)) {
        depth--;
        offset += 2;
      } else {
        offset++;
      }
    } while (depth > 0);
  }

  private Token next() {
    int start = offset;
    char c = text.charAt(offset);
    if (c == 'r' && (peekChar(1) == '"' || (peekChar(1) == '#' && peekChar(2) != '['))) {
      return rawString(start, 1);
    }
    if (c == 'b' && peekChar(1) == 'r' && (peekChar(2) == '"' || peekChar(2) == '#')) {
      return rawString(start, 2);
    }
    if (c == 'b' && (peekChar(1) == '"' || peekChar(1) == '\'')) {
      offset++;
      return peekChar(0) == '"' ? string(start) : charLiteral(start);
    }
    if (Character.isJavaIdentifierStart(c) && c != '$') {
      while (offset < text.length() && isIdentifierPart(text.charAt(offset))) {
        offset++;
      }
      return token(Kind.IDENTIFIER, start);
    }
    if (Character.isDigit(c)) {
      return number(start);
    }
    if (c == '"') {
      return string(start);
    }
    if (c == '\'') {
      if (peekChar(1) == '\\' || (peekChar(1) != 0 && peekChar(2) == '\'')) {
        return charLiteral(start);
      }
      if (Character.isJavaIdentifierStart(peekChar(1))) {
        offset++;
        while (offset < text.length() && isIdentifierPart(text.charAt(offset))) {
          offset++;
        }
        return token(Kind.LIFETIME, start);
      }
    }
    for (String punctuation : PUNCTUATION) {
      if (text.startsWith(punctuation, offset)) {
        offset += punctuation.length();
        return token(Kind.PUNCTUATION, start);
      }
    }
    throw new SyntaxError("Unexpected character '" + c + "'", start);
  }

  private Token number(int start) {
    boolean isFloat = false;
    if (text.startsWith("0x", offset)) {
      offset += 2;
      while (offset < text.length()
          && (Character.digit(text.charAt(offset), 16) >= 0 || text.charAt(offset) == '_')) {
        offset++;
      }
      return integerSuffix(start);
    }
    if (text.startsWith("0o", offset) || text.startsWith("0b", offset)) {
      offset += 2;
    }
    skipDigits();
    // A dot only continues the number if it is not a range or a method call.
    if (peekChar(0) == '.' && Character.isDigit(peekChar(1))) {
      isFloat = true;
      offset++;
      skipDigits();
    }
    if ((peekChar(0) == 'e' || peekChar(0) == 'E')
        && (Character.isDigit(peekChar(1))
            || ((peekChar(1) == '+' || peekChar(1) == '-') && Character.isDigit(peekChar(2))))) {
      isFloat = true;
      offset += 2;
      skipDigits();
    }
    // Type suffix, e.g. 1u32 or 2.0f64.
    skipIdentifierPart();
    return token(isFloat ? Kind.FLOAT : Kind.INTEGER, start);
  }

  private Token integerSuffix(int start) {
    skipIdentifierPart();
    return token(Kind.INTEGER, start);
  }

  private void skipIdentifierPart() {
    while (offset < text.length() && isIdentifierPart(text.charAt(offset))) {
      offset++;
    }
  }

  private void skipDigits() {
    while (offset < text.length()
        && (Character.isLetterOrDigit(text.charAt(offset)) || text.charAt(offset) == '_')
        && !(text.charAt(offset) == 'e' || text.charAt(offset) == 'E')
        && !isSuffixStart(text.charAt(offset))) {
      offset++;
    }
  }

  private static boolean isSuffixStart(char c) {
    return c == 'u' || c == 'i' || c == 'f';
  }

  private Token string(int start) {
    offset++;
    while (offset < text.length() && text.charAt(offset) != '"') {
      offset += text.charAt(offset) == '\\' ? 2 : 1;
    }
    if (offset >= text.length()) {
      throw new SyntaxError("Unterminated string literal", start);
    }
    offset++;
    return token(Kind.STRING, start);
  }

  private Token rawString(int start, int prefixLength) {
    offset += prefixLength;
    int hashes = 0;
    while (peekChar(0) == '#') {
      hashes++;
      offset++;
    }
    if (peekChar(0) != '"') {
      throw new SyntaxError("Malformed raw string literal", start);
    }
    String terminator = "\"" + "#".repeat(hashes);
    int end = text.indexOf(terminator, offset + 1);
    if (end < 0) {
      throw new SyntaxError("Unterminated raw string literal", start);
    }
    offset = end + terminator.length();
    return token(Kind.STRING, start);
  }

  private Token charLiteral(int start) {
    offset++;
    while (offset < text.length() && text.charAt(offset) != '\'') {
      offset += text.charAt(offset) == '\\' ? 2 : 1;
    }
    if (offset >= text.length()) {
      throw new SyntaxError("Unterminated character literal", start);
    }
    offset++;
    return token(Kind.CHAR, start);
  }

  private Token token(Kind kind, int start) {
    return new Token(kind, text.substring(start, offset), start, offset);
  }

  private char peekChar(int distance) {
    int index = offset + distance;
    return index < text.length() ? text.charAt(index) : 0;
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
