// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.evaluation;

import com.android.tools.rscfg.errors.SyntaxError;
import com.android.tools.rscfg.syntax.Lexer;
import com.android.tools.rscfg.syntax.Token;
import com.android.tools.rscfg.syntax.Token.Kind;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses attribute text such as {@code cfg(all(unix, target_os = "linux"))} or
 * {@code #[cfg(test)]} into a {@link MetaItem}.
 */
public final class MetaItemParser {

  private final List<Token> tokens;
  private int position = 0;

  private MetaItemParser(String text) {
    this.tokens = Lexer.tokenize(text);
  }

  public static MetaItem parse(String text) {
    return new MetaItemParser(text).parseAttribute();
  }

  public static List<MetaItem> parseAll(String... attributes) {
    List<MetaItem> items = new ArrayList<>(attributes.length);
    for (String attribute : attributes) {
      items.add(parse(attribute));
    }
    return items;
  }

  private MetaItem parseAttribute() {
    MetaItem item;
    if (at("#")) {
      advance();
      if (at("!")) {
        advance();
      }
      expect("[");
      item = parseMetaItem();
      expect("]");
    } else {
      item = parseMetaItem();
    }
    if (peek().kind != Kind.EOF) {
      throw error("Unexpected trailing input");
    }
    return item;
  }

  private MetaItem parseMetaItem() {
    if (peek().isLiteral()) {
      return MetaItem.literal(stringValue(advance()));
    }
    String name = parsePath();
    if (at("=")) {
      advance();
      if (!peek().isLiteral()) {
        throw error("Expected literal");
      }
      String value = stringValue(advance());
      // Only string literals are values; `name = 1` keeps just the name.
      return value != null ? MetaItem.nameValue(name, value) : MetaItem.word(name);
    }
    if (at("(")) {
      advance();
      List<MetaItem> args = new ArrayList<>();
      while (!at(")")) {
        args.add(parseMetaItem());
        if (!at(",")) {
          break;
        }
        advance();
      }
      expect(")");
      return MetaItem.list(name, args);
    }
    return MetaItem.word(name);
  }

  private String parsePath() {
    StringBuilder builder = new StringBuilder();
    if (at("::")) {
      builder.append(advance().text);
    }
    builder.append(expectIdentifier().text);
    while (at("::")) {
      builder.append(advance().text);
      builder.append(expectIdentifier().text);
    }
    return builder.toString();
  }

  /** Returns the value of a string literal token, or {@code null} for other literals. */
  static String stringValue(Token token) {
    if (token.kind != Kind.STRING) {
      return null;
    }
    String text = token.text;
    if (text.startsWith("b")) {
      return null;
    }
    if (text.startsWith("r")) {
      int hashes = text.indexOf('"') - 1;
      return text.substring(hashes + 2, text.length() - hashes - 1);
    }
    return unescape(text.substring(1, text.length() - 1), token.startOffset);
  }

  private static String unescape(String content, int offset) {
    StringBuilder builder = new StringBuilder(content.length());
    for (int i = 0; i < content.length(); i++) {
      char c = content.charAt(i);
      if (c != '\\') {
        builder.append(c);
        continue;
      }
      char escaped = content.charAt(++i);
      switch (escaped) {
        case 'n':
          builder.append('\n');
          break;
        case 'r':
          builder.append('\r');
          break;
        case 't':
          builder.append('\t');
          break;
        case '0':
          builder.append('\0');
          break;
        case '\\':
        case '\'':
        case '"':
          builder.append(escaped);
          break;
        case 'x':
          {
            // Exactly two hex digits, at most 0x7F.
            int value = i + 2 < content.length() ? parseHex(content.substring(i + 1, i + 3)) : -1;
            if (value < 0 || value > 0x7F) {
              throw new SyntaxError("Malformed ASCII escape", offset);
            }
            builder.append((char) value);
            i += 2;
            break;
          }
        case 'u':
          {
            int close = content.indexOf('}', i);
            if (close < 0 || content.charAt(i + 1) != '{') {
              throw new SyntaxError("Malformed unicode escape", offset);
            }
            String digits = content.substring(i + 2, close).replace("_", "");
            int codePoint = digits.length() > 6 ? -1 : parseHex(digits);
            if (codePoint < 0
                || codePoint > Character.MAX_CODE_POINT
                || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
              throw new SyntaxError("Malformed unicode escape", offset);
            }
            builder.appendCodePoint(codePoint);
            i = close;
            break;
          }
        case '\n':
          // Line continuation: skip the newline and the leading whitespace of the next line.
          while (i + 1 < content.length() && Character.isWhitespace(content.charAt(i + 1))) {
            i++;
          }
          break;
        default:
          throw new SyntaxError("Unknown escape '\\" + escaped + "'", offset);
      }
    }
    return builder.toString();
  }

  /** Returns the value of the hex digits {@code digits}, or -1 if they are not all hex digits. */
  private static int parseHex(String digits) {
    if (digits.isEmpty()) {
      return -1;
    }
    int value = 0;
    for (int i = 0; i < digits.length(); i++) {
      int digit = Character.digit(digits.charAt(i), 16);
      if (digit < 0) {
        return -1;
      }
      value = value * 16 + digit;
    }
    return value;
  }

  private Token peek() {
    return tokens.get(position);
  }

  private boolean at(String text) {
    return peek().is(text);
  }

  private Token advance() {
    Token token = peek();
    if (token.kind != Kind.EOF) {
      position++;
    }
    return token;
  }

  private void expect(String expected) {
    if (!at(expected)) {
      throw error("Expected '" + expected + "'");
    }
    advance();
  }

  private Token expectIdentifier() {
    if (!peek().isIdentifier()) {
      throw error("Expected identifier");
    }
    return advance();
  }

  private SyntaxError error(String message) {
    return new SyntaxError(message + " but found " + peek(), peek().startOffset);
  }
}
