// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

/** A lexical token, with its offsets in the source text. */
public final class Token {

  public enum Kind {
    IDENTIFIER,
    LIFETIME,
    INTEGER,
    FLOAT,
    STRING,
    CHAR,
    PUNCTUATION,
    EOF
  }

  public final Kind kind;
  public final String text;
  public final int startOffset;
  public final int endOffset;

  Token(Kind kind, String text, int startOffset, int endOffset) {
    this.kind = kind;
    this.text = text;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  public boolean is(String text) {
    return (kind == Kind.PUNCTUATION || kind == Kind.IDENTIFIER) && this.text.equals(text);
  }

  public boolean isIdentifier() {
    return kind == Kind.IDENTIFIER;
  }

  public boolean isLiteral() {
    return kind == Kind.INTEGER
        || kind == Kind.FLOAT
        || kind == Kind.STRING
        || kind == Kind.CHAR
        || is("true")
        || is("false");
  }

  @Override
  public String toString() {
    return kind == Kind.EOF ? "<eof>" : "'" + text + "'";
  }
}
