// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

/** A half-open range of offsets into the text of a source file. */
public final class SourceRange {

  private final String fileText;
  private final int startOffset;
  private final int endOffset;

  public SourceRange(String fileText, int startOffset, int endOffset) {
    assert 0 <= startOffset && startOffset <= endOffset && endOffset <= fileText.length();
    this.fileText = fileText;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
  }

  public int getStartOffset() {
    return startOffset;
  }

  public int getEndOffset() {
    return endOffset;
  }

  public String getText() {
    return fileText.substring(startOffset, endOffset);
  }

  public SourceRange withEnd(int newEndOffset) {
    return new SourceRange(fileText, startOffset, newEndOffset);
  }

  @Override
  public String toString() {
    return "[" + startOffset + ", " + endOffset + ")";
  }
}
