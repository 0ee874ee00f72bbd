// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.rscfg;

import static org.junit.Assert.assertFalse;

import com.android.tools.rscfg.cfg.ControlFlowGraph;
import com.android.tools.rscfg.scope.RegionScopeTree;
import com.android.tools.rscfg.syntax.FunctionDecl;
import com.android.tools.rscfg.syntax.Parser;
import com.android.tools.rscfg.syntax.SourceFile;
import com.android.tools.rscfg.syntax.SyntaxElement;
import com.android.tools.rscfg.utils.StringUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

public abstract class TestBase {

  public static SourceFile parse(String... lines) {
    return Parser.parseFile(StringUtils.lines(lines));
  }

  public static FunctionDecl parseFirstFunction(String... lines) {
    SourceFile file = parse(lines);
    assertFalse("No function in source", file.getFunctions().isEmpty());
    return file.getFunctions().get(0);
  }

  public static ControlFlowGraph buildControlFlowGraph(FunctionDecl function) {
    RegionScopeTree scopeTree = RegionScopeTree.build(function.getBody());
    return ControlFlowGraph.buildFor(function.getBody(), scopeTree);
  }

  public static ControlFlowGraph buildControlFlowGraph(String... lines) {
    return buildControlFlowGraph(parseFirstFunction(lines));
  }

  /** Joins the expected lines of a traversal trace. */
  public static String trace(String... lines) {
    return StringUtils.joinLines(Arrays.asList(lines));
  }

  /** Returns the elements below {@code root}, including root, in pre-order. */
  public static List<SyntaxElement> collectElements(SyntaxElement root) {
    List<SyntaxElement> elements = new ArrayList<>();
    collectElements(root, elements);
    return elements;
  }

  private static void collectElements(SyntaxElement element, List<SyntaxElement> elements) {
    elements.add(element);
    element.forEachChild(child -> collectElements(child, elements));
  }

  public static <T extends SyntaxElement> T findElement(
      SyntaxElement root, Class<T> clazz, Predicate<? super T> predicate) {
    for (SyntaxElement element : collectElements(root)) {
      if (clazz.isInstance(element) && predicate.test(clazz.cast(element))) {
        return clazz.cast(element);
      }
    }
    throw new AssertionError("No " + clazz.getSimpleName() + " found");
  }

  public static <T extends SyntaxElement> T findElement(
      SyntaxElement root, Class<T> clazz, String text) {
    return findElement(root, clazz, element -> element.getText().equals(text));
  }
}
