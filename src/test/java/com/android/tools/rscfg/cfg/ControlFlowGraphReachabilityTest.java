// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.rscfg.cfg;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.android.tools.rscfg.TestBase;
import com.android.tools.rscfg.errors.Unreachable;
import com.android.tools.rscfg.graph.Graph;
import com.android.tools.rscfg.scope.Scope;
import com.android.tools.rscfg.syntax.BreakExpr;
import com.android.tools.rscfg.syntax.ExprStmt;
import com.android.tools.rscfg.syntax.FunctionDecl;
import com.android.tools.rscfg.syntax.LitExpr;
import com.android.tools.rscfg.syntax.LoopExpr;
import com.android.tools.rscfg.syntax.MacroExpr;
import com.android.tools.rscfg.syntax.MatchArmGuard;
import com.android.tools.rscfg.syntax.PathExpr;
import com.android.tools.rscfg.syntax.ReturnExpr;
import com.android.tools.rscfg.syntax.SyntaxElement;
import com.android.tools.rscfg.syntax.TryExpr;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.List;
import org.junit.Test;

public class ControlFlowGraphReachabilityTest extends TestBase {

  private static int singleNode(ControlFlowGraph cfg, SyntaxElement element) {
    IntList nodes = cfg.getNodesFor(element);
    assertEquals(1, nodes.size());
    return nodes.getInt(0);
  }

  private static CfgEdgeData singleOutgoingEdge(ControlFlowGraph cfg, int node) {
    IntList edges = cfg.getGraph().getOutgoingEdges(node);
    assertEquals(1, edges.size());
    return cfg.getGraph().getEdgeData(edges.getInt(0));
  }

  @Test
  public void testCodeAfterConditionalBreakIsReachable() {
    FunctionDecl function =
        parseFirstFunction(
            "fn main() {",
            "    while cond {",
            "        op;",
            "        if g { break; }",
            "    }",
            "    after;",
            "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertTrue(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "op")));
    assertTrue(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "after")));
    assertTrue(cfg.isExitReachable());
  }

  @Test
  public void testInfiniteLoop() {
    FunctionDecl function = parseFirstFunction("fn main() {", "    loop { x; }", "    y;", "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertTrue(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "x")));
    assertFalse(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "y")));
    assertFalse(cfg.isReachable(findElement(function.getBody(), LoopExpr.class, e -> true)));
    assertFalse(cfg.isExitReachable());
  }

  @Test
  public void testBreakWithValueLeavesLoop() {
    FunctionDecl function =
        parseFirstFunction(
            "fn main() -> i32 {", "    let v = loop { break 5; };", "    v", "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertTrue(cfg.isReachable(findElement(function.getBody(), LoopExpr.class, e -> true)));
    assertTrue(cfg.isExitReachable());
    assertEquals(
        String.join(
            "\n",
            "Entry",
            "Dummy",
            "5",
            "break 5",
            "LOOP",
            "v",
            "v",
            "let v = loop { break 5; };",
            "v",
            "BLOCK",
            "Exit"),
        cfg.depthFirstTraversalTrace());
  }

  @Test
  public void testReturnExitsEveryScope() {
    FunctionDecl function =
        parseFirstFunction("fn main() {", "    let a = 1;", "    { return; }", "    a;", "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    ReturnExpr returnExpr = findElement(function.getBody(), ReturnExpr.class, e -> true);
    int returnNode = singleNode(cfg, returnExpr);
    IntList edges = cfg.getGraph().getOutgoingEdges(returnNode);
    assertEquals(1, edges.size());
    assertEquals(cfg.getExit(), cfg.getGraph().getTarget(edges.getInt(0)));
    List<Scope> exitingScopes = cfg.getGraph().getEdgeData(edges.getInt(0)).getExitingScopes();
    assertEquals(Scope.node(returnExpr), exitingScopes.get(0));
    assertEquals(
        Scope.destruction(function.getBody()), exitingScopes.get(exitingScopes.size() - 1));
    assertThat(exitingScopes, hasItem(Scope.remainder(function.getBody(), 0)));
    assertFalse(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "a")));
    assertTrue(cfg.isExitReachable());
  }

  @Test
  public void testBreakExitsScopesUpToTheLoop() {
    FunctionDecl function =
        parseFirstFunction("fn main() {", "    loop {", "        { break; }", "    }", "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    LoopExpr loop = findElement(function.getBody(), LoopExpr.class, e -> true);
    BreakExpr breakExpr = findElement(function.getBody(), BreakExpr.class, e -> true);
    CfgEdgeData edge = singleOutgoingEdge(cfg, singleNode(cfg, breakExpr));
    assertTrue(edge.isExiting());
    assertEquals(Scope.node(breakExpr), edge.getExitingScopes().get(0));
    assertThat(edge.getExitingScopes(), hasItem(Scope.destruction(loop.getBody())));
    assertThat(edge.getExitingScopes(), not(hasItem(Scope.node(loop))));
    assertTrue(cfg.isReachable(loop));
    assertTrue(cfg.isExitReachable());
  }

  @Test
  public void testEntryAndExitNodes() {
    ControlFlowGraph cfg = buildControlFlowGraph("fn main() {", "    a;", "}");
    Graph<CfgNodeData, CfgEdgeData> graph = cfg.getGraph();
    assertEquals(CfgNodeData.Kind.ENTRY, graph.getNodeData(cfg.getEntry()).getKind());
    assertEquals(CfgNodeData.Kind.EXIT, graph.getNodeData(cfg.getExit()).getKind());
    assertFalse(graph.getNodeData(cfg.getEntry()).isAst());
    assertTrue(graph.getIncomingEdges(cfg.getEntry()).isEmpty());
    assertTrue(graph.getOutgoingEdges(cfg.getExit()).isEmpty());
    PathExpr path = findElement(cfg.getBody(), PathExpr.class, "a");
    CfgNodeData data = graph.getNodeData(singleNode(cfg, path));
    assertTrue(data.isAst());
    assertEquals(path, data.getElement());
  }

  @Test
  public void testFallThroughEdgesExitNoScope() {
    ControlFlowGraph cfg = buildControlFlowGraph("fn main() {", "    a;", "}");
    Graph<CfgNodeData, CfgEdgeData> graph = cfg.getGraph();
    for (int edge = 0; edge < graph.getEdgeCount(); edge++) {
      assertFalse(graph.getEdgeData(edge).isExiting());
    }
  }

  @Test
  public void testLabeledBlock() {
    FunctionDecl function =
        parseFirstFunction(
            "fn main() {",
            "    let x = 'a: {",
            "        if c { break 'a 1; }",
            "        2",
            "    };",
            "    x;",
            "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertTrue(cfg.isReachable(findElement(function.getBody(), LitExpr.class, "1")));
    assertTrue(cfg.isReachable(findElement(function.getBody(), LitExpr.class, "2")));
    assertTrue(cfg.isReachable(findElement(function.getBody(), ExprStmt.class, "x;")));
  }

  @Test
  public void testLabeledContinue() {
    FunctionDecl function =
        parseFirstFunction(
            "fn main() {",
            "    'outer: for x in xs {",
            "        for y in ys {",
            "            if y { continue 'outer; }",
            "            inner;",
            "        }",
            "        after_inner;",
            "    }",
            "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertTrue(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "inner")));
    assertTrue(
        cfg.isReachable(
            findElement(function.getBody(), PathExpr.class, "after_inner")));
    assertTrue(cfg.isExitReachable());
  }

  @Test
  public void testBreakToUnknownLabel() {
    FunctionDecl function =
        parseFirstFunction("fn main() {", "    loop { break 'missing; }", "}");
    assertThrows(Unreachable.class, () -> buildControlFlowGraph(function));
  }

  @Test
  public void testBreakOutsideOfLoop() {
    FunctionDecl function = parseFirstFunction("fn main() {", "    break;", "}");
    assertThrows(Unreachable.class, () -> buildControlFlowGraph(function));
  }

  @Test
  public void testContinueToLabeledBlock() {
    FunctionDecl function =
        parseFirstFunction("fn main() {", "    'a: { continue 'a; }", "}");
    assertThrows(Unreachable.class, () -> buildControlFlowGraph(function));
  }

  @Test
  public void testProcessExitDiverges() {
    FunctionDecl function =
        parseFirstFunction("fn main() {", "    std::process::exit(1);", "    after;", "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertFalse(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "after")));
    assertFalse(cfg.isExitReachable());
  }

  @Test
  public void testDivergingMacroHasNoNode() {
    FunctionDecl function =
        parseFirstFunction("fn main() {", "    todo!();", "    after;", "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    MacroExpr macro = findElement(function.getBody(), MacroExpr.class, e -> true);
    assertTrue(cfg.getNodesFor(macro).isEmpty());
    assertFalse(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "after")));
  }

  @Test
  public void testMatchWithDivergingArms() {
    FunctionDecl function =
        parseFirstFunction(
            "fn main() {",
            "    match x {",
            "        true => return,",
            "        false => panic!(\"no\"),",
            "    };",
            "    after;",
            "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertTrue(cfg.isReachable(findElement(function.getBody(), ReturnExpr.class, e -> true)));
    assertFalse(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "after")));
    assertTrue(cfg.isExitReachable());
  }

  @Test
  public void testFailingGuardFallsThroughToNextGuard() {
    FunctionDecl function =
        parseFirstFunction(
            "fn main() {",
            "    match x {",
            "        A if g1 => 1,",
            "        B if g2 => 2,",
            "        _ => 3,",
            "    }",
            "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    int firstGuard =
        singleNode(cfg, findElement(function.getBody(), MatchArmGuard.class, "if g1"));
    int secondCondition = singleNode(cfg, findElement(function.getBody(), PathExpr.class, "g2"));
    IntList secondGuardStart = cfg.getGraph().getPredecessors(secondCondition);
    assertEquals(1, secondGuardStart.size());
    assertEquals(
        CfgNodeData.Kind.DUMMY, cfg.getGraph().getNodeData(secondGuardStart.getInt(0)).getKind());
    assertTrue(cfg.getGraph().getPredecessors(secondGuardStart.getInt(0)).contains(firstGuard));
  }

  @Test
  public void testTryReturnsEarly() {
    FunctionDecl function =
        parseFirstFunction(
            "fn main() -> Option<i32> {", "    let v = g()?;", "    Some(v)", "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    int tryNode = singleNode(cfg, findElement(function.getBody(), TryExpr.class, e -> true));
    IntList check = cfg.getGraph().getPredecessors(tryNode);
    assertEquals(1, check.size());
    IntList successors = cfg.getGraph().getSuccessors(check.getInt(0));
    assertEquals(2, successors.size());
    assertTrue(successors.contains(cfg.getExit()));
    assertTrue(successors.contains(tryNode));
    assertTrue(cfg.isExitReachable());
  }

  @Test
  public void testLetElse() {
    FunctionDecl function =
        parseFirstFunction(
            "fn main() {",
            "    let Some(v) = o else { return; };",
            "    v;",
            "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertTrue(cfg.isReachable(findElement(function.getBody(), ReturnExpr.class, e -> true)));
    assertTrue(cfg.isReachable(findElement(function.getBody(), ExprStmt.class, "v;")));
  }

  @Test
  public void testClosureBodyIsNotWalked() {
    FunctionDecl function =
        parseFirstFunction("fn main() {", "    let c = || return;", "    after;", "}");
    ControlFlowGraph cfg = buildControlFlowGraph(function);
    assertTrue(
        cfg.getNodesFor(findElement(function.getBody(), ReturnExpr.class, e -> true)).isEmpty());
    assertTrue(cfg.isReachable(findElement(function.getBody(), PathExpr.class, "after")));
    assertEquals(
        String.join(
            "\n", "Entry", "CLOSURE", "c", "c", "let c = || return;", "after", "after;", "BLOCK",
            "Exit"),
        cfg.depthFirstTraversalTrace());
  }
}
