// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.cfg;

import com.android.tools.rscfg.graph.Graph;
import com.android.tools.rscfg.scope.ScopeTree;
import com.android.tools.rscfg.syntax.Block;
import com.android.tools.rscfg.syntax.SyntaxElement;
import com.android.tools.rscfg.utils.Timing;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.BitSet;

/**
 * The control flow graph of a function body.
 *
 * <p>The graph has a single entry and a single exit node. Nodes without a path from the entry
 * correspond to unreachable code.
 */
public class ControlFlowGraph {

  private final Block body;
  private final Graph<CfgNodeData, CfgEdgeData> graph;
  private final int entry;
  private final int exit;
  private final BitSet reachable;

  ControlFlowGraph(Block body, Graph<CfgNodeData, CfgEdgeData> graph, int entry, int exit) {
    this.body = body;
    this.graph = graph;
    this.entry = entry;
    this.exit = exit;
    this.reachable = graph.computeReachable(entry);
  }

  public static ControlFlowGraph buildFor(Block body, ScopeTree scopeTree) {
    return buildFor(body, scopeTree, Timing.empty());
  }

  public static ControlFlowGraph buildFor(Block body, ScopeTree scopeTree, Timing timing) {
    return timing.time("Build control flow graph", () -> new CfgBuilder(scopeTree).build(body));
  }

  public Block getBody() {
    return body;
  }

  public Graph<CfgNodeData, CfgEdgeData> getGraph() {
    return graph;
  }

  public int getEntry() {
    return entry;
  }

  public int getExit() {
    return exit;
  }

  /** Returns false if every path through the body diverges, e.g. ends in an infinite loop. */
  public boolean isExitReachable() {
    return isReachable(exit);
  }

  public boolean isReachable(int node) {
    return reachable.get(node);
  }

  /** Returns true if some node for {@code element} can be reached from the entry. */
  public boolean isReachable(SyntaxElement element) {
    IntList nodes = getNodesFor(element);
    for (int i = 0; i < nodes.size(); i++) {
      if (isReachable(nodes.getInt(i))) {
        return true;
      }
    }
    return false;
  }

  /** Returns the nodes that wrap {@code element}. */
  public IntList getNodesFor(SyntaxElement element) {
    assert element != null;
    IntList nodes = new IntArrayList();
    for (int node = 0; node < graph.getNodeCount(); node++) {
      if (graph.getNodeData(node).getElement() == element) {
        nodes.add(node);
      }
    }
    return nodes;
  }

  public String depthFirstTraversalTrace() {
    return graph.depthFirstTraversalTrace(entry);
  }

  @Override
  public String toString() {
    return "ControlFlowGraph(nodes: "
        + graph.getNodeCount()
        + ", edges: "
        + graph.getEdgeCount()
        + ")";
  }
}
