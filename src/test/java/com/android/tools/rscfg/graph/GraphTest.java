// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.rscfg.graph;

import static com.android.tools.rscfg.utils.StringUtils.joinLines;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.BitSet;
import org.junit.Test;

public class GraphTest {

  private static IntList ints(int... values) {
    return IntArrayList.wrap(values);
  }

  @Test
  public void testIncidentEdgesAreLinkedNewestFirst() {
    Graph.Builder<String, String> builder = Graph.builder();
    int a = builder.addNode("a");
    int b = builder.addNode("b");
    int c = builder.addNode("c");
    int ab = builder.addEdge(a, b, "ab");
    int ac = builder.addEdge(a, c, "ac");
    int cb = builder.addEdge(c, b, "cb");
    Graph<String, String> graph = builder.build();

    assertEquals(3, graph.getNodeCount());
    assertEquals(3, graph.getEdgeCount());
    assertEquals("ac", graph.getEdgeData(ac));
    assertEquals(c, graph.getSource(cb));
    assertEquals(b, graph.getTarget(cb));
    assertEquals(b, graph.getIncidentNode(cb, Direction.OUTGOING));
    assertEquals(c, graph.getIncidentNode(cb, Direction.INCOMING));

    IntArrayList visited = new IntArrayList();
    graph.forEachIncidentEdge(a, Direction.OUTGOING, visited::add);
    assertEquals(ints(ac, ab), visited);

    assertEquals(ints(ab, ac), graph.getOutgoingEdges(a));
    assertEquals(ints(ab, cb), graph.getIncomingEdges(b));
    assertEquals(ints(b, c), graph.getSuccessors(a));
    assertEquals(ints(a, c), graph.getPredecessors(b));
    assertTrue(graph.getIncomingEdges(a).isEmpty());
  }

  @Test
  public void testParallelEdges() {
    Graph.Builder<String, String> builder = Graph.builder();
    int a = builder.addNode("a");
    int b = builder.addNode("b");
    builder.addEdge(a, b, "first");
    builder.addEdge(a, b, "second");
    Graph<String, String> graph = builder.build();
    assertEquals(ints(b, b), graph.getSuccessors(a));
    assertEquals(ints(a, b), graph.depthFirstTraversal(a));
  }

  @Test
  public void testDepthFirstTraversalFollowsOldestEdgeFirst() {
    //    a
    //   / \
    //  b   c
    //   \ /
    //    d
    Graph.Builder<String, String> builder = Graph.builder();
    int a = builder.addNode("a");
    int b = builder.addNode("b");
    int c = builder.addNode("c");
    int d = builder.addNode("d");
    builder.addEdge(a, b, "");
    builder.addEdge(a, c, "");
    builder.addEdge(b, d, "");
    builder.addEdge(c, d, "");
    Graph<String, String> graph = builder.build();
    assertEquals(ints(a, b, d, c), graph.depthFirstTraversal(a));
    assertThat(
        graph.depthFirstTraversalTrace(a),
        equalTo(joinLines(ImmutableList.of("a", "b", "d", "c"))));
  }

  @Test
  public void testNodeIsMarkedWhenDiscovered() {
    // c is pushed when a is visited, so it is not pushed again below b.
    Graph.Builder<String, String> builder = Graph.builder();
    int a = builder.addNode("a");
    int b = builder.addNode("b");
    int c = builder.addNode("c");
    int d = builder.addNode("d");
    builder.addEdge(a, b, "");
    builder.addEdge(a, c, "");
    builder.addEdge(b, d, "");
    builder.addEdge(d, c, "");
    Graph<String, String> graph = builder.build();
    assertEquals(ints(a, b, d, c), graph.depthFirstTraversal(a));
  }

  @Test
  public void testTraversalInReverseDirection() {
    Graph.Builder<String, String> builder = Graph.builder();
    int a = builder.addNode("a");
    int b = builder.addNode("b");
    int c = builder.addNode("c");
    builder.addEdge(a, c, "");
    builder.addEdge(b, c, "skip");
    Graph<String, String> graph = builder.build();
    assertEquals(ints(c, a, b), graph.depthFirstTraversal(c, Direction.INCOMING, edge -> true));
    assertEquals(
        ints(c, a),
        graph.depthFirstTraversal(
            c, Direction.INCOMING, edge -> !graph.getEdgeData(edge).equals("skip")));
  }

  @Test
  public void testComputeReachable() {
    Graph.Builder<String, String> builder = Graph.builder();
    int entry = builder.addNode("entry");
    int reachable = builder.addNode("reachable");
    int unreachable = builder.addNode("unreachable");
    builder.addEdge(entry, reachable, "");
    builder.addEdge(unreachable, reachable, "");
    Graph<String, String> graph = builder.build();
    BitSet result = graph.computeReachable(entry);
    assertTrue(result.get(entry));
    assertTrue(result.get(reachable));
    assertFalse(result.get(unreachable));
  }

  @Test
  public void testDirectionReverse() {
    assertEquals(Direction.INCOMING, Direction.OUTGOING.reverse());
    assertEquals(Direction.OUTGOING, Direction.INCOMING.reverse());
  }
}
