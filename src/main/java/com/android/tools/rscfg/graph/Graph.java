// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.graph;

import com.android.tools.rscfg.utils.StringUtils;
import com.google.common.collect.ImmutableList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;

/**
 * Directed multigraph where nodes and edges are referred to by their index in the graph.
 *
 * <p>Each node stores the most recently added edge in each direction, and each edge stores the
 * previously added edge of its source and of its target. Iterating the incident edges of a node
 * therefore yields the newest edge first. The graph is immutable, instances are created through
 * {@link Builder}.
 *
 * @param <N> the type of the node data
 * @param <E> the type of the edge data
 */
public class Graph<N, E> {

  public static final int INVALID_INDEX = -1;

  private final List<N> nodes;
  private final List<E> edges;

  // Indexed by Direction.index * size + node/edge.
  private final int[] firstEdge;
  private final int[] nextEdge;
  private final int[] edgeSource;
  private final int[] edgeTarget;

  private Graph(Builder<N, E> builder) {
    this.nodes = ImmutableList.copyOf(builder.nodes);
    this.edges = ImmutableList.copyOf(builder.edges);
    this.firstEdge = concat(builder.firstOutgoing, builder.firstIncoming);
    this.nextEdge = concat(builder.nextOutgoing, builder.nextIncoming);
    this.edgeSource = builder.edgeSource.toIntArray();
    this.edgeTarget = builder.edgeTarget.toIntArray();
  }

  private static int[] concat(IntList outgoing, IntList incoming) {
    assert outgoing.size() == incoming.size();
    int[] result = new int[outgoing.size() * 2];
    outgoing.getElements(0, result, 0, outgoing.size());
    incoming.getElements(0, result, outgoing.size(), incoming.size());
    return result;
  }

  public static <N, E> Builder<N, E> builder() {
    return new Builder<>();
  }

  public int getNodeCount() {
    return nodes.size();
  }

  public int getEdgeCount() {
    return edges.size();
  }

  public N getNodeData(int node) {
    return nodes.get(node);
  }

  public E getEdgeData(int edge) {
    return edges.get(edge);
  }

  public int getSource(int edge) {
    return edgeSource[edge];
  }

  public int getTarget(int edge) {
    return edgeTarget[edge];
  }

  /** Returns the node at the other end of {@code edge} when it is followed in {@code direction}. */
  public int getIncidentNode(int edge, Direction direction) {
    return direction == Direction.OUTGOING ? edgeTarget[edge] : edgeSource[edge];
  }

  /** Visits the edges incident to {@code node} in {@code direction}, newest edge first. */
  public void forEachIncidentEdge(int node, Direction direction, IntConsumer consumer) {
    int edge = firstEdge[direction.index * nodes.size() + node];
    while (edge != INVALID_INDEX) {
      consumer.accept(edge);
      edge = nextEdge[direction.index * edges.size() + edge];
    }
  }

  public IntList getOutgoingEdges(int node) {
    return getIncidentEdges(node, Direction.OUTGOING);
  }

  public IntList getIncomingEdges(int node) {
    return getIncidentEdges(node, Direction.INCOMING);
  }

  /** Returns the edges incident to {@code node} in {@code direction}, in insertion order. */
  public IntList getIncidentEdges(int node, Direction direction) {
    IntArrayList result = new IntArrayList();
    forEachIncidentEdge(node, direction, result::add);
    reverse(result);
    return IntLists.unmodifiable(result);
  }

  public IntList getSuccessors(int node) {
    return getNeighbors(node, Direction.OUTGOING);
  }

  public IntList getPredecessors(int node) {
    return getNeighbors(node, Direction.INCOMING);
  }

  private IntList getNeighbors(int node, Direction direction) {
    IntArrayList result = new IntArrayList();
    forEachIncidentEdge(node, direction, edge -> result.add(getIncidentNode(edge, direction)));
    reverse(result);
    return IntLists.unmodifiable(result);
  }

  private static void reverse(IntArrayList list) {
    for (int i = 0, j = list.size() - 1; i < j; i++, j--) {
      list.set(i, list.set(j, list.getInt(i)));
    }
  }

  public IntList depthFirstTraversal(int startNode) {
    return depthFirstTraversal(startNode, Direction.OUTGOING, edge -> true);
  }

  /**
   * Returns the nodes reachable from {@code startNode} in depth first order.
   *
   * <p>A node is marked as seen when it is discovered. The neighbors of a visited node are pushed
   * on the stack newest edge first, so the neighbor along the oldest edge is visited next.
   */
  public IntList depthFirstTraversal(int startNode, Direction direction, IntPredicate edgeFilter) {
    IntArrayList order = new IntArrayList();
    BitSet seen = new BitSet(nodes.size());
    IntArrayList stack = new IntArrayList();
    seen.set(startNode);
    stack.push(startNode);
    while (!stack.isEmpty()) {
      int node = stack.popInt();
      order.add(node);
      forEachIncidentEdge(
          node,
          direction,
          edge -> {
            if (edgeFilter.test(edge)) {
              int incident = getIncidentNode(edge, direction);
              if (!seen.get(incident)) {
                seen.set(incident);
                stack.push(incident);
              }
            }
          });
    }
    return IntLists.unmodifiable(order);
  }

  public BitSet computeReachable(int startNode) {
    BitSet reachable = new BitSet(nodes.size());
    depthFirstTraversal(startNode).forEach((IntConsumer) reachable::set);
    return reachable;
  }

  /** Renders the depth first traversal from {@code startNode}, one node per line. */
  public String depthFirstTraversalTrace(int startNode) {
    List<String> lines = new ArrayList<>();
    depthFirstTraversal(startNode)
        .forEach((IntConsumer) node -> lines.add(nodes.get(node).toString()));
    return StringUtils.joinLines(lines);
  }

  public static class Builder<N, E> {

    private final List<N> nodes = new ArrayList<>();
    private final List<E> edges = new ArrayList<>();

    private final IntArrayList firstOutgoing = new IntArrayList();
    private final IntArrayList firstIncoming = new IntArrayList();
    private final IntArrayList nextOutgoing = new IntArrayList();
    private final IntArrayList nextIncoming = new IntArrayList();
    private final IntArrayList edgeSource = new IntArrayList();
    private final IntArrayList edgeTarget = new IntArrayList();

    private Builder() {}

    public int getNodeCount() {
      return nodes.size();
    }

    public N getNodeData(int node) {
      return nodes.get(node);
    }

    public int addNode(N data) {
      assert data != null;
      int index = nodes.size();
      nodes.add(data);
      firstOutgoing.add(INVALID_INDEX);
      firstIncoming.add(INVALID_INDEX);
      return index;
    }

    public int addEdge(int source, int target, E data) {
      assert data != null;
      assert source >= 0 && source < nodes.size();
      assert target >= 0 && target < nodes.size();
      int index = edges.size();
      edges.add(data);
      edgeSource.add(source);
      edgeTarget.add(target);
      nextOutgoing.add(firstOutgoing.getInt(source));
      nextIncoming.add(firstIncoming.getInt(target));
      firstOutgoing.set(source, index);
      firstIncoming.set(target, index);
      return index;
    }

    public Graph<N, E> build() {
      return new Graph<>(this);
    }
  }
}
