// Copyright 2014 The Bazel Authors. All rights reserved.
// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.


package io.github.toposcc.graph;

import java.util.Arrays;

/**
 * The DFS class encapsulates a depth-first search visitation, including the order in which nodes
 * are to be visited relative to their successors (PREORDER/POSTORDER), whether the forward or
 * transposed graph is to be used, and which nodes have been seen already.
 *
 * <p>Successive calls to {@link #visit} share the set of marked nodes, so a node reached from an
 * earlier start node is never visited again. See {@link StronglyConnectedComponents} for an
 * example.
 *
 * <p>The search keeps its own stack on the heap rather than recursing, so arbitrarily long paths
 * can be traversed. Nodes and edges are reported in exactly the order a recursive search would
 * report them: edges leaving a node are followed in insertion order.
 *
 * <p>Clients should not modify the graph of a DFS while a traversal is in progress.
 */
final class DFS {

  // (Preferred over a boolean to avoid parameter confusion.)
  enum Order {
    PREORDER,
    POSTORDER
  }

  private final IndexGraph graph;

  private final Order order; // = (PREORDER|POSTORDER)

  private final boolean[] marked;

  private int markedCount;

  // Explicit search stack: the node of each frame, and the index of the next edge to follow.
  private int[] stackNodes = new int[16];

  private int[] stackEdges = new int[16];

  private int depth;

  /**
   * Constructs a DFS instance for searching over {@code digraph}, using the specified visitation
   * parameters.
   *
   * @param order PREORDER or POSTORDER, determines node visitation order
   * @param transpose iff true, the search follows edges against their direction. The edges into a
   *     node are then followed in the order given by {@link IndexGraph#transpose()}.
   */
  DFS(IndexGraph digraph, Order order, boolean transpose) {
    this.graph = transpose ? digraph.transpose() : digraph;
    this.order = order;
    this.marked = new boolean[digraph.vertexCount()];
  }

  boolean isMarked(int node) {
    return marked[node];
  }

  /** Returns the number of nodes visited so far. */
  int getMarkedCount() {
    return markedCount;
  }

  /** Visits {@code node} and every unmarked node reachable from it. No-op if already marked. */
  void visit(int node, GraphVisitor visitor) {
    if (marked[node]) {
      return;
    }
    enter(node, visitor);

    while (depth > 0) {
      int top = depth - 1;
      int current = stackNodes[top];
      int edge = stackEdges[top];
      if (edge < graph.degree(current)) {
        stackEdges[top] = edge + 1;
        int next = graph.successor(current, edge);
        visitor.visitEdge(current, next);
        if (!marked[next]) {
          enter(next, visitor);
        }
      } else {
        depth--;
        if (order == Order.POSTORDER) {
          visitor.visitNode(current);
        }
      }
    }
  }

  private void enter(int node, GraphVisitor visitor) {
    marked[node] = true;
    markedCount++;

    if (order == Order.PREORDER) {
      visitor.visitNode(node);
    }

    if (depth == stackNodes.length) {
      stackNodes = Arrays.copyOf(stackNodes, depth * 2);
      stackEdges = Arrays.copyOf(stackEdges, depth * 2);
    }
    stackNodes[depth] = node;
    stackEdges[depth] = 0;
    depth++;
  }
}
