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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.primitives.ImmutableIntArray;
import java.util.Arrays;
import java.util.List;

/**
 * {@code IndexGraph} is an adjacency-list directed graph over the dense vertex indices {@code 0 ..
 * n-1}.
 *
 * <p>The number of vertices is fixed when the graph is created. Edges may be added afterwards but
 * never removed. Each vertex keeps its outgoing edge targets in insertion order; that order drives
 * every traversal in this package and therefore the order of every result. Self-edges are
 * permitted, and so are multiple edges between the same pair of vertices: each one is stored (and
 * counted) separately.
 *
 * <p>Some invariants:
 *
 * <ul>
 *   <li>Every stored edge target is a valid vertex index of the graph.
 *   <li>The algorithms in this package only read the graph; they never modify it and keep no
 *       reference to it after returning.
 *   <li>Instances are not thread-safe. Adding edges while another thread traverses the graph has
 *       undefined results.
 * </ul>
 */
public final class IndexGraph implements Cloneable {

  private static final int[] NO_EDGES = new int[0];

  /** Outgoing edge targets of each vertex. Only the first {@code outDegree[v]} slots are used. */
  private final int[][] successors;

  private final int[] outDegree;

  private int edgeCount;

  private IndexGraph(int[][] successors, int[] outDegree, int edgeCount) {
    this.successors = successors;
    this.outDegree = outDegree;
    this.edgeCount = edgeCount;
  }

  /** Returns a graph with {@code vertexCount} vertices and no edges. */
  public static IndexGraph withVertices(int vertexCount) {
    checkArgument(vertexCount >= 0, "vertexCount (%s) must not be negative", vertexCount);
    int[][] successors = new int[vertexCount][];
    Arrays.fill(successors, NO_EDGES);
    return new IndexGraph(successors, new int[vertexCount], 0);
  }

  /**
   * Returns a graph with one vertex per entry of {@code adjacency}, where entry {@code v} lists the
   * targets of the edges leaving {@code v}, in order.
   *
   * @throws IllegalArgumentException if any target is not in {@code [0, adjacency.size())}
   */
  public static IndexGraph fromAdjacency(List<? extends List<Integer>> adjacency) {
    checkNotNull(adjacency, "adjacency");
    IndexGraph graph = withVertices(adjacency.size());
    for (int from = 0; from < adjacency.size(); from++) {
      for (Integer to : checkNotNull(adjacency.get(from), "adjacency of vertex %s", from)) {
        graph.addEdge(from, checkNotNull(to, "edge target of vertex %s", from));
      }
    }
    return graph;
  }

  /** Equivalent to {@link #fromAdjacency(List)}, with one array of edge targets per vertex. */
  public static IndexGraph fromAdjacency(int[]... adjacency) {
    checkNotNull(adjacency, "adjacency");
    IndexGraph graph = withVertices(adjacency.length);
    for (int from = 0; from < adjacency.length; from++) {
      for (int to : checkNotNull(adjacency[from], "adjacency of vertex %s", from)) {
        graph.addEdge(from, to);
      }
    }
    return graph;
  }

  /**
   * Returns a graph with one vertex per element of {@code elements}. The function is called once
   * for every element, in list order, and adds the edges of the element's vertex through the given
   * {@link VertexEdges}.
   */
  public static <E> IndexGraph fromElements(
      List<? extends E> elements, VertexEdgeFunction<? super E> edgeFunction) {
    checkNotNull(elements, "elements");
    checkNotNull(edgeFunction, "edgeFunction");
    IndexGraph graph = withVertices(elements.size());
    for (int index = 0; index < elements.size(); index++) {
      edgeFunction.addEdges(new VertexEdges(graph, index), elements.get(index));
    }
    return graph;
  }

  /**
   * Adds a directed edge from {@code from} to {@code to}. Does not check for duplicate edges.
   *
   * @throws IllegalArgumentException if either index is not a vertex of this graph
   */
  public void addEdge(int from, int to) {
    checkVertex(from, "from");
    checkVertex(to, "to");
    int[] targets = successors[from];
    int degree = outDegree[from];
    if (degree == targets.length) {
      targets = Arrays.copyOf(targets, Math.max(4, degree * 2));
      successors[from] = targets;
    }
    targets[degree] = to;
    outDegree[from] = degree + 1;
    edgeCount++;
  }

  public int vertexCount() {
    return successors.length;
  }

  /** Returns the number of edges, counting every parallel edge and self-edge. */
  public int edgeCount() {
    return edgeCount;
  }

  public int outDegree(int vertex) {
    checkVertex(vertex, "vertex");
    return outDegree[vertex];
  }

  /** Returns a snapshot of the targets of the edges leaving {@code vertex}, in insertion order. */
  public ImmutableIntArray successors(int vertex) {
    checkVertex(vertex, "vertex");
    return ImmutableIntArray.copyOf(Arrays.copyOf(successors[vertex], outDegree[vertex]));
  }

  /** Returns true iff at least one edge leads from {@code from} to {@code to}. Time: O(out). */
  public boolean hasEdge(int from, int to) {
    checkVertex(from, "from");
    checkVertex(to, "to");
    int[] targets = successors[from];
    for (int i = 0; i < outDegree[from]; i++) {
      if (targets[i] == to) {
        return true;
      }
    }
    return false;
  }

  /** Returns true iff {@code vertex} has an edge to itself. */
  public boolean hasSelfLoop(int vertex) {
    return hasEdge(vertex, vertex);
  }

  /**
   * Returns a new graph over the same vertices with the direction of every edge reversed.
   *
   * <p>The edges leaving vertex {@code v} in the result are ordered by ascending source vertex in
   * this graph, and edges from the same source keep their insertion order.
   */
  public IndexGraph transpose() {
    int vertexCount = vertexCount();
    int[] inDegree = new int[vertexCount];
    for (int from = 0; from < vertexCount; from++) {
      for (int i = 0; i < outDegree[from]; i++) {
        inDegree[successors[from][i]]++;
      }
    }

    int[][] reversed = new int[vertexCount][];
    for (int v = 0; v < vertexCount; v++) {
      reversed[v] = inDegree[v] == 0 ? NO_EDGES : new int[inDegree[v]];
    }
    int[] filled = new int[vertexCount];
    for (int from = 0; from < vertexCount; from++) {
      for (int i = 0; i < outDegree[from]; i++) {
        int to = successors[from][i];
        reversed[to][filled[to]++] = from;
      }
    }
    return new IndexGraph(reversed, filled, edgeCount);
  }

  /**
   * Returns a duplicate graph with the same vertices and the same edges, in the same order. The
   * duplicate shares no storage with this graph, so either may gain edges without affecting the
   * other.
   */
  @Override
  public IndexGraph clone() {
    int[][] copiedSuccessors = new int[successors.length][];
    for (int v = 0; v < successors.length; v++) {
      copiedSuccessors[v] =
          outDegree[v] == 0 ? NO_EDGES : Arrays.copyOf(successors[v], outDegree[v]);
    }
    return new IndexGraph(copiedSuccessors, outDegree.clone(), edgeCount);
  }

  @Override
  public String toString() {
    return "IndexGraph[" + vertexCount() + " vertices, " + edgeCount + " edges]";
  }

  /** Returns the target of the {@code index}th edge leaving {@code vertex}. Unchecked. */
  int successor(int vertex, int index) {
    return successors[vertex][index];
  }

  /** Returns the out-degree of {@code vertex}. Unchecked. */
  int degree(int vertex) {
    return outDegree[vertex];
  }

  private void checkVertex(int vertex, String name) {
    checkArgument(
        vertex >= 0 && vertex < successors.length,
        "%s (%s) must be a vertex of the graph, in [0, %s)",
        name,
        vertex,
        successors.length);
  }

  /**
   * Adds the edges of a single vertex while a graph is being built by {@link
   * IndexGraph#fromElements}.
   */
  @FunctionalInterface
  public interface VertexEdgeFunction<E> {
    void addEdges(VertexEdges edges, E element);
  }

  /** A handle on one vertex of a graph under construction. */
  public static final class VertexEdges {

    private final IndexGraph graph;

    private final int index;

    private VertexEdges(IndexGraph graph, int index) {
      this.graph = graph;
      this.index = index;
    }

    /** Returns the index of the vertex this handle adds edges to. */
    public int index() {
      return index;
    }

    /** Returns the graph under construction. */
    public IndexGraph graph() {
      return graph;
    }

    /** Adds an edge from this vertex to {@code to}. Does not check for duplicate edges. */
    public void addOutEdge(int to) {
      graph.addEdge(index, to);
    }

    /** Adds an edge from {@code from} to this vertex. Does not check for duplicate edges. */
    public void addInEdge(int from) {
      graph.addEdge(from, index);
    }
  }
}
