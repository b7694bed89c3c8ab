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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.Graph;
import com.google.common.graph.SuccessorsFunction;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code ProxyGraph} lets the algorithms of this package run over a graph whose nodes are
 * arbitrary labels rather than dense vertex indices.
 *
 * <p>Each distinct label is given the next free index the first time it is seen, and the edges
 * between labels become edges of an {@link IndexGraph} between indices. Results computed on the
 * index graph are translated back to labels. Labels must be non-null and, like {@link Map} keys,
 * must not change their {@code equals} while in use.
 *
 * <p>Instances are immutable.
 *
 * @param <N> the node label type
 */
public final class ProxyGraph<N> {

  private static final Logger log = LoggerFactory.getLogger(ProxyGraph.class);

  /** Labels by index. */
  private final ImmutableList<N> nodes;

  /** Indices by label; the inverse of {@link #nodes}. */
  private final ImmutableMap<N, Integer> indices;

  private final IndexGraph graph;

  private ProxyGraph(ImmutableList<N> nodes, ImmutableMap<N, Integer> indices, IndexGraph graph) {
    this.nodes = nodes;
    this.indices = indices;
    this.graph = graph;
  }

  public static <N> Builder<N> builder() {
    return new Builder<>();
  }

  /**
   * Returns a proxy for the graph in which each key of {@code successorLists} has an edge to every
   * label in its list. Keys are indexed in the map's iteration order, followed by labels that only
   * appear as successors, in the order they are first seen.
   */
  public static <N> ProxyGraph<N> fromSuccessorLists(
      Map<N, ? extends Iterable<? extends N>> successorLists) {
    checkNotNull(successorLists, "successorLists");
    Builder<N> builder = builder();
    for (N node : successorLists.keySet()) {
      builder.addNode(node);
    }
    for (Map.Entry<N, ? extends Iterable<? extends N>> entry : successorLists.entrySet()) {
      for (N successor : checkNotNull(entry.getValue(), "successors of %s", entry.getKey())) {
        builder.putEdge(entry.getKey(), successor);
      }
    }
    return builder.build();
  }

  /**
   * Returns a proxy for {@code nodes} and every edge {@code successors} leads to from them. Nodes
   * are indexed in iteration order, followed by successors outside {@code nodes} as first seen.
   */
  public static <N> ProxyGraph<N> fromSuccessors(
      Iterable<? extends N> nodes, SuccessorsFunction<N> successors) {
    checkNotNull(nodes, "nodes");
    checkNotNull(successors, "successors");
    Builder<N> builder = builder();
    List<N> sources = new ArrayList<>();
    for (N node : nodes) {
      builder.addNode(node);
      sources.add(node);
    }
    for (N node : sources) {
      for (N successor : successors.successors(node)) {
        builder.putEdge(node, successor);
      }
    }
    return builder.build();
  }

  /**
   * Returns a proxy for a directed Guava {@link Graph}, indexing nodes in the order of {@link
   * Graph#nodes()}.
   *
   * @throws IllegalArgumentException if {@code graph} is undirected
   */
  public static <N> ProxyGraph<N> fromGraph(Graph<N> graph) {
    checkNotNull(graph, "graph");
    checkArgument(graph.isDirected(), "graph must be directed: %s", graph);
    return fromSuccessors(graph.nodes(), graph);
  }

  /** Returns the labels of this graph, in index order. */
  public ImmutableList<N> nodes() {
    return nodes;
  }

  /**
   * Returns the vertex index assigned to {@code node}.
   *
   * @throws IllegalArgumentException if {@code node} is not a node of this graph
   */
  public int indexOf(N node) {
    Integer index = indices.get(checkNotNull(node, "node"));
    checkArgument(index != null, "No such node label: %s", node);
    return index;
  }

  /**
   * Returns the label of the vertex with the given index.
   *
   * @throws IllegalArgumentException if {@code index} is not a vertex index of this graph
   */
  public N nodeAt(int index) {
    checkArgument(
        index >= 0 && index < nodes.size(),
        "index (%s) must be a vertex of the graph, in [0, %s)",
        index,
        nodes.size());
    return nodes.get(index);
  }

  /** Returns a copy of the underlying index graph. */
  public IndexGraph asIndexGraph() {
    return graph.clone();
  }

  /**
   * Runs {@link Toposort#toposortOrScc} on the underlying index graph and returns its result in
   * terms of labels.
   */
  public ToposortResult<N> toposortOrScc() {
    return Toposort.toposortOrScc(graph).transform(nodes::get);
  }

  @Override
  public String toString() {
    return "ProxyGraph[" + nodes.size() + " nodes, " + graph.edgeCount() + " edges]";
  }

  /**
   * A builder of {@link ProxyGraph}s. Labels are indexed in the order they are first passed to
   * {@link #addNode} or {@link #putEdge}. Parallel edges and self-edges are kept.
   */
  public static final class Builder<N> {

    private final Map<N, Integer> indices = new LinkedHashMap<>();

    private final List<EndpointPair<Integer>> edges = new ArrayList<>();

    private Builder() {}

    /** Adds {@code node} if it is not already present. */
    public Builder<N> addNode(N node) {
      index(node);
      return this;
    }

    /** Adds an edge from {@code from} to {@code to}, adding either node if necessary. */
    public Builder<N> putEdge(N from, N to) {
      int fromIndex = index(checkNotNull(from, "from"));
      int toIndex = index(checkNotNull(to, "to"));
      edges.add(EndpointPair.ordered(fromIndex, toIndex));
      return this;
    }

    public ProxyGraph<N> build() {
      IndexGraph graph = IndexGraph.withVertices(indices.size());
      for (EndpointPair<Integer> edge : edges) {
        graph.addEdge(edge.source(), edge.target());
      }
      ProxyGraph<N> proxy =
          new ProxyGraph<>(
              ImmutableList.copyOf(indices.keySet()), ImmutableMap.copyOf(indices), graph);
      log.debug("Built {}", proxy);
      return proxy;
    }

    private int index(N node) {
      checkNotNull(node, "node");
      Integer index = indices.get(node);
      if (index == null) {
        index = indices.size();
        indices.put(node, index);
      }
      return index;
    }
  }
}
