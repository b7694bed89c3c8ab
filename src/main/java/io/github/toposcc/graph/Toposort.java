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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Topological sorting that falls back to cycle detection.
 *
 * <p>{@link #toposortOrScc} first tries {@link TopologicalSorter}. If every vertex can be placed,
 * the order is the result. Otherwise {@link StronglyConnectedComponents} partitions the graph and
 * the components that are cycles are the result. Vertices that could not be placed only because
 * they depend on a cycle, without being on one, are not reported.
 */
public final class Toposort {

  private static final Logger log = LoggerFactory.getLogger(Toposort.class);

  private Toposort() {}

  /**
   * Returns the topological order of {@code graph} if it is acyclic, or its cycles otherwise. An
   * empty graph is acyclic and has an empty order.
   */
  public static ToposortResult<Integer> toposortOrScc(IndexGraph graph) {
    checkNotNull(graph, "graph");

    ImmutableList<Integer> order = TopologicalSorter.sort(graph);
    if (order != null) {
      log.debug("Sorted {} topologically", graph);
      return ToposortResult.ordered(order);
    }

    ImmutableList<ImmutableList<Integer>> components = StronglyConnectedComponents.find(graph);
    ImmutableList.Builder<ImmutableList<Integer>> cycles = ImmutableList.builder();
    for (ImmutableList<Integer> component : components) {
      if (isCycle(graph, component)) {
        cycles.add(component);
      }
    }
    ImmutableList<ImmutableList<Integer>> found = cycles.build();
    checkState(!found.isEmpty(), "%s could not be sorted but no cycle was found", graph);

    log.debug(
        "{} is cyclic: {} of {} strongly connected components are cycles",
        graph,
        found.size(),
        components.size());
    return ToposortResult.cyclic(found);
  }

  /**
   * Returns true iff {@code component}, a strongly connected component of {@code graph}, is a
   * cycle: it has at least two members, or its only member has an edge to itself.
   */
  public static boolean isCycle(IndexGraph graph, List<Integer> component) {
    checkNotNull(graph, "graph");
    checkNotNull(component, "component");
    if (component.size() >= 2) {
      return true;
    }
    return component.size() == 1 && graph.hasSelfLoop(component.get(0));
  }
}
