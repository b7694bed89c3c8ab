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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import javax.annotation.Nullable;

/**
 * Topological sorting by Kahn's algorithm.
 *
 * <p>The sort is deterministic. Vertices with no incoming edges are taken in ascending index order;
 * after that, a vertex becomes ready when its last incoming edge has been consumed and is placed
 * behind every vertex that was already ready. Edges are consumed in the order they were added.
 *
 * <p>Time: O(V + E). Additional space: O(V).
 */
public final class TopologicalSorter {

  private TopologicalSorter() {}

  /**
   * Returns the vertices of {@code graph} in topological order: for every edge {@code u -> v},
   * {@code u} precedes {@code v}.
   *
   * @return the ordering of all vertices, or null if the graph has a cycle. No partial ordering is
   *     returned.
   */
  @Nullable
  public static ImmutableList<Integer> sort(IndexGraph graph) {
    checkNotNull(graph, "graph");
    int vertexCount = graph.vertexCount();

    // Every edge counts, including parallel edges and self-edges.
    int[] inDegree = new int[vertexCount];
    for (int from = 0; from < vertexCount; from++) {
      for (int i = 0; i < graph.degree(from); i++) {
        inDegree[graph.successor(from, i)]++;
      }
    }

    // Each vertex is enqueued at most once, so the queue is a plain array. Its prefix [0, tail) is
    // also the output order.
    int[] queue = new int[vertexCount];
    int head = 0;
    int tail = 0;
    for (int v = 0; v < vertexCount; v++) {
      if (inDegree[v] == 0) {
        queue[tail++] = v;
      }
    }

    while (head < tail) {
      int current = queue[head++];
      for (int i = 0; i < graph.degree(current); i++) {
        int next = graph.successor(current, i);
        if (--inDegree[next] == 0) {
          queue[tail++] = next;
        }
      }
    }

    if (tail < vertexCount) {
      return null;
    }
    return ImmutableList.copyOf(Ints.asList(queue));
  }

  /** Returns true iff {@code graph} has no cycle, self-edges included. */
  public static boolean isAcyclic(IndexGraph graph) {
    return sort(graph) != null;
  }
}
