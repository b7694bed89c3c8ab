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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/** Test for {@link StronglyConnectedComponents}. */
class StronglyConnectedComponentsTest {

  @Test
  void testAcyclicGraphIsAllSingletons() {
    IndexGraph graph = IndexGraph.fromAdjacency(new int[] {1, 2}, new int[] {2}, new int[0]);

    ImmutableList<ImmutableList<Integer>> components = StronglyConnectedComponents.find(graph);

    assertThat(components)
        .containsExactly(ImmutableList.of(0), ImmutableList.of(1), ImmutableList.of(2))
        .inOrder();
  }

  @Test
  void testTwoCycle() {
    IndexGraph graph = IndexGraph.fromAdjacency(new int[] {1}, new int[] {0});

    assertThat(StronglyConnectedComponents.find(graph))
        .containsExactly(ImmutableList.of(1, 0));
  }

  @Test
  void testSelfLoopIsASingleton() {
    IndexGraph graph = IndexGraph.fromAdjacency(new int[] {0});

    assertThat(StronglyConnectedComponents.find(graph)).containsExactly(ImmutableList.of(0));
  }

  @Test
  void testPartitionWithSelfLoopAndCycle() {
    IndexGraph graph =
        IndexGraph.fromAdjacency(
            new int[] {3, 0},
            new int[] {3, 4},
            new int[] {4, 7},
            new int[] {5, 6, 7},
            new int[] {6},
            new int[0],
            new int[] {2},
            new int[0]);

    assertThat(StronglyConnectedComponents.find(graph))
        .containsExactly(
            ImmutableList.of(1),
            ImmutableList.of(0),
            ImmutableList.of(3),
            ImmutableList.of(4, 2, 6),
            ImmutableList.of(7),
            ImmutableList.of(5))
        .inOrder();
  }

  @Test
  void testSeveralCycles() {
    IndexGraph graph =
        IndexGraph.fromAdjacency(
            new int[] {1},
            new int[] {2, 4, 5},
            new int[] {3, 6},
            new int[] {2, 7},
            new int[] {0, 5},
            new int[] {6},
            new int[] {5},
            new int[] {3, 6});

    assertThat(StronglyConnectedComponents.find(graph))
        .containsExactly(
            ImmutableList.of(4, 1, 0), ImmutableList.of(3, 2, 7), ImmutableList.of(5, 6))
        .inOrder();
  }

  @Test
  void testEmptyGraph() {
    assertThat(StronglyConnectedComponents.find(IndexGraph.withVertices(0))).isEmpty();
  }

  @Test
  void testLongCycleDoesNotOverflowTheStack() {
    int length = 200_000;
    IndexGraph ring = IndexGraph.withVertices(length);
    for (int v = 0; v < length; v++) {
      ring.addEdge(v, (v + 1) % length);
    }

    ImmutableList<ImmutableList<Integer>> components = StronglyConnectedComponents.find(ring);

    assertThat(components).hasSize(1);
    assertThat(components.get(0)).hasSize(length);
  }

  @Test
  void testRandomGraphsArePartitionedIntoStrongComponents() {
    Random random = new Random(7);
    for (int round = 0; round < 20; round++) {
      int vertexCount = 1 + random.nextInt(40);
      IndexGraph graph = IndexGraph.withVertices(vertexCount);
      for (int from = 0; from < vertexCount; from++) {
        for (int to = 0; to < vertexCount; to++) {
          if (random.nextDouble() < 0.06) {
            graph.addEdge(from, to);
          }
        }
      }
      assertStrongComponentPartition(graph, StronglyConnectedComponents.find(graph));
    }
  }

  /**
   * Asserts that {@code components} covers every vertex once, that members of one component reach
   * each other, and that no two components reach each other both ways.
   */
  static void assertStrongComponentPartition(
      IndexGraph graph, List<? extends List<Integer>> components) {
    List<Integer> covered = new ArrayList<>();
    int[] componentOf = new int[graph.vertexCount()];
    for (int c = 0; c < components.size(); c++) {
      for (int member : components.get(c)) {
        covered.add(member);
        componentOf[member] = c;
      }
    }
    assertThat(covered).containsExactlyElementsIn(TopologicalSorterTest.vertices(graph));

    boolean[][] reaches = new boolean[graph.vertexCount()][];
    for (int v = 0; v < graph.vertexCount(); v++) {
      reaches[v] = reachable(graph, v);
    }
    for (int u = 0; u < graph.vertexCount(); u++) {
      for (int v = 0; v < graph.vertexCount(); v++) {
        boolean mutual = reaches[u][v] && reaches[v][u];
        assertThat(componentOf[u] == componentOf[v]).isEqualTo(mutual);
      }
    }
  }

  /** Returns which vertices {@code start} reaches, itself included. */
  private static boolean[] reachable(IndexGraph graph, int start) {
    boolean[] seen = new boolean[graph.vertexCount()];
    Deque<Integer> queue = new ArrayDeque<>();
    seen[start] = true;
    queue.add(start);
    while (!queue.isEmpty()) {
      int u = queue.remove();
      for (int v : graph.successors(u).toArray()) {
        if (!seen[v]) {
          seen[v] = true;
          queue.add(v);
        }
      }
    }
    return seen;
  }
}
