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

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Test for {@link DFS}. */
class DFSTest {

  private IndexGraph graph;

  @BeforeEach
  void setup() {
    //   0
    //  / \
    // 1   2
    //  \ /
    //   3
    graph = IndexGraph.fromAdjacency(new int[] {1, 2}, new int[] {3}, new int[] {3}, new int[0]);
  }

  @Test
  void testPreorder() {
    CollectingVisitor visitor = new CollectingVisitor();
    new DFS(graph, DFS.Order.PREORDER, false).visit(0, visitor);

    assertThat(visitor.getVisitedNodes().asList()).containsExactly(0, 1, 3, 2).inOrder();
  }

  @Test
  void testPostorder() {
    CollectingVisitor visitor = new CollectingVisitor();
    new DFS(graph, DFS.Order.POSTORDER, false).visit(0, visitor);

    assertThat(visitor.getVisitedNodes().asList()).containsExactly(3, 1, 2, 0).inOrder();
  }

  @Test
  void testTransposedVisitation() {
    CollectingVisitor visitor = new CollectingVisitor();
    new DFS(graph, DFS.Order.PREORDER, true).visit(3, visitor);

    assertThat(visitor.getVisitedNodes().asList()).containsExactly(3, 1, 0, 2).inOrder();
  }

  @Test
  void testMarkedNodesAreSharedBetweenVisits() {
    CollectingVisitor visitor = new CollectingVisitor();
    DFS dfs = new DFS(graph, DFS.Order.PREORDER, false);
    dfs.visit(1, visitor);
    dfs.visit(0, visitor);
    dfs.visit(3, visitor);

    assertThat(visitor.getVisitedNodes().asList()).containsExactly(1, 3, 0, 2).inOrder();
    assertThat(dfs.getMarkedCount()).isEqualTo(4);
    assertThat(dfs.isMarked(2)).isTrue();
  }

  @Test
  void testEdgesAreReportedIncludingThoseToMarkedNodes() {
    List<String> edges = new ArrayList<>();
    new DFS(graph, DFS.Order.PREORDER, false)
        .visit(
            0,
            new AbstractGraphVisitor() {
              @Override
              public void visitEdge(int lhs, int rhs) {
                edges.add(lhs + "->" + rhs);
              }
            });

    assertThat(edges).containsExactly("0->1", "1->3", "0->2", "2->3").inOrder();
  }

  @Test
  void testLongPathDoesNotOverflowTheStack() {
    int length = 200_000;
    IndexGraph path = IndexGraph.withVertices(length);
    for (int v = 0; v + 1 < length; v++) {
      path.addEdge(v, v + 1);
    }

    CollectingVisitor visitor = new CollectingVisitor();
    new DFS(path, DFS.Order.POSTORDER, false).visit(0, visitor);

    assertThat(visitor.getVisitedNodes().length()).isEqualTo(length);
    assertThat(visitor.getVisitedNodes().get(0)).isEqualTo(length - 1);
    assertThat(visitor.getVisitedNodes().get(length - 1)).isEqualTo(0);
  }
}
