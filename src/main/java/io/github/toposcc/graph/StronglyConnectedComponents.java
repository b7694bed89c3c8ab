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
import com.google.common.primitives.ImmutableIntArray;

/**
 * Strongly connected components by Kosaraju's algorithm.
 *
 * <p>A first depth-first search over the graph records the order in which vertices finish; start
 * vertices are taken in ascending index order. A second depth-first search over the transposed
 * graph then starts from each vertex not yet assigned to a component, latest finisher first, and
 * every vertex it reaches forms one component.
 *
 * <p>Components are returned in the order of their second-pass start vertex. Within a component,
 * members appear in the order the second pass reaches them, except the start vertex itself, which
 * is placed where the search first follows an edge back into it. A start vertex that is never
 * re-entered is alone in its component.
 *
 * <p>Time: O(V + E). Additional space: O(V + E) for the transposed graph.
 */
public final class StronglyConnectedComponents {

  private StronglyConnectedComponents() {}

  /**
   * Returns a partition of the vertices of {@code graph}, each part being one strongly connected
   * component. Every vertex appears in exactly one component, including vertices on no cycle.
   */
  public static ImmutableList<ImmutableList<Integer>> find(IndexGraph graph) {
    checkNotNull(graph, "graph");
    int vertexCount = graph.vertexCount();

    CollectingVisitor finishOrder = new CollectingVisitor();
    DFS forward = new DFS(graph, DFS.Order.POSTORDER, /* transpose= */ false);
    finishOrder.beginVisit();
    for (int v = 0; v < vertexCount; v++) {
      forward.visit(v, finishOrder);
    }
    finishOrder.endVisit();
    ImmutableIntArray finished = finishOrder.getVisitedNodes();

    ImmutableList.Builder<ImmutableList<Integer>> components = ImmutableList.builder();
    ComponentCollector collector = new ComponentCollector();
    DFS backward = new DFS(graph, DFS.Order.PREORDER, /* transpose= */ true);
    collector.beginVisit();
    for (int i = finished.length() - 1; i >= 0; i--) {
      int root = finished.get(i);
      if (!backward.isMarked(root)) {
        collector.startComponent(root);
        backward.visit(root, collector);
        components.add(collector.finishComponent());
      }
    }
    collector.endVisit();
    return components.build();
  }

  /** Collects the members of one component at a time during the transposed search. */
  private static final class ComponentCollector extends AbstractGraphVisitor {

    private int root;

    private boolean rootReentered;

    private ImmutableList.Builder<Integer> members = ImmutableList.builder();

    void startComponent(int root) {
      this.root = root;
      this.rootReentered = false;
      this.members = ImmutableList.builder();
    }

    @Override
    public void visitNode(int node) {
      if (node != root) {
        members.add(node);
      }
    }

    @Override
    public void visitEdge(int lhs, int rhs) {
      if (rhs == root && !rootReentered) {
        rootReentered = true;
        members.add(root);
      }
    }

    ImmutableList<Integer> finishComponent() {
      if (!rootReentered) {
        members.add(root);
      }
      return members.build();
    }
  }
}
