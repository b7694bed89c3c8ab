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

import com.google.common.primitives.ImmutableIntArray;

/** A graph visitor that collects the visited nodes in the order of their visitation. */
class CollectingVisitor extends AbstractGraphVisitor {

  private ImmutableIntArray.Builder visited = ImmutableIntArray.builder();

  @Override
  public void beginVisit() {
    visited = ImmutableIntArray.builder();
  }

  @Override
  public void visitNode(int node) {
    visited.add(node);
  }

  /** Returns the nodes visited so far, in order. */
  ImmutableIntArray getVisitedNodes() {
    return visited.build();
  }
}
