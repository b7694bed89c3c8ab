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

/** A visitor with no-op callbacks, for subclasses that only need some of them. */
class AbstractGraphVisitor implements GraphVisitor {

  @Override
  public void beginVisit() {}

  @Override
  public void endVisit() {}

  @Override
  public void visitEdge(int lhs, int rhs) {}

  @Override
  public void visitNode(int node) {}
}
