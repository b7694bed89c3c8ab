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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nullable;

/**
 * The outcome of {@link Toposort#toposortOrScc}: either a topological order of every node of an
 * acyclic graph, or the cycles of a cyclic graph. Exactly one of the two is present, and callers
 * are expected to branch on {@link #isAcyclic()}.
 *
 * <p>A cyclic graph is not an error. Both variants are ordinary results.
 *
 * @param <T> the node type; {@link Integer} vertex indices for an {@link IndexGraph}
 */
public final class ToposortResult<T> {

  @Nullable private final ImmutableList<T> order;

  @Nullable private final ImmutableList<ImmutableList<T>> cycles;

  private ToposortResult(
      @Nullable ImmutableList<T> order, @Nullable ImmutableList<ImmutableList<T>> cycles) {
    this.order = order;
    this.cycles = cycles;
  }

  /** Returns the result for an acyclic graph whose nodes sort to {@code order}. */
  public static <T> ToposortResult<T> ordered(Iterable<? extends T> order) {
    return new ToposortResult<>(ImmutableList.copyOf(order), null);
  }

  /**
   * Returns the result for a cyclic graph with the given cycles.
   *
   * @throws IllegalArgumentException if {@code cycles} or any of its elements is empty
   */
  public static <T> ToposortResult<T> cyclic(Iterable<? extends Iterable<? extends T>> cycles) {
    checkNotNull(cycles, "cycles");
    ImmutableList.Builder<ImmutableList<T>> copied = ImmutableList.builder();
    for (Iterable<? extends T> cycle : cycles) {
      ImmutableList<T> members = ImmutableList.copyOf(cycle);
      checkArgument(!members.isEmpty(), "a cycle must have at least one member");
      copied.add(members);
    }
    ImmutableList<ImmutableList<T>> built = copied.build();
    checkArgument(!built.isEmpty(), "a cyclic result must have at least one cycle");
    return new ToposortResult<>(null, built);
  }

  public boolean isAcyclic() {
    return order != null;
  }

  public boolean isCyclic() {
    return cycles != null;
  }

  /**
   * Returns the topological order.
   *
   * @throws IllegalStateException if the graph was cyclic
   */
  public ImmutableList<T> order() {
    checkState(order != null, "graph is cyclic; there is no topological order");
    return order;
  }

  /**
   * Returns the cycles, each being one strongly connected component with at least two members, or
   * one member with a self-edge.
   *
   * @throws IllegalStateException if the graph was acyclic
   */
  public ImmutableList<ImmutableList<T>> cycles() {
    checkState(cycles != null, "graph is acyclic; there are no cycles");
    return cycles;
  }

  /**
   * Returns a result of the same kind with {@code function} applied to every node. Orders of nodes
   * and cycles are kept.
   */
  public <U> ToposortResult<U> transform(Function<? super T, ? extends U> function) {
    checkNotNull(function, "function");
    if (order != null) {
      return new ToposortResult<>(transformAll(order, function), null);
    }
    ImmutableList.Builder<ImmutableList<U>> transformed = ImmutableList.builder();
    for (ImmutableList<T> cycle : cycles) {
      transformed.add(transformAll(cycle, function));
    }
    return new ToposortResult<>(null, transformed.build());
  }

  private static <T, U> ImmutableList<U> transformAll(
      ImmutableList<T> nodes, Function<? super T, ? extends U> function) {
    ImmutableList.Builder<U> transformed = ImmutableList.builderWithExpectedSize(nodes.size());
    for (T node : nodes) {
      transformed.add(function.apply(node));
    }
    return transformed.build();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ToposortResult)) {
      return false;
    }
    ToposortResult<?> that = (ToposortResult<?>) obj;
    return Objects.equals(order, that.order) && Objects.equals(cycles, that.cycles);
  }

  @Override
  public int hashCode() {
    return Objects.hash(order, cycles);
  }

  @Override
  public String toString() {
    return isAcyclic()
        ? MoreObjects.toStringHelper(this).add("order", order).toString()
        : MoreObjects.toStringHelper(this).add("cycles", cycles).toString();
  }
}
