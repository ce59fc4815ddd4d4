/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lambdagraph.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lambdagraph.ast.Symbol;
import org.lambdagraph.util.StringUtil;

/**
 * A node in the intermediate representation. A node is one of
 *
 * <ul>
 *   <li>a computation: {@link #fn} is set and {@link #inputs} are the arguments it is applied to;
 *   <li>a constant: {@link #value} is set (if the value is an {@link IrGraph}, the node is a
 *       reference to that function), and the node usually has no owning graph;
 *   <li>an input of its graph: no fn, no inputs, and no value.
 * </ul>
 *
 * <p>Edges are explicit in both directions. Each edge from this node to one of its successors has
 * a {@link Role} ({@link Role#FN} or {@link Role#input}), and for every such edge {@code
 * (A --role--> B)} the successor's {@link #users} contains {@code (role, A)}. The mutating methods
 * ({@link #setSucc}, {@link #setApp}, {@link #redirect}, {@link #subsume}) maintain this invariant;
 * each one first computes the full list of link and unlink operations it needs (an {@link
 * EdgeBatch}) and then applies them in order.
 *
 * <p>Nodes are never explicitly destroyed; a node that nothing refers to is just garbage.
 */
public class IrNode {

  /** The {@link #value} of nodes that are not constants. */
  public static final Object NO_VALUE =
      new Object() {
        @Override
        public String toString() {
          return "NO_VALUE";
        }
      };

  /** The graph that owns this node; null for constants that are not specific to any graph. */
  private final @Nullable IrGraph graph;

  /** This node's name. */
  public final Symbol tag;

  /** The function this node applies, or null if this node is not a computation. */
  private @Nullable IrNode fn;

  /** The arguments to {@link #fn}. May contain nulls (for inputs that have not been linked). */
  private final List<IrNode> inputs = new ArrayList<>();

  /** The incoming edges. */
  private final Set<Use> users = new LinkedHashSet<>();

  /** The value of this node if it is a constant, otherwise {@link #NO_VALUE}. */
  private final Object value;

  /**
   * Information inferred about this node (type, shape, etc.) by later passes. Not interpreted by
   * the graph.
   */
  public final Map<String, Object> inferred = new HashMap<>();

  /**
   * Optional information about the source code and the sequence of transformations that produced
   * this node; not interpreted by the graph.
   */
  private @Nullable Object about;

  /** An incoming edge: {@code user}'s edge with the given role points to this node. */
  public record Use(Role role, IrNode user) {}

  /**
   * Thrown when an edge operation does not match the recorded state of the graph, e.g. linking a
   * role that already has a successor or unlinking an edge that doesn't exist. Indicates a bug in
   * the caller.
   */
  public static class InconsistentEdgeException extends IllegalStateException {
    InconsistentEdgeException(String message) {
      super(message);
    }
  }

  /** Creates a node with no successors, which will be an input unless it is later linked. */
  public IrNode(@Nullable IrGraph graph, Symbol tag) {
    this(graph, tag, NO_VALUE);
  }

  public IrNode(@Nullable IrGraph graph, Symbol tag, Object value) {
    this.graph = graph;
    this.tag = Preconditions.checkNotNull(tag);
    this.value = value;
  }

  /** Creates a constant node that is not owned by any graph. */
  public static IrNode constant(Object value) {
    Symbol tag = (value instanceof IrGraph g) ? g.tag : Symbol.of(String.valueOf(value));
    return new IrNode(null, tag, value);
  }

  public @Nullable IrGraph graph() {
    return graph;
  }

  public Object value() {
    return value;
  }

  public @Nullable IrNode fn() {
    return fn;
  }

  /** An unmodifiable view of this node's inputs; unlinked positions are null. */
  public List<IrNode> inputs() {
    return Collections.unmodifiableList(inputs);
  }

  /** An unmodifiable view of the edges pointing to this node. */
  public Set<Use> users() {
    return Collections.unmodifiableSet(users);
  }

  public @Nullable Object about() {
    return about;
  }

  public void setAbout(@Nullable Object about) {
    this.about = about;
  }

  public boolean isInput() {
    return fn == null && value == NO_VALUE;
  }

  public boolean isComputation() {
    return fn != null;
  }

  public boolean isConstant() {
    return value != NO_VALUE;
  }

  /** True if this node is a reference to a function. */
  public boolean isGraph() {
    return value instanceof IrGraph;
  }

  /** Returns the distinct nodes this node depends on (its function and inputs). */
  public ImmutableSet<IrNode> successors() {
    ImmutableSet.Builder<IrNode> result = ImmutableSet.builder();
    if (fn != null) {
      result.add(fn);
    }
    for (IrNode input : inputs) {
      if (input != null) {
        result.add(input);
      }
    }
    return result.build();
  }

  /**
   * If this node is a computation returns its function followed by its inputs; otherwise returns
   * null.
   */
  public @Nullable List<IrNode> app() {
    if (fn == null) {
      return null;
    }
    List<IrNode> result = new ArrayList<>(inputs.size() + 1);
    result.add(fn);
    result.addAll(inputs);
    return Collections.unmodifiableList(result);
  }

  /**
   * Returns the successor with the given role, or null if there is none. Throws
   * IndexOutOfBoundsException if {@code role} is an input index beyond the last linked input.
   */
  public @Nullable IrNode get(Role role) {
    if (role.isFn()) {
      return fn;
    }
    return inputs.get(Preconditions.checkElementIndex(role.index(), inputs.size()));
  }

  /** Returns the successor with the given role, or null if there is none. */
  private @Nullable IrNode current(Role role) {
    if (role.isFn()) {
      return fn;
    }
    int index = role.index();
    return (index < inputs.size()) ? inputs.get(index) : null;
  }

  /** Makes {@code node} this node's successor with the given role; if null, removes the edge. */
  public void setSucc(Role role, @Nullable IrNode node) {
    setSuccOperations(role, node).commit();
  }

  /**
   * Makes this node an application of {@code fn} to {@code inputs}, replacing its previous function
   * and all of its previous inputs.
   */
  public void setApp(@Nullable IrNode fn, List<? extends @Nullable IrNode> inputs) {
    setAppOperations(fn, inputs).commit();
  }

  /**
   * Moves every user of this node to {@code newNode}: each edge that points here is changed to
   * point to {@code newNode}, with the same role. This node's own successors are unchanged, and it
   * has no users afterwards.
   */
  public void redirect(IrNode newNode) {
    redirectOperations(newNode).commit();
  }

  /** Moves every user of {@code node} to this node. */
  public void subsume(IrNode node) {
    node.redirect(this);
  }

  EdgeBatch setSuccOperations(Role role, @Nullable IrNode node) {
    EdgeBatch batch = new EdgeBatch();
    IrNode prev = current(role);
    if (prev == node) {
      return batch;
    }
    if (prev != null) {
      batch.unlink(this, prev, role);
    }
    if (node != null) {
      batch.link(this, node, role);
    }
    return batch;
  }

  EdgeBatch setAppOperations(@Nullable IrNode fn, List<? extends @Nullable IrNode> newInputs) {
    EdgeBatch batch = setSuccOperations(Role.FN, fn);
    // All the unlinks come before any link, so no link finds its role still occupied.
    int n = Math.max(inputs.size(), newInputs.size());
    for (int i = 0; i < n; i++) {
      IrNode prev = (i < inputs.size()) ? inputs.get(i) : null;
      IrNode next = (i < newInputs.size()) ? newInputs.get(i) : null;
      if (prev != null && prev != next) {
        batch.unlink(this, prev, Role.input(i));
      }
    }
    for (int i = 0; i < newInputs.size(); i++) {
      IrNode prev = (i < inputs.size()) ? inputs.get(i) : null;
      IrNode next = newInputs.get(i);
      if (next != null && prev != next) {
        batch.link(this, next, Role.input(i));
      }
    }
    return batch;
  }

  EdgeBatch redirectOperations(IrNode newNode) {
    Preconditions.checkNotNull(newNode);
    EdgeBatch batch = new EdgeBatch();
    for (Use use : List.copyOf(users)) {
      batch.addAll(use.user.setSuccOperations(use.role, newNode));
    }
    return batch;
  }

  /** Adds the edge {@code this --role--> node}; the role must not already have a successor. */
  void addEdge(Role role, IrNode node) {
    if (role.isFn()) {
      checkConsistent(fn == null, "link", role, node);
      fn = node;
    } else {
      int index = role.index();
      while (inputs.size() <= index) {
        inputs.add(null);
      }
      checkConsistent(inputs.get(index) == null, "link", role, node);
      inputs.set(index, node);
    }
    checkConsistent(node.users.add(new Use(role, this)), "link", role, node);
  }

  /** Removes the edge {@code this --role--> node}, which must exist. */
  void removeEdge(Role role, IrNode node) {
    checkConsistent(current(role) == node, "unlink", role, node);
    if (role.isFn()) {
      fn = null;
    } else {
      inputs.set(role.index(), null);
      // Drop unlinked positions from the end, so that inputs.size() is always one more than the
      // index of the last linked input.
      while (!inputs.isEmpty() && inputs.get(inputs.size() - 1) == null) {
        inputs.remove(inputs.size() - 1);
      }
    }
    checkConsistent(node.users.remove(new Use(role, this)), "unlink", role, node);
  }

  private void checkConsistent(boolean ok, String op, Role role, IrNode node) {
    if (!ok) {
      throw new InconsistentEdgeException(
          String.format(
              "Can't %s %s --%s--> %s (currently %s)",
              op,
              this,
              role,
              StringUtil.safeToString(node),
              StringUtil.safeToString(current(role))));
    }
  }

  /**
   * Verifies that every edge from this node is recorded in its successor's users, and that every
   * recorded user has a matching edge to this node.
   */
  void checkEdges() {
    if (fn != null) {
      checkConsistent(fn.users.contains(new Use(Role.FN, this)), "find", Role.FN, fn);
    }
    for (int i = 0; i < inputs.size(); i++) {
      IrNode input = inputs.get(i);
      if (input != null) {
        Role role = Role.input(i);
        checkConsistent(input.users.contains(new Use(role, this)), "find", role, input);
      }
    }
    for (Use use : users) {
      if (use.user.current(use.role) != this) {
        throw new InconsistentEdgeException(
            String.format("%s has no edge %s to %s", use.user, use.role, this));
      }
    }
  }

  @Override
  public String toString() {
    return (value == NO_VALUE) ? tag.toString() : String.valueOf(value);
  }
}
