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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lambdagraph.ast.GenSym;
import org.lambdagraph.ast.Symbol;

/**
 * A function, represented as a graph of {@link IrNode}s with a list of input nodes and one output
 * node. The nodes reachable from the output (following {@link IrNode#fn} and {@link
 * IrNode#inputs}) must form an acyclic graph.
 *
 * <p>If {@link #parent} is non-null this graph is a closure nested in the parent's scope, and its
 * nodes may refer to nodes owned by the parent (or by the parent's ancestors). Such nodes are
 * <i>boundary</i> nodes of this graph: they are reachable from its output but are not owned by it.
 *
 * <p>IrGraphs are not thread-safe; use {@link #dup} to give another thread its own copy.
 */
public class IrGraph {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The graph of the enclosing function if this graph is a closure, otherwise null. */
  public final @Nullable IrGraph parent;

  /** This graph's name. */
  public final Symbol tag;

  /** Used to create tags for new nodes in this graph. */
  public final GenSym gen;

  private final List<IrNode> inputs = new ArrayList<>();

  private @Nullable IrNode output;

  /** Thrown by {@link #toposort} if the graph is not acyclic. */
  public static class CycleException extends IllegalStateException {
    CycleException(String message) {
      super(message);
    }
  }

  /** The result of {@link #dup}. */
  public record Duplicate(IrGraph graph, ImmutableList<IrNode> inputs, @Nullable IrNode output) {}

  public IrGraph(@Nullable IrGraph parent, Symbol tag, GenSym gen) {
    this.parent = parent;
    this.tag = Preconditions.checkNotNull(tag);
    this.gen = Preconditions.checkNotNull(gen);
  }

  /** An unmodifiable view of this graph's inputs. */
  public List<IrNode> inputs() {
    return Collections.unmodifiableList(inputs);
  }

  /** Replaces this graph's inputs. */
  public void setInputs(List<IrNode> newInputs) {
    inputs.clear();
    inputs.addAll(newInputs);
  }

  /** Creates a new node owned by this graph and appends it to the inputs. */
  public IrNode addInput(Symbol tag) {
    IrNode input = new IrNode(this, tag);
    inputs.add(input);
    return input;
  }

  /** Creates a new node owned by this graph, with no successors. */
  public IrNode newNode(Symbol tag) {
    return new IrNode(this, tag);
  }

  public @Nullable IrNode output() {
    return output;
  }

  public void setOutput(@Nullable IrNode output) {
    this.output = output;
  }

  /** Sets {@code to} as the successor of {@code from} with the given role. */
  public void link(IrNode from, IrNode to, Role role) {
    from.setSucc(role, to);
  }

  /**
   * Moves every user of {@code oldNode} to {@code newNode} (see {@link IrNode#redirect}), and makes
   * {@code newNode} the output if {@code oldNode} was.
   */
  public void replace(IrNode oldNode, IrNode newNode) {
    logger.atFine().log("%s: replacing %s with %s", tag, oldNode, newNode);
    oldNode.redirect(newNode);
    if (oldNode == output) {
      output = newNode;
    }
  }

  /** True if {@code graph} is this graph or one of its (possibly indirect) parents. */
  public boolean containedIn(IrGraph graph) {
    for (IrGraph g = this; g != null; g = g.parent) {
      if (g == graph) {
        return true;
      }
    }
    return false;
  }

  /** Returns the nodes owned by this graph that are reachable from its output. */
  public ImmutableList<IrNode> nodes() {
    return nodes(false);
  }

  /**
   * Returns the nodes owned by this graph that are reachable from its output; if {@code
   * includeBoundary} is true, also returns the reachable nodes owned by other graphs. The search
   * does not continue past nodes owned by other graphs, and never returns constants that have no
   * owner.
   */
  public ImmutableList<IrNode> nodes(boolean includeBoundary) {
    if (output == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<IrNode> result = ImmutableList.builder();
    Set<IrNode> seen = new HashSet<>();
    Deque<IrNode> toVisit = new ArrayDeque<>();
    toVisit.add(output);
    while (!toVisit.isEmpty()) {
      IrNode node = toVisit.removeFirst();
      if (!seen.add(node)) {
        continue;
      }
      if (node.graph() != this) {
        if (includeBoundary && node.graph() != null) {
          result.add(node);
        }
        continue;
      }
      result.add(node);
      if (node.fn() != null) {
        toVisit.add(node.fn());
      }
      for (IrNode input : node.inputs()) {
        if (input != null) {
          toVisit.add(input);
        }
      }
    }
    return result.build();
  }

  /** Returns the reachable nodes that are owned by other graphs, i.e. the free variables. */
  public ImmutableList<IrNode> boundary() {
    return nodes(true).stream()
        .filter(node -> node.graph() != this)
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns the computations owned by this graph that are reachable from the output, ordered so
   * that each node comes after all of the nodes it depends on (and so the output comes last).
   * Inputs, constants, and boundary nodes are not included.
   *
   * @throws CycleException if the nodes reachable from the output are not acyclic
   */
  public ImmutableList<IrNode> toposort() {
    if (output == null || !output.isComputation()) {
      return ImmutableList.of();
    }
    Set<IrNode> scope = new HashSet<>();
    for (IrNode node : nodes()) {
      if (node.isComputation()) {
        scope.add(node);
      }
    }
    // For each node that has been reached, the number of its users in scope that haven't been
    // processed yet. Computed the first time the node is reached.
    Map<IrNode, Integer> pending = new HashMap<>();
    Deque<IrNode> ready = new ArrayDeque<>();
    Set<IrNode> processed = new HashSet<>();
    List<IrNode> results = new ArrayList<>();
    ready.add(output);
    while (!ready.isEmpty()) {
      IrNode node = ready.removeLast();
      if (!processed.add(node)) {
        throw new CycleException("Cannot toposort " + tag + ": cycle detected at " + node);
      }
      results.add(node);
      for (IrNode succ : node.successors()) {
        if (!scope.contains(succ)) {
          continue;
        }
        int count = pending.computeIfAbsent(succ, s -> countUsers(s, scope)) - 1;
        pending.put(succ, count);
        if (count == 0) {
          ready.add(succ);
        }
      }
    }
    if (results.size() != scope.size()) {
      // Some reachable node still has an unprocessed user, which can only happen if they are on a
      // cycle.
      throw new CycleException(
          "Cannot toposort " + tag + ": cycle detected among " + (scope.size() - results.size())
              + " nodes");
    }
    logger.atFine().log("%s: toposorted %d nodes", tag, results.size());
    return ImmutableList.copyOf(Lists.reverse(results));
  }

  /** Returns the number of distinct nodes in {@code scope} that use {@code node}. */
  private static int countUsers(IrNode node, Set<IrNode> scope) {
    Set<IrNode> users = new HashSet<>();
    for (IrNode.Use use : node.users()) {
      if (scope.contains(use.user())) {
        users.add(use.user());
      }
    }
    return users.size();
  }

  /** Returns a copy of this graph with the same parent, tag, and generator. */
  public Duplicate dup() {
    return dup(null);
  }

  /**
   * Copies this graph's nodes. If {@code target} is null, the copies are owned by a new graph with
   * the same parent, tag, and generator as this one, whose inputs and output are set to the copies
   * of this graph's; otherwise the copies are owned by {@code target}, and its inputs and output
   * are left unchanged.
   *
   * <p>The nodes copied are this graph's inputs and the nodes returned by {@link #nodes()}. Edges
   * to other nodes (constants and boundary nodes) are preserved, so the copy refers to the same
   * constants and free variables as the original.
   */
  public Duplicate dup(@Nullable IrGraph target) {
    boolean setIo = (target == null);
    IrGraph g = setIo ? new IrGraph(parent, tag, gen) : target;
    Map<IrNode, IrNode> mapping = new LinkedHashMap<>();
    Set<IrNode> toCopy = new LinkedHashSet<>(inputs);
    toCopy.addAll(nodes());
    for (IrNode node : toCopy) {
      IrNode copy = new IrNode(g, g.gen.sym(node.tag, "+"), node.value());
      copy.inferred.putAll(node.inferred);
      copy.setAbout(node.about());
      mapping.put(node, copy);
    }
    mapping.forEach(
        (original, copy) -> {
          if (original.fn() != null || !original.inputs().isEmpty()) {
            List<IrNode> newInputs = new ArrayList<>(original.inputs().size());
            for (IrNode input : original.inputs()) {
              newInputs.add((input == null) ? null : mapping.getOrDefault(input, input));
            }
            IrNode fn = original.fn();
            copy.setApp((fn == null) ? null : mapping.getOrDefault(fn, fn), newInputs);
          }
        });
    ImmutableList<IrNode> newInputs =
        inputs.stream().map(mapping::get).collect(ImmutableList.toImmutableList());
    IrNode newOutput = (output == null) ? null : mapping.getOrDefault(output, output);
    if (setIo) {
      g.setInputs(newInputs);
      g.setOutput(newOutput);
    }
    logger.atFine().log("Duplicated %s (%d nodes) into %s", tag, mapping.size(), g.tag);
    return new Duplicate(g, newInputs, newOutput);
  }

  /**
   * Verifies that the edges of this graph's inputs and of every reachable node (including boundary
   * nodes) are consistent with their successors' and users' records.
   *
   * @throws IrNode.InconsistentEdgeException if they aren't
   */
  public void checkConsistency() {
    inputs.forEach(IrNode::checkEdges);
    nodes(true).forEach(IrNode::checkEdges);
  }

  @Override
  public String toString() {
    return tag.toString();
  }
}
