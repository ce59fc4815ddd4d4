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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Collects the nodes and edges of one or more graphs into flat element lists, for debugging tools
 * that want to display them. Graphs are only read, never modified.
 *
 * <p>Each graph, node, and edge is assigned an id ({@code X1}, {@code X2}, ...). Each node element
 * records the id of the graph that contains it; each edge element goes from the successor to the
 * node that uses it, and is labelled {@code F} for a function edge or with the input index.
 */
public class GraphPrinter {

  /**
   * Options that control how graphs are printed.
   *
   * @param duplicateConstants if true, each use of a constant is printed as a separate node
   * @param functionInNode if true, an application of a constant function is labelled {@code
   *     name:fn} rather than having an {@code F} edge to a separate node for the function
   * @param followReferences if true, graphs referred to by constants are also printed
   */
  public record Options(
      boolean duplicateConstants, boolean functionInNode, boolean followReferences) {
    public static final Options DEFAULT = new Options(true, true, true);
  }

  /** How a node element is displayed. */
  public enum Kind {
    /** A graph. */
    FUNCTION,
    /** A node without an owning graph. */
    CONSTANT,
    /** The output of a graph, if it is a computation. */
    OUTPUT,
    /** One of a graph's inputs. */
    INPUT,
    /** Any other node owned by a graph. */
    INTERMEDIATE,
    /** A placeholder for the output of a graph whose output is not a computation. */
    CONST_OUTPUT
  }

  /** A graph or node; {@code parent} is the id of the containing graph (if any). */
  public record NodeElement(String id, String label, Kind kind, @Nullable String parent) {
    @Override
    public String toString() {
      return String.format(
          "%s [%s] %s%s", id, kind, label, (parent == null) ? "" : " in " + parent);
    }
  }

  /** An edge from {@code source} to {@code target}. */
  public record EdgeElement(String id, String label, String source, String target) {
    @Override
    public String toString() {
      return String.format("%s: %s -%s-> %s", id, source, label, target);
    }
  }

  /** The elements collected by {@link #process}. */
  public record Dump(ImmutableList<NodeElement> nodes, ImmutableList<EdgeElement> edges) {
    @Override
    public String toString() {
      return nodes.stream().map(NodeElement::toString).collect(Collectors.joining("\n"))
          + "\n"
          + edges.stream().map(EdgeElement::toString).collect(Collectors.joining("\n"));
    }
  }

  private final Options options;

  /** Graphs left to process. */
  private final Deque<IrGraph> graphs = new ArrayDeque<>();

  /** Every graph that has been queued. */
  private final Set<IrGraph> queued = new LinkedHashSet<>();

  /** Nodes whose edges haven't been processed yet. */
  private final Deque<IrNode> pool = new ArrayDeque<>();

  private int currentId;

  /** The id most recently assigned to each graph or node. */
  private final Map<Object, String> ids = new IdentityHashMap<>();

  private final List<NodeElement> nodes = new ArrayList<>();
  private final List<EdgeElement> edges = new ArrayList<>();

  public GraphPrinter(Options options, Collection<IrGraph> entryPoints) {
    this.options = options;
    entryPoints.forEach(this::addGraphToProcess);
  }

  /** Prints the given graph (and, by default, every graph it refers to). */
  public static Dump print(IrGraph graph) {
    return new GraphPrinter(Options.DEFAULT, List.of(graph)).process();
  }

  private void addGraphToProcess(IrGraph g) {
    if (queued.add(g)) {
      graphs.add(g);
    }
  }

  private String nextId() {
    return "X" + ++currentId;
  }

  private boolean shouldDup(Object obj) {
    return obj instanceof IrNode node && options.duplicateConstants() && node.isConstant();
  }

  /** Returns the existing id for {@code obj}, or null after assigning it a new one. */
  private @Nullable String register(Object obj) {
    if (!shouldDup(obj)) {
      String id = ids.get(obj);
      if (id != null) {
        return id;
      }
    }
    ids.put(obj, nextId());
    return null;
  }

  /**
   * If {@code node} should be displayed with the name of the function it applies, returns that
   * function's tag.
   */
  private @Nullable String constFn(IrNode node) {
    if (options.functionInNode() && node.isComputation() && node.fn().isConstant()) {
      return node.fn().tag.toString();
    }
    return null;
  }

  private String addGraph(IrGraph g) {
    String id = register(g);
    if (id != null) {
      return id;
    }
    id = ids.get(g);
    nodes.add(new NodeElement(id, g.tag.toString(), Kind.FUNCTION, null));
    return id;
  }

  /**
   * Adds an element for {@code node} if it doesn't already have one, and returns its id. If {@code
   * g} is null the element is placed in the node's own graph.
   */
  private String addNode(IrNode node, @Nullable IrGraph g) {
    String existing = register(node);
    if (existing != null) {
      return existing;
    }
    String id = ids.get(node);
    if (g == null) {
      g = node.graph();
    }
    String label;
    if (node.isGraph()) {
      if (options.followReferences()) {
        addGraphToProcess((IrGraph) node.value());
      }
      label = node.tag.toString();
    } else if (node.isConstant()) {
      label = String.valueOf(node.value());
    } else {
      label = node.tag.toString();
    }
    Kind kind;
    if (node.graph() == null) {
      kind = Kind.CONSTANT;
    } else if (node == g.output() && node.isComputation()) {
      kind = Kind.OUTPUT;
    } else if (g.inputs().contains(node)) {
      kind = Kind.INPUT;
    } else {
      kind = Kind.INTERMEDIATE;
    }
    String cfn = constFn(node);
    if (cfn != null) {
      // Generated names add nothing next to the function name.
      if (label.contains("/out") || label.contains("/in")) {
        label = "";
      }
      label = label + ":" + cfn;
    }
    nodes.add(new NodeElement(id, label, kind, (g == null) ? null : addGraph(g)));
    pool.add(node);
    return id;
  }

  private void addEdge(IrNode src, Role role, IrNode dest, IrGraph g) {
    String label = role.isFn() ? "F" : String.valueOf(role.index());
    String destId = addNode(dest, shouldDup(dest) ? g : null);
    edges.add(new EdgeElement(nextId(), label, destId, ids.get(src)));
  }

  private void processGraph(IrGraph g) {
    for (IrNode input : g.inputs()) {
      addNode(input, null);
    }
    IrNode output = g.output();
    if (output == null) {
      return;
    }
    addNode(output, null);
    if (!output.isComputation()) {
      String outputId = nextId();
      nodes.add(new NodeElement(outputId, "", Kind.CONST_OUTPUT, addGraph(g)));
      edges.add(new EdgeElement(nextId(), "", ids.get(output), outputId));
    }
    while (!pool.isEmpty()) {
      IrNode node = pool.removeFirst();
      if (constFn(node) != null) {
        if (options.followReferences() && node.fn().value() instanceof IrGraph fnGraph) {
          addGraphToProcess(fnGraph);
        }
      } else if (node.isComputation()) {
        addEdge(node, Role.FN, node.fn(), g);
      }
      List<IrNode> inputs = node.inputs();
      for (int i = 0; i < inputs.size(); i++) {
        if (inputs.get(i) != null) {
          addEdge(node, Role.input(i), inputs.get(i), g);
        }
      }
    }
  }

  /** Processes each of the graphs and returns the collected elements. */
  public Dump process() {
    while (!graphs.isEmpty()) {
      processGraph(graphs.removeFirst());
    }
    return new Dump(ImmutableList.copyOf(nodes), ImmutableList.copyOf(edges));
  }
}
