/*
 * Copyright 2025 The Tytle Authors
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

package org.tytle.code;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A control-flow graph: {@link CfgNode}s indexed by id and connected by typed edges.
 *
 * <p>The graph owns its nodes; nodes refer to each other only by id, so loops in the graph are
 * not cycles of object references. Every edge is recorded on both of its nodes, and all mutations
 * here preserve that.
 *
 * <p>The entry node (id 0) is created with the graph. Ids are handed out in increasing order and
 * never reused. Some nodes are <em>roots</em>, which are where control arrives from outside the
 * graph's edges (the entry node, procedure entry nodes, and the program's exit node); {@link
 * #compact} never removes them even if they have no edges.
 *
 * <p>Once {@link #seal sealed}, a graph can no longer be modified.
 */
public class CfgGraph {

  public static final int ENTRY_ID = 0;

  private final SortedMap<Integer, CfgNode> nodes = new TreeMap<>();

  private final Set<Integer> roots = new TreeSet<>();

  private int nextId;

  private boolean sealed;

  public CfgGraph() {
    newNode();
    roots.add(ENTRY_ID);
  }

  public int entryId() {
    return ENTRY_ID;
  }

  /** The id that the next call to {@link #newNode} will return. */
  public int nextId() {
    return nextId;
  }

  public int nodeCount() {
    return nodes.size();
  }

  /** All nodes, in increasing id order. */
  public Collection<CfgNode> nodes() {
    return Collections.unmodifiableCollection(nodes.values());
  }

  public boolean hasNode(int id) {
    return nodes.containsKey(id);
  }

  public CfgNode getNode(int id) {
    CfgNode node = nodes.get(id);
    Preconditions.checkArgument(node != null, "No node %s", id);
    return node;
  }

  /** Creates a new empty node and returns its id. */
  @CanIgnoreReturnValue
  public int newNode() {
    checkMutable();
    CfgNode node = new CfgNode(nextId++);
    nodes.put(node.id, node);
    return node.id;
  }

  /**
   * Adds a node built outside the graph (e.g. by a test), replacing any node with the same id.
   * Edges already recorded on the node are taken as they are.
   */
  public void addNode(CfgNode node) {
    checkMutable();
    nodes.put(node.id, node);
    if (node.id >= nextId) {
      nextId = node.id + 1;
    }
  }

  /** Adds an edge from {@code srcId} to {@code dstId}, recording it on both nodes. */
  public void addEdge(int srcId, int dstId, JumpKind kind) {
    checkMutable();
    CfgNode src = getNode(srcId);
    CfgNode dst = getNode(dstId);
    src.addOutgoingEdge(dstId, kind);
    dst.addIncomingEdge(srcId, kind);
  }

  public void appendInst(int id, Instruction inst) {
    checkMutable();
    getNode(id).appendInst(inst);
  }

  /** Marks a node as a root, so that {@link #compact} will keep it. */
  public void markRoot(int id) {
    checkMutable();
    Preconditions.checkArgument(hasNode(id), "No node %s", id);
    roots.add(id);
  }

  public boolean isRoot(int id) {
    return roots.contains(id);
  }

  public boolean nodeIsEmpty(int id) {
    return getNode(id).isEmpty();
  }

  public boolean endsWithReturn(int id) {
    return getNode(id).endsWithReturn();
  }

  public boolean isOrphan(int id) {
    return getNode(id).isOrphan();
  }

  /**
   * Removes every orphan node that is not a root, and returns the ids removed. Removing an orphan
   * can't make another node an orphan (it has no edges to remove), so one pass suffices.
   */
  @CanIgnoreReturnValue
  public ImmutableList<Integer> compact() {
    checkMutable();
    ImmutableList<Integer> orphans =
        nodes.values().stream()
            .filter(node -> node.isOrphan() && !roots.contains(node.id))
            .map(node -> node.id)
            .collect(ImmutableList.toImmutableList());
    orphans.forEach(nodes::remove);
    return orphans;
  }

  /** Makes this graph and all of its nodes immutable. */
  public void seal() {
    sealed = true;
    nodes.values().forEach(CfgNode::seal);
  }

  public boolean isSealed() {
    return sealed;
  }

  private void checkMutable() {
    Preconditions.checkState(!sealed, "Graph is sealed");
  }

  /**
   * Checks that this graph can be executed, throwing a {@link MalformedGraphError} if not:
   *
   * <ul>
   *   <li>the entry node and all roots exist;
   *   <li>every edge refers to existing nodes and is recorded on both of them;
   *   <li>each node either has no outgoing edges, a single ALWAYS edge, or exactly one WHEN_TRUE
   *       and one FALLBACK edge; and
   *   <li>a node with a conditional pair ends with an instruction that leaves a value (the
   *       condition) on the stack.
   * </ul>
   */
  public void verify() {
    if (!hasNode(ENTRY_ID)) {
      throw malformed(ENTRY_ID, "Missing entry node");
    }
    for (int root : roots) {
      if (!hasNode(root)) {
        throw malformed(root, "Missing root node");
      }
    }
    for (CfgNode node : nodes.values()) {
      for (CfgEdge edge : node.outgoing()) {
        CfgNode dst = nodes.get(edge.nodeId());
        if (dst == null) {
          throw malformed(node.id, "Edge %s to missing node", edge);
        } else if (!dst.incoming().contains(new CfgEdge(node.id, edge.kind()))) {
          throw malformed(node.id, "Edge %s not recorded on its target", edge);
        }
      }
      for (CfgEdge edge : node.incoming()) {
        CfgNode src = nodes.get(edge.nodeId());
        if (src == null) {
          throw malformed(node.id, "Edge %s from missing node", edge);
        } else if (!src.outgoing().contains(new CfgEdge(node.id, edge.kind()))) {
          throw malformed(node.id, "Edge %s not recorded on its source", edge);
        }
      }
      verifyExits(node);
    }
  }

  private static void verifyExits(CfgNode node) {
    EnumSet<JumpKind> kinds = EnumSet.noneOf(JumpKind.class);
    node.outgoing().forEach(edge -> kinds.add(edge.kind()));
    int count = node.outgoing().size();
    if (count == 0 || (count == 1 && kinds.contains(JumpKind.ALWAYS))) {
      return;
    }
    if (count != 2 || !kinds.equals(EnumSet.of(JumpKind.WHEN_TRUE, JumpKind.FALLBACK))) {
      throw malformed(node.id, "Invalid outgoing edges %s", node.outgoing());
    }
    Instruction last = node.lastInst();
    if (last == null || !last.opcode.producesValue) {
      throw malformed(node.id, "Conditional edges without a condition");
    }
  }

  @FormatMethod
  private static MalformedGraphError malformed(int nodeId, String fmt, Object... fmtArgs) {
    return new MalformedGraphError(String.format(fmt, fmtArgs), nodeId);
  }

  /**
   * Returns a listing of the graph, one node per line:
   *
   * <pre>
   * 0: push 1, push 2, lt -> WHEN_TRUE:1, FALLBACK:2
   * </pre>
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (CfgNode node : nodes.values()) {
      sb.append(node.id).append(':');
      if (!node.isEmpty()) {
        sb.append(' ')
            .append(
                node.instructions().stream().map(Object::toString).collect(Collectors.joining(", ")));
      }
      if (!node.outgoing().isEmpty()) {
        sb.append(" -> ")
            .append(
                node.outgoing().stream().map(Object::toString).collect(Collectors.joining(", ")));
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
