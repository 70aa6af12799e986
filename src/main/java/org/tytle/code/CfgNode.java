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
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A basic block: an ordered list of instructions that always execute together, plus the edges by
 * which control enters and leaves it.
 *
 * <p>Edges are stored twice, once on each end; {@link CfgGraph#addEdge} is responsible for keeping
 * the two copies in agreement. The methods here that add a single end of an edge exist for tests
 * that build deliberately inconsistent nodes.
 *
 * <p>A node is sealed along with its graph; after that its mutators throw {@link
 * IllegalStateException}.
 */
public class CfgNode {
  public final int id;

  private final List<Instruction> insts = new ArrayList<>();

  // Linked sets so that printing and edge traversal are deterministic.
  private final Set<CfgEdge> incoming = new LinkedHashSet<>();
  private final Set<CfgEdge> outgoing = new LinkedHashSet<>();

  private boolean sealed;

  public CfgNode(int id) {
    this.id = id;
  }

  /** True if this node has no instructions. */
  public boolean isEmpty() {
    return insts.isEmpty();
  }

  /** True if this node has neither incoming nor outgoing edges. */
  public boolean isOrphan() {
    return incoming.isEmpty() && outgoing.isEmpty();
  }

  /** True if the last instruction of this node is a RETURN. */
  public boolean endsWithReturn() {
    Instruction last = lastInst();
    return last != null && last.isReturn();
  }

  public @Nullable Instruction lastInst() {
    return Iterables.getLast(insts, null);
  }

  public List<Instruction> instructions() {
    return Collections.unmodifiableList(insts);
  }

  public Set<CfgEdge> incoming() {
    return Collections.unmodifiableSet(incoming);
  }

  public Set<CfgEdge> outgoing() {
    return Collections.unmodifiableSet(outgoing);
  }

  /** Returns the outgoing edge of the given kind, or null if there is none. */
  public @Nullable CfgEdge outgoing(JumpKind kind) {
    for (CfgEdge edge : outgoing) {
      if (edge.kind() == kind) {
        return edge;
      }
    }
    return null;
  }

  void appendInst(Instruction inst) {
    checkMutable();
    insts.add(inst);
  }

  void addOutgoingEdge(int dstId, JumpKind kind) {
    checkMutable();
    outgoing.add(new CfgEdge(dstId, kind));
  }

  void addIncomingEdge(int srcId, JumpKind kind) {
    checkMutable();
    incoming.add(new CfgEdge(srcId, kind));
  }

  void seal() {
    sealed = true;
  }

  private void checkMutable() {
    Preconditions.checkState(!sealed, "Node %s is sealed", id);
  }

  @Override
  public String toString() {
    return "node " + id;
  }
}
