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
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * Everything the VM needs to run a program: the (sealed) graph, the procedure table, and the
 * program's storage requirements.
 */
public final class CompiledProgram {

  /** What the VM needs to know about a procedure to call it. */
  public record ProcedureInfo(
      int id, String name, int entryNodeId, int numParams, int frameSize, boolean returnsValue) {

    public ProcedureInfo {
      Preconditions.checkArgument(frameSize >= numParams);
    }
  }

  public final CfgGraph graph;

  /** Keyed by procedure id. */
  public final ImmutableMap<Integer, ProcedureInfo> procedures;

  /** The number of global slots; the main program's frame starts right after them. */
  public final int globalsSize;

  public final int mainFrameSize;

  /** The node in which the main program ends; running off its end halts the VM. */
  public final int exitNodeId;

  public CompiledProgram(
      CfgGraph graph,
      ImmutableMap<Integer, ProcedureInfo> procedures,
      int globalsSize,
      int mainFrameSize,
      int exitNodeId) {
    Preconditions.checkArgument(graph.isSealed(), "graph must be sealed");
    Preconditions.checkArgument(globalsSize >= 0 && mainFrameSize >= 0);
    this.graph = graph;
    this.procedures = procedures;
    this.globalsSize = globalsSize;
    this.mainFrameSize = mainFrameSize;
    this.exitNodeId = exitNodeId;
  }

  public @Nullable ProcedureInfo procedure(int id) {
    return procedures.get(id);
  }

  /**
   * Checks the graph (see {@link CfgGraph#verify}) and that the procedure table and the graph agree:
   * each procedure's entry node and the exit node exist, and every CALL names a known procedure.
   */
  public void verify() {
    graph.verify();
    if (!graph.hasNode(exitNodeId)) {
      throw new MalformedGraphError("Missing exit node", exitNodeId);
    }
    for (ProcedureInfo proc : procedures.values()) {
      if (!graph.hasNode(proc.entryNodeId())) {
        throw new MalformedGraphError("Missing entry node for " + proc.name(), proc.entryNodeId());
      }
    }
    for (CfgNode node : graph.nodes()) {
      for (Instruction inst : node.instructions()) {
        if (inst.opcode == Opcode.CALL && !procedures.containsKey(inst.procId())) {
          throw new MalformedGraphError("Call to unknown procedure #" + inst.procId(), node.id);
        }
      }
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("globals=%s main=%s exit=%s\n", globalsSize, mainFrameSize, exitNodeId));
    procedures
        .values()
        .forEach(
            p ->
                sb.append(
                    String.format(
                        "#%s %s: entry=%s params=%s frame=%s%s\n",
                        p.id(),
                        p.name(),
                        p.entryNodeId(),
                        p.numParams(),
                        p.frameSize(),
                        p.returnsValue() ? " value" : "")));
    return sb.append(graph).toString();
  }
}
