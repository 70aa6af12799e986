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

package org.tytle.compiler;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tytle.ast.BinaryOp;
import org.tytle.ast.Procedure;
import org.tytle.ast.Program;
import org.tytle.ast.Statement.IfStmt;
import org.tytle.ast.Statement.ProcedureStmt;
import org.tytle.ast.Statement.RepeatStmt;
import org.tytle.ast.Statement.ReturnStmt;
import org.tytle.code.Address;
import org.tytle.code.CfgGraph;
import org.tytle.code.CompiledProgram;
import org.tytle.code.CompiledProgram.ProcedureInfo;
import org.tytle.code.Instruction;
import org.tytle.code.JumpKind;
import org.tytle.code.MalformedGraphError;

/**
 * Lowers a resolved program into a {@link CfgGraph}.
 *
 * <p>Instructions are appended to the <em>current</em> node until a construct needs to branch:
 *
 * <ul>
 *   <li>{@code IF c [t] [f]} leaves {@code c} at the end of the current node, which gets a
 *       WHEN_TRUE edge to a new node for {@code t} and a FALLBACK edge to a new node for {@code f}
 *       (or straight to the merge node if there is no {@code f}); both branches end with an ALWAYS
 *       edge to a new merge node, which becomes current.
 *   <li>{@code REPEAT n [b]} stores {@code n} in a hidden counter, then jumps (ALWAYS) to a header
 *       node that tests {@code counter > 0}. Its WHEN_TRUE edge leads to the body, which
 *       decrements the counter before running {@code b} and jumps back to the header; its FALLBACK
 *       edge leads to a new node that becomes current.
 *   <li>Each procedure body starts at its own root node; the main program's code is not
 *       interrupted by it.
 *   <li>{@code RETURN} ends the current node. Code after it goes into a fresh node that nothing
 *       jumps to, and no edges are added from such nodes; they are dropped when the graph is
 *       compacted.
 * </ul>
 *
 * <p>The main program starts at the graph's entry node and ends in the node that is current after
 * the last statement (the exit node).
 */
public final class CfgBuilder extends InstructionEmitter {

  private static final Logger logger = LoggerFactory.getLogger(CfgBuilder.class);

  /** Builds the graph for a program that has been through the {@link Resolver}. */
  public static CompiledProgram build(Program program) {
    Preconditions.checkArgument(program.isResolved(), "Program has not been resolved");
    CfgBuilder builder = new CfgBuilder();
    builder.walkProgram(program);
    return builder.finish(program);
  }

  private final CfgGraph graph = new CfgGraph();

  private int current = CfgGraph.ENTRY_ID;

  private final ImmutableMap.Builder<Integer, ProcedureInfo> procedures = ImmutableMap.builder();

  private CfgBuilder() {}

  @Override
  void emit(Instruction inst) {
    graph.appendInst(current, inst);
  }

  /** A node is unreachable if it isn't a root and nothing jumps to it. */
  private boolean isDead(int nodeId) {
    return !graph.isRoot(nodeId) && graph.isOrphan(nodeId);
  }

  /**
   * Adds an edge, unless control can't actually leave {@code srcId} that way: because it ends
   * with a return, or because it is unreachable.
   */
  private void connect(int srcId, int dstId, JumpKind kind) {
    if (!graph.endsWithReturn(srcId) && !isDead(srcId)) {
      graph.addEdge(srcId, dstId, kind);
    }
  }

  @Override
  public void walkIfStmt(IfStmt ifStmt) {
    walkExpr(ifStmt.condition);
    onIfCondition(ifStmt);
    int condId = current;
    current = graph.newNode();
    connect(condId, current, JumpKind.WHEN_TRUE);
    walkBlockStmt(ifStmt.trueBlock);
    int trueEnd = current;
    int falseEnd = -1;
    if (ifStmt.falseBlock != null) {
      current = graph.newNode();
      connect(condId, current, JumpKind.FALLBACK);
      walkBlockStmt(ifStmt.falseBlock);
      falseEnd = current;
    }
    int mergeId = graph.newNode();
    if (falseEnd < 0) {
      connect(condId, mergeId, JumpKind.FALLBACK);
    }
    connect(trueEnd, mergeId, JumpKind.ALWAYS);
    if (falseEnd >= 0) {
      connect(falseEnd, mergeId, JumpKind.ALWAYS);
    }
    current = mergeId;
  }

  @Override
  public void walkRepeatStmt(RepeatStmt repeat) {
    walkExpr(repeat.count);
    onRepeatCount(repeat);
    Address counter = addressOf(repeat.counter());
    emit(Instruction.store(counter));
    int headerId = graph.newNode();
    connect(current, headerId, JumpKind.ALWAYS);
    current = headerId;
    emit(Instruction.load(counter));
    emit(Instruction.pushInt(0));
    emit(Instruction.binary(BinaryOp.GT));
    current = graph.newNode();
    connect(headerId, current, JumpKind.WHEN_TRUE);
    emit(Instruction.load(counter));
    emit(Instruction.pushInt(1));
    emit(Instruction.binary(BinaryOp.SUB));
    emit(Instruction.store(counter));
    walkBlockStmt(repeat.block);
    connect(current, headerId, JumpKind.ALWAYS);
    current = graph.newNode();
    connect(headerId, current, JumpKind.FALLBACK);
  }

  @Override
  public void walkProcStmt(ProcedureStmt proc) {
    int resumeId = current;
    int entryId = graph.newNode();
    graph.markRoot(entryId);
    current = entryId;
    super.walkProcStmt(proc);
    // Falling off the end of the body is an implicit RETURN.
    if (!graph.endsWithReturn(current)) {
      emit(Instruction.ret(false));
    }
    Procedure symbol = proc.procedure();
    procedures.put(
        symbol.id,
        new ProcedureInfo(
            symbol.id,
            symbol.name,
            entryId,
            symbol.numParams(),
            symbol.frameSize(),
            symbol.returnsValue()));
    current = resumeId;
  }

  @Override
  public void onReturnStmt(ReturnStmt ret) {
    emit(Instruction.ret(ret.value != null));
    current = graph.newNode();
  }

  private CompiledProgram finish(Program program) {
    int exitId = current;
    graph.markRoot(exitId);
    ImmutableList<Integer> removed = graph.compact();
    graph.seal();
    CompiledProgram result =
        new CompiledProgram(
            graph,
            procedures.buildOrThrow(),
            program.globalsSize(),
            program.mainFrameSize(),
            exitId);
    try {
      result.verify();
    } catch (MalformedGraphError e) {
      throw new CompileError(CompileError.Kind.MALFORMED_GRAPH, e.getMessage(), null);
    }
    logger.debug(
        "Built {} nodes ({} unreachable removed), {} procedures",
        graph.nodeCount(),
        removed.size(),
        result.procedures.size());
    return result;
  }
}
