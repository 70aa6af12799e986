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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tytle.ast.BinaryOp;

@RunWith(JUnit4.class)
public class CfgGraphTest {

  private final CfgGraph graph = new CfgGraph();

  @Test
  public void startsWithEntryNode() {
    assertThat(graph.entryId()).isEqualTo(0);
    assertThat(graph.nodeCount()).isEqualTo(1);
    assertThat(graph.hasNode(0)).isTrue();
    assertThat(graph.nodeIsEmpty(0)).isTrue();
    assertThat(graph.isOrphan(0)).isTrue();
    assertThat(graph.isRoot(0)).isTrue();
    assertThat(graph.nextId()).isEqualTo(1);
  }

  @Test
  public void edgesAreSymmetric() {
    int a = graph.newNode();
    int b = graph.newNode();
    graph.addEdge(0, a, JumpKind.WHEN_TRUE);
    graph.addEdge(0, b, JumpKind.FALLBACK);
    graph.addEdge(a, b, JumpKind.ALWAYS);

    assertThat(graph.getNode(0).outgoing())
        .containsExactly(new CfgEdge(a, JumpKind.WHEN_TRUE), new CfgEdge(b, JumpKind.FALLBACK))
        .inOrder();
    assertThat(graph.getNode(a).incoming()).containsExactly(new CfgEdge(0, JumpKind.WHEN_TRUE));
    assertThat(graph.getNode(b).incoming())
        .containsExactly(new CfgEdge(0, JumpKind.FALLBACK), new CfgEdge(a, JumpKind.ALWAYS));
    assertThat(graph.getNode(0).outgoing(JumpKind.FALLBACK).nodeId()).isEqualTo(b);
    assertThat(graph.getNode(0).outgoing(JumpKind.ALWAYS)).isNull();
    assertThat(graph.isOrphan(a)).isFalse();
  }

  @Test
  public void predicates() {
    int n = graph.newNode();
    graph.appendInst(n, Instruction.pushInt(3));
    assertThat(graph.nodeIsEmpty(n)).isFalse();
    assertThat(graph.endsWithReturn(n)).isFalse();
    graph.appendInst(n, Instruction.ret(true));
    assertThat(graph.endsWithReturn(n)).isTrue();
    assertThat(graph.getNode(n).lastInst()).isEqualTo(Instruction.ret(true));
  }

  @Test
  public void compactRemovesOnlyOrphans() {
    int reachable = graph.newNode();
    int orphan = graph.newNode();
    int root = graph.newNode();
    graph.addEdge(0, reachable, JumpKind.ALWAYS);
    graph.appendInst(orphan, Instruction.pushInt(1));
    graph.markRoot(root);

    assertThat(graph.compact()).containsExactly(orphan);
    assertThat(graph.hasNode(orphan)).isFalse();
    assertThat(graph.hasNode(reachable)).isTrue();
    assertThat(graph.hasNode(root)).isTrue();
    // Ids are never reused.
    assertThat(graph.newNode()).isEqualTo(4);
  }

  @Test
  public void sealedGraphCannotChange() {
    graph.seal();
    assertThat(graph.isSealed()).isTrue();
    assertThrows(IllegalStateException.class, graph::newNode);
    assertThrows(IllegalStateException.class, () -> graph.appendInst(0, Instruction.pushInt(1)));
  }

  @Test
  public void sealedNodesCannotChange() {
    int other = graph.newNode();
    graph.appendInst(0, Instruction.pushInt(20));
    graph.addEdge(0, other, JumpKind.ALWAYS);
    graph.seal();
    CfgNode entry = graph.getNode(0);
    assertThrows(IllegalStateException.class, () -> entry.appendInst(Instruction.ret(false)));
    assertThrows(IllegalStateException.class, () -> entry.addOutgoingEdge(42, JumpKind.ALWAYS));
    assertThrows(
        IllegalStateException.class, () -> graph.getNode(other).addIncomingEdge(7, JumpKind.ALWAYS));
    assertThrows(IllegalStateException.class, () -> graph.addNode(new CfgNode(9)));
    assertThat(graph.toString()).isEqualTo("0: push 20 -> ALWAYS:1\n1:\n");
  }

  @Test
  public void addNodeAdvancesIds() {
    graph.addNode(new CfgNode(7));
    assertThat(graph.hasNode(7)).isTrue();
    assertThat(graph.newNode()).isEqualTo(8);
  }

  @Test
  public void verifyAcceptsWellFormedGraph() {
    int t = graph.newNode();
    int f = graph.newNode();
    graph.appendInst(0, Instruction.pushInt(1));
    graph.appendInst(0, Instruction.pushInt(2));
    graph.appendInst(0, Instruction.binary(BinaryOp.LT));
    graph.addEdge(0, t, JumpKind.WHEN_TRUE);
    graph.addEdge(0, f, JumpKind.FALLBACK);
    graph.addEdge(t, f, JumpKind.ALWAYS);
    graph.verify();
    assertThat(graph.toString())
        .isEqualTo("0: push 1, push 2, lt -> WHEN_TRUE:1, FALLBACK:2\n1: -> ALWAYS:2\n2:\n");
  }

  @Test
  public void verifyRejectsOneSidedEdge() {
    CfgNode node = new CfgNode(1);
    node.addIncomingEdge(0, JumpKind.ALWAYS);
    graph.addNode(node);
    MalformedGraphError e = assertThrows(MalformedGraphError.class, graph::verify);
    assertThat(e.nodeId).isEqualTo(1);
  }

  @Test
  public void verifyRejectsDanglingEdge() {
    graph.getNode(0).addOutgoingEdge(5, JumpKind.ALWAYS);
    MalformedGraphError e = assertThrows(MalformedGraphError.class, graph::verify);
    assertThat(e.msg).contains("missing node");
  }

  @Test
  public void verifyRejectsBadExits() {
    int a = graph.newNode();
    int b = graph.newNode();
    graph.addEdge(0, a, JumpKind.ALWAYS);
    graph.addEdge(0, b, JumpKind.WHEN_TRUE);
    assertThrows(MalformedGraphError.class, graph::verify);
  }

  @Test
  public void verifyRejectsConditionWithoutValue() {
    int a = graph.newNode();
    int b = graph.newNode();
    graph.appendInst(0, Instruction.store(Address.global(0)));
    graph.addEdge(0, a, JumpKind.WHEN_TRUE);
    graph.addEdge(0, b, JumpKind.FALLBACK);
    MalformedGraphError e = assertThrows(MalformedGraphError.class, graph::verify);
    assertThat(e.getMessage()).isEqualTo("Conditional edges without a condition (node 0)");
  }

  @Test
  public void compiledProgramChecksCalls() {
    graph.appendInst(0, Instruction.call(3));
    graph.seal();
    CompiledProgram program = new CompiledProgram(graph, ImmutableMap.of(), 0, 0, 0);
    MalformedGraphError e = assertThrows(MalformedGraphError.class, program::verify);
    assertThat(e.msg).isEqualTo("Call to unknown procedure #3");
  }

  @Test
  public void compiledProgramNeedsSealedGraph() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new CompiledProgram(graph, ImmutableMap.of(), 0, 0, 0));
  }
}
