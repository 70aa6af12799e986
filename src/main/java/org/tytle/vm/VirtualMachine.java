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

package org.tytle.vm;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tytle.code.Address;
import org.tytle.code.CfgEdge;
import org.tytle.code.CfgNode;
import org.tytle.code.CompiledProgram;
import org.tytle.code.CompiledProgram.ProcedureInfo;
import org.tytle.code.Instruction;
import org.tytle.code.JumpKind;
import org.tytle.code.MalformedGraphError;
import org.tytle.code.Opcode;

/**
 * Executes a {@link CompiledProgram}.
 *
 * <p>The VM's position is a node id and the index of the next instruction in that node. Each
 * {@link #step} either executes one instruction or, once the node's instructions are exhausted,
 * leaves the node:
 *
 * <ul>
 *   <li>through its ALWAYS edge, if it has one;
 *   <li>through its WHEN_TRUE or FALLBACK edge, chosen by popping a boolean, if it has those;
 *   <li>if it has no edges, by halting (if it is the program's exit node) or failing.
 * </ul>
 *
 * <p>Values are computed on an operand stack. Globals live at the bottom of {@link Memory}, the
 * main program's frame just above them, and each procedure call gets a new frame immediately above
 * its caller's. CALL pops the arguments into the first slots of the new frame; a RETURN with a
 * value leaves it on the operand stack for the caller.
 *
 * <p>Any error stops the VM in the FAILED state; {@link #error} describes it.
 */
public final class VirtualMachine {

  private static final Logger logger = LoggerFactory.getLogger(VirtualMachine.class);

  public enum State {
    RUNNING,
    HALTED,
    FAILED
  }

  private final CompiledProgram program;
  private final Host host;
  private final VmOptions options;

  private final Memory memory;
  private final CallStack callStack;
  private final Deque<MemoryValue> operands = new ArrayDeque<>();
  private final Turtle turtle = new Turtle();
  private final Pen pen = new Pen();

  private State state = State.RUNNING;
  private @Nullable VmError error;

  private int nodeId;
  private int instIndex;

  private long steps;

  /**
   * Creates a VM that will run the given program from its entry node.
   *
   * @throws MalformedGraphError if the program's graph can't be executed
   */
  public VirtualMachine(CompiledProgram program, Host host, VmOptions options) {
    program.verify();
    Preconditions.checkArgument(
        program.globalsSize + program.mainFrameSize <= options.memoryCapacity,
        "Memory capacity %s too small for the program",
        options.memoryCapacity);
    this.program = program;
    this.host = host;
    this.options = options;
    this.memory = new Memory(options.memoryCapacity);
    this.callStack = new CallStack(options.maxCallDepth);
    this.nodeId = program.graph.entryId();
  }

  public VirtualMachine(CompiledProgram program, Host host) {
    this(program, host, VmOptions.DEFAULT);
  }

  public State state() {
    return state;
  }

  /** The error that stopped the VM, or null unless the state is FAILED. */
  public @Nullable VmError error() {
    return error;
  }

  public Memory memory() {
    return memory;
  }

  public CallStack callStack() {
    return callStack;
  }

  public Turtle turtle() {
    return turtle;
  }

  public Pen pen() {
    return pen;
  }

  public int nodeId() {
    return nodeId;
  }

  public int instIndex() {
    return instIndex;
  }

  /** The number of values on the operand stack. */
  public int operandDepth() {
    return operands.size();
  }

  /** The number of steps taken so far. */
  public long steps() {
    return steps;
  }

  /** Returns the value of a global or (resolved against the current frame) local variable. */
  public @Nullable MemoryValue valueAt(Address address) {
    return memory.get(address.resolve(frameBase()));
  }

  /** Runs until the program halts or fails. */
  @CanIgnoreReturnValue
  public State run() {
    while (state == State.RUNNING) {
      step();
    }
    logger.debug("Stopped {} after {} steps", state, steps);
    return state;
  }

  /** Executes one instruction or one jump; does nothing unless the VM is RUNNING. */
  @CanIgnoreReturnValue
  public State step() {
    if (state != State.RUNNING) {
      return state;
    }
    int atNode = nodeId;
    int atIndex = instIndex;
    try {
      ++steps;
      CfgNode node = program.graph.getNode(nodeId);
      List<Instruction> insts = node.instructions();
      if (instIndex < insts.size()) {
        Instruction inst = insts.get(instIndex++);
        if (options.trace) {
          logger.debug("{}.{}: {}", atNode, atIndex, inst);
        } else {
          logger.trace("{}.{}: {}", atNode, atIndex, inst);
        }
        execute(inst);
      } else {
        leave(node);
      }
    } catch (VmError e) {
      error = e.at(atNode, atIndex);
      state = State.FAILED;
      logger.debug("Failed: {}", error.getMessage());
    }
    return state;
  }

  /** The base address of the current frame. */
  private int frameBase() {
    CallStack.Frame top = callStack.top();
    return (top == null) ? program.globalsSize : top.base();
  }

  private int frameSize() {
    CallStack.Frame top = callStack.top();
    return (top == null) ? program.mainFrameSize : top.size();
  }

  private MemoryValue pop() {
    MemoryValue result = operands.poll();
    VmError.Kind.OPERAND_STACK_UNDERFLOW.unless(result != null, "Operand stack is empty");
    return result;
  }

  private void push(MemoryValue value) {
    operands.push(value);
  }

  private void execute(Instruction inst) {
    switch (inst.opcode) {
      case PUSH -> push(MemoryValue.of(inst.constant()));
      case LOAD -> push(memory.load(inst.address().resolve(frameBase())));
      case STORE -> memory.store(inst.address().resolve(frameBase()), pop());
      case POP -> pop();
      case ADD -> {
        MemoryValue right = pop();
        MemoryValue left = pop();
        if (left.isStr()) {
          push(MemoryValue.ofStr(left.asStr() + right.asStr()));
        } else {
          push(MemoryValue.ofInt(left.asInt() + right.asInt()));
        }
      }
      case SUB -> {
        int right = pop().asInt();
        push(MemoryValue.ofInt(pop().asInt() - right));
      }
      case MUL -> {
        int right = pop().asInt();
        push(MemoryValue.ofInt(pop().asInt() * right));
      }
      case DIV -> {
        int right = pop().asInt();
        int left = pop().asInt();
        VmError.Kind.DIVISION_BY_ZERO.unless(right != 0, "%s / 0", left);
        push(MemoryValue.ofInt(left / right));
      }
      case LT -> {
        int right = pop().asInt();
        push(MemoryValue.ofBool(pop().asInt() < right));
      }
      case GT -> {
        int right = pop().asInt();
        push(MemoryValue.ofBool(pop().asInt() > right));
      }
      case NOT -> push(MemoryValue.ofBool(!pop().asBool()));
      case CALL -> call(program.procedure(inst.procId()));
      case RETURN -> doReturn(inst.returnsValue());
      case FORWARD -> move(pop().asInt());
      case BACKWARD -> move(-pop().asInt());
      case LEFT -> turn(-pop().asInt());
      case RIGHT -> turn(pop().asInt());
      case SETX -> moveTo(pop().asInt(), turtle.y());
      case SETY -> moveTo(turtle.x(), pop().asInt());
      case PENUP -> {
        pen.up();
        host.setPenState(pen.state(), pen.isErasing());
      }
      case PENDOWN, PENERASE -> {
        pen.down(inst.opcode == Opcode.PENERASE);
        host.setPenState(pen.state(), pen.isErasing());
      }
      case SHOWTURTLE, HIDETURTLE -> {
        pen.setVisible(inst.opcode == Opcode.SHOWTURTLE);
        host.setVisible(pen.isVisible());
      }
    }
  }

  private void call(ProcedureInfo proc) {
    int base = frameBase() + frameSize();
    VmError.Kind.CALL_STACK_OVERFLOW.unless(
        base + proc.frameSize() <= memory.capacity(), "Out of memory calling %s", proc.name());
    callStack.push(new CallStack.Frame(nodeId, instIndex, base, proc.frameSize(), proc.id()));
    memory.clear(base, proc.frameSize());
    // The last argument is on top of the stack.
    for (int i = proc.numParams() - 1; i >= 0; i--) {
      memory.store(base + i, pop());
    }
    nodeId = proc.entryNodeId();
    instIndex = 0;
  }

  private void doReturn(boolean withValue) {
    CallStack.Frame frame = callStack.pop();
    ProcedureInfo proc = program.procedure(frame.procId());
    VmError.Kind.MISSING_RETURN_VALUE.unless(
        withValue || !proc.returnsValue(), "%s ended without returning a value", proc.name());
    nodeId = frame.returnNodeId();
    instIndex = frame.returnIndex();
  }

  private void move(double distance) {
    double fromX = turtle.x();
    double fromY = turtle.y();
    turtle.forward(distance);
    afterMove(fromX, fromY);
  }

  private void moveTo(double x, double y) {
    double fromX = turtle.x();
    double fromY = turtle.y();
    turtle.setX(x);
    turtle.setY(y);
    afterMove(fromX, fromY);
  }

  private void afterMove(double fromX, double fromY) {
    if (pen.isDown()) {
      host.drawLine(fromX, fromY, turtle.x(), turtle.y(), pen.isErasing());
    }
    host.moveTo(turtle.x(), turtle.y());
  }

  private void turn(double degrees) {
    turtle.turn(degrees);
    host.setHeading(turtle.heading());
  }

  /** Called when the current node's instructions have all been executed. */
  private void leave(CfgNode node) {
    if (node.outgoing().isEmpty()) {
      VmError.Kind.MISSING_EDGE.unless(
          node.id == program.exitNodeId, "No way out of node %s", node.id);
      state = State.HALTED;
      return;
    }
    CfgEdge next = node.outgoing(JumpKind.ALWAYS);
    if (next == null) {
      next = node.outgoing(pop().asBool() ? JumpKind.WHEN_TRUE : JumpKind.FALLBACK);
    }
    nodeId = next.nodeId();
    instIndex = 0;
  }

  @Override
  public String toString() {
    return String.format(
        "%s at %s.%s, turtle %s, pen %s, %s calls",
        state, nodeId, instIndex, turtle, pen, callStack.depth());
  }
}
