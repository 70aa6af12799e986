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

package org.tytle.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Properties;
import org.antlr.v4.runtime.CharStreams;
import org.tytle.code.CompiledProgram;
import org.tytle.compiler.CompileError;
import org.tytle.compiler.Compiler;
import org.tytle.vm.Host;
import org.tytle.vm.PenState;
import org.tytle.vm.VirtualMachine;
import org.tytle.vm.VmOptions;

/**
 * A simple command-line tool for running a single Tytle program, printing each of its effects.
 *
 * <p>System properties {@code memoryLimit} and {@code maxCallDepth} override the VM's limits;
 * {@code trace=true} logs each instruction, and {@code listing=true} prints the compiled graph.
 */
public class Run {
  private Run() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: run <fileName>");
      System.exit(1);
    }
  }

  /**
   * Builds the VM options from the given properties.
   *
   * @throws IllegalArgumentException if a limit is not a non-negative integer
   */
  static VmOptions readOptions(Properties props) {
    return VmOptions.builder()
        .memoryCapacity(intProperty(props, "memoryLimit", VmOptions.DEFAULT_MEMORY_CAPACITY))
        .maxCallDepth(intProperty(props, "maxCallDepth", VmOptions.DEFAULT_MAX_CALL_DEPTH))
        .trace(Boolean.parseBoolean(props.getProperty("trace", "false")))
        .build();
  }

  private static int intProperty(Properties props, String name, int defaultValue) {
    String value = props.getProperty(name);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be an integer, not '%s'", name, value), e);
    }
  }

  /** A Host that prints what it is told. */
  private static class PrintingHost implements Host {
    @Override
    public void moveTo(double x, double y) {
      System.out.printf("move to (%.2f, %.2f)\n", x, y);
    }

    @Override
    public void drawLine(double fromX, double fromY, double toX, double toY, boolean erase) {
      System.out.printf(
          "%s (%.2f, %.2f) - (%.2f, %.2f)\n", erase ? "erase" : "draw", fromX, fromY, toX, toY);
    }

    @Override
    public void setHeading(double degrees) {
      System.out.printf("heading %.1f\n", degrees);
    }

    @Override
    public void setPenState(PenState state, boolean erase) {
      System.out.printf("pen %s%s\n", state, erase ? " (erase)" : "");
    }

    @Override
    public void setVisible(boolean visible) {
      System.out.println(visible ? "show turtle" : "hide turtle");
    }
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length == 1);
    VmOptions options;
    try {
      options = readOptions(System.getProperties());
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      checkUsage(false);
      return;
    }
    Path file = Path.of(args[0]);
    CompiledProgram program;
    try {
      program = Compiler.compile(CharStreams.fromPath(file));
    } catch (CompileError e) {
      System.out.printf("%s: %s: %s\n", file.getFileName(), e.kind, e.getMessage());
      System.exit(2);
      return;
    }
    if (Boolean.parseBoolean(System.getProperty("listing", "false"))) {
      System.out.printf("/* LISTING\n%s*/\n", program);
    }
    VirtualMachine vm;
    try {
      vm = new VirtualMachine(program, new PrintingHost(), options);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      checkUsage(false);
      return;
    }
    VirtualMachine.State state = vm.run();
    if (state == VirtualMachine.State.FAILED) {
      System.out.printf("/* RUN ERRORS\n  %s\n*/\n", vm.error().getMessage());
      System.exit(3);
    }
    System.out.printf("/* RUN %s after %s steps\n  %s\n*/\n", state, vm.steps(), vm);
  }
}
