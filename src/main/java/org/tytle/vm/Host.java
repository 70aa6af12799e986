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

/**
 * Receives the visible effects of running a program. The VM calls these methods synchronously, in
 * program order, after updating its own turtle and pen state.
 */
public interface Host {

  /** The turtle moved to the given position. */
  void moveTo(double x, double y);

  /** The turtle moved with the pen down, drawing (or erasing) a line. Called before moveTo. */
  void drawLine(double fromX, double fromY, double toX, double toY, boolean erase);

  /** The turtle turned to the given heading. */
  void setHeading(double degrees);

  void setPenState(PenState state, boolean erase);

  void setVisible(boolean visible);
}
