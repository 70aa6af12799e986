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

/** A Host that ignores everything. */
public final class DummyHost implements Host {

  public static final DummyHost INSTANCE = new DummyHost();

  private DummyHost() {}

  @Override
  public void moveTo(double x, double y) {}

  @Override
  public void drawLine(double fromX, double fromY, double toX, double toY, boolean erase) {}

  @Override
  public void setHeading(double degrees) {}

  @Override
  public void setPenState(PenState state, boolean erase) {}

  @Override
  public void setVisible(boolean visible) {}
}
