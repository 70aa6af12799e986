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
 * The pen's state. The pen starts down (drawing, not erasing) and the turtle starts visible.
 * PENERASE puts the pen down in erase mode; PENDOWN puts it down in drawing mode.
 */
public final class Pen {
  private PenState state = PenState.DOWN;
  private boolean erase;
  private boolean visible = true;

  public PenState state() {
    return state;
  }

  public boolean isDown() {
    return state == PenState.DOWN;
  }

  public boolean isErasing() {
    return erase;
  }

  public boolean isVisible() {
    return visible;
  }

  void up() {
    state = PenState.UP;
  }

  void down(boolean erase) {
    state = PenState.DOWN;
    this.erase = erase;
  }

  void setVisible(boolean visible) {
    this.visible = visible;
  }

  @Override
  public String toString() {
    return state + (erase ? " (erase)" : "") + (visible ? "" : " (hidden)");
  }
}
