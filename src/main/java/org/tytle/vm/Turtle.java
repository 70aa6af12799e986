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
 * The turtle's position and heading. It starts at the origin facing north; headings are in
 * degrees, clockwise, and kept in {@code [0, 360)}.
 */
public final class Turtle {
  private double x;
  private double y;
  private double heading;

  public double x() {
    return x;
  }

  public double y() {
    return y;
  }

  public double heading() {
    return heading;
  }

  /** Moves along the current heading (backward if {@code distance} is negative). */
  void forward(double distance) {
    double radians = Math.toRadians(heading);
    x += distance * Math.sin(radians);
    y += distance * Math.cos(radians);
  }

  /** Turns clockwise (counter-clockwise if {@code degrees} is negative). */
  void turn(double degrees) {
    double h = (heading + degrees) % 360;
    // Adding 0.0 turns -0.0 into 0.0.
    heading = (h < 0) ? h + 360 : h + 0.0;
  }

  void setX(double x) {
    this.x = x;
  }

  void setY(double y) {
    this.y = y;
  }

  @Override
  public String toString() {
    return String.format("(%.2f, %.2f) heading %.1f", x, y, heading);
  }
}
