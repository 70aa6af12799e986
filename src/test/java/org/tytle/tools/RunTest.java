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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Properties;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.tytle.vm.VmOptions;

@RunWith(JUnit4.class)
public class RunTest {

  private final Properties props = new Properties();

  @Test
  public void defaults() {
    VmOptions options = Run.readOptions(props);
    assertThat(options.memoryCapacity).isEqualTo(VmOptions.DEFAULT_MEMORY_CAPACITY);
    assertThat(options.maxCallDepth).isEqualTo(VmOptions.DEFAULT_MAX_CALL_DEPTH);
    assertThat(options.trace).isFalse();
  }

  @Test
  public void readsLimits() {
    props.setProperty("memoryLimit", " 100 ");
    props.setProperty("maxCallDepth", "7");
    props.setProperty("trace", "true");
    VmOptions options = Run.readOptions(props);
    assertThat(options.memoryCapacity).isEqualTo(100);
    assertThat(options.maxCallDepth).isEqualTo(7);
    assertThat(options.trace).isTrue();
  }

  @Test
  public void rejectsNonNumericLimit() {
    props.setProperty("memoryLimit", "lots");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Run.readOptions(props));
    assertThat(e).hasMessageThat().isEqualTo("memoryLimit must be an integer, not 'lots'");
  }

  @Test
  public void rejectsNegativeLimit() {
    props.setProperty("maxCallDepth", "-1");
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Run.readOptions(props));
    assertThat(e).hasMessageThat().isEqualTo("maxCallDepth must not be negative: -1");
  }
}
