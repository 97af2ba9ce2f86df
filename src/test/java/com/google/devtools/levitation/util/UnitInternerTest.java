// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package com.google.devtools.levitation.util;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link UnitInterner}. */
@RunWith(JUnit4.class)
public final class UnitInternerTest {
  private final UnitInterner interner = new UnitInterner();

  @Test
  public void intern_assignsDenseIdsInOrder() {
    assertThat(interner.intern("a")).isEqualTo(0);
    assertThat(interner.intern("b/c")).isEqualTo(1);
    assertThat(interner.intern("a")).isEqualTo(0);
    assertThat(interner.size()).isEqualTo(2);
    assertThat(interner.paths()).containsExactly("a", "b/c").inOrder();
  }

  @Test
  public void getAndFind() {
    int id = interner.intern("lib/vector");

    assertThat(interner.get(id)).isEqualTo("lib/vector");
    assertThat(interner.find("lib/vector")).isEqualTo(OptionalInt.of(id));
    assertThat(interner.find("lib/list")).isEqualTo(OptionalInt.empty());
    assertThat(interner.size()).isEqualTo(1);
  }

  @Test
  public void get_unknownId() {
    assertThrows(IllegalArgumentException.class, () -> interner.get(0));
  }

  @Test
  public void intern_concurrently() throws Exception {
    int threads = 8;
    int paths = 200;
    CountDownLatch start = new CountDownLatch(1);
    List<Thread> workers = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      Thread worker =
          new Thread(
              () -> {
                try {
                  start.await();
                } catch (InterruptedException e) {
                  throw new AssertionError(e);
                }
                for (int i = 0; i < paths; i++) {
                  interner.intern("unit" + i);
                }
              });
      worker.start();
      workers.add(worker);
    }
    start.countDown();
    for (Thread worker : workers) {
      worker.join();
    }

    assertThat(interner.size()).isEqualTo(paths);
    for (int i = 0; i < paths; i++) {
      assertThat(interner.get(interner.find("unit" + i).getAsInt())).isEqualTo("unit" + i);
    }
  }
}
