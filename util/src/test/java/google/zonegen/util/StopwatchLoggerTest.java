// Copyright 2025 The Nomulus Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package google.zonegen.util;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Ticker;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link StopwatchLogger}. */
class StopwatchLoggerTest {

  private long nanos = 1_000L;

  private final Ticker ticker =
      new Ticker() {
        @Override
        public long read() {
          return nanos;
        }
      };

  @Test
  void testTick_returnsDurationOfEachStage() {
    StopwatchLogger stopwatch = new StopwatchLogger("generate", Duration.ofMillis(10), ticker);
    nanos += Duration.ofMillis(3).toNanos();
    assertThat(stopwatch.tick("decode")).isEqualTo(Duration.ofMillis(3));
    nanos += Duration.ofMillis(25).toNanos();
    assertThat(stopwatch.tick("validate")).isEqualTo(Duration.ofMillis(25));
  }

  @Test
  void testTotalElapsed_spansAllStages() {
    StopwatchLogger stopwatch = new StopwatchLogger("generate", Duration.ofMillis(10), ticker);
    nanos += Duration.ofMillis(3).toNanos();
    stopwatch.tick("decode");
    nanos += Duration.ofMillis(4).toNanos();
    stopwatch.tick("validate");
    assertThat(stopwatch.totalElapsed()).isEqualTo(Duration.ofMillis(7));
  }
}
