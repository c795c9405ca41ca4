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
import static google.zonegen.util.ResourceUtils.readResourceUtf8;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ResourceUtils} and {@link SystemClock}. */
class ResourceUtilsTest {

  @Test
  void testReadResourceUtf8_readsFileNextToClass() {
    assertThat(readResourceUtf8(ResourceUtilsTest.class, "sample.txt"))
        .isEqualTo("first line\nsecond line\n");
  }

  @Test
  void testReadResourceUtf8_missingResource_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> readResourceUtf8(ResourceUtilsTest.class, "does-not-exist.txt"));
  }

  @Test
  void testSystemClock_isInUtc() {
    DateTime before = DateTime.now(DateTimeZone.UTC);
    DateTime now = new SystemClock().nowUtc();
    assertThat(now.getZone()).isEqualTo(DateTimeZone.UTC);
    assertThat(now.isBefore(before)).isFalse();
  }
}
