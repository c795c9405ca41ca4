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

package google.zonegen.validation;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

/** Unit tests for {@link EmailAddresses}. */
class EmailAddressesTest {

  @Test
  void testCheck_validAddresses() {
    assertThat(EmailAddresses.check("hostmaster@example.com")).isEmpty();
    assertThat(EmailAddresses.check("john.doe+dns@mail.example.com.")).isEmpty();
  }

  @Test
  void testCheck_missingAt() {
    assertThat(EmailAddresses.check("hostmaster.example.com"))
        .hasValue("Email must contain '@': hostmaster.example.com");
  }

  @Test
  void testCheck_twoAts() {
    assertThat(EmailAddresses.check("a@b@example.com").get()).contains("exactly one '@'");
  }

  @Test
  void testCheck_consecutiveDotsInLocalPart() {
    assertThat(EmailAddresses.check("john..doe@example.com").get())
        .contains("consecutive dots");
  }

  @Test
  void testCheck_domainWithoutDot() {
    assertThat(EmailAddresses.check("root@localhost"))
        .hasValue("Email domain must contain at least one dot: localhost");
  }

  @Test
  void testCheck_numericTld() {
    assertThat(EmailAddresses.check("root@example.123").get()).contains("all numeric");
  }

  @Test
  void testToMailbox_escapesDotsInLocalPart() {
    assertThat(EmailAddresses.toMailbox("john.doe@example.com").toString())
        .isEqualTo("john\\.doe.example.com.");
  }

  @Test
  void testToMailbox_plainLocalPart() {
    assertThat(EmailAddresses.toMailbox("hostmaster@example.com.").toString())
        .isEqualTo("hostmaster.example.com.");
  }
}
