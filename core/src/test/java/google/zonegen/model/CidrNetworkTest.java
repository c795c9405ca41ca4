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

package google.zonegen.model;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link CidrNetwork}. */
class CidrNetworkTest {

  @Test
  void testParse_clearsHostBits() {
    CidrNetwork network = CidrNetwork.parse("192.168.1.77/24");

    assertThat(network.toString()).isEqualTo("192.168.1.0/24");
    assertThat(network.isIpv4()).isTrue();
  }

  @Test
  void testParse_ipv6() {
    CidrNetwork network = CidrNetwork.parse("fd00::1/64");

    assertThat(network.toString()).isEqualTo("fd00::/64");
    assertThat(network.isIpv4()).isFalse();
  }

  @Test
  void testParse_malformed() {
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> CidrNetwork.parse("192.168.1.0"));
    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo("'192.168.1.0' is not a CIDR network (expected address/prefix)");
  }

  @Test
  void testParse_badAddress() {
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> CidrNetwork.parse("192.168.1/24"));
    assertThat(thrown).hasMessageThat().isEqualTo("'192.168.1' is not a valid IP address");
  }

  @Test
  void testParse_badPrefix() {
    assertThat(
            assertThrows(IllegalArgumentException.class, () -> CidrNetwork.parse("10.0.0.0/x")))
        .hasMessageThat()
        .isEqualTo("'x' is not a valid prefix length");
    assertThat(
            assertThrows(IllegalArgumentException.class, () -> CidrNetwork.parse("fd00::/129")))
        .hasMessageThat()
        .isEqualTo("prefix length 129 out of range (0-128)");
  }

  @Test
  void testContains_sameFamilyOnly() {
    CidrNetwork network = CidrNetwork.parse("192.168.1.0/24");

    assertThat(network.contains(InetAddresses.forString("192.168.1.254"))).isTrue();
    assertThat(network.contains(InetAddresses.forString("192.168.2.1"))).isFalse();
    assertThat(network.contains(InetAddresses.forString("fd00::1"))).isFalse();
  }

  @Test
  void testContains_zeroPrefixMatchesEverything() {
    assertThat(CidrNetwork.parse("0.0.0.0/0").contains(InetAddresses.forString("8.8.8.8")))
        .isTrue();
  }

  @Test
  void testReverseZoneName_ipv4() {
    assertThat(CidrNetwork.parse("192.168.1.0/24").reverseZoneName().toString())
        .isEqualTo("1.168.192.in-addr.arpa.");
    assertThat(CidrNetwork.parse("10.0.0.0/16").reverseZoneName().toString())
        .isEqualTo("0.10.in-addr.arpa.");
  }

  @Test
  void testReverseZoneName_partialOctetIsDropped() {
    assertThat(CidrNetwork.parse("172.16.0.0/12").reverseZoneName().toString())
        .isEqualTo("172.in-addr.arpa.");
  }

  @Test
  void testReverseZoneName_ipv6() {
    assertThat(CidrNetwork.parse("2001:db8::/32").reverseZoneName().toString())
        .isEqualTo("8.b.d.0.1.0.0.2.ip6.arpa.");
  }
}
