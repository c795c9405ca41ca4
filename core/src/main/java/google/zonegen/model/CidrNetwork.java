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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.net.InetAddresses;
import com.google.common.primitives.Ints;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import org.xbill.DNS.Name;
import org.xbill.DNS.TextParseException;

/** An IPv4 or IPv6 network in CIDR notation, normalized to its network address. */
@AutoValue
public abstract class CidrNetwork {

  private static final Splitter SLASH = Splitter.on('/');

  /** The first address of the network, with all host bits cleared. */
  public abstract InetAddress address();

  public abstract int prefixLength();

  public static CidrNetwork create(InetAddress address, int prefixLength) {
    int maxPrefix = address.getAddress().length * 8;
    checkArgument(
        prefixLength >= 0 && prefixLength <= maxPrefix,
        "prefix length %s out of range (0-%s)",
        prefixLength,
        maxPrefix);
    return new AutoValue_CidrNetwork(mask(address, prefixLength), prefixLength);
  }

  /**
   * Parses {@code 192.168.1.0/24} or {@code fd00::/64}.
   *
   * @throws IllegalArgumentException with a message fit for users if {@code text} is not a network
   */
  public static CidrNetwork parse(String text) {
    List<String> parts = SLASH.splitToList(text.trim());
    checkArgument(parts.size() == 2, "'%s' is not a CIDR network (expected address/prefix)", text);
    InetAddress address;
    try {
      address = InetAddresses.forString(parts.get(0));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("'%s' is not a valid IP address", parts.get(0)), e);
    }
    Integer prefix = Ints.tryParse(parts.get(1));
    checkArgument(prefix != null, "'%s' is not a valid prefix length", parts.get(1));
    return create(address, prefix);
  }

  public boolean isIpv4() {
    return address() instanceof Inet4Address;
  }

  /** Returns true if {@code candidate} is of the same family and lies inside this network. */
  public boolean contains(InetAddress candidate) {
    if (candidate.getAddress().length != address().getAddress().length) {
      return false;
    }
    return mask(candidate, prefixLength()).equals(address());
  }

  /**
   * Returns the origin of the reverse zone for this network.
   *
   * <p>Only whole octets (IPv4) or nibbles (IPv6) covered by the prefix are used, so
   * {@code 10.0.0.0/16} maps to {@code 0.10.in-addr.arpa.}.
   */
  public Name reverseZoneName() {
    byte[] bytes = address().getAddress();
    StringBuilder name = new StringBuilder();
    if (isIpv4()) {
      for (int i = prefixLength() / 8 - 1; i >= 0; i--) {
        name.append(bytes[i] & 0xff).append('.');
      }
      name.append("in-addr.arpa.");
    } else {
      for (int i = prefixLength() / 4 - 1; i >= 0; i--) {
        int nibble = (i % 2 == 0) ? (bytes[i / 2] >> 4) & 0xf : bytes[i / 2] & 0xf;
        name.append(Character.forDigit(nibble, 16)).append('.');
      }
      name.append("ip6.arpa.");
    }
    try {
      return Name.fromString(name.toString());
    } catch (TextParseException e) {
      throw new IllegalStateException("Generated an unparseable reverse name " + name, e);
    }
  }

  private static InetAddress mask(InetAddress address, int prefixLength) {
    byte[] bytes = address.getAddress();
    for (int i = 0; i < bytes.length; i++) {
      int bitsInByte = Math.max(0, Math.min(8, prefixLength - i * 8));
      bytes[i] &= (byte) (0xff << (8 - bitsInByte));
    }
    try {
      return InetAddress.getByAddress(bytes);
    } catch (UnknownHostException e) {
      throw new IllegalStateException("Masked address has an illegal length", e);
    }
  }

  @Override
  public final String toString() {
    return InetAddresses.toAddrString(address()) + "/" + prefixLength();
  }
}
