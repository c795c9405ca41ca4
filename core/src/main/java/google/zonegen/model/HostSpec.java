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

import com.google.auto.value.AutoOneOf;
import com.google.common.collect.ImmutableList;
import java.net.InetAddress;
import java.util.Optional;
import org.xbill.DNS.Name;

/**
 * The notations a host may be written in.
 *
 * <pre>
 *   www: 192.168.1.2                                  # ADDRESS
 *   www: [192.168.1.2, "fd00::2"]                     # ADDRESS_LIST
 *   router: {ip: 192.168.1.254, alias: gw, ttl: 600}  # DETAILED
 * </pre>
 */
@AutoOneOf(HostSpec.Kind.class)
public abstract class HostSpec {

  /** Which notation was used. */
  public enum Kind {
    ADDRESS,
    ADDRESS_LIST,
    DETAILED
  }

  /** The mapping notation, which may carry aliases and per-host overrides. */
  public record Detailed(
      ImmutableList<InetAddress> addresses,
      ImmutableList<Name> aliases,
      Optional<Long> ttl,
      Optional<Boolean> withPtr) {}

  public abstract Kind getKind();

  public abstract InetAddress address();

  public abstract ImmutableList<InetAddress> addressList();

  public abstract Detailed detailed();

  public static HostSpec address(InetAddress address) {
    return AutoOneOf_HostSpec.address(address);
  }

  public static HostSpec addressList(ImmutableList<InetAddress> addresses) {
    return AutoOneOf_HostSpec.addressList(addresses);
  }

  public static HostSpec detailed(Detailed detailed) {
    return AutoOneOf_HostSpec.detailed(detailed);
  }
}
