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

import com.google.common.collect.ImmutableList;
import java.net.InetAddress;
import java.util.Optional;
import org.xbill.DNS.Name;

/**
 * A host of a forward zone with every address it resolves to.
 *
 * @param name the fully qualified host name
 * @param aliases extra fully qualified names that get the same addresses
 */
public record HostEntry(
    Name name,
    ImmutableList<InetAddress> addresses,
    ImmutableList<Name> aliases,
    Optional<Long> ttl,
    Optional<Boolean> withPtr) {

  /** Builds the entry for {@code name} from whichever notation the host was written in. */
  public static HostEntry of(Name name, HostSpec spec) {
    switch (spec.getKind()) {
      case ADDRESS:
        return new HostEntry(
            name,
            ImmutableList.of(spec.address()),
            ImmutableList.of(),
            Optional.empty(),
            Optional.empty());
      case ADDRESS_LIST:
        return new HostEntry(
            name, spec.addressList(), ImmutableList.of(), Optional.empty(), Optional.empty());
      case DETAILED:
        HostSpec.Detailed detailed = spec.detailed();
        return new HostEntry(
            name, detailed.addresses(), detailed.aliases(), detailed.ttl(), detailed.withPtr());
    }
    throw new AssertionError("Unknown host notation " + spec.getKind());
  }

  /** Returns true if the host is a wildcard such as {@code *.example.com.}. */
  public boolean isWildcard() {
    return name.isWild();
  }
}
