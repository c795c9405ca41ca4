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
import java.util.Optional;
import org.xbill.DNS.Name;

/**
 * The fields that make up a zone's SOA and apex, which the document defaults, forward zones and
 * reverse networks may each set.
 */
public interface SoaFields {

  /** The responsible mailbox, already in SOA form ({@code hostmaster.example.com.}). */
  Optional<Name> email();

  /** Empty when not set; present but empty is not a valid state. */
  Optional<ImmutableList<NameserverEntry>> nameservers();

  Optional<Long> ttl();

  Optional<Long> refresh();

  Optional<Long> retry();

  Optional<Long> expire();

  Optional<Long> nrcTtl();
}
