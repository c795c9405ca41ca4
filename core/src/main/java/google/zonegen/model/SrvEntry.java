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

import java.util.Optional;
import org.xbill.DNS.Name;

/**
 * A service location record.
 *
 * @param key the {@code _service._proto} key as written
 * @param owner the key expanded against the zone origin
 */
public record SrvEntry(
    String key,
    Name owner,
    Name target,
    int port,
    Optional<Integer> priority,
    Optional<Integer> weight,
    Optional<Long> ttl) {}
