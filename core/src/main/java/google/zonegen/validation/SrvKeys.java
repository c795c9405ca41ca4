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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Rules for the {@code _service._proto} keys of SRV records. */
public final class SrvKeys {

  /** Returns every rule {@code key} breaks, or an empty list if it is a valid SRV key. */
  public static ImmutableList<String> check(String key) {
    List<String> parts = Splitter.on('.').splitToList(key);
    if (parts.size() < 2) {
      return ImmutableList.of(
          String.format(
              "SRV key '%s' must have at least service and protocol (e.g. '_http._tcp')", key));
    }
    ImmutableList.Builder<String> problems = new ImmutableList.Builder<>();
    String service = parts.get(0);
    String protocol = parts.get(1);
    if (!service.startsWith("_")) {
      problems.add(String.format("service name '%s' must start with '_' (e.g. '_http')", service));
    }
    if (!protocol.startsWith("_")) {
      problems.add(String.format("protocol name '%s' must start with '_' (e.g. '_tcp')", protocol));
    }
    return problems.build();
  }

  private SrvKeys() {}
}
