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

package google.zonegen.transform;

import google.zonegen.ZonegenException;
import org.xbill.DNS.Name;

/** Thrown when a valid document still cannot be turned into consistent zones. */
public class TransformException extends ZonegenException {

  private final Name zone;

  public TransformException(Name zone, String message) {
    super(String.format("Zone %s: %s", zone, message));
    this.zone = zone;
  }

  /** Returns the origin of the zone the conflict was found in. */
  public Name getZone() {
    return zone;
  }
}
