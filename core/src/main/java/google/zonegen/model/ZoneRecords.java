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
import com.google.common.collect.ImmutableList;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.SOARecord;

/** The complete, ordered record set of one zone. The SOA record always comes first. */
@AutoValue
public abstract class ZoneRecords {

  /** Whether a zone maps names to addresses or addresses to names. */
  public enum Kind {
    FORWARD,
    REVERSE
  }

  public abstract Name origin();

  public abstract Kind kind();

  /** The zone's effective TTL, used for records that do not set their own. */
  public abstract long defaultTtl();

  public abstract ImmutableList<Record> records();

  public static ZoneRecords create(
      Name origin, Kind kind, long defaultTtl, ImmutableList<Record> records) {
    checkArgument(
        !records.isEmpty() && records.get(0) instanceof SOARecord,
        "Records of zone %s must start with its SOA",
        origin);
    return new AutoValue_ZoneRecords(origin, kind, defaultTtl, records);
  }

  public SOARecord soa() {
    return (SOARecord) records().get(0);
  }

  public long serial() {
    return soa().getSerial();
  }
}
