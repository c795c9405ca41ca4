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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Every zone produced by one run, all stamped with the same serial. */
@AutoValue
public abstract class ZoneModel {

  public abstract long serial();

  public abstract ImmutableList<ZoneRecords> forwardZones();

  public abstract ImmutableList<ZoneRecords> reverseZones();

  public static ZoneModel create(
      long serial,
      ImmutableList<ZoneRecords> forwardZones,
      ImmutableList<ZoneRecords> reverseZones) {
    return new AutoValue_ZoneModel(serial, forwardZones, reverseZones);
  }

  /** Returns forward zones followed by reverse zones. */
  public ImmutableList<ZoneRecords> allZones() {
    return new ImmutableList.Builder<ZoneRecords>()
        .addAll(forwardZones())
        .addAll(reverseZones())
        .build();
  }
}
