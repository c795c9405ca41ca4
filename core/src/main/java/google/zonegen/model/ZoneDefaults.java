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

/** Values used when neither a zone nor the document defaults set a field. */
public final class ZoneDefaults {

  public static final long TTL = 3600;
  public static final long REFRESH = 86400;
  public static final long RETRY = 7200;
  public static final long EXPIRE = 3600000;
  public static final long NEGATIVE_CACHE_TTL = 3600;
  public static final int MX_PRIORITY = 10;
  public static final int SRV_PRIORITY = 10;
  public static final int SRV_WEIGHT = 10;
  public static final boolean WITH_PTR = true;

  /** Largest value accepted for any TTL-like field. */
  public static final long MAX_TIME_VALUE = Integer.MAX_VALUE;

  /** Largest value accepted for priorities, weights and ports. */
  public static final int MAX_UINT16 = 65535;

  private ZoneDefaults() {}
}
