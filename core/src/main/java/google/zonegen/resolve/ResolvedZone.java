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

package google.zonegen.resolve;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import google.zonegen.model.CnameEntry;
import google.zonegen.model.HostEntry;
import google.zonegen.model.MxEntry;
import google.zonegen.model.SrvEntry;
import org.xbill.DNS.Name;

/** A forward zone with every zone-level setting resolved to a concrete value. */
@AutoValue
public abstract class ResolvedZone {

  public abstract Name origin();

  public abstract SoaSettings soa();

  public abstract ImmutableList<MxEntry> mx();

  public abstract int mxPriority();

  public abstract int srvPriority();

  public abstract int srvWeight();

  public abstract boolean withPtr();

  public abstract ImmutableList<HostEntry> hosts();

  public abstract ImmutableList<CnameEntry> cnames();

  public abstract ImmutableList<SrvEntry> srv();

  public static Builder newBuilder() {
    return new AutoValue_ResolvedZone.Builder()
        .setMx(ImmutableList.of())
        .setHosts(ImmutableList.of())
        .setCnames(ImmutableList.of())
        .setSrv(ImmutableList.of());
  }

  /** Builder for {@link ResolvedZone}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setOrigin(Name origin);

    public abstract Builder setSoa(SoaSettings soa);

    public abstract Builder setMx(ImmutableList<MxEntry> mx);

    public abstract Builder setMxPriority(int mxPriority);

    public abstract Builder setSrvPriority(int srvPriority);

    public abstract Builder setSrvWeight(int srvWeight);

    public abstract Builder setWithPtr(boolean withPtr);

    public abstract Builder setHosts(ImmutableList<HostEntry> hosts);

    public abstract Builder setCnames(ImmutableList<CnameEntry> cnames);

    public abstract Builder setSrv(ImmutableList<SrvEntry> srv);

    public abstract ResolvedZone build();
  }
}
