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
import java.util.Optional;
import org.xbill.DNS.Name;

/**
 * One forward zone as declared in the document.
 *
 * <p>All names are already expanded against {@link #name()}. Fields left empty inherit from
 * {@link Defaults}.
 */
@AutoValue
public abstract class ZoneConfig implements SoaFields {

  public abstract Name name();

  /** Empty to inherit the default MX list; present but empty to publish no MX records. */
  public abstract Optional<ImmutableList<MxEntry>> mx();

  public abstract Optional<Integer> mxPriority();

  public abstract Optional<Integer> srvPriority();

  public abstract Optional<Integer> srvWeight();

  public abstract Optional<Boolean> withPtr();

  public abstract ImmutableList<HostEntry> hosts();

  public abstract ImmutableList<CnameEntry> cnames();

  public abstract ImmutableList<SrvEntry> srv();

  public static Builder newBuilder(Name name) {
    return new AutoValue_ZoneConfig.Builder()
        .setName(name)
        .setHosts(ImmutableList.of())
        .setCnames(ImmutableList.of())
        .setSrv(ImmutableList.of());
  }

  /** Builder for {@link ZoneConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setName(Name name);

    public abstract Builder setEmail(Optional<Name> email);

    public abstract Builder setNameservers(Optional<ImmutableList<NameserverEntry>> nameservers);

    public abstract Builder setMx(Optional<ImmutableList<MxEntry>> mx);

    public abstract Builder setTtl(Optional<Long> ttl);

    public abstract Builder setRefresh(Optional<Long> refresh);

    public abstract Builder setRetry(Optional<Long> retry);

    public abstract Builder setExpire(Optional<Long> expire);

    public abstract Builder setNrcTtl(Optional<Long> nrcTtl);

    public abstract Builder setMxPriority(Optional<Integer> mxPriority);

    public abstract Builder setSrvPriority(Optional<Integer> srvPriority);

    public abstract Builder setSrvWeight(Optional<Integer> srvWeight);

    public abstract Builder setWithPtr(Optional<Boolean> withPtr);

    public abstract Builder setHosts(ImmutableList<HostEntry> hosts);

    public abstract Builder setCnames(ImmutableList<CnameEntry> cnames);

    public abstract Builder setSrv(ImmutableList<SrvEntry> srv);

    public abstract ZoneConfig build();
  }
}
