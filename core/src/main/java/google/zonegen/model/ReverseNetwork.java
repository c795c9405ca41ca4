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

/** A network for which a reverse zone is generated. */
@AutoValue
public abstract class ReverseNetwork implements SoaFields {

  public abstract CidrNetwork network();

  public static Builder newBuilder(CidrNetwork network) {
    return new AutoValue_ReverseNetwork.Builder().setNetwork(network);
  }

  /** Builder for {@link ReverseNetwork}. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setNetwork(CidrNetwork network);

    public abstract Builder setEmail(Optional<Name> email);

    public abstract Builder setNameservers(Optional<ImmutableList<NameserverEntry>> nameservers);

    public abstract Builder setTtl(Optional<Long> ttl);

    public abstract Builder setRefresh(Optional<Long> refresh);

    public abstract Builder setRetry(Optional<Long> retry);

    public abstract Builder setExpire(Optional<Long> expire);

    public abstract Builder setNrcTtl(Optional<Long> nrcTtl);

    public abstract ReverseNetwork build();
  }
}
