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

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import google.zonegen.model.Defaults;
import google.zonegen.model.NameserverEntry;
import google.zonegen.model.ReverseNetwork;
import google.zonegen.model.SoaFields;
import google.zonegen.model.ZoneConfig;
import google.zonegen.model.ZoneDefaults;
import google.zonegen.model.ZoneDocument;
import jakarta.inject.Inject;
import java.util.Optional;
import org.xbill.DNS.Name;

/**
 * Applies the document defaults to every zone and reverse network.
 *
 * <p>For each field the zone's own value wins, then the value from {@code defaults}, then the
 * built-in value from {@link ZoneDefaults}. Email and name servers have no built-in value; the
 * validator guarantees they are set somewhere.
 */
public class DefaultResolver {

  @Inject
  public DefaultResolver() {}

  public ResolvedDocument resolve(ZoneDocument document) {
    Defaults defaults = document.defaults();
    return new ResolvedDocument(
        document.zones().stream().map(z -> resolveZone(defaults, z)).collect(toImmutableList()),
        document.reverseNetworks().stream()
            .map(n -> resolveNetwork(defaults, n))
            .collect(toImmutableList()));
  }

  ResolvedZone resolveZone(Defaults defaults, ZoneConfig zone) {
    return ResolvedZone.newBuilder()
        .setOrigin(zone.name())
        .setSoa(resolveSoa(zone.name(), defaults, zone))
        .setMx(zone.mx().or(defaults::mx).orElse(ImmutableList.of()))
        .setMxPriority(
            zone.mxPriority().or(defaults::mxPriority).orElse(ZoneDefaults.MX_PRIORITY))
        .setSrvPriority(
            zone.srvPriority().or(defaults::srvPriority).orElse(ZoneDefaults.SRV_PRIORITY))
        .setSrvWeight(zone.srvWeight().or(defaults::srvWeight).orElse(ZoneDefaults.SRV_WEIGHT))
        .setWithPtr(zone.withPtr().or(defaults::withPtr).orElse(ZoneDefaults.WITH_PTR))
        .setHosts(zone.hosts())
        .setCnames(zone.cnames())
        .setSrv(zone.srv())
        .build();
  }

  ResolvedReverseNetwork resolveNetwork(Defaults defaults, ReverseNetwork network) {
    Name origin = network.network().reverseZoneName();
    return new ResolvedReverseNetwork(
        network.network(), origin, resolveSoa(origin, defaults, network));
  }

  private static SoaSettings resolveSoa(Name origin, Defaults defaults, SoaFields overrides) {
    Optional<Name> email = effectiveEmail(defaults, overrides);
    ImmutableList<NameserverEntry> nameservers = effectiveNameservers(defaults, overrides);
    checkState(email.isPresent(), "Zone %s has no email", origin);
    checkState(!nameservers.isEmpty(), "Zone %s has no name servers", origin);
    return new SoaSettings(
        email.get(),
        nameservers,
        overrides.ttl().or(defaults::ttl).orElse(ZoneDefaults.TTL),
        effectiveRefresh(defaults, overrides),
        effectiveRetry(defaults, overrides),
        overrides.expire().or(defaults::expire).orElse(ZoneDefaults.EXPIRE),
        overrides.nrcTtl().or(defaults::nrcTtl).orElse(ZoneDefaults.NEGATIVE_CACHE_TTL));
  }

  public static Optional<Name> effectiveEmail(Defaults defaults, SoaFields overrides) {
    return overrides.email().or(defaults::email);
  }

  public static ImmutableList<NameserverEntry> effectiveNameservers(
      Defaults defaults, SoaFields overrides) {
    return overrides.nameservers().or(defaults::nameservers).orElse(ImmutableList.of());
  }

  public static long effectiveRefresh(Defaults defaults, SoaFields overrides) {
    return overrides.refresh().or(defaults::refresh).orElse(ZoneDefaults.REFRESH);
  }

  public static long effectiveRetry(Defaults defaults, SoaFields overrides) {
    return overrides.retry().or(defaults::retry).orElse(ZoneDefaults.RETRY);
  }
}
