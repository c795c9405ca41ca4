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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.net.InetAddresses;
import com.google.common.primitives.UnsignedBytes;
import google.zonegen.model.CidrNetwork;
import google.zonegen.model.HostEntry;
import google.zonegen.model.ZoneRecords;
import google.zonegen.resolve.ResolvedReverseNetwork;
import google.zonegen.resolve.ResolvedZone;
import jakarta.inject.Inject;
import java.net.InetAddress;
import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;
import org.xbill.DNS.DClass;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.ReverseMap;

/**
 * Builds one reverse zone per declared network from the addresses of forward hosts.
 *
 * <p>Every address of a host whose effective {@code with-ptr} is true gets a PTR record in each
 * network that contains it. Aliases and wildcard hosts never get PTR records. PTR records are
 * sorted by address.
 */
public class ReverseZoneDeriver {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Comparator<InetAddress> BY_ADDRESS =
      Comparator.comparing(InetAddress::getAddress, UnsignedBytes.lexicographicalComparator());

  /** A PTR candidate and the host that asked for it. */
  private record Pointer(InetAddress address, Name host, long ttl) {}

  @Inject
  public ReverseZoneDeriver() {}

  public ImmutableList<ZoneRecords> derive(
      ImmutableList<ResolvedReverseNetwork> networks,
      ImmutableList<ResolvedZone> forwardZones,
      long serial)
      throws TransformException {
    warnAboutOverlaps(networks);
    ImmutableList.Builder<ZoneRecords> zones = new ImmutableList.Builder<>();
    for (ResolvedReverseNetwork network : networks) {
      zones.add(deriveZone(network, forwardZones, serial));
    }
    return zones.build();
  }

  ZoneRecords deriveZone(
      ResolvedReverseNetwork network, ImmutableList<ResolvedZone> forwardZones, long serial)
      throws TransformException {
    Map<InetAddress, Pointer> pointers = new TreeMap<>(BY_ADDRESS);
    for (ResolvedZone zone : forwardZones) {
      for (HostEntry host : zone.hosts()) {
        if (host.isWildcard() || !host.withPtr().orElse(zone.withPtr())) {
          continue;
        }
        long ttl = host.ttl().orElse(zone.soa().ttl());
        for (InetAddress address : host.addresses()) {
          if (!network.network().contains(address)) {
            continue;
          }
          Pointer existing = pointers.putIfAbsent(address, new Pointer(address, host.name(), ttl));
          if (existing != null && !existing.host().equals(host.name())) {
            throw new TransformException(
                network.origin(),
                String.format(
                    "address %s has PTR records for both %s and %s",
                    InetAddresses.toAddrString(address), existing.host(), host.name()));
          }
        }
      }
    }
    ImmutableList.Builder<Record> records = new ImmutableList.Builder<>();
    records.add(RecordTransformer.soaRecord(network.origin(), network.soa(), serial));
    records.addAll(RecordTransformer.nsRecords(network.origin(), network.soa()));
    for (Pointer pointer : pointers.values()) {
      records.add(
          new PTRRecord(
              ReverseMap.fromAddress(pointer.address()), DClass.IN, pointer.ttl(), pointer.host()));
    }
    logger.atInfo().log(
        "Reverse zone %s for %s has %d PTR record(s).",
        network.origin(), network.network(), pointers.size());
    return ZoneRecords.create(
        network.origin(), ZoneRecords.Kind.REVERSE, network.soa().ttl(), records.build());
  }

  private static void warnAboutOverlaps(ImmutableList<ResolvedReverseNetwork> networks) {
    for (int i = 0; i < networks.size(); i++) {
      for (int j = i + 1; j < networks.size(); j++) {
        CidrNetwork a = networks.get(i).network();
        CidrNetwork b = networks.get(j).network();
        if (a.contains(b.address()) || b.contains(a.address())) {
          logger.atWarning().log(
              "Reverse networks %s and %s overlap; shared addresses get a PTR record in each.",
              a, b);
        }
      }
    }
  }
}
