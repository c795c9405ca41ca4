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
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.flogger.FluentLogger;
import google.zonegen.model.CnameEntry;
import google.zonegen.model.HostEntry;
import google.zonegen.model.MxEntry;
import google.zonegen.model.NameserverEntry;
import google.zonegen.model.SrvEntry;
import google.zonegen.model.ZoneModel;
import google.zonegen.model.ZoneRecords;
import google.zonegen.resolve.ResolvedDocument;
import google.zonegen.resolve.ResolvedZone;
import google.zonegen.resolve.SoaSettings;
import jakarta.inject.Inject;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.NSRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.SOARecord;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.Type;

/**
 * Expands resolved zones into DNS records.
 *
 * <p>Records of a forward zone are emitted in a fixed order: SOA, NS, MX, A/AAAA, CNAME, SRV.
 * Within each type the document order is kept. A host's alias records follow each of its
 * addresses.
 */
public class RecordTransformer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ReverseZoneDeriver reverseZoneDeriver;

  @Inject
  public RecordTransformer(ReverseZoneDeriver reverseZoneDeriver) {
    this.reverseZoneDeriver = reverseZoneDeriver;
  }

  /** Builds every forward and reverse zone of {@code document}, stamped with {@code serial}. */
  public ZoneModel transform(ResolvedDocument document, long serial) throws TransformException {
    ImmutableList.Builder<ZoneRecords> forward = new ImmutableList.Builder<>();
    for (ResolvedZone zone : document.zones()) {
      forward.add(transformZone(zone, serial));
    }
    ImmutableList<ZoneRecords> reverse =
        reverseZoneDeriver.derive(document.reverseNetworks(), document.zones(), serial);
    ZoneModel model = ZoneModel.create(serial, forward.build(), reverse);
    Set<Name> origins = new HashSet<>();
    for (ZoneRecords zone : model.allZones()) {
      if (!origins.add(zone.origin())) {
        throw new TransformException(zone.origin(), "zone is generated more than once");
      }
    }
    logger.atInfo().log(
        "Generated %d forward and %d reverse zone(s) with serial %d.",
        model.forwardZones().size(), model.reverseZones().size(), serial);
    return model;
  }

  ZoneRecords transformZone(ResolvedZone zone, long serial) throws TransformException {
    Name origin = zone.origin();
    SoaSettings soa = zone.soa();
    long ttl = soa.ttl();
    ImmutableList.Builder<Record> records = new ImmutableList.Builder<>();
    records.add(soaRecord(origin, soa, serial));
    records.addAll(nsRecords(origin, soa));
    for (MxEntry mx : zone.mx()) {
      records.add(
          new MXRecord(
              origin,
              DClass.IN,
              mx.ttl().orElse(ttl),
              mx.priority().orElse(zone.mxPriority()),
              mx.target()));
    }
    checkAliasCollisions(origin, zone.hosts());
    for (HostEntry host : zone.hosts()) {
      long hostTtl = host.ttl().orElse(ttl);
      for (InetAddress address : host.addresses()) {
        records.add(addressRecord(host.name(), hostTtl, address));
        for (Name alias : host.aliases()) {
          records.add(addressRecord(alias, hostTtl, address));
        }
      }
    }
    for (CnameEntry cname : zone.cnames()) {
      records.add(
          new CNAMERecord(cname.alias(), DClass.IN, cname.ttl().orElse(ttl), cname.target()));
    }
    for (SrvEntry srv : zone.srv()) {
      records.add(
          new SRVRecord(
              srv.owner(),
              DClass.IN,
              srv.ttl().orElse(ttl),
              srv.priority().orElse(zone.srvPriority()),
              srv.weight().orElse(zone.srvWeight()),
              srv.port(),
              srv.target()));
    }
    ImmutableList<Record> built = records.build();
    checkCnameConflicts(origin, built);
    logger.atFine().log("Zone %s has %d records.", origin, built.size());
    return ZoneRecords.create(origin, ZoneRecords.Kind.FORWARD, ttl, built);
  }

  static SOARecord soaRecord(Name origin, SoaSettings soa, long serial) {
    return new SOARecord(
        origin,
        DClass.IN,
        soa.ttl(),
        soa.primaryNameserver(),
        soa.email(),
        serial,
        soa.refresh(),
        soa.retry(),
        soa.expire(),
        soa.nrcTtl());
  }

  static ImmutableList<Record> nsRecords(Name origin, SoaSettings soa) {
    ImmutableList.Builder<Record> records = new ImmutableList.Builder<>();
    for (NameserverEntry ns : soa.nameservers()) {
      records.add(new NSRecord(origin, DClass.IN, ns.ttl().orElse(soa.ttl()), ns.target()));
    }
    return records.build();
  }

  private static Record addressRecord(Name name, long ttl, InetAddress address) {
    return address instanceof Inet4Address
        ? new ARecord(name, DClass.IN, ttl, address)
        : new AAAARecord(name, DClass.IN, ttl, address);
  }

  /** An alias may not name a host, and no two hosts may claim the same alias. */
  private static void checkAliasCollisions(Name origin, ImmutableList<HostEntry> hosts)
      throws TransformException {
    Set<Name> hostNames = new HashSet<>();
    for (HostEntry host : hosts) {
      hostNames.add(host.name());
    }
    Map<Name, Name> aliasOwners = new HashMap<>();
    for (HostEntry host : hosts) {
      for (Name alias : host.aliases()) {
        if (hostNames.contains(alias)) {
          throw new TransformException(
              origin,
              String.format("alias %s of host %s collides with a host", alias, host.name()));
        }
        Name previous = aliasOwners.putIfAbsent(alias, host.name());
        if (previous != null) {
          throw new TransformException(
              origin,
              String.format(
                  "alias %s is claimed by both %s and %s", alias, previous, host.name()));
        }
      }
    }
  }

  /** A name that owns a CNAME may not own anything else, including a second CNAME. */
  private static void checkCnameConflicts(Name origin, ImmutableList<Record> records)
      throws TransformException {
    SetMultimap<Name, Integer> typesByOwner = LinkedHashMultimap.create();
    Set<Name> cnameOwners = new HashSet<>();
    for (Record record : records) {
      if (record.getType() == Type.CNAME) {
        if (!cnameOwners.add(record.getName())) {
          throw new TransformException(
              origin, String.format("%s has more than one CNAME record", record.getName()));
        }
      } else {
        typesByOwner.put(record.getName(), record.getType());
      }
    }
    for (Name owner : cnameOwners) {
      Set<Integer> others = typesByOwner.get(owner);
      if (!others.isEmpty()) {
        throw new TransformException(
            origin,
            String.format(
                "CNAME at %s conflicts with its %s record",
                owner, Type.string(others.iterator().next())));
      }
    }
  }
}
