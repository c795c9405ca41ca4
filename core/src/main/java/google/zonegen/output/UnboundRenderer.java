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

package google.zonegen.output;

import static com.google.common.base.Strings.padEnd;

import com.google.common.collect.ImmutableMap;
import com.google.common.net.InetAddresses;
import google.zonegen.config.ZonegenConfig.Config;
import google.zonegen.model.ZoneModel;
import google.zonegen.model.ZoneRecords;
import jakarta.inject.Inject;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.Record;

/**
 * Renders every zone into a single Unbound {@code server:} clause of static local zones.
 *
 * <p>Forward zones use {@code local-data} lines. Reverse zones list their SOA and NS records the
 * same way and their PTR records as {@code local-data-ptr} lines keyed by address. A record's TTL
 * is left out when it equals the zone's TTL, except on the SOA.
 */
public class UnboundRenderer implements ZoneRenderer {

  private final int columnWidth;
  private final String fileName;

  @Inject
  public UnboundRenderer(
      @Config("unboundColumnWidth") int columnWidth,
      @Config("unboundFileName") String fileName) {
    this.columnWidth = columnWidth;
    this.fileName = fileName;
  }

  @Override
  public OutputFormat format() {
    return OutputFormat.UNBOUND;
  }

  @Override
  public RenderedOutput render(ZoneModel model) {
    StringBuilder out = new StringBuilder("server:\n");
    for (ZoneRecords zone : model.allZones()) {
      out.append("local-zone: ").append(zone.origin()).append(" static\n");
      for (Record record : zone.records()) {
        String ttl = ttlText(record, zone);
        if (record instanceof PTRRecord) {
          PTRRecord ptr = (PTRRecord) record;
          String address = InetAddresses.toAddrString(RecordText.addressOf(ptr.getName()));
          out.append(
              String.format(
                  "local-data-ptr: \"%s %s %s\"\n",
                  padEnd(address, columnWidth - ttl.length(), ' '), ttl, ptr.getTarget()));
        } else {
          out.append(
              String.format(
                  "local-data: \"%s %s IN %s %s\"\n",
                  padEnd(record.getName().toString(), columnWidth - ttl.length(), ' '),
                  ttl,
                  padEnd(RecordText.type(record), 4, ' '),
                  RecordText.rdata(record)));
        }
      }
      out.append('\n');
    }
    return RenderedOutput.of(ImmutableMap.of(fileName, out.toString()));
  }

  private static String ttlText(Record record, ZoneRecords zone) {
    boolean isSoa = record == zone.soa();
    return !isSoa && record.getTTL() == zone.defaultTtl() ? "" : Long.toString(record.getTTL());
  }
}
