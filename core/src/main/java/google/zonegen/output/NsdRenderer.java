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
import static com.google.common.base.Strings.repeat;

import com.google.common.collect.ImmutableMap;
import google.zonegen.config.ZonegenConfig.Config;
import google.zonegen.model.ZoneModel;
import google.zonegen.model.ZoneRecords;
import jakarta.inject.Inject;
import org.xbill.DNS.Record;
import org.xbill.DNS.SOARecord;

/**
 * Renders NSD zone files, one per zone, and the {@code zones.conf} index that points NSD at them.
 *
 * <p>Zone files use owner names relative to {@code $ORIGIN}. An owner that repeats the one on the
 * line above is left blank.
 */
public class NsdRenderer implements ZoneRenderer {

  /** Minimum width of the record type column. */
  private static final int TYPE_WIDTH = 7;

  private final int columnWidth;
  private final String masterDirectory;
  private final String indexFile;

  @Inject
  public NsdRenderer(
      @Config("nsdColumnWidth") int columnWidth,
      @Config("nsdMasterDirectory") String masterDirectory,
      @Config("nsdIndexFile") String indexFile) {
    this.columnWidth = columnWidth;
    this.masterDirectory = masterDirectory;
    this.indexFile = indexFile;
  }

  @Override
  public OutputFormat format() {
    return OutputFormat.NSD;
  }

  @Override
  public RenderedOutput render(ZoneModel model) {
    StringBuilder index = new StringBuilder();
    ImmutableMap.Builder<String, String> zoneFiles = new ImmutableMap.Builder<>();
    for (ZoneRecords zone : model.allZones()) {
      String zoneFile = zoneFilePath(zone);
      index
          .append("zone:\n")
          .append("    name: ")
          .append(zone.origin())
          .append('\n')
          .append("    zonefile: ")
          .append(zoneFile)
          .append("\n\n");
      zoneFiles.put(zoneFile, renderZone(zone));
    }
    return RenderedOutput.of(
        new ImmutableMap.Builder<String, String>()
            .put(indexFile, index.toString())
            .putAll(zoneFiles.build())
            .buildOrThrow());
  }

  /** Returns e.g. {@code master/example.com.zone}. */
  String zoneFilePath(ZoneRecords zone) {
    return masterDirectory + "/" + zone.origin() + "zone";
  }

  String renderZone(ZoneRecords zone) {
    StringBuilder out = new StringBuilder();
    out.append("$ORIGIN ").append(zone.origin()).append('\n');
    out.append("$TTL ").append(zone.defaultTtl()).append("\n\n");
    appendSoa(out, zone.soa());
    String previousOwner = "@";
    for (Record record : zone.records().subList(1, zone.records().size())) {
      String owner = RecordText.relativeOwner(record.getName(), zone.origin());
      out.append(
          line(
              owner.equals(previousOwner) ? "" : owner,
              record.getTTL(),
              zone.defaultTtl(),
              RecordText.type(record),
              RecordText.rdata(record)));
      previousOwner = owner;
    }
    return out.toString();
  }

  private void appendSoa(StringBuilder out, SOARecord soa) {
    String indent = repeat(" ", columnWidth + 11);
    out.append(padEnd("@", columnWidth - 3, ' '))
        .append(" IN SOA     ")
        .append(soa.getHost())
        .append(' ')
        .append(soa.getAdmin())
        .append(" (\n");
    appendSoaField(out, indent, soa.getSerial(), "serial number");
    appendSoaField(out, indent, soa.getRefresh(), "refresh");
    appendSoaField(out, indent, soa.getRetry(), "retry");
    appendSoaField(out, indent, soa.getExpire(), "expire");
    appendSoaField(out, indent, soa.getMinimum(), "min ttl");
    out.append(repeat(" ", columnWidth + 8)).append(")\n");
  }

  private static void appendSoaField(StringBuilder out, String indent, long value, String label) {
    out.append(indent).append(padEnd(Long.toString(value), 12, ' ')).append("; ").append(label);
    out.append('\n');
  }

  /**
   * Formats one record line. The owner and TTL share the first column; when they overflow it the
   * type column shrinks to keep the data aligned where possible.
   */
  private String line(String owner, long ttl, long zoneTtl, String type, String data) {
    String ownerAndTtl =
        ttl == zoneTtl
            ? padEnd(owner, columnWidth - 1, ' ')
            : padEnd(owner, columnWidth - Long.toString(ttl).length() - 2, ' ') + " " + ttl;
    int overflow = Math.max(0, ownerAndTtl.length() - columnWidth - 1);
    int typeWidth = Math.max(0, TYPE_WIDTH - overflow);
    return ownerAndTtl + " " + padEnd(type, typeWidth, ' ') + " " + data + "\n";
  }
}
