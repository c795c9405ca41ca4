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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import com.google.common.net.InetAddresses;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;

/** Text helpers shared by the renderers. */
final class RecordText {

  private static final Name IPV4_REVERSE = Name.fromConstantString("in-addr.arpa.");
  private static final Name IPV6_REVERSE = Name.fromConstantString("ip6.arpa.");

  /** Returns the record's data in zone file syntax, with addresses in their shortest form. */
  static String rdata(Record record) {
    if (record instanceof ARecord) {
      return InetAddresses.toAddrString(((ARecord) record).getAddress());
    }
    if (record instanceof AAAARecord) {
      return InetAddresses.toAddrString(((AAAARecord) record).getAddress());
    }
    return record.rdataToString();
  }

  static String type(Record record) {
    return Type.string(record.getType());
  }

  /** Returns {@code @} for the origin, a relative name inside the zone, or the absolute name. */
  static String relativeOwner(Name owner, Name origin) {
    if (owner.equals(origin)) {
      return "@";
    }
    return owner.subdomain(origin) ? owner.relativize(origin).toString() : owner.toString();
  }

  /** Recovers the address a full {@code in-addr.arpa.} or {@code ip6.arpa.} name points at. */
  static InetAddress addressOf(Name reverseName) {
    List<String> labels = new ArrayList<>();
    boolean ipv4 = reverseName.subdomain(IPV4_REVERSE);
    checkArgument(
        ipv4 || reverseName.subdomain(IPV6_REVERSE), "%s is not a reverse name", reverseName);
    int suffixLabels = (ipv4 ? IPV4_REVERSE : IPV6_REVERSE).labels();
    for (int i = 0; i < reverseName.labels() - suffixLabels; i++) {
      labels.add(reverseName.getLabelString(i));
    }
    List<String> forward = Lists.reverse(labels);
    if (ipv4) {
      checkArgument(forward.size() == 4, "%s is not a full IPv4 reverse name", reverseName);
      return InetAddresses.forString(Joiner.on('.').join(forward));
    }
    checkArgument(forward.size() == 32, "%s is not a full IPv6 reverse name", reverseName);
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < forward.size(); i++) {
      if (i > 0 && i % 4 == 0) {
        text.append(':');
      }
      text.append(forward.get(i));
    }
    return InetAddresses.forString(text.toString());
  }

  private RecordText() {}
}
