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

package google.zonegen.testing;

import com.google.common.collect.ImmutableList;
import com.google.common.net.InetAddresses;
import google.zonegen.model.ZoneModel;
import google.zonegen.model.ZoneRecords;
import org.xbill.DNS.AAAARecord;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.CNAMERecord;
import org.xbill.DNS.DClass;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.NSRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.PTRRecord;
import org.xbill.DNS.SOARecord;

/**
 * A small hand-built {@link ZoneModel}: {@code example.com.} with a few hosts and the reverse zone
 * {@code 1.168.192.in-addr.arpa.} for two of them.
 */
public final class TestZones {

  public static final long SERIAL = 2025102700L;

  public static final Name ORIGIN = name("example.com.");
  public static final Name REVERSE_ORIGIN = name("1.168.192.in-addr.arpa.");

  public static ZoneModel sampleModel() {
    return ZoneModel.create(
        SERIAL, ImmutableList.of(forwardZone()), ImmutableList.of(reverseZone()));
  }

  public static ZoneRecords forwardZone() {
    return ZoneRecords.create(
        ORIGIN,
        ZoneRecords.Kind.FORWARD,
        3600,
        ImmutableList.of(
            soa(ORIGIN),
            new NSRecord(ORIGIN, DClass.IN, 3600, name("ns1.example.com.")),
            new MXRecord(ORIGIN, DClass.IN, 3600, 10, name("mail.example.com.")),
            new ARecord(
                name("www.example.com."), DClass.IN, 3600, InetAddresses.forString("192.168.1.2")),
            new AAAARecord(
                name("www.example.com."), DClass.IN, 3600, InetAddresses.forString("fd00::2")),
            new ARecord(
                name("router.example.com."),
                DClass.IN,
                600,
                InetAddresses.forString("192.168.1.1")),
            new CNAMERecord(name("ftp.example.com."), DClass.IN, 3600, name("www.example.com."))));
  }

  public static ZoneRecords reverseZone() {
    return ZoneRecords.create(
        REVERSE_ORIGIN,
        ZoneRecords.Kind.REVERSE,
        3600,
        ImmutableList.of(
            soa(REVERSE_ORIGIN),
            new NSRecord(REVERSE_ORIGIN, DClass.IN, 3600, name("ns1.example.com.")),
            new PTRRecord(
                name("1.1.168.192.in-addr.arpa."), DClass.IN, 600, name("router.example.com.")),
            new PTRRecord(
                name("2.1.168.192.in-addr.arpa."), DClass.IN, 3600, name("www.example.com."))));
  }

  private static SOARecord soa(Name origin) {
    return new SOARecord(
        origin,
        DClass.IN,
        3600,
        name("ns1.example.com."),
        name("hostmaster.example.com."),
        SERIAL,
        86400,
        7200,
        3600000,
        3600);
  }

  private static Name name(String text) {
    return Name.fromConstantString(text);
  }

  private TestZones() {}
}
