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

import static com.google.common.truth.Truth.assertThat;
import static google.zonegen.testing.TestDocuments.validYaml;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.net.InetAddresses;
import google.zonegen.model.ZoneModel;
import google.zonegen.model.ZoneRecords;
import google.zonegen.resolve.DefaultResolver;
import google.zonegen.resolve.ResolvedDocument;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.ARecord;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.SOARecord;
import org.xbill.DNS.SRVRecord;
import org.xbill.DNS.Type;

/** Unit tests for {@link RecordTransformer}. */
class RecordTransformerTest {

  private static final String DEFAULTS =
      """
      defaults:
        email: hostmaster@example.com
        nameserver: [ns1.example.com., ns2.example.com.]
      """;

  private static final long SERIAL = 2025102700L;

  private final RecordTransformer transformer = new RecordTransformer(new ReverseZoneDeriver());

  private static ResolvedDocument resolve(String yaml) throws Exception {
    return new DefaultResolver().resolve(validYaml(yaml));
  }

  private ZoneModel transform(String yaml) throws Exception {
    return transformer.transform(resolve(yaml), SERIAL);
  }

  private static ImmutableList<String> types(ZoneRecords zone) {
    return zone.records().stream()
        .map(r -> Type.string(r.getType()))
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  void testTransform_hostBecomesAddressRecord() throws Exception {
    ZoneModel model =
        transform(DEFAULTS + "  ttl: 3600\nzone:\n  example.com:\n    hosts: {www: 192.168.1.2}\n");

    ARecord www = (ARecord) model.forwardZones().get(0).records().get(3);
    assertThat(www.getName()).isEqualTo(Name.fromString("www.example.com."));
    assertThat(www.getTTL()).isEqualTo(3600L);
    assertThat(www.getAddress()).isEqualTo(InetAddresses.forString("192.168.1.2"));
  }

  @Test
  void testTransform_recordOrder() throws Exception {
    ZoneModel model =
        transform(
            DEFAULTS
                + """
                zone:
                  example.com:
                    srv:
                      _sip._udp: {target: sip, port: 5060}
                    cname: {ftp: www}
                    hosts:
                      www: [192.168.1.2, "fd00::2"]
                    mx: [mail, {name: mx2, prio: 20}]
                """);

    ZoneRecords zone = model.forwardZones().get(0);
    assertThat(types(zone))
        .containsExactly("SOA", "NS", "NS", "MX", "MX", "A", "AAAA", "CNAME", "SRV")
        .inOrder();
    assertThat(((MXRecord) zone.records().get(3)).getPriority()).isEqualTo(10);
    assertThat(((MXRecord) zone.records().get(4)).getPriority()).isEqualTo(20);
  }

  @Test
  void testTransform_soaCarriesSerialAndTimers() throws Exception {
    ZoneModel model = transform(DEFAULTS + "zone:\n  example.com: {refresh: 600, retry: 60}\n");

    SOARecord soa = model.forwardZones().get(0).soa();
    assertThat(soa.getSerial()).isEqualTo(SERIAL);
    assertThat(soa.getHost()).isEqualTo(Name.fromString("ns1.example.com."));
    assertThat(soa.getAdmin()).isEqualTo(Name.fromString("hostmaster.example.com."));
    assertThat(soa.getRefresh()).isEqualTo(600L);
    assertThat(soa.getRetry()).isEqualTo(60L);
    assertThat(model.serial()).isEqualTo(SERIAL);
  }

  @Test
  void testTransform_aliasesFollowEachAddress() throws Exception {
    ZoneModel model =
        transform(
            DEFAULTS
                + """
                zone:
                  example.com:
                    hosts:
                      router: {ip: [10.0.0.1, 10.0.0.2], alias: gw, ttl: 600}
                """);

    ImmutableList<Record> records = model.forwardZones().get(0).records();
    assertThat(records.subList(3, 7).stream().map(r -> r.getName().toString()))
        .containsExactly(
            "router.example.com.", "gw.example.com.", "router.example.com.", "gw.example.com.")
        .inOrder();
    assertThat(records.get(4).getTTL()).isEqualTo(600L);
  }

  @Test
  void testTransform_srvUsesZonePriorityAndWeight() throws Exception {
    ZoneModel model =
        transform(
            DEFAULTS
                + """
                  srv-prio: 5
                zone:
                  example.com:
                    srv-weight: 7
                    srv:
                      _mqtt._tcp: {target: broker, port: 1883}
                """);

    SRVRecord srv = (SRVRecord) model.forwardZones().get(0).records().get(3);
    assertThat(srv.getName()).isEqualTo(Name.fromString("_mqtt._tcp.example.com."));
    assertThat(srv.getPriority()).isEqualTo(5);
    assertThat(srv.getWeight()).isEqualTo(7);
    assertThat(srv.getPort()).isEqualTo(1883);
    assertThat(srv.getTarget()).isEqualTo(Name.fromString("broker.example.com."));
  }

  @Test
  void testTransform_cnameClashesWithHost() throws Exception {
    ResolvedDocument document =
        resolve(
            DEFAULTS
                + """
                zone:
                  example.com:
                    hosts: {www: 192.168.1.2}
                    cname: {www: web.example.org.}
                """);

    TransformException thrown =
        assertThrows(TransformException.class, () -> transformer.transform(document, SERIAL));
    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo("Zone example.com.: CNAME at www.example.com. conflicts with its A record");
    assertThat(thrown.getZone()).isEqualTo(Name.fromString("example.com."));
  }

  @Test
  void testTransform_cnameClashesWithAlias() throws Exception {
    ResolvedDocument document =
        resolve(
            DEFAULTS
                + """
                zone:
                  example.com:
                    hosts: {www: {ip: 192.168.1.2, alias: ftp}}
                    cname: {ftp.example.com.: www}
                """);

    TransformException thrown =
        assertThrows(TransformException.class, () -> transformer.transform(document, SERIAL));
    assertThat(thrown).hasMessageThat().contains("CNAME at ftp.example.com. conflicts");
  }

  @Test
  void testTransform_aliasCollidesWithHost() throws Exception {
    ResolvedDocument document =
        resolve(
            DEFAULTS
                + """
                zone:
                  example.com:
                    hosts:
                      www: 192.168.1.2
                      router: {ip: 192.168.1.254, alias: www}
                """);

    TransformException thrown =
        assertThrows(TransformException.class, () -> transformer.transform(document, SERIAL));
    assertThat(thrown)
        .hasMessageThat()
        .contains("alias www.example.com. of host router.example.com. collides with a host");
  }

  @Test
  void testTransform_aliasClaimedByTwoHosts() throws Exception {
    ResolvedDocument document =
        resolve(
            DEFAULTS
                + """
                zone:
                  example.com:
                    hosts:
                      a: {ip: 10.0.0.1, alias: gw}
                      b: {ip: 10.0.0.2, alias: gw}
                """);

    TransformException thrown =
        assertThrows(TransformException.class, () -> transformer.transform(document, SERIAL));
    assertThat(thrown)
        .hasMessageThat()
        .contains("alias gw.example.com. is claimed by both a.example.com. and b.example.com.");
  }

  @Test
  void testTransform_sameZoneTwice() throws Exception {
    ResolvedDocument document =
        resolve(DEFAULTS + "zone:\n  example.com: {}\n  example.com.: {}\n");

    TransformException thrown =
        assertThrows(TransformException.class, () -> transformer.transform(document, SERIAL));
    assertThat(thrown).hasMessageThat().contains("zone is generated more than once");
  }

  @Test
  void testTransform_everyZoneSharesTheSerial() throws Exception {
    ZoneModel model =
        transform(
            DEFAULTS
                + """
                zone:
                  example.com: {}
                  example.org: {}
                reverse: 192.168.1.0/24
                """);

    assertThat(model.allZones()).hasSize(3);
    assertThat(model.allZones().stream().map(ZoneRecords::serial))
        .containsExactly(SERIAL, SERIAL, SERIAL);
  }
}
