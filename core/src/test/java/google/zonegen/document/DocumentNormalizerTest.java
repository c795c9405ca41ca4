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

package google.zonegen.document;

import static com.google.common.truth.Truth.assertThat;
import static google.zonegen.testing.TestDocuments.decode;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Unit tests for {@link DocumentNormalizer}. */
class DocumentNormalizerTest {

  private static RawMapping section(RawDocument document, String key) {
    return (RawMapping) document.root().get(key).orElseThrow();
  }

  @Test
  void testNormalize_zoneSequence_isKeyedByName() throws Exception {
    RawDocument document =
        decode(
            DocumentFormat.YAML,
            """
            zone:
              - name: example.com
                ttl: 60
              - name: example.org
            """);

    RawMapping zones = section(document, "zone");
    assertThat(zones.keys()).containsExactly("example.com", "example.org").inOrder();
    RawMapping first = (RawMapping) zones.get("example.com").orElseThrow();
    assertThat(first.keys()).containsExactly("ttl");
    assertThat(first.get("ttl").orElseThrow().path()).isEqualTo("zone.example.com.ttl");
  }

  @Test
  void testNormalize_tomlArrayOfTables_matchesYamlMapping() throws Exception {
    RawDocument fromToml =
        decode(
            DocumentFormat.TOML,
            """
            [[zone]]
            name = "example.com"
            ttl = 60
            """);
    RawDocument fromYaml = decode(DocumentFormat.YAML, "zone:\n  example.com:\n    ttl: 60\n");

    RawMapping tomlZone = (RawMapping) section(fromToml, "zone").get("example.com").orElseThrow();
    RawMapping yamlZone = (RawMapping) section(fromYaml, "zone").get("example.com").orElseThrow();
    assertThat(tomlZone.keys()).isEqualTo(yamlZone.keys());
    assertThat(((RawScalar) tomlZone.get("ttl").orElseThrow()).text())
        .isEqualTo(((RawScalar) yamlZone.get("ttl").orElseThrow()).text());
  }

  @Test
  void testNormalize_cnameSequence_isKeyedByName() throws Exception {
    RawDocument document =
        decode(
            DocumentFormat.YAML,
            """
            zone:
              example.com:
                cname:
                  - name: ftp
                    target: www
            """);

    RawMapping zone = (RawMapping) section(document, "zone").get("example.com").orElseThrow();
    RawMapping cnames = (RawMapping) zone.get("cname").orElseThrow();
    assertThat(cnames.keys()).containsExactly("ftp");
    assertThat(cnames.get("ftp").orElseThrow().path()).isEqualTo("zone.example.com.cname.ftp");
  }

  @Test
  void testNormalize_reverseScalar_becomesSingleNetwork() throws Exception {
    RawDocument document = decode(DocumentFormat.YAML, "reverse: 192.168.1.0/24\n");

    RawMapping reverse = section(document, "reverse");
    assertThat(reverse.keys()).containsExactly("192.168.1.0/24");
    assertThat(((RawMapping) reverse.get("192.168.1.0/24").orElseThrow()).isEmpty()).isTrue();
  }

  @Test
  void testNormalize_reverseSequenceOfStrings() throws Exception {
    RawDocument document =
        decode(DocumentFormat.YAML, "reverse:\n  - 192.168.1.0/24\n  - fd00::/64\n");

    assertThat(section(document, "reverse").keys())
        .containsExactly("192.168.1.0/24", "fd00::/64")
        .inOrder();
  }

  @Test
  void testNormalize_reverseSequenceOfObjects_keepsOverrides() throws Exception {
    RawDocument document =
        decode(
            DocumentFormat.YAML,
            """
            reverse:
              - network: 10.0.0.0/16
                ttl: 300
            """);

    RawMapping network =
        (RawMapping) section(document, "reverse").get("10.0.0.0/16").orElseThrow();
    assertThat(network.keys()).containsExactly("ttl");
    assertThat(network.get("ttl").orElseThrow().path()).isEqualTo("reverse.10.0.0.0/16.ttl");
  }

  @Test
  void testNormalize_reverseMappingWithNullValue_becomesEmptyOverrides() throws Exception {
    RawDocument document = decode(DocumentFormat.YAML, "reverse:\n  192.168.1.0/24:\n");

    assertThat(section(document, "reverse").get("192.168.1.0/24").orElseThrow())
        .isInstanceOf(RawMapping.class);
  }

  @Test
  void testNormalize_duplicateZoneName_throws() {
    DecodeException thrown =
        assertThrows(
            DecodeException.class,
            () ->
                decode(
                    DocumentFormat.YAML,
                    "zone:\n  - name: example.com\n  - name: example.com\n"));
    assertThat(thrown.getProblem()).isEqualTo("duplicate zone 'example.com'");
    assertThat(thrown.getPosition()).isEqualTo(SourcePosition.of(3, 11));
  }

  @Test
  void testNormalize_zoneEntryWithoutName_throws() {
    DecodeException thrown =
        assertThrows(
            DecodeException.class, () -> decode(DocumentFormat.YAML, "zone:\n  - ttl: 1\n"));
    assertThat(thrown.getProblem()).isEqualTo("zone entry is missing required field 'name'");
  }

  @Test
  void testNormalize_reverseSequenceOfLists_throws() {
    DecodeException thrown =
        assertThrows(
            DecodeException.class, () -> decode(DocumentFormat.YAML, "reverse:\n  - [a]\n"));
    assertThat(thrown.getProblem())
        .startsWith("reverse network must be a CIDR string or a mapping");
  }
}
