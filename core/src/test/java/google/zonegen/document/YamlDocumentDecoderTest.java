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
import static org.junit.jupiter.api.Assertions.assertThrows;

import google.zonegen.document.RawScalar.ScalarKind;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link YamlDocumentDecoder}. */
class YamlDocumentDecoderTest {

  private final YamlDocumentDecoder decoder = new YamlDocumentDecoder();

  private static RawNode at(RawMapping root, String... keys) {
    RawNode node = root;
    for (String key : keys) {
      node = ((RawMapping) node).get(key).orElseThrow();
    }
    return node;
  }

  @Test
  void testDecode_recordsPathsAndPositions() throws Exception {
    RawDocument document =
        decoder.decode(
            """
            defaults:
              ttl: 0
            zone:
              example.com:
                hosts:
                  www: 192.168.1.2
            """);

    RawNode ttl = at(document.root(), "defaults", "ttl");
    assertThat(ttl.path()).isEqualTo("defaults.ttl");
    assertThat(ttl.position()).isEqualTo(SourcePosition.of(2, 8));

    RawNode www = at(document.root(), "zone", "example.com", "hosts", "www");
    assertThat(www.path()).isEqualTo("zone.example.com.hosts.www");
    assertThat(www.position()).isEqualTo(SourcePosition.of(6, 12));
    assertThat(((RawScalar) www).scalarKind()).isEqualTo(ScalarKind.STRING);
    assertThat(((RawScalar) www).text()).isEqualTo("192.168.1.2");
  }

  @Test
  void testDecode_keepsKeyOrderAndKeyPositions() throws Exception {
    RawDocument document = decoder.decode("zone:\n  b.com: {}\n  a.com: {}\n");

    RawMapping zones = (RawMapping) document.root().get("zone").orElseThrow();
    assertThat(zones.keys()).containsExactly("b.com", "a.com").inOrder();
    assertThat(zones.entry("a.com").orElseThrow().keyPosition())
        .isEqualTo(SourcePosition.of(3, 3));
  }

  @Test
  void testDecode_normalizesIntegersAndBooleans() throws Exception {
    RawDocument document = decoder.decode("a: 0x10\nb: 1_000\nc: true\nd: \"3600\"\ne: ~\n");

    RawScalar a = (RawScalar) document.root().get("a").orElseThrow();
    assertThat(a.scalarKind()).isEqualTo(ScalarKind.INTEGER);
    assertThat(a.text()).isEqualTo("16");
    assertThat(((RawScalar) document.root().get("b").orElseThrow()).text()).isEqualTo("1000");
    RawScalar c = (RawScalar) document.root().get("c").orElseThrow();
    assertThat(c.scalarKind()).isEqualTo(ScalarKind.BOOLEAN);
    assertThat(c.text()).isEqualTo("true");
    RawScalar d = (RawScalar) document.root().get("d").orElseThrow();
    assertThat(d.scalarKind()).isEqualTo(ScalarKind.STRING);
    assertThat(((RawScalar) document.root().get("e").orElseThrow()).isNull()).isTrue();
  }

  @Test
  void testDecode_sequenceItemsGetIndexedPaths() throws Exception {
    RawDocument document = decoder.decode("defaults:\n  mx: [a.example., b.example.]\n");

    RawSequence mx = (RawSequence) at(document.root(), "defaults", "mx");
    assertThat(mx.items().get(1).path()).isEqualTo("defaults.mx[1]");
  }

  @Test
  void testDecode_emptyDocument_isEmptyMapping() throws Exception {
    assertThat(decoder.decode("").root().isEmpty()).isTrue();
  }

  @Test
  void testDecode_duplicateKey_throws() {
    DecodeException thrown =
        assertThrows(DecodeException.class, () -> decoder.decode("ttl: 1\nttl: 2\n"));
    assertThat(thrown).hasMessageThat().contains("duplicate key 'ttl'");
    assertThat(thrown.getPosition()).isEqualTo(SourcePosition.of(2, 1));
    assertThat(thrown).hasMessageThat().startsWith("YAML parse error: Path: 'ttl'");
  }

  @Test
  void testDecode_malformedYaml_throwsWithPosition() {
    DecodeException thrown =
        assertThrows(DecodeException.class, () -> decoder.decode("zone:\n  - a\n  b: c\n"));
    assertThat(thrown.getFormat()).isEqualTo(DocumentFormat.YAML);
    assertThat(thrown.getPosition().isKnown()).isTrue();
  }

  @Test
  void testDecode_rootNotMapping_throws() {
    DecodeException thrown = assertThrows(DecodeException.class, () -> decoder.decode("- a\n"));
    assertThat(thrown).hasMessageThat().contains("document root must be a mapping");
  }

  @Test
  void testDecode_recursiveAlias_throws() {
    DecodeException thrown =
        assertThrows(DecodeException.class, () -> decoder.decode("a: &x [*x]\n"));
    assertThat(thrown).hasMessageThat().contains("recursive alias");
  }
}
