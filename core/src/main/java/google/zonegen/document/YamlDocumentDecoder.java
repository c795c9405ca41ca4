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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import google.zonegen.document.RawScalar.ScalarKind;
import java.io.StringReader;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * Decodes YAML documents using SnakeYAML's composed node graph, which keeps the start mark of
 * every node.
 */
public class YamlDocumentDecoder implements DocumentDecoder {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Exposes SnakeYAML's scalar construction so integers and booleans can be normalized. */
  private static final class ScalarConstructor extends SafeConstructor {
    ScalarConstructor(LoaderOptions options) {
      super(options);
    }

    Object construct(ScalarNode node) {
      return constructObject(node);
    }
  }

  private final LoaderOptions loaderOptions = new LoaderOptions();
  private final ScalarConstructor scalarConstructor = new ScalarConstructor(loaderOptions);

  @Override
  public RawDocument decode(String text) throws DecodeException {
    Node root;
    try {
      root = new Yaml(new SafeConstructor(loaderOptions)).compose(new StringReader(text));
    } catch (MarkedYAMLException e) {
      throw new DecodeException(
          DocumentFormat.YAML, toPosition(e.getProblemMark()), problemOf(e), e);
    } catch (YAMLException e) {
      throw new DecodeException(DocumentFormat.YAML, SourcePosition.UNKNOWN, e.getMessage(), e);
    }
    if (root == null) {
      logger.atInfo().log("YAML document is empty.");
      return new RawDocument(DocumentFormat.YAML, RawMapping.empty("", SourcePosition.of(1, 1)));
    }
    RawNode converted =
        convert(root, "", Collections.newSetFromMap(new IdentityHashMap<Node, Boolean>()));
    if (!(converted instanceof RawMapping)) {
      throw new DecodeException(
          DocumentFormat.YAML,
          "",
          converted.position(),
          String.format("document root must be a mapping, found %s", converted.describe()));
    }
    return new RawDocument(DocumentFormat.YAML, (RawMapping) converted);
  }

  private RawNode convert(Node node, String path, Set<Node> ancestors) throws DecodeException {
    SourcePosition position = toPosition(node.getStartMark());
    if (!ancestors.add(node)) {
      throw new DecodeException(DocumentFormat.YAML, path, position, "recursive alias");
    }
    try {
      if (node instanceof ScalarNode) {
        return convertScalar((ScalarNode) node, path, position);
      }
      if (node instanceof SequenceNode) {
        ImmutableList.Builder<RawNode> items = new ImmutableList.Builder<>();
        int index = 0;
        for (Node item : ((SequenceNode) node).getValue()) {
          items.add(convert(item, RawNode.indexPath(path, index++), ancestors));
        }
        return new RawSequence(path, position, items.build());
      }
      return convertMapping((MappingNode) node, path, position, ancestors);
    } finally {
      ancestors.remove(node);
    }
  }

  private RawMapping convertMapping(
      MappingNode node, String path, SourcePosition position, Set<Node> ancestors)
      throws DecodeException {
    Map<String, RawMapping.Entry> entries = new LinkedHashMap<>();
    for (NodeTuple tuple : node.getValue()) {
      Node keyNode = tuple.getKeyNode();
      SourcePosition keyPosition = toPosition(keyNode.getStartMark());
      if (!(keyNode instanceof ScalarNode)) {
        throw new DecodeException(
            DocumentFormat.YAML, path, keyPosition, "mapping keys must be scalars");
      }
      String key = ((ScalarNode) keyNode).getValue();
      if (entries.containsKey(key)) {
        throw new DecodeException(
            DocumentFormat.YAML,
            RawNode.childPath(path, key),
            keyPosition,
            String.format("duplicate key '%s'", key));
      }
      String childPath = RawNode.childPath(path, key);
      RawNode value = convert(tuple.getValueNode(), childPath, ancestors);
      entries.put(key, new RawMapping.Entry(key, keyPosition, value));
    }
    return new RawMapping(path, position, ImmutableList.copyOf(entries.values()));
  }

  private RawScalar convertScalar(ScalarNode node, String path, SourcePosition position)
      throws DecodeException {
    Tag tag = node.getTag();
    if (Tag.NULL.equals(tag)) {
      return new RawScalar(path, position, ScalarKind.NULL, node.getValue());
    }
    if (Tag.INT.equals(tag) || Tag.BOOL.equals(tag)) {
      Object value;
      try {
        value = scalarConstructor.construct(node);
      } catch (YAMLException e) {
        throw new DecodeException(
            DocumentFormat.YAML,
            path,
            position,
            String.format("invalid scalar '%s'", node.getValue()));
      }
      ScalarKind kind = Tag.INT.equals(tag) ? ScalarKind.INTEGER : ScalarKind.BOOLEAN;
      return new RawScalar(path, position, kind, String.valueOf(value));
    }
    if (Tag.FLOAT.equals(tag)) {
      return new RawScalar(path, position, ScalarKind.FLOAT, node.getValue());
    }
    if (Tag.TIMESTAMP.equals(tag)) {
      return new RawScalar(path, position, ScalarKind.DATETIME, node.getValue());
    }
    return new RawScalar(path, position, ScalarKind.STRING, node.getValue());
  }

  private static String problemOf(MarkedYAMLException e) {
    String problem = e.getProblem();
    return problem == null ? e.getMessage() : problem;
  }

  private static SourcePosition toPosition(Mark mark) {
    // SnakeYAML marks are 0-based.
    return mark == null
        ? SourcePosition.UNKNOWN
        : SourcePosition.of(mark.getLine() + 1, mark.getColumn() + 1);
  }
}
