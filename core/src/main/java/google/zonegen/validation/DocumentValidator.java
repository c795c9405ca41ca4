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

package google.zonegen.validation;

import static google.zonegen.validation.FieldReader.oneOrMany;
import static google.zonegen.validation.FieldReader.optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import google.zonegen.document.RawDocument;
import google.zonegen.document.RawMapping;
import google.zonegen.document.RawNode;
import google.zonegen.document.RawScalar;
import google.zonegen.model.CidrNetwork;
import google.zonegen.model.CnameEntry;
import google.zonegen.model.Defaults;
import google.zonegen.model.HostEntry;
import google.zonegen.model.HostSpec;
import google.zonegen.model.MxEntry;
import google.zonegen.model.NameserverEntry;
import google.zonegen.model.ReverseNetwork;
import google.zonegen.model.SoaFields;
import google.zonegen.model.SrvEntry;
import google.zonegen.model.ZoneConfig;
import google.zonegen.model.ZoneDocument;
import google.zonegen.resolve.DefaultResolver;
import jakarta.inject.Inject;
import java.net.InetAddress;
import java.util.Optional;
import javax.annotation.Nullable;
import org.xbill.DNS.Name;

/**
 * Turns a normalized document into a {@link ZoneDocument}, checking every field.
 *
 * <p>Validation does not stop at the first problem: each zone and network is checked in full and
 * all errors are reported together. A field with the wrong shape is reported once and not looked
 * into further.
 */
public class DocumentValidator {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String DEFAULTS = "defaults";
  static final String ZONE = "zone";
  static final String REVERSE = "reverse";

  private static final ImmutableSet<String> ROOT_FIELDS = ImmutableSet.of(DEFAULTS, ZONE, REVERSE);
  private static final ImmutableSet<String> SOA_FIELDS =
      ImmutableSet.of("email", "nameserver", "ttl", "refresh", "retry", "expire", "nrc-ttl");
  private static final ImmutableSet<String> DEFAULTS_FIELDS =
      ImmutableSet.<String>builder()
          .addAll(SOA_FIELDS)
          .add("mx", "mx-prio", "srv-prio", "srv-weight", "with-ptr")
          .build();
  private static final ImmutableSet<String> ZONE_FIELDS =
      ImmutableSet.<String>builder().addAll(DEFAULTS_FIELDS).add("hosts", "cname", "srv").build();
  private static final ImmutableSet<String> HOST_FIELDS =
      ImmutableSet.of("ip", "alias", "ttl", "with-ptr");
  private static final ImmutableSet<String> NAMESERVER_FIELDS = ImmutableSet.of("name", "ttl");
  private static final ImmutableSet<String> MX_FIELDS = ImmutableSet.of("name", "prio", "ttl");
  private static final ImmutableSet<String> CNAME_FIELDS = ImmutableSet.of("target", "ttl");
  private static final ImmutableSet<String> SRV_FIELDS =
      ImmutableSet.of("target", "port", "prio", "weight", "ttl");

  /** The SOA-related fields of one section, before they are copied into a builder. */
  private record SoaValues(
      Optional<Name> email,
      Optional<ImmutableList<NameserverEntry>> nameservers,
      Optional<Long> ttl,
      Optional<Long> refresh,
      Optional<Long> retry,
      Optional<Long> expire,
      Optional<Long> nrcTtl,
      boolean emailDeclared,
      boolean nameserversDeclared) {}

  @Inject
  public DocumentValidator() {}

  public ZoneDocument validate(RawDocument document) throws ValidationException {
    FieldReader reader = new FieldReader();
    RawMapping root = document.root();
    reader.rejectUnknownFields(root, ROOT_FIELDS);

    Optional<RawMapping> defaultsNode =
        optional(root, DEFAULTS).flatMap(n -> reader.mapping(n, DEFAULTS));
    Defaults defaults = defaultsNode.map(m -> readDefaults(reader, m)).orElse(Defaults.empty());

    ImmutableList.Builder<ZoneConfig> zones = new ImmutableList.Builder<>();
    Optional<RawMapping> zonesNode = optional(root, ZONE).flatMap(n -> reader.mapping(n, ZONE));
    for (RawMapping.Entry entry : zonesNode.map(RawMapping::entries).orElse(ImmutableList.of())) {
      readZone(reader, defaults, defaultsNode, entry).ifPresent(zones::add);
    }

    ImmutableList.Builder<ReverseNetwork> networks = new ImmutableList.Builder<>();
    Optional<RawMapping> reverseNode =
        optional(root, REVERSE).flatMap(n -> reader.mapping(n, REVERSE));
    for (RawMapping.Entry entry : reverseNode.map(RawMapping::entries).orElse(ImmutableList.of())) {
      readNetwork(reader, defaults, defaultsNode, entry).ifPresent(networks::add);
    }

    if (reader.hasErrors()) {
      ImmutableList<ValidationError> errors = reader.errors();
      logger.atInfo().log("Document rejected with %d validation error(s).", errors.size());
      throw new ValidationException(document.format(), errors);
    }
    ZoneDocument result = new ZoneDocument(defaults, zones.build(), networks.build());
    logger.atInfo().log(
        "Validated %d zone(s) and %d reverse network(s).",
        result.zones().size(), result.reverseNetworks().size());
    return result;
  }

  private Defaults readDefaults(FieldReader reader, RawMapping node) {
    reader.rejectUnknownFields(node, DEFAULTS_FIELDS);
    SoaValues soa = readSoa(reader, node, null);
    return Defaults.newBuilder()
        .setEmail(soa.email())
        .setNameservers(soa.nameservers())
        .setTtl(soa.ttl())
        .setRefresh(soa.refresh())
        .setRetry(soa.retry())
        .setExpire(soa.expire())
        .setNrcTtl(soa.nrcTtl())
        .setMx(optional(node, "mx").map(n -> readMx(reader, n, null)))
        .setMxPriority(optional(node, "mx-prio").flatMap(n -> reader.uint16(n, "MX priority")))
        .setSrvPriority(optional(node, "srv-prio").flatMap(n -> reader.uint16(n, "SRV priority")))
        .setSrvWeight(optional(node, "srv-weight").flatMap(n -> reader.uint16(n, "SRV weight")))
        .setWithPtr(optional(node, "with-ptr").flatMap(n -> reader.bool(n, "with-ptr")))
        .build();
  }

  private Optional<ZoneConfig> readZone(
      FieldReader reader,
      Defaults defaults,
      Optional<RawMapping> defaultsNode,
      RawMapping.Entry entry) {
    String zoneText = entry.key().endsWith(".") ? entry.key() : entry.key() + ".";
    Optional<Name> zoneName =
        reader.nameFromText(entry.value().path(), entry.keyPosition(), zoneText, null);
    Optional<RawMapping> body = reader.mapping(entry.value(), "zone");
    if (zoneName.isEmpty() || body.isEmpty()) {
      return Optional.empty();
    }
    RawMapping node = body.get();
    String origin = zoneName.get().toString();
    reader.rejectUnknownFields(node, ZONE_FIELDS);
    SoaValues soa = readSoa(reader, node, origin);
    ZoneConfig zone =
        ZoneConfig.newBuilder(zoneName.get())
            .setEmail(soa.email())
            .setNameservers(soa.nameservers())
            .setTtl(soa.ttl())
            .setRefresh(soa.refresh())
            .setRetry(soa.retry())
            .setExpire(soa.expire())
            .setNrcTtl(soa.nrcTtl())
            .setMx(optional(node, "mx").map(n -> readMx(reader, n, origin)))
            .setMxPriority(
                optional(node, "mx-prio").flatMap(n -> reader.uint16(n, "MX priority")))
            .setSrvPriority(
                optional(node, "srv-prio").flatMap(n -> reader.uint16(n, "SRV priority")))
            .setSrvWeight(
                optional(node, "srv-weight").flatMap(n -> reader.uint16(n, "SRV weight")))
            .setWithPtr(optional(node, "with-ptr").flatMap(n -> reader.bool(n, "with-ptr")))
            .setHosts(readHosts(reader, optional(node, "hosts"), origin))
            .setCnames(readCnames(reader, optional(node, "cname"), origin))
            .setSrv(readSrv(reader, optional(node, "srv"), origin))
            .build();
    checkSoaConsistency(reader, node, soa, defaults, defaultsNode, zone);
    return Optional.of(zone);
  }

  private Optional<ReverseNetwork> readNetwork(
      FieldReader reader,
      Defaults defaults,
      Optional<RawMapping> defaultsNode,
      RawMapping.Entry entry) {
    Optional<CidrNetwork> network = Optional.empty();
    try {
      network = Optional.of(CidrNetwork.parse(entry.key()));
    } catch (IllegalArgumentException e) {
      reader.errorAt(entry.value().path(), entry.keyPosition(), e.getMessage());
    }
    Optional<RawMapping> body = reader.mapping(entry.value(), "reverse network");
    if (network.isEmpty() || body.isEmpty()) {
      return Optional.empty();
    }
    RawMapping node = body.get();
    reader.rejectUnknownFields(node, SOA_FIELDS);
    SoaValues soa = readSoa(reader, node, null);
    ReverseNetwork result =
        ReverseNetwork.newBuilder(network.get())
            .setEmail(soa.email())
            .setNameservers(soa.nameservers())
            .setTtl(soa.ttl())
            .setRefresh(soa.refresh())
            .setRetry(soa.retry())
            .setExpire(soa.expire())
            .setNrcTtl(soa.nrcTtl())
            .build();
    checkSoaConsistency(reader, node, soa, defaults, defaultsNode, result);
    return Optional.of(result);
  }

  private SoaValues readSoa(FieldReader reader, RawMapping node, @Nullable String origin) {
    Optional<RawNode> email = optional(node, "email");
    Optional<RawNode> nameservers = optional(node, "nameserver");
    return new SoaValues(
        email.flatMap(n -> readEmail(reader, n)),
        nameservers.map(n -> readNameservers(reader, n, origin)),
        optional(node, "ttl").flatMap(n -> reader.timeValue(n, "TTL")),
        optional(node, "refresh").flatMap(n -> reader.timeValue(n, "refresh")),
        optional(node, "retry").flatMap(n -> reader.timeValue(n, "retry")),
        optional(node, "expire").flatMap(n -> reader.timeValue(n, "expire")),
        optional(node, "nrc-ttl").flatMap(n -> reader.timeValue(n, "nrc-ttl")),
        email.isPresent(),
        nameservers.isPresent());
  }

  /**
   * Checks the rules that span a section and the defaults: a contact email and a name server
   * must be set somewhere, and retry must be shorter than refresh.
   */
  private void checkSoaConsistency(
      FieldReader reader,
      RawMapping node,
      SoaValues own,
      Defaults defaults,
      Optional<RawMapping> defaultsNode,
      SoaFields effective) {
    boolean defaultsEmail = defaultsNode.flatMap(d -> optional(d, "email")).isPresent();
    boolean defaultsNameservers = defaultsNode.flatMap(d -> optional(d, "nameserver")).isPresent();
    if (!own.emailDeclared() && !defaultsEmail) {
      reader.error(node, "Email is required (set 'email' here or in defaults)");
    }
    if (!own.nameserversDeclared() && !defaultsNameservers) {
      reader.error(
          node, "at least one nameserver is required (set 'nameserver' here or in defaults)");
    }
    long refresh = DefaultResolver.effectiveRefresh(defaults, effective);
    long retry = DefaultResolver.effectiveRetry(defaults, effective);
    if (retry >= refresh) {
      RawNode at = optional(node, "retry").or(() -> optional(node, "refresh")).orElse(node);
      reader.error(at, "retry (%d) must be less than refresh (%d)", retry, refresh);
    }
  }

  private Optional<Name> readEmail(FieldReader reader, RawNode node) {
    Optional<String> email = reader.string(node, "email").map(String::trim);
    if (email.isEmpty()) {
      return Optional.empty();
    }
    Optional<String> problem = EmailAddresses.check(email.get());
    if (problem.isPresent()) {
      reader.error(node, problem.get());
      return Optional.empty();
    }
    return Optional.of(EmailAddresses.toMailbox(email.get()));
  }

  private ImmutableList<NameserverEntry> readNameservers(
      FieldReader reader, RawNode node, @Nullable String origin) {
    ImmutableList<RawNode> items = oneOrMany(node);
    if (items.isEmpty()) {
      reader.error(node, "nameserver list cannot be empty");
    }
    ImmutableList.Builder<NameserverEntry> entries = new ImmutableList.Builder<>();
    for (RawNode item : items) {
      if (item instanceof RawMapping) {
        RawMapping mapping = (RawMapping) item;
        reader.rejectUnknownFields(mapping, NAMESERVER_FIELDS);
        Optional<Name> name =
            reader.required(mapping, "name").flatMap(n -> reader.name(n, origin, "nameserver"));
        Optional<Long> ttl = optional(mapping, "ttl").flatMap(n -> reader.timeValue(n, "TTL"));
        name.ifPresent(n -> entries.add(new NameserverEntry(n, ttl)));
      } else {
        reader.name(item, origin, "nameserver").map(NameserverEntry::of).ifPresent(entries::add);
      }
    }
    return entries.build();
  }

  private ImmutableList<MxEntry> readMx(FieldReader reader, RawNode node, @Nullable String origin) {
    ImmutableList.Builder<MxEntry> entries = new ImmutableList.Builder<>();
    for (RawNode item : oneOrMany(node)) {
      if (item instanceof RawMapping) {
        RawMapping mapping = (RawMapping) item;
        reader.rejectUnknownFields(mapping, MX_FIELDS);
        Optional<Name> name =
            reader.required(mapping, "name").flatMap(n -> reader.name(n, origin, "MX host"));
        Optional<Integer> priority =
            optional(mapping, "prio").flatMap(n -> reader.uint16(n, "MX priority"));
        Optional<Long> ttl = optional(mapping, "ttl").flatMap(n -> reader.timeValue(n, "TTL"));
        name.ifPresent(n -> entries.add(new MxEntry(n, priority, ttl)));
      } else {
        reader
            .name(item, origin, "MX host")
            .ifPresent(n -> entries.add(new MxEntry(n, Optional.empty(), Optional.empty())));
      }
    }
    return entries.build();
  }

  private ImmutableList<HostEntry> readHosts(
      FieldReader reader, Optional<RawNode> node, String origin) {
    Optional<RawMapping> hosts = node.flatMap(n -> reader.mapping(n, "hosts"));
    ImmutableList.Builder<HostEntry> entries = new ImmutableList.Builder<>();
    for (RawMapping.Entry entry : hosts.map(RawMapping::entries).orElse(ImmutableList.of())) {
      Optional<Name> name =
          reader.nameFromText(entry.value().path(), entry.keyPosition(), entry.key(), origin);
      Optional<HostSpec> spec = readHostSpec(reader, entry.value(), origin);
      if (name.isPresent() && spec.isPresent()) {
        entries.add(HostEntry.of(name.get(), spec.get()));
      }
    }
    return entries.build();
  }

  private Optional<HostSpec> readHostSpec(FieldReader reader, RawNode node, String origin) {
    if (node instanceof RawScalar) {
      if (((RawScalar) node).isNull()) {
        reader.error(node, "host must have at least one IP address");
        return Optional.empty();
      }
      return reader.address(node).map(HostSpec::address);
    }
    if (!(node instanceof RawMapping)) {
      return reader.addresses(node).map(HostSpec::addressList);
    }
    RawMapping mapping = (RawMapping) node;
    reader.rejectUnknownFields(mapping, HOST_FIELDS);
    Optional<ImmutableList<InetAddress>> addresses =
        reader.required(mapping, "ip").flatMap(reader::addresses);
    ImmutableList.Builder<Name> aliases = new ImmutableList.Builder<>();
    optional(mapping, "alias")
        .ifPresent(
            aliasNode -> {
              for (RawNode alias : oneOrMany(aliasNode)) {
                reader.name(alias, origin, "alias").ifPresent(aliases::add);
              }
            });
    Optional<Long> ttl = optional(mapping, "ttl").flatMap(n -> reader.timeValue(n, "TTL"));
    Optional<Boolean> withPtr =
        optional(mapping, "with-ptr").flatMap(n -> reader.bool(n, "with-ptr"));
    return addresses.map(
        a -> HostSpec.detailed(new HostSpec.Detailed(a, aliases.build(), ttl, withPtr)));
  }

  private ImmutableList<CnameEntry> readCnames(
      FieldReader reader, Optional<RawNode> node, String origin) {
    Optional<RawMapping> cnames = node.flatMap(n -> reader.mapping(n, "cname"));
    ImmutableList.Builder<CnameEntry> entries = new ImmutableList.Builder<>();
    for (RawMapping.Entry entry : cnames.map(RawMapping::entries).orElse(ImmutableList.of())) {
      Optional<Name> alias =
          reader.nameFromText(entry.value().path(), entry.keyPosition(), entry.key(), origin);
      Optional<Name> target;
      Optional<Long> ttl = Optional.empty();
      if (entry.value() instanceof RawMapping) {
        RawMapping mapping = (RawMapping) entry.value();
        reader.rejectUnknownFields(mapping, CNAME_FIELDS);
        target =
            reader.required(mapping, "target").flatMap(n -> reader.name(n, origin, "CNAME target"));
        ttl = optional(mapping, "ttl").flatMap(n -> reader.timeValue(n, "TTL"));
      } else {
        target = reader.name(entry.value(), origin, "CNAME target");
      }
      if (alias.isPresent() && target.isPresent()) {
        entries.add(new CnameEntry(alias.get(), target.get(), ttl));
      }
    }
    return entries.build();
  }

  private ImmutableList<SrvEntry> readSrv(
      FieldReader reader, Optional<RawNode> node, String origin) {
    Optional<RawMapping> services = node.flatMap(n -> reader.mapping(n, "srv"));
    ImmutableList.Builder<SrvEntry> entries = new ImmutableList.Builder<>();
    for (RawMapping.Entry entry : services.map(RawMapping::entries).orElse(ImmutableList.of())) {
      String path = entry.value().path();
      ImmutableList<String> keyProblems = SrvKeys.check(entry.key());
      keyProblems.forEach(problem -> reader.errorAt(path, entry.keyPosition(), problem));
      Optional<Name> owner =
          keyProblems.isEmpty()
              ? reader.nameFromText(path, entry.keyPosition(), entry.key(), origin)
              : Optional.empty();
      Optional<RawMapping> body = reader.mapping(entry.value(), "SRV record");
      if (body.isEmpty()) {
        continue;
      }
      RawMapping mapping = body.get();
      reader.rejectUnknownFields(mapping, SRV_FIELDS);
      Optional<Name> target =
          reader.required(mapping, "target").flatMap(n -> reader.name(n, origin, "SRV target"));
      Optional<Integer> port =
          reader.required(mapping, "port").flatMap(n -> reader.uint16(n, "port"));
      Optional<Integer> priority =
          optional(mapping, "prio").flatMap(n -> reader.uint16(n, "SRV priority"));
      Optional<Integer> weight =
          optional(mapping, "weight").flatMap(n -> reader.uint16(n, "SRV weight"));
      Optional<Long> ttl = optional(mapping, "ttl").flatMap(n -> reader.timeValue(n, "TTL"));
      if (owner.isPresent() && target.isPresent() && port.isPresent()) {
        entries.add(
            new SrvEntry(
                entry.key(), owner.get(), target.get(), port.get(), priority, weight, ttl));
      }
    }
    return entries.build();
  }
}
