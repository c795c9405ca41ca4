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

package google.zonegen.config;

import static com.google.common.base.Suppliers.memoize;
import static google.zonegen.util.ResourceUtils.readResourceUtf8;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import com.google.common.annotations.VisibleForTesting;
import dagger.Module;
import dagger.Provides;
import jakarta.inject.Qualifier;
import jakarta.inject.Singleton;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.representer.Representer;

/**
 * Central configuration of the tool.
 *
 * <p>Settings are read from {@code files/default-config.yaml} next to this class. An operator may
 * supply an override file whose values replace the defaults key by key.
 */
public final class ZonegenConfig {

  private static final String YAML_CONFIG_DEFAULT =
      readResourceUtf8(ZonegenConfig.class, "files/default-config.yaml");

  /** Dagger qualifier for configuration settings. */
  @Qualifier
  @Documented
  @Retention(RUNTIME)
  public @interface Config {
    String value() default "";
  }

  /** Dagger module that provides the tool's settings. */
  @Module
  public static final class ConfigModule {

    /** Parsed settings, with the contents of the override file applied if one was given. */
    @Singleton
    @Provides
    static ZonegenConfigSettings provideSettings(
        @Config("configOverrideYaml") Optional<String> overrideYaml) {
      return overrideYaml.isPresent()
          ? loadSettings(mergeYaml(YAML_CONFIG_DEFAULT, overrideYaml.get()))
          : CONFIG_SETTINGS.get();
    }

    /** Serial file used when none is given on the command line. */
    @Provides
    @Config("defaultSerialFile")
    static String provideDefaultSerialFile(ZonegenConfigSettings config) {
      return config.serial.defaultFile;
    }

    /** File name of the Unbound output when it is not written to stdout. */
    @Provides
    @Config("unboundFileName")
    static String provideUnboundFileName(ZonegenConfigSettings config) {
      return config.output.unboundFileName;
    }

    /** Width of the owner name column in Unbound output. */
    @Provides
    @Config("unboundColumnWidth")
    static int provideUnboundColumnWidth(ZonegenConfigSettings config) {
      return config.output.unboundColumnWidth;
    }

    /** Output directory of NSD files when none is given on the command line. */
    @Provides
    @Config("nsdDirectory")
    static String provideNsdDirectory(ZonegenConfigSettings config) {
      return config.output.nsdDirectory;
    }

    /** Sub-directory of the NSD output that holds the zone files. */
    @Provides
    @Config("nsdMasterDirectory")
    static String provideNsdMasterDirectory(ZonegenConfigSettings config) {
      return config.output.nsdMasterDirectory;
    }

    @Provides
    @Config("nsdIndexFile")
    static String provideNsdIndexFile(ZonegenConfigSettings config) {
      return config.output.nsdIndexFile;
    }

    /** Width of the owner name column in NSD zone files. */
    @Provides
    @Config("nsdColumnWidth")
    static int provideNsdColumnWidth(ZonegenConfigSettings config) {
      return config.output.nsdColumnWidth;
    }

    /** Name prefix of the temporary directories output is staged in. */
    @Provides
    @Config("stagingPrefix")
    static String provideStagingPrefix(ZonegenConfigSettings config) {
      return config.output.stagingPrefix;
    }

    private ConfigModule() {}
  }

  /**
   * Memoizes loading of the default {@link ZonegenConfigSettings}.
   *
   * <p>The defaults ship inside the jar, so they never change while the tool runs.
   */
  @VisibleForTesting
  public static final Supplier<ZonegenConfigSettings> CONFIG_SETTINGS =
      memoize(() -> loadSettings(YAML_CONFIG_DEFAULT));

  @VisibleForTesting
  static ZonegenConfigSettings loadSettings(String yaml) {
    LoaderOptions options = new LoaderOptions();
    return new Yaml(new Constructor(ZonegenConfigSettings.class, options))
        .loadAs(yaml, ZonegenConfigSettings.class);
  }

  /**
   * Recursively merges two YAML documents: mappings are merged key by key, and any other value in
   * {@code override} replaces the one in {@code base}. A null or empty override changes nothing,
   * and a key left empty in {@code override} keeps its base value.
   */
  @VisibleForTesting
  static String mergeYaml(String base, String override) {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()), createRepresenter());
    Map<String, Object> merged = loadMap(yaml, base);
    mergeInto(merged, loadMap(yaml, override));
    return yaml.dump(merged);
  }

  private static Representer createRepresenter() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    return new Representer(options);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> loadMap(Yaml yaml, String text) {
    Object loaded = yaml.load(text);
    if (loaded == null) {
      return new LinkedHashMap<>();
    }
    if (!(loaded instanceof Map)) {
      throw new IllegalArgumentException("Settings YAML must be a mapping");
    }
    return new LinkedHashMap<>((Map<String, Object>) loaded);
  }

  @SuppressWarnings("unchecked")
  private static void mergeInto(Map<String, Object> base, Map<String, Object> override) {
    for (Map.Entry<String, Object> entry : override.entrySet()) {
      if (entry.getValue() == null) {
        continue;
      }
      Object existing = base.get(entry.getKey());
      if (existing instanceof Map && entry.getValue() instanceof Map) {
        Map<String, Object> nested = new LinkedHashMap<>((Map<String, Object>) existing);
        mergeInto(nested, (Map<String, Object>) entry.getValue());
        base.put(entry.getKey(), nested);
      } else {
        base.put(entry.getKey(), entry.getValue());
      }
    }
  }

  private ZonegenConfig() {}
}
