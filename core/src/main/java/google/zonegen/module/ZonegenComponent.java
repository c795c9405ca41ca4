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

package google.zonegen.module;

import dagger.BindsInstance;
import dagger.Component;
import google.zonegen.config.ZonegenConfig.Config;
import google.zonegen.config.ZonegenConfig.ConfigModule;
import google.zonegen.pipeline.ZonegenPipeline;
import jakarta.inject.Singleton;
import java.util.Optional;

/** Dagger component of the command line tool. */
@Singleton
@Component(modules = {ConfigModule.class, UtilsModule.class})
public interface ZonegenComponent {

  ZonegenPipeline pipeline();

  @Config("defaultSerialFile")
  String defaultSerialFile();

  @Config("nsdDirectory")
  String nsdDirectory();

  /** Factory for {@link ZonegenComponent}. */
  @Component.Factory
  interface Factory {
    /**
     * Creates the component.
     *
     * @param configOverrideYaml the contents of the operator's settings file, if one was given
     */
    ZonegenComponent create(
        @BindsInstance @Config("configOverrideYaml") Optional<String> configOverrideYaml);
  }
}
