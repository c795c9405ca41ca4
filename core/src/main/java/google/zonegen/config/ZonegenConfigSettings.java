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

/** The POJO that the tool's YAML settings files are deserialized into. */
public class ZonegenConfigSettings {

  public Serial serial;
  public Output output;

  /** Settings of the persisted serial. */
  public static class Serial {
    public String defaultFile;
  }

  /** Settings of the rendered output. */
  public static class Output {
    public String unboundFileName;
    public Integer unboundColumnWidth;
    public String nsdDirectory;
    public String nsdMasterDirectory;
    public String nsdIndexFile;
    public Integer nsdColumnWidth;
    public String stagingPrefix;
  }
}
