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

package google.zonegen;

/**
 * Base class for the checked failures of a zone generation run.
 *
 * <p>Every subclass describes a reason to abort the whole run before any output or serial state is
 * committed.
 */
public abstract class ZonegenException extends Exception {

  protected ZonegenException(String message) {
    super(message);
  }

  protected ZonegenException(String message, Throwable cause) {
    super(message, cause);
  }
}
