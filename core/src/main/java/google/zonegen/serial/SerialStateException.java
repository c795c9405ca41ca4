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

package google.zonegen.serial;

import google.zonegen.ZonegenException;

/**
 * Thrown when the persisted serial cannot be used: the file is unreadable or corrupt, the clock
 * went backwards, or the day has run out of sequence numbers.
 */
public class SerialStateException extends ZonegenException {

  public SerialStateException(String message) {
    super(message);
  }

  public SerialStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
