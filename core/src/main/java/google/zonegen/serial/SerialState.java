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

import static com.google.common.base.Preconditions.checkState;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The serial of one run, from loading to the single commit at its end.
 *
 * <p>A state starts out {@link Status#LOADED} and becomes {@link Status#COMMITTED} once its next
 * serial has been written back. It cannot be committed twice.
 */
public final class SerialState {

  /** Where a state is in its lifecycle. */
  public enum Status {
    LOADED,
    COMMITTED
  }

  private final Path file;
  private final Optional<SerialNumber> previous;
  private final SerialNumber next;
  private Status status = Status.LOADED;

  SerialState(Path file, Optional<SerialNumber> previous, SerialNumber next) {
    this.file = file;
    this.previous = previous;
    this.next = next;
  }

  public Path file() {
    return file;
  }

  /** The serial found on disk, if there was one. */
  public Optional<SerialNumber> previous() {
    return previous;
  }

  /** The serial this run stamps on its zones. */
  public SerialNumber next() {
    return next;
  }

  public Status status() {
    return status;
  }

  void markCommitted() {
    checkState(status == Status.LOADED, "Serial %s was already committed to %s", next, file);
    status = Status.COMMITTED;
  }
}
