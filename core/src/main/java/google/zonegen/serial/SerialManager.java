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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.flogger.FluentLogger;
import google.zonegen.util.Clock;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.joda.time.LocalDate;

/** Reads the serial of the previous run and writes back the serial of this one. */
public class SerialManager {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Clock clock;

  @Inject
  public SerialManager(Clock clock) {
    this.clock = clock;
  }

  /**
   * Loads the serial stored in {@code file} and works out the serial for today.
   *
   * <p>A missing or blank file means there was no previous run.
   */
  public SerialState load(Path file) throws SerialStateException {
    Optional<SerialNumber> previous = read(file);
    LocalDate today = clock.nowUtc().toLocalDate();
    SerialNumber next;
    if (previous.isEmpty() || previous.get().date().isBefore(today)) {
      next = SerialNumber.firstOf(today);
    } else if (previous.get().date().isAfter(today)) {
      throw new SerialStateException(
          String.format(
              "Serial %s in %s is dated after today (%s); refusing to go backwards",
              previous.get(), file, today));
    } else if (previous.get().sequence() >= SerialNumber.MAX_SEQUENCE) {
      throw new SerialStateException(
          String.format(
              "Serial %s in %s is the last one available today; no more changes until tomorrow",
              previous.get(), file));
    } else {
      next = previous.get().nextOnSameDay();
    }
    logger.atInfo().log(
        "Previous serial %s, next serial %s.",
        previous.map(SerialNumber::toString).orElse("(none)"), next);
    return new SerialState(file, previous, next);
  }

  /**
   * Atomically replaces the serial file with the state's next serial.
   *
   * @throws IllegalStateException if the state was already committed
   */
  public void commit(SerialState state) throws IOException {
    checkState(
        state.status() == SerialState.Status.LOADED,
        "Serial %s was already committed to %s",
        state.next(),
        state.file());
    Path file = state.file().toAbsolutePath();
    Path directory = file.getParent();
    Files.createDirectories(directory);
    Path temp = Files.createTempFile(directory, "." + file.getFileName(), ".tmp");
    try {
      Files.writeString(temp, state.next() + "\n", UTF_8);
      try {
        Files.move(
            temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        logger.atWarning().log("Atomic move not supported in %s; replacing %s.", directory, file);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
    state.markCommitted();
    logger.atInfo().log("Committed serial %s to %s.", state.next(), file);
  }

  private static Optional<SerialNumber> read(Path file) throws SerialStateException {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    String content;
    try {
      content = Files.readString(file, UTF_8);
    } catch (IOException e) {
      throw new SerialStateException(String.format("Cannot read serial file %s", file), e);
    }
    String trimmed = CharMatcher.whitespace().trimFrom(content);
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(SerialNumber.parse(trimmed));
    } catch (IllegalArgumentException e) {
      throw new SerialStateException(
          String.format("Serial file %s is corrupt: %s", file, e.getMessage()), e);
    }
  }
}
