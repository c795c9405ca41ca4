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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import org.joda.time.LocalDate;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

/**
 * A zone serial in {@code YYYYMMDDNN} form: the date of the change and a two-digit sequence
 * number for changes made on the same day.
 */
public record SerialNumber(LocalDate date, int sequence) {

  public static final int MAX_SEQUENCE = 99;

  private static final DateTimeFormatter DATE_FORMAT = DateTimeFormat.forPattern("yyyyMMdd");
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  public SerialNumber {
    checkArgument(
        sequence >= 0 && sequence <= MAX_SEQUENCE, "Sequence %s out of range (0-99)", sequence);
    checkArgument(
        date.getYear() >= 1000 && date.getYear() <= 9999, "Year of %s is not four digits", date);
  }

  /** Returns the first serial of {@code day}. */
  public static SerialNumber firstOf(LocalDate day) {
    return new SerialNumber(day, 0);
  }

  /**
   * Parses a 10-digit serial.
   *
   * @throws IllegalArgumentException if {@code text} is not ten digits or its date is invalid
   */
  public static SerialNumber parse(String text) {
    checkArgument(
        text.length() == 10 && DIGITS.matchesAllOf(text),
        "'%s' is not a 10-digit YYYYMMDDNN serial",
        text);
    LocalDate date = DATE_FORMAT.parseLocalDate(text.substring(0, 8));
    return new SerialNumber(date, Integer.parseInt(text.substring(8)));
  }

  /** Returns the next serial on the same day. */
  public SerialNumber nextOnSameDay() {
    checkState(sequence < MAX_SEQUENCE, "Serial %s is the last one of its day", this);
    return new SerialNumber(date, sequence + 1);
  }

  public long value() {
    return Long.parseLong(toString());
  }

  @Override
  public String toString() {
    return DATE_FORMAT.print(date) + String.format("%02d", sequence);
  }
}
