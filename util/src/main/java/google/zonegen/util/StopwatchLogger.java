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

package google.zonegen.util;

import com.google.common.base.Ticker;
import com.google.common.flogger.FluentLogger;
import java.time.Duration;

/**
 * A helper class that times the stages of a run and logs those whose duration exceeds a threshold.
 *
 * <p>Each call to {@link #tick} closes the stage that began at the previous tick (or at
 * construction).
 */
public final class StopwatchLogger {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Duration DEFAULT_THRESHOLD = Duration.ofMillis(400);

  private final String taskName;
  private final long thresholdNanos;
  private final Ticker ticker;
  private final long startNanos;
  private long lastTickNanos;

  public StopwatchLogger(String taskName) {
    this(taskName, DEFAULT_THRESHOLD, Ticker.systemTicker());
  }

  public StopwatchLogger(String taskName, Duration threshold, Ticker ticker) {
    this.taskName = taskName;
    this.thresholdNanos = threshold.toNanos();
    this.ticker = ticker;
    this.startNanos = ticker.read();
    this.lastTickNanos = startNanos;
  }

  /** Ends the current stage and returns how long it took. */
  public Duration tick(String stage) {
    long currentNanos = ticker.read();
    Duration elapsed = Duration.ofNanos(currentNanos - lastTickNanos);
    // Only log if the elapsed time is over the threshold.
    if (elapsed.toNanos() > thresholdNanos) {
      logger.atInfo().log("%s: %s (took %d ms)", taskName, stage, elapsed.toMillis());
    }
    this.lastTickNanos = currentNanos;
    return elapsed;
  }

  /** Returns the time elapsed since this stopwatch was created. */
  public Duration totalElapsed() {
    return Duration.ofNanos(ticker.read() - startNanos);
  }
}
