/*
 * Copyright 2013 Cloudera Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.datamarket.ledger;

/**
 * <p>
 * The lifecycle of a {@link TrainingJob}.
 * </p>
 * <pre>
 *   PENDING --accept--&gt; PROCESSING --complete--&gt; COMPLETED
 *      |                    |
 *      +--cancel--&gt; FAILED &lt;--fail--+
 * </pre>
 * <p>
 * Transitions only move forward; {@link #COMPLETED} and {@link #FAILED} are
 * terminal.
 * </p>
 */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean canTransitionTo(JobStatus next) {
    switch (this) {
      case PENDING:
        return next == PROCESSING || next == FAILED;
      case PROCESSING:
        return next == COMPLETED || next == FAILED;
      case COMPLETED:
      case FAILED:
        return false;
      default:
        throw new IllegalStateException("Unknown status: " + this);
    }
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Throws a {@link ValidationException} unless a job in {@code current}
   * status may move to {@code next}.
   */
  static void checkTransition(long jobId, JobStatus current, JobStatus next) {
    ValidationException.check(!current.isTerminal(),
        "Training job:%s is already %s", jobId, current);
    ValidationException.check(current.canTransitionTo(next),
        "Training job:%s is %s and cannot become %s", jobId, current, next);
  }
}
