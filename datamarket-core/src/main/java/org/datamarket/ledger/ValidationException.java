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
 * Exception thrown when an argument violates its length or range bounds, or
 * when an operation is attempted from a {@link JobStatus} that forbids it.
 * </p>
 */
public class ValidationException extends LedgerException {

  public ValidationException(String msg) {
    super(ErrorKind.INVALID_PARAMETERS, msg);
  }

  public ValidationException(Throwable cause) {
    super(ErrorKind.INVALID_PARAMETERS, cause);
  }

  public ValidationException(String msg, Throwable cause) {
    super(ErrorKind.INVALID_PARAMETERS, msg, cause);
  }

  /**
   * Precondition-style validation that throws a {@link ValidationException}.
   *
   * @param isValid
   *          {@code true} if valid, {@code false} if an exception should be
   *          thrown
   * @param message
   *          A String message for the exception.
   */
  public static void check(boolean isValid, String message, Object... args) {
    if (!isValid) {
      throw new ValidationException(format(message, args));
    }
  }
}
