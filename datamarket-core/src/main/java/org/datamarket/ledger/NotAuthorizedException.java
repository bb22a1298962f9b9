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
 * Exception thrown when the calling {@link Identity} is not the dataset
 * owner, job creator or assigned provider that an operation requires.
 * </p>
 */
public class NotAuthorizedException extends LedgerException {

  public NotAuthorizedException(String message) {
    super(ErrorKind.NOT_AUTHORIZED, message);
  }

  /**
   * Precondition-style check that throws a {@link NotAuthorizedException}
   * unless {@code caller} is the {@code required} identity. A {@code null}
   * required identity never matches.
   */
  public static void check(Identity caller, Identity required, String what,
                           long id) {
    if (required == null || !required.equals(caller)) {
      throw new NotAuthorizedException(
          format("%s is not the %s of record:%s", caller, what, id));
    }
  }
}
