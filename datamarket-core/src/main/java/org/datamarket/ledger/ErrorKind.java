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
 * The tag carried by every {@link LedgerException}, so callers can switch on
 * the failure without matching exception classes.
 */
public enum ErrorKind {
  /** The caller is not the owner, creator or assignee the operation requires. */
  NOT_AUTHORIZED,
  /** A referenced dataset or training job does not exist. */
  NOT_FOUND,
  /** An argument is out of bounds, or the record's status forbids the operation. */
  INVALID_PARAMETERS,
  /** A balance is too low for the requested debit. */
  INSUFFICIENT_FUNDS,
  /** The external transfer gateway refused a deposit or withdrawal. */
  PAYMENT_FAILED,
  /** A record was inserted under an id that is already taken. */
  ALREADY_EXISTS,
  /** The backing store could not read or write its state. */
  STORAGE
}
