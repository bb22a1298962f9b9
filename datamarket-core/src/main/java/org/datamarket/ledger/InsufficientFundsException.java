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
 * Exception thrown when a debit would take a participant's balance below
 * zero.
 * </p>
 */
public class InsufficientFundsException extends LedgerException {

  private final long balance;
  private final long requested;

  public InsufficientFundsException(Identity holder, long balance,
                                    long requested) {
    super(ErrorKind.INSUFFICIENT_FUNDS, format(
        "Balance of %s is %s, cannot debit %s", holder, balance, requested));
    this.balance = balance;
    this.requested = requested;
  }

  public long getBalance() {
    return balance;
  }

  public long getRequested() {
    return requested;
  }
}
