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
 * Exception thrown when the external
 * {@link org.datamarket.ledger.spi.TransferGateway} refuses to move funds in
 * or out of the ledger.
 * </p>
 */
public class PaymentFailedException extends LedgerException {

  public PaymentFailedException(String message) {
    super(ErrorKind.PAYMENT_FAILED, message);
  }

  public PaymentFailedException(String message, Throwable cause) {
    super(ErrorKind.PAYMENT_FAILED, message, cause);
  }
}
