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

import java.io.IOException;

/**
 * <p>
 * Exception thrown to indicate that a persistent
 * {@link org.datamarket.ledger.spi.LedgerStore} could not read or write its
 * state.
 * </p>
 */
public class LedgerIOException extends LedgerException {

  public LedgerIOException(String message, IOException root) {
    super(ErrorKind.STORAGE, message, root);
  }

  public LedgerIOException(String message, Throwable root) {
    super(ErrorKind.STORAGE, message, root);
  }
}
