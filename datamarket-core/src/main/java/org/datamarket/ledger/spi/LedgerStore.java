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
package org.datamarket.ledger.spi;

import java.io.Closeable;

/**
 * <p>
 * A service provider interface for the state behind a
 * {@link org.datamarket.ledger.Marketplace}: datasets by id, training jobs by
 * id, balances by identity, the escrow total and the two id counters.
 * </p>
 * <p>
 * A store hands out one {@link LedgerTransaction} at a time. Callers are
 * expected to serialize their operations; a store rejects a second
 * {@link #begin()} while a transaction is still open rather than interleave
 * them.
 * </p>
 */
public interface LedgerStore extends Closeable {

  /**
   * Start a new transaction over the current committed state.
   *
   * @throws IllegalStateException if another transaction is still open or
   *         the store is closed
   */
  LedgerTransaction begin();

  /**
   * Release the store. Committed state stays where the implementation keeps
   * it.
   */
  @Override
  void close();
}
