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

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import org.datamarket.ledger.Dataset;
import org.datamarket.ledger.Identity;
import org.datamarket.ledger.TrainingJob;

/**
 * <p>
 * A unit of work against a {@link LedgerStore}.
 * </p>
 * <p>
 * Reads see the committed state plus this transaction's own writes. Writes
 * are invisible to everyone else until {@link #commit()}; {@link #rollback()}
 * discards them. After either call the transaction is finished and every
 * other method throws {@link IllegalStateException}.
 * </p>
 */
@NotThreadSafe
public interface LedgerTransaction {

  /**
   * Load the dataset stored under {@code id}.
   *
   * @return the dataset, or {@code null} if there is none
   */
  @Nullable
  Dataset loadDataset(long id);

  /**
   * Store a new dataset.
   *
   * @throws org.datamarket.ledger.RecordExistsException if a dataset with the
   *         same id is already stored
   */
  void insertDataset(Dataset dataset);

  /**
   * Replace a stored dataset with {@code dataset}, matched by id.
   *
   * @throws org.datamarket.ledger.RecordNotFoundException if there is no
   *         dataset with that id
   */
  void updateDataset(Dataset dataset);

  /**
   * Load the training job stored under {@code id}.
   *
   * @return the job, or {@code null} if there is none
   */
  @Nullable
  TrainingJob loadJob(long id);

  /**
   * Store a new training job.
   *
   * @throws org.datamarket.ledger.RecordExistsException if a job with the same
   *         id is already stored
   */
  void insertJob(TrainingJob job);

  /**
   * Replace a stored training job with {@code job}, matched by id.
   *
   * @throws org.datamarket.ledger.RecordNotFoundException if there is no job
   *         with that id
   */
  void updateJob(TrainingJob job);

  /**
   * @return the balance of {@code holder}, or 0 if none was ever stored
   */
  long getBalance(Identity holder);

  void setBalance(Identity holder, long amount);

  /**
   * @return the total amount held in escrow for open jobs
   */
  long getEscrow();

  void setEscrow(long amount);

  /**
   * @return the highest dataset id handed out, 0 if none
   */
  long getLastDatasetId();

  /**
   * Advance the dataset counter and return the new value. The increment is
   * part of this transaction.
   */
  long nextDatasetId();

  /**
   * @return the highest job id handed out, 0 if none
   */
  long getLastJobId();

  /**
   * Advance the job counter and return the new value. The increment is part
   * of this transaction.
   */
  long nextJobId();

  /**
   * Publish every write made in this transaction.
   *
   * @throws org.datamarket.ledger.LedgerIOException if a persistent store
   *         cannot record the new state; nothing is published in that case
   */
  void commit();

  /**
   * Discard every write made in this transaction. Calling this on a finished
   * transaction has no effect.
   */
  void rollback();
}
