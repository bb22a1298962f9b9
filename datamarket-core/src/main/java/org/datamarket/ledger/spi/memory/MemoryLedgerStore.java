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
package org.datamarket.ledger.spi.memory;

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import org.datamarket.ledger.Dataset;
import org.datamarket.ledger.Identity;
import org.datamarket.ledger.RecordExistsException;
import org.datamarket.ledger.RecordNotFoundException;
import org.datamarket.ledger.TrainingJob;
import org.datamarket.ledger.spi.LedgerStore;
import org.datamarket.ledger.spi.LedgerTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * A {@link LedgerStore} that keeps its committed state in memory.
 * </p>
 * <p>
 * Each transaction buffers its writes in a {@link StagedChanges} overlay.
 * Commit applies the overlay to the committed {@link LedgerState} and then
 * calls {@link #persist(LedgerState)}; if that hook throws, the overlay is
 * undone before the exception propagates. Subclasses that keep the state
 * elsewhere as well override the hook.
 * </p>
 */
@ThreadSafe
public class MemoryLedgerStore implements LedgerStore {

  private static final Logger LOG = LoggerFactory
      .getLogger(MemoryLedgerStore.class);

  private final LedgerState committed;
  private MemoryTransaction current = null;
  private boolean closed = false;

  public MemoryLedgerStore() {
    this(new LedgerState());
  }

  protected MemoryLedgerStore(LedgerState initial) {
    Preconditions.checkNotNull(initial, "Initial state cannot be null");
    this.committed = initial;
  }

  @Override
  public synchronized LedgerTransaction begin() {
    Preconditions.checkState(!closed, "Store is closed");
    Preconditions.checkState(current == null,
        "A transaction is already open on this store");
    current = new MemoryTransaction();
    return current;
  }

  @Override
  public synchronized void close() {
    closed = true;
  }

  /**
   * Called with the committed state after a transaction's writes have been
   * applied to it. Throwing from here undoes the commit.
   *
   * @param state the new committed state; must not be retained or modified
   */
  protected void persist(LedgerState state) {
  }

  private synchronized void publish(MemoryTransaction txn) {
    StagedChanges undo = txn.changes.applyTo(committed);
    try {
      persist(committed);
    } catch (RuntimeException e) {
      LOG.warn("Commit rejected, restoring previous state", e);
      undo.applyTo(committed);
      throw e;
    }
  }

  private synchronized void release(MemoryTransaction txn) {
    if (current == txn) {
      current = null;
    }
  }

  @NotThreadSafe
  private class MemoryTransaction implements LedgerTransaction {

    private final StagedChanges changes = new StagedChanges();
    private boolean finished = false;

    private void checkOpen() {
      Preconditions.checkState(!finished, "Transaction is finished");
    }

    @Override
    public Dataset loadDataset(long id) {
      checkOpen();
      if (changes.datasets.containsKey(id)) {
        return changes.datasets.get(id);
      }
      return committed.getDataset(id);
    }

    @Override
    public void insertDataset(Dataset dataset) {
      Preconditions.checkNotNull(dataset, "Dataset cannot be null");
      if (loadDataset(dataset.getId()) != null) {
        throw new RecordExistsException(
            "Dataset already exists for id:" + dataset.getId());
      }
      changes.datasets.put(dataset.getId(), dataset);
    }

    @Override
    public void updateDataset(Dataset dataset) {
      Preconditions.checkNotNull(dataset, "Dataset cannot be null");
      if (loadDataset(dataset.getId()) == null) {
        throw RecordNotFoundException.dataset(dataset.getId());
      }
      changes.datasets.put(dataset.getId(), dataset);
    }

    @Override
    public TrainingJob loadJob(long id) {
      checkOpen();
      if (changes.jobs.containsKey(id)) {
        return changes.jobs.get(id);
      }
      return committed.getJob(id);
    }

    @Override
    public void insertJob(TrainingJob job) {
      Preconditions.checkNotNull(job, "Job cannot be null");
      if (loadJob(job.getId()) != null) {
        throw new RecordExistsException(
            "Training job already exists for id:" + job.getId());
      }
      changes.jobs.put(job.getId(), job);
    }

    @Override
    public void updateJob(TrainingJob job) {
      Preconditions.checkNotNull(job, "Job cannot be null");
      if (loadJob(job.getId()) == null) {
        throw RecordNotFoundException.job(job.getId());
      }
      changes.jobs.put(job.getId(), job);
    }

    @Override
    public long getBalance(Identity holder) {
      checkOpen();
      Preconditions.checkNotNull(holder, "Holder cannot be null");
      Long amount = changes.balances.containsKey(holder) ?
          changes.balances.get(holder) :
          committed.getBalance(holder);
      return amount == null ? 0 : amount;
    }

    @Override
    public void setBalance(Identity holder, long amount) {
      checkOpen();
      Preconditions.checkNotNull(holder, "Holder cannot be null");
      Preconditions.checkArgument(amount >= 0,
          "Balance of %s cannot be negative: %s", holder, amount);
      changes.balances.put(holder, amount);
    }

    @Override
    public long getEscrow() {
      checkOpen();
      return changes.escrow != null ? changes.escrow : committed.getEscrow();
    }

    @Override
    public void setEscrow(long amount) {
      checkOpen();
      Preconditions.checkArgument(amount >= 0,
          "Escrow cannot be negative: %s", amount);
      changes.escrow = amount;
    }

    @Override
    public long getLastDatasetId() {
      checkOpen();
      return changes.lastDatasetId != null ?
          changes.lastDatasetId : committed.getLastDatasetId();
    }

    @Override
    public long nextDatasetId() {
      long next = LongMath.checkedAdd(getLastDatasetId(), 1);
      changes.lastDatasetId = next;
      return next;
    }

    @Override
    public long getLastJobId() {
      checkOpen();
      return changes.lastJobId != null ?
          changes.lastJobId : committed.getLastJobId();
    }

    @Override
    public long nextJobId() {
      long next = LongMath.checkedAdd(getLastJobId(), 1);
      changes.lastJobId = next;
      return next;
    }

    @Override
    public void commit() {
      checkOpen();
      try {
        publish(this);
      } finally {
        finished = true;
        release(this);
      }
    }

    @Override
    public void rollback() {
      if (!finished) {
        finished = true;
        release(this);
      }
    }
  }
}
