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
import com.google.common.collect.Maps;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import org.datamarket.ledger.Dataset;
import org.datamarket.ledger.Identity;
import org.datamarket.ledger.TrainingJob;

/**
 * The committed contents of a {@link MemoryLedgerStore}, kept in id and
 * identity order.
 */
@NotThreadSafe
public class LedgerState {

  private final SortedMap<Long, Dataset> datasets = Maps.newTreeMap();
  private final SortedMap<Long, TrainingJob> jobs = Maps.newTreeMap();
  private final SortedMap<Identity, Long> balances = Maps.newTreeMap();
  private long lastDatasetId = 0;
  private long lastJobId = 0;
  private long escrow = 0;

  @Nullable
  public Dataset getDataset(long id) {
    return datasets.get(id);
  }

  public Collection<Dataset> getDatasets() {
    return Collections.unmodifiableCollection(datasets.values());
  }

  public void putDataset(Dataset dataset) {
    Preconditions.checkNotNull(dataset, "Dataset cannot be null");
    datasets.put(dataset.getId(), dataset);
  }

  @Nullable
  public TrainingJob getJob(long id) {
    return jobs.get(id);
  }

  public Collection<TrainingJob> getJobs() {
    return Collections.unmodifiableCollection(jobs.values());
  }

  public void putJob(TrainingJob job) {
    Preconditions.checkNotNull(job, "Job cannot be null");
    jobs.put(job.getId(), job);
  }

  @Nullable
  public Long getBalance(Identity holder) {
    return balances.get(holder);
  }

  public Map<Identity, Long> getBalances() {
    return Collections.unmodifiableMap(balances);
  }

  public void putBalance(Identity holder, long amount) {
    Preconditions.checkNotNull(holder, "Holder cannot be null");
    Preconditions.checkArgument(amount >= 0,
        "Balance of %s cannot be negative: %s", holder, amount);
    balances.put(holder, amount);
  }

  public long getLastDatasetId() {
    return lastDatasetId;
  }

  public void setLastDatasetId(long lastDatasetId) {
    this.lastDatasetId = lastDatasetId;
  }

  public long getLastJobId() {
    return lastJobId;
  }

  public void setLastJobId(long lastJobId) {
    this.lastJobId = lastJobId;
  }

  public long getEscrow() {
    return escrow;
  }

  public void setEscrow(long escrow) {
    Preconditions.checkArgument(escrow >= 0,
        "Escrow cannot be negative: %s", escrow);
    this.escrow = escrow;
  }

  void removeDataset(long id) {
    datasets.remove(id);
  }

  void removeJob(long id) {
    jobs.remove(id);
  }

  void removeBalance(Identity holder) {
    balances.remove(holder);
  }
}
