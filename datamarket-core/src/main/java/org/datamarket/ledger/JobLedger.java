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

import com.google.common.base.Preconditions;
import com.google.common.collect.Multiset;
import java.util.List;
import javax.annotation.Nullable;
import org.datamarket.ledger.spi.HeightSource;
import org.datamarket.ledger.spi.LedgerTransaction;
import org.datamarket.ledger.spi.Payout;
import org.datamarket.ledger.spi.SettlementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Creates training jobs and moves them through their {@link JobStatus}
 * lifecycle, holding each job's cost in escrow while it is open.
 * </p>
 * <ul>
 *   <li>create: the creator's balance is debited by the job's cost, which
 *   moves into escrow</li>
 *   <li>accept: a provider takes the job; no funds move</li>
 *   <li>complete: the provider records a result, every referenced dataset's
 *   access count goes up once per list entry, and the
 *   {@link SettlementPolicy} decides where the escrowed cost goes</li>
 *   <li>cancel / fail: the job ends without a result and its cost is
 *   refunded to the creator</li>
 * </ul>
 */
public class JobLedger {

  private static final Logger LOG = LoggerFactory.getLogger(JobLedger.class);

  private final DatasetRegistry registry;
  private final BalanceLedger balances;
  private final HeightSource heights;
  private final SettlementPolicy settlement;

  JobLedger(DatasetRegistry registry, BalanceLedger balances,
            HeightSource heights, SettlementPolicy settlement) {
    Preconditions.checkNotNull(registry, "Dataset registry cannot be null");
    Preconditions.checkNotNull(balances, "Balance ledger cannot be null");
    Preconditions.checkNotNull(heights, "Height source cannot be null");
    Preconditions.checkNotNull(settlement, "Settlement policy cannot be null");
    this.registry = registry;
    this.balances = balances;
    this.heights = heights;
    this.settlement = settlement;
  }

  /**
   * Create a pending job and move its cost from the creator into escrow.
   *
   * @return the new job's id
   * @throws ValidationException if the name or id list is out of bounds
   * @throws RecordNotFoundException if any listed dataset is missing or
   *         inactive
   * @throws InsufficientFundsException if the creator cannot pay the cost
   */
  public long create(LedgerTransaction txn, Identity caller, String name,
                     List<Long> datasetIds) {
    Preconditions.checkNotNull(caller, "Caller cannot be null");
    FieldLimits.checkName(name);
    List<Long> ids = DatasetReferences.checkIds(datasetIds);

    List<Dataset> datasets = DatasetReferences.resolveActive(txn, ids);
    long totalCost = DatasetReferences.totalCost(datasets);
    balances.hold(txn, caller, totalCost);

    TrainingJob job = new TrainingJob.Builder()
        .id(txn.nextJobId())
        .creator(caller)
        .name(name)
        .datasetIds(ids)
        .status(JobStatus.PENDING)
        .totalCost(totalCost)
        .createdAt(heights.currentHeight())
        .build();
    txn.insertJob(job);

    LOG.debug("Created job {}", job);
    return job.getId();
  }

  /**
   * Assign a pending job to {@code caller}.
   *
   * @throws RecordNotFoundException if there is no such job
   * @throws ValidationException if the job is not pending
   */
  public void accept(LedgerTransaction txn, Identity caller, long jobId) {
    Preconditions.checkNotNull(caller, "Caller cannot be null");
    TrainingJob job = load(txn, jobId);
    JobStatus.checkTransition(jobId, job.getStatus(), JobStatus.PROCESSING);

    TrainingJob accepted = new TrainingJob.Builder(job)
        .computationProvider(caller)
        .status(JobStatus.PROCESSING)
        .build();
    txn.updateJob(accepted);

    LOG.debug("Job {} accepted by {}", jobId, caller);
  }

  /**
   * Record the result of a processing job, count the dataset uses and settle
   * the escrowed cost.
   *
   * @throws RecordNotFoundException if there is no such job
   * @throws NotAuthorizedException if {@code caller} is not the job's provider
   * @throws ValidationException if the job is not processing or the result
   *         URL is out of bounds
   */
  public void complete(LedgerTransaction txn, Identity caller, long jobId,
                       String resultUrl) {
    Preconditions.checkNotNull(caller, "Caller cannot be null");
    TrainingJob job = load(txn, jobId);
    NotAuthorizedException.check(caller, job.getComputationProvider(),
        "provider", jobId);
    JobStatus.checkTransition(jobId, job.getStatus(), JobStatus.COMPLETED);
    FieldLimits.checkUrl("resultUrl", resultUrl);

    TrainingJob completed = new TrainingJob.Builder(job)
        .status(JobStatus.COMPLETED)
        .resultUrl(resultUrl)
        .completedAt(heights.currentHeight())
        .build();
    txn.updateJob(completed);

    Multiset<Long> uses = DatasetReferences.occurrences(job.getDatasetIds());
    for (Multiset.Entry<Long> entry : uses.entrySet()) {
      Dataset dataset = txn.loadDataset(entry.getElement());
      if (dataset == null) {
        LOG.warn("Job {} references missing dataset {}, not counted",
            jobId, entry.getElement());
        continue;
      }
      registry.recordAccess(txn, dataset, entry.getCount());
    }

    settle(txn, completed);
    LOG.debug("Job {} completed by {}", jobId, caller);
  }

  /**
   * Withdraw a pending job. Only its creator may do so; the cost is refunded.
   *
   * @throws RecordNotFoundException if there is no such job
   * @throws NotAuthorizedException if {@code caller} did not create the job
   * @throws ValidationException if the job is not pending
   */
  public void cancel(LedgerTransaction txn, Identity caller, long jobId) {
    Preconditions.checkNotNull(caller, "Caller cannot be null");
    TrainingJob job = load(txn, jobId);
    NotAuthorizedException.check(caller, job.getCreator(), "creator", jobId);
    ValidationException.check(job.getStatus() == JobStatus.PENDING,
        "Training job:%s is %s, only pending jobs can be cancelled",
        jobId, job.getStatus());

    failAndRefund(txn, job);
    LOG.debug("Job {} cancelled by {}", jobId, caller);
  }

  /**
   * Give up on a processing job. Only its provider may do so; the cost is
   * refunded to the creator and no dataset use is counted.
   *
   * @throws RecordNotFoundException if there is no such job
   * @throws NotAuthorizedException if {@code caller} is not the job's provider
   * @throws ValidationException if the job is not processing
   */
  public void fail(LedgerTransaction txn, Identity caller, long jobId) {
    Preconditions.checkNotNull(caller, "Caller cannot be null");
    TrainingJob job = load(txn, jobId);
    NotAuthorizedException.check(caller, job.getComputationProvider(),
        "provider", jobId);
    ValidationException.check(job.getStatus() == JobStatus.PROCESSING,
        "Training job:%s is %s, only processing jobs can fail",
        jobId, job.getStatus());

    failAndRefund(txn, job);
    LOG.debug("Job {} failed by {}", jobId, caller);
  }

  @Nullable
  public TrainingJob get(LedgerTransaction txn, long jobId) {
    return txn.loadJob(jobId);
  }

  private TrainingJob load(LedgerTransaction txn, long jobId) {
    TrainingJob job = txn.loadJob(jobId);
    if (job == null) {
      throw RecordNotFoundException.job(jobId);
    }
    return job;
  }

  private void failAndRefund(LedgerTransaction txn, TrainingJob job) {
    JobStatus.checkTransition(job.getId(), job.getStatus(), JobStatus.FAILED);
    TrainingJob failed = new TrainingJob.Builder(job)
        .status(JobStatus.FAILED)
        .completedAt(heights.currentHeight())
        .build();
    txn.updateJob(failed);
    balances.refund(txn, job.getCreator(), job.getTotalCost());
  }

  private void settle(LedgerTransaction txn, TrainingJob completed) {
    List<Payout> payouts = settlement.payouts(completed,
        DatasetReferences.resolveExisting(txn, completed.getDatasetIds()));
    if (payouts.isEmpty()) {
      return;
    }

    long total = 0;
    for (Payout payout : payouts) {
      total += payout.getAmount();
    }
    Preconditions.checkState(total == completed.getTotalCost(),
        "Settlement %s pays %s for job %s costing %s",
        settlement, total, completed.getId(), completed.getTotalCost());

    balances.release(txn, total);
    for (Payout payout : payouts) {
      balances.credit(txn, payout.getPayee(), payout.getAmount());
    }
    LOG.debug("Settled job {}: {}", completed.getId(), payouts);
  }
}
