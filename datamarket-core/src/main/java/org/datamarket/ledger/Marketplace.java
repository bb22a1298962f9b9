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
import java.io.Closeable;
import java.util.List;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import org.datamarket.ledger.spi.HeightSource;
import org.datamarket.ledger.spi.LedgerStore;
import org.datamarket.ledger.spi.LedgerTransaction;
import org.datamarket.ledger.spi.SettlementPolicy;
import org.datamarket.ledger.spi.TransferGateway;
import org.datamarket.ledger.spi.memory.MemoryLedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * The public operations of the dataset marketplace.
 * </p>
 * <p>
 * Every operation takes the already-authenticated caller {@link Identity}
 * where one is needed, runs in a single {@link LedgerTransaction} and either
 * commits all of its changes or none of them. Failures are thrown as
 * {@link LedgerException} subclasses after the transaction has been rolled
 * back. Operations are serialized on this instance, so they are applied one
 * at a time in a single total order.
 * </p>
 * <p>
 * Use {@link Builder} or {@link Marketplaces#open} to create an instance.
 * </p>
 */
@ThreadSafe
public class Marketplace implements Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(Marketplace.class);

  private final LedgerStore store;
  private final int platformFeePercent;
  private final DatasetRegistry registry;
  private final BalanceLedger balances;
  private final JobLedger jobs;

  private Marketplace(LedgerStore store, TransferGateway gateway,
                      HeightSource heights, SettlementPolicy settlement,
                      int platformFeePercent) {
    this.store = store;
    this.platformFeePercent = platformFeePercent;
    this.registry = new DatasetRegistry(heights);
    this.balances = new BalanceLedger(gateway);
    this.jobs = new JobLedger(registry, balances, heights, settlement);
  }

  // Dataset Registry

  public long registerDataset(final Identity caller, final String name,
                              final String metadataUrl,
                              final long pricePerUse, final String category) {
    return write("registerDataset", new Operation<Long>() {
      @Override
      public Long apply(LedgerTransaction txn) {
        return registry.register(txn, caller, name, metadataUrl, pricePerUse,
            category);
      }
    });
  }

  public void updateDataset(final Identity caller, final long datasetId,
                            final String name, final String metadataUrl,
                            final long pricePerUse, final boolean active,
                            final String category) {
    write("updateDataset", new Operation<Void>() {
      @Override
      public Void apply(LedgerTransaction txn) {
        registry.update(txn, caller, datasetId, name, metadataUrl,
            pricePerUse, active, category);
        return null;
      }
    });
  }

  /**
   * @return the dataset, or {@code null} if there is no dataset with that id
   */
  @Nullable
  public Dataset getDataset(final long datasetId) {
    return read(new Operation<Dataset>() {
      @Override
      public Dataset apply(LedgerTransaction txn) {
        return registry.get(txn, datasetId);
      }
    });
  }

  public long getLastDatasetId() {
    return read(new Operation<Long>() {
      @Override
      public Long apply(LedgerTransaction txn) {
        return txn.getLastDatasetId();
      }
    });
  }

  // Job Ledger

  public long createTrainingJob(final Identity caller, final String name,
                                final List<Long> datasetIds) {
    return write("createTrainingJob", new Operation<Long>() {
      @Override
      public Long apply(LedgerTransaction txn) {
        return jobs.create(txn, caller, name, datasetIds);
      }
    });
  }

  public void acceptTrainingJob(final Identity caller, final long jobId) {
    write("acceptTrainingJob", new Operation<Void>() {
      @Override
      public Void apply(LedgerTransaction txn) {
        jobs.accept(txn, caller, jobId);
        return null;
      }
    });
  }

  public void completeTrainingJob(final Identity caller, final long jobId,
                                  final String resultUrl) {
    write("completeTrainingJob", new Operation<Void>() {
      @Override
      public Void apply(LedgerTransaction txn) {
        jobs.complete(txn, caller, jobId, resultUrl);
        return null;
      }
    });
  }

  public void cancelTrainingJob(final Identity caller, final long jobId) {
    write("cancelTrainingJob", new Operation<Void>() {
      @Override
      public Void apply(LedgerTransaction txn) {
        jobs.cancel(txn, caller, jobId);
        return null;
      }
    });
  }

  public void failTrainingJob(final Identity caller, final long jobId) {
    write("failTrainingJob", new Operation<Void>() {
      @Override
      public Void apply(LedgerTransaction txn) {
        jobs.fail(txn, caller, jobId);
        return null;
      }
    });
  }

  /**
   * @return the job, or {@code null} if there is no job with that id
   */
  @Nullable
  public TrainingJob getTrainingJob(final long jobId) {
    return read(new Operation<TrainingJob>() {
      @Override
      public TrainingJob apply(LedgerTransaction txn) {
        return jobs.get(txn, jobId);
      }
    });
  }

  public long getLastJobId() {
    return read(new Operation<Long>() {
      @Override
      public Long apply(LedgerTransaction txn) {
        return txn.getLastJobId();
      }
    });
  }

  // Balance Ledger

  /**
   * @return the internal balance of {@code holder}, 0 if it never held funds
   */
  public long getUserBalance(final Identity holder) {
    return read(new Operation<Long>() {
      @Override
      public Long apply(LedgerTransaction txn) {
        return balances.getBalance(txn, holder);
      }
    });
  }

  /**
   * Collect {@code amount} through the transfer gateway and credit it. If
   * the credit cannot be committed, the collected amount is paid back.
   */
  public void depositFunds(final Identity caller, final long amount) {
    write("depositFunds", new Operation<Void>() {
      @Override
      public Void apply(LedgerTransaction txn) {
        balances.deposit(txn, caller, amount);
        return null;
      }

      @Override
      void commitFailed(RuntimeException cause) {
        balances.returnDeposit(caller, amount);
      }
    });
  }

  /**
   * Debit {@code amount} and pay it out through the transfer gateway. The
   * debit is committed before the payout; if the gateway then refuses, the
   * amount is credited back and a {@link PaymentFailedException} is thrown.
   */
  public synchronized void withdrawFunds(final Identity caller,
                                         final long amount) {
    write("withdrawFunds", new Operation<Void>() {
      @Override
      public Void apply(LedgerTransaction txn) {
        balances.withdraw(txn, caller, amount);
        return null;
      }
    });

    try {
      balances.payOut(caller, amount);
    } catch (PaymentFailedException e) {
      LOG.debug("withdrawFunds payout refused, crediting {} back to {}",
          amount, caller);
      write("withdrawFunds reversal", new Operation<Void>() {
        @Override
        public Void apply(LedgerTransaction txn) {
          balances.credit(txn, caller, amount);
          return null;
        }
      });
      throw e;
    }
  }

  /**
   * @return the funds currently held for jobs, across all creators
   */
  public long getEscrowBalance() {
    return read(new Operation<Long>() {
      @Override
      public Long apply(LedgerTransaction txn) {
        return txn.getEscrow();
      }
    });
  }

  /**
   * @return the platform fee, as a whole percentage
   */
  public int getPlatformFee() {
    return platformFeePercent;
  }

  @Override
  public synchronized void close() {
    store.close();
  }

  private abstract static class Operation<T> {
    abstract T apply(LedgerTransaction txn);

    /**
     * Undo side effects outside the store after {@link #apply} succeeded
     * but the commit did not.
     */
    void commitFailed(RuntimeException cause) {
    }
  }

  private synchronized <T> T write(String name, Operation<T> operation) {
    LedgerTransaction txn = store.begin();
    boolean committed = false;
    try {
      T result = operation.apply(txn);
      try {
        txn.commit();
      } catch (RuntimeException e) {
        compensate(name, operation, e);
        throw e;
      }
      committed = true;
      LOG.debug("{} committed", name);
      return result;
    } catch (LedgerException e) {
      if (e.getKind() == ErrorKind.STORAGE) {
        LOG.error(name + " could not be stored", e);
      } else {
        LOG.debug("{} rejected: {}", name, e.getMessage());
      }
      throw e;
    } finally {
      if (!committed) {
        txn.rollback();
      }
    }
  }

  private static void compensate(String name, Operation<?> operation,
                                 RuntimeException cause) {
    try {
      operation.commitFailed(cause);
    } catch (RuntimeException e) {
      LOG.error(name + " failed to commit and could not be undone", e);
      cause.addSuppressed(e);
    }
  }

  private synchronized <T> T read(Operation<T> operation) {
    LedgerTransaction txn = store.begin();
    try {
      return operation.apply(txn);
    } finally {
      txn.rollback();
    }
  }

  /**
   * A fluent builder to aid in the construction of {@link Marketplace}
   * instances.
   */
  public static class Builder {

    private LedgerStore store = null;
    private TransferGateway gateway = null;
    private HeightSource heights = null;
    private SettlementPolicy settlement = null;
    private MarketConfig config = null;

    /**
     * The {@link LedgerStore} holding the marketplace state. Defaults to a
     * new {@link MemoryLedgerStore}.
     */
    public Builder store(LedgerStore store) {
      this.store = store;
      return this;
    }

    /**
     * The external {@link TransferGateway} used by deposits and withdrawals.
     * Required.
     */
    public Builder transferGateway(TransferGateway gateway) {
      this.gateway = gateway;
      return this;
    }

    /**
     * The {@link HeightSource} used to stamp records. Required.
     */
    public Builder heightSource(HeightSource heights) {
      this.heights = heights;
      return this;
    }

    /**
     * The settings for the platform fee and settlement. Defaults to
     * {@link MarketConfig#load()}.
     */
    public Builder config(MarketConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Overrides the {@link SettlementPolicy} chosen by the configuration.
     */
    public Builder settlementPolicy(SettlementPolicy settlement) {
      this.settlement = settlement;
      return this;
    }

    public Marketplace build() {
      Preconditions.checkState(gateway != null,
          "A transfer gateway is required");
      Preconditions.checkState(heights != null,
          "A height source is required");

      MarketConfig marketConfig = (config != null ? config : MarketConfig.load());
      LedgerStore ledgerStore = (store != null ? store : new MemoryLedgerStore());
      SettlementPolicy policy = (settlement != null ?
          settlement : SettlementPolicies.fromConfig(marketConfig));

      LOG.info("Opening marketplace: settlement={}, fee={}%",
          policy, marketConfig.getPlatformFeePercent());
      return new Marketplace(ledgerStore, gateway, heights, policy,
          marketConfig.getPlatformFeePercent());
    }
  }
}
