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

import com.google.common.collect.ImmutableList;
import com.typesafe.config.ConfigFactory;
import java.util.Arrays;
import org.datamarket.ledger.spi.LedgerStore;
import org.datamarket.ledger.spi.LedgerTransaction;
import org.datamarket.ledger.spi.memory.CountingHeightSource;
import org.datamarket.ledger.spi.memory.LedgerState;
import org.datamarket.ledger.spi.memory.MemoryLedgerStore;
import org.datamarket.ledger.spi.memory.MemoryTransferGateway;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class TestMarketplaceScenario {

  private static final Identity OWNER = Identity.of("D");
  private static final Identity USER = Identity.of("U");
  private static final Identity PROVIDER = Identity.of("P");
  private static final Identity STRANGER = Identity.of("X");

  private MemoryTransferGateway gateway;
  private CountingHeightSource heights;
  private Marketplace market;

  @Before
  public void setUp() {
    this.gateway = new MemoryTransferGateway();
    gateway.fund(USER, 1000);
    gateway.fund(OWNER, 1000);
    this.heights = new CountingHeightSource(1);
    this.market = new Marketplace.Builder()
        .transferGateway(gateway)
        .heightSource(heights)
        .config(new MarketConfig(ConfigFactory.empty()))
        .build();
  }

  @After
  public void tearDown() {
    market.close();
  }

  /**
   * Internal balances plus escrow must always equal the net amount moved in
   * through the gateway.
   */
  private void assertConserved(Identity... holders) {
    long internal = market.getEscrowBalance();
    for (Identity holder : holders) {
      internal += market.getUserBalance(holder);
    }
    long external = 0;
    for (Identity holder : holders) {
      external += gateway.getWallet(holder);
    }
    Assert.assertEquals("Funds must be conserved", 2000, internal + external);
  }

  @Test
  public void testTrainingRoundTrip() {
    long datasetId = market.registerDataset(OWNER, "reviews",
        "ipfs://reviews", 20, "nlp");
    Assert.assertEquals(1, datasetId);

    market.depositFunds(USER, 100);
    heights.advance();
    long jobId = market.createTrainingJob(USER, "sentiment",
        ImmutableList.of(datasetId));
    Assert.assertEquals(80, market.getUserBalance(USER));
    Assert.assertEquals(20, market.getEscrowBalance());

    heights.advance();
    market.acceptTrainingJob(PROVIDER, jobId);
    heights.advance();
    market.completeTrainingJob(PROVIDER, jobId, "ipfs://model");

    TrainingJob job = market.getTrainingJob(jobId);
    Assert.assertEquals(JobStatus.COMPLETED, job.getStatus());
    Assert.assertEquals(PROVIDER, job.getComputationProvider());
    Assert.assertEquals("ipfs://model", job.getResultUrl());
    Assert.assertEquals(2, job.getCreatedAt());
    Assert.assertEquals(Long.valueOf(4), job.getCompletedAt());
    Assert.assertEquals(1, market.getDataset(datasetId).getAccessCount());
    Assert.assertEquals("Default settlement keeps escrow",
        20, market.getEscrowBalance());

    LedgerException e = TestHelpers.assertKind("Cannot complete twice",
        ErrorKind.INVALID_PARAMETERS, new Runnable() {
          @Override
          public void run() {
            market.completeTrainingJob(PROVIDER, 1, "ipfs://again");
          }
        });
    Assert.assertTrue(e instanceof ValidationException);
    Assert.assertEquals("ipfs://model",
        market.getTrainingJob(jobId).getResultUrl());
    Assert.assertEquals(1, market.getDataset(datasetId).getAccessCount());
    assertConserved(OWNER, USER, PROVIDER);
  }

  @Test
  public void testFailedOperationsLeaveNoTrace() {
    final long datasetId = market.registerDataset(OWNER, "reviews",
        "ipfs://reviews", 20, "nlp");
    market.depositFunds(USER, 30);

    TestHelpers.assertKind("One missing dataset fails the whole job",
        ErrorKind.NOT_FOUND, new Runnable() {
          @Override
          public void run() {
            market.createTrainingJob(USER, "job",
                Arrays.asList(datasetId, 12L));
          }
        });
    TestHelpers.assertKind("Too expensive",
        ErrorKind.INSUFFICIENT_FUNDS, new Runnable() {
          @Override
          public void run() {
            market.createTrainingJob(USER, "job",
                Arrays.asList(datasetId, datasetId));
          }
        });

    Assert.assertEquals(30, market.getUserBalance(USER));
    Assert.assertEquals(0, market.getEscrowBalance());
    Assert.assertEquals("No job id was consumed", 0, market.getLastJobId());
    Assert.assertNull(market.getTrainingJob(1));

    Assert.assertEquals(1,
        market.createTrainingJob(USER, "job", Arrays.asList(datasetId)));
    assertConserved(OWNER, USER, PROVIDER);
  }

  @Test
  public void testDatasetOwnership() {
    final long datasetId = market.registerDataset(OWNER, "reviews",
        "ipfs://reviews", 20, "nlp");

    TestHelpers.assertKind("Only the owner updates",
        ErrorKind.NOT_AUTHORIZED, new Runnable() {
          @Override
          public void run() {
            market.updateDataset(STRANGER, datasetId, "mine", "ipfs://mine",
                0, true, "nlp");
          }
        });
    TestHelpers.assertKind("Unknown dataset",
        ErrorKind.NOT_FOUND, new Runnable() {
          @Override
          public void run() {
            market.updateDataset(OWNER, 5, "x", "y", 0, true, "z");
          }
        });

    market.updateDataset(OWNER, datasetId, "reviews v2", "ipfs://v2", 25,
        false, "nlp");
    Dataset updated = market.getDataset(datasetId);
    Assert.assertEquals("reviews v2", updated.getName());
    Assert.assertFalse(updated.isActive());
    Assert.assertEquals(1, market.getLastDatasetId());
    Assert.assertNull(market.getDataset(2));
  }

  @Test
  public void testCancelAndFailRefund() {
    long datasetId = market.registerDataset(OWNER, "reviews",
        "ipfs://reviews", 20, "nlp");
    market.depositFunds(USER, 100);

    long cancelled = market.createTrainingJob(USER, "a",
        ImmutableList.of(datasetId));
    long failed = market.createTrainingJob(USER, "b",
        ImmutableList.of(datasetId, datasetId));
    Assert.assertEquals(40, market.getUserBalance(USER));
    Assert.assertEquals(60, market.getEscrowBalance());

    market.cancelTrainingJob(USER, cancelled);
    market.acceptTrainingJob(PROVIDER, failed);
    market.failTrainingJob(PROVIDER, failed);

    Assert.assertEquals(JobStatus.FAILED,
        market.getTrainingJob(cancelled).getStatus());
    Assert.assertEquals(JobStatus.FAILED,
        market.getTrainingJob(failed).getStatus());
    Assert.assertEquals(100, market.getUserBalance(USER));
    Assert.assertEquals(0, market.getEscrowBalance());
    Assert.assertEquals(0, market.getDataset(datasetId).getAccessCount());
    assertConserved(OWNER, USER, PROVIDER);
  }

  @Test
  public void testWithdrawals() {
    market.depositFunds(USER, 100);
    market.withdrawFunds(USER, 40);
    Assert.assertEquals(60, market.getUserBalance(USER));
    Assert.assertEquals(940, gateway.getWallet(USER));

    TestHelpers.assertKind("Overdraw", ErrorKind.INSUFFICIENT_FUNDS,
        new Runnable() {
          @Override
          public void run() {
            market.withdrawFunds(USER, 61);
          }
        });

    gateway.setAvailable(false);
    TestHelpers.assertKind("Gateway refuses", ErrorKind.PAYMENT_FAILED,
        new Runnable() {
          @Override
          public void run() {
            market.withdrawFunds(USER, 10);
          }
        });
    Assert.assertEquals("Refused withdrawal is credited back",
        60, market.getUserBalance(USER));
    Assert.assertEquals(940, gateway.getWallet(USER));
    assertConserved(OWNER, USER, PROVIDER);
  }

  @Test
  public void testProviderSettlement() {
    Marketplace paying = new Marketplace.Builder()
        .transferGateway(gateway)
        .heightSource(heights)
        .config(new MarketConfig(ConfigFactory.parseString(
            "datamarket { settlement = provider, platform-account = fees }")))
        .build();
    Identity fees = Identity.of("fees");

    long datasetId = paying.registerDataset(OWNER, "images", "ipfs://img",
        100, "vision");
    paying.depositFunds(USER, 200);
    long jobId = paying.createTrainingJob(USER, "cnn",
        ImmutableList.of(datasetId, datasetId));
    paying.acceptTrainingJob(PROVIDER, jobId);
    paying.completeTrainingJob(PROVIDER, jobId, "ipfs://cnn");

    Assert.assertEquals(3, paying.getPlatformFee());
    Assert.assertEquals(194, paying.getUserBalance(PROVIDER));
    Assert.assertEquals(6, paying.getUserBalance(fees));
    Assert.assertEquals(0, paying.getEscrowBalance());

    paying.withdrawFunds(PROVIDER, 194);
    Assert.assertEquals(194, gateway.getWallet(PROVIDER));
    paying.close();
  }

  @Test
  public void testStorageFailureRollsBack() {
    final boolean[] failing = new boolean[] { false };
    LedgerStore store = new MemoryLedgerStore() {
      @Override
      protected void persist(LedgerState state) {
        if (failing[0]) {
          throw new LedgerIOException("disk full", new RuntimeException());
        }
      }
    };
    final Marketplace fragile = new Marketplace.Builder()
        .store(store)
        .transferGateway(gateway)
        .heightSource(heights)
        .config(new MarketConfig(ConfigFactory.empty()))
        .build();

    final long datasetId = fragile.registerDataset(OWNER, "reviews",
        "ipfs://reviews", 5, "nlp");
    failing[0] = true;
    TestHelpers.assertKind("Store refuses the commit", ErrorKind.STORAGE,
        new Runnable() {
          @Override
          public void run() {
            fragile.updateDataset(OWNER, datasetId, "changed", "ipfs://c", 9,
                true, "nlp");
          }
        });
    failing[0] = false;

    Assert.assertEquals("reviews", fragile.getDataset(datasetId).getName());
    LedgerTransaction txn = store.begin();
    try {
      Assert.assertEquals(1, txn.getLastDatasetId());
    } finally {
      txn.rollback();
    }
  }

  private Marketplace fragileMarket(final boolean[] failing) {
    LedgerStore store = new MemoryLedgerStore() {
      @Override
      protected void persist(LedgerState state) {
        if (failing[0]) {
          throw new LedgerIOException("disk full", new RuntimeException());
        }
      }
    };
    return new Marketplace.Builder()
        .store(store)
        .transferGateway(gateway)
        .heightSource(heights)
        .config(new MarketConfig(ConfigFactory.empty()))
        .build();
  }

  @Test
  public void testStorageFailureDuringWithdrawalPaysNothing() {
    final boolean[] failing = new boolean[] { false };
    final Marketplace fragile = fragileMarket(failing);
    fragile.depositFunds(USER, 100);
    Assert.assertEquals(900, gateway.getWallet(USER));

    failing[0] = true;
    TestHelpers.assertKind("Store refuses the debit", ErrorKind.STORAGE,
        new Runnable() {
          @Override
          public void run() {
            fragile.withdrawFunds(USER, 40);
          }
        });
    failing[0] = false;

    Assert.assertEquals(100, fragile.getUserBalance(USER));
    Assert.assertEquals("Nothing paid out", 900, gateway.getWallet(USER));
    Assert.assertEquals(2000, fragile.getUserBalance(USER)
        + gateway.getWallet(USER) + gateway.getWallet(OWNER));
  }

  @Test
  public void testStorageFailureDuringDepositReturnsFunds() {
    final boolean[] failing = new boolean[] { true };
    final Marketplace fragile = fragileMarket(failing);
    TestHelpers.assertKind("Store refuses the credit", ErrorKind.STORAGE,
        new Runnable() {
          @Override
          public void run() {
            fragile.depositFunds(USER, 100);
          }
        });
    failing[0] = false;

    Assert.assertEquals(0, fragile.getUserBalance(USER));
    Assert.assertEquals("Collected funds returned",
        1000, gateway.getWallet(USER));
  }

  @Test
  public void testPlatformFee() {
    Assert.assertEquals(3, market.getPlatformFee());
  }

  @Test
  public void testBuilderRequiresGateway() {
    TestHelpers.assertThrows("Gateway is required",
        IllegalStateException.class, new Runnable() {
          @Override
          public void run() {
            new Marketplace.Builder().heightSource(heights).build();
          }
        });
  }
}
