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
import java.util.List;
import org.datamarket.ledger.spi.Payout;
import org.datamarket.ledger.spi.SettlementPolicy;
import org.junit.Assert;
import org.junit.Test;

public class TestSettlementPolicies {

  private static final Identity CREATOR = Identity.of("creator");
  private static final Identity PROVIDER = Identity.of("provider");
  private static final Identity PLATFORM = Identity.of("platform");

  private static TrainingJob completed(long cost) {
    return new TrainingJob.Builder()
        .id(1)
        .creator(CREATOR)
        .name("job")
        .datasetIds(ImmutableList.of(1L))
        .computationProvider(PROVIDER)
        .status(JobStatus.COMPLETED)
        .resultUrl("ipfs://model")
        .totalCost(cost)
        .completedAt(2L)
        .build();
  }

  @Test
  public void testFeeRoundsDown() {
    Assert.assertEquals(0, SettlementPolicies.fee(33, 3));
    Assert.assertEquals(1, SettlementPolicies.fee(34, 3));
    Assert.assertEquals(3, SettlementPolicies.fee(100, 3));
    Assert.assertEquals(0, SettlementPolicies.fee(1000, 0));
    Assert.assertEquals(1000, SettlementPolicies.fee(1000, 100));
  }

  @Test
  public void testFeeDoesNotOverflow() {
    Assert.assertEquals(Long.MAX_VALUE,
        SettlementPolicies.fee(Long.MAX_VALUE, 100));
    Assert.assertEquals(Long.MAX_VALUE / 2,
        SettlementPolicies.fee(Long.MAX_VALUE, 50));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testFeeRejectsBadPercent() {
    SettlementPolicies.fee(10, 101);
  }

  @Test
  public void testHoldInEscrow() {
    Assert.assertTrue(SettlementPolicies.holdInEscrow()
        .payouts(completed(50), ImmutableList.<Dataset>of()).isEmpty());
  }

  @Test
  public void testPayProvider() {
    List<Payout> payouts = SettlementPolicies.payProvider(3, PLATFORM)
        .payouts(completed(200), ImmutableList.<Dataset>of());
    Assert.assertEquals(ImmutableList.of(
        Payout.of(PROVIDER, 194), Payout.of(PLATFORM, 6)), payouts);
  }

  @Test
  public void testPayProviderSkipsZeroPayouts() {
    SettlementPolicy policy = SettlementPolicies.payProvider(3, PLATFORM);
    Assert.assertEquals("Fee rounds to nothing",
        ImmutableList.of(Payout.of(PROVIDER, 10)),
        policy.payouts(completed(10), ImmutableList.<Dataset>of()));
    Assert.assertTrue("Free job pays nothing",
        policy.payouts(completed(0), ImmutableList.<Dataset>of()).isEmpty());
  }

  @Test
  public void testPayoutsAddUpToCost() {
    SettlementPolicy policy = SettlementPolicies.payProvider(7, PLATFORM);
    for (long cost = 0; cost < 500; cost += 1) {
      long total = 0;
      for (Payout payout : policy.payouts(completed(cost),
          ImmutableList.<Dataset>of())) {
        total += payout.getAmount();
      }
      Assert.assertEquals("Payouts of cost " + cost, cost, total);
    }
  }

  @Test
  public void testFromConfig() {
    Assert.assertSame(SettlementPolicies.holdInEscrow(),
        SettlementPolicies.fromConfig(new MarketConfig(ConfigFactory.empty())));

    SettlementPolicy provider = SettlementPolicies.fromConfig(new MarketConfig(
        ConfigFactory.parseString("datamarket.settlement = provider")));
    List<Payout> payouts = provider.payouts(completed(100),
        ImmutableList.<Dataset>of());
    Assert.assertEquals(ImmutableList.of(Payout.of(PROVIDER, 97),
        Payout.of(Identity.of("datamarket-platform"), 3)), payouts);
  }
}
