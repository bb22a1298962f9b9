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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.List;
import org.datamarket.ledger.spi.Payout;
import org.datamarket.ledger.spi.SettlementPolicy;

/**
 * <p>
 * The {@link SettlementPolicy} implementations selected by the
 * {@code datamarket.settlement} setting.
 * </p>
 * <p>
 * Fees are {@code floor(amount * percent / 100)}; whatever the fee leaves
 * goes to the payee, so the payouts of a job always add up to its cost.
 * </p>
 */
public final class SettlementPolicies {

  private SettlementPolicies() {
  }

  /**
   * Leave completed jobs' funds in escrow.
   */
  public static SettlementPolicy holdInEscrow() {
    return HoldInEscrow.INSTANCE;
  }

  /**
   * Pay the job's cost to its provider, less the platform fee.
   */
  public static SettlementPolicy payProvider(int feePercent,
                                             Identity platformAccount) {
    return new PayProvider(feePercent, platformAccount);
  }

  public static SettlementPolicy fromConfig(MarketConfig config) {
    switch (config.getSettlement()) {
      case ESCROW:
        return holdInEscrow();
      case PROVIDER:
        return payProvider(config.getPlatformFeePercent(),
            config.getPlatformAccount());
      default:
        throw new IllegalStateException(
            "Unknown settlement: " + config.getSettlement());
    }
  }

  /**
   * @return {@code floor(amount * percent / 100)}, computed without overflow
   */
  static long fee(long amount, int percent) {
    Preconditions.checkArgument(amount >= 0, "Amount cannot be negative");
    checkPercent(percent);
    return (amount / 100) * percent + ((amount % 100) * percent) / 100;
  }

  private static void checkPercent(int percent) {
    Preconditions.checkArgument(percent >= 0 && percent <= 100,
        "Fee percent must be between 0 and 100: %s", percent);
  }

  private static class HoldInEscrow implements SettlementPolicy {
    private static final HoldInEscrow INSTANCE = new HoldInEscrow();

    @Override
    public List<Payout> payouts(TrainingJob completed,
                                List<Dataset> referenced) {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return "escrow";
    }
  }

  private static class PayProvider implements SettlementPolicy {
    private final int feePercent;
    private final Identity platformAccount;

    private PayProvider(int feePercent, Identity platformAccount) {
      checkPercent(feePercent);
      Preconditions.checkNotNull(platformAccount,
          "Platform account cannot be null");
      this.feePercent = feePercent;
      this.platformAccount = platformAccount;
    }

    @Override
    public List<Payout> payouts(TrainingJob completed,
                                List<Dataset> referenced) {
      long cost = completed.getTotalCost();
      long platformFee = fee(cost, feePercent);
      List<Payout> payouts = Lists.newArrayList();
      if (cost - platformFee > 0) {
        payouts.add(Payout.of(completed.getComputationProvider(),
            cost - platformFee));
      }
      if (platformFee > 0) {
        payouts.add(Payout.of(platformAccount, platformFee));
      }
      return payouts;
    }

    @Override
    public String toString() {
      return "provider(" + feePercent + "%)";
    }
  }
}
