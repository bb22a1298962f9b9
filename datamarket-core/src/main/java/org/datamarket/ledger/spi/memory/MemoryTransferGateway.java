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
import com.google.common.math.LongMath;
import java.util.Map;
import javax.annotation.concurrent.ThreadSafe;
import org.datamarket.ledger.Identity;
import org.datamarket.ledger.spi.TransferGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * A {@link TransferGateway} over external wallets held in memory.
 * </p>
 * <p>
 * Collecting more than a wallet holds is refused. While the gateway is
 * {@link #setAvailable(boolean) unavailable} every transfer is refused.
 * </p>
 */
@ThreadSafe
public class MemoryTransferGateway implements TransferGateway {

  private static final Logger LOG = LoggerFactory
      .getLogger(MemoryTransferGateway.class);

  private final Map<Identity, Long> wallets = Maps.newHashMap();
  private boolean available = true;

  public synchronized void fund(Identity holder, long amount) {
    Preconditions.checkNotNull(holder, "Holder cannot be null");
    Preconditions.checkArgument(amount >= 0,
        "Cannot fund a negative amount: %s", amount);
    wallets.put(holder, LongMath.checkedAdd(getWallet(holder), amount));
  }

  public synchronized long getWallet(Identity holder) {
    Long amount = wallets.get(holder);
    return amount == null ? 0 : amount;
  }

  public synchronized void setAvailable(boolean available) {
    this.available = available;
  }

  @Override
  public synchronized boolean collect(Identity from, long amount) {
    long held = getWallet(from);
    if (!available || held < amount) {
      LOG.debug("Refusing to collect {} from {} (holds {})",
          new Object[] { amount, from, held });
      return false;
    }
    wallets.put(from, held - amount);
    return true;
  }

  @Override
  public synchronized boolean pay(Identity to, long amount) {
    if (!available) {
      LOG.debug("Refusing to pay {} to {}", amount, to);
      return false;
    }
    wallets.put(to, LongMath.checkedAdd(getWallet(to), amount));
    return true;
  }
}
