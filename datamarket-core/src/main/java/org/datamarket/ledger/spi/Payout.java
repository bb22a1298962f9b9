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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import javax.annotation.concurrent.Immutable;
import org.datamarket.ledger.Identity;

/**
 * A credit of escrowed funds to one participant's internal balance.
 */
@Immutable
public class Payout {

  private final Identity payee;
  private final long amount;

  public static Payout of(Identity payee, long amount) {
    return new Payout(payee, amount);
  }

  public Payout(Identity payee, long amount) {
    Preconditions.checkNotNull(payee, "Payee cannot be null");
    Preconditions.checkArgument(amount >= 0,
        "Payout amount cannot be negative: %s", amount);
    this.payee = payee;
    this.amount = amount;
  }

  public Identity getPayee() {
    return payee;
  }

  public long getAmount() {
    return amount;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Payout other = (Payout) obj;
    return amount == other.amount && payee.equals(other.payee);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(payee, amount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("payee", payee)
        .add("amount", amount)
        .toString();
  }
}
