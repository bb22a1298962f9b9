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
import com.google.common.math.LongMath;
import org.datamarket.ledger.spi.LedgerTransaction;
import org.datamarket.ledger.spi.TransferGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Per-participant internal balances and the escrow total.
 * </p>
 * <p>
 * Balances change only through deposits, withdrawals and the job lifecycle:
 * a job's cost is {@link #hold held} when it is created and later either
 * {@link #release released} to payees or refunded. Every method works inside
 * the caller's {@link LedgerTransaction}, so a failure anywhere in an
 * operation leaves no balance changed.
 * </p>
 */
public class BalanceLedger {

  private static final Logger LOG = LoggerFactory
      .getLogger(BalanceLedger.class);

  private final TransferGateway gateway;

  BalanceLedger(TransferGateway gateway) {
    Preconditions.checkNotNull(gateway, "Transfer gateway cannot be null");
    this.gateway = gateway;
  }

  public long getBalance(LedgerTransaction txn, Identity holder) {
    Preconditions.checkNotNull(holder, "Holder cannot be null");
    return txn.getBalance(holder);
  }

  /**
   * Collect {@code amount} from the caller's external holdings and credit it.
   * If the transaction then fails to commit, the collected amount must be
   * handed back with {@link #returnDeposit}.
   *
   * @throws ValidationException if the amount is not positive or the new
   *         balance would overflow
   * @throws PaymentFailedException if the gateway refuses the transfer
   */
  public void deposit(LedgerTransaction txn, Identity caller, long amount) {
    FieldLimits.checkPositive("amount", amount);
    long updated = checkedCredit(txn.getBalance(caller), amount, caller);

    if (!transfer(true, caller, amount)) {
      throw new PaymentFailedException(LedgerException.format(
          "Could not collect %s from %s", amount, caller));
    }

    txn.setBalance(caller, updated);
    LOG.debug("Deposited {} for {}", amount, caller);
  }

  /**
   * Stage the debit of a withdrawal. Nothing is paid out here; the caller
   * commits the debit and then calls {@link #payOut}.
   *
   * @throws ValidationException if the amount is not positive
   * @throws InsufficientFundsException if the balance is below the amount
   */
  public void withdraw(LedgerTransaction txn, Identity caller, long amount) {
    FieldLimits.checkPositive("amount", amount);
    debit(txn, caller, amount);
    LOG.debug("Staged withdrawal of {} for {}", amount, caller);
  }

  /**
   * Pay a committed withdrawal to the caller's external holdings.
   *
   * @throws PaymentFailedException if the gateway refuses the transfer
   */
  public void payOut(Identity caller, long amount) {
    if (!transfer(false, caller, amount)) {
      throw new PaymentFailedException(LedgerException.format(
          "Could not pay %s to %s", amount, caller));
    }
    LOG.debug("Paid out {} to {}", amount, caller);
  }

  /**
   * Give back a deposit that was collected but never committed.
   *
   * @throws PaymentFailedException if the gateway refuses the transfer
   */
  void returnDeposit(Identity caller, long amount) {
    if (!transfer(false, caller, amount)) {
      throw new PaymentFailedException(LedgerException.format(
          "Could not return deposit of %s to %s", amount, caller));
    }
    LOG.debug("Returned uncommitted deposit of {} to {}", amount, caller);
  }

  void credit(LedgerTransaction txn, Identity holder, long amount) {
    txn.setBalance(holder,
        checkedCredit(txn.getBalance(holder), amount, holder));
  }

  void debit(LedgerTransaction txn, Identity holder, long amount) {
    long balance = txn.getBalance(holder);
    if (balance < amount) {
      throw new InsufficientFundsException(holder, balance, amount);
    }
    txn.setBalance(holder, balance - amount);
  }

  /**
   * Move {@code amount} from the holder's balance into escrow.
   */
  void hold(LedgerTransaction txn, Identity holder, long amount) {
    debit(txn, holder, amount);
    txn.setEscrow(LongMath.checkedAdd(txn.getEscrow(), amount));
  }

  /**
   * Take {@code amount} out of escrow. The caller credits it somewhere in the
   * same transaction.
   */
  void release(LedgerTransaction txn, long amount) {
    long escrow = txn.getEscrow();
    Preconditions.checkState(escrow >= amount,
        "Escrow holds %s, cannot release %s", escrow, amount);
    txn.setEscrow(escrow - amount);
  }

  /**
   * Give {@code amount} held in escrow back to {@code holder}.
   */
  void refund(LedgerTransaction txn, Identity holder, long amount) {
    release(txn, amount);
    credit(txn, holder, amount);
  }

  private boolean transfer(boolean inbound, Identity who, long amount) {
    try {
      return inbound ? gateway.collect(who, amount) : gateway.pay(who, amount);
    } catch (RuntimeException e) {
      throw new PaymentFailedException(LedgerException.format(
          "Transfer gateway failed moving %s for %s", amount, who), e);
    }
  }

  private static long checkedCredit(long balance, long amount, Identity who) {
    try {
      return LongMath.checkedAdd(balance, amount);
    } catch (ArithmeticException e) {
      throw new ValidationException(LedgerException.format(
          "Crediting %s would overflow the balance of %s", amount, who), e);
    }
  }
}
