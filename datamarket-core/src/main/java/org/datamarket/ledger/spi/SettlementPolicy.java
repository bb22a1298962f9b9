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

import java.util.List;
import org.datamarket.ledger.Dataset;
import org.datamarket.ledger.TrainingJob;

/**
 * <p>
 * Decides where the escrowed cost of a job goes when the job completes.
 * </p>
 * <p>
 * A policy either returns no payouts, in which case the funds stay in
 * escrow, or payouts whose amounts add up to exactly the job's
 * {@code totalCost}.
 * </p>
 */
public interface SettlementPolicy {

  /**
   * @param completed the job, already in the {@code COMPLETED} status
   * @param referenced the datasets the job lists, one element per list entry
   *                   and in the same order; entries that no longer resolve
   *                   are left out
   * @return the credits to make, possibly empty
   */
  List<Payout> payouts(TrainingJob completed, List<Dataset> referenced);
}
