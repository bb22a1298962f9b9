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

import com.google.common.collect.Maps;
import java.util.Map;
import org.datamarket.ledger.Dataset;
import org.datamarket.ledger.Identity;
import org.datamarket.ledger.TrainingJob;

/**
 * Writes buffered by one transaction. A {@code null} map value stands for an
 * absent record; a {@code null} counter means unchanged.
 */
class StagedChanges {

  final Map<Long, Dataset> datasets = Maps.newLinkedHashMap();
  final Map<Long, TrainingJob> jobs = Maps.newLinkedHashMap();
  final Map<Identity, Long> balances = Maps.newLinkedHashMap();
  Long lastDatasetId = null;
  Long lastJobId = null;
  Long escrow = null;

  /**
   * Apply these changes to {@code state}.
   *
   * @return the changes that restore {@code state} to what it was
   */
  StagedChanges applyTo(LedgerState state) {
    StagedChanges undo = new StagedChanges();

    for (Map.Entry<Long, Dataset> entry : datasets.entrySet()) {
      undo.datasets.put(entry.getKey(), state.getDataset(entry.getKey()));
      if (entry.getValue() == null) {
        state.removeDataset(entry.getKey());
      } else {
        state.putDataset(entry.getValue());
      }
    }

    for (Map.Entry<Long, TrainingJob> entry : jobs.entrySet()) {
      undo.jobs.put(entry.getKey(), state.getJob(entry.getKey()));
      if (entry.getValue() == null) {
        state.removeJob(entry.getKey());
      } else {
        state.putJob(entry.getValue());
      }
    }

    for (Map.Entry<Identity, Long> entry : balances.entrySet()) {
      undo.balances.put(entry.getKey(), state.getBalance(entry.getKey()));
      if (entry.getValue() == null) {
        state.removeBalance(entry.getKey());
      } else {
        state.putBalance(entry.getKey(), entry.getValue());
      }
    }

    if (lastDatasetId != null) {
      undo.lastDatasetId = state.getLastDatasetId();
      state.setLastDatasetId(lastDatasetId);
    }
    if (lastJobId != null) {
      undo.lastJobId = state.getLastJobId();
      state.setLastJobId(lastJobId);
    }
    if (escrow != null) {
      undo.escrow = state.getEscrow();
      state.setEscrow(escrow);
    }

    return undo;
  }
}
