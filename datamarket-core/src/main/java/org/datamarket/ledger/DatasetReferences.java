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
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Lists;
import com.google.common.collect.Multiset;
import com.google.common.math.LongMath;
import java.util.List;
import org.datamarket.ledger.spi.LedgerTransaction;

/**
 * Folds over a job's dataset id list. Every fold visits the entries in list
 * order and treats each entry on its own, so a repeated id counts once per
 * occurrence.
 */
final class DatasetReferences {

  private DatasetReferences() {
  }

  /**
   * @throws ValidationException if the list is missing, too long or holds a
   *         null entry
   */
  static List<Long> checkIds(List<Long> datasetIds) {
    if (datasetIds == null) {
      throw new ValidationException("Dataset ids cannot be null");
    }
    ValidationException.check(
        datasetIds.size() <= FieldLimits.MAX_JOB_DATASETS,
        "A job may reference at most %s datasets, got %s",
        FieldLimits.MAX_JOB_DATASETS, datasetIds.size());
    for (Long id : datasetIds) {
      ValidationException.check(id != null, "Dataset ids cannot be null");
    }
    return ImmutableList.copyOf(datasetIds);
  }

  /**
   * Resolve every entry to an existing, active dataset. The check is a
   * conjunction over the whole list: all entries are looked up and the
   * failure names every one that did not resolve.
   *
   * @return the datasets, one per entry and in list order
   * @throws RecordNotFoundException if any entry is missing or inactive
   */
  static List<Dataset> resolveActive(LedgerTransaction txn,
                                     List<Long> datasetIds) {
    List<Dataset> resolved = Lists.newArrayListWithCapacity(datasetIds.size());
    List<Long> unresolved = Lists.newArrayList();
    for (Long id : datasetIds) {
      Dataset dataset = txn.loadDataset(id);
      if (dataset != null && dataset.isActive()) {
        resolved.add(dataset);
      } else {
        unresolved.add(id);
      }
    }
    if (!unresolved.isEmpty()) {
      throw new RecordNotFoundException(
          "Missing or inactive datasets:" + unresolved);
    }
    return resolved;
  }

  /**
   * Resolve whatever entries still exist, skipping the rest.
   *
   * @return the datasets that resolved, in list order
   */
  static List<Dataset> resolveExisting(LedgerTransaction txn,
                                       List<Long> datasetIds) {
    List<Dataset> resolved = Lists.newArrayListWithCapacity(datasetIds.size());
    for (Long id : datasetIds) {
      Dataset dataset = txn.loadDataset(id);
      if (dataset != null) {
        resolved.add(dataset);
      }
    }
    return resolved;
  }

  /**
   * @return the sum of {@code pricePerUse} over the given datasets
   * @throws ValidationException if the sum overflows
   */
  static long totalCost(List<Dataset> datasets) {
    long total = 0;
    for (Dataset dataset : datasets) {
      try {
        total = LongMath.checkedAdd(total, dataset.getPricePerUse());
      } catch (ArithmeticException e) {
        throw new ValidationException("Total job cost overflows", e);
      }
    }
    return total;
  }

  /**
   * @return each distinct id with the number of times it occurs, in order of
   *         first occurrence
   */
  static Multiset<Long> occurrences(List<Long> datasetIds) {
    return LinkedHashMultiset.create(datasetIds);
  }
}
