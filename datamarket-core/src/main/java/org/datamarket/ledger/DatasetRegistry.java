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
import javax.annotation.Nullable;
import org.datamarket.ledger.spi.HeightSource;
import org.datamarket.ledger.spi.LedgerTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Creates and updates {@link Dataset} listings.
 * </p>
 * <p>
 * Whoever registers a dataset owns it, and only the owner can change it.
 * Listings are never removed; an owner retires one by marking it inactive.
 * </p>
 */
public class DatasetRegistry {

  private static final Logger LOG = LoggerFactory
      .getLogger(DatasetRegistry.class);

  private final HeightSource heights;

  DatasetRegistry(HeightSource heights) {
    Preconditions.checkNotNull(heights, "Height source cannot be null");
    this.heights = heights;
  }

  /**
   * Register a new active dataset owned by {@code caller}.
   *
   * @return the new dataset's id
   * @throws ValidationException if a field is out of bounds
   */
  public long register(LedgerTransaction txn, Identity caller, String name,
                       String metadataUrl, long pricePerUse,
                       String category) {
    Preconditions.checkNotNull(caller, "Caller cannot be null");
    FieldLimits.checkName(name);
    FieldLimits.checkUrl("metadataUrl", metadataUrl);
    FieldLimits.checkCategory(category);
    FieldLimits.checkNonNegative("pricePerUse", pricePerUse);

    Dataset dataset = new Dataset.Builder()
        .id(txn.nextDatasetId())
        .owner(caller)
        .name(name)
        .metadataUrl(metadataUrl)
        .category(category)
        .pricePerUse(pricePerUse)
        .active(true)
        .createdAt(heights.currentHeight())
        .build();
    txn.insertDataset(dataset);

    LOG.debug("Registered dataset {}", dataset);
    return dataset.getId();
  }

  /**
   * Replace the mutable fields of a dataset. The id, owner, creation height
   * and access count are kept.
   *
   * @throws RecordNotFoundException if there is no such dataset
   * @throws NotAuthorizedException if {@code caller} does not own it
   * @throws ValidationException if a field is out of bounds
   */
  public void update(LedgerTransaction txn, Identity caller, long datasetId,
                     String name, String metadataUrl, long pricePerUse,
                     boolean active, String category) {
    Preconditions.checkNotNull(caller, "Caller cannot be null");
    Dataset current = load(txn, datasetId);
    NotAuthorizedException.check(caller, current.getOwner(), "owner",
        datasetId);

    Dataset updated = new Dataset.Builder(current)
        .name(name)
        .metadataUrl(metadataUrl)
        .pricePerUse(pricePerUse)
        .active(active)
        .category(category)
        .build();
    txn.updateDataset(updated);

    LOG.debug("Updated dataset {}", updated);
  }

  @Nullable
  public Dataset get(LedgerTransaction txn, long datasetId) {
    return txn.loadDataset(datasetId);
  }

  /**
   * @throws RecordNotFoundException if there is no such dataset
   */
  Dataset load(LedgerTransaction txn, long datasetId) {
    Dataset dataset = txn.loadDataset(datasetId);
    if (dataset == null) {
      throw RecordNotFoundException.dataset(datasetId);
    }
    return dataset;
  }

  /**
   * Add {@code uses} to the access count of a dataset.
   */
  void recordAccess(LedgerTransaction txn, Dataset dataset, long uses) {
    Dataset updated = new Dataset.Builder(dataset)
        .accessCount(LongMath.checkedAdd(dataset.getAccessCount(), uses))
        .build();
    txn.updateDataset(updated);
  }
}
