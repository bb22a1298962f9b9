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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import javax.annotation.concurrent.Immutable;

/**
 * <p>
 * A dataset listing in the {@link DatasetRegistry}.
 * </p>
 * <p>
 * Listings are immutable. The registry replaces a listing with a modified
 * copy, made with {@link Builder#Builder(Dataset)}, whenever the owner
 * updates it or a completed job uses it. The {@code id}, {@code owner} and
 * {@code createdAt} of a listing never change.
 * </p>
 */
@Immutable
public class Dataset {

  private final long id;
  private final Identity owner;
  private final String name;
  private final String metadataUrl;
  private final String category;
  private final long pricePerUse;
  private final long accessCount;
  private final boolean active;
  private final long createdAt;

  private Dataset(Builder builder) {
    this.id = builder.id;
    this.owner = builder.owner;
    this.name = builder.name;
    this.metadataUrl = builder.metadataUrl;
    this.category = builder.category;
    this.pricePerUse = builder.pricePerUse;
    this.accessCount = builder.accessCount;
    this.active = builder.active;
    this.createdAt = builder.createdAt;
  }

  public long getId() {
    return id;
  }

  public Identity getOwner() {
    return owner;
  }

  public String getName() {
    return name;
  }

  public String getMetadataUrl() {
    return metadataUrl;
  }

  public String getCategory() {
    return category;
  }

  /**
   * @return the amount charged to a job for each time it lists this dataset
   */
  public long getPricePerUse() {
    return pricePerUse;
  }

  /**
   * @return the number of completed-job references to this dataset
   */
  public long getAccessCount() {
    return accessCount;
  }

  /**
   * @return {@code false} if new jobs may no longer reference this dataset
   */
  public boolean isActive() {
    return active;
  }

  /**
   * @return the ledger height at which the dataset was registered
   */
  public long getCreatedAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Dataset other = (Dataset) obj;
    return id == other.id &&
        pricePerUse == other.pricePerUse &&
        accessCount == other.accessCount &&
        active == other.active &&
        createdAt == other.createdAt &&
        Objects.equal(owner, other.owner) &&
        Objects.equal(name, other.name) &&
        Objects.equal(metadataUrl, other.metadataUrl) &&
        Objects.equal(category, other.category);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, owner, name, metadataUrl, category,
        pricePerUse, accessCount, active, createdAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("owner", owner)
        .add("name", name)
        .add("category", category)
        .add("pricePerUse", pricePerUse)
        .add("accessCount", accessCount)
        .add("active", active)
        .toString();
  }

  /**
   * A fluent builder to aid in constructing a {@link Dataset}.
   */
  public static class Builder {

    private long id;
    private Identity owner;
    private String name;
    private String metadataUrl;
    private String category;
    private long pricePerUse;
    private long accessCount = 0;
    private boolean active = true;
    private long createdAt;

    public Builder() {
    }

    /**
     * Creates a Builder configured to copy {@code dataset}, if it is not
     * modified.
     *
     * @param dataset A {@link Dataset} to copy settings from
     */
    public Builder(Dataset dataset) {
      this.id = dataset.id;
      this.owner = dataset.owner;
      this.name = dataset.name;
      this.metadataUrl = dataset.metadataUrl;
      this.category = dataset.category;
      this.pricePerUse = dataset.pricePerUse;
      this.accessCount = dataset.accessCount;
      this.active = dataset.active;
      this.createdAt = dataset.createdAt;
    }

    public Builder id(long id) {
      this.id = id;
      return this;
    }

    public Builder owner(Identity owner) {
      Preconditions.checkNotNull(owner, "Owner cannot be null");
      this.owner = owner;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder metadataUrl(String metadataUrl) {
      this.metadataUrl = metadataUrl;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    public Builder pricePerUse(long pricePerUse) {
      this.pricePerUse = pricePerUse;
      return this;
    }

    public Builder accessCount(long accessCount) {
      this.accessCount = accessCount;
      return this;
    }

    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    public Builder createdAt(long createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    /**
     * Build an instance of the configured {@link Dataset}.
     *
     * @throws ValidationException if a field is out of bounds
     */
    public Dataset build() {
      ValidationException.check(id > 0, "Dataset id must be positive: %s", id);
      ValidationException.check(owner != null, "Dataset owner is required");
      FieldLimits.checkName(name);
      FieldLimits.checkUrl("metadataUrl", metadataUrl);
      FieldLimits.checkCategory(category);
      FieldLimits.checkNonNegative("pricePerUse", pricePerUse);
      FieldLimits.checkNonNegative("accessCount", accessCount);
      return new Dataset(this);
    }
  }
}
