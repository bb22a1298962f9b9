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
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * <p>
 * A request to train against one or more datasets, as recorded by the
 * {@link JobLedger}.
 * </p>
 * <p>
 * The dataset id list keeps its order and may repeat an id; each entry is
 * charged and counted on its own. {@code totalCost} is fixed when the job is
 * created and held in escrow from then on.
 * </p>
 */
@Immutable
public class TrainingJob {

  private final long id;
  private final Identity creator;
  private final String name;
  private final List<Long> datasetIds;
  private final Identity computationProvider;
  private final JobStatus status;
  private final String resultUrl;
  private final long totalCost;
  private final long createdAt;
  private final Long completedAt;

  private TrainingJob(Builder builder) {
    this.id = builder.id;
    this.creator = builder.creator;
    this.name = builder.name;
    this.datasetIds = builder.datasetIds;
    this.computationProvider = builder.computationProvider;
    this.status = builder.status;
    this.resultUrl = builder.resultUrl;
    this.totalCost = builder.totalCost;
    this.createdAt = builder.createdAt;
    this.completedAt = builder.completedAt;
  }

  public long getId() {
    return id;
  }

  public Identity getCreator() {
    return creator;
  }

  public String getName() {
    return name;
  }

  /**
   * @return the referenced dataset ids, in the order they were given
   */
  public List<Long> getDatasetIds() {
    return datasetIds;
  }

  /**
   * @return the provider that accepted this job, or {@code null} if it was
   *         never accepted
   */
  @Nullable
  public Identity getComputationProvider() {
    return computationProvider;
  }

  public JobStatus getStatus() {
    return status;
  }

  @Nullable
  public String getResultUrl() {
    return resultUrl;
  }

  public long getTotalCost() {
    return totalCost;
  }

  public long getCreatedAt() {
    return createdAt;
  }

  /**
   * @return the ledger height at which the job completed or failed, or
   *         {@code null} while it is still open
   */
  @Nullable
  public Long getCompletedAt() {
    return completedAt;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    TrainingJob other = (TrainingJob) obj;
    return id == other.id &&
        totalCost == other.totalCost &&
        createdAt == other.createdAt &&
        status == other.status &&
        Objects.equal(creator, other.creator) &&
        Objects.equal(name, other.name) &&
        Objects.equal(datasetIds, other.datasetIds) &&
        Objects.equal(computationProvider, other.computationProvider) &&
        Objects.equal(resultUrl, other.resultUrl) &&
        Objects.equal(completedAt, other.completedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, creator, name, datasetIds,
        computationProvider, status, resultUrl, totalCost, createdAt,
        completedAt);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("creator", creator)
        .add("name", name)
        .add("datasetIds", datasetIds)
        .add("provider", computationProvider)
        .add("status", status)
        .add("totalCost", totalCost)
        .toString();
  }

  /**
   * A fluent builder to aid in constructing a {@link TrainingJob}.
   */
  public static class Builder {

    private long id;
    private Identity creator;
    private String name;
    private List<Long> datasetIds = ImmutableList.of();
    private Identity computationProvider = null;
    private JobStatus status = JobStatus.PENDING;
    private String resultUrl = null;
    private long totalCost;
    private long createdAt;
    private Long completedAt = null;

    public Builder() {
    }

    /**
     * Creates a Builder configured to copy {@code job}, if it is not
     * modified.
     *
     * @param job A {@link TrainingJob} to copy settings from
     */
    public Builder(TrainingJob job) {
      this.id = job.id;
      this.creator = job.creator;
      this.name = job.name;
      this.datasetIds = job.datasetIds;
      this.computationProvider = job.computationProvider;
      this.status = job.status;
      this.resultUrl = job.resultUrl;
      this.totalCost = job.totalCost;
      this.createdAt = job.createdAt;
      this.completedAt = job.completedAt;
    }

    public Builder id(long id) {
      this.id = id;
      return this;
    }

    public Builder creator(Identity creator) {
      Preconditions.checkNotNull(creator, "Creator cannot be null");
      this.creator = creator;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder datasetIds(List<Long> datasetIds) {
      Preconditions.checkNotNull(datasetIds, "Dataset ids cannot be null");
      this.datasetIds = ImmutableList.copyOf(datasetIds);
      return this;
    }

    public Builder computationProvider(@Nullable Identity provider) {
      this.computationProvider = provider;
      return this;
    }

    public Builder status(JobStatus status) {
      Preconditions.checkNotNull(status, "Status cannot be null");
      this.status = status;
      return this;
    }

    public Builder resultUrl(@Nullable String resultUrl) {
      this.resultUrl = resultUrl;
      return this;
    }

    public Builder totalCost(long totalCost) {
      this.totalCost = totalCost;
      return this;
    }

    public Builder createdAt(long createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder completedAt(@Nullable Long completedAt) {
      this.completedAt = completedAt;
      return this;
    }

    /**
     * Build an instance of the configured {@link TrainingJob}.
     *
     * @throws ValidationException if a field is out of bounds or the
     *         provider, result and completion fields disagree with the status
     */
    public TrainingJob build() {
      ValidationException.check(id > 0, "Job id must be positive: %s", id);
      ValidationException.check(creator != null, "Job creator is required");
      FieldLimits.checkName(name);
      ValidationException.check(
          datasetIds.size() <= FieldLimits.MAX_JOB_DATASETS,
          "A job may reference at most %s datasets, got %s",
          FieldLimits.MAX_JOB_DATASETS, datasetIds.size());
      FieldLimits.checkNonNegative("totalCost", totalCost);
      if (resultUrl != null) {
        FieldLimits.checkUrl("resultUrl", resultUrl);
      }

      switch (status) {
        case PENDING:
          ValidationException.check(computationProvider == null,
              "A pending job cannot have a provider");
          ValidationException.check(completedAt == null && resultUrl == null,
              "A pending job cannot have a result");
          break;
        case PROCESSING:
          ValidationException.check(computationProvider != null,
              "A processing job must have a provider");
          ValidationException.check(completedAt == null && resultUrl == null,
              "A processing job cannot have a result");
          break;
        case COMPLETED:
          ValidationException.check(computationProvider != null,
              "A completed job must have a provider");
          ValidationException.check(completedAt != null && resultUrl != null,
              "A completed job must have a result and completion height");
          break;
        case FAILED:
          ValidationException.check(completedAt != null && resultUrl == null,
              "A failed job must have a completion height and no result");
          break;
        default:
          throw new IllegalStateException("Unknown status: " + status);
      }

      return new TrainingJob(this);
    }
  }
}
