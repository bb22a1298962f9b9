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
import com.google.common.collect.Lists;
import java.util.List;
import org.junit.Assert;
import org.junit.Test;

public class TestTrainingJob {

  private static final Identity CREATOR = Identity.of("creator");
  private static final Identity PROVIDER = Identity.of("provider");

  private static TrainingJob.Builder pending() {
    return new TrainingJob.Builder()
        .id(3)
        .creator(CREATOR)
        .name("sentiment")
        .datasetIds(ImmutableList.of(1L, 2L, 1L))
        .status(JobStatus.PENDING)
        .totalCost(35)
        .createdAt(10);
  }

  @Test
  public void testPending() {
    TrainingJob job = pending().build();
    Assert.assertEquals(JobStatus.PENDING, job.getStatus());
    Assert.assertNull(job.getComputationProvider());
    Assert.assertNull(job.getResultUrl());
    Assert.assertNull(job.getCompletedAt());
    Assert.assertEquals("Duplicates are kept in order",
        ImmutableList.of(1L, 2L, 1L), job.getDatasetIds());
  }

  @Test
  public void testDatasetIdsAreCopied() {
    List<Long> ids = Lists.newArrayList(1L, 2L);
    TrainingJob job = pending().datasetIds(ids).build();
    ids.add(5L);
    Assert.assertEquals(ImmutableList.of(1L, 2L), job.getDatasetIds());
  }

  @Test
  public void testCompleted() {
    TrainingJob job = new TrainingJob.Builder(pending().build())
        .computationProvider(PROVIDER)
        .status(JobStatus.COMPLETED)
        .resultUrl("ipfs://model")
        .completedAt(12L)
        .build();
    Assert.assertEquals(PROVIDER, job.getComputationProvider());
    Assert.assertEquals("ipfs://model", job.getResultUrl());
    Assert.assertEquals(Long.valueOf(12), job.getCompletedAt());
    Assert.assertEquals("Copy keeps the cost", 35, job.getTotalCost());
  }

  @Test
  public void testStatusFieldConsistency() {
    TestHelpers.assertThrows("Pending job cannot have a provider",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            pending().computationProvider(PROVIDER).build();
          }
        });
    TestHelpers.assertThrows("Processing job needs a provider",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            pending().status(JobStatus.PROCESSING).build();
          }
        });
    TestHelpers.assertThrows("Completed job needs a result",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            pending().status(JobStatus.COMPLETED)
                .computationProvider(PROVIDER).completedAt(4L).build();
          }
        });
    TestHelpers.assertThrows("Failed job cannot have a result",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            pending().status(JobStatus.FAILED)
                .completedAt(4L).resultUrl("ipfs://x").build();
          }
        });
  }

  @Test
  public void testFailedWithoutProvider() {
    TrainingJob job = pending().status(JobStatus.FAILED).completedAt(11L)
        .build();
    Assert.assertTrue(job.getStatus().isTerminal());
  }

  @Test
  public void testTooManyDatasets() {
    final List<Long> ids = Lists.newArrayList();
    for (long i = 0; i <= FieldLimits.MAX_JOB_DATASETS; i += 1) {
      ids.add(i + 1);
    }
    TestHelpers.assertThrows("Should reject 21 dataset ids",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            pending().datasetIds(ids).build();
          }
        });
  }
}
