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
package org.datamarket.ledger.spi.filesystem;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Lists;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.datamarket.ledger.Dataset;
import org.datamarket.ledger.Identity;
import org.datamarket.ledger.JobStatus;
import org.datamarket.ledger.TrainingJob;
import org.datamarket.ledger.ValidationException;
import org.datamarket.ledger.spi.memory.LedgerState;

/**
 * Parser and writer for the JSON form of a {@link LedgerState}.
 */
public class LedgerStateParser {

  static final int FORMAT_VERSION = 1;

  private static final String VERSION = "version";
  private static final String LAST_DATASET_ID = "lastDatasetId";
  private static final String LAST_JOB_ID = "lastJobId";
  private static final String ESCROW = "escrow";
  private static final String DATASETS = "datasets";
  private static final String JOBS = "jobs";
  private static final String BALANCES = "balances";

  private static final String ID = "id";
  private static final String OWNER = "owner";
  private static final String NAME = "name";
  private static final String METADATA_URL = "metadataUrl";
  private static final String CATEGORY = "category";
  private static final String PRICE_PER_USE = "pricePerUse";
  private static final String ACCESS_COUNT = "accessCount";
  private static final String ACTIVE = "active";
  private static final String CREATED_AT = "createdAt";

  private static final String CREATOR = "creator";
  private static final String DATASET_IDS = "datasetIds";
  private static final String PROVIDER = "computationProvider";
  private static final String STATUS = "status";
  private static final String RESULT_URL = "resultUrl";
  private static final String TOTAL_COST = "totalCost";
  private static final String COMPLETED_AT = "completedAt";

  public static LedgerState parse(String json) {
    return parse(JsonUtil.parse(json));
  }

  public static LedgerState parse(JsonNode node) {
    ValidationException.check(node != null && node.isObject(),
        "A ledger snapshot must be a JSON record");
    int version = (int) requiredLong(node, VERSION);
    ValidationException.check(version == FORMAT_VERSION,
        "Unsupported ledger snapshot version: %s", version);

    LedgerState state = new LedgerState();
    state.setLastDatasetId(requiredLong(node, LAST_DATASET_ID));
    state.setLastJobId(requiredLong(node, LAST_JOB_ID));
    state.setEscrow(requiredLong(node, ESCROW));

    for (Iterator<JsonNode> it = requiredArray(node, DATASETS); it.hasNext();) {
      state.putDataset(parseDataset(it.next()));
    }
    for (Iterator<JsonNode> it = requiredArray(node, JOBS); it.hasNext();) {
      state.putJob(parseJob(it.next()));
    }

    JsonNode balances = node.get(BALANCES);
    ValidationException.check(balances != null && balances.isObject(),
        "Ledger snapshot must have a %s record", BALANCES);
    for (Iterator<Map.Entry<String, JsonNode>> it = balances.fields();
         it.hasNext();) {
      Map.Entry<String, JsonNode> entry = it.next();
      ValidationException.check(entry.getValue().canConvertToLong(),
          "Balance of %s must be a number", entry.getKey());
      state.putBalance(Identity.of(entry.getKey()),
          entry.getValue().asLong());
    }

    ValidationException.check(
        state.getDatasets().size() <= state.getLastDatasetId(),
        "Snapshot holds more datasets than its counter: %s",
        state.getLastDatasetId());
    ValidationException.check(
        state.getJobs().size() <= state.getLastJobId(),
        "Snapshot holds more jobs than its counter: %s",
        state.getLastJobId());

    return state;
  }

  public static Dataset parseDataset(JsonNode node) {
    ValidationException.check(node.isObject(),
        "A dataset must be a JSON record");
    return new Dataset.Builder()
        .id(requiredLong(node, ID))
        .owner(Identity.of(requiredText(node, OWNER)))
        .name(requiredText(node, NAME))
        .metadataUrl(requiredText(node, METADATA_URL))
        .category(requiredText(node, CATEGORY))
        .pricePerUse(requiredLong(node, PRICE_PER_USE))
        .accessCount(requiredLong(node, ACCESS_COUNT))
        .active(requiredBoolean(node, ACTIVE))
        .createdAt(requiredLong(node, CREATED_AT))
        .build();
  }

  public static TrainingJob parseJob(JsonNode node) {
    ValidationException.check(node.isObject(),
        "A training job must be a JSON record");

    List<Long> datasetIds = Lists.newArrayList();
    for (Iterator<JsonNode> it = requiredArray(node, DATASET_IDS);
         it.hasNext();) {
      JsonNode id = it.next();
      ValidationException.check(id.canConvertToLong(),
          "Dataset ids must be numbers: %s", id);
      datasetIds.add(id.asLong());
    }

    String status = requiredText(node, STATUS);
    JobStatus jobStatus;
    try {
      jobStatus = JobStatus.valueOf(status);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unknown job status: " + status, e);
    }

    String provider = optionalText(node, PROVIDER);
    return new TrainingJob.Builder()
        .id(requiredLong(node, ID))
        .creator(Identity.of(requiredText(node, CREATOR)))
        .name(requiredText(node, NAME))
        .datasetIds(datasetIds)
        .computationProvider(provider == null ? null : Identity.of(provider))
        .status(jobStatus)
        .resultUrl(optionalText(node, RESULT_URL))
        .totalCost(requiredLong(node, TOTAL_COST))
        .createdAt(requiredLong(node, CREATED_AT))
        .completedAt(optionalLong(node, COMPLETED_AT))
        .build();
  }

  public static String toString(LedgerState state, boolean pretty) {
    return JsonUtil.toString(toJson(state), pretty);
  }

  public static JsonNode toJson(LedgerState state) {
    ObjectNode root = JsonNodeFactory.instance.objectNode();
    root.put(VERSION, FORMAT_VERSION);
    root.put(LAST_DATASET_ID, state.getLastDatasetId());
    root.put(LAST_JOB_ID, state.getLastJobId());
    root.put(ESCROW, state.getEscrow());

    ArrayNode datasets = root.putArray(DATASETS);
    for (Dataset dataset : state.getDatasets()) {
      datasets.add(toJson(dataset));
    }

    ArrayNode jobs = root.putArray(JOBS);
    for (TrainingJob job : state.getJobs()) {
      jobs.add(toJson(job));
    }

    ObjectNode balances = root.putObject(BALANCES);
    for (Map.Entry<Identity, Long> entry : state.getBalances().entrySet()) {
      balances.put(entry.getKey().getName(), entry.getValue());
    }

    return root;
  }

  private static JsonNode toJson(Dataset dataset) {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put(ID, dataset.getId());
    node.put(OWNER, dataset.getOwner().getName());
    node.put(NAME, dataset.getName());
    node.put(METADATA_URL, dataset.getMetadataUrl());
    node.put(CATEGORY, dataset.getCategory());
    node.put(PRICE_PER_USE, dataset.getPricePerUse());
    node.put(ACCESS_COUNT, dataset.getAccessCount());
    node.put(ACTIVE, dataset.isActive());
    node.put(CREATED_AT, dataset.getCreatedAt());
    return node;
  }

  private static JsonNode toJson(TrainingJob job) {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put(ID, job.getId());
    node.put(CREATOR, job.getCreator().getName());
    node.put(NAME, job.getName());
    ArrayNode ids = node.putArray(DATASET_IDS);
    for (Long id : job.getDatasetIds()) {
      ids.add(id);
    }
    if (job.getComputationProvider() != null) {
      node.put(PROVIDER, job.getComputationProvider().getName());
    }
    node.put(STATUS, job.getStatus().name());
    if (job.getResultUrl() != null) {
      node.put(RESULT_URL, job.getResultUrl());
    }
    node.put(TOTAL_COST, job.getTotalCost());
    node.put(CREATED_AT, job.getCreatedAt());
    if (job.getCompletedAt() != null) {
      node.put(COMPLETED_AT, job.getCompletedAt());
    }
    return node;
  }

  private static long requiredLong(JsonNode node, String field) {
    JsonNode value = node.get(field);
    ValidationException.check(value != null && value.canConvertToLong(),
        "Ledger record must have a numeric %s", field);
    return value.asLong();
  }

  private static Long optionalLong(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    ValidationException.check(value.canConvertToLong(),
        "Ledger record field %s must be numeric", field);
    return value.asLong();
  }

  private static String requiredText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    ValidationException.check(value != null && value.isTextual(),
        "Ledger record must have a text %s", field);
    return value.textValue();
  }

  private static String optionalText(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    ValidationException.check(value.isTextual(),
        "Ledger record field %s must be text", field);
    return value.textValue();
  }

  private static boolean requiredBoolean(JsonNode node, String field) {
    JsonNode value = node.get(field);
    ValidationException.check(value != null && value.isBoolean(),
        "Ledger record must have a boolean %s", field);
    return value.booleanValue();
  }

  private static Iterator<JsonNode> requiredArray(JsonNode node, String field) {
    JsonNode value = node.get(field);
    ValidationException.check(value != null && value.isArray(),
        "Ledger record must have a %s array", field);
    return value.elements();
  }
}
