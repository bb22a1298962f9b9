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

/**
 * <p>
 * Exception thrown when a dataset or training job id does not resolve, or
 * when a new job references a dataset that is not active.
 * </p>
 */
public class RecordNotFoundException extends LedgerException {

  public RecordNotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }

  public RecordNotFoundException(String message, Throwable cause) {
    super(ErrorKind.NOT_FOUND, message, cause);
  }

  public static RecordNotFoundException dataset(long datasetId) {
    return new RecordNotFoundException("No dataset with id:" + datasetId);
  }

  public static RecordNotFoundException job(long jobId) {
    return new RecordNotFoundException("No training job with id:" + jobId);
  }
}
