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
 * Bounds on record fields. Every violation is a {@link ValidationException}.
 */
public final class FieldLimits {

  public static final int MAX_NAME_LENGTH = 100;
  public static final int MAX_URL_LENGTH = 256;
  public static final int MAX_CATEGORY_LENGTH = 50;
  public static final int MAX_JOB_DATASETS = 20;

  private FieldLimits() {
  }

  public static String checkName(String name) {
    return checkBounded("name", name, MAX_NAME_LENGTH);
  }

  public static String checkUrl(String field, String url) {
    return checkBounded(field, url, MAX_URL_LENGTH);
  }

  public static String checkCategory(String category) {
    return checkBounded("category", category, MAX_CATEGORY_LENGTH);
  }

  public static long checkNonNegative(String field, long value) {
    ValidationException.check(value >= 0,
        "%s cannot be negative: %s", field, value);
    return value;
  }

  public static long checkPositive(String field, long value) {
    ValidationException.check(value > 0,
        "%s must be positive: %s", field, value);
    return value;
  }

  static String checkBounded(String field, String value, int maxLength) {
    if (value == null) {
      throw new ValidationException(field + " cannot be null");
    }
    ValidationException.check(value.length() <= maxLength,
        "%s is %s characters, longer than %s", field, value.length(),
        maxLength);
    return value;
  }
}
