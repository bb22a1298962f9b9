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

import com.google.common.base.Strings;
import org.junit.Assert;
import org.junit.Test;

public class TestDataset {

  private static final Identity OWNER = Identity.of("owner");

  private static Dataset.Builder valid() {
    return new Dataset.Builder()
        .id(1)
        .owner(OWNER)
        .name("Census 2020")
        .metadataUrl("ipfs://census")
        .category("demographics")
        .pricePerUse(25)
        .createdAt(7);
  }

  @Test
  public void testBuild() {
    Dataset dataset = valid().build();
    Assert.assertEquals(1, dataset.getId());
    Assert.assertEquals(OWNER, dataset.getOwner());
    Assert.assertEquals("Census 2020", dataset.getName());
    Assert.assertEquals("ipfs://census", dataset.getMetadataUrl());
    Assert.assertEquals("demographics", dataset.getCategory());
    Assert.assertEquals(25, dataset.getPricePerUse());
    Assert.assertEquals("New datasets are unused", 0, dataset.getAccessCount());
    Assert.assertTrue("New datasets are active", dataset.isActive());
    Assert.assertEquals(7, dataset.getCreatedAt());
  }

  @Test
  public void testCopyBuilder() {
    Dataset original = valid().build();
    Dataset copy = new Dataset.Builder(original).build();
    Assert.assertEquals("Unmodified copy should be equal", original, copy);
    Assert.assertEquals(original.hashCode(), copy.hashCode());

    Dataset changed = new Dataset.Builder(original).active(false).build();
    Assert.assertFalse(changed.isActive());
    Assert.assertFalse("Changed copy should differ", original.equals(changed));
  }

  @Test
  public void testBoundaryLengthsAccepted() {
    Dataset dataset = valid()
        .name(Strings.repeat("n", FieldLimits.MAX_NAME_LENGTH))
        .metadataUrl(Strings.repeat("u", FieldLimits.MAX_URL_LENGTH))
        .category(Strings.repeat("c", FieldLimits.MAX_CATEGORY_LENGTH))
        .pricePerUse(0)
        .build();
    Assert.assertEquals(FieldLimits.MAX_NAME_LENGTH,
        dataset.getName().length());
    Assert.assertEquals(0, dataset.getPricePerUse());
  }

  @Test
  public void testEmptyStringsAccepted() {
    Dataset dataset = valid().name("").metadataUrl("").category("").build();
    Assert.assertEquals("", dataset.getName());
  }

  @Test
  public void testRejectsOversizedFields() {
    TestHelpers.assertThrows("Should reject a long name",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            valid().name(Strings.repeat("n", FieldLimits.MAX_NAME_LENGTH + 1))
                .build();
          }
        });
    TestHelpers.assertThrows("Should reject a long URL",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            valid().metadataUrl(
                Strings.repeat("u", FieldLimits.MAX_URL_LENGTH + 1)).build();
          }
        });
    TestHelpers.assertThrows("Should reject a long category",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            valid().category(
                Strings.repeat("c", FieldLimits.MAX_CATEGORY_LENGTH + 1))
                .build();
          }
        });
  }

  @Test
  public void testRejectsMissingAndNegativeFields() {
    TestHelpers.assertThrows("Should reject a null name",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            valid().name(null).build();
          }
        });
    TestHelpers.assertThrows("Should reject a negative price",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            valid().pricePerUse(-1).build();
          }
        });
    TestHelpers.assertThrows("Should reject a zero id",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            valid().id(0).build();
          }
        });
    TestHelpers.assertThrows("Should reject a missing owner",
        ValidationException.class, new Runnable() {
          @Override
          public void run() {
            new Dataset.Builder().id(1).name("n").metadataUrl("u")
                .category("c").build();
          }
        });
  }

  @Test
  public void testValidationKind() {
    TestHelpers.assertKind("Oversized name is a parameter error",
        ErrorKind.INVALID_PARAMETERS, new Runnable() {
          @Override
          public void run() {
            valid().name(Strings.repeat("n", 101)).build();
          }
        });
  }
}
