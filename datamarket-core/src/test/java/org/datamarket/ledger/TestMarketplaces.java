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
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;
import java.io.File;
import org.datamarket.ledger.spi.memory.CountingHeightSource;
import org.datamarket.ledger.spi.memory.MemoryLedgerStore;
import org.datamarket.ledger.spi.memory.MemoryTransferGateway;
import org.datamarket.ledger.spi.filesystem.FileSystemLedgerStore;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestMarketplaces {

  private static final Identity OWNER = Identity.of("owner");
  private static final Identity USER = Identity.of("user");

  @Rule
  public TemporaryFolder temp = new TemporaryFolder();

  @Test
  public void testMemoryStoreByDefault() {
    Assert.assertTrue(Marketplaces.openStore(
        new MarketConfig(ConfigFactory.empty())) instanceof MemoryLedgerStore);
  }

  @Test
  public void testFilesystemStoreSurvivesReopen() throws Exception {
    File root = new File(temp.getRoot(), "ledger");
    MarketConfig config = new MarketConfig(ConfigFactory.empty()
        .withValue("datamarket.store.type",
            ConfigValueFactory.fromAnyRef("filesystem"))
        .withValue("datamarket.store.path",
            ConfigValueFactory.fromAnyRef(root.getAbsolutePath())));
    Assert.assertTrue(
        Marketplaces.openStore(config) instanceof FileSystemLedgerStore);

    MemoryTransferGateway gateway = new MemoryTransferGateway();
    gateway.fund(USER, 100);
    CountingHeightSource heights = new CountingHeightSource(5);

    Marketplace first = Marketplaces.open(config, gateway, heights);
    long datasetId = first.registerDataset(OWNER, "weather", "ipfs://w", 7,
        "climate");
    first.depositFunds(USER, 50);
    long jobId = first.createTrainingJob(USER, "forecast",
        ImmutableList.of(datasetId));
    first.close();

    Marketplace second = Marketplaces.open(config, gateway, heights);
    Assert.assertEquals("weather", second.getDataset(datasetId).getName());
    Assert.assertEquals(43, second.getUserBalance(USER));
    Assert.assertEquals(7, second.getEscrowBalance());
    Assert.assertEquals(JobStatus.PENDING,
        second.getTrainingJob(jobId).getStatus());
    Assert.assertEquals("Counters are restored", 2,
        second.registerDataset(OWNER, "tides", "ipfs://t", 1, "climate"));
    second.close();
  }
}
