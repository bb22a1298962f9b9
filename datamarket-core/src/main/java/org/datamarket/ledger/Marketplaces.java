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
import com.typesafe.config.Config;
import org.datamarket.ledger.spi.HeightSource;
import org.datamarket.ledger.spi.LedgerStore;
import org.datamarket.ledger.spi.TransferGateway;
import org.datamarket.ledger.spi.filesystem.FileSystemLedgerStore;
import org.datamarket.ledger.spi.memory.MemoryLedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Convenience methods for opening a {@link Marketplace} from configuration.
 * </p>
 * <p>
 * The store is picked by {@code datamarket.store.type}:
 * </p>
 * <ul>
 *   <li>{@code memory}: a new, empty {@link MemoryLedgerStore}</li>
 *   <li>{@code filesystem}: a {@link FileSystemLedgerStore} in
 *   {@code datamarket.store.path}</li>
 * </ul>
 */
public final class Marketplaces {

  private static final Logger LOG = LoggerFactory.getLogger(Marketplaces.class);

  private Marketplaces() {
  }

  /**
   * Open a marketplace using the application's configuration.
   */
  public static Marketplace open(TransferGateway gateway, HeightSource heights) {
    return open(MarketConfig.load(), gateway, heights);
  }

  public static Marketplace open(Config config, TransferGateway gateway,
                                 HeightSource heights) {
    return open(new MarketConfig(config), gateway, heights);
  }

  public static Marketplace open(MarketConfig config, TransferGateway gateway,
                                 HeightSource heights) {
    Preconditions.checkNotNull(config, "Config cannot be null");
    return new Marketplace.Builder()
        .config(config)
        .store(openStore(config))
        .transferGateway(gateway)
        .heightSource(heights)
        .build();
  }

  static LedgerStore openStore(MarketConfig config) {
    switch (config.getStoreType()) {
      case MEMORY:
        LOG.debug("Using in-memory ledger store");
        return new MemoryLedgerStore();
      case FILESYSTEM:
        LOG.debug("Using filesystem ledger store in {}", config.getStorePath());
        return new FileSystemLedgerStore(config.getStorePath());
      default:
        throw new IllegalStateException(
            "Unknown store type: " + config.getStoreType());
    }
  }
}
