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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import java.util.Locale;
import java.util.Set;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * <p>
 * The {@code datamarket} block of a HOCON configuration, read and validated.
 * </p>
 * <p>
 * Defaults come from the {@code reference.conf} shipped in this module.
 * Unknown keys and bad values are rejected with a
 * {@link ConfigException.BadValue} that names the offending path.
 * </p>
 */
@Immutable
public class MarketConfig {

  public static final String ROOT = "datamarket";

  static final String PLATFORM_FEE_PERCENT = "platform-fee-percent";
  static final String PLATFORM_ACCOUNT = "platform-account";
  static final String SETTLEMENT = "settlement";
  static final String STORE = "store";
  static final String STORE_TYPE = "store.type";
  static final String STORE_PATH = "store.path";

  private static final Set<String> RECOGNIZED = ImmutableSet.of(
      PLATFORM_FEE_PERCENT, PLATFORM_ACCOUNT, SETTLEMENT, STORE);

  public enum Settlement {
    ESCROW,
    PROVIDER;

    static Settlement parse(Config config, String path) {
      String value = config.getString(path);
      try {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
      } catch (IllegalArgumentException e) {
        throw new ConfigException.BadValue(config.origin(), path,
            "Unknown settlement policy: " + value);
      }
    }
  }

  public enum StoreType {
    MEMORY,
    FILESYSTEM
  }

  private final int platformFeePercent;
  private final Identity platformAccount;
  private final Settlement settlement;
  private final StoreType storeType;
  private final File storePath;

  /**
   * Load the application's configuration: {@code application.conf},
   * system properties and this module's defaults.
   */
  public static MarketConfig load() {
    return new MarketConfig(ConfigFactory.load());
  }

  /**
   * @param root a configuration containing a {@code datamarket} block;
   *             missing settings fall back to this module's defaults
   */
  public MarketConfig(Config root) {
    Preconditions.checkNotNull(root, "Config cannot be null");
    Config config = root
        .withFallback(ConfigFactory.defaultReference())
        .resolve()
        .getConfig(ROOT);

    for (String key : config.root().keySet()) {
      if (!RECOGNIZED.contains(key)) {
        throw new ConfigException.BadValue(config.origin(), key,
            "Unrecognized setting, recognized settings: " + RECOGNIZED);
      }
    }

    this.platformFeePercent = config.getInt(PLATFORM_FEE_PERCENT);
    if (platformFeePercent < 0 || platformFeePercent > 100) {
      throw new ConfigException.BadValue(config.origin(),
          PLATFORM_FEE_PERCENT,
          "Must be between 0 and 100: " + platformFeePercent);
    }

    String account = config.getString(PLATFORM_ACCOUNT);
    if (account.trim().isEmpty()) {
      throw new ConfigException.BadValue(config.origin(), PLATFORM_ACCOUNT,
          "Cannot be empty");
    }
    this.platformAccount = Identity.of(account);

    this.settlement = Settlement.parse(config, SETTLEMENT);

    String type = config.getString(STORE_TYPE);
    try {
      this.storeType = StoreType.valueOf(
          type.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException.BadValue(config.origin(), STORE_TYPE,
          "Unknown store type: " + type);
    }

    if (config.hasPath(STORE_PATH)) {
      this.storePath = new File(config.getString(STORE_PATH));
    } else if (storeType == StoreType.FILESYSTEM) {
      throw new ConfigException.Missing(ROOT + "." + STORE_PATH);
    } else {
      this.storePath = null;
    }
  }

  public int getPlatformFeePercent() {
    return platformFeePercent;
  }

  public Identity getPlatformAccount() {
    return platformAccount;
  }

  public Settlement getSettlement() {
    return settlement;
  }

  public StoreType getStoreType() {
    return storeType;
  }

  /**
   * @return the filesystem store's directory, or {@code null} if none is set
   */
  @Nullable
  public File getStorePath() {
    return storePath;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("platformFeePercent", platformFeePercent)
        .add("platformAccount", platformAccount)
        .add("settlement", settlement)
        .add("storeType", storeType)
        .add("storePath", storePath)
        .toString();
  }
}
