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
package org.datamarket.ledger.spi.memory;

import com.google.common.base.Preconditions;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.concurrent.ThreadSafe;
import org.datamarket.ledger.spi.HeightSource;

/**
 * A {@link HeightSource} that only moves when {@link #advance()} is called.
 */
@ThreadSafe
public class CountingHeightSource implements HeightSource {

  private final AtomicLong height;

  public CountingHeightSource() {
    this(0);
  }

  public CountingHeightSource(long initialHeight) {
    Preconditions.checkArgument(initialHeight >= 0,
        "Initial height cannot be negative: %s", initialHeight);
    this.height = new AtomicLong(initialHeight);
  }

  @Override
  public long currentHeight() {
    return height.get();
  }

  public long advance() {
    return height.incrementAndGet();
  }

  public long advance(long blocks) {
    Preconditions.checkArgument(blocks >= 0,
        "Height cannot move backwards: %s", blocks);
    return height.addAndGet(blocks);
  }
}
