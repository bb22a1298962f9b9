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
import javax.annotation.concurrent.Immutable;

/**
 * <p>
 * An authenticated principal issuing marketplace operations.
 * </p>
 * <p>
 * Authentication happens before an operation reaches the {@link Marketplace};
 * an {@code Identity} is only the name the hosting environment vouched for.
 * Two identities are equal when their names are equal.
 * </p>
 */
@Immutable
public final class Identity implements Comparable<Identity> {

  private final String name;

  private Identity(String name) {
    this.name = name;
  }

  public static Identity of(String name) {
    Preconditions.checkNotNull(name, "Identity name cannot be null");
    Preconditions.checkArgument(!name.trim().isEmpty(),
        "Identity name cannot be empty");
    return new Identity(name);
  }

  public String getName() {
    return name;
  }

  @Override
  public int compareTo(Identity other) {
    return name.compareTo(other.name);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return name.equals(((Identity) obj).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
