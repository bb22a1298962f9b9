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
package org.datamarket.ledger.spi;

import org.datamarket.ledger.Identity;

/**
 * <p>
 * The external value-transfer primitive that moves funds between a
 * participant's own holdings and the marketplace.
 * </p>
 * <p>
 * Both methods report a refusal by returning {@code false}. A runtime
 * exception thrown by an implementation is treated the same way by the
 * ledger.
 * </p>
 */
public interface TransferGateway {

  /**
   * Move {@code amount} from the external holdings of {@code from} into the
   * marketplace.
   *
   * @return {@code true} if the funds were transferred
   */
  boolean collect(Identity from, long amount);

  /**
   * Move {@code amount} from the marketplace to the external holdings of
   * {@code to}.
   *
   * @return {@code true} if the funds were transferred
   */
  boolean pay(Identity to, long amount);
}
