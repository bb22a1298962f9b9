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
 * Exception thrown for marketplace ledger failures. The root of the ledger
 * exception hierarchy.
 * </p>
 * <p>
 * Every {@link Marketplace} operation that fails throws a subclass of this
 * exception after rolling back its transaction, so a caller that catches it
 * can rely on the ledger being unchanged. This is a runtime (unchecked)
 * exception; {@link #getKind()} tells the failure apart.
 * </p>
 */
public class LedgerException extends RuntimeException {

  private final ErrorKind kind;

  public LedgerException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public LedgerException(ErrorKind kind, String message, Throwable t) {
    super(message, t);
    this.kind = kind;
  }

  public LedgerException(ErrorKind kind, Throwable t) {
    super(t);
    this.kind = kind;
  }

  /**
   * @return the {@link ErrorKind} tag for this failure
   */
  public ErrorKind getKind() {
    return kind;
  }

  protected static String format(String message, Object... args) {
    String[] argStrings = new String[args.length];
    for (int i = 0; i < args.length; i += 1) {
      argStrings[i] = String.valueOf(args[i]);
    }
    return String.format(String.valueOf(message), (Object[]) argStrings);
  }
}
