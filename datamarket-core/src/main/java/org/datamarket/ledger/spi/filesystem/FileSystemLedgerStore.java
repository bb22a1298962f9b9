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
package org.datamarket.ledger.spi.filesystem;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.StandardCopyOption;
import javax.annotation.concurrent.ThreadSafe;
import org.datamarket.ledger.LedgerIOException;
import org.datamarket.ledger.spi.memory.LedgerState;
import org.datamarket.ledger.spi.memory.MemoryLedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * A {@link org.datamarket.ledger.spi.LedgerStore} that keeps its state in a
 * local directory.
 * </p>
 * <p>
 * The committed state is held in memory and rewritten to
 * {@code rootDirectory/ledger.json} after every commit. The new document is
 * written to a temporary file in the same directory and renamed over the
 * previous one, so a reader never sees a partially written snapshot. If the
 * write fails the commit is undone and a
 * {@link org.datamarket.ledger.LedgerIOException} is thrown.
 * </p>
 */
@ThreadSafe
public class FileSystemLedgerStore extends MemoryLedgerStore {

  private static final Logger LOG = LoggerFactory
      .getLogger(FileSystemLedgerStore.class);

  static final String SNAPSHOT_FILE_NAME = "ledger.json";
  private static final String TEMP_FILE_NAME = ".ledger.json.tmp";

  private final File rootDirectory;

  /**
   * Open the store in {@code rootDirectory}, creating the directory if it
   * does not exist and loading the snapshot if there is one.
   *
   * @throws LedgerIOException if the directory cannot be created or the
   *         snapshot cannot be read
   * @throws org.datamarket.ledger.ValidationException if the snapshot is not
   *         a valid ledger document
   */
  public FileSystemLedgerStore(File rootDirectory) {
    super(load(rootDirectory));
    this.rootDirectory = rootDirectory;
  }

  public File getRootDirectory() {
    return rootDirectory;
  }

  private static LedgerState load(File rootDirectory) {
    Preconditions.checkNotNull(rootDirectory, "Root directory cannot be null");

    if (!rootDirectory.isDirectory() && !rootDirectory.mkdirs()) {
      throw new LedgerIOException(
          "Cannot create ledger directory:" + rootDirectory,
          new IOException("mkdirs failed"));
    }

    File snapshot = new File(rootDirectory, SNAPSHOT_FILE_NAME);
    if (!snapshot.exists()) {
      LOG.info("Starting empty ledger in {}", rootDirectory);
      return new LedgerState();
    }

    LOG.debug("Loading ledger snapshot {}", snapshot);
    LedgerState state = LedgerStateParser.parse(JsonUtil.parse(snapshot));
    LOG.info("Loaded ledger from {}: {} datasets, {} jobs",
        new Object[] { rootDirectory, state.getDatasets().size(),
            state.getJobs().size() });
    return state;
  }

  @Override
  protected void persist(LedgerState state) {
    File temp = new File(rootDirectory, TEMP_FILE_NAME);
    File snapshot = new File(rootDirectory, SNAPSHOT_FILE_NAME);
    try {
      Files.asCharSink(temp, Charsets.UTF_8)
          .write(LedgerStateParser.toString(state, true));
      try {
        java.nio.file.Files.move(temp.toPath(), snapshot.toPath(),
            StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        java.nio.file.Files.move(temp.toPath(), snapshot.toPath(),
            StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new LedgerIOException(
          "Cannot write ledger snapshot:" + snapshot, e);
    }
    LOG.debug("Wrote ledger snapshot {}", snapshot);
  }
}
