// Copyright (c) YugaByte, Inc.
//
// Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
// in compliance with the License.  You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software distributed under the License
// is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
// or implied.  See the License for the specific language governing permissions and limitations
// under the License.
//
package org.yb.fidelity.roundtrip;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A freshly created directory that holds the artifacts of one backup between the backup and
 * the restore. Closing it deletes the directory and everything in it.
 */
public class StagingDirectory implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(StagingDirectory.class);

  private final Path path;

  private StagingDirectory(Path path) {
    this.path = path;
  }

  /**
   * Creates a new, empty, uniquely named directory under {@code baseDir}.
   */
  public static StagingDirectory create(File baseDir) throws IOException {
    Files.createDirectories(baseDir.toPath());
    Path dir = Files.createTempDirectory(baseDir.toPath(), "backup");
    LOG.info("Created staging directory {}", dir);
    return new StagingDirectory(dir);
  }

  public Path getPath() {
    return path;
  }

  /**
   * @return the directory as a URI, the form backup pipelines take as their root path
   */
  public String getUri() {
    return path.toUri().toString();
  }

  @Override
  public void close() throws IOException {
    FileUtils.deleteDirectory(path.toFile());
    LOG.info("Deleted staging directory {}", path);
  }

  @Override
  public String toString() {
    return path.toString();
  }
}
