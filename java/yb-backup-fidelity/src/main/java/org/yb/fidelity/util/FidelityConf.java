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
package org.yb.fidelity.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yb.fidelity.backup.RestoreOptions;

import java.io.File;

/**
 * Settings of a fidelity run. Every value can be given as an environment variable or as the
 * matching system property (YB_FIDELITY_MAX_ROWS or yb.fidelity.max.rows).
 */
public final class FidelityConf {
  private static final Logger LOG = LoggerFactory.getLogger(FidelityConf.class);

  public static final String SEED_ENV_VAR = "YB_FIDELITY_SEED";
  public static final String MAX_ROWS_ENV_VAR = "YB_FIDELITY_MAX_ROWS";
  public static final String MAX_COLUMNS_ENV_VAR = "YB_FIDELITY_MAX_COLUMNS";
  public static final String NUM_REPLICAS_ENV_VAR = "YB_FIDELITY_NUM_REPLICAS";
  public static final String RESTORE_SUFFIX_ENV_VAR = "YB_FIDELITY_RESTORE_SUFFIX";
  public static final String TMP_DIR_ENV_VAR = "TEST_TMPDIR";

  public static final int DEFAULT_MAX_ROWS = 200;
  public static final int DEFAULT_MAX_COLUMNS = 50;
  public static final int DEFAULT_NUM_REPLICAS = 1;

  private final long seed;
  private final int maxRows;
  private final int maxColumns;
  private final int numReplicas;
  private final String restoreSuffix;
  private final File stagingBaseDir;

  private FidelityConf(Builder builder) {
    this.seed = builder.seed;
    this.maxRows = builder.maxRows;
    this.maxColumns = builder.maxColumns;
    this.numReplicas = builder.numReplicas;
    this.restoreSuffix = builder.restoreSuffix;
    this.stagingBaseDir = builder.stagingBaseDir;
  }

  /**
   * Reads the configuration from the environment. Without an explicit seed a new one is
   * drawn and logged, so that a failing run can be repeated.
   */
  public static FidelityConf fromEnvironment() {
    Builder builder = new Builder();
    String seedValue = EnvAndSysPropertyUtil.getEnvVarOrSystemProperty(SEED_ENV_VAR);
    if (seedValue != null) {
      builder.seed(EnvAndSysPropertyUtil.getLongEnvVarOrSystemProperty(SEED_ENV_VAR, 0));
      LOG.info("Using random seed {} from {}", builder.seed, SEED_ENV_VAR);
    } else {
      builder.seed(RandomUtil.newSeed());
      LOG.info("Using random seed {}, set {} to reproduce", builder.seed, SEED_ENV_VAR);
    }
    builder.maxRows(
        EnvAndSysPropertyUtil.getIntEnvVarOrSystemProperty(MAX_ROWS_ENV_VAR, DEFAULT_MAX_ROWS));
    builder.maxColumns(EnvAndSysPropertyUtil.getIntEnvVarOrSystemProperty(
        MAX_COLUMNS_ENV_VAR, DEFAULT_MAX_COLUMNS));
    builder.numReplicas(EnvAndSysPropertyUtil.getIntEnvVarOrSystemProperty(
        NUM_REPLICAS_ENV_VAR, DEFAULT_NUM_REPLICAS));
    builder.restoreSuffix(EnvAndSysPropertyUtil.getEnvVarOrSystemProperty(
        RESTORE_SUFFIX_ENV_VAR, RestoreOptions.DEFAULT_TABLE_SUFFIX));
    String tmpDir = System.getenv(TMP_DIR_ENV_VAR);
    if (tmpDir != null) {
      builder.stagingBaseDir(new File(tmpDir));
    }
    return builder.build();
  }

  public long getSeed() {
    return seed;
  }

  public int getMaxRows() {
    return maxRows;
  }

  public int getMaxColumns() {
    return maxColumns;
  }

  public int getNumReplicas() {
    return numReplicas;
  }

  public String getRestoreSuffix() {
    return restoreSuffix;
  }

  /**
   * @return the directory staging directories are created in
   */
  public File getStagingBaseDir() {
    return stagingBaseDir;
  }

  @Override
  public String toString() {
    return "FidelityConf(seed=" + seed + ", maxRows=" + maxRows + ", maxColumns=" + maxColumns +
        ", numReplicas=" + numReplicas + ", restoreSuffix=" + restoreSuffix +
        ", stagingBaseDir=" + stagingBaseDir + ")";
  }

  public static class Builder {
    private long seed = 0;
    private int maxRows = DEFAULT_MAX_ROWS;
    private int maxColumns = DEFAULT_MAX_COLUMNS;
    private int numReplicas = DEFAULT_NUM_REPLICAS;
    private String restoreSuffix = RestoreOptions.DEFAULT_TABLE_SUFFIX;
    private File stagingBaseDir = new File(System.getProperty("java.io.tmpdir"));

    public Builder seed(long seed) {
      this.seed = seed;
      return this;
    }

    public Builder maxRows(int maxRows) {
      this.maxRows = maxRows;
      return this;
    }

    public Builder maxColumns(int maxColumns) {
      this.maxColumns = maxColumns;
      return this;
    }

    public Builder numReplicas(int numReplicas) {
      this.numReplicas = numReplicas;
      return this;
    }

    public Builder restoreSuffix(String restoreSuffix) {
      this.restoreSuffix = restoreSuffix;
      return this;
    }

    public Builder stagingBaseDir(File stagingBaseDir) {
      this.stagingBaseDir = stagingBaseDir;
      return this;
    }

    public FidelityConf build() {
      if (maxRows < 1 || maxColumns < 1 || numReplicas < 1) {
        throw new IllegalArgumentException("maxRows, maxColumns and numReplicas must be " +
            "positive: " + maxRows + ", " + maxColumns + ", " + numReplicas);
      }
      return new FidelityConf(this);
    }
  }
}
