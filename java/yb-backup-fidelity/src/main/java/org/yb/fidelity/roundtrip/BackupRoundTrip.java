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

import com.google.common.base.Preconditions;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yb.fidelity.client.CreateTableOptions;
import org.yb.fidelity.client.ExternalOperationException;
import org.yb.fidelity.client.PartialRow;
import org.yb.fidelity.client.RowError;
import org.yb.fidelity.client.TableClient;
import org.yb.fidelity.client.TableSession;
import org.yb.fidelity.client.YBTable;
import org.yb.fidelity.backup.BackupOptions;
import org.yb.fidelity.backup.BackupRestorePipeline;
import org.yb.fidelity.backup.RestoreOptions;
import org.yb.fidelity.generator.GeneratedTable;
import org.yb.fidelity.generator.RandomRowGenerator;
import org.yb.fidelity.generator.RandomTableGenerator;
import org.yb.fidelity.util.FidelityConf;
import org.yb.fidelity.verifier.SchemaVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Drives one backup and restore of a table and checks that the restored copy matches the
 * original.
 *
 * A random round trip creates a random table, loads random rows into it, backs it up to a
 * fresh staging directory, restores it under a new name and compares the two tables. The
 * staging directory is deleted whether or not the round trip succeeds. Failures of the
 * cluster or of the backup pipeline propagate unchanged; differences between the tables are
 * returned in a {@link VerificationReport}.
 */
public class BackupRoundTrip {
  private static final Logger LOG = LoggerFactory.getLogger(BackupRoundTrip.class);

  // Differences beyond this many are only counted.
  private static final int MAX_REPORTED_ROWS = 10;

  private final TableClient client;
  private final BackupRestorePipeline pipeline;
  private final FidelityConf conf;
  private boolean compareRowContents = false;

  public BackupRoundTrip(TableClient client, BackupRestorePipeline pipeline, FidelityConf conf) {
    this.client = Preconditions.checkNotNull(client);
    this.pipeline = Preconditions.checkNotNull(pipeline);
    this.conf = Preconditions.checkNotNull(conf);
  }

  /**
   * Also compare the rows of both tables, not only their counts.
   */
  public BackupRoundTrip setCompareRowContents(boolean compareRowContents) {
    this.compareRowContents = compareRowContents;
    return this;
  }

  /**
   * Runs a random round trip seeded from the configuration.
   */
  public VerificationReport runRandomRoundTrip() throws Exception {
    return runRandomRoundTrip(conf.getSeed());
  }

  /**
   * Runs a random round trip. The generated table, its partitioning and its rows only depend
   * on {@code seed}.
   */
  public VerificationReport runRandomRoundTrip(long seed) throws Exception {
    LOG.info("Starting random backup round trip with seed {}", seed);
    Random random = new Random(seed);
    GeneratedTable generated = new RandomTableGenerator(random, conf.getMaxColumns()).generate();
    String tableName = "random-" + seed + "-" + System.nanoTime();
    YBTable table = createTable(tableName, generated);
    int rowCount = random.nextInt(conf.getMaxRows()) + 1;
    loadRandomRows(table, rowCount, random);
    VerificationReport report = runRoundTrip(tableName);
    if (!report.isFaithful()) {
      LOG.warn("Round trip with seed {} was not faithful, rerun with {}={}", seed,
          FidelityConf.SEED_ENV_VAR, seed);
    }
    return report;
  }

  /**
   * Backs up and restores an existing table, then compares the restored copy with it.
   */
  public VerificationReport runRoundTrip(String tableName) throws Exception {
    String restoredName = backupAndRestore(tableName);
    return verify(tableName, restoredName);
  }

  /**
   * Creates a table from a generated definition, with the configured replica count unless the
   * definition asks for one. The definition itself is left unchanged.
   */
  public YBTable createTable(String tableName, GeneratedTable generated) throws Exception {
    CreateTableOptions options = new CreateTableOptions(generated.getOptions());
    if (options.getNumReplicas() == null) {
      options.setNumReplicas(conf.getNumReplicas());
    }
    LOG.info("Creating table {} with {} columns, {}", tableName,
        generated.getSchema().getColumnCount(), options);
    return client.createTable(tableName, generated.getSchema(), options);
  }

  /**
   * Upserts {@code rowCount} random rows and waits until all of them are written.
   *
   * @return the rows that were written
   */
  public List<PartialRow> loadRandomRows(YBTable table, int rowCount, Random random)
      throws Exception {
    List<PartialRow> rows = new RandomRowGenerator(random).generateRows(table.getSchema(),
        rowCount);
    writeRows(table, rows);
    return rows;
  }

  /**
   * Upserts the rows and flushes them. Nothing is written if an upsert cannot be applied.
   *
   * @throws ExternalOperationException if the cluster rejected any row
   */
  public void writeRows(YBTable table, List<PartialRow> rows) throws Exception {
    try (TableSession session = client.newSession()) {
      try {
        for (PartialRow row : rows) {
          session.apply(table.newUpsert(row));
        }
      } catch (Exception e) {
        session.discardPendingOperations();
        throw e;
      }
      session.flush();
      if (session.countPendingErrors() > 0) {
        List<RowError> errors = session.getPendingErrors();
        throw new ExternalOperationException(errors.size() + " of " + rows.size() +
            " rows were rejected by table " + table.getName() + ", first: " + errors.get(0));
      }
    }
    LOG.info("Wrote {} rows to table {}", rows.size(), table.getName());
  }

  /**
   * Backs up a table to a new staging directory and restores it from there.
   *
   * @return the name of the restored table
   */
  public String backupAndRestore(String tableName) throws Exception {
    List<String> tables = ImmutableList.of(tableName);
    String masters = client.getMasterAddresses();
    RestoreOptions restoreOptions;
    try (StagingDirectory staging = StagingDirectory.create(conf.getStagingBaseDir())) {
      BackupOptions backupOptions = new BackupOptions(tables, staging.getUri(), masters);
      LOG.info("Backing up: {}", backupOptions);
      pipeline.backup(backupOptions);
      restoreOptions = new RestoreOptions(tables, staging.getUri(), masters,
          conf.getRestoreSuffix());
      LOG.info("Restoring: {}", restoreOptions);
      pipeline.restore(restoreOptions);
    }
    return restoreOptions.restoredTableName(tableName);
  }

  /**
   * Compares a table with the copy restored under the configured suffix.
   */
  public VerificationReport verify(String sourceName) throws Exception {
    return verify(sourceName, sourceName + conf.getRestoreSuffix());
  }

  /**
   * Compares a table with its restored copy.
   */
  public VerificationReport verify(String sourceName, String restoredName) throws Exception {
    YBTable source = client.openTable(sourceName);
    YBTable restored = client.openTable(restoredName);
    List<PartialRow> sourceRows = client.scanRows(source);
    List<PartialRow> restoredRows = client.scanRows(restored);

    VerificationReport.Builder builder = new VerificationReport.Builder(sourceName, restoredName)
        .schemas(SchemaVerifier.schemasMatch(source.getSchema(), restored.getSchema()),
            SchemaVerifier.describeSchemaMismatches(source.getSchema(), restored.getSchema()))
        .partitionSchemas(
            SchemaVerifier.partitionSchemasMatch(source.getPartitionSchema(),
                restored.getPartitionSchema()),
            SchemaVerifier.describePartitionSchemaMismatches(source.getPartitionSchema(),
                restored.getPartitionSchema()))
        .replicas(source.getNumReplicas(), restored.getNumReplicas())
        .rowCounts(sourceRows.size(), restoredRows.size());
    if (compareRowContents) {
      builder.rowMismatches(describeRowMismatches(sourceRows, restoredRows));
    }
    VerificationReport report = builder.build();
    if (report.isFaithful()) {
      LOG.info("Verified {}", report);
    } else {
      LOG.warn("Restore mismatch {}: {}", report, report.getMismatches());
    }
    return report;
  }

  /**
   * Compares rows by their rendered contents, ignoring order.
   */
  static List<String> describeRowMismatches(List<PartialRow> sourceRows,
                                            List<PartialRow> restoredRows) {
    Multiset<String> source = render(sourceRows);
    Multiset<String> restored = render(restoredRows);
    List<String> mismatches = new ArrayList<>();
    addMissing(mismatches, "missing from restored table", Multisets.difference(source, restored));
    addMissing(mismatches, "not in source table", Multisets.difference(restored, source));
    return mismatches;
  }

  private static Multiset<String> render(List<PartialRow> rows) {
    Multiset<String> rendered = HashMultiset.create();
    for (PartialRow row : rows) {
      rendered.add(row.rowToString());
    }
    return rendered;
  }

  private static void addMissing(List<String> mismatches, String what, Multiset<String> rows) {
    if (rows.isEmpty()) {
      return;
    }
    int reported = 0;
    for (String row : rows) {
      if (reported == MAX_REPORTED_ROWS) {
        break;
      }
      mismatches.add("row " + what + ": " + row);
      reported++;
    }
    if (rows.size() > reported) {
      mismatches.add((rows.size() - reported) + " more rows " + what);
    }
  }
}
