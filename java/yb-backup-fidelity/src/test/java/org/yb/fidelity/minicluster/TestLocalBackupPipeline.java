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
package org.yb.fidelity.minicluster;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.yb.fidelity.BaseFidelityTest;
import org.yb.fidelity.ColumnSchema.ColumnSchemaBuilder;
import org.yb.fidelity.Schema;
import org.yb.fidelity.Type;
import org.yb.fidelity.backup.BackupOperationException;
import org.yb.fidelity.backup.BackupOptions;
import org.yb.fidelity.backup.RestoreOptions;
import org.yb.fidelity.client.CreateTableOptions;
import org.yb.fidelity.client.PartialRow;
import org.yb.fidelity.client.TableSession;
import org.yb.fidelity.client.YBTable;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class TestLocalBackupPipeline extends BaseFidelityTest {

  @Rule
  public final TemporaryFolder tmpFolder = new TemporaryFolder();

  private MiniTableCluster cluster;
  private LocalBackupPipeline pipeline;

  @Before
  public void setUp() {
    cluster = new MiniTableCluster();
    pipeline = new LocalBackupPipeline(cluster);
  }

  @After
  public void tearDown() {
    cluster.close();
  }

  private YBTable createTableWithRows() throws Exception {
    Schema schema = new Schema(ImmutableList.of(
        new ColumnSchemaBuilder("key", Type.INT32).key(true).build(),
        new ColumnSchemaBuilder("ratio", Type.DOUBLE).nullable(true).build(),
        new ColumnSchemaBuilder("blob", Type.BINARY).defaultValue(new byte[] {7, 7}).build()));
    YBTable table = cluster.createTable("source", schema,
        new CreateTableOptions().addHashPartitions(ImmutableList.of("key"), 3, 11));
    try (TableSession session = cluster.newSession()) {
      double[] ratios = {0.5, Double.NaN, Double.NEGATIVE_INFINITY};
      for (int i = 0; i < ratios.length; i++) {
        PartialRow row = table.getSchema().newPartialRow();
        row.addInt("key", i);
        row.addDouble("ratio", ratios[i]);
        session.apply(table.newUpsert(row));
      }
      PartialRow nullRatio = table.getSchema().newPartialRow();
      nullRatio.addInt("key", 3);
      nullRatio.setNull("ratio");
      nullRatio.addBinary("blob", new byte[0]);
      session.apply(table.newUpsert(nullRatio));
    }
    return table;
  }

  @Test
  public void testBackupLayout() throws Exception {
    createTableWithRows();
    File root = tmpFolder.newFolder("backup");
    pipeline.backup(new BackupOptions(ImmutableList.of("source"), root.toURI().toString(),
        cluster.getMasterAddresses()));

    Path dir = root.toPath().resolve("source");
    JsonObject metadata = JsonParser.parseString(new String(Files.readAllBytes(
        dir.resolve(LocalBackupPipeline.METADATA_FILE)), StandardCharsets.UTF_8))
        .getAsJsonObject();
    assertEquals("source", metadata.get("name").getAsString());
    assertEquals(3, metadata.getAsJsonArray("columns").size());
    assertEquals("Bwc=", metadata.getAsJsonArray("columns").get(2).getAsJsonObject()
        .get("default").getAsString());
    assertEquals(11, metadata.getAsJsonArray("hashPartitions").get(0).getAsJsonObject()
        .get("seed").getAsInt());

    JsonArray rows = JsonParser.parseString(new String(Files.readAllBytes(
        dir.resolve(LocalBackupPipeline.ROWS_FILE)), StandardCharsets.UTF_8)).getAsJsonArray();
    assertEquals(4, rows.size());
    assertTrue(rows.get(3).getAsJsonArray().get(1).isJsonNull());
    assertEquals(1, pipeline.getBackupCount());
  }

  @Test
  public void testRestore() throws Exception {
    YBTable source = createTableWithRows();
    File root = tmpFolder.newFolder("backup");
    List<String> tables = ImmutableList.of("source");
    pipeline.backup(new BackupOptions(tables, root.toURI().toString(),
        cluster.getMasterAddresses()));
    pipeline.restore(new RestoreOptions(tables, root.toURI().toString(),
        cluster.getMasterAddresses()));

    YBTable restored = cluster.openTable("source-restore");
    List<PartialRow> sourceRows = cluster.scanRows(source);
    List<PartialRow> restoredRows = cluster.scanRows(restored);
    assertEquals(sourceRows.size(), restoredRows.size());
    for (int i = 0; i < sourceRows.size(); i++) {
      assertEquals(sourceRows.get(i).rowToString(), restoredRows.get(i).rowToString());
    }
    assertTrue(Double.isNaN((Double) restoredRows.get(1).getObject("ratio")));
    assertEquals(3, restored.getPartitionSchema().getHashBucketSchemas().get(0).getNumBuckets());
    assertEquals(1, pipeline.getRestoreCount());
  }

  @Test
  public void testUnknownMasters() throws Exception {
    createTableWithRows();
    File root = tmpFolder.newFolder("backup");
    try {
      pipeline.backup(new BackupOptions(ImmutableList.of("source"), root.toURI().toString(),
          "10.0.0.1:7100"));
      fail("Expected a backup against other masters to fail");
    } catch (BackupOperationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("Unknown masters"));
    }
  }

  @Test
  public void testRestoreWithoutBackup() throws Exception {
    File root = tmpFolder.newFolder("empty");
    try {
      pipeline.restore(new RestoreOptions(ImmutableList.of("source"), root.toURI().toString(),
          cluster.getMasterAddresses()));
      fail("Expected a restore from an empty location to fail");
    } catch (BackupOperationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("No backup of table source"));
    }
  }

  @Test
  public void testMissingLocation() throws Exception {
    File missing = new File(tmpFolder.getRoot(), "missing");
    try {
      pipeline.backup(new BackupOptions(ImmutableList.of("source"), missing.toURI().toString(),
          cluster.getMasterAddresses()));
      fail("Expected a backup to a missing location to fail");
    } catch (BackupOperationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("is not a directory"));
    }
  }
}
