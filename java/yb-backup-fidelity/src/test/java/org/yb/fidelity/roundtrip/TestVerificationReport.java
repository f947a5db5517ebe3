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

import com.google.common.collect.ImmutableList;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.yb.fidelity.ColumnSchema.ColumnSchemaBuilder;
import org.yb.fidelity.Schema;
import org.yb.fidelity.Type;
import org.yb.fidelity.client.PartialRow;

import java.io.File;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.Assert.*;

public class TestVerificationReport {

  @Rule
  public final TemporaryFolder tmpFolder = new TemporaryFolder();

  @Test
  public void testFaithfulReport() {
    VerificationReport report = new VerificationReport.Builder("t", "t-restore")
        .schemas(true, ImmutableList.<String>of())
        .partitionSchemas(true, ImmutableList.<String>of())
        .replicas(3, 3)
        .rowCounts(10, 10)
        .build();
    assertTrue(report.isFaithful());
    assertTrue(report.getMismatches().isEmpty());
    report.assertFaithful();
    assertEquals("VerificationReport(t -> t-restore, faithful=true, rows=10/10, replicas=3/3)",
        report.toString());
  }

  @Test
  public void testEveryMismatchIsListed() {
    VerificationReport report = new VerificationReport.Builder("t", "t-restore")
        .schemas(false, ImmutableList.of("column 1 (v) nullable: true != false"))
        .partitionSchemas(false, ImmutableList.<String>of())
        .replicas(3, 1)
        .rowCounts(10, 9)
        .rowMismatches(ImmutableList.of("row missing from restored table: int64 k=1"))
        .build();
    assertFalse(report.isFaithful());
    assertEquals(ImmutableList.of(
        "column 1 (v) nullable: true != false",
        "partition schemas differ",
        "replicas: 3 != 1",
        "row count: 10 != 9",
        "row missing from restored table: int64 k=1"), report.getMismatches());
    try {
      report.assertFaithful();
      fail("Expected an unfaithful report to fail");
    } catch (AssertionError e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith(
          "Table t-restore is not a faithful restore of t:"));
      assertTrue(e.getMessage(), e.getMessage().contains("replicas: 3 != 1"));
    }
  }

  @Test
  public void testRowMismatchesIgnoreOrder() {
    Schema schema = new Schema(ImmutableList.of(
        new ColumnSchemaBuilder("k", Type.INT64).key(true).build()));
    List<PartialRow> source = ImmutableList.of(row(schema, 1), row(schema, 2), row(schema, 2));
    assertTrue(BackupRoundTrip.describeRowMismatches(source,
        ImmutableList.of(row(schema, 2), row(schema, 1), row(schema, 2))).isEmpty());
    assertEquals(ImmutableList.of("row missing from restored table: int64 k=2"),
        BackupRoundTrip.describeRowMismatches(source,
            ImmutableList.of(row(schema, 2), row(schema, 1))));
  }

  @Test
  public void testManyRowMismatchesAreCapped() {
    Schema schema = new Schema(ImmutableList.of(
        new ColumnSchemaBuilder("k", Type.INT64).key(true).build()));
    ImmutableList.Builder<PartialRow> source = ImmutableList.builder();
    for (int i = 0; i < 25; i++) {
      source.add(row(schema, i));
    }
    List<String> mismatches = BackupRoundTrip.describeRowMismatches(source.build(),
        ImmutableList.<PartialRow>of());
    assertEquals(11, mismatches.size());
    assertEquals("15 more rows missing from restored table", mismatches.get(10));
  }

  @Test
  public void testStagingDirectory() throws Exception {
    File base = new File(tmpFolder.getRoot(), "not-yet-created");
    Path path;
    try (StagingDirectory staging = StagingDirectory.create(base)) {
      path = staging.getPath();
      assertTrue(Files.isDirectory(path));
      assertEquals(base.toPath(), path.getParent());
      assertEquals(path, Paths.get(URI.create(staging.getUri())));
      Files.createDirectories(path.resolve("table"));
      Files.write(path.resolve("table").resolve("rows.json"), new byte[] {'[', ']'});
    }
    assertFalse(Files.exists(path));
    assertTrue(Files.isDirectory(base.toPath()));
  }

  private static PartialRow row(Schema schema, long key) {
    PartialRow row = schema.newPartialRow();
    row.addLong("k", key);
    return row;
  }
}
