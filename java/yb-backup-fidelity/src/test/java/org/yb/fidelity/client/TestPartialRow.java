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
package org.yb.fidelity.client;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.yb.fidelity.ColumnSchema.ColumnSchemaBuilder;
import org.yb.fidelity.Schema;
import org.yb.fidelity.Type;
import org.yb.fidelity.util.DecimalUtil;

import java.math.BigDecimal;

import static org.junit.Assert.*;

public class TestPartialRow {

  private static Schema getSchema() {
    return new Schema(ImmutableList.of(
        new ColumnSchemaBuilder("key", Type.INT64).key(true).build(),
        new ColumnSchemaBuilder("name", Type.STRING).nullable(true).build(),
        new ColumnSchemaBuilder("payload", Type.BINARY).build(),
        new ColumnSchemaBuilder("price", Type.DECIMAL)
            .typeAttributes(DecimalUtil.typeAttributes(9, 2))
            .build()));
  }

  @Test
  public void testSetAndGet() {
    PartialRow row = getSchema().newPartialRow();
    assertFalse(row.isSet("key"));
    assertFalse(row.hasAllKeyColumns());
    row.addLong("key", 5);
    row.setNull("name");
    row.addDecimal("price", new BigDecimal("1.25"));
    assertTrue(row.hasAllKeyColumns());
    assertTrue(row.isSet("name"));
    assertTrue(row.isNull("name"));
    assertNull(row.getObject("name"));
    assertFalse(row.isSet("payload"));
    assertEquals(5L, row.getObject("key"));
    assertEquals("(int64 key=5)", row.stringifyRowKey());
    assertEquals("int64 key=5, string name=NULL, decimal price=1.25", row.rowToString());
  }

  @Test
  public void testBinaryValuesAreCopied() {
    PartialRow row = getSchema().newPartialRow();
    byte[] payload = {1, 2, 3};
    row.addBinary("payload", payload);
    payload[0] = 9;
    assertArrayEquals(new byte[] {1, 2, 3}, (byte[]) row.getObject("payload"));

    PartialRow copy = new PartialRow(row);
    assertNotSame(row.getObject("payload"), copy.getObject("payload"));
    assertArrayEquals((byte[]) row.getObject("payload"), (byte[]) copy.getObject("payload"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullOnNonNullableColumn() {
    getSchema().newPartialRow().setNull("payload");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongValueClass() {
    getSchema().newPartialRow().addObject(0, 5);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDecimalOutOfRange() {
    getSchema().newPartialRow().addDecimal("price", new BigDecimal("123456789.00"));
  }

  @Test
  public void testAppliedRowsAreFrozen() {
    Schema schema = getSchema();
    YBTable table = new YBTable("t", "id", schema,
        new PartitionSchema(new PartitionSchema.RangeSchema(ImmutableList.of(0)),
            ImmutableList.<PartitionSchema.HashBucketSchema>of()), 1);
    Upsert upsert = table.newUpsert();
    upsert.getRow().addLong("key", 1);
    upsert.freeze();
    assertTrue(upsert.getRow().isFrozen());
    try {
      upsert.getRow().addLong("key", 2);
      fail("Expected a frozen row to be immutable");
    } catch (IllegalStateException e) {
      // Expected.
    }
    assertFalse(new PartialRow(upsert.getRow()).isFrozen());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRowFromOtherSchema() {
    Schema schema = getSchema();
    YBTable table = new YBTable("t", "id", schema,
        new PartitionSchema(new PartitionSchema.RangeSchema(ImmutableList.of(0)),
            ImmutableList.<PartitionSchema.HashBucketSchema>of()), 1);
    table.newUpsert(getSchema().newPartialRow());
  }

  @Test
  public void testSplitRowsAreCopied() {
    PartialRow split = getSchema().newPartialRow();
    split.addLong("key", 10);
    CreateTableOptions options = new CreateTableOptions().addSplitRow(split);
    split.addLong("key", 20);
    assertEquals(10L, options.getSplitRows().get(0).getObject("key"));
    assertNull(options.getRangePartitionColumns());
    assertNull(options.getNumReplicas());
  }
}
