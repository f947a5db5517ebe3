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
package org.yb.fidelity;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.yb.fidelity.ColumnSchema.ColumnSchemaBuilder;
import org.yb.fidelity.ColumnSchema.CompressionAlgorithm;
import org.yb.fidelity.ColumnSchema.Encoding;
import org.yb.fidelity.util.DecimalUtil;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.Assert.*;

public class TestColumnSchema {

  @Test
  public void testBuilderCopiesEveryAttribute() {
    ColumnSchema column = new ColumnSchemaBuilder("price", Type.DECIMAL)
        .id(3)
        .nullable(true)
        .defaultValue(new BigDecimal("12345.67"))
        .desiredBlockSize(4096)
        .encoding(Encoding.BIT_SHUFFLE)
        .compressionAlgorithm(CompressionAlgorithm.SNAPPY)
        .typeAttributes(DecimalUtil.typeAttributes(9, 2))
        .build();
    ColumnSchema copy = new ColumnSchemaBuilder(column).build();
    assertEquals(Integer.valueOf(3), copy.getId());
    assertEquals("price", copy.getName());
    assertEquals(Type.DECIMAL, copy.getType());
    assertFalse(copy.isKey());
    assertTrue(copy.isNullable());
    assertEquals(new BigDecimal("12345.67"), copy.getDefaultValue());
    assertEquals(4096, copy.getDesiredBlockSize());
    assertEquals(Encoding.BIT_SHUFFLE, copy.getEncoding());
    assertEquals(CompressionAlgorithm.SNAPPY, copy.getCompressionAlgorithm());
    assertEquals(DecimalUtil.typeAttributes(9, 2), copy.getTypeAttributes());
    assertEquals("Column name: price, type: decimal(9, 2)", copy.toString());
  }

  @Test
  public void testEqualsOnlyComparesNameTypeAndKey() {
    ColumnSchema a = new ColumnSchemaBuilder("c", Type.STRING).build();
    ColumnSchema b = new ColumnSchemaBuilder("c", Type.STRING)
        .nullable(true)
        .encoding(Encoding.DICT_ENCODING)
        .build();
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new ColumnSchemaBuilder("c", Type.STRING).key(true).build());
    assertNotEquals(a, new ColumnSchemaBuilder("c", Type.BINARY).build());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDefaultOfWrongKind() {
    new ColumnSchemaBuilder("c", Type.INT64).defaultValue(1).build();
  }

  @Test
  public void testEncodingsByType() {
    assertTrue(Type.INT8.isValidEncoding(Encoding.RLE));
    assertFalse(Type.INT8.isValidEncoding(Encoding.DICT_ENCODING));
    assertTrue(Type.STRING.isValidEncoding(Encoding.PREFIX_ENCODING));
    assertFalse(Type.STRING.isValidEncoding(Encoding.BIT_SHUFFLE));
    assertTrue(Type.BOOL.isValidEncoding(Encoding.RLE));
    assertFalse(Type.DOUBLE.isValidEncoding(Encoding.RLE));
    for (Type type : Type.values()) {
      assertTrue(type.getName(), type.isValidEncoding(Encoding.AUTO_ENCODING));
      assertTrue(type.getName(), type.isValidEncoding(Encoding.PLAIN_ENCODING));
      assertFalse(type.getName(), type.isValidEncoding(Encoding.UNKNOWN));
      assertFalse(type.getName(), type.isValidEncoding(Encoding.GROUP_VARINT));
    }
  }

  @Test
  public void testKeyTypes() {
    List<Type> keyTypes = Type.keyTypes();
    assertFalse(keyTypes.contains(Type.BOOL));
    assertFalse(keyTypes.contains(Type.FLOAT));
    assertFalse(keyTypes.contains(Type.DOUBLE));
    assertTrue(keyTypes.contains(Type.INT64));
    assertTrue(keyTypes.contains(Type.DECIMAL));
    assertTrue(keyTypes.contains(Type.BINARY));
  }

  @Test
  public void testValueKinds() {
    assertEquals(ValueKind.INT64, Type.UNIXTIME_MICROS.getValueKind());
    assertTrue(ValueKind.BINARY.valuesEqual(new byte[] {1, 2}, new byte[] {1, 2}));
    assertFalse(ValueKind.BINARY.valuesEqual(new byte[] {1, 2}, new byte[] {2, 1}));
    assertFalse(ValueKind.INT32.valuesEqual(1, 1L));
    assertEquals(ValueKind.STRING, ValueKind.forValue("s"));
    assertNull(ValueKind.forValue(new Object()));
  }

  @Test
  public void testSchemaLookups() {
    Schema schema = new Schema(ImmutableList.of(
        new ColumnSchemaBuilder("k", Type.INT32).key(true).id(10).build(),
        new ColumnSchemaBuilder("v", Type.STRING).nullable(true).id(20).build()));
    assertEquals(1, schema.getColumnIndex("v"));
    assertEquals(1, schema.getColumnIndex(20));
    assertEquals(1, schema.getPrimaryKeyColumnCount());
    assertTrue(schema.hasColumnIds());
    assertFalse(schema.hasColumn("x"));
    try {
      schema.getColumnIndex("x");
      fail("Expected an unknown column to be rejected");
    } catch (IllegalArgumentException e) {
      assertEquals("Unknown column: x", e.getMessage());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicateColumnNames() {
    new Schema(ImmutableList.of(
        new ColumnSchemaBuilder("k", Type.INT32).key(true).build(),
        new ColumnSchemaBuilder("k", Type.STRING).build()));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPartialColumnIds() {
    new Schema(ImmutableList.of(
        new ColumnSchemaBuilder("k", Type.INT32).key(true).id(0).build(),
        new ColumnSchemaBuilder("v", Type.STRING).build()));
  }

  @Test
  public void testInvalidColumnsAreRefused() {
    assertRefused(new ColumnSchemaBuilder("k", Type.INT64).key(true).nullable(true),
        "Key column k cannot be nullable");
    assertRefused(new ColumnSchemaBuilder("k", Type.INT64).key(true).defaultValue(1L),
        "Key column k cannot have a default value");
    assertRefused(new ColumnSchemaBuilder("d", Type.DECIMAL),
        "Decimal column d needs a precision and scale");
    assertRefused(new ColumnSchemaBuilder("i", Type.INT32)
        .typeAttributes(DecimalUtil.typeAttributes(5, 2)),
        "Type attributes are only allowed on decimal columns: i");
  }

  @Test
  public void testSchemaWithoutKeyIsRefused() {
    try {
      new Schema(ImmutableList.of(new ColumnSchemaBuilder("v", Type.INT32).build()));
      fail("Expected a schema without key columns to be refused");
    } catch (IllegalArgumentException e) {
      assertEquals("A schema needs at least one key column", e.getMessage());
    }
  }

  private static void assertRefused(ColumnSchemaBuilder builder, String expected) {
    try {
      builder.build();
      fail("Expected the column to be refused: " + expected);
    } catch (IllegalArgumentException e) {
      assertEquals(expected, e.getMessage());
    }
  }
}
