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
package org.yb.fidelity.verifier;

import com.google.common.base.Objects;
import org.yb.fidelity.ColumnSchema;
import org.yb.fidelity.Schema;
import org.yb.fidelity.ValueKind;
import org.yb.fidelity.client.PartitionSchema;
import org.yb.fidelity.client.PartitionSchema.HashBucketSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural comparison of schemas, columns and partition schemas. Every attribute the
 * cluster stores is compared, including the ones {@link ColumnSchema#equals(Object)} ignores.
 *
 * The boolean methods never throw for well-formed input. The describe methods return one
 * line per difference and an empty list when the two sides match.
 */
public final class SchemaVerifier {

  private SchemaVerifier() {
  }

  public static boolean schemasMatch(Schema before, Schema after) {
    if (before == after) return true;
    if (before.getColumnCount() != after.getColumnCount()) return false;
    for (int i = 0; i < before.getColumnCount(); i++) {
      if (!columnsMatch(before.getColumnByIndex(i), after.getColumnByIndex(i))) {
        return false;
      }
    }
    return true;
  }

  public static boolean columnsMatch(ColumnSchema before, ColumnSchema after) {
    if (before == after) return true;
    return columnDifferences(before, after).isEmpty();
  }

  /**
   * Default values are compared by {@link ValueKind}, which compares byte arrays by content.
   * Values of different kinds never match.
   */
  public static boolean defaultValuesMatch(Object before, Object after) {
    if (before == null || after == null) {
      return before == after;
    }
    ValueKind kind = ValueKind.forValue(before);
    if (kind == null) {
      return Objects.equal(before, after);
    }
    return kind.valuesEqual(before, after);
  }

  public static boolean partitionSchemasMatch(PartitionSchema before, PartitionSchema after) {
    if (before == after) return true;
    List<HashBucketSchema> beforeBuckets = before.getHashBucketSchemas();
    List<HashBucketSchema> afterBuckets = after.getHashBucketSchemas();
    if (beforeBuckets.size() != afterBuckets.size()) return false;
    for (int i = 0; i < beforeBuckets.size(); i++) {
      if (!hashBucketSchemasMatch(beforeBuckets.get(i), afterBuckets.get(i))) {
        return false;
      }
    }
    return Objects.equal(before.getRangeSchema().getColumnIds(),
                         after.getRangeSchema().getColumnIds());
  }

  public static boolean hashBucketSchemasMatch(HashBucketSchema before, HashBucketSchema after) {
    if (before == after) return true;
    return Objects.equal(before.getColumnIds(), after.getColumnIds()) &&
        before.getNumBuckets() == after.getNumBuckets() &&
        before.getSeed() == after.getSeed();
  }

  /**
   * Lists every column attribute that differs, as "attribute: before != after".
   */
  public static List<String> columnDifferences(ColumnSchema before, ColumnSchema after) {
    List<String> diffs = new ArrayList<>();
    addIfDifferent(diffs, "name", before.getName(), after.getName());
    addIfDifferent(diffs, "type", before.getType().getName(), after.getType().getName());
    addIfDifferent(diffs, "key", before.isKey(), after.isKey());
    addIfDifferent(diffs, "nullable", before.isNullable(), after.isNullable());
    if (!defaultValuesMatch(before.getDefaultValue(), after.getDefaultValue())) {
      diffs.add("default value: " + render(before.getDefaultValue()) + " != " +
          render(after.getDefaultValue()));
    }
    addIfDifferent(diffs, "desired block size",
        before.getDesiredBlockSize(), after.getDesiredBlockSize());
    addIfDifferent(diffs, "encoding", before.getEncoding(), after.getEncoding());
    addIfDifferent(diffs, "compression",
        before.getCompressionAlgorithm(), after.getCompressionAlgorithm());
    addIfDifferent(diffs, "type attributes",
        before.getTypeAttributes(), after.getTypeAttributes());
    return diffs;
  }

  /**
   * Describes how two schemas differ, column by column.
   */
  public static List<String> describeSchemaMismatches(Schema before, Schema after) {
    List<String> mismatches = new ArrayList<>();
    if (before == after) {
      return mismatches;
    }
    if (before.getColumnCount() != after.getColumnCount()) {
      mismatches.add("column count: " + before.getColumnCount() + " != " +
          after.getColumnCount());
    }
    int common = Math.min(before.getColumnCount(), after.getColumnCount());
    for (int i = 0; i < common; i++) {
      ColumnSchema beforeColumn = before.getColumnByIndex(i);
      for (String diff : columnDifferences(beforeColumn, after.getColumnByIndex(i))) {
        mismatches.add("column " + i + " (" + beforeColumn.getName() + ") " + diff);
      }
    }
    return mismatches;
  }

  /**
   * Describes how two partition schemas differ, hash level by hash level, then range.
   */
  public static List<String> describePartitionSchemaMismatches(PartitionSchema before,
                                                               PartitionSchema after) {
    List<String> mismatches = new ArrayList<>();
    if (before == after) {
      return mismatches;
    }
    List<HashBucketSchema> beforeBuckets = before.getHashBucketSchemas();
    List<HashBucketSchema> afterBuckets = after.getHashBucketSchemas();
    if (beforeBuckets.size() != afterBuckets.size()) {
      mismatches.add("hash levels: " + beforeBuckets.size() + " != " + afterBuckets.size());
    }
    int common = Math.min(beforeBuckets.size(), afterBuckets.size());
    for (int i = 0; i < common; i++) {
      HashBucketSchema b = beforeBuckets.get(i);
      HashBucketSchema a = afterBuckets.get(i);
      List<String> diffs = new ArrayList<>();
      addIfDifferent(diffs, "column ids", b.getColumnIds(), a.getColumnIds());
      addIfDifferent(diffs, "buckets", b.getNumBuckets(), a.getNumBuckets());
      addIfDifferent(diffs, "seed", b.getSeed(), a.getSeed());
      for (String diff : diffs) {
        mismatches.add("hash level " + i + " " + diff);
      }
    }
    addIfDifferent(mismatches, "range column ids",
        before.getRangeSchema().getColumnIds(), after.getRangeSchema().getColumnIds());
    return mismatches;
  }

  private static void addIfDifferent(List<String> diffs, String what, Object before,
                                     Object after) {
    if (!Objects.equal(before, after)) {
      diffs.add(what + ": " + before + " != " + after);
    }
  }

  private static String render(Object value) {
    ValueKind kind = ValueKind.forValue(value);
    return kind == null ? String.valueOf(value) : kind.render(value);
  }
}
