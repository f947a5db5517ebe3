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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The outcome of comparing a table with its restored copy. Holds the verdict of every check
 * together with one line per difference found, so that a failing random run can be diagnosed
 * without running it again.
 */
public class VerificationReport {
  private final String sourceTable;
  private final String restoredTable;
  private final boolean schemasMatch;
  private final List<String> schemaMismatches;
  private final boolean partitionSchemasMatch;
  private final List<String> partitionSchemaMismatches;
  private final int sourceReplicas;
  private final int restoredReplicas;
  private final long sourceRowCount;
  private final long restoredRowCount;
  private final List<String> rowMismatches;

  private VerificationReport(Builder builder) {
    this.sourceTable = builder.sourceTable;
    this.restoredTable = builder.restoredTable;
    this.schemasMatch = builder.schemasMatch;
    this.schemaMismatches = ImmutableList.copyOf(builder.schemaMismatches);
    this.partitionSchemasMatch = builder.partitionSchemasMatch;
    this.partitionSchemaMismatches = ImmutableList.copyOf(builder.partitionSchemaMismatches);
    this.sourceReplicas = builder.sourceReplicas;
    this.restoredReplicas = builder.restoredReplicas;
    this.sourceRowCount = builder.sourceRowCount;
    this.restoredRowCount = builder.restoredRowCount;
    this.rowMismatches = ImmutableList.copyOf(builder.rowMismatches);
  }

  public String getSourceTable() {
    return sourceTable;
  }

  public String getRestoredTable() {
    return restoredTable;
  }

  public boolean schemasMatch() {
    return schemasMatch;
  }

  public List<String> getSchemaMismatches() {
    return schemaMismatches;
  }

  public boolean partitionSchemasMatch() {
    return partitionSchemasMatch;
  }

  public List<String> getPartitionSchemaMismatches() {
    return partitionSchemaMismatches;
  }

  public int getSourceReplicas() {
    return sourceReplicas;
  }

  public int getRestoredReplicas() {
    return restoredReplicas;
  }

  public boolean replicasMatch() {
    return sourceReplicas == restoredReplicas;
  }

  public long getSourceRowCount() {
    return sourceRowCount;
  }

  public long getRestoredRowCount() {
    return restoredRowCount;
  }

  public boolean rowCountsMatch() {
    return sourceRowCount == restoredRowCount;
  }

  /**
   * @return differences in row contents; always empty when row contents were not compared
   */
  public List<String> getRowMismatches() {
    return rowMismatches;
  }

  public boolean isFaithful() {
    return schemasMatch && partitionSchemasMatch && replicasMatch() && rowCountsMatch() &&
        rowMismatches.isEmpty();
  }

  /**
   * Every difference found, one per line.
   */
  public List<String> getMismatches() {
    ImmutableList.Builder<String> all = ImmutableList.builder();
    if (!schemasMatch && schemaMismatches.isEmpty()) {
      all.add("schemas differ");
    }
    all.addAll(schemaMismatches);
    if (!partitionSchemasMatch && partitionSchemaMismatches.isEmpty()) {
      all.add("partition schemas differ");
    }
    all.addAll(partitionSchemaMismatches);
    if (!replicasMatch()) {
      all.add("replicas: " + sourceReplicas + " != " + restoredReplicas);
    }
    if (!rowCountsMatch()) {
      all.add("row count: " + sourceRowCount + " != " + restoredRowCount);
    }
    all.addAll(rowMismatches);
    return all.build();
  }

  /**
   * @throws AssertionError listing every difference if the restored table is not a faithful
   * copy of the source table
   */
  public void assertFaithful() {
    if (!isFaithful()) {
      throw new AssertionError("Table " + restoredTable + " is not a faithful restore of " +
          sourceTable + ":\n  " + Joiner.on("\n  ").join(getMismatches()));
    }
  }

  @Override
  public String toString() {
    return "VerificationReport(" + sourceTable + " -> " + restoredTable +
        ", faithful=" + isFaithful() +
        ", rows=" + sourceRowCount + "/" + restoredRowCount +
        ", replicas=" + sourceReplicas + "/" + restoredReplicas + ")";
  }

  static class Builder {
    private final String sourceTable;
    private final String restoredTable;
    private boolean schemasMatch;
    private List<String> schemaMismatches = ImmutableList.of();
    private boolean partitionSchemasMatch;
    private List<String> partitionSchemaMismatches = ImmutableList.of();
    private int sourceReplicas;
    private int restoredReplicas;
    private long sourceRowCount;
    private long restoredRowCount;
    private List<String> rowMismatches = ImmutableList.of();

    Builder(String sourceTable, String restoredTable) {
      this.sourceTable = sourceTable;
      this.restoredTable = restoredTable;
    }

    Builder schemas(boolean match, List<String> mismatches) {
      this.schemasMatch = match;
      this.schemaMismatches = mismatches;
      return this;
    }

    Builder partitionSchemas(boolean match, List<String> mismatches) {
      this.partitionSchemasMatch = match;
      this.partitionSchemaMismatches = mismatches;
      return this;
    }

    Builder replicas(int source, int restored) {
      this.sourceReplicas = source;
      this.restoredReplicas = restored;
      return this;
    }

    Builder rowCounts(long source, long restored) {
      this.sourceRowCount = source;
      this.restoredRowCount = restored;
      return this;
    }

    Builder rowMismatches(List<String> mismatches) {
      this.rowMismatches = mismatches;
      return this;
    }

    VerificationReport build() {
      return new VerificationReport(this);
    }
  }
}
