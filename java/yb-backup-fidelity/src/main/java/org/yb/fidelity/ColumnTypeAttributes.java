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

/**
 * Extra metadata a parameterized column type needs. Only decimals use it today.
 */
public class ColumnTypeAttributes {

  private final int precision;
  private final int scale;

  private ColumnTypeAttributes(int precision, int scale) {
    this.precision = precision;
    this.scale = scale;
  }

  /**
   * Return the precision for the column.
   */
  public int getPrecision() {
    return precision;
  }

  /**
   * Return the scale for the column.
   */
  public int getScale() {
    return scale;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ColumnTypeAttributes that = (ColumnTypeAttributes) o;
    return precision == that.precision && scale == that.scale;
  }

  @Override
  public int hashCode() {
    return 31 * precision + scale;
  }

  @Override
  public String toString() {
    return "(" + precision + ", " + scale + ")";
  }

  /**
   * Builder for ColumnTypeAttributes.
   */
  public static class ColumnTypeAttributesBuilder {
    private int precision = 0;
    private int scale = 0;

    public ColumnTypeAttributesBuilder precision(int precision) {
      this.precision = precision;
      return this;
    }

    public ColumnTypeAttributesBuilder scale(int scale) {
      this.scale = scale;
      return this;
    }

    public ColumnTypeAttributes build() {
      return new ColumnTypeAttributes(precision, scale);
    }
  }
}
