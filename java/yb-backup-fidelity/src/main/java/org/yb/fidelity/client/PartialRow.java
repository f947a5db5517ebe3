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

import com.google.common.base.Preconditions;
import org.yb.fidelity.ColumnSchema;
import org.yb.fidelity.Schema;
import org.yb.fidelity.Type;
import org.yb.fidelity.util.DecimalUtil;

import java.math.BigDecimal;
import java.util.BitSet;

/**
 * Class used to represent parts of a row along with its schema.<p>
 *
 * Each column is in one of three states: not set (the server applies the column default),
 * set to null, or set to a value. Values can be replaced as often as needed, but once the
 * enclosing {@link Operation} is applied then they cannot be changed again. This means that a
 * PartialRow cannot be reused.<p>
 *
 * This class isn't thread-safe.
 */
public class PartialRow {

  private final Schema schema;
  private final Object[] values;
  private final BitSet columnsBitSet;
  private final BitSet nullsBitSet;

  private boolean frozen = false;

  /**
   * This is not a stable API, prefer using {@link Schema#newPartialRow()}
   * to create a new partial row.
   * @param schema the schema to use for this row
   */
  public PartialRow(Schema schema) {
    this.schema = schema;
    this.values = new Object[schema.getColumnCount()];
    this.columnsBitSet = new BitSet(schema.getColumnCount());
    this.nullsBitSet = new BitSet(schema.getColumnCount());
  }

  /**
   * Creates a new partial row by deep-copying the data-fields of the provided partial row.
   * The copy is not frozen.
   * @param row the partial row to copy
   */
  public PartialRow(PartialRow row) {
    this.schema = row.schema;
    this.values = new Object[row.values.length];
    for (int i = 0; i < values.length; i++) {
      Object value = row.values[i];
      this.values[i] = value instanceof byte[] ? ((byte[]) value).clone() : value;
    }
    this.columnsBitSet = (BitSet) row.columnsBitSet.clone();
    this.nullsBitSet = (BitSet) row.nullsBitSet.clone();
  }

  public void addBoolean(int columnIndex, boolean val) {
    addObject(columnIndex, val);
  }

  public void addBoolean(String columnName, boolean val) {
    addBoolean(schema.getColumnIndex(columnName), val);
  }

  public void addByte(int columnIndex, byte val) {
    addObject(columnIndex, val);
  }

  public void addByte(String columnName, byte val) {
    addByte(schema.getColumnIndex(columnName), val);
  }

  public void addShort(int columnIndex, short val) {
    addObject(columnIndex, val);
  }

  public void addShort(String columnName, short val) {
    addShort(schema.getColumnIndex(columnName), val);
  }

  public void addInt(int columnIndex, int val) {
    addObject(columnIndex, val);
  }

  public void addInt(String columnName, int val) {
    addInt(schema.getColumnIndex(columnName), val);
  }

  /**
   * Add a long for the specified column. Used for both int64 and unixtime_micros columns.
   */
  public void addLong(int columnIndex, long val) {
    addObject(columnIndex, val);
  }

  public void addLong(String columnName, long val) {
    addLong(schema.getColumnIndex(columnName), val);
  }

  public void addFloat(int columnIndex, float val) {
    addObject(columnIndex, val);
  }

  public void addFloat(String columnName, float val) {
    addFloat(schema.getColumnIndex(columnName), val);
  }

  public void addDouble(int columnIndex, double val) {
    addObject(columnIndex, val);
  }

  public void addDouble(String columnName, double val) {
    addDouble(schema.getColumnIndex(columnName), val);
  }

  public void addDecimal(int columnIndex, BigDecimal val) {
    addObject(columnIndex, val);
  }

  public void addDecimal(String columnName, BigDecimal val) {
    addDecimal(schema.getColumnIndex(columnName), val);
  }

  public void addString(int columnIndex, String val) {
    addObject(columnIndex, val);
  }

  public void addString(String columnName, String val) {
    addString(schema.getColumnIndex(columnName), val);
  }

  /**
   * Add binary data for the specified column. The array is copied.
   */
  public void addBinary(int columnIndex, byte[] val) {
    addObject(columnIndex, val == null ? null : val.clone());
  }

  public void addBinary(String columnName, byte[] val) {
    addBinary(schema.getColumnIndex(columnName), val);
  }

  /**
   * Sets a value of any supported type. The runtime class of {@code val} must match the
   * column's {@link org.yb.fidelity.ValueKind}; a null value is the same as
   * {@link #setNull(int)}.
   */
  public void addObject(int columnIndex, Object val) {
    checkNotFrozen();
    if (val == null) {
      setNull(columnIndex);
      return;
    }
    ColumnSchema column = schema.getColumnByIndex(columnIndex);
    Preconditions.checkArgument(column.getType().getValueKind().accepts(val),
        "Value %s of class %s does not match column %s", val, val.getClass().getSimpleName(),
        column);
    if (column.getType() == Type.DECIMAL) {
      Preconditions.checkArgument(
          DecimalUtil.fits((BigDecimal) val, column.getTypeAttributes()),
          "Decimal %s does not fit column %s", val, column);
    }
    values[columnIndex] = val;
    columnsBitSet.set(columnIndex);
    nullsBitSet.clear(columnIndex);
  }

  /**
   * Set the specified column to null
   * @param columnIndex the column's index in the schema
   * @throws IllegalArgumentException if the column doesn't exist or cannot be set to null
   */
  public void setNull(int columnIndex) {
    checkNotFrozen();
    ColumnSchema column = schema.getColumnByIndex(columnIndex);
    Preconditions.checkArgument(column.isNullable(), "%s cannot be set to null", column.getName());
    values[columnIndex] = null;
    columnsBitSet.set(columnIndex);
    nullsBitSet.set(columnIndex);
  }

  public void setNull(String columnName) {
    setNull(schema.getColumnIndex(columnName));
  }

  /**
   * @return true if the column was set, to a value or to null
   */
  public boolean isSet(int columnIndex) {
    return columnsBitSet.get(columnIndex);
  }

  public boolean isSet(String columnName) {
    return isSet(schema.getColumnIndex(columnName));
  }

  /**
   * @return true if the column was explicitly set to null
   */
  public boolean isNull(int columnIndex) {
    return nullsBitSet.get(columnIndex);
  }

  public boolean isNull(String columnName) {
    return isNull(schema.getColumnIndex(columnName));
  }

  /**
   * @return the value of the column, or null if it is unset or null
   */
  public Object getObject(int columnIndex) {
    return values[columnIndex];
  }

  public Object getObject(String columnName) {
    return getObject(schema.getColumnIndex(columnName));
  }

  /**
   * @return true if every primary key column has a non-null value
   */
  public boolean hasAllKeyColumns() {
    for (int i = 0; i < schema.getColumnCount(); i++) {
      if (schema.getColumnByIndex(i).isKey() && (!isSet(i) || isNull(i))) {
        return false;
      }
    }
    return true;
  }

  public Schema getSchema() {
    return schema;
  }

  /**
   * Transforms the row key into a string representation where each column is in the format:
   * "type col_name=value".
   */
  public String stringifyRowKey() {
    StringBuilder sb = new StringBuilder();
    sb.append("(");
    boolean first = true;
    for (int i = 0; i < schema.getColumnCount(); i++) {
      if (!schema.getColumnByIndex(i).isKey()) {
        continue;
      }
      if (!first) {
        sb.append(", ");
      }
      appendCell(sb, i);
      first = false;
    }
    sb.append(")");
    return sb.toString();
  }

  /**
   * Renders every set column as "type col_name=value", unset columns are skipped.
   */
  public String rowToString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < schema.getColumnCount(); i++) {
      if (!isSet(i)) {
        continue;
      }
      if (sb.length() > 0) {
        sb.append(", ");
      }
      appendCell(sb, i);
    }
    return sb.toString();
  }

  private void appendCell(StringBuilder sb, int i) {
    ColumnSchema col = schema.getColumnByIndex(i);
    sb.append(col.getType().getName());
    sb.append(" ");
    sb.append(col.getName());
    sb.append("=");
    if (!isSet(i)) {
      sb.append("<unset>");
    } else if (isNull(i)) {
      sb.append("NULL");
    } else {
      sb.append(col.getType().getValueKind().render(values[i]));
    }
  }

  void freeze() {
    this.frozen = true;
  }

  boolean isFrozen() {
    return frozen;
  }

  private void checkNotFrozen() {
    if (frozen) {
      throw new IllegalStateException("This row was already applied and cannot be modified.");
    }
  }

  @Override
  public String toString() {
    return "PartialRow(" + rowToString() + ")";
  }
}
