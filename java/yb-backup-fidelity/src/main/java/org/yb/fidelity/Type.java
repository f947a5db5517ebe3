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
import org.yb.fidelity.ColumnSchema.Encoding;

import java.util.List;

/**
 * Describes all the types available to build table schemas.
 *
 * Key eligibility and the block encodings the storage engine accepts are fixed on each
 * constant.
 */
public enum Type {

  INT8 ("int8", ValueKind.INT8, true, EncodingSets.INTEGER),
  INT16 ("int16", ValueKind.INT16, true, EncodingSets.INTEGER),
  INT32 ("int32", ValueKind.INT32, true, EncodingSets.INTEGER),
  INT64 ("int64", ValueKind.INT64, true, EncodingSets.INTEGER),
  UNIXTIME_MICROS ("unixtime_micros", ValueKind.INT64, true, EncodingSets.INTEGER),
  FLOAT ("float", ValueKind.FLOAT, false, EncodingSets.FLOATING),
  DOUBLE ("double", ValueKind.DOUBLE, false, EncodingSets.FLOATING),
  DECIMAL ("decimal", ValueKind.DECIMAL, true, EncodingSets.FLOATING),
  STRING ("string", ValueKind.STRING, true, EncodingSets.BINARY),
  BINARY ("binary", ValueKind.BINARY, true, EncodingSets.BINARY),
  BOOL ("bool", ValueKind.BOOL, false, EncodingSets.BOOLEAN);

  private final String name;
  private final ValueKind valueKind;
  private final boolean keyType;
  private final List<Encoding> encodings;

  Type(String name, ValueKind valueKind, boolean keyType, List<Encoding> encodings) {
    this.name = name;
    this.valueKind = valueKind;
    this.keyType = keyType;
    this.encodings = encodings;
  }

  /**
   * Get the string representation of this type
   * @return The type's name
   */
  public String getName() {
    return this.name;
  }

  /**
   * @return the Java representation of values of this type
   */
  public ValueKind getValueKind() {
    return valueKind;
  }

  /**
   * Whether values of this type have a total order the storage engine can sort and partition
   * by. Booleans and floating point types are excluded.
   */
  public boolean isKeyType() {
    return keyType;
  }

  /**
   * @return the block encodings the storage engine accepts for this type
   */
  public List<Encoding> getValidEncodings() {
    return encodings;
  }

  public boolean isValidEncoding(Encoding encoding) {
    return encodings.contains(encoding);
  }

  /**
   * @return every type that may be used for a primary key column
   */
  public static List<Type> keyTypes() {
    ImmutableList.Builder<Type> builder = ImmutableList.builder();
    for (Type type : values()) {
      if (type.isKeyType()) {
        builder.add(type);
      }
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return "Type: " + this.name;
  }

  private static final class EncodingSets {
    static final List<Encoding> INTEGER = ImmutableList.of(
        Encoding.AUTO_ENCODING, Encoding.PLAIN_ENCODING, Encoding.BIT_SHUFFLE, Encoding.RLE);
    static final List<Encoding> FLOATING = ImmutableList.of(
        Encoding.AUTO_ENCODING, Encoding.PLAIN_ENCODING, Encoding.BIT_SHUFFLE);
    static final List<Encoding> BINARY = ImmutableList.of(
        Encoding.AUTO_ENCODING, Encoding.PLAIN_ENCODING, Encoding.PREFIX_ENCODING,
        Encoding.DICT_ENCODING);
    static final List<Encoding> BOOLEAN = ImmutableList.of(
        Encoding.AUTO_ENCODING, Encoding.PLAIN_ENCODING, Encoding.RLE);
  }
}
