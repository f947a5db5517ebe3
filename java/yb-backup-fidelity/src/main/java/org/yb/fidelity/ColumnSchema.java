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

import com.google.common.base.Preconditions;

/**
 * Represents a table column. Use {@link ColumnSchema.ColumnSchemaBuilder} in order to
 * create columns.
 *
 * {@link #equals(Object)} only looks at name, type and key membership. Use
 * {@link org.yb.fidelity.verifier.SchemaVerifier#columnsMatch} to compare every attribute.
 */
public class ColumnSchema {

  private final Integer id;
  private final String name;
  private final Type type;
  private final boolean key;
  private final boolean nullable;
  private final Object defaultValue;
  private final int desiredBlockSize;
  private final Encoding encoding;
  private final CompressionAlgorithm compressionAlgorithm;
  private final ColumnTypeAttributes typeAttributes;

  /**
   * Specifies the encoding of data for a column on disk.
   * Not all encodings are available for all data types, see {@link Type#getValidEncodings()}.
   */
  public enum Encoding {
    UNKNOWN,
    AUTO_ENCODING,
    PLAIN_ENCODING,
    PREFIX_ENCODING,
    GROUP_VARINT,
    RLE,
    DICT_ENCODING,
    BIT_SHUFFLE
  }

  /**
   * Specifies the compression algorithm of data for a column on disk.
   */
  public enum CompressionAlgorithm {
    UNKNOWN,
    DEFAULT_COMPRESSION,
    NO_COMPRESSION,
    SNAPPY,
    LZ4,
    ZLIB
  }

  private ColumnSchema(Integer id, String name, Type type, boolean key, boolean nullable,
                       Object defaultValue, int desiredBlockSize, Encoding encoding,
                       CompressionAlgorithm compressionAlgorithm,
                       ColumnTypeAttributes typeAttributes) {
    this.id = id;
    this.name = name;
    this.type = type;
    this.key = key;
    this.nullable = nullable;
    this.defaultValue = defaultValue;
    this.desiredBlockSize = desiredBlockSize;
    this.encoding = encoding;
    this.compressionAlgorithm = compressionAlgorithm;
    this.typeAttributes = typeAttributes;
  }

  /**
   * @return the id the cluster assigned to this column, or null for a column that was never
   * part of a created table
   */
  public Integer getId() {
    return id;
  }

  /**
   * Get the column's Type
   * @return the type
   */
  public Type getType() {
    return type;
  }

  /**
   * Get the column's name
   * @return A string representation of the name
   */
  public String getName() {
    return name;
  }

  /**
   * Answers if the column part of the key
   * @return true if the column is part of the key, else false
   */
  public boolean isKey() {
    return key;
  }

  /**
   * Answers if the column can be set to null
   * @return true if it can be set to null, else false
   */
  public boolean isNullable() {
    return nullable;
  }

  /**
   * The Java object representation of the default value that's read
   * @return the default read value
   */
  public Object getDefaultValue() {
    return defaultValue;
  }

  /**
   * Gets the desired block size for this column.
   * If no block size has been explicitly specified for this column,
   * returns 0 to indicate that the server-side default will be used.
   *
   * @return the block size, in bytes, or 0 if none has been configured.
   */
  public int getDesiredBlockSize() {
    return desiredBlockSize;
  }

  /**
   * Return the encoding of this column, or null if it is not known.
   */
  public Encoding getEncoding() {
    return encoding;
  }

  /**
   * Return the compression algorithm of this column, or null if it is not known.
   */
  public CompressionAlgorithm getCompressionAlgorithm() {
    return compressionAlgorithm;
  }

  /**
   * Return the type attributes of the column, or null for non-parameterized types.
   */
  public ColumnTypeAttributes getTypeAttributes() {
    return typeAttributes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ColumnSchema that = (ColumnSchema) o;

    if (key != that.key) return false;
    if (!name.equals(that.name)) return false;
    if (!type.equals(that.type)) return false;

    return true;
  }

  @Override
  public int hashCode() {
    int result = name.hashCode();
    result = 31 * result + type.hashCode();
    result = 31 * result + (key ? 1 : 0);
    return result;
  }

  @Override
  public String toString() {
    return "Column name: " + name + ", type: " + type.getName() +
        (typeAttributes == null ? "" : typeAttributes.toString());
  }

  /**
   * Builder for ColumnSchema.
   */
  public static class ColumnSchemaBuilder {
    private final String name;
    private final Type type;
    private Integer id = null;
    private boolean key = false;
    private boolean nullable = false;
    private Object defaultValue = null;
    private int blockSize = 0;
    private Encoding encoding = null;
    private CompressionAlgorithm compressionAlgorithm = null;
    private ColumnTypeAttributes typeAttributes = null;

    /**
     * Constructor for the required parameters.
     * @param name column's name
     * @param type column's type
     */
    public ColumnSchemaBuilder(String name, Type type) {
      this.name = Preconditions.checkNotNull(name);
      this.type = Preconditions.checkNotNull(type);
    }

    /**
     * Constructor that copies every attribute of an existing column, so that a single
     * attribute can then be overridden.
     * @param that the column to copy
     */
    public ColumnSchemaBuilder(ColumnSchema that) {
      this(that.name, that.type);
      this.id = that.id;
      this.key = that.key;
      this.nullable = that.nullable;
      this.defaultValue = that.defaultValue;
      this.blockSize = that.desiredBlockSize;
      this.encoding = that.encoding;
      this.compressionAlgorithm = that.compressionAlgorithm;
      this.typeAttributes = that.typeAttributes;
    }

    /**
     * Sets the column id. Ids are assigned by the cluster when a table is created.
     */
    public ColumnSchemaBuilder id(Integer id) {
      this.id = id;
      return this;
    }

    /**
     * Sets if the column is part of the row key. False by default.
     * @param key a boolean that indicates if the column is part of the key
     * @return this instance
     */
    public ColumnSchemaBuilder key(boolean key) {
      this.key = key;
      return this;
    }

    /**
     * Marks the column as allowing null values. False by default.
     * @param nullable a boolean that indicates if the column allows null values
     * @return this instance
     */
    public ColumnSchemaBuilder nullable(boolean nullable) {
      this.nullable = nullable;
      return this;
    }

    /**
     * Sets the default value that will be read from the column. Null by default.
     * @param defaultValue a Java object representation of the default value that's read
     * @return this instance
     */
    public ColumnSchemaBuilder defaultValue(Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    /**
     * Set the desired block size for this column.
     *
     * This is the number of bytes of user data packed per block on disk, and
     * represents the unit of IO when reading this column. 0 means the server-side default.
     *
     * @param blockSize the desired block size, in bytes
     * @return this instance
     */
    public ColumnSchemaBuilder desiredBlockSize(int blockSize) {
      this.blockSize = blockSize;
      return this;
    }

    /**
     * Set the block encoding for this column.
     */
    public ColumnSchemaBuilder encoding(Encoding encoding) {
      this.encoding = encoding;
      return this;
    }

    /**
     * Set the compression algorithm for this column.
     */
    public ColumnSchemaBuilder compressionAlgorithm(CompressionAlgorithm compressionAlgorithm) {
      this.compressionAlgorithm = compressionAlgorithm;
      return this;
    }

    /**
     * Set the type attributes, required for decimal columns.
     */
    public ColumnSchemaBuilder typeAttributes(ColumnTypeAttributes typeAttributes) {
      this.typeAttributes = typeAttributes;
      return this;
    }

    /**
     * Builds a {@link ColumnSchema} using the passed parameters.
     * @return a new {@link ColumnSchema}
     */
    public ColumnSchema build() {
      if (key) {
        Preconditions.checkArgument(!nullable, "Key column %s cannot be nullable", name);
        Preconditions.checkArgument(defaultValue == null,
            "Key column %s cannot have a default value", name);
      }
      if (type == Type.DECIMAL) {
        Preconditions.checkArgument(typeAttributes != null,
            "Decimal column %s needs a precision and scale", name);
      } else {
        Preconditions.checkArgument(typeAttributes == null,
            "Type attributes are only allowed on decimal columns: %s", name);
      }
      if (defaultValue != null) {
        Preconditions.checkArgument(type.getValueKind().accepts(defaultValue),
            "Default value %s of column %s is not a %s", defaultValue, name,
            type.getValueKind().getJavaClass().getSimpleName());
      }
      return new ColumnSchema(id, name, type,
                              key, nullable, defaultValue,
                              blockSize, encoding, compressionAlgorithm, typeAttributes);
    }
  }
}
