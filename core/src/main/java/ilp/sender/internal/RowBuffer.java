/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.internal;

import ilp.sender.BufferLimitException;
import ilp.sender.BufferMode;
import ilp.sender.InvalidTimestampException;
import ilp.sender.InvalidValueException;
import ilp.sender.LineSenderException;
import ilp.sender.ProtocolVersion;
import java.math.BigDecimal;
import java.math.MathContext;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Encodes rows in InfluxDB Line Protocol into a growable byte array.
 *
 * <p>Bytes in {@code [0, endOfLastRow)} are complete rows, ready to send. Bytes in
 * {@code [endOfLastRow, position)} belong to the row under construction.
 *
 * <p>Each call validates its input and reserves the exact number of bytes it will write before
 * writing anything. A call that throws leaves the buffer as it was.
 *
 * <p>With {@link ProtocolVersion#V2}, doubles are written in binary as {@code ==}, a type byte and
 * eight little-endian bytes, and double arrays can be written. Everything else is text in both
 * versions.
 *
 * <p>This type is not thread-safe.
 */
public final class RowBuffer {
  public static final int DEFAULT_INIT_BUF_SIZE = 64 * 1024;
  public static final int DEFAULT_MAX_BUF_SIZE = 100 * 1024 * 1024;
  public static final int DEFAULT_MAX_NAME_LEN = 127;
  /** Most dimensions the server accepts in an array. */
  public static final int MAX_ARRAY_DIMENSIONS = 32;

  static final byte ENTITY_TYPE_ARRAY = 14, ENTITY_TYPE_DOUBLE = 16;
  static final byte ARRAY_TYPE_DOUBLE = 10, ARRAY_TYPE_NULL = 33;

  final int maxBufferSize, maxNameLength;
  final BufferMode bufferMode;
  final ProtocolVersion protocolVersion;

  byte[] buffer;
  int position, endOfLastRow, rowCount;
  RowState state = RowState.EMPTY;

  public RowBuffer(int initBufferSize, int maxBufferSize, int maxNameLength,
    BufferMode bufferMode) {
    this(initBufferSize, maxBufferSize, maxNameLength, bufferMode, ProtocolVersion.V1);
  }

  public RowBuffer(int initBufferSize, int maxBufferSize, int maxNameLength,
    BufferMode bufferMode, ProtocolVersion protocolVersion) {
    if (initBufferSize < 1) {
      throw new IllegalArgumentException("initBufferSize < 1: " + initBufferSize);
    }
    if (maxBufferSize < initBufferSize) {
      throw new IllegalArgumentException(
        "maxBufferSize < initBufferSize: " + maxBufferSize + " < " + initBufferSize);
    }
    if (maxNameLength < 1) {
      throw new IllegalArgumentException("maxNameLength < 1: " + maxNameLength);
    }
    if (bufferMode == null) throw new NullPointerException("bufferMode == null");
    if (protocolVersion == null) throw new NullPointerException("protocolVersion == null");
    this.protocolVersion = protocolVersion;
    this.maxBufferSize = maxBufferSize;
    this.maxNameLength = maxNameLength;
    this.bufferMode = bufferMode;
    this.buffer = new byte[initBufferSize];
  }

  public RowBuffer table(String table) {
    RowState next = state.table();
    NameValidator.validateTableName(table, maxNameLength);
    ensureCapacity(escapedLength(table, false));
    writeEscaped(table, false);
    state = next;
    return this;
  }

  public RowBuffer symbol(String name, String value) {
    RowState next = state.symbol();
    NameValidator.validateColumnName(name, maxNameLength);
    if (value == null) throw new NullPointerException("value == null");
    ensureCapacity(2 + escapedLength(name, false) + escapedLength(value, false));
    writeByte(',');
    writeEscaped(name, false);
    writeByte('=');
    writeEscaped(value, false);
    state = next;
    return this;
  }

  public RowBuffer stringColumn(String name, String value) {
    if (value == null) throw new NullPointerException("value == null");
    for (int i = 0, length = value.length(); i < length; i++) {
      char ch = value.charAt(i);
      if (ch == '\n' || ch == '\r') {
        throw new InvalidValueException("String value of column '" + name
          + "' contains a line break, which can't be written in line protocol");
      }
    }
    beginColumn(name, 2 + escapedLength(value, true));
    writeByte('"');
    writeEscaped(value, true);
    writeByte('"');
    return this;
  }

  public RowBuffer boolColumn(String name, boolean value) {
    beginColumn(name, 1);
    writeByte(value ? 't' : 'f');
    return this;
  }

  public RowBuffer doubleColumn(String name, double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new InvalidValueException(
        "Value of column '" + name + "' has no line protocol representation: " + value);
    }
    if (protocolVersion != ProtocolVersion.V1) {
      beginColumn(name, 10);
      writeByte('=');
      writeByte(ENTITY_TYPE_DOUBLE);
      writeDoubleLE(value);
      return this;
    }
    String text = shortestDecimal(value);
    beginColumn(name, text.length());
    writeAscii(text);
    return this;
  }

  /** Writes a one-dimensional array. A null array is written as a null value. */
  public RowBuffer arrayColumn(String name, double[] values) {
    return arrayColumn(name, values != null ? new int[] {values.length} : null, values);
  }

  /**
   * Writes a two-dimensional array. A null array is written as a null value.
   *
   * @throws InvalidValueException if the rows have different lengths
   */
  public RowBuffer arrayColumn(String name, double[][] values) {
    if (values == null) return arrayColumn(name, null, null);
    int columns = values.length == 0 ? 0 : checkRow(name, values[0]).length;
    double[] flat = new double[Math.multiplyExact(values.length, columns)];
    for (int i = 0; i < values.length; i++) {
      double[] row = checkRow(name, values[i]);
      if (row.length != columns) {
        throw new InvalidValueException("Array of column '" + name
          + "' is irregular: row " + i + " has " + row.length + " elements, expected " + columns);
      }
      System.arraycopy(row, 0, flat, i * columns, columns);
    }
    return arrayColumn(name, new int[] {values.length, columns}, flat);
  }

  static double[] checkRow(String name, double[] row) {
    if (row == null) {
      throw new InvalidValueException("Array of column '" + name + "' has a null row");
    }
    return row;
  }

  /**
   * Writes an array of any number of dimensions, from its shape and its values in row-major order.
   * Null values are written as a null array.
   *
   * @throws InvalidValueException if the shape doesn't match the values, or has more than
   * {@value #MAX_ARRAY_DIMENSIONS} dimensions
   * @throws LineSenderException if the protocol version doesn't support arrays
   */
  public RowBuffer arrayColumn(String name, int[] shape, double[] values) {
    if (protocolVersion == ProtocolVersion.V1) {
      throw new LineSenderException(
        "Arrays of column '" + name + "' require protocol version 2, configured: 1");
    }
    if (values == null) {
      beginColumn(name, 3);
      writeByte('=');
      writeByte(ENTITY_TYPE_ARRAY);
      writeByte(ARRAY_TYPE_NULL);
      return this;
    }
    if (shape == null) throw new NullPointerException("shape == null");
    if (shape.length < 1 || shape.length > MAX_ARRAY_DIMENSIONS) {
      throw new InvalidValueException("Array of column '" + name + "' has " + shape.length
        + " dimensions, must be between 1 and " + MAX_ARRAY_DIMENSIONS);
    }
    long elements = 1;
    for (int dimension : shape) {
      if (dimension < 0) {
        throw new InvalidValueException(
          "Array of column '" + name + "' has a negative dimension: " + dimension);
      }
      elements *= dimension;
      if (elements > Integer.MAX_VALUE) break;
    }
    if (elements != values.length) {
      throw new InvalidValueException("Array of column '" + name + "' has " + values.length
        + " values, its shape needs " + elements);
    }
    for (double value : values) {
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new InvalidValueException(
          "Array of column '" + name + "' has a value with no line protocol representation: "
            + value);
      }
    }
    long length = 4L + 4L * shape.length + 8L * values.length;
    if (length > maxBufferSize) {
      throw new BufferLimitException(maxBufferSize, (int) Math.min(
        (long) position + length, Integer.MAX_VALUE));
    }
    beginColumn(name, (int) length);
    writeByte('=');
    writeByte(ENTITY_TYPE_ARRAY);
    writeByte(ARRAY_TYPE_DOUBLE);
    writeByte(shape.length);
    for (int dimension : shape) writeIntLE(dimension);
    for (double value : values) writeDoubleLE(value);
    return this;
  }

  public RowBuffer longColumn(String name, long value) {
    String text = Long.toString(value);
    beginColumn(name, text.length() + 1);
    writeAscii(text);
    writeByte('i');
    return this;
  }

  /** Writes a timestamp column, in microseconds, which is the server's timestamp resolution. */
  public RowBuffer timestampColumn(String name, long value, TimeUnit unit) {
    if (unit == null) throw new NullPointerException("unit == null");
    long micros = unit.toMicros(value);
    if (saturated(micros, unit, TimeUnit.MICROSECONDS)) {
      throw new InvalidValueException(
        "Timestamp of column '" + name + "' overflows microseconds: " + value + " " + unit);
    }
    String text = Long.toString(micros);
    beginColumn(name, text.length() + 1);
    writeAscii(text);
    writeByte('t');
    return this;
  }

  public RowBuffer timestampColumn(String name, Instant value) {
    if (value == null) throw new NullPointerException("value == null");
    long micros;
    try {
      micros = Math.addExact(Math.multiplyExact(value.getEpochSecond(), 1_000_000L),
        value.getNano() / 1000);
    } catch (ArithmeticException e) {
      throw new InvalidValueException(
        "Timestamp of column '" + name + "' overflows microseconds: " + value);
    }
    return timestampColumn(name, micros, TimeUnit.MICROSECONDS);
  }

  /** Closes the row with a designated timestamp, converted to nanoseconds. */
  public void at(long timestamp, TimeUnit unit) {
    if (unit == null) throw new NullPointerException("unit == null");
    RowState next = state.close();
    long nanos = unit.toNanos(timestamp);
    if (saturated(nanos, unit, TimeUnit.NANOSECONDS)) {
      throw new InvalidTimestampException(
        "Designated timestamp overflows nanoseconds: " + timestamp + " " + unit);
    }
    String text = Long.toString(nanos);
    NameValidator.validateDesignatedTimestamp(text);
    ensureCapacity(text.length() + 2);
    writeByte(' ');
    writeAscii(text);
    writeByte('\n');
    endRow(next);
  }

  public void at(Instant timestamp) {
    if (timestamp == null) throw new NullPointerException("timestamp == null");
    long nanos;
    try {
      nanos = Math.addExact(Math.multiplyExact(timestamp.getEpochSecond(), 1_000_000_000L),
        timestamp.getNano());
    } catch (ArithmeticException e) {
      throw new InvalidTimestampException(
        "Designated timestamp overflows nanoseconds: " + timestamp);
    }
    at(nanos, TimeUnit.NANOSECONDS);
  }

  /** Closes the row without a timestamp. The server assigns one on ingestion. */
  public void atNow() {
    RowState next = state.close();
    ensureCapacity(1);
    writeByte('\n');
    endRow(next);
  }

  /**
   * Reallocates the backing array. The array never shrinks below the bytes already written, so
   * this cannot truncate data.
   *
   * @throws BufferLimitException if {@code newSize} is larger than the maximum buffer size
   */
  public void resize(int newSize) {
    if (newSize > maxBufferSize) throw new BufferLimitException(maxBufferSize, newSize);
    if (newSize < 1) throw new IllegalArgumentException("newSize < 1: " + newSize);
    byte[] newBuffer = new byte[Math.max(newSize, position)];
    System.arraycopy(buffer, 0, newBuffer, 0, position);
    buffer = newBuffer;
  }

  /** Discards everything buffered, including a row under construction. */
  public void reset() {
    position = 0;
    endOfLastRow = 0;
    rowCount = 0;
    state = RowState.EMPTY;
  }

  /**
   * Returns complete rows to send, or null if there are none.
   *
   * <p>With {@link BufferMode#COPY_ON_FLUSH}, the result is a copy and complete rows are removed
   * from this buffer before returning. With {@link BufferMode#REUSE_IN_PLACE}, the result is a view
   * over this buffer: the caller must not write rows until it is done with it, and then must call
   * {@link #compact()}.
   */
  public ByteBuffer toSendable() {
    if (endOfLastRow == 0) return null;
    if (bufferMode == BufferMode.REUSE_IN_PLACE) {
      return ByteBuffer.wrap(buffer, 0, endOfLastRow).slice();
    }
    byte[] copy = new byte[endOfLastRow];
    System.arraycopy(buffer, 0, copy, 0, endOfLastRow);
    compact();
    return ByteBuffer.wrap(copy);
  }

  /** Removes complete rows, moving any row under construction to the start of the buffer. */
  public void compact() {
    if (endOfLastRow == 0) return;
    System.arraycopy(buffer, endOfLastRow, buffer, 0, position - endOfLastRow);
    position -= endOfLastRow;
    endOfLastRow = 0;
    rowCount = 0;
  }

  public BufferMode bufferMode() {
    return bufferMode;
  }

  public ProtocolVersion protocolVersion() {
    return protocolVersion;
  }

  public int position() {
    return position;
  }

  public int endOfLastRow() {
    return endOfLastRow;
  }

  /** Count of complete rows in {@code [0, endOfLastRow)}. */
  public int rowCount() {
    return rowCount;
  }

  public int capacity() {
    return buffer.length;
  }

  public int maxBufferSize() {
    return maxBufferSize;
  }

  public RowState state() {
    return state;
  }

  /** Returns the bytes written so far, including any incomplete row. */
  public byte[] toByteArray() {
    byte[] result = new byte[position];
    System.arraycopy(buffer, 0, result, 0, position);
    return result;
  }

  void beginColumn(String name, int valueLength) {
    RowState next = state.column();
    NameValidator.validateColumnName(name, maxNameLength);
    ensureCapacity(2 + escapedLength(name, false) + valueLength);
    writeByte(state.hasColumns() ? ',' : ' ');
    writeEscaped(name, false);
    writeByte('=');
    state = next;
  }

  void endRow(RowState next) {
    state = next;
    endOfLastRow = position;
    rowCount++;
  }

  void ensureCapacity(int length) {
    long required = (long) position + length;
    if (required <= buffer.length) return;
    if (required > maxBufferSize) {
      throw new BufferLimitException(maxBufferSize, (int) Math.min(required, Integer.MAX_VALUE));
    }
    long doubled = Math.max((long) buffer.length * 2, required);
    resize((int) Math.min(doubled, maxBufferSize));
  }

  /**
   * Returns the shortest decimal that parses back to the same double, in the format of {@link
   * Double#toString(double)}. Before JDK 19, that method sometimes writes an extra digit.
   */
  static String shortestDecimal(double value) {
    String text = Double.toString(value);
    if (value == 0) return text;
    int digits = significantDigits(text);
    BigDecimal exact = new BigDecimal(value);
    for (int precision = 1; precision < digits; precision++) {
      BigDecimal rounded = exact.round(new MathContext(precision));
      if (rounded.doubleValue() == value) return format(rounded.stripTrailingZeros(), value);
    }
    return text;
  }

  /** Counts the digits of the mantissa, without leading or trailing zeros. */
  static int significantDigits(String text) {
    int end = text.indexOf('E');
    if (end < 0) end = text.length();
    int first = -1, last = -1;
    for (int i = 0; i < end; i++) {
      char ch = text.charAt(i);
      if (ch >= '1' && ch <= '9') {
        if (first == -1) first = i;
        last = i;
      }
    }
    if (first == -1) return 1;
    int result = last - first + 1;
    int dot = text.indexOf('.');
    if (dot > first && dot < last) result--;
    return result;
  }

  /** Plain notation between 10^-3 and 10^7, otherwise computerized scientific notation. */
  static String format(BigDecimal decimal, double value) {
    double abs = Math.abs(value);
    if (abs >= 1e-3 && abs < 1e7) {
      String plain = decimal.toPlainString();
      return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }
    String digits = decimal.unscaledValue().abs().toString();
    int exponent = digits.length() - 1 - decimal.scale();
    StringBuilder result = new StringBuilder(digits.length() + 8);
    if (decimal.signum() < 0) result.append('-');
    result.append(digits.charAt(0)).append('.');
    result.append(digits.length() > 1 ? digits.substring(1) : "0");
    return result.append('E').append(exponent).toString();
  }

  static boolean saturated(long converted, TimeUnit from, TimeUnit to) {
    if (from == to) return false;
    return converted == Long.MAX_VALUE || converted == Long.MIN_VALUE;
  }

  /** UTF-8 length of the value after escaping. */
  static int escapedLength(String value, boolean quoted) {
    int result = 0;
    for (int i = 0, length = value.length(); i < length; i++) {
      char ch = value.charAt(i);
      if (needsEscape(ch, quoted)) {
        result += 2;
      } else if (ch < 0x80) {
        result++;
      } else if (ch < 0x800) {
        result += 2;
      } else if (Character.isHighSurrogate(ch) && i + 1 < length
        && Character.isLowSurrogate(value.charAt(i + 1))) {
        result += 4;
        i++;
      } else if (Character.isSurrogate(ch)) {
        result++; // malformed, written as '?'
      } else {
        result += 3;
      }
    }
    return result;
  }

  static boolean needsEscape(char ch, boolean quoted) {
    switch (ch) {
      case '\\':
        return true;
      case '"':
        return quoted;
      case ' ':
      case ',':
      case '=':
      case '\n':
      case '\r':
        return !quoted;
      default:
        return false;
    }
  }

  void writeEscaped(String value, boolean quoted) {
    for (int i = 0, length = value.length(); i < length; i++) {
      char ch = value.charAt(i);
      if (needsEscape(ch, quoted)) {
        writeByte('\\');
        writeByte(ch);
      } else if (ch < 0x80) {
        writeByte(ch);
      } else if (ch < 0x800) {
        buffer[position++] = (byte) (0xc0 | (ch >> 6));
        buffer[position++] = (byte) (0x80 | (ch & 0x3f));
      } else if (Character.isHighSurrogate(ch) && i + 1 < length
        && Character.isLowSurrogate(value.charAt(i + 1))) {
        int codePoint = Character.toCodePoint(ch, value.charAt(++i));
        buffer[position++] = (byte) (0xf0 | (codePoint >> 18));
        buffer[position++] = (byte) (0x80 | ((codePoint >> 12) & 0x3f));
        buffer[position++] = (byte) (0x80 | ((codePoint >> 6) & 0x3f));
        buffer[position++] = (byte) (0x80 | (codePoint & 0x3f));
      } else if (Character.isSurrogate(ch)) {
        writeByte('?');
      } else {
        buffer[position++] = (byte) (0xe0 | (ch >> 12));
        buffer[position++] = (byte) (0x80 | ((ch >> 6) & 0x3f));
        buffer[position++] = (byte) (0x80 | (ch & 0x3f));
      }
    }
  }

  void writeAscii(String value) {
    for (int i = 0, length = value.length(); i < length; i++) {
      buffer[position++] = (byte) value.charAt(i);
    }
  }

  void writeByte(int b) {
    buffer[position++] = (byte) b;
  }

  void writeIntLE(int value) {
    for (int i = 0; i < 4; i++) buffer[position++] = (byte) (value >>> (8 * i));
  }

  void writeDoubleLE(double value) {
    long bits = Double.doubleToRawLongBits(value);
    for (int i = 0; i < 8; i++) buffer[position++] = (byte) (bits >>> (8 * i));
  }

  @Override public String toString() {
    return "RowBuffer{position=" + position + ", endOfLastRow=" + endOfLastRow
      + ", capacity=" + buffer.length + ", mode=" + bufferMode + ", version=" + protocolVersion
      + "}";
  }
}
