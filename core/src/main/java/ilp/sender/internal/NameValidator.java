/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender.internal;

import ilp.sender.InvalidNameException;
import ilp.sender.InvalidTimestampException;

/**
 * Checks names and timestamps before anything is written, so that a rejected call never leaves
 * partial bytes in the buffer. The character rules match what the server accepts for table and
 * column names.
 */
public final class NameValidator {

  public static void validateTableName(String name, int maxNameLength) {
    if (name == null) throw new NullPointerException("table == null");
    int length = name.length();
    if (length > maxNameLength) {
      throw new InvalidNameException("Table name is too long, max length is " + maxNameLength);
    }
    if (length == 0) {
      throw new InvalidNameException("Empty string is not allowed as table name");
    }
    for (int i = 0; i < length; i++) {
      char ch = name.charAt(i);
      if (ch == '.') {
        // only a single dot, and only in the middle: leading dots hide files, trailing ones get
        // trimmed by some file systems
        if (i == 0 || i == length - 1 || name.charAt(i - 1) == '.') {
          throw new InvalidNameException(
            "Table name cannot start or end with a dot, and only a single dot allowed");
        }
      } else if (isIllegalInNames(ch)) {
        throw new InvalidNameException("Invalid character in table name: " + printable(ch));
      }
    }
  }

  public static void validateColumnName(String name, int maxNameLength) {
    if (name == null) throw new NullPointerException("name == null");
    int length = name.length();
    if (length > maxNameLength) {
      throw new InvalidNameException("Column name is too long, max length is " + maxNameLength);
    }
    if (length == 0) {
      throw new InvalidNameException("Empty string is not allowed as column name");
    }
    for (int i = 0; i < length; i++) {
      char ch = name.charAt(i);
      switch (ch) {
        case '.':
        case '-':
        case '=':
          throw new InvalidNameException("Invalid character in column name: " + ch);
        default:
          if (isIllegalInNames(ch)) {
            throw new InvalidNameException("Invalid character in column name: " + printable(ch));
          }
      }
    }
  }

  /** The designated timestamp is written without a suffix, so it must be plain digits. */
  public static void validateDesignatedTimestamp(CharSequence text) {
    int length = text.length();
    if (length == 0) throw new InvalidTimestampException("Designated timestamp is empty");
    for (int i = 0; i < length; i++) {
      char ch = text.charAt(i);
      if (ch < '0' || ch > '9') {
        throw new InvalidTimestampException(
          "Designated timestamp must be a non-negative integer, received " + text);
      }
    }
  }

  static boolean isIllegalInNames(char ch) {
    switch (ch) {
      case '?':
      case ',':
      case '\'':
      case '"':
      case '\\':
      case '/':
      case ':':
      case ')':
      case '(':
      case '+':
      case '*':
      case '%':
      case '~':
      case '\u007f':
      case '\ufeff': // byte order mark
        return true;
      default:
        return ch <= '\u000f';
    }
  }

  static String printable(char ch) {
    if (ch < 0x20 || ch == 0x7f || ch == '\ufeff') {
      return String.format("\\u%04x", (int) ch);
    }
    return String.valueOf(ch);
  }

  NameValidator() {
  }
}
