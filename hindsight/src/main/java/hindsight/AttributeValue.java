/*
 * Copyright The Hindsight Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package hindsight;

/**
 * A typed attribute value: one of string, long, double or boolean.
 *
 * <p>Typed accessors throw {@link IllegalStateException} when called on the wrong type. Use {@link
 * #type()} first when the type isn't known.
 */
// @Immutable
public final class AttributeValue {
  public enum Type {
    STRING,
    LONG,
    DOUBLE,
    BOOLEAN
  }

  static final AttributeValue TRUE = new AttributeValue(Type.BOOLEAN, Boolean.TRUE);
  static final AttributeValue FALSE = new AttributeValue(Type.BOOLEAN, Boolean.FALSE);

  public static AttributeValue of(String value) {
    if (value == null) throw new NullPointerException("value == null");
    return new AttributeValue(Type.STRING, value);
  }

  public static AttributeValue of(long value) {
    return new AttributeValue(Type.LONG, value);
  }

  public static AttributeValue of(double value) {
    return new AttributeValue(Type.DOUBLE, value);
  }

  public static AttributeValue of(boolean value) {
    return value ? TRUE : FALSE;
  }

  final Type type;
  final Object value;

  AttributeValue(Type type, Object value) {
    this.type = type;
    this.value = value;
  }

  public Type type() {
    return type;
  }

  public String stringValue() {
    return (String) as(Type.STRING);
  }

  public long longValue() {
    return (Long) as(Type.LONG);
  }

  public double doubleValue() {
    return (Double) as(Type.DOUBLE);
  }

  public boolean booleanValue() {
    return (Boolean) as(Type.BOOLEAN);
  }

  Object as(Type expected) {
    if (type != expected) throw new IllegalStateException(type + " != " + expected);
    return value;
  }

  @Override public String toString() {
    return String.valueOf(value);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof AttributeValue)) return false;
    AttributeValue that = (AttributeValue) o;
    return type == that.type && value.equals(that.value);
  }

  @Override public int hashCode() {
    return type.hashCode() * 1000003 ^ value.hashCode();
  }
}
