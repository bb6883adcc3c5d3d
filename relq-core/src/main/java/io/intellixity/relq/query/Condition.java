package io.intellixity.relq.query;

import java.util.*;

/**
 * Filter leaf: {@code property operator value}.
 * <p>
 * {@code property} is a field of the scope entity or a dot path ({@code testEntity.stringType}) whose
 * leading segments are relations. {@link Operator#RANGE} carries its bounds in {@code lower}/{@code upper}.
 */
public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;
  private final Object lower;
  private final Object upper;
  private final boolean not;

  public Condition(String property, Operator operator, Object value, Object lower, Object upper, boolean not) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.lower = lower;
    this.upper = upper;
    this.not = not;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public Object lower() { return lower; }
  public Object upper() { return upper; }
  public boolean not() { return not; }

  public Condition negate() {
    return new Condition(property, operator, value, lower, upper, !not);
  }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value, null, null, false);
  }

  public static Condition range(String property, Object lower, Object upper) {
    return new Condition(property, Operator.RANGE, null, lower, upper, false);
  }

  @Override
  public String toString() {
    return "Condition{" + property + " " + operator.key() + " " +
        (operator == Operator.RANGE ? "[" + lower + ", " + upper + "]" : value) + (not ? ", not" : "") + "}";
  }
}
