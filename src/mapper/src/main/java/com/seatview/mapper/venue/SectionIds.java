package com.seatview.mapper.venue;

import java.math.BigInteger;
import java.util.Comparator;

/** Deterministic ordering for section identifiers. */
public final class SectionIds {

  /**
   * Numeric identifiers sort by value and before non-numeric ones ({@code "9" < "101" < "A1"});
   * everything else sorts lexicographically.
   */
  public static final Comparator<String> ORDER = SectionIds::compare;

  private SectionIds() {}

  private static int compare(String left, String right) {
    boolean leftNumeric = isNumeric(left);
    boolean rightNumeric = isNumeric(right);
    if (leftNumeric && rightNumeric) {
      int byValue = new BigInteger(left).compareTo(new BigInteger(right));
      return byValue != 0 ? byValue : left.compareTo(right);
    }
    if (leftNumeric != rightNumeric) {
      return leftNumeric ? -1 : 1;
    }
    return left.compareTo(right);
  }

  private static boolean isNumeric(String value) {
    if (value.isEmpty()) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (!Character.isDigit(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
