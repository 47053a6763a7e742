package org.atrack.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("workers", 10, 1, 64));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65, 1, 64));
  }

  @Test
  void positiveAndNonNegativeRejectNonFiniteValues() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("pixelScale", 0));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requirePositive("pixelScale", Double.POSITIVE_INFINITY));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("tolerance", Double.NaN));
    assertEquals(0.0, Numbers.requireNonNegative("tolerance", 0.0));
  }

  @Test
  void parseDoubleTrimsAndNamesTheKeyOnFailure() {
    assertEquals(0.63, Numbers.parseDouble("pixelScale", " 0.63 "));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseDouble("pixelScale", "0,63"));
    assertTrue(ex.getMessage().startsWith("pixelScale"));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("workers", "2.5"));
  }
}
