package ca.gc.cra.spectra.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(0L, Numbers.requireRange("rows", 0, 0, 10));
    assertEquals(10L, Numbers.requireRange("rows", 10, 0, 10));
  }

  @Test
  void requireRangeReportsValue() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("rows", 11, 0, 10));
    assertEquals("rows must be between 0 and 10 (was 11)", ex.getMessage());
  }
}
