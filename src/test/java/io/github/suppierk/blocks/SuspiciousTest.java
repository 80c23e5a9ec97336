package io.github.suppierk.blocks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SuspiciousTest {
  static final class Guarded extends Suspicious {
    String argument(final String value) {
      return throwIllegalArgumentIfNull(value, "Value");
    }

    String property(final String value) {
      return throwIllegalStateIfNull(value, "Property");
    }
  }

  static final Guarded GUARDED = new Guarded();

  @Test
  void non_null_values_are_returned_unchanged() {
    final var value = "value";

    assertSame(value, GUARDED.argument(value));
    assertSame(value, GUARDED.property(value));
  }

  @Test
  void null_argument_throws_illegal_argument_exception() {
    final var exception =
        assertThrows(IllegalArgumentException.class, () -> GUARDED.argument(null));
    assertEquals("Value cannot be null", exception.getMessage());
  }

  @Test
  void null_property_throws_illegal_state_exception() {
    final var exception = assertThrows(IllegalStateException.class, () -> GUARDED.property(null));
    assertEquals("Property cannot be null", exception.getMessage());
  }
}
