package io.github.suppierk.sample.order.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class MoneyTest {
  @Test
  void amounts_with_different_scale_are_equal() {
    assertEquals(Money.of("150", "usd"), Money.of(new BigDecimal("150.000"), "USD"));
    assertEquals("150.00 USD", Money.of("150", "USD").toString());
  }

  @Test
  void arithmetic_keeps_currency() {
    final var total = Money.of("10.25", "EUR").multiply(3).add(Money.of("0.25", "EUR"));

    assertEquals(Money.of("31.00", "EUR"), total);
    assertTrue(total.isPositive());
    assertFalse(Money.zero("EUR").isPositive());
  }

  @Test
  void adding_different_currencies_throws_illegal_argument_exception() {
    assertThrows(
        IllegalArgumentException.class, () -> Money.of("1", "USD").add(Money.of("1", "EUR")));
  }

  @Test
  void missing_parts_throw_illegal_argument_exception() {
    assertThrows(IllegalArgumentException.class, () -> Money.of((BigDecimal) null, "USD"));
    assertThrows(IllegalArgumentException.class, () -> Money.of("1", " "));
  }
}
