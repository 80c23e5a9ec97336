package io.github.suppierk.blocks.domain.rules;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BusinessRuleCheckerTest {
  record TestRule(boolean broken, String code) implements BusinessRule {
    @Override
    public boolean isBroken() {
      return broken;
    }

    @Override
    public String message() {
      return "Rule " + code + " is broken";
    }
  }

  record RuleWithDefaultCode() implements BusinessRule {
    @Override
    public boolean isBroken() {
      return true;
    }

    @Override
    public String message() {
      return "Always broken";
    }
  }

  static final TestRule SATISFIED = new TestRule(false, "SATISFIED");
  static final TestRule FIRST_BROKEN = new TestRule(true, "FIRST");
  static final TestRule SECOND_BROKEN = new TestRule(true, "SECOND");

  @Nested
  class CheckRule {
    @Test
    void when_rule_is_satisfied_nothing_is_thrown() {
      assertDoesNotThrow(() -> BusinessRuleChecker.checkRule(SATISFIED));
    }

    @Test
    void when_rule_is_broken_exception_carries_rule_code_and_message() {
      final var exception =
          assertThrows(
              BusinessRuleValidationException.class,
              () -> BusinessRuleChecker.checkRule(FIRST_BROKEN));

      assertEquals("FIRST", exception.getCode());
      assertEquals("Rule FIRST is broken", exception.getMessage());
      assertSame(FIRST_BROKEN, exception.getBrokenRule());
      assertEquals(422, exception.getStatusCode());
    }

    @Test
    void when_rule_does_not_define_code_default_code_is_reported() {
      final var exception =
          assertThrows(
              BusinessRuleValidationException.class,
              () -> BusinessRuleChecker.checkRule(new RuleWithDefaultCode()));

      assertEquals(BusinessRule.DEFAULT_CODE, exception.getCode());
    }

    @Test
    void when_rule_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> BusinessRuleChecker.checkRule(null));
    }
  }

  @Nested
  class CheckRules {
    @Test
    void first_broken_rule_in_order_is_reported() {
      final var exception =
          assertThrows(
              BusinessRuleValidationException.class,
              () -> BusinessRuleChecker.checkRules(SATISFIED, SECOND_BROKEN, FIRST_BROKEN));

      assertEquals("SECOND", exception.getCode());
    }

    @Test
    void when_all_rules_are_satisfied_nothing_is_thrown() {
      assertDoesNotThrow(() -> BusinessRuleChecker.checkRules(List.of(SATISFIED, SATISFIED)));
    }

    @Test
    void empty_rules_are_satisfied() {
      assertDoesNotThrow(() -> BusinessRuleChecker.checkRules());
    }
  }

  @Nested
  class ValidateAll {
    @Test
    void every_broken_rule_is_reported_in_order() {
      final var exception =
          assertThrows(
              AggregateBusinessRuleValidationException.class,
              () -> BusinessRuleChecker.validateAll(FIRST_BROKEN, SATISFIED, SECOND_BROKEN));

      assertEquals(AggregateBusinessRuleValidationException.CODE, exception.getCode());
      assertEquals(List.of("FIRST", "SECOND"), exception.getBrokenRuleCodes());
      assertEquals(List.of(FIRST_BROKEN, SECOND_BROKEN), exception.getBrokenRules());
      assertTrue(exception.getMessage().contains("Rule FIRST is broken"));
      assertTrue(exception.getMessage().contains("Rule SECOND is broken"));
    }

    @Test
    void single_broken_rule_is_still_reported_as_aggregate() {
      final var exception =
          assertThrows(
              AggregateBusinessRuleValidationException.class,
              () -> BusinessRuleChecker.validateAll(SATISFIED, FIRST_BROKEN));

      assertEquals(List.of("FIRST"), exception.getBrokenRuleCodes());
    }

    @Test
    void broken_rules_can_be_collected_without_throwing() {
      assertEquals(
          List.of(SECOND_BROKEN),
          BusinessRuleChecker.getBrokenRules(List.of(SATISFIED, SECOND_BROKEN)));
    }

    @Test
    void when_no_rule_is_broken_nothing_is_thrown() {
      assertDoesNotThrow(() -> BusinessRuleChecker.validateAll(SATISFIED));
    }
  }
}
