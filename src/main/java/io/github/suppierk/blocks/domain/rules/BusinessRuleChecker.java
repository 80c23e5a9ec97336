/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.blocks.domain.rules;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stateless functions evaluating {@link BusinessRule}s.
 *
 * <p>Two evaluation styles are available:
 *
 * <ul>
 *   <li><b>Fail-fast</b>: {@link #checkRule(BusinessRule)} and {@link #checkRules(BusinessRule...)}
 *       stop at the first broken rule. Aggregates use them to guard mutations, where the order of
 *       rules reflects their priority and nothing may be reasoned about past the first violation.
 *   <li><b>Collect-all</b>: {@link #getBrokenRules(BusinessRule...)} and {@link
 *       #validateAll(BusinessRule...)} evaluate every rule. Input boundaries use them to report
 *       every problem to the caller at once.
 * </ul>
 */
public final class BusinessRuleChecker {
  private BusinessRuleChecker() {
    // No instance
  }

  /**
   * @param rule to evaluate
   * @throws BusinessRuleValidationException if the rule is broken
   * @throws IllegalArgumentException if the rule is {@code null}
   */
  public static void checkRule(final BusinessRule rule) {
    if (nonNull(rule).isBroken()) {
      throw new BusinessRuleValidationException(rule);
    }
  }

  /**
   * Evaluates rules in the given order, stopping at the first broken one.
   *
   * @param rules to evaluate
   * @throws BusinessRuleValidationException for the first broken rule
   * @throws IllegalArgumentException if any of the rules is {@code null}
   */
  public static void checkRules(final BusinessRule... rules) {
    checkRules(asList(rules));
  }

  /**
   * @see #checkRules(BusinessRule...)
   */
  public static void checkRules(final List<? extends BusinessRule> rules) {
    for (BusinessRule rule : nonNull(rules)) {
      checkRule(rule);
    }
  }

  /**
   * Evaluates every rule without throwing.
   *
   * @param rules to evaluate
   * @return broken rules, in evaluation order
   * @throws IllegalArgumentException if any of the rules is {@code null}
   */
  public static List<BusinessRule> getBrokenRules(final BusinessRule... rules) {
    return getBrokenRules(asList(rules));
  }

  /**
   * @see #getBrokenRules(BusinessRule...)
   */
  public static List<BusinessRule> getBrokenRules(final List<? extends BusinessRule> rules) {
    final List<BusinessRule> brokenRules = new ArrayList<>();
    for (BusinessRule rule : nonNull(rules)) {
      if (nonNull(rule).isBroken()) {
        brokenRules.add(rule);
      }
    }
    return List.copyOf(brokenRules);
  }

  /**
   * Evaluates every rule and reports all broken ones together.
   *
   * @param rules to evaluate
   * @throws AggregateBusinessRuleValidationException if at least one rule is broken
   * @throws IllegalArgumentException if any of the rules is {@code null}
   */
  public static void validateAll(final BusinessRule... rules) {
    validateAll(asList(rules));
  }

  /**
   * @see #validateAll(BusinessRule...)
   */
  public static void validateAll(final List<? extends BusinessRule> rules) {
    final List<BusinessRule> brokenRules = getBrokenRules(rules);
    if (!brokenRules.isEmpty()) {
      throw new AggregateBusinessRuleValidationException(brokenRules);
    }
  }

  private static List<BusinessRule> asList(final BusinessRule[] rules) {
    return Arrays.asList(nonNull(rules));
  }

  private static <T> T nonNull(final T value) {
    if (value == null) {
      throw new IllegalArgumentException("Business rule cannot be null");
    }

    return value;
  }
}
