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

package io.github.suppierk.blocks.application;

import io.github.suppierk.blocks.domain.DomainException;
import io.github.suppierk.blocks.domain.rules.AggregateBusinessRuleValidationException;
import io.github.suppierk.blocks.domain.rules.BusinessRule;
import io.github.suppierk.blocks.domain.rules.BusinessRuleValidationException;
import java.util.List;

/**
 * Structured description of a recoverable failure, suitable for returning to a caller.
 *
 * @param code machine-readable reason
 * @param message human-readable reason
 * @param statusCode HTTP-like status code
 * @param violations individual broken rules, empty if the failure was not caused by rules
 */
public record ErrorReport(String code, String message, int statusCode, List<Violation> violations) {
  public ErrorReport {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("Error code cannot be blank");
    }

    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  /**
   * @param exception to describe
   * @return report carrying the code, message, status and broken rules of the exception
   */
  public static ErrorReport from(final DomainException exception) {
    if (exception == null) {
      throw new IllegalArgumentException("Domain exception cannot be null");
    }

    final List<Violation> violations;
    if (exception instanceof AggregateBusinessRuleValidationException aggregate) {
      violations = aggregate.getBrokenRules().stream().map(Violation::of).toList();
    } else if (exception instanceof BusinessRuleValidationException single) {
      violations = List.of(Violation.of(single.getBrokenRule()));
    } else {
      violations = List.of();
    }

    return new ErrorReport(
        exception.getCode(), exception.getMessage(), exception.getStatusCode(), violations);
  }

  /**
   * @param code of the broken rule
   * @param message of the broken rule
   */
  public record Violation(String code, String message) {
    static Violation of(final BusinessRule rule) {
      return new Violation(rule.code(), rule.message());
    }
  }
}
