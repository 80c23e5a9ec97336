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

import io.github.suppierk.blocks.domain.DomainException;
import java.io.Serial;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A specific {@link Exception} to be thrown when one or more {@link BusinessRule}s were broken and
 * all of them have to be reported at once, typically at input validation boundaries.
 */
public class AggregateBusinessRuleValidationException extends DomainException {
  @Serial private static final long serialVersionUID = -8475398017372009921L;

  /** Code reported for every aggregate violation. */
  public static final String CODE = "MULTIPLE_RULES_VIOLATED";

  @SuppressWarnings("squid:S1948")
  private final List<BusinessRule> brokenRules;

  /**
   * @param brokenRules which caused this exception, must not be empty
   * @throws IllegalArgumentException if the list of rules is empty
   */
  public AggregateBusinessRuleValidationException(final List<BusinessRule> brokenRules) {
    super(CODE, joinMessages(brokenRules));
    this.brokenRules = List.copyOf(brokenRules);
  }

  private static String joinMessages(final List<BusinessRule> brokenRules) {
    if (brokenRules == null || brokenRules.isEmpty()) {
      throw new IllegalArgumentException("Broken rules cannot be empty");
    }

    return brokenRules.stream().map(BusinessRule::message).collect(Collectors.joining("; "));
  }

  /**
   * @return every rule which caused this exception, in evaluation order
   */
  public final List<BusinessRule> getBrokenRules() {
    return brokenRules;
  }

  /**
   * @return codes of every broken rule, in evaluation order
   */
  public final List<String> getBrokenRuleCodes() {
    return brokenRules.stream().map(BusinessRule::code).toList();
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/422">422 Unprocessable
   *     Content</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 422;
  }
}
