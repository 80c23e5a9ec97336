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

/** A specific {@link Exception} to be thrown when a single {@link BusinessRule} is broken. */
public class BusinessRuleValidationException extends DomainException {
  @Serial private static final long serialVersionUID = 3049121759125520913L;

  @SuppressWarnings("squid:S1948")
  private final BusinessRule brokenRule;

  /**
   * @param brokenRule which caused this exception
   */
  public BusinessRuleValidationException(final BusinessRule brokenRule) {
    super(brokenRule.code(), brokenRule.message());
    this.brokenRule = brokenRule;
  }

  /**
   * @return the rule which caused this exception
   */
  public final BusinessRule getBrokenRule() {
    return brokenRule;
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
