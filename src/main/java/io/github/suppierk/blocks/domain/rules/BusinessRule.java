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

/**
 * Represents a named, explainable invariant guarding a specific state transition.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s: a rule is plain data
 * bound to the exact values it checks plus a pure function over them, which keeps rules trivially
 * testable. Rules are created per invocation and are never persisted.
 */
public interface BusinessRule {
  /** Code reported for rules which do not define their own. */
  String DEFAULT_CODE = "BUSINESS_RULE_VIOLATION";

  /**
   * @return {@code true} if the captured values violate this rule
   */
  boolean isBroken();

  /**
   * @return human-readable explanation of the rule
   */
  String message();

  /**
   * @return machine-readable rule identifier
   */
  default String code() {
    return DEFAULT_CODE;
  }
}
