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

package io.github.suppierk.sample.payment.domain.rules;

import io.github.suppierk.blocks.domain.rules.BusinessRule;
import io.github.suppierk.sample.payment.domain.PaymentStatus;

/**
 * @param actual status of the payment
 * @param expected status the transition can start from
 * @param action being attempted, used in the message
 */
public record PaymentMustBeInStatusRule(
    PaymentStatus actual, PaymentStatus expected, String action) implements BusinessRule {
  @Override
  public boolean isBroken() {
    return actual != expected;
  }

  @Override
  public String message() {
    return "Cannot %s a payment in status %s.".formatted(action, actual);
  }

  @Override
  public String code() {
    return "PAYMENT_INVALID_STATUS";
  }
}
