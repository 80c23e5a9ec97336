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

package io.github.suppierk.sample.contracts;

import io.github.suppierk.blocks.integration.IntegrationEvent;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published by the Payment context once the payment for an order succeeded.
 *
 * @param messageId of the message
 * @param occurredAt when the payment completed
 * @param paymentId textual UUID of the payment
 * @param orderId textual UUID of the paid order
 * @param amount which was paid
 * @param currency of the amount
 * @param transactionReference of the payment provider
 */
public record PaymentCompletedIntegrationEvent(
    UUID messageId,
    Instant occurredAt,
    String paymentId,
    String orderId,
    BigDecimal amount,
    String currency,
    String transactionReference)
    implements IntegrationEvent {}
