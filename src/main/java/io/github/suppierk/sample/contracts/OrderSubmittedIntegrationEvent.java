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
 * Published by the Order context once an order awaits payment.
 *
 * @param messageId of the message
 * @param occurredAt when the order was submitted
 * @param orderId textual UUID of the order
 * @param customerId owning the order
 * @param totalAmount to be paid
 * @param currency of the amount
 * @param itemCount number of distinct items
 */
public record OrderSubmittedIntegrationEvent(
    UUID messageId,
    Instant occurredAt,
    String orderId,
    String customerId,
    BigDecimal totalAmount,
    String currency,
    int itemCount)
    implements IntegrationEvent {}
