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

package io.github.suppierk.sample.order.domain.events;

import io.github.suppierk.blocks.domain.DomainEvent;
import io.github.suppierk.sample.order.domain.Money;
import io.github.suppierk.sample.order.domain.OrderId;
import java.time.Instant;
import java.util.UUID;

/**
 * Order was submitted for payment.
 *
 * @param eventId of the event
 * @param occurredAt when the order was submitted
 * @param orderId of the submitted order
 * @param customerId owning the order
 * @param total of all order items
 * @param itemCount number of distinct items
 */
public record OrderSubmittedDomainEvent(
    UUID eventId,
    Instant occurredAt,
    OrderId orderId,
    String customerId,
    Money total,
    int itemCount)
    implements DomainEvent {}
