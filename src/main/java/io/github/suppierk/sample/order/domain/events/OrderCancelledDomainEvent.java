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
import io.github.suppierk.sample.order.domain.OrderId;
import io.github.suppierk.sample.order.domain.OrderStatus;
import java.time.Instant;
import java.util.UUID;

/**
 * @param eventId of the event
 * @param occurredAt when the order was cancelled
 * @param orderId of the cancelled order
 * @param previousStatus status the order was cancelled from
 * @param reason of the cancellation, optional
 */
public record OrderCancelledDomainEvent(
    UUID eventId, Instant occurredAt, OrderId orderId, OrderStatus previousStatus, String reason)
    implements DomainEvent {}
