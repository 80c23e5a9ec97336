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

package io.github.suppierk.sample.order.application;

import io.github.suppierk.blocks.integration.EventBus;
import io.github.suppierk.blocks.integration.IdempotentIntegrationEventHandler;
import io.github.suppierk.blocks.integration.IntegrationEventPipeline;
import io.github.suppierk.blocks.integration.ProcessedMessageStore;
import io.github.suppierk.blocks.persistence.Repository;
import io.github.suppierk.sample.contracts.OrderCancelledIntegrationEvent;
import io.github.suppierk.sample.contracts.OrderPaidIntegrationEvent;
import io.github.suppierk.sample.contracts.OrderShippedIntegrationEvent;
import io.github.suppierk.sample.contracts.OrderSubmittedIntegrationEvent;
import io.github.suppierk.sample.contracts.PaymentCompletedIntegrationEvent;
import io.github.suppierk.sample.contracts.PaymentFailedIntegrationEvent;
import io.github.suppierk.sample.order.domain.Order;
import io.github.suppierk.sample.order.domain.OrderId;
import io.github.suppierk.sample.order.domain.events.OrderCancelledDomainEvent;
import io.github.suppierk.sample.order.domain.events.OrderPaidDomainEvent;
import io.github.suppierk.sample.order.domain.events.OrderShippedDomainEvent;
import io.github.suppierk.sample.order.domain.events.OrderSubmittedDomainEvent;

/**
 * Wiring of the Order context to the outside world.
 *
 * <p>{@code OrderCreatedDomainEvent} has no translator: a draft is of no interest to other
 * contexts.
 */
public final class OrderIntegrationEvents {
  private OrderIntegrationEvents() {
    // Utility class
  }

  /**
   * @param builder to register Order translators with
   * @return the same builder
   */
  public static IntegrationEventPipeline.Builder registerTranslators(
      final IntegrationEventPipeline.Builder builder) {
    return builder
        .translator(
            OrderSubmittedDomainEvent.class,
            event ->
                new OrderSubmittedIntegrationEvent(
                    event.eventId(),
                    event.occurredAt(),
                    event.orderId().toString(),
                    event.customerId(),
                    event.total().amount(),
                    event.total().currency(),
                    event.itemCount()))
        .translator(
            OrderPaidDomainEvent.class,
            event ->
                new OrderPaidIntegrationEvent(
                    event.eventId(),
                    event.occurredAt(),
                    event.orderId().toString(),
                    event.paymentReference()))
        .translator(
            OrderShippedDomainEvent.class,
            event ->
                new OrderShippedIntegrationEvent(
                    event.eventId(),
                    event.occurredAt(),
                    event.orderId().toString(),
                    event.trackingNumber()))
        .translator(
            OrderCancelledDomainEvent.class,
            event ->
                new OrderCancelledIntegrationEvent(
                    event.eventId(),
                    event.occurredAt(),
                    event.orderId().toString(),
                    event.reason()));
  }

  /**
   * Subscribes Order handlers to events of other contexts.
   *
   * @param eventBus to subscribe to
   * @param orderRepository used by the handlers
   * @param processedMessageStore to deduplicate deliveries with
   */
  public static void subscribe(
      final EventBus eventBus,
      final Repository<Order, OrderId> orderRepository,
      final ProcessedMessageStore processedMessageStore) {
    eventBus.subscribe(
        PaymentCompletedIntegrationEvent.class,
        new IdempotentIntegrationEventHandler<>(
            "order.payment-completed",
            new PaymentCompletedIntegrationEventHandler(orderRepository),
            processedMessageStore));
    eventBus.subscribe(
        PaymentFailedIntegrationEvent.class,
        new IdempotentIntegrationEventHandler<>(
            "order.payment-failed",
            new PaymentFailedIntegrationEventHandler(orderRepository),
            processedMessageStore));
  }
}
