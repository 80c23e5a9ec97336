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

package io.github.suppierk.sample.payment.application;

import io.github.suppierk.blocks.integration.EventBus;
import io.github.suppierk.blocks.integration.IdempotentIntegrationEventHandler;
import io.github.suppierk.blocks.integration.IntegrationEventPipeline;
import io.github.suppierk.blocks.integration.ProcessedMessageStore;
import io.github.suppierk.blocks.persistence.Repository;
import io.github.suppierk.sample.contracts.OrderSubmittedIntegrationEvent;
import io.github.suppierk.sample.contracts.PaymentCompletedIntegrationEvent;
import io.github.suppierk.sample.contracts.PaymentFailedIntegrationEvent;
import io.github.suppierk.sample.payment.domain.Payment;
import io.github.suppierk.sample.payment.domain.PaymentId;
import io.github.suppierk.sample.payment.domain.events.PaymentCompletedDomainEvent;
import io.github.suppierk.sample.payment.domain.events.PaymentFailedDomainEvent;
import java.time.Clock;

/** Wiring of the Payment context to the outside world. */
public final class PaymentIntegrationEvents {
  private PaymentIntegrationEvents() {
    // Utility class
  }

  /**
   * @param builder to register Payment translators with
   * @return the same builder
   */
  public static IntegrationEventPipeline.Builder registerTranslators(
      final IntegrationEventPipeline.Builder builder) {
    return builder
        .translator(
            PaymentCompletedDomainEvent.class,
            event ->
                new PaymentCompletedIntegrationEvent(
                    event.eventId(),
                    event.occurredAt(),
                    event.paymentId().toString(),
                    event.orderId(),
                    event.amount().value(),
                    event.amount().currency(),
                    event.transactionReference()))
        .translator(
            PaymentFailedDomainEvent.class,
            event ->
                new PaymentFailedIntegrationEvent(
                    event.eventId(),
                    event.occurredAt(),
                    event.paymentId().toString(),
                    event.orderId(),
                    event.reason()));
  }

  /**
   * @param eventBus to subscribe to
   * @param paymentRepository used by the handlers
   * @param processedMessageStore to deduplicate deliveries with
   * @param clock to stamp new payments with
   */
  public static void subscribe(
      final EventBus eventBus,
      final Repository<Payment, PaymentId> paymentRepository,
      final ProcessedMessageStore processedMessageStore,
      final Clock clock) {
    eventBus.subscribe(
        OrderSubmittedIntegrationEvent.class,
        new IdempotentIntegrationEventHandler<>(
            "payment.order-submitted",
            new OrderSubmittedIntegrationEventHandler(paymentRepository, clock),
            processedMessageStore));
  }
}
