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

import io.github.suppierk.blocks.integration.IntegrationEventHandler;
import io.github.suppierk.blocks.persistence.Repository;
import io.github.suppierk.sample.contracts.OrderSubmittedIntegrationEvent;
import io.github.suppierk.sample.payment.domain.Amount;
import io.github.suppierk.sample.payment.domain.Payment;
import io.github.suppierk.sample.payment.domain.PaymentId;
import io.github.suppierk.sample.payment.domain.specifications.PaymentForOrderSpecification;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens a pending payment for every submitted order.
 *
 * <p>At most one payment exists per order: a payment already created for the same order, even by a
 * redelivered message with a different ID, makes this handler a no-op.
 */
public final class OrderSubmittedIntegrationEventHandler
    implements IntegrationEventHandler<OrderSubmittedIntegrationEvent> {
  private static final Logger log =
      LoggerFactory.getLogger(OrderSubmittedIntegrationEventHandler.class);

  private final Repository<Payment, PaymentId> paymentRepository;
  private final Clock clock;

  public OrderSubmittedIntegrationEventHandler(
      final Repository<Payment, PaymentId> paymentRepository, final Clock clock) {
    if (paymentRepository == null) {
      throw new IllegalArgumentException("Payment repository cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.paymentRepository = paymentRepository;
    this.clock = clock;
  }

  @Override
  public void handle(final OrderSubmittedIntegrationEvent event) {
    if (!paymentRepository.find(new PaymentForOrderSpecification(event.orderId())).isEmpty()) {
      log.debug("Payment for order '{}' already exists", event.orderId());
      return;
    }

    final Payment payment =
        Payment.create(
            event.orderId(), Amount.of(event.totalAmount(), event.currency()), clock);
    paymentRepository.add(payment);
    paymentRepository.unitOfWork().saveEntities();

    log.debug("Created payment '{}' for order '{}'", payment.getId(), event.orderId());
  }
}
