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

import io.github.suppierk.blocks.integration.IntegrationEventHandler;
import io.github.suppierk.blocks.persistence.Repository;
import io.github.suppierk.sample.contracts.PaymentCompletedIntegrationEvent;
import io.github.suppierk.sample.order.domain.Order;
import io.github.suppierk.sample.order.domain.OrderId;
import io.github.suppierk.sample.order.domain.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Marks the order as paid once its payment completed. */
public final class PaymentCompletedIntegrationEventHandler
    implements IntegrationEventHandler<PaymentCompletedIntegrationEvent> {
  private static final Logger log =
      LoggerFactory.getLogger(PaymentCompletedIntegrationEventHandler.class);

  private final Repository<Order, OrderId> orderRepository;

  public PaymentCompletedIntegrationEventHandler(final Repository<Order, OrderId> orderRepository) {
    if (orderRepository == null) {
      throw new IllegalArgumentException("Order repository cannot be null");
    }

    this.orderRepository = orderRepository;
  }

  @Override
  public void handle(final PaymentCompletedIntegrationEvent event) {
    final Order order = orderRepository.getById(OrderId.parse(event.orderId()));

    if (order.getStatus() == OrderStatus.PAID) {
      log.debug("Order '{}' is already paid", order.getId());
      return;
    }

    order.markPaid(event.paymentId());
    orderRepository.unitOfWork().saveEntities();
  }
}
