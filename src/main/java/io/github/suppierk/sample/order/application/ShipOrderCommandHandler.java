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

import io.github.suppierk.blocks.application.CommandHandler;
import io.github.suppierk.blocks.persistence.Repository;
import io.github.suppierk.sample.order.domain.Order;
import io.github.suppierk.sample.order.domain.OrderId;
import io.github.suppierk.sample.order.domain.OrderStatus;

public final class ShipOrderCommandHandler extends CommandHandler<ShipOrderCommand, OrderStatus> {
  private final Repository<Order, OrderId> orderRepository;

  public ShipOrderCommandHandler(final Repository<Order, OrderId> orderRepository) {
    super(ShipOrderCommand.class);
    this.orderRepository = throwIllegalArgumentIfNull(orderRepository, "Order repository");
  }

  @Override
  protected OrderStatus run(final ShipOrderCommand command) {
    final Order order =
        orderRepository.getById(throwIllegalStateIfNull(command.orderId(), "Order ID"));

    order.ship(command.trackingNumber());
    orderRepository.unitOfWork().saveEntities();

    return order.getStatus();
  }
}
