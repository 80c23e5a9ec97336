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
import io.github.suppierk.sample.order.anticorruption.ExternalOrderTranslator;
import io.github.suppierk.sample.order.domain.CreateOrderData;
import io.github.suppierk.sample.order.domain.Order;
import io.github.suppierk.sample.order.domain.OrderFactory;
import io.github.suppierk.sample.order.domain.OrderId;

/**
 * Orchestrates an import: translate the external payload, create the order through the factory,
 * persist it. Nothing is persisted if translation or creation fails.
 */
public final class ImportExternalOrderCommandHandler
    extends CommandHandler<ImportExternalOrderCommand, OrderId> {
  private final Repository<Order, OrderId> orderRepository;
  private final ExternalOrderTranslator translator;
  private final OrderFactory orderFactory;

  public ImportExternalOrderCommandHandler(
      final Repository<Order, OrderId> orderRepository,
      final ExternalOrderTranslator translator,
      final OrderFactory orderFactory) {
    super(ImportExternalOrderCommand.class);
    this.orderRepository = throwIllegalArgumentIfNull(orderRepository, "Order repository");
    this.translator = throwIllegalArgumentIfNull(translator, "External order translator");
    this.orderFactory = throwIllegalArgumentIfNull(orderFactory, "Order factory");
  }

  @Override
  protected OrderId run(final ImportExternalOrderCommand command) {
    final CreateOrderData data =
        translator.translate(throwIllegalStateIfNull(command.order(), "External order"));
    final Order order = orderFactory.create(data);

    orderRepository.add(order);
    orderRepository.unitOfWork().saveEntities();

    return order.getId();
  }
}
