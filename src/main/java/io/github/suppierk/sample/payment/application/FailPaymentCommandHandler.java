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

import io.github.suppierk.blocks.application.CommandHandler;
import io.github.suppierk.blocks.persistence.Repository;
import io.github.suppierk.sample.payment.domain.Payment;
import io.github.suppierk.sample.payment.domain.PaymentId;
import io.github.suppierk.sample.payment.domain.PaymentStatus;

public final class FailPaymentCommandHandler
    extends CommandHandler<FailPaymentCommand, PaymentStatus> {
  private final Repository<Payment, PaymentId> paymentRepository;

  public FailPaymentCommandHandler(final Repository<Payment, PaymentId> paymentRepository) {
    super(FailPaymentCommand.class);
    this.paymentRepository = throwIllegalArgumentIfNull(paymentRepository, "Payment repository");
  }

  @Override
  protected PaymentStatus run(final FailPaymentCommand command) {
    final Payment payment =
        paymentRepository.getById(throwIllegalStateIfNull(command.paymentId(), "Payment ID"));

    payment.fail(command.reason());
    paymentRepository.unitOfWork().saveEntities();

    return payment.getStatus();
  }
}
