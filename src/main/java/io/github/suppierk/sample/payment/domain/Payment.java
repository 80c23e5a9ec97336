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

package io.github.suppierk.sample.payment.domain;

import io.github.suppierk.blocks.domain.AggregateRoot;
import io.github.suppierk.blocks.domain.rules.BusinessRuleChecker;
import io.github.suppierk.blocks.domain.specification.Attribute;
import io.github.suppierk.sample.payment.domain.events.PaymentCompletedDomainEvent;
import io.github.suppierk.sample.payment.domain.events.PaymentCreatedDomainEvent;
import io.github.suppierk.sample.payment.domain.events.PaymentFailedDomainEvent;
import io.github.suppierk.sample.payment.domain.rules.OrderIdMustBeProvidedRule;
import io.github.suppierk.sample.payment.domain.rules.PaymentAmountMustBePositiveRule;
import io.github.suppierk.sample.payment.domain.rules.PaymentMustBeInStatusRule;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serial;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment aggregate.
 *
 * <p>Lifecycle: {@code PENDING -> COMPLETED} or {@code PENDING -> FAILED}. The order is referenced by
 * its textual identifier only, as received through integration events.
 */
public final class Payment extends AggregateRoot<PaymentId> {
  @Serial private static final long serialVersionUID = 8829640918410265386L;

  public static final Attribute<Payment, String> ORDER_ID =
      Attribute.of("order_id", String.class, Payment::getOrderId);
  public static final Attribute<Payment, PaymentStatus> STATUS =
      Attribute.of("status", PaymentStatus.class, Payment::getStatus);

  private final String orderId;
  private final Amount amount;
  private final Instant createdAt;
  private transient Clock clock;

  private PaymentStatus status;
  private String transactionReference;
  private String failureReason;

  private Payment(
      final PaymentId id, final String orderId, final Amount amount, final Clock clock) {
    super(id);
    this.orderId = orderId;
    this.amount = amount;
    this.clock = clock;
    this.createdAt = clock.instant();
    this.status = PaymentStatus.PENDING;
  }

  /**
   * @param orderId paid by this payment
   * @param amount to charge
   * @param clock to stamp events with
   * @return new pending payment
   * @throws io.github.suppierk.blocks.domain.rules.BusinessRuleValidationException with {@code
   *     ORDER_ID_REQUIRED} or {@code INVALID_PAYMENT_AMOUNT}
   */
  public static Payment create(final String orderId, final Amount amount, final Clock clock) {
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    BusinessRuleChecker.checkRules(
        new OrderIdMustBeProvidedRule(orderId), new PaymentAmountMustBePositiveRule(amount));

    final Payment payment = new Payment(PaymentId.newId(), orderId.trim(), amount, clock);
    payment.raiseDomainEvent(
        new PaymentCreatedDomainEvent(
            UUID.randomUUID(), payment.createdAt, payment.getId(), payment.orderId, amount));
    return payment;
  }

  public void complete(final String transactionReference) {
    checkRule(new PaymentMustBeInStatusRule(status, PaymentStatus.PENDING, "complete"));

    status = PaymentStatus.COMPLETED;
    this.transactionReference = transactionReference;
    raiseDomainEvent(
        new PaymentCompletedDomainEvent(
            UUID.randomUUID(), clock.instant(), getId(), orderId, amount, transactionReference));
  }

  public void fail(final String reason) {
    checkRule(new PaymentMustBeInStatusRule(status, PaymentStatus.PENDING, "fail"));

    status = PaymentStatus.FAILED;
    failureReason = reason;
    raiseDomainEvent(
        new PaymentFailedDomainEvent(UUID.randomUUID(), clock.instant(), getId(), orderId, reason));
  }

  public String getOrderId() {
    return orderId;
  }

  public Amount getAmount() {
    return amount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public PaymentStatus getStatus() {
    return status;
  }

  public String getTransactionReference() {
    return transactionReference;
  }

  public String getFailureReason() {
    return failureReason;
  }

  /** The clock is not a part of the serialized state, a deserialized aggregate uses UTC. */
  @Serial
  private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
    in.defaultReadObject();
    clock = Clock.systemUTC();
  }
}
