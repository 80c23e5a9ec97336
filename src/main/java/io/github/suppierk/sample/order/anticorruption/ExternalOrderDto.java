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

package io.github.suppierk.sample.order.anticorruption;

import java.util.List;

/**
 * Order as received from an external sales channel, in that channel's shape and vocabulary. Any
 * field can be missing.
 */
public record ExternalOrderDto(
    String externalOrderId,
    String customerId,
    String customerName,
    String shippingStreet,
    String shippingCity,
    String shippingState,
    String shippingCountry,
    String shippingZipCode,
    String currency,
    List<ExternalOrderItemDto> items,
    String notes) {}
