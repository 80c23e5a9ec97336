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

import java.math.BigDecimal;

/**
 * Item of an order as received from an external sales channel. Any field can be missing.
 *
 * @param productId of the item
 * @param productName of the item
 * @param unitPrice of the item
 * @param quantity of the item
 */
public record ExternalOrderItemDto(
    String productId, String productName, BigDecimal unitPrice, Integer quantity) {}
