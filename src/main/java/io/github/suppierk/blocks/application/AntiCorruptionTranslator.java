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

package io.github.suppierk.blocks.application;

/**
 * Protects the domain model from the shape and vocabulary of an external system.
 *
 * <p>Translators validate the external payload (usually with {@link
 * io.github.suppierk.blocks.domain.rules.BusinessRuleChecker#validateAll(java.util.List)}, so that
 * the caller learns about every problem at once), normalize it and produce an internal creation
 * contract. They are pure functions and never build or persist aggregates themselves.
 *
 * @param <EXTERNAL> is the type of the external payload
 * @param <CONTRACT> is the type of the internal creation contract
 */
@SuppressWarnings("squid:S119")
@FunctionalInterface
public interface AntiCorruptionTranslator<EXTERNAL, CONTRACT> {
  /**
   * @param external payload to translate
   * @return internal contract
   * @throws io.github.suppierk.blocks.domain.rules.AggregateBusinessRuleValidationException if the
   *     payload is invalid
   */
  CONTRACT translate(final EXTERNAL external);
}
