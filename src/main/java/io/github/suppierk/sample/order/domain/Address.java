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

package io.github.suppierk.sample.order.domain;

import io.github.suppierk.blocks.domain.ValueObject;
import java.io.Serial;
import java.util.Arrays;
import java.util.List;

/** Shipping address of an {@link Order}, state is optional. */
public final class Address extends ValueObject {
  @Serial private static final long serialVersionUID = 8290546410396713905L;

  private final String street;
  private final String city;
  private final String state;
  private final String country;
  private final String zipCode;

  private Address(
      final String street,
      final String city,
      final String state,
      final String country,
      final String zipCode) {
    this.street = required(street, "Street");
    this.city = required(city, "City");
    this.state = state == null || state.isBlank() ? null : state.trim();
    this.country = required(country, "Country");
    this.zipCode = required(zipCode, "Zip code");
  }

  /**
   * @throws IllegalArgumentException if any of the required parts is blank
   */
  public static Address of(
      final String street,
      final String city,
      final String state,
      final String country,
      final String zipCode) {
    return new Address(street, city, state, country, zipCode);
  }

  private static String required(final String value, final String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("%s cannot be blank".formatted(name));
    }

    return value.trim();
  }

  public String street() {
    return street;
  }

  public String city() {
    return city;
  }

  public String state() {
    return state;
  }

  public String country() {
    return country;
  }

  public String zipCode() {
    return zipCode;
  }

  @Override
  protected List<?> equalityComponents() {
    return Arrays.asList(street, city, state, country, zipCode);
  }
}
