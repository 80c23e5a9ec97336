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

package io.github.suppierk.blocks.jooq;

import io.github.suppierk.blocks.domain.specification.Attribute;
import io.github.suppierk.blocks.domain.specification.Criterion;
import io.github.suppierk.blocks.domain.specification.Specification;
import java.util.function.Function;
import org.jooq.Condition;
import org.jooq.Field;
import org.jooq.impl.DSL;

/**
 * Translates {@link Criterion} trees into jOOQ {@link Condition}s, allowing {@link Specification}s
 * to be executed by the database.
 *
 * <p>Translation rules:
 *
 * <ul>
 *   <li>Every {@link Attribute} is mapped to a {@link Field} by the provided resolver, by default
 *       an unqualified column named after {@link Attribute#name()}.
 *   <li>{@link Enum} values are bound by their {@link Enum#name()}, enum attributes are treated as
 *       character columns.
 *   <li>Boolean nodes map to {@link DSL#and}, {@link DSL#or} and {@link DSL#not}, which gives the
 *       same three-valued semantics as in-memory evaluation.
 * </ul>
 */
public final class JooqCriterionCompiler {
  private final Function<Attribute<?, ?>, Field<?>> fieldResolver;

  /**
   * @param fieldResolver mapping attributes to table fields
   * @throws IllegalArgumentException if resolver is {@code null}
   */
  public JooqCriterionCompiler(final Function<Attribute<?, ?>, Field<?>> fieldResolver) {
    if (fieldResolver == null) {
      throw new IllegalArgumentException("Field resolver cannot be null");
    }

    this.fieldResolver = fieldResolver;
  }

  /**
   * @return a compiler resolving attributes to unqualified columns named after them
   */
  public static JooqCriterionCompiler withUnqualifiedColumns() {
    return new JooqCriterionCompiler(JooqCriterionCompiler::unqualifiedField);
  }

  /**
   * @param attribute to describe as a column
   * @return an unqualified column named after the attribute
   */
  public static Field<?> unqualifiedField(final Attribute<?, ?> attribute) {
    return DSL.field(DSL.name(attribute.name()), columnType(attribute.type()));
  }

  /**
   * @param specification to translate
   * @return equivalent condition
   */
  public Condition compile(final Specification<?> specification) {
    if (specification == null) {
      throw new IllegalArgumentException("Specification cannot be null");
    }

    return compile(specification.toCriterion());
  }

  /**
   * @param criterion to translate
   * @return equivalent condition
   */
  public Condition compile(final Criterion<?> criterion) {
    if (criterion == null) {
      throw new IllegalArgumentException("Criterion cannot be null");
    }

    if (criterion instanceof Criterion.Comparison<?, ?> comparison) {
      return compileComparison(comparison);
    }

    if (criterion instanceof Criterion.In<?, ?> in) {
      return field(in.attribute()).in(in.values().stream().map(this::toColumnValue).toList());
    }

    if (criterion instanceof Criterion.IsNull<?, ?> isNull) {
      return field(isNull.attribute()).isNull();
    }

    if (criterion instanceof Criterion.And<?> and) {
      return DSL.and(and.operands().stream().map(this::compile).toList());
    }

    if (criterion instanceof Criterion.Or<?> or) {
      return DSL.or(or.operands().stream().map(this::compile).toList());
    }

    if (criterion instanceof Criterion.Not<?> not) {
      return DSL.not(compile(not.operand()));
    }

    throw new IllegalArgumentException(
        "Unsupported criterion '%s'".formatted(criterion.getClass().getSimpleName()));
  }

  private Condition compileComparison(final Criterion.Comparison<?, ?> comparison) {
    final Field<Object> field = field(comparison.attribute());
    final Object value = toColumnValue(comparison.value());

    return switch (comparison.operator()) {
      case EQ -> field.eq(value);
      case NE -> field.ne(value);
      case LT -> field.lt(value);
      case LE -> field.le(value);
      case GT -> field.gt(value);
      case GE -> field.ge(value);
    };
  }

  @SuppressWarnings("unchecked")
  private Field<Object> field(final Attribute<?, ?> attribute) {
    final Field<?> field = fieldResolver.apply(attribute);
    if (field == null) {
      throw new IllegalStateException(
          "Field for attribute '%s' cannot be null".formatted(attribute.name()));
    }

    return (Field<Object>) field;
  }

  private Object toColumnValue(final Object value) {
    if (value instanceof Enum<?> enumValue) {
      return enumValue.name();
    }

    return value;
  }

  private static Class<?> columnType(final Class<?> attributeType) {
    return attributeType.isEnum() ? String.class : attributeType;
  }
}
