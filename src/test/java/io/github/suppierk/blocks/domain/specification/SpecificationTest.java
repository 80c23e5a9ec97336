package io.github.suppierk.blocks.domain.specification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SpecificationTest {
  record Product(String name, Integer stock, String category) {}

  static final Attribute<Product, String> NAME =
      Attribute.of("name", String.class, Product::name);
  static final Attribute<Product, Integer> STOCK =
      Attribute.of("stock", Integer.class, Product::stock);
  static final Attribute<Product, String> CATEGORY =
      Attribute.of("category", String.class, Product::category);

  static final Specification<Product> IN_STOCK = Specification.of(STOCK.gt(0));
  static final Specification<Product> BOOKS = Specification.of(CATEGORY.eq("books"));
  static final Specification<Product> CHEAP_NAME = Specification.of(NAME.in("pen", "pencil"));

  static final Product BOOK_IN_STOCK = new Product("novel", 3, "books");
  static final Product BOOK_SOLD_OUT = new Product("atlas", 0, "books");
  static final Product PEN = new Product("pen", 10, "office");
  static final Product UNKNOWN_STOCK = new Product("map", null, "books");

  @Nested
  class Leaves {
    @Test
    void comparisons_evaluate_against_attribute_value() {
      assertTrue(STOCK.ge(3).test(BOOK_IN_STOCK));
      assertTrue(STOCK.le(3).test(BOOK_IN_STOCK));
      assertFalse(STOCK.lt(3).test(BOOK_IN_STOCK));
      assertTrue(STOCK.ne(4).test(BOOK_IN_STOCK));
    }

    @Test
    void in_matches_any_of_values() {
      assertTrue(CHEAP_NAME.isSatisfiedBy(PEN));
      assertFalse(CHEAP_NAME.isSatisfiedBy(BOOK_IN_STOCK));
    }

    @Test
    void comparison_value_cannot_be_null() {
      assertThrows(IllegalArgumentException.class, () -> STOCK.eq(null));
    }

    @Test
    void in_values_cannot_be_empty() {
      assertThrows(IllegalArgumentException.class, () -> STOCK.in(List.of()));
    }

    @Test
    void is_null_is_the_only_test_for_absent_values() {
      assertTrue(STOCK.isNull().test(UNKNOWN_STOCK));
      assertFalse(STOCK.isNotNull().test(UNKNOWN_STOCK));
      assertTrue(STOCK.isNotNull().test(PEN));
    }
  }

  @Nested
  class Composition {
    @Test
    void and_requires_both_sides() {
      final var availableBooks = BOOKS.and(IN_STOCK);

      assertTrue(availableBooks.isSatisfiedBy(BOOK_IN_STOCK));
      assertFalse(availableBooks.isSatisfiedBy(BOOK_SOLD_OUT));
      assertFalse(availableBooks.isSatisfiedBy(PEN));
    }

    @Test
    void or_requires_any_side() {
      final var booksOrStocked = BOOKS.or(IN_STOCK);

      assertTrue(booksOrStocked.isSatisfiedBy(BOOK_SOLD_OUT));
      assertTrue(booksOrStocked.isSatisfiedBy(PEN));
      assertFalse(booksOrStocked.isSatisfiedBy(new Product("chair", 0, "furniture")));
    }

    @Test
    void not_inverts_the_result() {
      assertTrue(IN_STOCK.not().isSatisfiedBy(BOOK_SOLD_OUT));
      assertFalse(IN_STOCK.not().isSatisfiedBy(PEN));
    }

    @Test
    void double_negation_returns_original_criterion() {
      final var criterion = STOCK.gt(0);
      assertSame(criterion, Criterion.not(Criterion.not(criterion)));
    }

    @Test
    void and_is_associative_in_structure() {
      final var left = BOOKS.and(IN_STOCK).and(CHEAP_NAME).toCriterion();
      final var right = BOOKS.and(IN_STOCK.and(CHEAP_NAME)).toCriterion();

      assertEquals(left, right);
      assertEquals(3, assertInstanceOf(Criterion.And.class, left).operands().size());
    }

    @Test
    void or_is_associative_in_structure() {
      final var left = BOOKS.or(IN_STOCK).or(CHEAP_NAME).toCriterion();
      final var right = BOOKS.or(IN_STOCK.or(CHEAP_NAME)).toCriterion();

      assertEquals(left, right);
    }

    @Test
    void composed_specifications_do_not_change_operands() {
      final var before = BOOKS.toCriterion();
      BOOKS.and(IN_STOCK);

      assertEquals(before, BOOKS.toCriterion());
    }

    @Test
    void composition_with_null_throws_illegal_argument_exception() {
      assertThrows(IllegalArgumentException.class, () -> BOOKS.and(null));
      assertThrows(IllegalArgumentException.class, () -> BOOKS.or(null));
    }

    @Test
    void null_candidate_throws_illegal_argument_exception() {
      assertThrows(IllegalArgumentException.class, () -> BOOKS.isSatisfiedBy(null));
    }
  }

  @Nested
  class UnknownValues {
    @Test
    void comparison_with_absent_value_is_unknown() {
      assertNull(STOCK.gt(0).evaluate(UNKNOWN_STOCK));
      assertFalse(IN_STOCK.isSatisfiedBy(UNKNOWN_STOCK));
    }

    @Test
    void negation_of_unknown_stays_unknown() {
      assertNull(IN_STOCK.not().toCriterion().evaluate(UNKNOWN_STOCK));
      assertFalse(IN_STOCK.not().isSatisfiedBy(UNKNOWN_STOCK));
    }

    @Test
    void false_dominates_unknown_in_conjunction() {
      final var criterion = Criterion.and(STOCK.gt(0), CATEGORY.eq("office"));
      assertEquals(Boolean.FALSE, criterion.evaluate(UNKNOWN_STOCK));
    }

    @Test
    void true_dominates_unknown_in_disjunction() {
      final var criterion = Criterion.or(STOCK.gt(0), CATEGORY.eq("books"));
      assertEquals(Boolean.TRUE, criterion.evaluate(UNKNOWN_STOCK));
    }

    @Test
    void unknown_conjunction_with_true_stays_unknown() {
      final var criterion = Criterion.and(STOCK.gt(0), CATEGORY.eq("books"));
      assertNull(criterion.evaluate(UNKNOWN_STOCK));
    }
  }
}
