package io.github.suppierk.blocks.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EntityTest {
  static final class Customer extends Entity<Long> {
    Customer() {
      super();
    }

    Customer(final Long id) {
      super(id);
    }

    void assign(final Long id) {
      setId(id);
    }

    @Override
    protected boolean isDefaultIdentifier(final Long candidate) {
      return candidate == 0L;
    }
  }

  static final class Supplier extends Entity<Long> {
    Supplier(final Long id) {
      super(id);
    }
  }

  @Nested
  class Identity {
    @Test
    void when_identifier_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new Customer(null));
    }

    @Test
    void when_identifier_is_assigned_twice_illegal_state_exception_is_thrown() {
      final var customer = new Customer(1L);
      assertThrows(IllegalStateException.class, () -> customer.assign(2L));
    }

    @Test
    void when_identifier_is_assigned_later_entity_stops_being_transient() {
      final var customer = new Customer();
      assertTrue(customer.isTransient());

      customer.assign(5L);

      assertFalse(customer.isTransient());
      assertEquals(5L, customer.getId());
    }

    @Test
    void when_identifier_is_default_entity_is_transient() {
      assertTrue(new Customer(0L).isTransient());
    }
  }

  @Nested
  class Equality {
    @Test
    void entities_of_same_type_and_identifier_are_equal() {
      final var left = new Customer(1L);
      final var right = new Customer(1L);

      assertEquals(left, right);
      assertEquals(left.hashCode(), right.hashCode());
    }

    @Test
    void entities_of_different_types_are_not_equal_even_with_same_identifier() {
      assertNotEquals(new Customer(1L), new Supplier(1L));
    }

    @Test
    void entities_with_different_identifiers_are_not_equal() {
      assertNotEquals(new Customer(1L), new Customer(2L));
    }

    @Test
    void transient_entities_are_equal_only_to_themselves() {
      final var transientCustomer = new Customer();

      assertEquals(transientCustomer, transientCustomer);
      assertNotEquals(transientCustomer, new Customer());
      assertNotEquals(new Customer(0L), new Customer(0L));
    }

    @Test
    void entity_is_not_equal_to_null() {
      assertNotEquals(null, new Customer(1L));
    }

    @Test
    void hash_code_is_stable_for_set_membership() {
      final Set<Customer> customers = new HashSet<>();
      customers.add(new Customer(1L));
      customers.add(new Customer(1L));
      customers.add(new Customer());
      customers.add(new Customer());

      assertEquals(3, customers.size());
    }
  }
}
