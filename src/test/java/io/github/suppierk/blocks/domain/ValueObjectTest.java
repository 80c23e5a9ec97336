package io.github.suppierk.blocks.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ValueObjectTest {
  static final class Dimensions extends ValueObject {
    private final int width;
    private final int height;
    private final String unit;

    Dimensions(final int width, final int height, final String unit) {
      this.width = width;
      this.height = height;
      this.unit = unit;
    }

    @Override
    protected List<?> equalityComponents() {
      return Arrays.asList(width, height, unit);
    }
  }

  static final class Size extends ValueObject {
    private final int width;
    private final int height;
    private final String unit;

    Size(final int width, final int height, final String unit) {
      this.width = width;
      this.height = height;
      this.unit = unit;
    }

    @Override
    protected List<?> equalityComponents() {
      return Arrays.asList(width, height, unit);
    }
  }

  @Test
  void values_with_equal_components_are_equal() {
    final var left = new Dimensions(10, 20, "cm");
    final var right = new Dimensions(10, 20, "cm");

    assertEquals(left, right);
    assertEquals(left.hashCode(), right.hashCode());
  }

  @Test
  void values_with_different_components_are_not_equal() {
    assertNotEquals(new Dimensions(10, 20, "cm"), new Dimensions(20, 10, "cm"));
  }

  @Test
  void values_of_different_types_are_not_equal_even_with_same_components() {
    assertNotEquals(new Dimensions(10, 20, "cm"), new Size(10, 20, "cm"));
  }

  @Test
  void null_components_participate_in_equality() {
    assertEquals(new Dimensions(1, 1, null), new Dimensions(1, 1, null));
    assertNotEquals(new Dimensions(1, 1, null), new Dimensions(1, 1, "cm"));
  }

  @Test
  void default_string_representation_lists_components() {
    assertEquals("Dimensions[10, 20, cm]", new Dimensions(10, 20, "cm").toString());
  }
}
