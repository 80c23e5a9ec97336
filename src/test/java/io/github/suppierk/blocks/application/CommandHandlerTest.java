package io.github.suppierk.blocks.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.blocks.domain.rules.BusinessRule;
import io.github.suppierk.blocks.domain.rules.BusinessRuleChecker;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CommandHandlerTest {
  record RenameCommand(UUID messageId, Instant createdAt, String name)
      implements Command<UUID, Instant> {}

  record NameMustNotBeBlankRule(String name) implements BusinessRule {
    @Override
    public boolean isBroken() {
      return name == null || name.isBlank();
    }

    @Override
    public String message() {
      return "Name cannot be blank.";
    }

    @Override
    public String code() {
      return "NAME_REQUIRED";
    }
  }

  static final class RenameHandler extends CommandHandler<RenameCommand, String> {
    RenameHandler() {
      super(RenameCommand.class);
    }

    @Override
    protected String run(final RenameCommand command) {
      BusinessRuleChecker.checkRule(new NameMustNotBeBlankRule(command.name()));

      if ("null".equals(command.name())) {
        return null;
      }

      if ("crash".equals(command.name())) {
        throw new IllegalStateException("Storage is down");
      }

      return command.name().trim();
    }
  }

  static final RenameHandler HANDLER = new RenameHandler();

  static RenameCommand rename(final String name) {
    return new RenameCommand(UUID.randomUUID(), Instant.now(), name);
  }

  @Nested
  class Create {
    @Test
    void when_command_class_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new CommandHandler<RenameCommand, String>(null) {
                @Override
                protected String run(final RenameCommand command) {
                  return command.name();
                }
              });
    }

    @Test
    void when_command_class_is_present_it_must_be_not_null() {
      assertNotNull(HANDLER.getCommandClass());
      assertEquals(RenameCommand.class, HANDLER.getCommandClass());
    }
  }

  @Nested
  class Handle {
    @Test
    void successful_run_returns_success() {
      final var result = HANDLER.handle(rename(" Widget "));

      assertTrue(result.isSuccess());
      assertEquals("Widget", result.getOrThrow());
    }

    @Test
    void broken_rule_returns_failure_with_report() {
      final var result = HANDLER.handle(rename(" "));

      assertFalse(result.isSuccess());
      final var failure = assertInstanceOf(CommandResult.Failure.class, result);
      assertEquals("NAME_REQUIRED", failure.error().code());
      assertEquals(422, failure.error().statusCode());
      assertEquals(1, failure.error().violations().size());
      assertThrows(IllegalStateException.class, result::getOrThrow);
    }

    @Test
    void unexpected_failure_is_rethrown() {
      assertThrows(Exception.class, () -> HANDLER.handle(rename("crash")));
    }

    @Test
    void null_result_is_treated_as_failure() {
      assertThrows(Exception.class, () -> HANDLER.handle(rename("null")));
    }

    @Test
    void when_command_is_null_illegal_argument_exception_is_thrown() {
      assertThrows(IllegalArgumentException.class, () -> HANDLER.handle(null));
    }
  }
}
