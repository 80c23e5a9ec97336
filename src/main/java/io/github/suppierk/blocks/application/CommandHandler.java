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

import io.github.suppierk.blocks.Suspicious;
import io.github.suppierk.blocks.domain.DomainException;
import io.github.suppierk.java.Try;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link Command}:
 *
 * <ul>
 *   <li>Load or create exactly one aggregate, usually via a repository or a factory.
 *   <li>Invoke one of its methods, which checks business rules and raises domain events.
 *   <li>Commit the unit of work, which in turn publishes integration events.
 * </ul>
 *
 * <p>Expected failures are {@link DomainException}s: they are recovered into {@link
 * CommandResult.Failure} with an {@link ErrorReport}. Everything else is a bug or an infrastructure
 * problem and is rethrown as is.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever parameters are expected to be provided by consumer
 * must be checked with the help of {@link Suspicious} methods.
 *
 * @param <COMMAND> the type of the particular {@link Command}
 * @param <OUTPUT> the expected output type of the given command
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract class CommandHandler<
  COMMAND extends Command<?, ?>,
  OUTPUT
> extends Suspicious {
// @formatter:on
  private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);

  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link CommandHandler} for a specific {@link Command} class.
   *
   * @param commandClass the class of the {@link Command} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected CommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
  }

  /**
   * Returns the class type of the command being handled by this {@link CommandHandler}.
   *
   * @return the class type of the command
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Executes the core logic of the command.
   *
   * @param command being executed, never {@code null}
   * @return the result of the command execution, must not be {@code null}
   * @throws Exception if execution failed
   */
  @SuppressWarnings("squid:S112")
  protected abstract OUTPUT run(final COMMAND command) throws Exception;

  /**
   * Executes the given command.
   *
   * @param command to be executed
   * @return {@link CommandResult.Success} with the output or {@link CommandResult.Failure} if the
   *     command was rejected by the domain
   * @throws IllegalArgumentException if command is {@code null}
   * @throws IllegalStateException if handler produced {@code null}
   */
  public final CommandResult<OUTPUT> handle(final COMMAND command) {
    final COMMAND nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final String commandName = commandClass.getSimpleName();

    final Try<OUTPUT> output =
        Try.of(() -> throwIllegalStateIfNull(run(nonNullCommand), "Command handler result"));

    final AtomicReference<CommandResult<OUTPUT>> rejection = new AtomicReference<>();

    output.ifSuccess(
        result -> log.debug("{} '{}' succeeded", commandName, nonNullCommand.messageId()));

    output.ifFailure(
        reason -> {
          if (reason instanceof DomainException domainException) {
            log.info(
                "{} '{}' rejected with '{}': {}",
                commandName,
                nonNullCommand.messageId(),
                domainException.getCode(),
                domainException.getMessage());
            rejection.set(new CommandResult.Failure<>(ErrorReport.from(domainException)));
          } else {
            log.error("{} '{}' failed", commandName, nonNullCommand.messageId(), reason);
          }
        });

    final CommandResult<OUTPUT> rejected = rejection.get();
    if (rejected != null) {
      return rejected;
    }

    return new CommandResult.Success<>(output.get());
  }
}
