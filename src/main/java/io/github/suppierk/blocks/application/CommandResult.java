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
 * Outcome of {@link CommandHandler#handle(Command)}.
 *
 * @param <OUTPUT> is the type of the successful output
 */
@SuppressWarnings("squid:S119")
public sealed interface CommandResult<OUTPUT>
    permits CommandResult.Success, CommandResult.Failure {

  /**
   * @return {@code true} if the command succeeded
   */
  boolean isSuccess();

  /**
   * @return output of the successful command
   * @throws IllegalStateException if the command failed
   */
  OUTPUT getOrThrow();

  /**
   * @param value produced by the command
   * @param <OUTPUT> is the type of the output
   */
  record Success<OUTPUT>(OUTPUT value) implements CommandResult<OUTPUT> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public OUTPUT getOrThrow() {
      return value;
    }
  }

  /**
   * @param error describing why the command was rejected
   * @param <OUTPUT> is the type of the output
   */
  record Failure<OUTPUT>(ErrorReport error) implements CommandResult<OUTPUT> {
    public Failure {
      if (error == null) {
        throw new IllegalArgumentException("Error report cannot be null");
      }
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public OUTPUT getOrThrow() {
      throw new IllegalStateException(
          "Command failed with '%s': %s".formatted(error.code(), error.message()));
    }
  }
}
