/*
 * Copyright 2025 XueFeng Ma
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

package courier.api;

import java.util.Objects;
import java.util.function.Function;

/**
 * Represents the outcome of a dispatch that can either succeed with a value of type {@code T} or
 * fail with a {@link Throwable} cause.
 *
 * <p>{@link Mediator#send(Request)} reports every failure through this type instead of completing
 * its future exceptionally, so callers branch on {@link #isSuccess()} or rethrow with {@link
 * #getOrThrow()}.
 *
 * @param <T> The type of the value on success.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

  /**
   * Returns the encapsulated value if this result is a {@link Success}, or {@code null} if it is
   * a {@link Failure}. A successful result may itself carry {@code null}, for example for {@code
   * Request<Void>}; use {@link #isSuccess()} to tell the two apart.
   *
   * @return The successful value, or {@code null} if it's a failure.
   */
  T value();

  /**
   * Returns the cause of the failure if this result is a {@link Failure}.
   *
   * @return The {@link Throwable} cause if it's a failure, otherwise {@code null}.
   */
  Throwable cause();

  /**
   * Transforms the value of a successful result. A failure is returned as is, retyped.
   *
   * @param mapper The function to apply to the value.
   * @param <M> The type of the value returned by the mapping function.
   * @return A new result holding the mapped value, or the same failure.
   */
  <M> Result<M> map(Function<? super T, ? extends M> mapper);

  /**
   * Returns the encapsulated value, or throws the encapsulated cause if this is a failure.
   *
   * @return The successful value.
   * @throws Throwable The encapsulated cause if this result is a failure.
   */
  T getOrThrow() throws Throwable;

  /**
   * Indicates whether this result represents a successful outcome.
   *
   * @return {@code true} if this is a {@link Success}, {@code false} otherwise.
   */
  default boolean isSuccess() {
    return this instanceof Result.Success<T>;
  }

  /**
   * Indicates whether this result represents a failed outcome.
   *
   * @return {@code true} if this is a {@link Failure}, {@code false} otherwise.
   */
  default boolean isFailure() {
    return this instanceof Result.Failure<T>;
  }

  /**
   * A successful outcome.
   *
   * @param <T> The type of the successful value.
   * @param value The value produced by the handler; may be {@code null}.
   */
  record Success<T>(T value) implements Result<T> {

    @Override
    public Throwable cause() {
      return null;
    }

    @Override
    public <M> Result<M> map(Function<? super T, ? extends M> mapper) {
      return new Success<>(mapper.apply(value));
    }

    @Override
    public T getOrThrow() {
      return value;
    }
  }

  /**
   * A failed outcome.
   *
   * @param <T> The type of the expected successful value (not present in failure).
   * @param cause The {@link Throwable} that caused the failure.
   */
  record Failure<T>(Throwable cause) implements Result<T> {

    public Failure {
      Objects.requireNonNull(cause, "cause");
    }

    /**
     * Always returns {@code null} for a failed result.
     *
     * @return {@code null}.
     */
    @Override
    public T value() {
      return null;
    }

    @Override
    public <M> Result<M> map(Function<? super T, ? extends M> mapper) {
      return new Failure<>(cause);
    }

    /**
     * Throws the encapsulated {@link Throwable} cause.
     *
     * @throws Throwable The encapsulated cause.
     */
    @Override
    public T getOrThrow() throws Throwable {
      throw cause;
    }
  }
}
