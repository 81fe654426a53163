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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;

import java.util.concurrent.CompletableFuture;

/**
 * {@code Mediator} decouples the code that issues a {@link Request} from the code that handles
 * it. Handlers are registered once per request type; at call time the mediator routes each
 * request to the handler registered for the request's runtime class.
 *
 * <p>Exactly one handler exists per request type. Registering a second handler for a type that
 * already has one replaces it by default (last registration wins); implementations may be
 * configured to reject the second registration with a {@link DuplicateHandlerException} instead.
 *
 * <p>Implementations must allow registration and {@link #send(Request)} to run concurrently.
 */
public interface Mediator {

  /**
   * Registers a handler, inferring the request type from the handler class's declared type
   * arguments.
   *
   * <p>The request type cannot be inferred for lambdas and method references; register those
   * with {@link #registerHandler(Class, RequestHandler)}.
   *
   * @param handler The handler to register.
   * @param <Q> The request type.
   * @param <R> The response type.
   * @return This mediator.
   * @throws IllegalArgumentException If the request type cannot be inferred or is not a concrete
   *     class.
   * @throws DuplicateHandlerException If duplicates are rejected and the type is registered.
   */
  @CanIgnoreReturnValue
  <Q extends Request<R>, R> Mediator registerHandler(RequestHandler<Q, R> handler);

  /**
   * Registers a handler for an explicitly given request type.
   *
   * @param requestType The concrete class of requests the handler serves.
   * @param handler The handler to register.
   * @param <Q> The request type.
   * @param <R> The response type.
   * @return This mediator.
   * @throws IllegalArgumentException If {@code requestType} is an interface or abstract class.
   * @throws DuplicateHandlerException If duplicates are rejected and the type is registered.
   */
  @CanIgnoreReturnValue
  <Q extends Request<R>, R> Mediator registerHandler(
      Class<Q> requestType, RequestHandler<Q, R> handler);

  /**
   * Registers a synchronous handler, inferring the request type from the handler class. The
   * handler runs off the sender's thread.
   *
   * @see #registerHandler(RequestHandler)
   */
  @CanIgnoreReturnValue
  <Q extends Request<R>, R> Mediator registerBlockingHandler(BlockingRequestHandler<Q, R> handler);

  /**
   * Registers a synchronous handler for an explicitly given request type.
   *
   * @see #registerHandler(Class, RequestHandler)
   */
  @CanIgnoreReturnValue
  <Q extends Request<R>, R> Mediator registerBlockingHandler(
      Class<Q> requestType, BlockingRequestHandler<Q, R> handler);

  /**
   * Sends a request to the handler registered for its runtime class.
   *
   * <p>The returned future always completes normally. It holds a {@link Result.Success} with the
   * handler's response, or a {@link Result.Failure} whose cause is either a {@link
   * NoHandlerRegisteredException} (no handler was invoked) or a {@link HandlerExecutionException}
   * wrapping the handler's own failure.
   *
   * @param request The request to send.
   * @param <R> The response type, inferred from the request.
   * @return A future of the outcome.
   * @throws MediatorStateException If the registry is internally inconsistent.
   */
  @CheckReturnValue
  <R> CompletableFuture<Result<R>> send(Request<R> request);
}
