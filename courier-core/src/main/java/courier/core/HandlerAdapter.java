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

package courier.core;

import courier.api.BlockingRequestHandler;
import courier.api.HandlerExecutionException;
import courier.api.MediatorStateException;
import courier.api.Request;
import courier.api.RequestHandler;
import courier.api.Result;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Hides the concrete types of a handler behind one call shape, so handlers of unrelated request
 * types can share a registry. The request class recorded here is also the registry key.
 *
 * @param <Q> The request type.
 * @param <R> The response type.
 */
final class HandlerAdapter<Q extends Request<R>, R> {

  private final Class<Q> requestType;
  private final Class<?> handlerType;
  private final RequestHandler<Q, R> handler;

  private HandlerAdapter(Class<Q> requestType, Class<?> handlerType, RequestHandler<Q, R> handler) {
    this.requestType = requestType;
    this.handlerType = handlerType;
    this.handler = handler;
  }

  static <Q extends Request<R>, R> HandlerAdapter<Q, R> of(
      Class<Q> requestType, RequestHandler<Q, R> handler) {
    return new HandlerAdapter<>(requestType, handler.getClass(), handler);
  }

  /** Adapts a synchronous handler by running each call on {@code executor}. */
  static <Q extends Request<R>, R> HandlerAdapter<Q, R> offloaded(
      Class<Q> requestType, BlockingRequestHandler<Q, R> handler, Executor executor) {
    RequestHandler<Q, R> async =
        request -> {
          CompletableFuture<R> future = new CompletableFuture<>();
          executor.execute(
              () -> {
                try {
                  future.complete(handler.handle(request));
                } catch (Throwable e) {
                  if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                  }
                  future.completeExceptionally(e);
                }
              });
          return future;
        };
    return new HandlerAdapter<>(requestType, handler.getClass(), async);
  }

  Class<Q> requestType() {
    return requestType;
  }

  Class<?> handlerType() {
    return handlerType;
  }

  /**
   * Invokes the handler with a request looked up under {@link #requestType()}.
   *
   * @throws MediatorStateException If the request is not an instance of {@link #requestType()}.
   */
  @SuppressWarnings("unchecked")
  <T> CompletableFuture<Result<T>> invoke(Request<T> request) {
    if (!requestType.isInstance(request)) {
      throw new MediatorStateException(
          "Adapter for "
              + requestType.getName()
              + " was resolved for a request of type "
              + request.getClass().getName());
    }
    // Q fixes its response type, so a Q is a Request<T> only when T is R.
    return (CompletableFuture<Result<T>>) (CompletableFuture<?>) dispatch(requestType.cast(request));
  }

  private CompletableFuture<Result<R>> dispatch(Q request) {
    CompletionStage<R> stage;
    try {
      stage = handler.handle(request);
    } catch (Throwable e) {
      return CompletableFuture.completedFuture(failure(e));
    }
    if (stage == null) {
      return CompletableFuture.completedFuture(
          new Result.Failure<>(
              new HandlerExecutionException(
                  requestType, handlerType.getName() + " returned no completion stage")));
    }
    return stage.handle(this::toResult).toCompletableFuture();
  }

  private Result<R> toResult(R value, Throwable error) {
    if (error != null) {
      return failure(error);
    }
    return new Result.Success<>(value);
  }

  private Result<R> failure(Throwable error) {
    Throwable cause =
        error instanceof CompletionException && error.getCause() != null
            ? error.getCause()
            : error;
    return new Result.Failure<>(new HandlerExecutionException(requestType, cause));
  }
}
