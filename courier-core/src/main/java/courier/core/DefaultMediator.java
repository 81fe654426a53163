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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import courier.api.BlockingRequestHandler;
import courier.api.Mediator;
import courier.api.NoHandlerRegisteredException;
import courier.api.Request;
import courier.api.RequestHandler;
import courier.api.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The default {@link Mediator}.
 *
 * <p>Handlers are kept in a registry keyed by request class, one handler per class. By default a
 * second registration for the same class replaces the first and logs a warning; build the
 * mediator with {@link DuplicateHandlerPolicy#REJECT} to refuse it instead.
 *
 * <p>{@link #send(Request)} looks the handler up and invokes it on the caller's thread.
 * Asynchronous handlers decide themselves where their work runs; synchronous ones registered
 * through {@code registerBlockingHandler} run on the blocking-handler executor.
 *
 * <p><b>Resource Management:</b> A mediator that created its own executor shuts it down on
 * {@link #close()}. An executor passed to {@link Builder#blockingExecutor(Executor)} is left to
 * its owner.
 */
@ThreadSafe
public class DefaultMediator implements Mediator, AutoCloseable {

  private final Logger log = LoggerFactory.getLogger(DefaultMediator.class);

  private final HandlerRegistry registry;
  private final Executor blockingExecutor;
  private final boolean ownExecutor;

  /** Creates a mediator with the defaults of {@link #builder()}. */
  public DefaultMediator() {
    this(new Builder());
  }

  private DefaultMediator(Builder builder) {
    this.registry = new HandlerRegistry(builder.duplicateHandlerPolicy);
    if (builder.blockingExecutor != null) {
      this.blockingExecutor = builder.blockingExecutor;
      this.ownExecutor = false;
    } else {
      this.blockingExecutor =
          Executors.newCachedThreadPool(
              new ThreadFactoryBuilder()
                  .setNameFormat("courier-blocking-handler-%d")
                  .setDaemon(true)
                  .build());
      this.ownExecutor = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  @CanIgnoreReturnValue
  public <Q extends Request<R>, R> Mediator registerHandler(RequestHandler<Q, R> handler) {
    Objects.requireNonNull(handler, "handler");
    Class<Q> requestType = RequestTypes.inferFrom(handler, RequestTypes.HANDLER_REQUEST);
    return register(HandlerAdapter.of(requestType, handler));
  }

  @Override
  @CanIgnoreReturnValue
  public <Q extends Request<R>, R> Mediator registerHandler(
      Class<Q> requestType, RequestHandler<Q, R> handler) {
    Objects.requireNonNull(requestType, "requestType");
    Objects.requireNonNull(handler, "handler");
    return register(HandlerAdapter.of(RequestTypes.checkConcrete(requestType), handler));
  }

  @Override
  @CanIgnoreReturnValue
  public <Q extends Request<R>, R> Mediator registerBlockingHandler(
      BlockingRequestHandler<Q, R> handler) {
    Objects.requireNonNull(handler, "handler");
    Class<Q> requestType = RequestTypes.inferFrom(handler, RequestTypes.BLOCKING_HANDLER_REQUEST);
    return register(HandlerAdapter.offloaded(requestType, handler, blockingExecutor));
  }

  @Override
  @CanIgnoreReturnValue
  public <Q extends Request<R>, R> Mediator registerBlockingHandler(
      Class<Q> requestType, BlockingRequestHandler<Q, R> handler) {
    Objects.requireNonNull(requestType, "requestType");
    Objects.requireNonNull(handler, "handler");
    return register(
        HandlerAdapter.offloaded(
            RequestTypes.checkConcrete(requestType), handler, blockingExecutor));
  }

  private Mediator register(HandlerAdapter<?, ?> adapter) {
    HandlerAdapter<?, ?> previous = registry.put(adapter);
    if (previous != null) {
      log.warn(
          "Handler {} for request {} replaced by {}",
          previous.handlerType().getName(),
          adapter.requestType().getName(),
          adapter.handlerType().getName());
    } else {
      log.debug(
          "Registered handler {} for request {}",
          adapter.handlerType().getName(),
          adapter.requestType().getName());
    }
    return this;
  }

  @Override
  public <R> CompletableFuture<Result<R>> send(Request<R> request) {
    Objects.requireNonNull(request, "request");
    Class<?> requestType = request.getClass();
    HandlerAdapter<?, ?> adapter = registry.get(requestType);
    if (adapter == null) {
      log.debug("No handler registered for request {}", requestType.getName());
      return CompletableFuture.completedFuture(
          new Result.Failure<>(new NoHandlerRegisteredException(requestType)));
    }
    return adapter.invoke(request);
  }

  @Override
  public void close() {
    if (ownExecutor) {
      ((ExecutorService) blockingExecutor).shutdown();
    }
  }

  /** Configures a {@link DefaultMediator}. */
  public static final class Builder {

    private DuplicateHandlerPolicy duplicateHandlerPolicy = DuplicateHandlerPolicy.REPLACE;
    private Executor blockingExecutor;

    private Builder() {}

    /** Defaults to {@link DuplicateHandlerPolicy#REPLACE}. */
    @CanIgnoreReturnValue
    public Builder duplicateHandlerPolicy(DuplicateHandlerPolicy duplicateHandlerPolicy) {
      this.duplicateHandlerPolicy =
          Objects.requireNonNull(duplicateHandlerPolicy, "duplicateHandlerPolicy");
      return this;
    }

    /**
     * Sets the executor that runs blocking handlers. Defaults to a cached pool of daemon threads
     * owned, and shut down, by the mediator.
     */
    @CanIgnoreReturnValue
    public Builder blockingExecutor(Executor blockingExecutor) {
      this.blockingExecutor = Objects.requireNonNull(blockingExecutor, "blockingExecutor");
      return this;
    }

    public DefaultMediator build() {
      return new DefaultMediator(this);
    }
  }
}
