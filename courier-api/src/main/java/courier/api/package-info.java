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

/**
 * The public contract of Courier, an in-process mediator.
 *
 * <p>A request type declares its response type through {@link courier.api.Request}; a handler
 * for it implements {@link courier.api.RequestHandler}. Senders only ever see the {@link
 * courier.api.Mediator}:
 *
 * <pre>{@code
 * import courier.api.Request;
 * import courier.api.RequestHandler;
 * import courier.api.Result;
 * import courier.core.DefaultMediator;
 *
 * import java.util.concurrent.CompletableFuture;
 * import java.util.concurrent.CompletionStage;
 *
 * public record Ping() implements Request<String> {}
 *
 * public class PingHandler implements RequestHandler<Ping, String> {
 *   public CompletionStage<String> handle(Ping request) {
 *     return CompletableFuture.completedFuture("pong!");
 *   }
 * }
 *
 * try (DefaultMediator mediator = DefaultMediator.builder().build()) {
 *   mediator.registerHandler(new PingHandler());
 *   Result<String> result = mediator.send(new Ping()).join();
 * }
 * }</pre>
 */
package courier.api;
