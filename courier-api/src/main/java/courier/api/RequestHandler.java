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

import java.util.concurrent.CompletionStage;

/**
 * A handler that asynchronously produces the response for one type of {@link Request}.
 *
 * <p>One handler instance serves every {@link Mediator#send(Request) send} of its request type,
 * possibly from several threads at once. State kept across calls must be thread-safe.
 *
 * @param <Q> The type of Request this handler can process.
 * @param <R> The type of response the request produces.
 */
@FunctionalInterface
public interface RequestHandler<Q extends Request<R>, R> {

  /**
   * Handles a request.
   *
   * <p>The returned stage completes with the response, or exceptionally with the handler's
   * failure. Throwing from this method is reported the same way as a failed stage.
   *
   * @param request The request to handle.
   * @return A stage that completes with the response.
   */
  CompletionStage<R> handle(Q request);
}
