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

/**
 * A handler whose logic runs synchronously. The mediator runs it on a dedicated executor so that
 * callers of {@link Mediator#send(Request)} are never blocked by it.
 *
 * @param <Q> The type of Request this handler can process.
 * @param <R> The type of response the request produces.
 */
@FunctionalInterface
public interface BlockingRequestHandler<Q extends Request<R>, R> {

  /**
   * Handles a request on the calling (executor) thread.
   *
   * @param request The request to handle.
   * @return The response.
   * @throws Exception Any failure, reported to the sender as a {@link HandlerExecutionException}.
   */
  R handle(Q request) throws Exception;
}
