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
 * A marker for values that can be sent through a {@link Mediator}.
 *
 * <p>The type argument fixes the single response type a request produces, so {@link
 * Mediator#send(Request)} can infer it from the request alone. Requests are routed by their
 * runtime class, so implementations should be concrete, typically records:
 *
 * <pre>{@code
 * public record GetBalance(String accountId) implements Request<BigDecimal> {}
 * }</pre>
 *
 * @param <R> The type of response a handler produces for this request.
 */
public interface Request<R> {}
