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

import com.google.common.reflect.TypeToken;
import courier.api.BlockingRequestHandler;
import courier.api.Request;
import courier.api.RequestHandler;

import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;

import static com.google.common.base.Preconditions.checkArgument;

/** Derives the registry key of a handler: the concrete request class it serves. */
final class RequestTypes {

  static final TypeVariable<?> HANDLER_REQUEST = RequestHandler.class.getTypeParameters()[0];
  static final TypeVariable<?> BLOCKING_HANDLER_REQUEST =
      BlockingRequestHandler.class.getTypeParameters()[0];

  private RequestTypes() {}

  /**
   * Resolves {@code requestParameter} against the generic supertypes of the handler's class.
   *
   * @throws IllegalArgumentException If the parameter is not bound to a class, as for lambdas, or
   *     the class is not concrete.
   */
  @SuppressWarnings("unchecked")
  static <Q> Class<Q> inferFrom(Object handler, TypeVariable<?> requestParameter) {
    Type resolved = TypeToken.of(handler.getClass()).resolveType(requestParameter).getType();
    Class<?> rawType;
    if (resolved instanceof Class<?> type) {
      rawType = type;
    } else if (resolved instanceof ParameterizedType parameterized) {
      rawType = (Class<?>) parameterized.getRawType();
    } else {
      throw new IllegalArgumentException(
          "Cannot infer the request type of "
              + handler.getClass().getName()
              + " (resolved to "
              + resolved.getTypeName()
              + "); register it with an explicit request class");
    }
    return checkConcrete((Class<Q>) rawType);
  }

  /** Requests are looked up by runtime class, which is never an interface or abstract. */
  static <Q> Class<Q> checkConcrete(Class<Q> requestType) {
    checkArgument(
        Request.class.isAssignableFrom(requestType),
        "%s does not implement %s",
        requestType.getName(),
        Request.class.getName());
    checkArgument(
        !requestType.isInterface() && !Modifier.isAbstract(requestType.getModifiers()),
        "Request type %s must be a concrete class",
        requestType.getName());
    return requestType;
  }
}
