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
 * Thrown on registration when the mediator rejects duplicates and a handler is already
 * registered for the request type. The existing registration is kept.
 */
public class DuplicateHandlerException extends MediatorException {

  private final Class<?> requestType;

  public DuplicateHandlerException(Class<?> requestType) {
    super("A handler is already registered for request: " + requestType.getName());
    this.requestType = requestType;
  }

  public Class<?> requestType() {
    return requestType;
  }
}
