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

/** What a {@link DefaultMediator} does when a request type receives a second handler. */
public enum DuplicateHandlerPolicy {

  /** The new handler replaces the old one; last registration wins. The replacement is logged. */
  REPLACE,

  /**
   * The registration is refused with a {@link courier.api.DuplicateHandlerException} and the
   * existing handler stays in place.
   */
  REJECT
}
