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

import com.google.errorprone.annotations.ThreadSafe;
import courier.api.DuplicateHandlerException;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Maps each request class to the single adapter that serves it.
 *
 * <p>Writers take the exclusive lock and readers the shared one, so a lookup that overlaps a
 * registration sees either the old entry or the new one.
 */
@ThreadSafe
final class HandlerRegistry {

  private final Map<Class<?>, HandlerAdapter<?, ?>> adapters = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final DuplicateHandlerPolicy duplicateHandlerPolicy;

  HandlerRegistry(DuplicateHandlerPolicy duplicateHandlerPolicy) {
    this.duplicateHandlerPolicy = duplicateHandlerPolicy;
  }

  /**
   * Stores an adapter under its request type.
   *
   * @return The adapter it replaced, or {@code null} if the type was not registered.
   * @throws DuplicateHandlerException If the type is registered and the policy is {@link
   *     DuplicateHandlerPolicy#REJECT}.
   */
  HandlerAdapter<?, ?> put(HandlerAdapter<?, ?> adapter) {
    Class<?> requestType = adapter.requestType();
    lock.writeLock().lock();
    try {
      HandlerAdapter<?, ?> previous = adapters.get(requestType);
      if (previous != null && duplicateHandlerPolicy == DuplicateHandlerPolicy.REJECT) {
        throw new DuplicateHandlerException(requestType);
      }
      adapters.put(requestType, adapter);
      return previous;
    } finally {
      lock.writeLock().unlock();
    }
  }

  HandlerAdapter<?, ?> get(Class<?> requestType) {
    lock.readLock().lock();
    try {
      return adapters.get(requestType);
    } finally {
      lock.readLock().unlock();
    }
  }
}
