/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.aperio.oecd;

import io.aperio.oecd.diagnostic.ErrorDiagnostic;

/**
 * Base exception thrown by the OECD access pipeline.
 *
 * <p>Every terminal failure surfaced to callers is one of the subclasses in this
 * package. Each carries an {@link ErrorCategory} and can render itself as a
 * structured {@link ErrorDiagnostic}, which is what crosses the trust boundary
 * to remote callers instead of the exception message or stack trace.
 */
public abstract class OecdException extends RuntimeException {

  private final ErrorCategory category;

  /**
   * Creates a new OecdException with the specified category and message.
   */
  protected OecdException(ErrorCategory category, String message) {
    super(message);
    this.category = category;
  }

  /**
   * Creates a new OecdException with the specified category, message and cause.
   */
  protected OecdException(ErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
  }

  public ErrorCategory getCategory() {
    return category;
  }

  /**
   * Whether repeating the same request later could succeed.
   * Input errors are never retryable.
   */
  public boolean isRetryable() {
    return category == ErrorCategory.TRANSIENT;
  }

  /**
   * Returns the caller-safe description of this failure.
   */
  public abstract ErrorDiagnostic getDiagnostic();
}
