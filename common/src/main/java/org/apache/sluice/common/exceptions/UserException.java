/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.sluice.common.exceptions;

import org.slf4j.Logger;

/**
 * Base class for all exceptions that are reported back to the submitter of a
 * request. Every instance carries an {@link ErrorType}, a unique error id that
 * also appears in the server logs, and optional context lines.
 *
 * <p>Always create instances through one of the static builder methods, e.g.
 * <pre>
 *   throw UserException.overloadedError()
 *       .message("Too many pending requests for pool %s", poolId)
 *       .addContext("Queue size", queueSize)
 *       .build(logger);
 * </pre>
 * If the cause passed to a builder already wraps a UserException, that
 * exception is returned unchanged (with any new context appended) instead of
 * creating a new one.</p>
 */
public class UserException extends SluiceRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  /**
   * Wraps the passed exception inside a system error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   * <p>If the wrapped exception is, or wraps, a user exception it will be returned by {@link Builder#build(Logger)}
   * instead of creating a new exception.
   */
  public static Builder systemError(final Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  public static Builder overloadedError() {
    return new Builder(ErrorType.OVERLOADED, null);
  }

  public static Builder preconditionError() {
    return new Builder(ErrorType.PRECONDITION_FAILED, null);
  }

  public static Builder cancellationError() {
    return new Builder(ErrorType.CANCELLED, null);
  }

  public static Builder permissionError() {
    return new Builder(ErrorType.UNAUTHORIZED, null);
  }

  public static Builder notFoundError() {
    return new Builder(ErrorType.NOT_FOUND, null);
  }

  public static Builder validationError() {
    return validationError(null);
  }

  public static Builder validationError(final Throwable cause) {
    return new Builder(ErrorType.GENERIC_ERROR, cause);
  }

  /**
   * Builder class for UserException. You can wrap an existing exception, in this case it will first check if
   * this exception is, or wraps, a UserException. If it does then the builder will use the user exception as it is
   * (it will ignore the message passed to the constructor) and will add any additional context information to the
   * exception's context
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    private Builder(final ErrorType errorType, final Throwable cause) {
      this.cause = cause;

      uex = ErrorHelper.findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
      } else {
        this.errorType = errorType;
        this.context = new UserExceptionContext();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * sets or replaces the error message.
     * <p>This will be ignored if this builder is wrapping a user exception
     *
     * @see String#format(String, Object...)
     */
    public Builder message(final String format, final Object... args) {
      // we can't replace the message of a user exception
      if (uex == null && format != null) {
        this.message = args.length == 0 ? format : String.format(format, args);
      }
      return this;
    }

    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    /**
     * pushes a string value to the top of the context
     */
    public Builder pushContext(final String value) {
      context.push(value);
      return this;
    }

    /**
     * Builds a user exception or returns the wrapped one. If the error is a system error, the error message is logged
     * at ERROR level, otherwise at INFO level.
     *
     * @param logger the logger of the class that creates the exception
     * @return user exception
     */
    public UserException build(final Logger logger) {
      if (uex != null) {
        return uex;
      }

      boolean isSystemError = errorType == ErrorType.SYSTEM;

      // system errors report the root cause so operators see what actually broke
      if (isSystemError && cause != null) {
        message = ErrorHelper.getRootMessage(cause);
      }

      final UserException newException = new UserException(this);

      if (isSystemError) {
        logger.error(newException.getMessage(), newException);
      } else {
        logger.info("User Error Occurred: {}", newException.getMessage());
      }

      return newException;
    }
  }

  private final ErrorType errorType;

  private final UserExceptionContext context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  /**
   * generates the message that will be displayed to the client without the stack trace.
   *
   * @return non verbose error message
   */
  @Override
  public String getMessage() {
    return errorType + " ERROR: " + super.getMessage() + "\n\n" + context.generateContextMessage();
  }

  /**
   * @return the message as passed to the builder, without type or context
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  /**
   * @return the message followed by the full chain of causes
   */
  public String getVerboseMessage() {
    return getMessage() + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  UserExceptionContext getContext() {
    return context;
  }
}
