package com.codeheadsystems.accounts.exception;

import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.RequestLimitExceededException;

/**
 * The database, or the SDK talking to it, rejected the request.
 */
public class BackendException extends AccountStoreException {

  private static final String THROTTLING = "ThrottlingException";

  private final boolean retryable;

  /**
   * Instantiates a new Backend exception, classifying the cause.
   *
   * @param message the message
   * @param cause   the SDK failure
   */
  public BackendException(final String message, final SdkException cause) {
    this(message, cause, isRetryable(cause));
  }

  /**
   * Instantiates a new Backend exception.
   *
   * @param message   the message
   * @param cause     the SDK failure
   * @param retryable whether the same call may succeed later
   */
  public BackendException(final String message, final SdkException cause, final boolean retryable) {
    super(message + ": " + cause.getMessage(), cause);
    this.retryable = retryable;
  }

  /**
   * Throttling, service side errors and client side I/O failures are transient; everything else
   * is not.
   *
   * @param e the SDK failure
   * @return the boolean
   */
  public static boolean isRetryable(final SdkException e) {
    if (e instanceof DynamoDbException) {
      final DynamoDbException de = (DynamoDbException) e;
      final String errorCode = de.awsErrorDetails() == null ? null : de.awsErrorDetails().errorCode();
      return de instanceof ProvisionedThroughputExceededException
          || de instanceof RequestLimitExceededException
          || THROTTLING.equals(errorCode)
          || de.statusCode() >= 500;
    }
    return e instanceof SdkClientException;
  }

  /**
   * Whether the same call may succeed if tried again later.
   *
   * @return the boolean
   */
  public boolean isRetryable() {
    return retryable;
  }
}
