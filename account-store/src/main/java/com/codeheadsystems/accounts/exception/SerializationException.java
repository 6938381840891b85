package com.codeheadsystems.accounts.exception;

/**
 * An account could not be encoded into, or decoded from, its stored form.
 */
public class SerializationException extends AccountStoreException {

  /**
   * Instantiates a new Serialization exception.
   *
   * @param message the message
   */
  public SerializationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Serialization exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SerializationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
