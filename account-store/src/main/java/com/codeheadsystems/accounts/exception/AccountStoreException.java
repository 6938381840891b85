package com.codeheadsystems.accounts.exception;

/**
 * Base of every failure raised by the account store.
 */
public class AccountStoreException extends RuntimeException {

  /**
   * Instantiates a new Account store exception.
   *
   * @param message the message
   */
  public AccountStoreException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Account store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public AccountStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
