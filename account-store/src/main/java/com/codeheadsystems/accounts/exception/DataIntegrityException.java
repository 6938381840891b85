package com.codeheadsystems.accounts.exception;

/**
 * The table holds data that the key schema should make impossible, such as two rows for one name.
 */
public class DataIntegrityException extends AccountStoreException {

  /**
   * Instantiates a new Data integrity exception.
   *
   * @param message the message
   */
  public DataIntegrityException(final String message) {
    super(message);
  }
}
