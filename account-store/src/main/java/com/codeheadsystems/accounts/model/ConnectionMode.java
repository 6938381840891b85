package com.codeheadsystems.accounts.model;

/**
 * Which DynamoDB the store talks to.
 */
public enum ConnectionMode {

  /**
   * DynamoDB Local on the loopback address, no real credentials.
   */
  LOCAL,

  /**
   * The managed service, credentials from a named profile.
   */
  REMOTE;

  /**
   * The command line argument that selects {@link #LOCAL}.
   */
  public static final String LOCAL_ARGUMENT = "local";

  /**
   * Local if, and only if, the first argument is exactly {@value #LOCAL_ARGUMENT}.
   *
   * @param args from the command line.
   * @return the mode.
   */
  public static ConnectionMode fromArgs(final String[] args) {
    if (args != null && args.length > 0 && LOCAL_ARGUMENT.equals(args[0])) {
      return LOCAL;
    }
    return REMOTE;
  }

}
