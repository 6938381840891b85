package com.codeheadsystems.accounts;

import com.codeheadsystems.accounts.exception.AccountStoreException;
import com.codeheadsystems.accounts.factory.ConfigurationFactory;
import com.codeheadsystems.accounts.model.Configuration;
import com.codeheadsystems.accounts.model.ConnectionMode;
import com.codeheadsystems.api.accounts.v1.Account;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed script against the accounts table. Pass {@code local} to use DynamoDB Local.
 */
public class AccountStoreCli {

  private static final Logger LOGGER = LoggerFactory.getLogger(AccountStoreCli.class);

  private final ConnectionMode mode;

  /**
   * Instantiates a new Account store cli.
   *
   * @param mode the mode
   */
  public AccountStoreCli(final ConnectionMode mode) {
    this.mode = mode;
  }

  /**
   * Run the world.
   *
   * @param args from the command line.
   */
  public static void main(String[] args) {
    LOGGER.info("main({})", (Object) args);
    final ConnectionMode mode = ConnectionMode.fromArgs(args);
    final Configuration configuration = new ConfigurationFactory().resolve(mode);
    final int status = new AccountStoreCli(mode).run(configuration);
    System.exit(status);
  }

  /**
   * Opens the store, runs the script and closes the store.
   *
   * @param configuration the configuration
   * @return the process exit status.
   */
  public int run(final Configuration configuration) {
    try (AccountStore store = AccountStore.open(configuration)) {
      runScript(store);
      return 0;
    } catch (AccountStoreException e) {
      LOGGER.error("Account store failure", e);
      return 1;
    }
  }

  /**
   * The script itself. The table is only created against DynamoDB Local; the managed service's
   * schema is provisioned outside this program.
   *
   * @param store an open store.
   */
  public void runScript(final AccountStore store) {
    if (mode == ConnectionMode.LOCAL) {
      store.ensureTable();
    }
    store.putAccount(Account.of("Foo", "123456", "My first account"));
    store.findAccount("Foo").ifPresentOrElse(
        account -> LOGGER.info("Found account: {} ({})", account.name(), account.description()),
        () -> LOGGER.warn("Account not found: Foo"));

    store.putAccount(Account.of("Fum", "654321", "My second account"));
    logAccounts(store.listAccounts());

    store.deleteAccount("Foo");
    logAccounts(store.listAccounts());
  }

  private void logAccounts(final List<Account> accounts) {
    LOGGER.info("{} account(s)", accounts.size());
    accounts.forEach(account -> LOGGER.info("  {} ({})", account.name(), account.description()));
  }

}
