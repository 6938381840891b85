package com.codeheadsystems.accounts;

import com.codeheadsystems.accounts.component.AccountStoreComponent;
import com.codeheadsystems.accounts.factory.ConfigurationFactory;
import com.codeheadsystems.accounts.manager.AccountManager;
import com.codeheadsystems.accounts.manager.AccountTableManager;
import com.codeheadsystems.accounts.model.Configuration;
import com.codeheadsystems.accounts.model.ConnectionMode;
import com.codeheadsystems.api.accounts.v1.Account;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;

/**
 * An open connection to the accounts table. Owns the DynamoDB client and its credentials and
 * releases both on close.
 * Not thread safe; calls are expected one at a time.
 */
@Singleton
public class AccountStore implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(AccountStore.class);

  private final DynamoDbClient dynamoDbClient;
  private final AwsCredentialsProvider credentialsProvider;
  private final AccountTableManager accountTableManager;
  private final AccountManager accountManager;

  /**
   * Instantiates a new Account store.
   *
   * @param dynamoDbClient      the dynamo db client
   * @param credentialsProvider the credentials the client was built with
   * @param accountTableManager the account table manager
   * @param accountManager      the account manager
   */
  @Inject
  public AccountStore(final DynamoDbClient dynamoDbClient,
                      final AwsCredentialsProvider credentialsProvider,
                      final AccountTableManager accountTableManager,
                      final AccountManager accountManager) {
    LOGGER.info("AccountStore({},{},{})", dynamoDbClient, accountTableManager, accountManager);
    this.dynamoDbClient = dynamoDbClient;
    this.credentialsProvider = credentialsProvider;
    this.accountTableManager = accountTableManager;
    this.accountManager = accountManager;
  }

  /**
   * Opens a store with the default configuration for the mode.
   *
   * @param mode the mode
   * @return the account store
   */
  public static AccountStore open(final ConnectionMode mode) {
    return open(new ConfigurationFactory().forMode(mode));
  }

  /**
   * Opens a store.
   *
   * @param configuration the configuration
   * @return the account store
   */
  public static AccountStore open(final Configuration configuration) {
    LOGGER.trace("open({})", configuration);
    return AccountStoreComponent.instance(configuration).accountStore();
  }

  /**
   * List tables list.
   *
   * @return the list
   * @see AccountTableManager#listTables()
   */
  public List<String> listTables() {
    return accountTableManager.listTables();
  }

  /**
   * Create table.
   *
   * @see AccountTableManager#createTable()
   */
  public void createTable() {
    accountTableManager.createTable();
  }

  /**
   * Ensure table boolean.
   *
   * @return true if created.
   * @see AccountTableManager#ensureTable()
   */
  public boolean ensureTable() {
    return accountTableManager.ensureTable();
  }

  /**
   * Put account.
   *
   * @param account the account
   * @see AccountManager#putAccount(Account)
   */
  public void putAccount(final Account account) {
    accountManager.putAccount(account);
  }

  /**
   * Find account optional.
   *
   * @param name the name
   * @return the optional
   * @see AccountManager#findAccount(String)
   */
  public Optional<Account> findAccount(final String name) {
    return accountManager.findAccount(name);
  }

  /**
   * List accounts list.
   *
   * @return the list
   * @see AccountManager#listAccounts()
   */
  public List<Account> listAccounts() {
    return accountManager.listAccounts();
  }

  /**
   * Delete account.
   *
   * @param name the name
   * @see AccountManager#deleteAccount(String)
   */
  public void deleteAccount(final String name) {
    accountManager.deleteAccount(name);
  }

  @Override
  public void close() {
    LOGGER.info("close()");
    dynamoDbClient.close();
    // the client leaves caller supplied providers open
    if (credentialsProvider instanceof SdkAutoCloseable) {
      ((SdkAutoCloseable) credentialsProvider).close();
    }
  }

}
