package com.codeheadsystems.accounts.manager;

import static com.codeheadsystems.accounts.converter.AccountConverter.ACCOUNT_NAME;

import com.codeheadsystems.accounts.converter.AccountConverter;
import com.codeheadsystems.accounts.exception.BackendException;
import com.codeheadsystems.accounts.exception.DataIntegrityException;
import com.codeheadsystems.accounts.model.Configuration;
import com.codeheadsystems.api.accounts.v1.Account;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;

/**
 * Create, read, list and delete of accounts. Every call is a single request against the table.
 */
@Singleton
public class AccountManager {

  /**
   * Key condition used by {@link #findAccount(String)}.
   */
  public static final String KEY_CONDITION = ACCOUNT_NAME + " = :nameValue";

  private static final Logger LOGGER = LoggerFactory.getLogger(AccountManager.class);
  private static final String NAME_VALUE = ":nameValue";
  // one more than can legally match, so duplicates show up
  private static final int FIND_LIMIT = 2;

  private final DynamoDbClient dynamoDbClient;
  private final AccountConverter accountConverter;
  private final Configuration configuration;

  /**
   * Instantiates a new Account manager.
   *
   * @param dynamoDbClient   the dynamo db client
   * @param accountConverter the account converter
   * @param configuration    the configuration
   */
  @Inject
  public AccountManager(final DynamoDbClient dynamoDbClient,
                        final AccountConverter accountConverter,
                        final Configuration configuration) {
    LOGGER.info("AccountManager({},{},{})", dynamoDbClient, accountConverter, configuration.tableName());
    this.dynamoDbClient = dynamoDbClient;
    this.accountConverter = accountConverter;
    this.configuration = configuration;
  }

  /**
   * Writes the account, replacing any account with the same name.
   *
   * @param account the account
   */
  public void putAccount(final Account account) {
    LOGGER.trace("putAccount({})", account.name());
    final PutItemRequest request = PutItemRequest.builder()
        .tableName(configuration.tableName())
        .item(accountConverter.toItem(account))
        .build();
    try {
      dynamoDbClient.putItem(request);
    } catch (SdkException e) {
      LOGGER.error("Unable to put account: {}", account.name(), e);
      throw new BackendException("Unable to put account " + account.name(), e);
    }
  }

  /**
   * Strongly consistent lookup by name.
   *
   * @param name the name
   * @return the account, if there is one.
   * @throws DataIntegrityException if more than one row has the name.
   */
  public Optional<Account> findAccount(final String name) {
    LOGGER.trace("findAccount({})", name);
    final QueryRequest request = QueryRequest.builder()
        .tableName(configuration.tableName())
        .keyConditionExpression(KEY_CONDITION)
        .expressionAttributeValues(Map.of(NAME_VALUE, AttributeValue.builder().s(name).build()))
        .consistentRead(true)
        .limit(FIND_LIMIT)
        .build();
    final QueryResponse response;
    try {
      response = dynamoDbClient.query(request);
    } catch (SdkException e) {
      LOGGER.error("Unable to find account: {}", name, e);
      throw new BackendException("Unable to find account " + name, e);
    }
    final List<Map<String, AttributeValue>> items = response.items();
    if (items.isEmpty()) {
      LOGGER.debug("findAccount: not found {}", name);
      return Optional.empty();
    }
    if (items.size() > 1) {
      LOGGER.error("Found {} rows for account: {}", items.size(), name);
      throw new DataIntegrityException("More than one row for account " + name);
    }
    final Account account = accountConverter.fromItem(items.get(0));
    LOGGER.debug("findAccount: {}", account.name());
    return Optional.of(account);
  }

  /**
   * Strongly consistent scan of the first page of accounts. Rows past the configured scan limit
   * are not returned.
   *
   * @return the list, in no particular order.
   */
  public List<Account> listAccounts() {
    LOGGER.trace("listAccounts()");
    final ScanRequest request = ScanRequest.builder()
        .tableName(configuration.tableName())
        .consistentRead(true)
        .limit(configuration.scanLimit())
        .build();
    final ScanResponse response;
    try {
      response = dynamoDbClient.scan(request);
    } catch (SdkException e) {
      LOGGER.error("Unable to list accounts", e);
      throw new BackendException("Unable to list accounts", e);
    }
    if (response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()) {
      LOGGER.warn("listAccounts: more than {} accounts, result is incomplete", configuration.scanLimit());
    }
    return response.items().stream()
        .map(accountConverter::fromItem)
        .toList();
  }

  /**
   * Deletes the account. Deleting an account that is not there is not an error.
   *
   * @param name the name
   */
  public void deleteAccount(final String name) {
    LOGGER.trace("deleteAccount({})", name);
    final DeleteItemRequest request = DeleteItemRequest.builder()
        .tableName(configuration.tableName())
        .key(accountConverter.key(name))
        .build();
    try {
      dynamoDbClient.deleteItem(request);
    } catch (SdkException e) {
      LOGGER.error("Unable to delete account: {}", name, e);
      throw new BackendException("Unable to delete account " + name, e);
    }
  }

}
