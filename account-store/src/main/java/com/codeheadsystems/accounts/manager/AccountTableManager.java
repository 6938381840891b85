package com.codeheadsystems.accounts.manager;

import static com.codeheadsystems.accounts.converter.AccountConverter.ACCOUNT_NAME;

import com.codeheadsystems.accounts.exception.BackendException;
import com.codeheadsystems.accounts.model.Configuration;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.CreateTableResponse;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ListTablesRequest;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

/**
 * Table level operations for the accounts table.
 */
@Singleton
public class AccountTableManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(AccountTableManager.class);

  private final DynamoDbClient dynamoDbClient;
  private final Configuration configuration;

  /**
   * Instantiates a new Account table manager.
   *
   * @param dynamoDbClient the dynamo db client
   * @param configuration  the configuration
   */
  @Inject
  public AccountTableManager(final DynamoDbClient dynamoDbClient,
                             final Configuration configuration) {
    LOGGER.info("AccountTableManager({},{})", dynamoDbClient, configuration.tableName());
    this.dynamoDbClient = dynamoDbClient;
    this.configuration = configuration;
  }

  /**
   * Exact, case sensitive membership.
   *
   * @param names  the names
   * @param target the target
   * @return true if target is one of the names
   */
  public static boolean tableExists(final List<String> names, final String target) {
    return names.contains(target);
  }

  /**
   * The first page of table names.
   *
   * @return the list
   */
  public List<String> listTables() {
    LOGGER.trace("listTables()");
    final ListTablesRequest request = ListTablesRequest.builder()
        .limit(configuration.tableListLimit())
        .build();
    try {
      final List<String> names = dynamoDbClient.listTables(request).tableNames();
      LOGGER.debug("listTables: {}", names);
      return names;
    } catch (SdkException e) {
      LOGGER.error("Unable to list tables", e);
      throw new BackendException("Unable to list tables", e);
    }
  }

  /**
   * Creates the accounts table. Fails if it is already there.
   */
  public void createTable() {
    final String tableName = configuration.tableName();
    LOGGER.trace("createTable({})", tableName);
    final CreateTableRequest request = CreateTableRequest.builder()
        .tableName(tableName)
        .attributeDefinitions(AttributeDefinition.builder()
            .attributeName(ACCOUNT_NAME)
            .attributeType(ScalarAttributeType.S)
            .build())
        .keySchema(KeySchemaElement.builder()
            .attributeName(ACCOUNT_NAME)
            .keyType(KeyType.HASH)
            .build())
        .provisionedThroughput(ProvisionedThroughput.builder()
            .readCapacityUnits(configuration.readCapacityUnits())
            .writeCapacityUnits(configuration.writeCapacityUnits())
            .build())
        .build();
    try {
      final CreateTableResponse response = dynamoDbClient.createTable(request);
      LOGGER.info("Created table: {}", response.tableDescription());
    } catch (SdkException e) {
      LOGGER.error("Unable to create table: {}", tableName, e);
      throw new BackendException("Unable to create table " + tableName, e);
    }
  }

  /**
   * Creates the table unless the first page of table names already has it, then waits until it
   * is active.
   *
   * @return true if the table was created by this call.
   */
  public boolean ensureTable() {
    final String tableName = configuration.tableName();
    LOGGER.trace("ensureTable({})", tableName);
    if (tableExists(listTables(), tableName)) {
      LOGGER.info("Table already exists: {}", tableName);
      return false;
    }
    createTable();
    awaitActive(tableName);
    return true;
  }

  private void awaitActive(final String tableName) {
    try (DynamoDbWaiter waiter = DynamoDbWaiter.builder().client(dynamoDbClient).build()) {
      waiter.waitUntilTableExists(DescribeTableRequest.builder().tableName(tableName).build());
      LOGGER.info("Table is active: {}", tableName);
    } catch (SdkException e) {
      LOGGER.error("Unable to wait for table: {}", tableName, e);
      throw new BackendException("Unable to wait for table " + tableName, e);
    }
  }

}
