package com.codeheadsystems.accounts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.accounts.converter.AccountConverter;
import com.codeheadsystems.accounts.exception.BackendException;
import com.codeheadsystems.accounts.exception.DataIntegrityException;
import com.codeheadsystems.accounts.manager.AccountManager;
import com.codeheadsystems.accounts.manager.AccountTableManager;
import com.codeheadsystems.accounts.model.Configuration;
import com.codeheadsystems.accounts.model.ImmutableConfiguration;
import com.codeheadsystems.accounts.module.AccountStoreModule;
import com.codeheadsystems.api.accounts.v1.Account;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

class AccountStoreTest {

  private static final Account FOO = Account.of("Foo", "123456", "My first account");
  private static final Account FUM = Account.of("Fum", "654321", "My second account");

  private InMemoryDynamoDbClient client;
  private TrackingCredentialsProvider credentialsProvider;
  private AccountConverter accountConverter;
  private AccountStore store;

  @BeforeEach
  void setUp() {
    final Configuration configuration = ImmutableConfiguration.builder().build();
    client = new InMemoryDynamoDbClient();
    credentialsProvider = new TrackingCredentialsProvider();
    accountConverter = new AccountConverter(new AccountStoreModule().objectMapper());
    store = new AccountStore(client, credentialsProvider,
        new AccountTableManager(client, configuration),
        new AccountManager(client, accountConverter, configuration));
    store.createTable();
  }

  @Test
  void putThenFind() {
    store.putAccount(FOO);

    assertThat(store.findAccount("Foo")).contains(FOO);
  }

  @Test
  void put_isAnUpsert() {
    store.putAccount(FOO);
    store.putAccount(Account.of("Foo", "123456", "Changed"));

    assertThat(store.findAccount("Foo"))
        .hasValueSatisfying(account -> assertThat(account.description()).isEqualTo("Changed"));
    assertThat(store.listAccounts()).hasSize(1);
  }

  @Test
  void delete_removesVisibility() {
    store.putAccount(FOO);

    store.deleteAccount("Foo");

    assertThat(store.findAccount("Foo")).isEmpty();
  }

  @Test
  void delete_missingName() {
    store.deleteAccount("Nobody");

    assertThat(store.listAccounts()).isEmpty();
  }

  @Test
  void find_emptyTable() {
    assertThat(store.findAccount("Foo")).isEmpty();
  }

  @Test
  void find_unknownName() {
    store.putAccount(FOO);

    assertThat(store.findAccount("Fee")).isEmpty();
  }

  @Test
  void find_caseSensitive() {
    store.putAccount(FOO);

    assertThat(store.findAccount("foo")).isEmpty();
  }

  @Test
  void find_duplicateRows() {
    client.rawPut(Configuration.DEFAULT_TABLE_NAME, "Foo-1", accountConverter.toItem(FOO));
    client.rawPut(Configuration.DEFAULT_TABLE_NAME, "Foo-2", accountConverter.toItem(FOO));

    assertThatExceptionOfType(DataIntegrityException.class)
        .isThrownBy(() -> store.findAccount("Foo"))
        .withMessageContaining("Foo");
  }

  @Test
  void listAccounts_returnsEveryPut() {
    final List<Account> accounts = IntStream.range(0, 100)
        .mapToObj(i -> Account.of("account-" + i, "key-" + i, "description " + i))
        .toList();
    accounts.forEach(store::putAccount);

    assertThat(store.listAccounts()).containsExactlyInAnyOrderElementsOf(accounts);
  }

  @Test
  void listAccounts_stopsAtOnePage() {
    IntStream.range(0, 101)
        .mapToObj(i -> Account.of("account-" + i, "key-" + i, "description " + i))
        .forEach(store::putAccount);

    assertThat(store.listAccounts()).hasSize(100);
  }

  @Test
  void exampleScenario() {
    store.putAccount(FOO);
    assertThat(store.findAccount("Foo")).contains(FOO);

    store.putAccount(FUM);
    assertThat(store.listAccounts()).containsExactlyInAnyOrder(FOO, FUM);

    store.deleteAccount("Foo");
    assertThat(store.listAccounts()).containsExactly(FUM);
  }

  @Test
  void ensureTable_createsOnce() {
    final InMemoryDynamoDbClient fresh = new InMemoryDynamoDbClient();
    final Configuration configuration = ImmutableConfiguration.builder().build();
    final AccountTableManager manager = new AccountTableManager(fresh, configuration);

    assertThat(manager.ensureTable()).isTrue();
    assertThat(manager.ensureTable()).isFalse();
    assertThat(manager.listTables()).containsExactly("Accounts");
  }

  @Test
  void createTable_twice() {
    assertThatExceptionOfType(BackendException.class)
        .isThrownBy(() -> store.createTable())
        .withMessageContaining("Accounts");
  }

  @Test
  void putAccount_noTable() {
    final Configuration configuration = ImmutableConfiguration.builder().tableName("Missing").build();
    final AccountManager manager = new AccountManager(client, accountConverter, configuration);

    assertThatExceptionOfType(BackendException.class)
        .isThrownBy(() -> manager.putAccount(FOO))
        .withCauseInstanceOf(ResourceNotFoundException.class)
        .satisfies(e -> assertThat(e.isRetryable()).isFalse());
  }

  @Test
  void close_closesClient() {
    store.close();

    assertThat(client.isClosed()).isTrue();
    assertThat(credentialsProvider.isClosed()).isTrue();
  }

}
