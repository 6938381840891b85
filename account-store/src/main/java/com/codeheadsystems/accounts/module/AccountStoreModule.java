package com.codeheadsystems.accounts.module;

import com.codeheadsystems.accounts.factory.DynamoDbClientFactory;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import dagger.Module;
import dagger.Provides;
import javax.inject.Singleton;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * The type Account store module.
 */
@Module
public class AccountStoreModule {

  /**
   * Object mapper for account payloads and configuration files. Absent optionals are left out and
   * unknown properties are ignored.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper()
        .registerModule(new Jdk8Module())
        .setSerializationInclusion(JsonInclude.Include.NON_ABSENT)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Credentials for the client. Closed by the account store.
   *
   * @param factory the factory
   * @return the aws credentials provider
   */
  @Provides
  @Singleton
  public AwsCredentialsProvider awsCredentialsProvider(final DynamoDbClientFactory factory) {
    return factory.credentialsProvider();
  }

  /**
   * The one client shared by every manager. Closed by the account store.
   *
   * @param factory             the factory
   * @param credentialsProvider the credentials provider
   * @return the dynamo db client
   */
  @Provides
  @Singleton
  public DynamoDbClient dynamoDbClient(final DynamoDbClientFactory factory,
                                       final AwsCredentialsProvider credentialsProvider) {
    return factory.createDynamoDbClient(credentialsProvider);
  }

}
