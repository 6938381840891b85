package com.codeheadsystems.accounts.factory;

import com.codeheadsystems.accounts.exception.BackendException;
import com.codeheadsystems.accounts.model.Configuration;
import java.net.URI;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * Builds the DynamoDB client described by the configuration.
 */
@Singleton
public class DynamoDbClientFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(DynamoDbClientFactory.class);

  // DynamoDB Local accepts any credentials but the SDK still signs requests.
  private static final AwsBasicCredentials LOCAL_CREDENTIALS =
      AwsBasicCredentials.create("fakeAccessKey", "fakeSecretKey");

  private final Configuration configuration;

  /**
   * Instantiates a new Dynamo db client factory.
   *
   * @param configuration the configuration
   */
  @Inject
  public DynamoDbClientFactory(final Configuration configuration) {
    LOGGER.info("DynamoDbClientFactory({})", configuration);
    this.configuration = configuration;
  }

  /**
   * Create the client.
   *
   * @param credentialsProvider from {@link #credentialsProvider()}. Not closed by the client.
   * @return the dynamo db client
   * @throws BackendException if the client cannot be built, including a malformed endpoint or region.
   */
  public DynamoDbClient createDynamoDbClient(final AwsCredentialsProvider credentialsProvider) {
    LOGGER.trace("createDynamoDbClient()");
    try {
      final DynamoDbClientBuilder builder = DynamoDbClient.builder()
          .region(Region.of(configuration.region()))
          .credentialsProvider(credentialsProvider);
      configuration.endpoint().map(URI::create).ifPresent(builder::endpointOverride);
      final DynamoDbClient client = builder.build();
      LOGGER.info("Opened DynamoDB client: region={}, endpoint={}, profile={}",
          configuration.region(), configuration.endpoint().orElse("-"), configuration.profile().orElse("-"));
      return client;
    } catch (SdkException e) {
      LOGGER.error("Unable to open DynamoDB client", e);
      throw new BackendException("Unable to open DynamoDB client", e);
    } catch (IllegalArgumentException e) {
      LOGGER.error("Invalid DynamoDB client settings", e);
      throw new BackendException("Unable to open DynamoDB client",
          SdkClientException.create("Invalid client settings: " + e.getMessage(), e), false);
    }
  }

  /**
   * The credentials for the configuration: the named profile if there is one, placeholder
   * credentials for an endpoint override, otherwise the default chain. Profile credentials are
   * resolved here so a missing profile fails now rather than on the first request.
   *
   * @return the aws credentials provider
   * @throws BackendException if the profile's credentials cannot be resolved.
   */
  public AwsCredentialsProvider credentialsProvider() {
    if (configuration.profile().isPresent()) {
      final String profile = configuration.profile().get();
      final ProfileCredentialsProvider provider = ProfileCredentialsProvider.create(profile);
      try {
        provider.resolveCredentials();
        return provider;
      } catch (SdkException e) {
        LOGGER.error("Unable to resolve credentials for profile: {}", profile, e);
        provider.close();
        throw new BackendException("Unable to resolve credentials for profile " + profile, e, false);
      }
    } else if (configuration.endpoint().isPresent()) {
      return StaticCredentialsProvider.create(LOCAL_CREDENTIALS);
    } else {
      return DefaultCredentialsProvider.create();
    }
  }

}
