package com.codeheadsystems.accounts.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Settings for the account store connection and table.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(builder = ImmutableConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * The constant DEFAULT_REGION.
   */
  String DEFAULT_REGION = "eu-central-1";

  /**
   * The constant DEFAULT_TABLE_NAME.
   */
  String DEFAULT_TABLE_NAME = "Accounts";

  /**
   * AWS region name.
   *
   * @return the region
   */
  @Value.Default
  default String region() {
    return DEFAULT_REGION;
  }

  /**
   * Endpoint override, used for DynamoDB Local.
   *
   * @return the endpoint
   */
  Optional<String> endpoint();

  /**
   * Named profile in the shared credentials file. When absent and there is an endpoint, static
   * placeholder credentials are used.
   *
   * @return the profile
   */
  Optional<String> profile();

  /**
   * Table name.
   *
   * @return the string
   */
  @Value.Default
  default String tableName() {
    return DEFAULT_TABLE_NAME;
  }

  /**
   * Provisioned read capacity for a created table.
   *
   * @return the long
   */
  @Value.Default
  default long readCapacityUnits() {
    return 10L;
  }

  /**
   * Provisioned write capacity for a created table.
   *
   * @return the long
   */
  @Value.Default
  default long writeCapacityUnits() {
    return 10L;
  }

  /**
   * Max table names read by a single list tables call.
   *
   * @return the int
   */
  @Value.Default
  default int tableListLimit() {
    return 10;
  }

  /**
   * Max rows read by a single scan.
   *
   * @return the int
   */
  @Value.Default
  default int scanLimit() {
    return 100;
  }

}
