package com.codeheadsystems.accounts.factory;

import com.codeheadsystems.accounts.model.Configuration;
import com.codeheadsystems.accounts.model.ConnectionMode;
import com.codeheadsystems.accounts.model.ImmutableConfiguration;
import com.codeheadsystems.accounts.module.AccountStoreModule;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the configuration for a connection mode, optionally overridden by a JSON file.
 */
public class ConfigurationFactory {

  /**
   * System property naming a JSON configuration file.
   */
  public static final String CONFIGURATION_PROPERTY = "accounts.configuration";
  /**
   * DynamoDB Local endpoint.
   */
  public static final String LOCAL_ENDPOINT = "http://127.0.0.1:8000";
  /**
   * Profile in the shared credentials file used for the managed service.
   */
  public static final String REMOTE_PROFILE = "home-cloud";

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationFactory.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Configuration factory with its own object mapper.
   */
  public ConfigurationFactory() {
    this(new AccountStoreModule().objectMapper());
  }

  /**
   * Instantiates a new Configuration factory.
   *
   * @param objectMapper the object mapper, which must handle {@link java.util.Optional} and leave absent values out.
   */
  public ConfigurationFactory(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * The defaults for the mode.
   *
   * @param mode the mode
   * @return the configuration
   */
  public Configuration forMode(final ConnectionMode mode) {
    final ImmutableConfiguration.Builder builder = ImmutableConfiguration.builder();
    switch (mode) {
      case LOCAL:
        builder.endpoint(LOCAL_ENDPOINT);
        break;
      case REMOTE:
        builder.profile(REMOTE_PROFILE);
        break;
      default:
        throw new IllegalArgumentException("Unknown mode: " + mode);
    }
    return builder.build();
  }

  /**
   * The mode defaults with every property present in the file replacing its default.
   *
   * @param mode the mode
   * @param path the JSON file
   * @return the configuration
   * @throws IllegalArgumentException if the file cannot be read or parsed.
   */
  public Configuration load(final ConnectionMode mode, final Path path) {
    LOGGER.info("load({},{})", mode, path);
    final ObjectNode merged = objectMapper.valueToTree(forMode(mode));
    try {
      final JsonNode overrides = objectMapper.readTree(path.toFile());
      if (overrides == null || !overrides.isObject()) {
        throw new IllegalArgumentException("Configuration must be a JSON object: " + path);
      }
      merged.setAll((ObjectNode) overrides);
      return objectMapper.treeToValue(merged, Configuration.class);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to read configuration: " + path, e);
    }
  }

  /**
   * {@link #load(ConnectionMode, Path)} when the {@value #CONFIGURATION_PROPERTY} system property is
   * set, {@link #forMode(ConnectionMode)} otherwise.
   *
   * @param mode the mode
   * @return the configuration
   */
  public Configuration resolve(final ConnectionMode mode) {
    final String file = System.getProperty(CONFIGURATION_PROPERTY);
    if (file == null || file.isBlank()) {
      return forMode(mode);
    }
    return load(mode, Path.of(file));
  }

}
