package com.codeheadsystems.accounts.factory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.accounts.model.Configuration;
import com.codeheadsystems.accounts.model.ConnectionMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationFactoryTest {

  @TempDir Path tempDir;

  private ConfigurationFactory configurationFactory;

  @BeforeEach
  void setUp() {
    configurationFactory = new ConfigurationFactory();
  }

  @Test
  void forMode_local() {
    final Configuration configuration = configurationFactory.forMode(ConnectionMode.LOCAL);

    assertThat(configuration.endpoint()).contains("http://127.0.0.1:8000");
    assertThat(configuration.profile()).isEmpty();
    assertThat(configuration.region()).isEqualTo("eu-central-1");
    assertThat(configuration.tableName()).isEqualTo("Accounts");
    assertThat(configuration.readCapacityUnits()).isEqualTo(10L);
    assertThat(configuration.writeCapacityUnits()).isEqualTo(10L);
    assertThat(configuration.tableListLimit()).isEqualTo(10);
    assertThat(configuration.scanLimit()).isEqualTo(100);
  }

  @Test
  void forMode_remote() {
    final Configuration configuration = configurationFactory.forMode(ConnectionMode.REMOTE);

    assertThat(configuration.endpoint()).isEmpty();
    assertThat(configuration.profile()).contains("home-cloud");
  }

  @Test
  void load_overridesDefaults() throws IOException {
    final Path file = tempDir.resolve("accounts.json");
    Files.writeString(file, "{\"tableName\":\"TestAccounts\",\"scanLimit\":25,\"unknown\":true}");

    final Configuration configuration = configurationFactory.load(ConnectionMode.LOCAL, file);

    assertThat(configuration.tableName()).isEqualTo("TestAccounts");
    assertThat(configuration.scanLimit()).isEqualTo(25);
    assertThat(configuration.endpoint()).contains("http://127.0.0.1:8000");
    assertThat(configuration.region()).isEqualTo("eu-central-1");
  }

  @Test
  void load_replacesEndpoint() throws IOException {
    final Path file = tempDir.resolve("accounts.json");
    Files.writeString(file, "{\"endpoint\":\"http://localhost:4566\",\"region\":\"us-east-1\"}");

    final Configuration configuration = configurationFactory.load(ConnectionMode.LOCAL, file);

    assertThat(configuration.endpoint()).contains("http://localhost:4566");
    assertThat(configuration.region()).isEqualTo("us-east-1");
  }

  @Test
  void load_missingFile() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> configurationFactory.load(ConnectionMode.LOCAL, tempDir.resolve("nope.json")));
  }

  @Test
  void load_notAnObject() throws IOException {
    final Path file = tempDir.resolve("accounts.json");
    Files.writeString(file, "[1, 2]");

    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> configurationFactory.load(ConnectionMode.REMOTE, file))
        .withMessageContaining("JSON object");
  }

  @Test
  void resolve_withoutProperty() {
    System.clearProperty(ConfigurationFactory.CONFIGURATION_PROPERTY);

    assertThat(configurationFactory.resolve(ConnectionMode.REMOTE))
        .isEqualTo(configurationFactory.forMode(ConnectionMode.REMOTE));
  }

}
