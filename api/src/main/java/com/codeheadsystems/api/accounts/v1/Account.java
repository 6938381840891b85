package com.codeheadsystems.api.accounts.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * An account record. The name identifies the account and is unique within the store.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAccount.class)
@JsonDeserialize(builder = ImmutableAccount.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Account {

  /**
   * Convenience factory.
   *
   * @param name        the account name
   * @param key         the secret or token held by the account
   * @param description free text
   * @return the account
   */
  static Account of(final String name, final String key, final String description) {
    return ImmutableAccount.builder().name(name).key(key).description(description).build();
  }

  /**
   * Unique name of the account.
   *
   * @return the name
   */
  @JsonProperty("name")
  String name();

  /**
   * Opaque secret value. Not interpreted by the store, and left out of {@code toString()}.
   *
   * @return the key
   */
  @Value.Redacted
  @JsonProperty("key")
  String key();

  /**
   * Description.
   *
   * @return the description
   */
  @JsonProperty("description")
  String description();

}
