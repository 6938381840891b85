package com.codeheadsystems.accounts.converter;

import com.codeheadsystems.accounts.exception.SerializationException;
import com.codeheadsystems.api.accounts.v1.Account;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Converts accounts to and from table rows. A row is keyed by {@value #ACCOUNT_NAME} and carries
 * the whole account as a map under {@value #DATA}.{@value #OBJECT}.
 */
@Singleton
public class AccountConverter {

  /**
   * Partition key attribute.
   */
  public static final String ACCOUNT_NAME = "AccountName";
  /**
   * Attribute wrapping the payload.
   */
  public static final String DATA = "Data";
  /**
   * Entry inside {@link #DATA} holding the encoded account.
   */
  public static final String OBJECT = "object";

  private static final Logger LOGGER = LoggerFactory.getLogger(AccountConverter.class);
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Account converter.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public AccountConverter(final ObjectMapper objectMapper) {
    LOGGER.info("AccountConverter({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  /**
   * The key of the row for the account name.
   *
   * @param name the name
   * @return the key map
   */
  public Map<String, AttributeValue> key(final String name) {
    return Map.of(ACCOUNT_NAME, AttributeValue.builder().s(name).build());
  }

  /**
   * The full row for the account.
   *
   * @param account the account
   * @return the item
   */
  public Map<String, AttributeValue> toItem(final Account account) {
    LOGGER.trace("toItem({})", account.name());
    final AttributeValue payload = toAttributeValue(toMap(account));
    final AttributeValue data = AttributeValue.builder().m(Map.of(OBJECT, payload)).build();
    return Map.of(
        ACCOUNT_NAME, AttributeValue.builder().s(account.name()).build(),
        DATA, data);
  }

  /**
   * Reads the account out of a row.
   *
   * @param item the item
   * @return the account
   */
  public Account fromItem(final Map<String, AttributeValue> item) {
    LOGGER.trace("fromItem({})", item.get(ACCOUNT_NAME));
    final AttributeValue data = item.get(DATA);
    if (data == null || !data.hasM()) {
      throw new SerializationException("Row has no '" + DATA + "' map: " + item.get(ACCOUNT_NAME));
    }
    final AttributeValue payload = data.m().get(OBJECT);
    if (payload == null || !payload.hasM()) {
      throw new SerializationException("Row has no '" + DATA + "." + OBJECT + "' map: " + item.get(ACCOUNT_NAME));
    }
    final Object decoded = fromAttributeValue(payload);
    try {
      return objectMapper.convertValue(decoded, Account.class);
    } catch (IllegalArgumentException e) {
      LOGGER.error("Unable to decode account payload: {}", item.get(ACCOUNT_NAME), e);
      throw new SerializationException("Unable to decode account payload", e);
    }
  }

  private Map<String, Object> toMap(final Account account) {
    try {
      return objectMapper.convertValue(account, MAP_TYPE);
    } catch (IllegalArgumentException e) {
      LOGGER.error("Unable to encode account: {}", account.name(), e);
      throw new SerializationException("Unable to encode account", e);
    }
  }

  @SuppressWarnings("unchecked")
  private AttributeValue toAttributeValue(final Object value) {
    if (value == null) {
      return AttributeValue.builder().nul(true).build();
    }
    if (value instanceof String) {
      return AttributeValue.builder().s((String) value).build();
    }
    if (value instanceof Number) {
      return AttributeValue.builder().n(value.toString()).build();
    }
    if (value instanceof Boolean) {
      return AttributeValue.builder().bool((Boolean) value).build();
    }
    if (value instanceof Map) {
      return AttributeValue.builder().m(((Map<String, Object>) value).entrySet().stream()
          .collect(Collectors.toMap(Map.Entry::getKey, e -> toAttributeValue(e.getValue())))).build();
    }
    if (value instanceof List) {
      return AttributeValue.builder().l(((List<Object>) value).stream()
          .map(this::toAttributeValue)
          .toList()).build();
    }
    throw new SerializationException("Unsupported value type: " + value.getClass().getName());
  }

  private Object fromAttributeValue(final AttributeValue value) {
    switch (value.type()) {
      case S:
        return value.s();
      case N:
        return new BigDecimal(value.n());
      case BOOL:
        return value.bool();
      case NUL:
        return null;
      case M:
        final Map<String, Object> map = new LinkedHashMap<>();
        value.m().forEach((k, v) -> map.put(k, fromAttributeValue(v)));
        return map;
      case L:
        return value.l().stream().map(this::fromAttributeValue).toList();
      default:
        throw new SerializationException("Unsupported attribute type: " + value.type());
    }
  }

}
