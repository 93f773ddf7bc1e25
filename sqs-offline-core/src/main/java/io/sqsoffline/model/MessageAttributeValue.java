package io.sqsoffline.model;

import java.util.List;

/**
 * A user-defined message attribute as carried by the queue backend.
 *
 * @param dataType         attribute data type, e.g. {@code String}, {@code Number}, {@code Binary}
 * @param stringValue      string value, or {@code null}
 * @param binaryValue      binary value, or {@code null}
 * @param stringListValues string list values (never {@code null})
 * @param binaryListValues binary list values (never {@code null})
 */
public record MessageAttributeValue(
    String dataType,
    String stringValue,
    byte[] binaryValue,
    List<String> stringListValues,
    List<byte[]> binaryListValues
) {
  public static final String DEFAULT_DATA_TYPE = "String";

  public MessageAttributeValue {
    dataType = dataType == null ? DEFAULT_DATA_TYPE : dataType;
    binaryValue = binaryValue == null ? null : binaryValue.clone();
    stringListValues = stringListValues == null ? List.of() : List.copyOf(stringListValues);
    binaryListValues = binaryListValues == null ? List.of() : List.copyOf(binaryListValues);
  }

  public static MessageAttributeValue ofString(String value) {
    return new MessageAttributeValue(DEFAULT_DATA_TYPE, value, null, null, null);
  }

  public static MessageAttributeValue ofNumber(String value) {
    return new MessageAttributeValue("Number", value, null, null, null);
  }

  @Override
  public byte[] binaryValue() {
    return binaryValue == null ? null : binaryValue.clone();
  }
}
