package com.deigmueller.em_link.common.utils;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class Json {
  /**
   * Read the first of the given fields that carries a numeric value
   * @param node Object to read from
   * @param fieldNames Field names in order of preference
   * @return Numeric value or null if none of the fields holds a number (or a numeric string)
   */
  public static @Nullable Double readDoubleValue(@Nullable JsonNode node,
                                                 @NotNull String... fieldNames) {
    if (node == null || !node.isObject()) {
      return null;
    }

    for (String fieldName : fieldNames) {
      Double value = toDouble(node.get(fieldName));
      if (value != null) {
        return value;
      }
    }

    return null;
  }

  public static @Nullable Double toDouble(@Nullable JsonNode value) {
    if (value == null || value.isNull()) {
      return null;
    }

    if (value.isNumber()) {
      double number = value.doubleValue();
      return Double.isFinite(number) ? number : null;
    }

    if (value.isTextual()) {
      try {
        double number = Double.parseDouble(value.asText().trim());
        return Double.isFinite(number) ? number : null;
      } catch (NumberFormatException exception) {
        return null;
      }
    }

    return null;
  }

  /**
   * Coerce a declared channel id into a positive integer
   * @param value Node holding the id, either a number or a numeric string
   * @return Positive id or null
   */
  public static @Nullable Integer toChannelId(@Nullable JsonNode value) {
    Double number = toDouble(value);
    if (number == null || number != Math.rint(number) || number < 1 || number > Integer.MAX_VALUE) {
      return null;
    }
    return number.intValue();
  }
}
