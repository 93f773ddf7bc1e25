package io.sqsoffline.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultJsonCodecTest {
  private final JsonCodec codec = JsonCodec.getDefault();

  // ── Writing ─────────────────────────────────────────────────────

  @Test
  void writesRedrivePolicyInInsertionOrder() {
    Map<String, Object> policy = new LinkedHashMap<>();
    policy.put("deadLetterTargetArn", "arn:aws:sqs:us-east-1:000000000000:orders-dlq");
    policy.put("maxReceiveCount", 3);

    assertEquals("{\"deadLetterTargetArn\":\"arn:aws:sqs:us-east-1:000000000000:orders-dlq\",\"maxReceiveCount\":3}",
        codec.toJson(policy));
  }

  @Test
  void writesNestedStructures() {
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("list", List.of(1, "two", true));
    value.put("nested", Map.of("k", "v"));
    value.put("none", null);

    assertEquals("{\"list\":[1,\"two\",true],\"nested\":{\"k\":\"v\"},\"none\":null}", codec.toJson(value));
  }

  @Test
  void escapesControlCharacters() {
    assertEquals("\"a\\\"b\\\\c\\nd\\u0001\"", codec.toJson("a\"b\\c\nd\u0001"));
  }

  @Test
  void writesInstantsAsIsoStrings() {
    assertEquals("\"2024-01-02T03:04:05Z\"", codec.toJson(Instant.parse("2024-01-02T03:04:05Z")));
  }

  @Test
  void rejectsUnsupportedTypes() {
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(new Object()));
  }

  @Test
  void rejectsNullKeys() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(null, "x");
    assertThrows(IllegalArgumentException.class, () -> codec.toJson(map));
  }

  // ── Parsing ─────────────────────────────────────────────────────

  @Test
  void parsesObjectWithMixedValues() {
    Map<String, Object> parsed = codec.parseObject(
        "{\"s\":\"x\\u0041\",\"i\":42,\"d\":1.5,\"b\":false,\"n\":null,\"a\":[1,{\"k\":\"v\"}]}");

    assertEquals("xA", parsed.get("s"));
    assertEquals(42L, parsed.get("i"));
    assertEquals(1.5, parsed.get("d"));
    assertEquals(Boolean.FALSE, parsed.get("b"));
    assertTrue(parsed.containsKey("n"));
    assertNull(parsed.get("n"));
    assertEquals(List.of(1L, Map.of("k", "v")), parsed.get("a"));
  }

  @Test
  void parseObjectReturnsEmptyForBlank() {
    assertTrue(codec.parseObject(null).isEmpty());
    assertTrue(codec.parseObject("  ").isEmpty());
  }

  @Test
  void parseObjectRejectsArrays() {
    assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\":}"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{\"a\":1"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("\"unterminated"));
    assertThrows(IllegalArgumentException.class, () -> codec.parse("{} trailing"));
  }

  @Test
  void parsesWhatItWrites() {
    Map<String, Object> original = new LinkedHashMap<>();
    original.put("body", "line1\nline2 \"quoted\"");
    original.put("count", 7L);

    assertEquals(original, codec.parseObject(codec.toJson(original)));
  }
}
