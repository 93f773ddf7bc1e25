package io.sqsoffline.util;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free JSON writer and recursive-descent reader.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}. Integral numbers parse to {@link Long},
 * everything else numeric to {@link Double}. Parsed objects and arrays are unmodifiable.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value);
    return sb.toString();
  }

  private static void write(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence || value instanceof Character) {
      sb.append('"').append(escape(value.toString())).append('"');
    } else if (value instanceof Double d && (d.isNaN() || d.isInfinite())) {
      throw new IllegalArgumentException("Non-finite number: " + d);
    } else if (value instanceof Number || value instanceof Boolean) {
      sb.append(value);
    } else if (value instanceof TemporalAccessor || value instanceof Enum<?>) {
      sb.append('"').append(escape(value.toString())).append('"');
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("JSON object keys cannot be null");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(entry.getKey().toString())).append("\":");
        write(sb, entry.getValue());
      }
      sb.append('}');
    } else if (value instanceof Iterable<?> items) {
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        write(sb, item);
      }
      sb.append(']');
    } else if (value instanceof Object[] array) {
      write(sb, List.of(array));
    } else {
      throw new IllegalArgumentException("Unsupported JSON type: " + value.getClass().getName());
    }
  }

  @Override
  public Object parse(String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON input is null");
    }
    Reader reader = new Reader(json);
    Object value = reader.readValue();
    reader.skipWhitespace();
    if (!reader.atEnd()) {
      throw new IllegalArgumentException("Unexpected trailing content at index " + reader.index);
    }
    return value;
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.toString();
  }

  private static final class Reader {
    private final String input;
    private int index;

    private Reader(String input) {
      this.input = input;
    }

    boolean atEnd() {
      return index >= input.length();
    }

    void skipWhitespace() {
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        index++;
      }
    }

    Object readValue() {
      skipWhitespace();
      if (atEnd()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      char c = input.charAt(index);
      switch (c) {
        case '{':
          return readObject();
        case '[':
          return readArray();
        case '"':
          index++;
          return readString();
        case 't':
          return readLiteral("true", Boolean.TRUE);
        case 'f':
          return readLiteral("false", Boolean.FALSE);
        case 'n':
          return readLiteral("null", null);
        default:
          if (c == '-' || (c >= '0' && c <= '9')) {
            return readNumber();
          }
          throw new IllegalArgumentException("Unexpected character '" + c + "' at index " + index);
      }
    }

    private Map<String, Object> readObject() {
      index++;
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (!atEnd() && input.charAt(index) == '}') {
        index++;
        return Collections.unmodifiableMap(result);
      }
      while (true) {
        skipWhitespace();
        if (atEnd() || input.charAt(index) != '"') {
          throw new IllegalArgumentException("Expected string key at index " + index);
        }
        index++;
        String key = readString();
        skipWhitespace();
        expect(':');
        result.put(key, readValue());
        skipWhitespace();
        if (atEnd()) {
          throw new IllegalArgumentException("Unexpected end of JSON object");
        }
        char next = input.charAt(index++);
        if (next == '}') {
          return Collections.unmodifiableMap(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at index " + (index - 1));
        }
      }
    }

    private List<Object> readArray() {
      index++;
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (!atEnd() && input.charAt(index) == ']') {
        index++;
        return Collections.unmodifiableList(result);
      }
      while (true) {
        result.add(readValue());
        skipWhitespace();
        if (atEnd()) {
          throw new IllegalArgumentException("Unexpected end of JSON array");
        }
        char next = input.charAt(index++);
        if (next == ']') {
          return Collections.unmodifiableList(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or ']' at index " + (index - 1));
        }
      }
    }

    private String readString() {
      StringBuilder sb = new StringBuilder();
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c == '"') {
          index++;
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          index++;
          continue;
        }
        if (index + 1 >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char next = input.charAt(index + 1);
        switch (next) {
          case '"', '\\', '/' -> sb.append(next);
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'u' -> {
            if (index + 5 >= input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(index + 2, index + 6), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            index += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
        }
        index += 2;
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private Number readNumber() {
      int start = index;
      boolean integral = true;
      while (index < input.length()) {
        char c = input.charAt(index);
        if (c == '.' || c == 'e' || c == 'E') {
          integral = false;
        } else if (!(c == '-' || c == '+' || (c >= '0' && c <= '9'))) {
          break;
        }
        index++;
      }
      String text = input.substring(start, index);
      try {
        if (integral) {
          return Long.parseLong(text);
        }
        return Double.parseDouble(text);
      } catch (NumberFormatException e) {
        if (integral) {
          return Double.parseDouble(text);
        }
        throw new IllegalArgumentException("Invalid number: " + text, e);
      }
    }

    private Object readLiteral(String literal, Object value) {
      if (!input.startsWith(literal, index)) {
        throw new IllegalArgumentException("Invalid literal at index " + index);
      }
      index += literal.length();
      return value;
    }

    private void expect(char expected) {
      if (atEnd() || input.charAt(index) != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at index " + index);
      }
      index++;
    }
  }
}
