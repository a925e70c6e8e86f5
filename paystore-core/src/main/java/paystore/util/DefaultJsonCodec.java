package paystore.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec}.
 *
 * <p>Writes strings, booleans, numbers, maps with string keys, collections and arrays of those.
 * Parsed objects and arrays are unmodifiable and keep document order.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    writeObject(sb, values);
    return sb.toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    return new Parser(json).document();
  }

  private static void writeValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence s) {
      writeString(sb, s.toString());
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof Number n) {
      writeNumber(sb, n);
    } else if (value instanceof Map<?, ?> map) {
      writeObject(sb, map);
    } else if (value instanceof Collection<?> items) {
      writeArray(sb, items);
    } else if (value instanceof Object[] items) {
      writeArray(sb, Arrays.asList(items));
    } else {
      throw new IllegalArgumentException(
          "Cannot write " + value.getClass().getName() + " as JSON");
    }
  }

  private static void writeObject(StringBuilder sb, Map<?, ?> map) {
    sb.append('{');
    boolean first = true;
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException("metadata keys must be non-null strings");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      writeString(sb, key);
      sb.append(':');
      writeValue(sb, entry.getValue());
    }
    sb.append('}');
  }

  private static void writeArray(StringBuilder sb, Collection<?> items) {
    sb.append('[');
    boolean first = true;
    for (Object item : items) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      writeValue(sb, item);
    }
    sb.append(']');
  }

  private static void writeNumber(StringBuilder sb, Number n) {
    if (n instanceof Double d && (d.isNaN() || d.isInfinite())
        || n instanceof Float f && (f.isNaN() || f.isInfinite())) {
      throw new IllegalArgumentException("JSON has no representation for " + n);
    }
    sb.append(n instanceof BigDecimal big ? big.toString() : n.toString());
  }

  private static void writeString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  /** Single-use cursor over the input text. */
  private static final class Parser {
    private final String text;
    private int pos;

    Parser(String text) {
      this.text = text;
    }

    Map<String, Object> document() {
      skipWhitespace();
      if (peek() != '{') {
        throw error("Expected '{'");
      }
      Map<String, Object> result = object();
      skipWhitespace();
      if (pos != text.length()) {
        throw error("Unexpected trailing content");
      }
      return result;
    }

    private Object value() {
      skipWhitespace();
      char c = peek();
      switch (c) {
        case '{':
          return object();
        case '[':
          return array();
        case '"':
          return string();
        case 't':
          literal("true");
          return Boolean.TRUE;
        case 'f':
          literal("false");
          return Boolean.FALSE;
        case 'n':
          literal("null");
          return null;
        default:
          if (c == '-' || (c >= '0' && c <= '9')) {
            return number();
          }
          throw error("Unexpected character '" + c + "'");
      }
    }

    private Map<String, Object> object() {
      expect('{');
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (peek() == '}') {
        pos++;
        return Collections.unmodifiableMap(result);
      }
      while (true) {
        skipWhitespace();
        String key = string();
        skipWhitespace();
        expect(':');
        result.put(key, value());
        skipWhitespace();
        char c = next();
        if (c == '}') {
          return Collections.unmodifiableMap(result);
        }
        if (c != ',') {
          throw error("Expected ',' or '}'");
        }
      }
    }

    private List<Object> array() {
      expect('[');
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (peek() == ']') {
        pos++;
        return Collections.unmodifiableList(result);
      }
      while (true) {
        result.add(value());
        skipWhitespace();
        char c = next();
        if (c == ']') {
          return Collections.unmodifiableList(result);
        }
        if (c != ',') {
          throw error("Expected ',' or ']'");
        }
      }
    }

    private Number number() {
      int start = pos;
      boolean integral = true;
      if (peek() == '-') {
        pos++;
      }
      if (peek() == '0') {
        pos++;
      } else {
        digits();
      }
      if (pos < text.length() && text.charAt(pos) == '.') {
        integral = false;
        pos++;
        digits();
      }
      if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
        integral = false;
        pos++;
        if (peek() == '+' || peek() == '-') {
          pos++;
        }
        digits();
      }
      String token = text.substring(start, pos);
      if (!integral) {
        return new BigDecimal(token);
      }
      try {
        return Long.parseLong(token);
      } catch (NumberFormatException e) {
        return new BigInteger(token);
      }
    }

    private void digits() {
      int start = pos;
      while (pos < text.length() && text.charAt(pos) >= '0' && text.charAt(pos) <= '9') {
        pos++;
      }
      if (pos == start) {
        throw error("Expected digit");
      }
    }

    private void literal(String word) {
      if (!text.startsWith(word, pos)) {
        throw error("Expected '" + word + "'");
      }
      pos += word.length();
    }

    private String string() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (true) {
        char c = next();
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        char esc = next();
        switch (esc) {
          case '"', '\\', '/' -> sb.append(esc);
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> {
            if (pos + 4 > text.length()) {
              throw error("Truncated unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw error("Invalid unicode escape");
            }
            pos += 4;
          }
          default -> throw error("Invalid escape '\\" + esc + "'");
        }
      }
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private char peek() {
      if (pos >= text.length()) {
        throw error("Unexpected end of input");
      }
      return text.charAt(pos);
    }

    private char next() {
      char c = peek();
      pos++;
      return c;
    }

    private void expect(char expected) {
      if (next() != expected) {
        throw error("Expected '" + expected + "'");
      }
    }

    private IllegalArgumentException error(String message) {
      return new IllegalArgumentException(message + " at position " + pos);
    }
  }
}
