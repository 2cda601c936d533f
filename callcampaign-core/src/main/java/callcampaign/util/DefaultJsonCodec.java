package callcampaign.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for flat objects. Has no external dependencies.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> fields) {
    StringBuilder sb = new StringBuilder();
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("fields cannot contain null keys");
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append('"').append(escape(entry.getKey())).append('"').append(':');
      Object value = entry.getValue();
      if (value == null) {
        sb.append("null");
      } else if (value instanceof String s) {
        sb.append('"').append(escape(s)).append('"');
      } else if (value instanceof Boolean || value instanceof Integer || value instanceof Long) {
        sb.append(value);
      } else if (value instanceof Number n) {
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
          throw new IllegalArgumentException("Non-finite number for key " + entry.getKey());
        }
        sb.append(n);
      } else {
        throw new IllegalArgumentException("Unsupported value type for key " + entry.getKey()
            + ": " + value.getClass().getName());
      }
    }
    sb.append('}');
    return sb.toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    int len = trimmed.length();
    int idx = skipWhitespace(trimmed, 0);
    if (idx >= len || trimmed.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    idx++;
    Map<String, String> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = trimmed.charAt(idx);
      if (ch == '}') {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(trimmed, idx + 1);
      idx = skipWhitespace(trimmed, key.nextIndex);
      if (idx >= len || trimmed.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      idx = skipWhitespace(trimmed, idx + 1);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char start = trimmed.charAt(idx);
      if (start == '"') {
        ParseResult value = parseString(trimmed, idx + 1);
        result.put(key.value, value.value);
        idx = value.nextIndex;
      } else if (start == '{' || start == '[') {
        idx = skipNested(trimmed, idx);
      } else {
        int end = scanLiteral(trimmed, idx);
        String literal = trimmed.substring(idx, end);
        if (!"null".equals(literal)) {
          result.put(key.value, literal);
        }
        idx = end;
      }
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        return result;
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static int scanLiteral(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == ',' || c == '}' || c == ']' || c == ' ' || c == '\t' || c == '\n' || c == '\r') {
        break;
      }
      i++;
    }
    String literal = input.substring(index, i);
    if (!"true".equals(literal) && !"false".equals(literal) && !"null".equals(literal)
        && !literal.matches("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?")) {
      throw new IllegalArgumentException("Invalid JSON value: " + literal);
    }
    return i;
  }

  // Returns the index after the object or array starting at index.
  private static int skipNested(String input, int index) {
    int depth = 0;
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        i = parseString(input, i + 1).nextIndex;
        continue;
      }
      if (c == '{' || c == '[') {
        depth++;
      } else if (c == '}' || c == ']') {
        depth--;
        if (depth == 0) {
          return i + 1;
        }
      }
      i++;
    }
    throw new IllegalArgumentException("Unterminated nested value");
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char next = input.charAt(i + 1);
      switch (next) {
        case '"', '\\', '/' -> sb.append(next);
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          if (i + 5 >= input.length()) {
            throw new IllegalArgumentException("Invalid unicode escape");
          }
          try {
            sb.append((char) Integer.parseInt(input.substring(i + 2, i + 6), 16));
          } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid unicode escape", ex);
          }
          i += 4;
        }
        default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
      }
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
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

  private record ParseResult(String value, int nextIndex) {
  }
}
