package paystore.util;

import java.util.Map;

/**
 * Codec for the JSON objects stored in {@code metadata} columns.
 *
 * <p>Values map to Java as follows: strings to {@link String}, {@code true}/{@code false} to
 * {@link Boolean}, integers to {@link Long} (or {@link java.math.BigInteger} when they do not fit),
 * other numbers to {@link java.math.BigDecimal}, objects to {@code Map<String, Object>}, arrays to
 * {@code List<Object>} and {@code null} to {@code null}. The default implementation
 * ({@link DefaultJsonCodec}) has no dependencies. Applications can plug in a codec backed by their
 * JSON library.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the shared default implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a map as a JSON object. Returns {@code null} for a null or empty map so that the
   * column stays NULL.
   *
   * @param values the map to encode
   * @return JSON text, or {@code null}
   * @throws IllegalArgumentException if a key is null or a value has no JSON form
   */
  String toJson(Map<String, ?> values);

  /**
   * Parses a JSON object. Returns an empty map for {@code null}, blank or {@code "null"} input.
   *
   * @param json the JSON text
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the text is not a JSON object
   */
  Map<String, Object> parseObject(String json);
}
