package io.github.panghy.flowbus.codec;

import java.util.function.Function;

/**
 * Converts values of one type to and from the single string that carries them on the bus.
 *
 * <p>StringCodec is the customization point of FlowBus: every argument, return value
 * and notification argument crosses the bus as exactly one string, and the codec
 * registered for the value's declared type decides what that string looks like.
 * Encoding of composite values (lists, records, JSON documents) is entirely up to
 * the codec.</p>
 *
 * <p>Codecs must be pure and stateless. A codec that cannot decode its input should
 * throw; the exception reaches the caller of the bus method unchanged.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * StringCodec<Point> pointCodec = StringCodec.of(
 *     p -> p.x() + "," + p.y(),
 *     s -> {
 *       String[] parts = s.split(",");
 *       return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
 *     });
 *
 * CodecRegistry codecs = CodecRegistry.builder()
 *     .withStandardCodecs()
 *     .register(Point.class, pointCodec)
 *     .build();
 * }</pre>
 *
 * @param <T> The type of value this codec converts
 */
public interface StringCodec<T> {

  /**
   * Encodes a value to its wire string.
   *
   * @param value The value to encode
   * @return The wire form of the value
   */
  String encode(T value);

  /**
   * Decodes a wire string back to a value.
   *
   * @param text The wire form
   * @return The decoded value
   */
  T decode(String text);

  /**
   * Creates a codec from a pair of functions.
   *
   * @param encoder The encoding function
   * @param decoder The decoding function
   * @param <T>     The value type
   * @return A codec delegating to the two functions
   */
  static <T> StringCodec<T> of(Function<? super T, String> encoder,
                               Function<String, ? extends T> decoder) {
    return new StringCodec<>() {
      @Override
      public String encode(T value) {
        return encoder.apply(value);
      }

      @Override
      public T decode(String text) {
        return decoder.apply(text);
      }
    };
  }
}
