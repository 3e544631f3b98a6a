package io.github.panghy.flowbus.codec;

import java.lang.reflect.Type;

/**
 * Factory for codecs of types that have no directly registered codec.
 *
 * <p>A CodecFactory is consulted by {@link CodecRegistry} when a lookup misses the
 * exact registrations. Factories may be scoped to a package, in which case they
 * are asked about every type declared in that package or one of its
 * sub-packages, or registered globally, in which case they are asked about every
 * type that nothing more specific handles. The built-in
 * {@link StandardCodecs#enumFactory()} is a global factory.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * // Every record in com.example.model travels as JSON
 * CodecFactory jsonFactory = type -> type instanceof Class<?> c && c.isRecord()
 *     ? new JsonCodec<>(c)
 *     : null;
 *
 * CodecRegistry codecs = CodecRegistry.builder()
 *     .registerFactory("com.example.model", jsonFactory)
 *     .build();
 * }</pre>
 *
 * @see CodecRegistry
 */
@FunctionalInterface
public interface CodecFactory {

  /**
   * Creates a codec for the specified type.
   *
   * @param type The declared type to create a codec for (a class or a parameterized type)
   * @return A codec that can handle the type, or null if this factory cannot handle it
   */
  StringCodec<?> createCodec(Type type);
}
