package io.github.panghy.flowbus.codec;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Objects;

/**
 * Captures a generic type so that a codec can be registered for it.
 *
 * <p>Codecs are keyed by the declared type of a parameter or return value, which
 * for generic declarations such as {@code List<String>} is a
 * {@link ParameterizedType}. TypeToken works around erasure by capturing that type
 * from an anonymous subclass:</p>
 * <pre>{@code
 * CodecRegistry codecs = CodecRegistry.builder()
 *     .register(new TypeToken<List<String>>() {}, new CommaListCodec())
 *     .build();
 * }</pre>
 *
 * <p>Primitive classes are normalized to their wrappers, so {@code int} and
 * {@code Integer} share one codec.</p>
 *
 * @param <T> The captured type
 */
public abstract class TypeToken<T> {

  private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
      boolean.class, Boolean.class,
      byte.class, Byte.class,
      short.class, Short.class,
      char.class, Character.class,
      int.class, Integer.class,
      long.class, Long.class,
      float.class, Float.class,
      double.class, Double.class);

  private final Type type;
  private final Class<? super T> rawType;

  /**
   * Creates a new TypeToken, capturing the type argument of the anonymous subclass.
   */
  @SuppressWarnings("unchecked")
  protected TypeToken() {
    Type superclass = getClass().getGenericSuperclass();
    if (!(superclass instanceof ParameterizedType)) {
      throw new IllegalArgumentException("TypeToken must be created with a type parameter");
    }
    this.type = normalize(((ParameterizedType) superclass).getActualTypeArguments()[0]);
    this.rawType = (Class<? super T>) rawTypeOf(this.type);
  }

  @SuppressWarnings("unchecked")
  private TypeToken(Type type) {
    this.type = normalize(type);
    this.rawType = (Class<? super T>) rawTypeOf(this.type);
  }

  /**
   * Creates a TypeToken from a Class object.
   *
   * @param <T>   The type parameter
   * @param clazz The class object
   * @return A TypeToken for the specified class
   */
  public static <T> TypeToken<T> of(Class<T> clazz) {
    return new TypeToken<T>(clazz) {
    };
  }

  /**
   * Creates a TypeToken for an arbitrary reflective type, e.g. a method's generic parameter type.
   *
   * @param type The type
   * @return A TypeToken for the type
   */
  public static TypeToken<?> of(Type type) {
    return new TypeToken<Object>(type) {
    };
  }

  /**
   * Gets the captured type, with primitives replaced by their wrappers.
   *
   * @return The captured type
   */
  public Type getType() {
    return type;
  }

  /**
   * Gets the raw type.
   *
   * @return The raw type (erased class)
   */
  public Class<? super T> getRawType() {
    return rawType;
  }

  /**
   * Replaces a primitive class by its wrapper; any other type is returned unchanged.
   *
   * @param type The type to normalize
   * @return The normalized type
   */
  static Type normalize(Type type) {
    if (type instanceof Class<?> clazz && clazz.isPrimitive()) {
      Class<?> wrapper = WRAPPERS.get(clazz);
      return wrapper != null ? wrapper : clazz;
    }
    return type;
  }

  /**
   * Extracts the raw class from a Type object.
   *
   * @param type The type to extract from
   * @return The raw class
   * @throws IllegalArgumentException if the type is a wildcard, type variable or generic array
   */
  static Class<?> rawTypeOf(Type type) {
    if (type instanceof Class<?> clazz) {
      return clazz;
    } else if (type instanceof ParameterizedType parameterizedType) {
      return (Class<?>) parameterizedType.getRawType();
    } else {
      throw new IllegalArgumentException("Unsupported type: " + type.getTypeName());
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TypeToken<?> typeToken)) {
      return false;
    }
    return Objects.equals(type, typeToken.type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type);
  }

  @Override
  public String toString() {
    return "TypeToken{" + type.getTypeName() + '}';
  }
}
