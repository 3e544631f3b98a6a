package io.github.panghy.flowbus.codec;

import io.github.panghy.flowbus.error.CodecException;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;
import java.util.function.Function;

/**
 * Ready-made codecs for common JDK value types.
 *
 * <p>None of these are installed unless asked for, via
 * {@link CodecRegistry.Builder#withStandardCodecs()} or
 * {@link CodecRegistry#defaults()}. Numbers use their canonical decimal
 * {@code toString} form, booleans are exactly {@code "true"} or {@code "false"},
 * and enum constants travel by name. Decoders reject malformed input and encoders
 * reject {@code null} with a {@link CodecException}.</p>
 */
public final class StandardCodecs {

  public static final StringCodec<String> STRING = new StringCodec<>() {
    @Override
    public String encode(String value) {
      return requireValue(String.class, value);
    }

    @Override
    public String decode(String text) {
      return requireText(String.class, text);
    }
  };

  public static final StringCodec<Integer> INTEGER = parsing(Integer.class, Integer::valueOf);
  public static final StringCodec<Long> LONG = parsing(Long.class, Long::valueOf);
  public static final StringCodec<Short> SHORT = parsing(Short.class, Short::valueOf);
  public static final StringCodec<Byte> BYTE = parsing(Byte.class, Byte::valueOf);
  public static final StringCodec<Double> DOUBLE = parsing(Double.class, Double::valueOf);
  public static final StringCodec<Float> FLOAT = parsing(Float.class, Float::valueOf);
  public static final StringCodec<BigInteger> BIG_INTEGER = parsing(BigInteger.class, BigInteger::new);
  public static final StringCodec<BigDecimal> BIG_DECIMAL = parsing(BigDecimal.class, BigDecimal::new);
  public static final StringCodec<UUID> UUID_CODEC = parsing(UUID.class, UUID::fromString);

  public static final StringCodec<Boolean> BOOLEAN = parsing(Boolean.class, text -> {
    if ("true".equals(text)) {
      return Boolean.TRUE;
    } else if ("false".equals(text)) {
      return Boolean.FALSE;
    }
    throw new IllegalArgumentException("not a boolean");
  });

  public static final StringCodec<Character> CHARACTER = parsing(Character.class, text -> {
    if (text.length() != 1) {
      throw new IllegalArgumentException("expected exactly one character");
    }
    return text.charAt(0);
  });

  private static final CodecFactory ENUM_FACTORY = StandardCodecs::createEnumCodec;

  private StandardCodecs() {
  }

  /**
   * Installs every standard codec and the enum factory into a registry builder.
   *
   * @param builder The builder to populate
   * @return The same builder
   */
  public static CodecRegistry.Builder installInto(CodecRegistry.Builder builder) {
    return builder
        .register(String.class, STRING)
        .register(Integer.class, INTEGER)
        .register(Long.class, LONG)
        .register(Short.class, SHORT)
        .register(Byte.class, BYTE)
        .register(Double.class, DOUBLE)
        .register(Float.class, FLOAT)
        .register(Boolean.class, BOOLEAN)
        .register(Character.class, CHARACTER)
        .register(BigInteger.class, BIG_INTEGER)
        .register(BigDecimal.class, BIG_DECIMAL)
        .register(UUID.class, UUID_CODEC)
        .registerGlobalFactory(ENUM_FACTORY);
  }

  /**
   * Gets the factory that creates by-name codecs for enum types.
   *
   * @return The enum codec factory
   */
  public static CodecFactory enumFactory() {
    return ENUM_FACTORY;
  }

  /**
   * Creates a by-name codec for an enum class.
   *
   * @param enumType The enum class
   * @param <E>      The enum type
   * @return A codec that encodes constants by {@link Enum#name()}
   */
  public static <E extends Enum<E>> StringCodec<E> forEnum(Class<E> enumType) {
    return parsing(enumType, text -> Enum.valueOf(enumType, text));
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static StringCodec<?> createEnumCodec(Type type) {
    if (type instanceof Class<?> clazz && clazz.isEnum()) {
      return forEnum((Class) clazz);
    }
    return null;
  }

  private static <T> StringCodec<T> parsing(Class<T> type, Function<String, T> parser) {
    return new StringCodec<>() {
      @Override
      public String encode(T value) {
        requireValue(type, value);
        return value instanceof Enum<?> constant ? constant.name() : value.toString();
      }

      @Override
      public T decode(String text) {
        requireText(type, text);
        try {
          return parser.apply(text);
        } catch (IllegalArgumentException e) {
          throw new CodecException(type,
              "Cannot decode '" + text + "' as " + type.getSimpleName(), e);
        }
      }
    };
  }

  private static <T> T requireValue(Class<?> type, T value) {
    if (value == null) {
      throw new CodecException(type, "null " + type.getSimpleName() + " has no wire form");
    }
    return value;
  }

  private static String requireText(Class<?> type, String text) {
    if (text == null) {
      throw new CodecException(type, "Cannot decode null text as " + type.getSimpleName());
    }
    return text;
  }
}
