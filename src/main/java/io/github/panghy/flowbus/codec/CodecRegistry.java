package io.github.panghy.flowbus.codec;

import io.github.panghy.flowbus.error.CodecNotFoundException;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Immutable mapping from value type to the {@link StringCodec} that carries it on the bus.
 *
 * <p>A registry is populated once through its {@link Builder}, typically during
 * process start-up, and then shared by every service definition. After
 * {@link Builder#build()} the set of registrations cannot change; the only
 * internal state that still grows is the cache of codecs produced by factories,
 * which does not alter lookup results.</p>
 *
 * <p>The registry supports:</p>
 * <ul>
 *   <li>Direct registration of codecs for classes and, through {@link TypeToken},
 *       for parameterized types</li>
 *   <li>Registration of codec factories for packages (the nearest enclosing package wins)</li>
 *   <li>Global factories, consulted last (e.g. the enum factory)</li>
 * </ul>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * CodecRegistry codecs = CodecRegistry.builder()
 *     .withStandardCodecs()
 *     .register(Point.class, new PointCodec())
 *     .registerFactory("com.example.model", new JsonCodecFactory())
 *     .build();
 *
 * String wire = codecs.codecFor(Point.class).encode(new Point(1, 2));
 * }</pre>
 */
public final class CodecRegistry {

  private final Map<Type, StringCodec<?>> codecs;
  private final Map<String, CodecFactory> packageFactories;
  private final List<CodecFactory> globalFactories;

  // Codecs created by factories, cached per type
  private final Map<Type, StringCodec<?>> factoryCodecs = new ConcurrentHashMap<>();

  private CodecRegistry(Builder builder) {
    this.codecs = Collections.unmodifiableMap(new HashMap<>(builder.codecs));
    this.packageFactories = Collections.unmodifiableMap(new HashMap<>(builder.packageFactories));
    this.globalFactories = List.copyOf(builder.globalFactories);
  }

  /**
   * Creates a new builder.
   *
   * @return An empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a registry containing only the {@link StandardCodecs}.
   *
   * @return A registry with the standard codecs installed
   */
  public static CodecRegistry defaults() {
    return builder().withStandardCodecs().build();
  }

  /**
   * Gets the codec for a class.
   *
   * @param type The value class (primitives are treated as their wrappers)
   * @param <T>  The value type
   * @return The codec
   * @throws CodecNotFoundException if no codec handles the class
   */
  @SuppressWarnings("unchecked")
  public <T> StringCodec<T> codecFor(Class<T> type) {
    return (StringCodec<T>) codecFor((Type) type);
  }

  /**
   * Gets the codec for a declared type.
   * This will first check direct registrations, then package-based factories
   * from the innermost package outwards, and finally the global factories.
   *
   * @param type The declared type of a parameter, return value or notification argument
   * @return The codec
   * @throws CodecNotFoundException if no codec handles the type
   */
  @SuppressWarnings("unchecked")
  public StringCodec<Object> codecFor(Type type) {
    StringCodec<?> codec = lookup(type);
    if (codec == null) {
      throw new CodecNotFoundException(type);
    }
    return (StringCodec<Object>) codec;
  }

  /**
   * Checks whether a codec is available for a declared type.
   *
   * @param type The declared type
   * @return true if {@link #codecFor(Type)} would succeed
   */
  public boolean hasCodec(Type type) {
    return lookup(type) != null;
  }

  private StringCodec<?> lookup(Type declared) {
    Type type = TypeToken.normalize(declared);

    StringCodec<?> codec = codecs.get(type);
    if (codec != null) {
      return codec;
    }
    codec = factoryCodecs.get(type);
    if (codec != null) {
      return codec;
    }

    Class<?> rawType;
    try {
      rawType = TypeToken.rawTypeOf(type);
    } catch (IllegalArgumentException e) {
      // wildcards and type variables have no codec
      return null;
    }

    // Check package-based factories
    Package pkg = rawType.getPackage();
    String packageName = pkg != null ? pkg.getName() : "";
    while (!packageName.isEmpty()) {
      CodecFactory factory = packageFactories.get(packageName);
      if (factory != null) {
        codec = factory.createCodec(type);
        if (codec != null) {
          factoryCodecs.put(type, codec);
          return codec;
        }
      }

      // Move up to parent package
      int lastDot = packageName.lastIndexOf('.');
      packageName = lastDot > 0 ? packageName.substring(0, lastDot) : "";
    }

    for (CodecFactory factory : globalFactories) {
      codec = factory.createCodec(type);
      if (codec != null) {
        factoryCodecs.put(type, codec);
        return codec;
      }
    }
    return null;
  }

  /**
   * Builder for CodecRegistry.
   */
  public static class Builder {
    private final Map<Type, StringCodec<?>> codecs = new HashMap<>();
    private final Map<String, CodecFactory> packageFactories = new HashMap<>();
    private final List<CodecFactory> globalFactories = new ArrayList<>();

    private Builder() {
    }

    /**
     * Registers a codec for a class. Registering {@code int.class} registers the
     * codec for {@code Integer} as well, and vice versa.
     *
     * @param type  The value class
     * @param codec The codec
     * @param <T>   The value type
     * @return This builder for chaining
     */
    public <T> Builder register(Class<T> type, StringCodec<? super T> codec) {
      if (type == null || codec == null) {
        throw new IllegalArgumentException("Type and codec cannot be null");
      }
      codecs.put(TypeToken.normalize(type), codec);
      return this;
    }

    /**
     * Registers a codec for a (possibly parameterized) type.
     *
     * @param type  The captured type
     * @param codec The codec
     * @param <T>   The value type
     * @return This builder for chaining
     */
    public <T> Builder register(TypeToken<T> type, StringCodec<? super T> codec) {
      if (type == null || codec == null) {
        throw new IllegalArgumentException("Type and codec cannot be null");
      }
      codecs.put(type.getType(), codec);
      return this;
    }

    /**
     * Registers a codec factory for a package.
     * All types in the specified package (or its sub-packages) without a specific
     * codec will use the provided factory.
     *
     * @param packageName The package name (e.g., "com.example.model")
     * @param factory     The codec factory
     * @return This builder for chaining
     */
    public Builder registerFactory(String packageName, CodecFactory factory) {
      if (packageName == null || packageName.isEmpty() || factory == null) {
        throw new IllegalArgumentException("Package name and factory cannot be empty");
      }
      packageFactories.put(packageName, factory);
      return this;
    }

    /**
     * Registers a factory consulted for any type nothing more specific handles.
     *
     * @param factory The codec factory
     * @return This builder for chaining
     */
    public Builder registerGlobalFactory(CodecFactory factory) {
      if (factory == null) {
        throw new IllegalArgumentException("Factory cannot be null");
      }
      globalFactories.add(factory);
      return this;
    }

    /**
     * Installs the {@link StandardCodecs}.
     *
     * @return This builder for chaining
     */
    public Builder withStandardCodecs() {
      return StandardCodecs.installInto(this);
    }

    /**
     * Builds the immutable registry.
     *
     * @return A new CodecRegistry
     */
    public CodecRegistry build() {
      return new CodecRegistry(this);
    }
  }
}
