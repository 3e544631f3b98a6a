package io.github.panghy.flowbus.marshal;

import io.github.panghy.flowbus.codec.CodecRegistry;
import io.github.panghy.flowbus.error.BusCallException;
import io.github.panghy.flowbus.error.BusException;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts typed call arguments and return values to their string wire form and back.
 *
 * <p>The marshaler is the only place where typed values meet the bus. Arguments are
 * converted one by one, in declaration order, by the codec registered for the
 * parameter's declared type; the position in the resulting list is the only thing
 * that identifies an argument. Return values are wrapped into a single string;
 * methods without a return value produce {@link #VOID_SENTINEL}, which the
 * inbound side accepts without consulting any codec.</p>
 *
 * <p>Exceptions thrown by codecs are not caught here. A malformed string reaches the
 * caller as whatever the codec threw.</p>
 */
public final class CallMarshaler {

  /**
   * Wire form of "no value", returned by every void method.
   */
  public static final String VOID_SENTINEL = "";

  private final CodecRegistry codecs;

  /**
   * Creates a marshaler backed by a codec registry.
   *
   * @param codecs The codec registry
   */
  public CallMarshaler(CodecRegistry codecs) {
    if (codecs == null) {
      throw new IllegalArgumentException("Codec registry cannot be null");
    }
    this.codecs = codecs;
  }

  /**
   * Encodes arguments in declaration order.
   *
   * @param kinds The declared parameter types
   * @param args  The argument values (null is treated as no arguments)
   * @return One string per argument, in the same order
   */
  public List<String> marshal(Type[] kinds, Object[] args) {
    Object[] values = args == null ? new Object[0] : args;
    if (values.length != kinds.length) {
      throw new IllegalArgumentException(
          "Expected " + kinds.length + " arguments but got " + values.length);
    }
    if (kinds.length == 0) {
      return Collections.emptyList();
    }
    List<String> encoded = new ArrayList<>(kinds.length);
    for (int i = 0; i < kinds.length; i++) {
      encoded.add(codecs.codecFor(kinds[i]).encode(values[i]));
    }
    return Collections.unmodifiableList(encoded);
  }

  /**
   * Decodes wire strings into typed arguments.
   *
   * @param kinds The declared parameter types
   * @param wire  The encoded arguments, in declaration order
   * @return The decoded arguments
   * @throws BusCallException if the number of strings does not match the number of parameters
   */
  public Object[] unmarshal(Type[] kinds, List<String> wire) {
    List<String> values = wire == null ? Collections.emptyList() : wire;
    if (values.size() != kinds.length) {
      throw new BusCallException(BusException.ErrorCode.INVALID_ARGUMENT, null, null,
          "Expected " + kinds.length + " wire arguments but got " + values.size());
    }
    Object[] decoded = new Object[kinds.length];
    for (int i = 0; i < kinds.length; i++) {
      decoded[i] = codecs.codecFor(kinds[i]).decode(values.get(i));
    }
    return decoded;
  }

  /**
   * Encodes a return value.
   *
   * @param kind  The declared return type
   * @param value The returned value (ignored for void)
   * @return The wire form, or {@link #VOID_SENTINEL} for void
   */
  public String wrapReturn(Type kind, Object value) {
    if (isVoid(kind)) {
      return VOID_SENTINEL;
    }
    return codecs.codecFor(kind).encode(value);
  }

  /**
   * Decodes a return value.
   *
   * @param kind The declared return type
   * @param wire The wire form of the reply
   * @return The decoded value, or null for void without touching any codec
   */
  public Object unwrapReturn(Type kind, String wire) {
    if (isVoid(kind)) {
      return null;
    }
    return codecs.codecFor(kind).decode(wire);
  }

  /**
   * Checks whether a declared return type means "no value".
   *
   * @param kind The declared return type
   * @return true for {@code void} and {@code Void}
   */
  public static boolean isVoid(Type kind) {
    return kind == void.class || kind == Void.class;
  }
}
