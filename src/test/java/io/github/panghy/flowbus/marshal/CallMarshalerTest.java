package io.github.panghy.flowbus.marshal;

import io.github.panghy.flowbus.codec.CodecRegistry;
import io.github.panghy.flowbus.codec.StringCodec;
import io.github.panghy.flowbus.error.BusCallException;
import io.github.panghy.flowbus.error.BusException;
import io.github.panghy.flowbus.error.CodecException;
import io.github.panghy.flowbus.error.CodecNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the {@link CallMarshaler} class.
 */
public class CallMarshalerTest {

  private CallMarshaler marshaler;

  @BeforeEach
  public void setUp() {
    marshaler = new CallMarshaler(CodecRegistry.defaults());
  }

  @Test
  public void testArgumentsKeepDeclarationOrder() {
    Type[] kinds = {int.class, String.class, boolean.class};

    List<String> wire = marshaler.marshal(kinds, new Object[]{1, "x", true});

    assertEquals(List.of("1", "x", "true"), wire);
    assertArrayEquals(new Object[]{1, "x", true}, marshaler.unmarshal(kinds, wire));
  }

  @Test
  public void testNoArguments() {
    assertEquals(List.of(), marshaler.marshal(new Type[0], null));
    assertEquals(0, marshaler.unmarshal(new Type[0], List.of()).length);
  }

  @Test
  public void testVoidReturnUsesSentinelWithoutCodec() {
    // An empty registry proves no codec is consulted on the void path
    CallMarshaler bare = new CallMarshaler(CodecRegistry.builder().build());

    assertEquals(CallMarshaler.VOID_SENTINEL, bare.wrapReturn(void.class, null));
    assertEquals("", bare.wrapReturn(Void.class, null));
    assertNull(bare.unwrapReturn(void.class, "anything at all"));
    assertTrue(CallMarshaler.isVoid(void.class));
  }

  @Test
  public void testReturnValueRoundTrip() {
    String wire = marshaler.wrapReturn(long.class, 5L);

    assertEquals("5", wire);
    assertEquals(5L, marshaler.unwrapReturn(long.class, wire));
  }

  @Test
  public void testArityMismatchOnOutboundSide() {
    assertThrows(IllegalArgumentException.class,
        () -> marshaler.marshal(new Type[]{int.class}, new Object[]{1, 2}));
  }

  @Test
  public void testArityMismatchOnInboundSide() {
    BusCallException e = assertThrows(BusCallException.class,
        () -> marshaler.unmarshal(new Type[]{int.class, int.class}, List.of("1")));
    assertEquals(BusException.ErrorCode.INVALID_ARGUMENT, e.getErrorCode());
  }

  @Test
  public void testCodecExceptionPropagatesUnchanged() {
    CodecException e = assertThrows(CodecException.class,
        () -> marshaler.unmarshal(new Type[]{int.class}, List.of("not a number")));
    assertEquals(Integer.class, e.getType());
  }

  @Test
  public void testUserCodecExceptionIsNotWrapped() {
    IllegalStateException failure = new IllegalStateException("codec broke");
    StringCodec<StringBuilder> broken = StringCodec.of(sb -> {
      throw failure;
    }, text -> new StringBuilder(text));
    CallMarshaler custom = new CallMarshaler(CodecRegistry.builder()
        .register(StringBuilder.class, broken)
        .build());

    IllegalStateException thrown = assertThrows(IllegalStateException.class,
        () -> custom.marshal(new Type[]{StringBuilder.class}, new Object[]{new StringBuilder("a")}));
    assertSame(failure, thrown);
  }

  @Test
  public void testMissingCodec() {
    assertThrows(CodecNotFoundException.class,
        () -> marshaler.marshal(new Type[]{StringBuilder.class}, new Object[]{new StringBuilder()}));
  }

  @Test
  public void testNullRegistryIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new CallMarshaler(null));
  }
}
