package io.github.panghy.flowbus.codec;

import io.github.panghy.flowbus.error.CodecException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link StandardCodecs}.
 */
public class StandardCodecsTest {

  enum Color {
    RED, GREEN
  }

  @Test
  public void testNumbersUseDecimalForm() {
    assertEquals("42", StandardCodecs.INTEGER.encode(42));
    assertEquals(-7, StandardCodecs.INTEGER.decode("-7"));
    assertEquals("9223372036854775807", StandardCodecs.LONG.encode(Long.MAX_VALUE));
    assertEquals((short) 12, StandardCodecs.SHORT.decode("12"));
    assertEquals((byte) -1, StandardCodecs.BYTE.decode("-1"));
    assertEquals(2.5, StandardCodecs.DOUBLE.decode(StandardCodecs.DOUBLE.encode(2.5)));
    assertEquals(0.25f, StandardCodecs.FLOAT.decode("0.25"));
    assertEquals(new BigInteger("123456789012345678901234567890"),
        StandardCodecs.BIG_INTEGER.decode("123456789012345678901234567890"));
    assertEquals("1.50", StandardCodecs.BIG_DECIMAL.encode(new BigDecimal("1.50")));
  }

  @Test
  public void testMalformedNumberRaisesCodecException() {
    CodecException e = assertThrows(CodecException.class, () -> StandardCodecs.INTEGER.decode("abc"));
    assertEquals(Integer.class, e.getType());
    assertInstanceOf(NumberFormatException.class, e.getCause());

    assertThrows(CodecException.class, () -> StandardCodecs.INTEGER.decode(""));
    assertThrows(CodecException.class, () -> StandardCodecs.BYTE.decode("300"));
  }

  @Test
  public void testBooleanIsStrict() {
    assertEquals("true", StandardCodecs.BOOLEAN.encode(true));
    assertEquals(Boolean.FALSE, StandardCodecs.BOOLEAN.decode("false"));
    assertThrows(CodecException.class, () -> StandardCodecs.BOOLEAN.decode("TRUE"));
    assertThrows(CodecException.class, () -> StandardCodecs.BOOLEAN.decode("yes"));
  }

  @Test
  public void testCharacter() {
    assertEquals("x", StandardCodecs.CHARACTER.encode('x'));
    assertEquals('y', StandardCodecs.CHARACTER.decode("y"));
    assertThrows(CodecException.class, () -> StandardCodecs.CHARACTER.decode("yz"));
  }

  @Test
  public void testStringIsIdentity() {
    assertEquals("", StandardCodecs.STRING.encode(""));
    assertEquals("with, commas; and \"quotes\"", StandardCodecs.STRING.decode("with, commas; and \"quotes\""));
  }

  @Test
  public void testUuid() {
    UUID id = UUID.randomUUID();
    assertEquals(id.toString(), StandardCodecs.UUID_CODEC.encode(id));
    assertEquals(id, StandardCodecs.UUID_CODEC.decode(id.toString()));
    assertThrows(CodecException.class, () -> StandardCodecs.UUID_CODEC.decode("not-a-uuid"));
  }

  @Test
  public void testNullHasNoWireForm() {
    assertThrows(CodecException.class, () -> StandardCodecs.STRING.encode(null));
    assertThrows(CodecException.class, () -> StandardCodecs.INTEGER.encode(null));
    assertThrows(CodecException.class, () -> StandardCodecs.LONG.decode(null));
  }

  @Test
  public void testEnumsTravelByName() {
    StringCodec<Color> codec = StandardCodecs.forEnum(Color.class);
    assertEquals("GREEN", codec.encode(Color.GREEN));
    assertEquals(Color.RED, codec.decode("RED"));
    assertThrows(CodecException.class, () -> codec.decode("BLUE"));
  }

  @Test
  public void testEnumFactory() {
    assertNull(StandardCodecs.enumFactory().createCodec(String.class));

    CodecRegistry codecs = CodecRegistry.defaults();
    assertTrue(codecs.hasCodec(Color.class));
    assertEquals(Color.GREEN, codecs.codecFor(Color.class).decode("GREEN"));
  }
}
