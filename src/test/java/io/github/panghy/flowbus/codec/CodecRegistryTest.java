package io.github.panghy.flowbus.codec;

import io.github.panghy.flowbus.error.CodecNotFoundException;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the {@link CodecRegistry} class.
 */
public class CodecRegistryTest {

  record Point(int x, int y) {
  }

  private static final StringCodec<Point> POINT_CODEC = StringCodec.of(
      p -> p.x() + "," + p.y(),
      text -> {
        String[] parts = text.split(",");
        return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
      });

  @Test
  public void testDirectRegistration() {
    CodecRegistry codecs = CodecRegistry.builder()
        .register(Point.class, POINT_CODEC)
        .build();

    assertSame(POINT_CODEC, codecs.codecFor(Point.class));
    assertEquals("3,4", codecs.codecFor(Point.class).encode(new Point(3, 4)));
    assertEquals(new Point(1, 2), codecs.codecFor(Point.class).decode("1,2"));
  }

  @Test
  public void testPrimitivesShareWrapperCodec() {
    CodecRegistry codecs = CodecRegistry.builder()
        .register(int.class, StandardCodecs.INTEGER)
        .build();

    assertSame(StandardCodecs.INTEGER, codecs.codecFor(Integer.class));
    assertSame(StandardCodecs.INTEGER, codecs.codecFor(int.class));
    assertTrue(codecs.hasCodec(int.class));
  }

  @Test
  public void testParameterizedTypeRegistration() {
    StringCodec<List<String>> listCodec = StringCodec.of(
        list -> String.join(";", list),
        text -> Arrays.asList(text.split(";")));
    TypeToken<List<String>> listOfStrings = new TypeToken<>() {
    };
    CodecRegistry codecs = CodecRegistry.builder()
        .register(listOfStrings, listCodec)
        .build();

    assertTrue(codecs.hasCodec(listOfStrings.getType()));
    assertEquals("a;b", codecs.codecFor(listOfStrings.getType()).encode(List.of("a", "b")));

    // The raw type and other parameterizations are not covered
    assertFalse(codecs.hasCodec(List.class));
    assertFalse(codecs.hasCodec(new TypeToken<List<Integer>>() {
    }.getType()));
  }

  @Test
  public void testMissingCodec() {
    CodecRegistry codecs = CodecRegistry.builder().build();

    assertFalse(codecs.hasCodec(Point.class));
    CodecNotFoundException e = assertThrows(CodecNotFoundException.class, () -> codecs.codecFor(Point.class));
    assertEquals(Point.class, e.getValueType());
  }

  @Test
  public void testNearestPackageFactoryWins() {
    CodecFactory outer = type -> StringCodec.of(Object::toString, text -> "outer");
    CodecFactory inner = type -> type == Point.class ? POINT_CODEC : null;
    CodecRegistry codecs = CodecRegistry.builder()
        .registerFactory("io.github.panghy", outer)
        .registerFactory("io.github.panghy.flowbus.codec", inner)
        .build();

    assertSame(POINT_CODEC, codecs.codecFor(Point.class));

    // The inner factory declines, so the lookup moves up to the outer package
    assertEquals("outer", codecs.codecFor((Type) CodecRegistryTest.class).decode("anything"));
  }

  @Test
  public void testFactoryResultsAreCached() {
    AtomicInteger created = new AtomicInteger();
    CodecRegistry codecs = CodecRegistry.builder()
        .registerGlobalFactory(type -> {
          created.incrementAndGet();
          return POINT_CODEC;
        })
        .build();

    StringCodec<Point> first = codecs.codecFor(Point.class);
    StringCodec<Point> second = codecs.codecFor(Point.class);

    assertSame(first, second);
    assertEquals(1, created.get());
  }

  @Test
  public void testDirectRegistrationBeatsFactories() {
    CodecRegistry codecs = CodecRegistry.builder()
        .registerGlobalFactory(type -> StringCodec.of(Object::toString, text -> null))
        .register(Point.class, POINT_CODEC)
        .build();

    assertSame(POINT_CODEC, codecs.codecFor(Point.class));
  }

  @Test
  public void testBuilderChangesDoNotAffectBuiltRegistry() {
    CodecRegistry.Builder builder = CodecRegistry.builder();
    CodecRegistry codecs = builder.build();
    builder.register(Point.class, POINT_CODEC);

    assertFalse(codecs.hasCodec(Point.class));
  }

  @Test
  public void testDefaultsContainStandardCodecs() {
    CodecRegistry codecs = CodecRegistry.defaults();

    assertSame(StandardCodecs.STRING, codecs.codecFor(String.class));
    assertSame(StandardCodecs.LONG, codecs.codecFor(long.class));
    assertTrue(codecs.hasCodec(Thread.State.class));
  }

  @Test
  public void testInvalidRegistrations() {
    CodecRegistry.Builder builder = CodecRegistry.builder();
    assertThrows(IllegalArgumentException.class, () -> builder.register(Point.class, null));
    assertThrows(IllegalArgumentException.class, () -> builder.registerFactory("", type -> null));
    assertThrows(IllegalArgumentException.class, () -> builder.registerGlobalFactory(null));
  }
}
