package net.larse.seas.helper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

public class NameResolverTest {

  @Test
  public void testResolve() {
    NameResolver<Integer> resolver = new NameResolver<Integer>()
        .add(1, "moving average", "ma")
        .add(2, "mean");

    assertEquals(Integer.valueOf(1), resolver.resolve("MA"));
    assertEquals(Integer.valueOf(1), resolver.resolve("mov"));
    assertEquals(Integer.valueOf(2), resolver.resolve("mean"));
    assertEquals(Integer.valueOf(2), resolver.resolve("me"));
    // ambiguous
    assertNull(resolver.resolve("m"));
    assertNull(resolver.resolve("median"));
    assertNull(resolver.resolve(null));
  }
}
