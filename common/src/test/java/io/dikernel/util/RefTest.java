package io.dikernel.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class RefTest {
	@Test
	public void testHoldsAndReplacesValue() {
		Ref<String> ref = Ref.of("first");
		assertFalse(ref.isEmpty());
		assertEquals("first", ref.get());

		ref.set(null);
		assertTrue(ref.isEmpty());
		assertNull(ref.get());
	}

	@Test
	public void testEqualityFollowsHeldValue() {
		assertEquals(Ref.of("x"), Ref.of("x"));
		assertNotEquals(Ref.of("x"), Ref.of("y"));
		assertEquals(new Ref<>(), Ref.of(null));
		assertEquals(Ref.of("x").hashCode(), Ref.of("x").hashCode());
	}
}
