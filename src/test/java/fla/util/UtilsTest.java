package fla.util;

import java.util.*;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {

	@Test
	public void testFormatSet(){
		assertEquals("{a, b, c}", Utils.formatSet(Arrays.asList("c", "a", "b")));
		assertEquals("{}", Utils.formatSet(Collections.emptySet()));
	}

	@Test
	public void testSplitSymbols(){
		assertEquals(Arrays.asList("a", "ε", "b"), Utils.splitSymbols("aεb"));
		assertTrue(Utils.splitSymbols("").isEmpty());
	}

	@Test
	public void testFreshName(){
		Set<String> first = new HashSet<>(Arrays.asList("x", "x'"));
		Set<String> second = new HashSet<>(Collections.singletonList("x''"));
		assertEquals("y", Utils.freshName("y", first, second));
		assertEquals("x'''", Utils.freshName("x", first, second));
	}

	@Test
	public void testRandomWord(){
		Random random = new Random(5);
		for (int i = 0; i < 100; i++){
			List<String> word = Utils.randomWord(Arrays.asList("a", "b"), 2, 4, random);
			assertTrue(word.size() >= 2 && word.size() <= 4, word.toString());
			assertTrue(Arrays.asList("a", "b").containsAll(word));
		}
		assertThrows(IllegalArgumentException.class, () -> Utils.randomWord(Collections.emptyList(), 0, 1, random));
		assertThrows(IllegalArgumentException.class, () -> Utils.randomWord(Arrays.asList("a"), 3, 1, random));
	}

	@Test
	public void testJoin(){
		assertEquals("1-2-3", Utils.join(Arrays.asList(1, 2, 3), "-"));
		assertEquals("", Utils.join(Collections.emptyList(), "-"));
	}
}
