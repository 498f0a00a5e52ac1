package org.sessionstore;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

import static org.junit.Assert.*;

public class SessionIdsTest {

	@Test
	public void idsAreLowerCaseHexOf256Bits() {
		String id = SessionIds.newId();
		assertEquals(64, id.length());
		assertTrue(id, id.matches("[0-9a-f]{64}"));
	}

	@Test
	public void idsDoNotRepeat() {
		Set<String> seen = new HashSet<String>();
		for(int i = 0; i < 10000; i++) {
			assertTrue(seen.add(SessionIds.newId()));
		}
	}

}
