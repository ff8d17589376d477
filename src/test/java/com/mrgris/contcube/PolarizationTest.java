package com.mrgris.contcube;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class PolarizationTest {

	@Test
	void parsesInOrder() {
		assertEquals(Arrays.asList(Polarization.I, Polarization.Q, Polarization.U), Polarization.parse("IQU"));
		assertEquals(Arrays.asList(Polarization.V, Polarization.I), Polarization.parse("vi"));
	}

	@Test
	void rejectsUnknownAndRepeated() {
		assertThrows(IllegalArgumentException.class, () -> Polarization.parse("IXU"));
		assertThrows(IllegalArgumentException.class, () -> Polarization.parse("QQ"));
		assertThrows(IllegalArgumentException.class, () -> Polarization.parse(""));
	}

	@Test
	void joinsBack() {
		assertEquals("QU", Polarization.join(Polarization.parse("qu")));
	}
}
