package com.mrgris.contcube;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mrgris.contcube.image.BeamShape;

class CommonBeamCacheTest {

	@TempDir
	Path tmp;

	@Test
	void roundTripsExactly() throws Exception {
		CommonBeamCache cache = new CommonBeamCache(tmp.toString());
		CommonBeam cb = new CommonBeam("abc123def4567890", new BeamShape(12.345678901234567, 9.87654321, -33.3333333333), 7);
		cache.store(cb);
		CommonBeam back = cache.load("abc123def4567890");
		assertEquals(cb, back);
		assertEquals(cb.major, back.major, 0.);
		assertEquals(cb.pa, back.pa, 0.);
	}

	@Test
	void missingEntryIsNull() throws Exception {
		assertNull(new CommonBeamCache(tmp.toString()).load("nothing"));
	}

	@Test
	void firstWriterWins() throws Exception {
		CommonBeamCache cache = new CommonBeamCache(tmp.toString());
		CommonBeam first = new CommonBeam("fp0000000000000", new BeamShape(2, 1, 0), 1);
		CommonBeam second = new CommonBeam("fp0000000000000", new BeamShape(3, 1, 0), 1);
		cache.store(first);
		assertEquals(first, cache.store(second));
		assertEquals(first, cache.load("fp0000000000000"));
		try (Stream<Path> files = Files.list(tmp)) {
			assertEquals(1, files.count());
		}
	}

	@Test
	void computesOnlyOnMiss() throws Exception {
		CommonBeamCache cache = new CommonBeamCache(tmp.toString());
		AtomicInteger computed = new AtomicInteger();
		CommonBeamCache.Computation c = () -> {
			computed.incrementAndGet();
			return new CommonBeam("fp1111111111111", new BeamShape(2, 2, 0), 3);
		};
		CommonBeam a = cache.getOrCompute("fp1111111111111", c);
		CommonBeam b = cache.getOrCompute("fp1111111111111", c);
		assertEquals(a, b);
		assertEquals(1, computed.get());
	}

	@Test
	void corruptEntryIsAnError() throws Exception {
		CommonBeamCache cache = new CommonBeamCache(tmp.toString());
		Files.write(cache.entry("bad"), "{not json".getBytes(StandardCharsets.UTF_8));
		assertThrows(IOException.class, () -> cache.load("bad"));
	}
}
