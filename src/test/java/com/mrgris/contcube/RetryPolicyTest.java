package com.mrgris.contcube;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class RetryPolicyTest {

	@Test
	void noneRunsOnce() throws Exception {
		AtomicInteger calls = new AtomicInteger();
		int result = RetryPolicy.none().run("x", () -> calls.incrementAndGet(), r -> true);
		assertEquals(1, result);
		assertEquals(1, calls.get());
	}

	@Test
	void boundedStopsAtFirstSuccess() throws Exception {
		AtomicInteger calls = new AtomicInteger();
		int result = RetryPolicy.bounded(5, 0).run("x", () -> calls.incrementAndGet(), r -> r < 3);
		assertEquals(3, result);
		assertEquals(3, calls.get());
	}

	@Test
	void boundedGivesUpWithLastResult() throws Exception {
		AtomicInteger calls = new AtomicInteger();
		int result = RetryPolicy.bounded(2, 0).run("x", () -> calls.incrementAndGet(), r -> true);
		assertEquals(2, result);
	}

	@Test
	void ioErrorsRetriedThenRethrown() {
		AtomicInteger calls = new AtomicInteger();
		assertThrows(IOException.class, () -> RetryPolicy.bounded(3, 0).run("x", () -> {
			calls.incrementAndGet();
			throw new IOException("cannot start");
		}, r -> false));
		assertEquals(3, calls.get());
	}

	@Test
	void atLeastOneAttempt() {
		assertThrows(IllegalArgumentException.class, () -> RetryPolicy.bounded(0, 0));
	}
}
