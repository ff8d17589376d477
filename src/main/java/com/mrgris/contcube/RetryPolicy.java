package com.mrgris.contcube;

import java.io.IOException;
import java.io.Serializable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** How many times a failed engine invocation is attempted. */
public class RetryPolicy implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

	public interface Attempt<T> {
		T attempt() throws IOException, InterruptedException;
	}

	public interface Outcome<T> {
		boolean failed(T result);
	}

	public final int maxAttempts;
	public final long delayMillis;

	RetryPolicy(int maxAttempts, long delayMillis) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("at least one attempt required");
		}
		this.maxAttempts = maxAttempts;
		this.delayMillis = delayMillis;
	}

	public static RetryPolicy none() {
		return new RetryPolicy(1, 0);
	}

	public static RetryPolicy bounded(int maxAttempts, long delayMillis) {
		return new RetryPolicy(maxAttempts, delayMillis);
	}

	/** returns the first result that did not fail, or the last one */
	public <T> T run(String what, Attempt<T> attempt, Outcome<T> outcome) throws IOException, InterruptedException {
		T result = null;
		for (int i = 1; i <= maxAttempts; i++) {
			try {
				result = attempt.attempt();
				if (!outcome.failed(result)) {
					return result;
				}
				if (i == maxAttempts) {
					return result;
				}
				LOG.warn("{} failed, attempt {}/{}", what, i, maxAttempts);
			} catch (IOException e) {
				if (i == maxAttempts) {
					throw e;
				}
				LOG.warn(String.format("%s failed, attempt %d/%d", what, i, maxAttempts), e);
			}
			Thread.sleep(delayMillis);
		}
		return result;
	}
}
