package com.aldaviva.tweet_importer.importer;

import java.time.Duration;

@FunctionalInterface
public interface RateLimitDelay {

	RateLimitDelay SLEEP = duration -> {
		try {
			Thread.sleep(duration.toMillis());
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for the Bluesky rate limit", e);
		}
	};

	void await(Duration duration);

}
