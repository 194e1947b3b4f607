package com.aldaviva.tweet_importer.importer;

import java.time.Duration;

public class ImportSummary {

	/**
	 * Allowance for resolving shortened links, which a simulation does not wait for the same way a real import does.
	 */
	static final Duration URL_RESOLUTION_MARGIN = Duration.ofMinutes(10);

	private final int importedCount;
	private final boolean simulated;
	private final Duration apiDelay;

	public ImportSummary(final int importedCount, final boolean simulated, final Duration apiDelay) {
		this.importedCount = importedCount;
		this.simulated = simulated;
		this.apiDelay = apiDelay;
	}

	/**
	 * @return number of tweets posted to Bluesky, or that would have been posted in a simulation
	 */
	public int getImportedCount() {
		return importedCount;
	}

	public boolean isSimulated() {
		return simulated;
	}

	/**
	 * @return how long a real import of the same tweets would take, rounded to the minute
	 */
	public Duration getEstimatedRealDuration() {
		final long apiMinutes = Math.round(importedCount * apiDelay.toMillis() / 1000.0 / 60.0);
		return Duration.ofMinutes(apiMinutes).plus(URL_RESOLUTION_MARGIN);
	}

	@Override
	public String toString() {
		return String.format("ImportSummary [importedCount=%s, simulated=%s]", importedCount, simulated);
	}

}
