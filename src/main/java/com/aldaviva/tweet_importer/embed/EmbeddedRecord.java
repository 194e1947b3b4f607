package com.aldaviva.tweet_importer.embed;

import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.StrongRef;

/**
 * A link in a tweet that will be shown as a quoted post instead of as text.
 */
public class EmbeddedRecord {

	private final String embeddedUrl;
	private final StrongRef record;

	public EmbeddedRecord(final String embeddedUrl, final StrongRef record) {
		this.embeddedUrl = embeddedUrl;
		this.record = record;
	}

	/**
	 * @return the expanded link, exactly as it appears in the tweet's URL entities
	 */
	public String getEmbeddedUrl() {
		return embeddedUrl;
	}

	public StrongRef getRecord() {
		return record;
	}

	@Override
	public String toString() {
		return String.format("EmbeddedRecord [embeddedUrl=%s, record=%s]", embeddedUrl, record != null ? record.uri : null);
	}

}
