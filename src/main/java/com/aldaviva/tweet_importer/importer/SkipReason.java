package com.aldaviva.tweet_importer.importer;

/**
 * Why a tweet was not imported.
 */
public enum SkipReason {

	REPLY("reply"),
	MENTION("start with @"),
	RETWEET("start with RT"),
	VIDEO("containing videos");

	private final String description;

	SkipReason(final String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}

}
