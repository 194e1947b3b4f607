package com.aldaviva.tweet_importer.archive;

import com.aldaviva.tweet_importer.archive.TwitterArchiveSchema.Tweet;
import com.aldaviva.tweet_importer.http.JacksonConfig.CustomObjectMapperProvider;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * One tweet from the archive, in the same {@code { "tweet": {...} }} wrapper that the archive and the checkpoint file use. The original
 * tweet fields are kept verbatim so that rewriting the checkpoint never loses data. The only mutable part is the {@link PublishResult}.
 */
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE, fieldVisibility = Visibility.NONE, setterVisibility = Visibility.NONE)
public class ArchivedPost {

	static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss xx yyyy", Locale.US); // Thu Jan 16 19:15:41 +0000 2025

	private final ObjectNode source;
	private final Tweet tweet;
	private final Instant createdAt;

	private PublishResult publishResult;

	@JsonCreator
	public ArchivedPost(@JsonProperty("tweet") final ObjectNode source) {
		if (source == null) {
			throw new IllegalArgumentException("Archive entry has no tweet object");
		}

		this.source = source;
		tweet = CustomObjectMapperProvider.OBJECT_MAPPER.convertValue(source, Tweet.class);

		if (tweet.id == null || tweet.id.isEmpty()) {
			throw new IllegalArgumentException("Tweet has no id: " + source);
		}

		if (tweet.createdAt == null) {
			throw new IllegalArgumentException("Tweet " + tweet.id + " has no created_at date");
		}
		try {
			createdAt = OffsetDateTime.parse(tweet.createdAt, DATE_FORMAT).toInstant();
		} catch (final DateTimeParseException e) {
			throw new IllegalArgumentException("Tweet " + tweet.id + " has an invalid created_at date " + tweet.createdAt, e);
		}

		if (tweet.fullText == null) {
			tweet.fullText = "";
		}
	}

	@JsonProperty("tweet")
	public ObjectNode getSource() {
		return source;
	}

	public Tweet getTweet() {
		return tweet;
	}

	public String getId() {
		return tweet.id;
	}

	public Instant getCreatedAt() {
		return createdAt;
	}

	@JsonProperty("bsky")
	public PublishResult getPublishResult() {
		return publishResult;
	}

	@JsonProperty("bsky")
	public void setPublishResult(final PublishResult publishResult) {
		this.publishResult = publishResult;
	}

	public boolean isPublished() {
		return publishResult != null;
	}

	@Override
	public String toString() {
		return String.format("ArchivedPost [id=%s, createdAt=%s, publishResult=%s]", tweet.id, createdAt, publishResult);
	}

}
