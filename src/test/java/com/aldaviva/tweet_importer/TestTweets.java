package com.aldaviva.tweet_importer;

import com.aldaviva.tweet_importer.archive.ArchivedPost;
import com.aldaviva.tweet_importer.http.JacksonConfig.CustomObjectMapperProvider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds tweets shaped like the ones in a Twitter archive export.
 */
public final class TestTweets {

	public static final Instant START = Instant.parse("2020-01-01T00:00:00Z");
	private static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss xx yyyy", Locale.US).withZone(ZoneOffset.UTC);

	private TestTweets() {
	}

	/**
	 * @param minutesAfterStart creation time, in minutes after {@link #START}
	 */
	public static ObjectNode tweet(final String id, final int minutesAfterStart, final String fullText) {
		final ObjectNode tweet = CustomObjectMapperProvider.OBJECT_MAPPER.createObjectNode();
		tweet.put("id", id);
		tweet.put("id_str", id);
		tweet.put("created_at", CREATED_AT_FORMAT.format(START.plusSeconds(minutesAfterStart * 60L)));
		tweet.put("full_text", fullText);
		tweet.put("favorite_count", "0");
		tweet.putObject("entities").putArray("urls");
		return tweet;
	}

	public static ObjectNode withUrl(final ObjectNode tweet, final String url, final String expandedUrl) {
		final ArrayNode urls = (ArrayNode) tweet.path("entities").path("urls");
		urls.addObject()
		    .put("url", url)
		    .put("expanded_url", expandedUrl)
		    .put("display_url", expandedUrl.replaceFirst("^https?://", ""));
		return tweet;
	}

	public static ObjectNode withMedia(final ObjectNode tweet, final String type, final String mediaUrl) {
		if (!tweet.has("extended_entities")) {
			tweet.putObject("extended_entities").putArray("media");
		}
		((ArrayNode) tweet.path("extended_entities").path("media")).addObject()
		    .put("type", type)
		    .put("media_url", mediaUrl)
		    .put("media_url_https", mediaUrl.replaceFirst("^http:", "https:"));
		return tweet;
	}

	public static ObjectNode inReplyTo(final ObjectNode tweet, final String parentId, final String parentScreenName) {
		tweet.put("in_reply_to_status_id", parentId);
		tweet.put("in_reply_to_status_id_str", parentId);
		tweet.put("in_reply_to_screen_name", parentScreenName);
		return tweet;
	}

	public static ArchivedPost post(final ObjectNode tweet) {
		return new ArchivedPost(tweet);
	}

	/**
	 * @return the content of an archive file like {@code tweets-part1.js}
	 */
	public static String archiveFile(final int partNumber, final ObjectNode... tweets) {
		final ArrayNode wrappers = CustomObjectMapperProvider.OBJECT_MAPPER.createArrayNode();
		for (final ObjectNode tweet : tweets) {
			wrappers.addObject().set("tweet", tweet);
		}

		try {
			return "window.YTD.tweets.part" + partNumber + " = " + CustomObjectMapperProvider.OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(wrappers) + ";";
		} catch (final JsonProcessingException e) {
			throw new RuntimeException(e);
		}
	}

}
