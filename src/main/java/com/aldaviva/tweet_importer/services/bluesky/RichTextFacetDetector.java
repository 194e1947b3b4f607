package com.aldaviva.tweet_importer.services.bluesky;

import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Facet;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.LinkFeature;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.MentionFeature;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.TagFeature;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds mentions, links and hashtags in post text, so that Bluesky renders them as rich text. Mentions of handles that don't resolve to an
 * account are left as plain text.
 * @see https://docs.bsky.app/docs/advanced-guides/post-richtext
 */
public class RichTextFacetDetector {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(RichTextFacetDetector.class);

	private static final Pattern MENTION = Pattern.compile("(?<=^|\\s|\\()@(?<handle>[a-zA-Z0-9.-]+)\\b");
	private static final Pattern HANDLE = Pattern.compile("^([a-zA-Z0-9]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]([a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?$");
	private static final Pattern LINK = Pattern.compile("(?<=^|\\s|\\()https?://\\S+", Pattern.CASE_INSENSITIVE);
	private static final Pattern TAG = Pattern.compile("(?<=^|\\s)[#\\uFF03](?<tag>[^\\s\\u00AD\\u2060\\u200A\\u200B\\u200C\\u200D\\u20E2]+)");
	private static final Pattern DIGITS_ONLY = Pattern.compile("^[0-9]+$");
	private static final String TRAILING_PUNCTUATION = ".,;:!?";
	private static final int MAX_TAG_LENGTH = 64;

	private final BlueskyClient bluesky;

	public RichTextFacetDetector(final BlueskyClient bluesky) {
		this.bluesky = bluesky;
	}

	public List<Facet> detectFacets(final String text) {
		final List<Facet> facets = new ArrayList<>();
		detectMentions(text, facets);
		detectLinks(text, facets);
		detectTags(text, facets);
		facets.sort(Comparator.comparingInt(facet -> facet.index.byteStart));
		return facets;
	}

	private void detectMentions(final String text, final List<Facet> facets) {
		final Matcher matcher = MENTION.matcher(text);
		while (matcher.find()) {
			final String handle = matcher.group("handle");
			if (!HANDLE.matcher(handle).matches() || handle.endsWith(".test")) {
				continue;
			}

			try {
				final String did = bluesky.resolveHandle(handle);
				if (did != null) {
					facets.add(new Facet(utf8Offset(text, matcher.start()), utf8Offset(text, matcher.end()), new MentionFeature(did)));
				}
			} catch (final WebApplicationException | ProcessingException e) {
				LOGGER.debug("Not linking mention of @{} because the handle could not be resolved: {}", handle, e.getMessage());
			}
		}
	}

	private static void detectLinks(final String text, final List<Facet> facets) {
		final Matcher matcher = LINK.matcher(text);
		while (matcher.find()) {
			String uri = matcher.group();
			while (!uri.isEmpty() && (TRAILING_PUNCTUATION.indexOf(uri.charAt(uri.length() - 1)) >= 0 || (uri.endsWith(")") && !uri.contains("(")))) {
				uri = uri.substring(0, uri.length() - 1);
			}

			final int start = matcher.start();
			facets.add(new Facet(utf8Offset(text, start), utf8Offset(text, start + uri.length()), new LinkFeature(uri)));
		}
	}

	private static void detectTags(final String text, final List<Facet> facets) {
		final Matcher matcher = TAG.matcher(text);
		while (matcher.find()) {
			String tag = matcher.group("tag");
			while (!tag.isEmpty() && isPunctuation(tag.codePointBefore(tag.length()))) {
				tag = tag.substring(0, tag.offsetByCodePoints(tag.length(), -1));
			}

			if (tag.isEmpty() || tag.length() > MAX_TAG_LENGTH || DIGITS_ONLY.matcher(tag).matches()) {
				continue;
			}

			final int start = matcher.start();
			final int end = matcher.start("tag") + tag.length();
			facets.add(new Facet(utf8Offset(text, start), utf8Offset(text, end), new TagFeature(tag)));
		}
	}

	private static boolean isPunctuation(final int codePoint) {
		switch (Character.getType(codePoint)) {
			case Character.CONNECTOR_PUNCTUATION:
			case Character.DASH_PUNCTUATION:
			case Character.START_PUNCTUATION:
			case Character.END_PUNCTUATION:
			case Character.INITIAL_QUOTE_PUNCTUATION:
			case Character.FINAL_QUOTE_PUNCTUATION:
			case Character.OTHER_PUNCTUATION:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Facet indices count bytes of UTF-8, but Java strings count UTF-16 code units.
	 */
	static int utf8Offset(final String text, final int charIndex) {
		return text.substring(0, charIndex).getBytes(StandardCharsets.UTF_8).length;
	}

}
