package com.aldaviva.tweet_importer.text;

import com.aldaviva.tweet_importer.archive.PostIndex;
import com.aldaviva.tweet_importer.archive.PublishResult;
import com.aldaviva.tweet_importer.archive.TwitterArchiveSchema.UrlEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.parser.Parser;

/**
 * Turns the text of a tweet into the text of a Bluesky post: shortened links are expanded, links to the author's own tweets point to the
 * imported Bluesky posts instead, links that are already shown as an embed are removed, and HTML entities are decoded.
 */
public class TweetTextCleaner {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(TweetTextCleaner.class);

	public static final int MAX_POST_LENGTH = 300;
	private static final String ELLIPSIS = "...";

	private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"\\u2026]+", Pattern.CASE_INSENSITIVE);
	private static final String TRAILING_PUNCTUATION = ".,;:!?'";

	private final UrlResolver urlResolver;
	private final SelfReferenceRecognizer selfReferenceRecognizer;

	public TweetTextCleaner(final UrlResolver urlResolver, final SelfReferenceRecognizer selfReferenceRecognizer) {
		this.urlResolver = urlResolver;
		this.selfReferenceRecognizer = selfReferenceRecognizer;
	}

	/**
	 * @param fullText text of the tweet
	 * @param urlMappings the tweet's {@code entities.urls}, which record what each t.co link expanded to, or {@code null}
	 * @param embeddedUrl the link that will be shown as a quoted post embed, so it should not also appear in the text, or {@code null}
	 * @param posts every tweet in the archive, used to find the Bluesky posts that self-quotes should point to
	 */
	public String clean(final String fullText, final List<UrlEntity> urlMappings, final String embeddedUrl, final PostIndex posts) {
		final List<UrlMatch> urls = findUrls(fullText);
		if (urls.isEmpty()) {
			return Parser.unescapeEntities(fullText, false);
		}

		final StringBuilder newText = new StringBuilder(fullText.length());
		int copiedUpTo = 0;
		for (final UrlMatch url : urls) {
			final String newUrl = rewriteUrl(url.text, urlMappings, embeddedUrl, posts);

			newText.append(fullText, copiedUpTo, url.start);
			// photos are attached to the post as images, and the embedded URL is attached as a quote, so neither needs a link in the text
			if (!(selfReferenceRecognizer.isSelfReference(newUrl) && PastHandlesRecognizer.isPhotoUrl(newUrl)) && !newUrl.equals(embeddedUrl)) {
				newText.append(newUrl);
			}
			copiedUpTo = url.end;
		}
		newText.append(fullText, copiedUpTo, fullText.length());

		return Parser.unescapeEntities(newText.toString(), false);
	}

	private String rewriteUrl(final String url, final List<UrlEntity> urlMappings, final String embeddedUrl, final PostIndex posts) {
		// prefer the archive's own expansion so the result matches what Twitter showed
		String expandedUrl = null;
		if (urlMappings != null) {
			for (final UrlEntity mapping : urlMappings) {
				if (url.equals(mapping.url) && mapping.expandedUrl != null) {
					expandedUrl = mapping.expandedUrl;
					break;
				}
			}
		}
		if (expandedUrl == null) {
			expandedUrl = urlResolver.resolve(url);
		}

		if (selfReferenceRecognizer.isSelfReference(expandedUrl) && !PastHandlesRecognizer.isPhotoUrl(expandedUrl) && !Objects.equals(expandedUrl, embeddedUrl)) {
			final String statusId = PastHandlesRecognizer.getStatusId(expandedUrl);
			final PublishResult quotedPost = posts.getPublishResult(statusId);
			if (quotedPost != null && quotedPost.getWebUrl() != null) {
				return quotedPost.getWebUrl().toString();
			} else {
				LOGGER.warn("Link to own tweet {} can't be converted to a Bluesky link because that tweet has not been imported yet, leaving {}", statusId,
				    expandedUrl);
			}
		}

		return expandedUrl;
	}

	/**
	 * Bluesky rejects posts longer than {@value #MAX_POST_LENGTH} characters. If cleaning made the text too long (by expanding links, for
	 * example), go back to the original text, and if that is still too long, cut it off.
	 */
	public static String fitToLimit(final String cleanText, final String originalText) {
		if (cleanText.length() <= MAX_POST_LENGTH) {
			return cleanText;
		} else if (originalText.length() <= MAX_POST_LENGTH) {
			return originalText;
		}

		int cutoff = MAX_POST_LENGTH - ELLIPSIS.length() - 1;
		if (Character.isHighSurrogate(originalText.charAt(cutoff - 1))) {
			cutoff--;
		}
		return originalText.substring(0, cutoff) + ELLIPSIS;
	}

	static List<UrlMatch> findUrls(final String text) {
		final List<UrlMatch> urls = new ArrayList<>();
		final Matcher matcher = URL.matcher(text);
		while (matcher.find()) {
			int end = matcher.end();
			while (end > matcher.start() && isTrailingPunctuation(text, matcher.start(), end)) {
				end--;
			}
			urls.add(new UrlMatch(matcher.start(), end, text.substring(matcher.start(), end)));
		}
		return urls;
	}

	private static boolean isTrailingPunctuation(final String text, final int start, final int end) {
		final char last = text.charAt(end - 1);
		if (TRAILING_PUNCTUATION.indexOf(last) >= 0) {
			return true;
		} else if (last == ')') {
			// keep parentheses that are part of the URL, like Wikipedia links
			final String candidate = text.substring(start, end);
			return candidate.chars().filter(c -> c == '(').count() < candidate.chars().filter(c -> c == ')').count();
		}
		return false;
	}

	static final class UrlMatch {
		final int start;
		final int end;
		final String text;

		UrlMatch(final int start, final int end, final String text) {
			this.start = start;
			this.end = end;
			this.text = text;
		}
	}

}
