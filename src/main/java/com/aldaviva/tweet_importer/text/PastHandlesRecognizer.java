package com.aldaviva.tweet_importer.text;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recognizes links to tweets by any of the author's current or past Twitter handles. The host must be one of Twitter's own domains and the
 * first path segment must equal one of the handles, ignoring case.
 */
public class PastHandlesRecognizer implements SelfReferenceRecognizer {

	private static final Set<String> TWITTER_HOSTS = Set.of("twitter.com", "www.twitter.com", "mobile.twitter.com", "x.com", "www.x.com", "mobile.x.com");
	private static final Pattern STATUS_PATH = Pattern.compile("^/(?<handle>[^/]+)/status(?:es)?/(?<id>[0-9]+)(?:/.*)?$");

	private final Set<String> pastHandles;

	public PastHandlesRecognizer(final Collection<String> pastHandles) {
		this.pastHandles = pastHandles.stream()
		    .map(handle -> handle.trim().replaceFirst("^@", "").toLowerCase(Locale.ROOT))
		    .filter(handle -> !handle.isEmpty())
		    .collect(Collectors.toUnmodifiableSet());
	}

	@Override
	public boolean isSelfReference(final String url) {
		final Matcher matcher = matchStatusUrl(url);
		return matcher != null && pastHandles.contains(matcher.group("handle").toLowerCase(Locale.ROOT));
	}

	/**
	 * @return the tweet ID from a link like {@code https://twitter.com/someone/status/123}, or {@code null} if the URL does not link to a tweet
	 */
	public static String getStatusId(final String url) {
		final Matcher matcher = matchStatusUrl(url);
		return matcher != null ? matcher.group("id") : null;
	}

	/**
	 * @return true for links to one photo of a tweet, like {@code https://twitter.com/someone/status/123/photo/1}
	 */
	public static boolean isPhotoUrl(final String url) {
		return url != null && url.indexOf("/photo/") > 0;
	}

	private static Matcher matchStatusUrl(final String url) {
		if (url == null) {
			return null;
		}

		try {
			final URI uri = new URI(url);
			if (uri.getHost() == null || !TWITTER_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT)) || uri.getPath() == null) {
				return null;
			}

			final Matcher matcher = STATUS_PATH.matcher(uri.getPath());
			return matcher.matches() ? matcher : null;
		} catch (final URISyntaxException e) {
			return null;
		}
	}

}
