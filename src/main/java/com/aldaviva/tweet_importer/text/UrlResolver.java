package com.aldaviva.tweet_importer.text;

public interface UrlResolver {

	/**
	 * Expand a possibly shortened link, like {@code https://t.co/abc}, to the URL it finally redirects to.
	 * @return the expanded URL, or {@code url} itself if it could not be resolved in time
	 */
	String resolve(String url);

}
