package com.aldaviva.tweet_importer.archive;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.ws.rs.core.UriBuilder;
import java.net.URI;

/**
 * The Bluesky record that a tweet was imported as. Its presence on an {@link ArchivedPost} means the tweet must never be posted again.
 */
public class PublishResult {

	private static final UriBuilder POST_PAGE_URI = UriBuilder.fromUri("https://bsky.app/profile/{author}/post/{recordkey}");
	private static final String AT_URI_SCHEME = "at://";

	private final String uri;
	private final String cid;

	@JsonCreator
	public PublishResult(@JsonProperty("uri") final String uri, @JsonProperty("cid") final String cid) {
		this.uri = uri;
		this.cid = cid;
	}

	/**
	 * @return AT URI of the post record, like {@code at://did:plc:abc/app.bsky.feed.post/3k2a}
	 */
	@JsonProperty("uri")
	public String getUri() {
		return uri;
	}

	@JsonProperty("cid")
	public String getCid() {
		return cid;
	}

	/**
	 * @return the bsky.app page of this post, or {@code null} if {@link #getUri()} is not an AT URI of a record
	 */
	@JsonIgnore
	public URI getWebUrl() {
		if (uri == null || !uri.startsWith(AT_URI_SCHEME)) {
			return null;
		}

		final String[] segments = uri.substring(AT_URI_SCHEME.length()).split("/");
		if (segments.length != 3) {
			return null;
		}

		return POST_PAGE_URI.build(segments[0], segments[2]);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((cid == null) ? 0 : cid.hashCode());
		result = prime * result + ((uri == null) ? 0 : uri.hashCode());
		return result;
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		final PublishResult other = (PublishResult) obj;
		if (cid == null) {
			if (other.cid != null) {
				return false;
			}
		} else if (!cid.equals(other.cid)) {
			return false;
		}
		if (uri == null) {
			if (other.uri != null) {
				return false;
			}
		} else if (!uri.equals(other.uri)) {
			return false;
		}
		return true;
	}

	@Override
	public String toString() {
		return String.format("PublishResult [uri=%s, cid=%s]", uri, cid);
	}

}
