package com.aldaviva.tweet_importer.archive;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up archived tweets by ID. The posts are shared with the importer, so a {@link PublishResult} attached during a run is visible to later
 * lookups in the same run.
 */
public class PostIndex {

	private final List<ArchivedPost> posts;
	private final Map<String, ArchivedPost> postsById = new HashMap<>();

	public PostIndex(final List<ArchivedPost> posts) {
		this.posts = posts;
		for (final ArchivedPost post : posts) {
			postsById.putIfAbsent(post.getId(), post);
		}
	}

	public ArchivedPost get(final String tweetId) {
		return tweetId != null ? postsById.get(tweetId) : null;
	}

	/**
	 * @return the Bluesky post that the given tweet was imported as, or {@code null} if it isn't in the archive or hasn't been imported
	 */
	public PublishResult getPublishResult(final String tweetId) {
		final ArchivedPost post = get(tweetId);
		return post != null ? post.getPublishResult() : null;
	}

	/**
	 * @return all posts, oldest first
	 */
	public List<ArchivedPost> getPosts() {
		return Collections.unmodifiableList(posts);
	}

}
