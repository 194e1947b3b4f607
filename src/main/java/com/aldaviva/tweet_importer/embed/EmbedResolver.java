package com.aldaviva.tweet_importer.embed;

import com.aldaviva.tweet_importer.archive.ArchivedPost;
import com.aldaviva.tweet_importer.archive.PostIndex;
import com.aldaviva.tweet_importer.archive.TwitterArchiveSchema.Tweet;
import com.aldaviva.tweet_importer.archive.TwitterArchiveSchema.UrlEntity;
import com.aldaviva.tweet_importer.services.bluesky.BlueskyClient;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Blob;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Embed;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Image;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.ImagesEmbed;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.RecordEmbed;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.ReplyRef;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.StrongRef;
import com.aldaviva.tweet_importer.text.PastHandlesRecognizer;
import com.aldaviva.tweet_importer.text.SelfReferenceRecognizer;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Works out what a tweet's Bluesky post should embed (a quoted post or images) and which post it replies to.
 */
public class EmbedResolver {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(EmbedResolver.class);

	private static final Pattern BLUESKY_POST_URL = Pattern.compile("^https?://(?:www\\.)?bsky\\.app/profile/(?<actor>[^/?#]+)/post/(?<recordkey>[^/?#]+)/?(?:[?#].*)?$",
	    Pattern.CASE_INSENSITIVE);

	private final SelfReferenceRecognizer selfReferenceRecognizer;
	private final BlueskyClient bluesky;

	/**
	 * @param bluesky used to look up quoted Bluesky posts, or {@code null} to only embed quotes of the author's own imported tweets
	 */
	public EmbedResolver(final SelfReferenceRecognizer selfReferenceRecognizer, final BlueskyClient bluesky) {
		this.selfReferenceRecognizer = selfReferenceRecognizer;
		this.bluesky = bluesky;
	}

	/**
	 * Find the first link in the tweet that can be embedded as a quoted post: either a tweet by the same author that has already been imported, or
	 * a post on Bluesky itself.
	 * @return the link and the record to embed, or {@code null} if no link can be embedded
	 */
	public EmbeddedRecord resolveEmbeddedRecord(final Tweet tweet, final PostIndex posts) {
		for (final UrlEntity urlEntity : tweet.getUrls()) {
			final String expandedUrl = urlEntity.expandedUrl;
			if (expandedUrl == null) {
				continue;
			}

			if (selfReferenceRecognizer.isSelfReference(expandedUrl) && !PastHandlesRecognizer.isPhotoUrl(expandedUrl)) {
				final String quotedId = PastHandlesRecognizer.getStatusId(expandedUrl);
				final ArchivedPost quoted = posts.get(quotedId);
				if (quoted == null) {
					LOGGER.debug("Tweet {} quotes own tweet {}, which is not in the archive", tweet.id, quotedId);
				} else if (!quoted.isPublished()) {
					LOGGER.warn("Tweet {} quotes tweet {}, which has not been imported yet, so the quote can't be embedded", tweet.id, quotedId);
				} else {
					return new EmbeddedRecord(expandedUrl, StrongRef.of(quoted.getPublishResult()));
				}
				continue;
			}

			final Matcher blueskyPost = BLUESKY_POST_URL.matcher(expandedUrl);
			if (blueskyPost.matches() && bluesky != null) {
				try {
					final StrongRef record = bluesky.getPost(blueskyPost.group("actor"), blueskyPost.group("recordkey"));
					if (record != null && record.uri != null && record.cid != null) {
						return new EmbeddedRecord(expandedUrl, record);
					}
				} catch (final WebApplicationException | ProcessingException e) {
					LOGGER.warn("Failed to look up quoted Bluesky post {}, leaving it as a link: {}", expandedUrl, e.getMessage());
				}
			}
		}

		return null;
	}

	/**
	 * @return references to the imported parent and thread root of a reply, or {@code null} if the tweet is not a reply to an imported tweet
	 */
	public ReplyRef resolveReply(final Tweet tweet, final PostIndex posts) {
		if (tweet.inReplyToStatusId == null) {
			return null;
		}

		final ArchivedPost parent = posts.get(tweet.inReplyToStatusId);
		if (parent == null) {
			LOGGER.debug("Tweet {} replies to tweet {}, which is not in the archive", tweet.id, tweet.inReplyToStatusId);
			return null;
		} else if (!parent.isPublished()) {
			LOGGER.warn("Tweet {} replies to tweet {}, which has not been imported yet, so it will be posted as a top-level post", tweet.id,
			    tweet.inReplyToStatusId);
			return null;
		}

		ArchivedPost root = parent;
		final Set<String> visited = new HashSet<>();
		visited.add(tweet.id);
		while (visited.add(root.getId())) {
			final ArchivedPost ancestor = posts.get(root.getTweet().inReplyToStatusId);
			if (ancestor == null || !ancestor.isPublished()) {
				break;
			}
			root = ancestor;
		}

		return new ReplyRef(StrongRef.of(root.getPublishResult()), StrongRef.of(parent.getPublishResult()));
	}

	/**
	 * A post can only have one embed. Images take precedence over a quoted post.
	 * @return the embed to attach to the post, or {@code null} if there are neither images nor a quoted post
	 */
	public static Embed mergeEmbed(final List<Blob> images, final EmbeddedRecord embeddedRecord) {
		if (images != null && !images.isEmpty()) {
			return new ImagesEmbed(images.stream().map(Image::new).collect(Collectors.toList()));
		} else if (embeddedRecord != null) {
			return new RecordEmbed(embeddedRecord.getRecord());
		} else {
			return null;
		}
	}

}
