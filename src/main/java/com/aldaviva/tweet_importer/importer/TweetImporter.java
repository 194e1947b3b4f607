package com.aldaviva.tweet_importer.importer;

import com.aldaviva.tweet_importer.ImportConfiguration;
import com.aldaviva.tweet_importer.archive.ArchivedPost;
import com.aldaviva.tweet_importer.archive.CheckpointStore;
import com.aldaviva.tweet_importer.archive.PostIndex;
import com.aldaviva.tweet_importer.archive.PublishResult;
import com.aldaviva.tweet_importer.archive.TwitterArchiveSchema.Tweet;
import com.aldaviva.tweet_importer.embed.EmbedResolver;
import com.aldaviva.tweet_importer.embed.EmbeddedRecord;
import com.aldaviva.tweet_importer.http.JacksonConfig;
import com.aldaviva.tweet_importer.media.EncodedImage;
import com.aldaviva.tweet_importer.media.ImageNormalizer;
import com.aldaviva.tweet_importer.media.TweetMediaSelector;
import com.aldaviva.tweet_importer.media.TweetMediaSelector.Photo;
import com.aldaviva.tweet_importer.services.bluesky.BlueskyClient;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Blob;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Embed;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Link;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.PostRecord;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.RecordEmbed;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.StrongRef;
import com.aldaviva.tweet_importer.services.bluesky.RichTextFacetDetector;
import com.aldaviva.tweet_importer.text.TweetTextCleaner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Posts archived tweets to Bluesky one at a time, oldest first. Tweets that were imported by an earlier run are skipped, and the checkpoint file
 * is rewritten when the run ends, even if it fails partway through.
 */
public class TweetImporter {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(TweetImporter.class);

	private static final String SIMULATED_BLOB_LINK = "simulated";

	private final ImportConfiguration configuration;
	private final BlueskyClient bluesky;
	private final TweetTextCleaner textCleaner;
	private final EmbedResolver embedResolver;
	private final TweetMediaSelector mediaSelector;
	private final ImageNormalizer imageNormalizer;
	private final RichTextFacetDetector facetDetector;
	private final CheckpointStore checkpointStore;
	private final RateLimitDelay rateLimitDelay;
	private final ObjectWriter recordWriter = JacksonConfig.prettyWriter();

	public TweetImporter(final ImportConfiguration configuration, final BlueskyClient bluesky, final TweetTextCleaner textCleaner,
	    final EmbedResolver embedResolver, final TweetMediaSelector mediaSelector, final ImageNormalizer imageNormalizer,
	    final RichTextFacetDetector facetDetector, final CheckpointStore checkpointStore, final RateLimitDelay rateLimitDelay) {
		this.configuration = configuration;
		this.bluesky = bluesky;
		this.textCleaner = textCleaner;
		this.embedResolver = embedResolver;
		this.mediaSelector = mediaSelector;
		this.imageNormalizer = imageNormalizer;
		this.facetDetector = facetDetector;
		this.checkpointStore = checkpointStore;
		this.rateLimitDelay = rateLimitDelay;
	}

	/**
	 * @param posts every tweet in the archive, sorted oldest first. Imported tweets get their {@link PublishResult} set.
	 * @throws SubmissionException if Bluesky rejects an upload or post, after saving the checkpoint
	 */
	public ImportSummary importAll(final List<ArchivedPost> posts) {
		final PostIndex index = new PostIndex(posts);
		int importedCount = 0;
		RuntimeException failure = null;

		try {
			for (final ArchivedPost post : posts) {
				if (configuration.getMinDate() != null && post.getCreatedAt().isBefore(configuration.getMinDate())) {
					continue;
				}
				// sorted by date, so everything after this one is outside the window too
				if (configuration.getMaxDate() != null && post.getCreatedAt().isAfter(configuration.getMaxDate())) {
					LOGGER.debug("Tweet {} is after {}, stopping", post.getId(), configuration.getMaxDate());
					break;
				}

				if (post.isPublished()) {
					continue;
				}

				if (importPost(post, index)) {
					importedCount++;
				}
			}
		} catch (final RuntimeException e) {
			failure = e;
			throw e;
		} finally {
			try {
				checkpointStore.save(posts);
			} catch (final RuntimeException saveFailure) {
				if (failure == null) {
					throw saveFailure;
				}
				// keep the import failure as the cause users see
				failure.addSuppressed(saveFailure);
				LOGGER.error("Failed to save checkpoint file {}", checkpointStore.getCheckpointFile(), saveFailure);
			}
		}

		return new ImportSummary(importedCount, configuration.isSimulate(), configuration.getApiDelay());
	}

	/**
	 * @return true if the tweet was posted (or would have been, in a simulation), false if it was skipped
	 */
	boolean importPost(final ArchivedPost post, final PostIndex index) {
		final Tweet tweet = post.getTweet();

		LOGGER.info("Parse tweet id '{}'", tweet.id);
		LOGGER.info(" Created at {}", post.getCreatedAt());
		LOGGER.info(" Full text '{}'", tweet.fullText);

		SkipReason skipReason = getSkipReason(tweet);
		List<Photo> photos = null;
		if (skipReason == null) {
			photos = mediaSelector.selectPhotos(tweet);
			if (photos == null) {
				skipReason = SkipReason.VIDEO;
			}
		}
		if (skipReason != null) {
			LOGGER.info("Discarded ({})", skipReason.getDescription());
			return false;
		}

		final List<Blob> images = uploadImages(tweet, photos);

		final EmbeddedRecord embeddedRecord = embedResolver.resolveEmbeddedRecord(tweet, index);
		final Embed embed = EmbedResolver.mergeEmbed(images, embeddedRecord);
		// when images win, the quoted link has no embed of its own, so it stays in the text
		final String embeddedUrl = embed instanceof RecordEmbed ? embeddedRecord.getEmbeddedUrl() : null;

		final String cleanText = textCleaner.clean(tweet.fullText, tweet.getUrls(), embeddedUrl, index);
		final String postText = TweetTextCleaner.fitToLimit(cleanText, tweet.fullText);
		if (!postText.equals(tweet.fullText)) {
			LOGGER.info(" Clean text '{}'", postText);
		}

		final PostRecord record = new PostRecord();
		record.text = postText;
		record.facets = facetDetector.detectFacets(postText);
		record.createdAt = post.getCreatedAt();
		record.embed = embed;
		if (configuration.isImportReplies() && tweet.isReply()) {
			record.reply = embedResolver.resolveReply(tweet, index);
		}

		logRecord(record);

		if (configuration.isSimulate()) {
			return true;
		}

		final StrongRef created;
		try {
			created = bluesky.createPost(record);
		} catch (final WebApplicationException | ProcessingException e) {
			throw new SubmissionException("Failed to post tweet " + tweet.id + " to Bluesky", e);
		}

		final PublishResult publishResult = new PublishResult(created.uri, created.cid);
		post.setPublishResult(publishResult);

		final URI postUrl = publishResult.getWebUrl();
		if (postUrl != null) {
			LOGGER.info("Bluesky post created, URL: {}", postUrl);
		} else {
			LOGGER.warn("Bluesky post created with unexpected URI {}", created.uri);
		}

		rateLimitDelay.await(configuration.getApiDelay());
		return true;
	}

	private SkipReason getSkipReason(final Tweet tweet) {
		if (!configuration.isImportReplies() && tweet.isReply()) {
			return SkipReason.REPLY;
		} else if (tweet.fullText.startsWith("@")) {
			return SkipReason.MENTION;
		} else if (tweet.fullText.startsWith("RT ")) {
			return SkipReason.RETWEET;
		} else {
			return null;
		}
	}

	private List<Blob> uploadImages(final Tweet tweet, final List<Photo> photos) {
		final List<Blob> images = new ArrayList<>(photos.size());
		for (final Photo photo : photos) {
			final EncodedImage image = imageNormalizer.normalize(mediaSelector.read(photo));

			if (configuration.isSimulate()) {
				images.add(simulatedBlob(image));
				continue;
			}

			try {
				images.add(bluesky.uploadBlob(image.getBytes(), image.getMimeType()));
			} catch (final WebApplicationException | ProcessingException e) {
				throw new SubmissionException("Failed to upload image " + photo.getFile() + " of tweet " + tweet.id + " to Bluesky", e);
			}
		}
		return images;
	}

	private static Blob simulatedBlob(final EncodedImage image) {
		final Blob blob = new Blob();
		blob.ref = new Link(SIMULATED_BLOB_LINK);
		blob.mimeType = image.getMimeType();
		blob.size = image.getSize();
		return blob;
	}

	private void logRecord(final PostRecord record) {
		try {
			LOGGER.info(recordWriter.writeValueAsString(record));
		} catch (final JsonProcessingException e) {
			LOGGER.warn("Failed to print post record", e);
		}
	}

}
