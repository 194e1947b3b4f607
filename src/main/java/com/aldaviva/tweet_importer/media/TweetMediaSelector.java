package com.aldaviva.tweet_importer.media;

import com.aldaviva.tweet_importer.archive.ArchiveReadException;
import com.aldaviva.tweet_importer.archive.TwitterArchiveSchema.Media;
import com.aldaviva.tweet_importer.archive.TwitterArchiveSchema.Tweet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Picks which of a tweet's attached media can be uploaded to Bluesky, and reads them from the archive's {@code data/tweets_media} folder.
 */
public class TweetMediaSelector {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(TweetMediaSelector.class);

	public static final int MAX_IMAGES_PER_POST = 4;

	private final Path mediaFolder;

	public TweetMediaSelector(final Path archiveFolder) {
		mediaFolder = archiveFolder.resolve("data").resolve("tweets_media");
	}

	/**
	 * @return the photos to upload, in their original order, or {@code null} if the tweet has a video or animated GIF, which Bluesky can't show,
	 *         so the whole tweet should be skipped
	 */
	public List<Photo> selectPhotos(final Tweet tweet) {
		final List<Media> media = tweet.getMedia();
		if (media.isEmpty()) {
			return Collections.emptyList();
		}

		for (final Media item : media) {
			if ("video".equals(item.type) || "animated_gif".equals(item.type)) {
				return null;
			}
		}

		final List<Photo> photos = new ArrayList<>();
		for (final Media item : media) {
			if (!"photo".equals(item.type) || item.mediaUrl == null) {
				continue;
			}

			final String filename = item.mediaUrl.substring(item.mediaUrl.lastIndexOf('/') + 1);
			final String extension = filename.substring(filename.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
			final String mimeType = getMimeType(extension);
			if (mimeType == null) {
				LOGGER.error("Unsupported photo file type {} in tweet {}", extension, tweet.id);
				continue;
			}

			if (photos.size() >= MAX_IMAGES_PER_POST) {
				LOGGER.warn("Bluesky does not support more than {} images per post, excess images will be discarded.", MAX_IMAGES_PER_POST);
				break;
			}

			photos.add(new Photo(mediaFolder.resolve(tweet.id + "-" + filename), mimeType));
		}
		return photos;
	}

	public EncodedImage read(final Photo photo) {
		try {
			return new EncodedImage(Files.readAllBytes(photo.getFile()), photo.getMimeType());
		} catch (final IOException e) {
			throw new ArchiveReadException("Failed to read media file " + photo.getFile(), e);
		}
	}

	private static String getMimeType(final String extension) {
		switch (extension) {
			case "png":
				return "image/png";
			case "jpg":
			case "jpeg":
				return "image/jpeg";
			default:
				return null;
		}
	}

	public static final class Photo {

		private final Path file;
		private final String mimeType;

		public Photo(final Path file, final String mimeType) {
			this.file = file;
			this.mimeType = mimeType;
		}

		public Path getFile() {
			return file;
		}

		public String getMimeType() {
			return mimeType;
		}

		@Override
		public String toString() {
			return String.format("Photo [file=%s, mimeType=%s]", file, mimeType);
		}
	}

}
