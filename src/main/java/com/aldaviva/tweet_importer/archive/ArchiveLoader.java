package com.aldaviva.tweet_importer.archive;

import com.aldaviva.tweet_importer.http.JacksonConfig.CustomObjectMapperProvider;

import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the tweets of a Twitter archive, which are split across {@code data/tweets.js}, {@code data/tweets-part1.js},
 * {@code data/tweets-part2.js} and so on, and merges in the Bluesky posts recorded by a previous run.
 */
public class ArchiveLoader {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(ArchiveLoader.class);

	private static final Pattern ASSIGNMENT_PREFIX = Pattern.compile("^\\s*window\\.YTD\\.tweets\\.part[0-9]+\\s*=\\s*\\[");
	private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");
	private static final TypeReference<List<ArchivedPost>> POST_LIST_TYPE = new TypeReference<List<ArchivedPost>>() {
	};

	private final Path archiveFolder;
	private final CheckpointStore checkpointStore;

	public ArchiveLoader(final Path archiveFolder, final CheckpointStore checkpointStore) {
		this.archiveFolder = archiveFolder;
		this.checkpointStore = checkpointStore;
	}

	/**
	 * @return every tweet in the archive exactly once, oldest first, with the {@link PublishResult} from the checkpoint file attached where one
	 *         was recorded
	 * @throws ArchiveReadException if {@code tweets.js}, any part file that exists, or the checkpoint file can't be read
	 */
	public List<ArchivedPost> load() {
		final List<ArchivedPost> previousRun = checkpointStore.load();

		final Map<String, ArchivedPost> postsById = new LinkedHashMap<>();
		final Path dataFolder = archiveFolder.resolve("data");

		addAll(postsById, readFragment(dataFolder.resolve("tweets.js")));
		for (int partNumber = 1;; partNumber++) {
			final Path partFile = dataFolder.resolve("tweets-part" + partNumber + ".js");
			if (!Files.exists(partFile)) {
				break;
			}
			addAll(postsById, readFragment(partFile));
		}

		final Map<String, PublishResult> alreadyImported = new HashMap<>();
		for (final ArchivedPost cached : previousRun) {
			if (cached.isPublished()) {
				alreadyImported.put(cached.getId(), cached.getPublishResult());
			}
		}

		int merged = 0;
		for (final ArchivedPost post : postsById.values()) {
			final PublishResult publishResult = alreadyImported.get(post.getId());
			if (publishResult != null) {
				post.setPublishResult(publishResult);
				merged++;
			}
		}

		final List<ArchivedPost> posts = new ArrayList<>(postsById.values());
		posts.sort(Comparator.comparing(ArchivedPost::getCreatedAt));

		LOGGER.info("Loaded {} tweets from archive, {} of which were already imported", posts.size(), merged);
		return posts;
	}

	private static void addAll(final Map<String, ArchivedPost> postsById, final List<ArchivedPost> fragment) {
		for (final ArchivedPost post : fragment) {
			if (postsById.putIfAbsent(post.getId(), post) != null) {
				LOGGER.debug("Ignoring duplicate tweet {}", post.getId());
			}
		}
	}

	private static List<ArchivedPost> readFragment(final Path fragmentFile) {
		try {
			final String fileContent = new String(Files.readAllBytes(fragmentFile), StandardCharsets.UTF_8);
			final List<ArchivedPost> posts = CustomObjectMapperProvider.OBJECT_MAPPER.readValue(stripAssignment(fileContent), POST_LIST_TYPE);
			if (posts == null) {
				throw new ArchiveReadException("Archive file " + fragmentFile + " does not contain a list of tweets");
			}
			LOGGER.debug("Read {} tweets from {}", posts.size(), fragmentFile);
			return posts;
		} catch (final IOException | IllegalArgumentException e) {
			throw new ArchiveReadException("Failed to read archive file " + fragmentFile, e);
		}
	}

	/**
	 * Archive files are JavaScript, not JSON: {@code window.YTD.tweets.part0 = [ ... ];}
	 */
	static String stripAssignment(final String fileContent) {
		final String withoutPrefix = ASSIGNMENT_PREFIX.matcher(fileContent).replaceFirst("[");
		return TRAILING_SEMICOLON.matcher(withoutPrefix).replaceFirst("");
	}

}
