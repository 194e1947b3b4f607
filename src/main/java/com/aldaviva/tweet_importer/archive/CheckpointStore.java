package com.aldaviva.tweet_importer.archive;

import com.aldaviva.tweet_importer.http.JacksonConfig;
import com.aldaviva.tweet_importer.http.JacksonConfig.CustomObjectMapperProvider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The tweets mapping file, which records every archived tweet along with the Bluesky post it was imported as, if any. A later run reads it
 * back to resume where the previous one stopped.
 */
public class CheckpointStore {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(CheckpointStore.class);

	private static final TypeReference<List<ArchivedPost>> POST_LIST_TYPE = new TypeReference<List<ArchivedPost>>() {
	};

	private final Path checkpointFile;
	private final ObjectWriter writer = JacksonConfig.prettyWriter().forType(POST_LIST_TYPE);

	public CheckpointStore(final Path checkpointFile) {
		this.checkpointFile = checkpointFile;
	}

	public Path getCheckpointFile() {
		return checkpointFile;
	}

	/**
	 * @return the posts saved by the previous run, or an empty list if there has not been one
	 * @throws ArchiveReadException if the file exists but cannot be read or parsed
	 */
	public List<ArchivedPost> load() {
		if (!Files.exists(checkpointFile)) {
			LOGGER.debug("No checkpoint file at {}, starting from scratch", checkpointFile);
			return new ArrayList<>();
		}

		try {
			final List<ArchivedPost> posts = CustomObjectMapperProvider.OBJECT_MAPPER.readValue(checkpointFile.toFile(), POST_LIST_TYPE);
			LOGGER.debug("Read {} posts from checkpoint file {}", posts.size(), checkpointFile);
			return posts != null ? posts : new ArrayList<>();
		} catch (final IOException | IllegalArgumentException e) {
			throw new ArchiveReadException("Failed to read checkpoint file " + checkpointFile, e);
		}
	}

	/**
	 * Replace the checkpoint file with all of the given posts, imported or not. The file is written next to the old one and then moved over it, so
	 * an interrupted write never leaves a truncated checkpoint behind.
	 */
	public void save(final Collection<ArchivedPost> posts) {
		final Path absoluteFile = checkpointFile.toAbsolutePath();
		final Path temporaryFile = absoluteFile.resolveSibling(absoluteFile.getFileName() + ".tmp");
		try {
			try (OutputStream outputStream = Files.newOutputStream(temporaryFile)) {
				writer.writeValue(outputStream, new ArrayList<>(posts));
			}
			Files.move(temporaryFile, absoluteFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			LOGGER.debug("Saved {} posts to checkpoint file {}", posts.size(), absoluteFile);
		} catch (final IOException e) {
			throw new RuntimeException("Failed to save checkpoint file " + absoluteFile, e);
		}
	}

}
