package com.aldaviva.tweet_importer;

import java.net.PasswordAuthentication;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Settings for one import run. Built once by {@link ConfigurationFactory} and passed to the components that need it.
 */
public final class ImportConfiguration {

	private final boolean simulate;
	private final boolean importReplies;
	private final Instant minDate;
	private final Instant maxDate;
	private final Path archiveFolder;
	private final Path checkpointFile;
	private final PasswordAuthentication blueskyCredentials;
	private final List<String> pastHandles;
	private final Duration apiDelay;

	private ImportConfiguration(final Builder builder) {
		simulate = builder.simulate;
		importReplies = builder.importReplies;
		minDate = builder.minDate;
		maxDate = builder.maxDate;
		archiveFolder = builder.archiveFolder;
		checkpointFile = builder.checkpointFile;
		blueskyCredentials = builder.blueskyCredentials;
		pastHandles = List.copyOf(builder.pastHandles);
		apiDelay = builder.apiDelay;
	}

	/**
	 * When true, tweets are filtered and transformed as usual but nothing is uploaded or posted to Bluesky.
	 */
	public boolean isSimulate() {
		return simulate;
	}

	public boolean isImportReplies() {
		return importReplies;
	}

	/**
	 * @return tweets created before this are skipped, or {@code null} for no lower bound
	 */
	public Instant getMinDate() {
		return minDate;
	}

	/**
	 * @return tweets created after this end the import, or {@code null} for no upper bound
	 */
	public Instant getMaxDate() {
		return maxDate;
	}

	/**
	 * @return root of the extracted Twitter archive, which contains the {@code data} folder
	 */
	public Path getArchiveFolder() {
		return archiveFolder;
	}

	public Path getCheckpointFile() {
		return checkpointFile;
	}

	public PasswordAuthentication getBlueskyCredentials() {
		return blueskyCredentials;
	}

	/**
	 * @return Twitter handles the author has used, so links to their own tweets can be recognized
	 */
	public List<String> getPastHandles() {
		return pastHandles;
	}

	/**
	 * @return how long to wait after creating each post, to stay under Bluesky's rate limits
	 * @see https://docs.bsky.app/docs/advanced-guides/rate-limits
	 */
	public Duration getApiDelay() {
		return apiDelay;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {

		private boolean simulate = false;
		private boolean importReplies = true;
		private Instant minDate;
		private Instant maxDate;
		private Path archiveFolder;
		private Path checkpointFile = Path.of(ConfigurationFactory.DEFAULT_CHECKPOINT_FILE);
		private PasswordAuthentication blueskyCredentials;
		private List<String> pastHandles = List.of();
		private Duration apiDelay = ConfigurationFactory.DEFAULT_API_DELAY;

		private Builder() {
		}

		public Builder simulate(final boolean simulate) {
			this.simulate = simulate;
			return this;
		}

		public Builder importReplies(final boolean importReplies) {
			this.importReplies = importReplies;
			return this;
		}

		public Builder minDate(final Instant minDate) {
			this.minDate = minDate;
			return this;
		}

		public Builder maxDate(final Instant maxDate) {
			this.maxDate = maxDate;
			return this;
		}

		public Builder archiveFolder(final Path archiveFolder) {
			this.archiveFolder = archiveFolder;
			return this;
		}

		public Builder checkpointFile(final Path checkpointFile) {
			this.checkpointFile = checkpointFile;
			return this;
		}

		public Builder blueskyCredentials(final PasswordAuthentication blueskyCredentials) {
			this.blueskyCredentials = blueskyCredentials;
			return this;
		}

		public Builder pastHandles(final List<String> pastHandles) {
			this.pastHandles = pastHandles;
			return this;
		}

		public Builder apiDelay(final Duration apiDelay) {
			this.apiDelay = apiDelay;
			return this;
		}

		public ImportConfiguration build() {
			if (archiveFolder == null) {
				throw new IllegalStateException("Archive folder is required");
			}
			return new ImportConfiguration(this);
		}
	}

}
