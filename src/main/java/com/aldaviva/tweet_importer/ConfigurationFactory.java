package com.aldaviva.tweet_importer;

import java.io.IOException;
import java.io.Reader;
import java.net.PasswordAuthentication;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Reads {@link ImportConfiguration} from environment variables. Values can also be put in a {@code .env} file in the working directory, in
 * {@code KEY=value} form; real environment variables win.
 */
public final class ConfigurationFactory {

	public static final String DEFAULT_CHECKPOINT_FILE = "tweets_mapping.json";
	public static final Duration DEFAULT_API_DELAY = Duration.ofMillis(2500);
	public static final Path DOTENV_FILE = Path.of(".env");

	private ConfigurationFactory() {
	}

	public static ImportConfiguration fromEnvironment() {
		final Map<String, String> settings = new HashMap<>(readDotenvFile(DOTENV_FILE));
		settings.putAll(System.getenv());
		return fromEnvironment(settings);
	}

	public static ImportConfiguration fromEnvironment(final Map<String, String> environment) {
		final String archiveFolder = getNonEmpty(environment, "ARCHIVE_FOLDER");
		if (archiveFolder == null) {
			throw new IllegalArgumentException("ARCHIVE_FOLDER is not set");
		}

		final ImportConfiguration.Builder builder = ImportConfiguration.builder()
		    .archiveFolder(Path.of(archiveFolder))
		    .simulate("1".equals(environment.get("SIMULATE")))
		    .importReplies(!"1".equals(environment.get("DISABLE_IMPORT_REPLY")))
		    .minDate(parseDate(getNonEmpty(environment, "MIN_DATE")))
		    .maxDate(parseDate(getNonEmpty(environment, "MAX_DATE")));

		final String username = getNonEmpty(environment, "BLUESKY_USERNAME");
		final String password = getNonEmpty(environment, "BLUESKY_PASSWORD");
		if (username != null && password != null) {
			builder.blueskyCredentials(new PasswordAuthentication(username, password.toCharArray()));
		}

		final String pastHandles = getNonEmpty(environment, "PAST_HANDLES");
		if (pastHandles != null) {
			builder.pastHandles(splitList(pastHandles));
		}

		final String checkpointFile = getNonEmpty(environment, "TWEETS_MAPPING_FILE");
		if (checkpointFile != null) {
			builder.checkpointFile(Path.of(checkpointFile));
		}

		final String apiDelay = getNonEmpty(environment, "API_DELAY_MS");
		if (apiDelay != null) {
			try {
				builder.apiDelay(Duration.ofMillis(Long.parseLong(apiDelay)));
			} catch (final NumberFormatException e) {
				throw new IllegalArgumentException("API_DELAY_MS must be a number of milliseconds, but was " + apiDelay, e);
			}
		}

		return builder.build();
	}

	/**
	 * @param value either an instant like {@code 2020-01-31T12:00:00Z} or a date like {@code 2020-01-31}, which means midnight UTC
	 */
	static Instant parseDate(final String value) {
		if (value == null) {
			return null;
		}

		try {
			return Instant.parse(value);
		} catch (final DateTimeParseException e) {
			try {
				return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
			} catch (final DateTimeParseException e2) {
				throw new IllegalArgumentException("Invalid date " + value + ", expected yyyy-MM-dd or an ISO-8601 instant", e2);
			}
		}
	}

	static Map<String, String> readDotenvFile(final Path dotenvFile) {
		final Map<String, String> settings = new HashMap<>();
		if (!Files.isRegularFile(dotenvFile)) {
			return settings;
		}

		final Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(dotenvFile, StandardCharsets.UTF_8)) {
			properties.load(reader);
		} catch (final IOException e) {
			throw new RuntimeException("Failed to read " + dotenvFile, e);
		}

		for (final String key : properties.stringPropertyNames()) {
			settings.put(key, unquote(properties.getProperty(key).trim()));
		}
		return settings;
	}

	private static String unquote(final String value) {
		if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"") || value.startsWith("'") && value.endsWith("'"))) {
			return value.substring(1, value.length() - 1);
		}
		return value;
	}

	private static List<String> splitList(final String value) {
		return Arrays.stream(value.split(","))
		    .map(String::trim)
		    .filter(item -> !item.isEmpty())
		    .collect(Collectors.toList());
	}

	private static String getNonEmpty(final Map<String, String> environment, final String key) {
		final String value = environment.get(key);
		return value != null && !value.trim().isEmpty() ? value.trim() : null;
	}

}
