package com.aldaviva.tweet_importer;

import com.aldaviva.tweet_importer.archive.ArchiveLoader;
import com.aldaviva.tweet_importer.archive.ArchivedPost;
import com.aldaviva.tweet_importer.archive.CheckpointStore;
import com.aldaviva.tweet_importer.embed.EmbedResolver;
import com.aldaviva.tweet_importer.http.JacksonConfig.CustomObjectMapperProvider;
import com.aldaviva.tweet_importer.importer.ImportSummary;
import com.aldaviva.tweet_importer.importer.RateLimitDelay;
import com.aldaviva.tweet_importer.importer.TweetImporter;
import com.aldaviva.tweet_importer.media.ImageNormalizer;
import com.aldaviva.tweet_importer.media.TweetMediaSelector;
import com.aldaviva.tweet_importer.services.bluesky.BlueskyClient;
import com.aldaviva.tweet_importer.services.bluesky.JerseyBlueskyClient;
import com.aldaviva.tweet_importer.services.bluesky.RichTextFacetDetector;
import com.aldaviva.tweet_importer.text.PastHandlesRecognizer;
import com.aldaviva.tweet_importer.text.RedirectUrlResolver;
import com.aldaviva.tweet_importer.text.SelfReferenceRecognizer;
import com.aldaviva.tweet_importer.text.TweetTextCleaner;

import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.glassfish.jersey.client.ClientConfig;
import org.glassfish.jersey.client.ClientProperties;
import org.glassfish.jersey.jackson.JacksonFeature;
import org.glassfish.jersey.logging.LoggingFeature;
import org.slf4j.bridge.SLF4JBridgeHandler;

public class Main {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(Main.class);

	public static void main(final String[] args) {
		SLF4JBridgeHandler.removeHandlersForRootLogger();
		SLF4JBridgeHandler.install();

		final ImportConfiguration configuration = ConfigurationFactory.fromEnvironment();

		LOGGER.info("Import started at {}", Instant.now());
		LOGGER.info("SIMULATE is {}", configuration.isSimulate() ? "ON" : "OFF");
		LOGGER.info("IMPORT REPLY is {}", configuration.isImportReplies() ? "ON" : "OFF");

		final Client httpClient = createHttpClient();
		try (BlueskyClient bluesky = new JerseyBlueskyClient(httpClient);
		    RedirectUrlResolver urlResolver = new RedirectUrlResolver(httpClient)) {

			final CheckpointStore checkpointStore = new CheckpointStore(configuration.getCheckpointFile());
			final List<ArchivedPost> posts = new ArchiveLoader(configuration.getArchiveFolder(), checkpointStore).load();

			if (configuration.getBlueskyCredentials() != null) {
				LOGGER.info("Logging into Bluesky...");
				bluesky.signIn(configuration.getBlueskyCredentials());
			} else if (!configuration.isSimulate()) {
				throw new IllegalArgumentException("BLUESKY_USERNAME and BLUESKY_PASSWORD are required unless SIMULATE=1");
			}

			final SelfReferenceRecognizer selfReferenceRecognizer = new PastHandlesRecognizer(configuration.getPastHandles());
			final TweetImporter importer = new TweetImporter(configuration,
			    bluesky,
			    new TweetTextCleaner(urlResolver, selfReferenceRecognizer),
			    new EmbedResolver(selfReferenceRecognizer, bluesky),
			    new TweetMediaSelector(configuration.getArchiveFolder()),
			    new ImageNormalizer(),
			    new RichTextFacetDetector(bluesky),
			    checkpointStore,
			    RateLimitDelay.SLEEP);

			final ImportSummary summary = importer.importAll(posts);

			if (summary.isSimulated()) {
				final Duration estimate = summary.getEstimatedRealDuration();
				LOGGER.info("Estimated time for real import: {} hours and {} minutes", estimate.toHours(), estimate.toMinutesPart());
			}

			LOGGER.info("Import finished at {}, imported {} tweets", Instant.now(), summary.getImportedCount());
		} catch (final RuntimeException e) {
			LOGGER.error("Import failed at {}", Instant.now());
			throw e;
		} finally {
			httpClient.close();
		}
	}

	private static Client createHttpClient() {
		final ClientConfig clientConfig = new ClientConfig();
		clientConfig.register(CustomObjectMapperProvider.class);
		clientConfig.register(JacksonFeature.class);
		clientConfig.property(ClientProperties.CONNECT_TIMEOUT, 5 * 1000);
		clientConfig.property(ClientProperties.READ_TIMEOUT, 30 * 1000);
		clientConfig.property(ClientProperties.FOLLOW_REDIRECTS, false);

		final Logger httpLogger = Logger.getLogger("http");
		httpLogger.setLevel(Level.ALL);
		clientConfig.register(new LoggingFeature(httpLogger, Level.FINE, LoggingFeature.Verbosity.HEADERS_ONLY, LoggingFeature.DEFAULT_MAX_ENTITY_SIZE));

		return ClientBuilder.newClient(clientConfig);
	}

}
