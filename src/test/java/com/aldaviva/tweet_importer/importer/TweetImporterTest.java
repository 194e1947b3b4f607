package com.aldaviva.tweet_importer.importer;

import static com.aldaviva.tweet_importer.TestTweets.archiveFile;
import static com.aldaviva.tweet_importer.TestTweets.inReplyTo;
import static com.aldaviva.tweet_importer.TestTweets.tweet;
import static com.aldaviva.tweet_importer.TestTweets.withMedia;
import static com.aldaviva.tweet_importer.TestTweets.withUrl;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.aldaviva.tweet_importer.ImportConfiguration;
import com.aldaviva.tweet_importer.TestTweets;
import com.aldaviva.tweet_importer.archive.ArchiveLoader;
import com.aldaviva.tweet_importer.archive.ArchivedPost;
import com.aldaviva.tweet_importer.archive.CheckpointStore;
import com.aldaviva.tweet_importer.embed.EmbedResolver;
import com.aldaviva.tweet_importer.media.ImageNormalizer;
import com.aldaviva.tweet_importer.media.TweetMediaSelector;
import com.aldaviva.tweet_importer.services.bluesky.BlueskyClient;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Blob;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.ImagesEmbed;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Link;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.PostRecord;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.RecordEmbed;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.StrongRef;
import com.aldaviva.tweet_importer.services.bluesky.RichTextFacetDetector;
import com.aldaviva.tweet_importer.text.PastHandlesRecognizer;
import com.aldaviva.tweet_importer.text.TweetTextCleaner;

import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.ws.rs.InternalServerErrorException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TweetImporterTest {

	private static final Duration API_DELAY = Duration.ofMillis(2500);

	@TempDir
	Path archiveFolder;

	@Mock
	private BlueskyClient bluesky;

	private Path dataFolder;
	private CheckpointStore checkpointStore;
	private final List<PostRecord> submitted = new ArrayList<>();
	private final List<Duration> delays = new ArrayList<>();
	private String failingText;

	@BeforeEach
	void setUp() throws IOException {
		dataFolder = Files.createDirectories(archiveFolder.resolve("data"));
		checkpointStore = new CheckpointStore(archiveFolder.resolve("tweets_mapping.json"));
	}

	@Test
	void importsEveryTweetOnceInOrder() throws IOException {
		acceptPosts();
		writeArchive(tweet("3", 3, "third"), tweet("1", 1, "first"), tweet("2", 2, "second"));

		final ImportSummary summary = importer(configuration().build()).importAll(loadArchive());

		assertEquals(3, summary.getImportedCount());
		assertEquals(List.of("first", "second", "third"), submittedTexts());
		assertEquals(List.of(API_DELAY, API_DELAY, API_DELAY), delays);
		assertEquals(TestTweets.START.plusSeconds(60), submitted.get(0).createdAt);

		final List<ArchivedPost> checkpoint = checkpointStore.load();
		assertEquals(3, checkpoint.size());
		assertTrue(checkpoint.stream().allMatch(ArchivedPost::isPublished));
		assertEquals("at://did:plc:me/app.bsky.feed.post/rkey60", checkpoint.get(0).getPublishResult().getUri());
	}

	@Test
	void secondRunSubmitsNothing() throws IOException {
		acceptPosts();
		writeArchive(tweet("1", 1, "first"), tweet("2", 2, "second"));
		importer(configuration().build()).importAll(loadArchive());
		submitted.clear();

		final ImportSummary summary = importer(configuration().build()).importAll(loadArchive());

		assertEquals(0, summary.getImportedCount());
		assertTrue(submitted.isEmpty());
		assertTrue(checkpointStore.load().stream().allMatch(ArchivedPost::isPublished));
	}

	@Test
	void failedRunResumesWhereItStopped() throws IOException {
		acceptPosts();
		final ObjectNode[] tweets = new ObjectNode[10];
		for (int i = 1; i <= 10; i++) {
			tweets[i - 1] = tweet(String.valueOf(i), i, "tweet " + i);
		}
		writeArchive(tweets);
		failingText = "tweet 7";

		final TweetImporter firstRun = importer(configuration().build());
		final List<ArchivedPost> firstArchive = loadArchive();
		assertThrows(SubmissionException.class, () -> firstRun.importAll(firstArchive));

		assertEquals(6, submitted.size());
		assertEquals(6, checkpointStore.load().stream().filter(ArchivedPost::isPublished).count());

		failingText = null;
		submitted.clear();
		final ImportSummary summary = importer(configuration().build()).importAll(loadArchive());

		assertEquals(4, summary.getImportedCount());
		assertEquals(List.of("tweet 7", "tweet 8", "tweet 9", "tweet 10"), submittedTexts());
		assertEquals(10, checkpointStore.load().stream().filter(ArchivedPost::isPublished).count());
	}

	@Test
	void checkpointFailureDoesNotHideSubmissionFailure() throws IOException {
		acceptPosts();
		writeArchive(tweet("1", 1, "tweet 1"));
		failingText = "tweet 1";
		checkpointStore = new CheckpointStore(archiveFolder.resolve("missing-folder").resolve("tweets_mapping.json"));

		final TweetImporter importer = importer(configuration().build());
		final List<ArchivedPost> archive = loadArchive();
		final SubmissionException failure = assertThrows(SubmissionException.class, () -> importer.importAll(archive));

		assertInstanceOf(InternalServerErrorException.class, failure.getCause());
		assertEquals(1, failure.getSuppressed().length);
		assertTrue(failure.getSuppressed()[0].getMessage().startsWith("Failed to save checkpoint file"));
	}

	@Test
	void checkpointFailureAfterSuccessfulRunIsThrown() throws IOException {
		acceptPosts();
		writeArchive(tweet("1", 1, "tweet 1"));
		checkpointStore = new CheckpointStore(archiveFolder.resolve("missing-folder").resolve("tweets_mapping.json"));

		final TweetImporter importer = importer(configuration().build());
		final List<ArchivedPost> archive = loadArchive();
		final RuntimeException failure = assertThrows(RuntimeException.class, () -> importer.importAll(archive));

		assertTrue(failure.getMessage().startsWith("Failed to save checkpoint file"));
		assertEquals(List.of("tweet 1"), submittedTexts());
	}

	@Test
	void onlyTweetsInsideDateWindowAreImported() throws IOException {
		acceptPosts();
		writeArchive(tweet("1", 1, "too early"), tweet("2", 2, "start"), tweet("3", 3, "middle"), tweet("4", 4, "end"), tweet("5", 5, "too late"));

		importer(configuration()
		    .minDate(TestTweets.START.plusSeconds(2 * 60))
		    .maxDate(TestTweets.START.plusSeconds(4 * 60))
		    .build()).importAll(loadArchive());

		assertEquals(List.of("start", "middle", "end"), submittedTexts());
		final List<ArchivedPost> checkpoint = checkpointStore.load();
		assertEquals(5, checkpoint.size());
		assertFalse(checkpoint.get(0).isPublished());
		assertFalse(checkpoint.get(4).isPublished());
	}

	@Test
	void skipsMentionsRetweetsAndVideos() throws IOException {
		acceptPosts();
		writeArchive(tweet("1", 1, "@friend hi"), tweet("2", 2, "RT @friend: something"),
		    withMedia(tweet("3", 3, "watch this"), "video", "http://pbs.twimg.com/ext_tw_video_thumb/3/pu/img/v.jpg"), tweet("4", 4, "kept"));

		final ImportSummary summary = importer(configuration().build()).importAll(loadArchive());

		assertEquals(1, summary.getImportedCount());
		assertEquals(List.of("kept"), submittedTexts());
		verify(bluesky, never()).uploadBlob(any(byte[].class), any(String.class));
		assertEquals(1, delays.size());
	}

	@Test
	void repliesAreThreadedOrSkipped() throws IOException {
		acceptPosts();
		writeArchive(tweet("1", 1, "question"), inReplyTo(tweet("2", 2, "answer"), "1", "me"));

		importer(configuration().build()).importAll(loadArchive());

		assertEquals(2, submitted.size());
		assertNull(submitted.get(0).reply);
		assertNotNull(submitted.get(1).reply);
		assertEquals("at://did:plc:me/app.bsky.feed.post/rkey60", submitted.get(1).reply.parent.uri);
		assertEquals("at://did:plc:me/app.bsky.feed.post/rkey60", submitted.get(1).reply.root.uri);
	}

	@Test
	void repliesCanBeDisabled() throws IOException {
		acceptPosts();
		writeArchive(tweet("1", 1, "question"), inReplyTo(tweet("2", 2, "answer"), "1", "me"));

		importer(configuration().importReplies(false).build()).importAll(loadArchive());

		assertEquals(List.of("question"), submittedTexts());
	}

	@Test
	void quoteOfOwnTweetBecomesEmbed() throws IOException {
		acceptPosts();
		writeArchive(tweet("1", 1, "hot take"), withUrl(tweet("2", 2, "still true https://t.co/q"), "https://t.co/q", "https://twitter.com/me/status/1"));

		importer(configuration().build()).importAll(loadArchive());

		final PostRecord quote = submitted.get(1);
		assertEquals("still true ", quote.text);
		assertInstanceOf(RecordEmbed.class, quote.embed);
		assertEquals("at://did:plc:me/app.bsky.feed.post/rkey60", ((RecordEmbed) quote.embed).record.uri);
		assertEquals("cid-rkey60", ((RecordEmbed) quote.embed).record.cid);
	}

	@Test
	void quoteAcrossArchiveFilesReferencesImportedPostThroughRecordEmbed() throws IOException {
		acceptPosts();
		Files.write(dataFolder.resolve("tweets.js"), archiveFile(0, tweet("1", 1, "post A")).getBytes(StandardCharsets.UTF_8));
		Files.write(dataFolder.resolve("tweets-part1.js"), archiveFile(1, withUrl(tweet("2", 2, "post B https://t.co/a"), "https://t.co/a",
		    "https://x.com/Me/status/1?s=20")).getBytes(StandardCharsets.UTF_8));

		importer(configuration().build()).importAll(loadArchive());

		final PostRecord postB = submitted.get(1);
		assertFalse(postB.text.contains("x.com"));
		assertEquals("at://did:plc:me/app.bsky.feed.post/rkey60", ((RecordEmbed) postB.embed).record.uri);
		assertEquals(checkpointStore.load().get(0).getPublishResult().getUri(), ((RecordEmbed) postB.embed).record.uri);
	}

	@Test
	void uploadsAtMostFourImages() throws IOException {
		acceptPosts();
		acceptBlobs();
		final ObjectNode tweet = tweet("1", 1, "photo dump");
		for (int i = 1; i <= 5; i++) {
			withMedia(tweet, "photo", "http://pbs.twimg.com/media/pic" + i + ".png");
			writePng("1-pic" + i + ".png");
		}
		writeArchive(tweet);

		importer(configuration().build()).importAll(loadArchive());

		verify(bluesky, times(4)).uploadBlob(any(byte[].class), eq("image/png"));
		final ImagesEmbed embed = assertInstanceOf(ImagesEmbed.class, submitted.get(0).embed);
		assertEquals(List.of("blob1", "blob2", "blob3", "blob4"), embed.images.stream().map(image -> image.image.ref.link).collect(Collectors.toList()));
	}

	@Test
	void imagesWinOverQuoteAndLinkStays() throws IOException {
		acceptPosts();
		acceptBlobs();
		final ObjectNode quote = withUrl(tweet("2", 2, "look https://t.co/q"), "https://t.co/q", "https://twitter.com/me/status/1");
		withMedia(quote, "photo", "http://pbs.twimg.com/media/pic.png");
		writePng("2-pic.png");
		writeArchive(tweet("1", 1, "original"), quote);

		importer(configuration().build()).importAll(loadArchive());

		final PostRecord record = submitted.get(1);
		assertInstanceOf(ImagesEmbed.class, record.embed);
		assertEquals("look https://bsky.app/profile/did:plc:me/post/rkey60", record.text);
	}

	@Test
	void simulationSubmitsNothing() throws IOException {
		final ObjectNode withPhoto = withMedia(tweet("2", 2, "pic"), "photo", "http://pbs.twimg.com/media/pic.png");
		writePng("2-pic.png");
		writeArchive(tweet("1", 1, "text"), withPhoto);

		final ImportSummary summary = importer(configuration().simulate(true).build()).importAll(loadArchive());

		assertEquals(2, summary.getImportedCount());
		assertTrue(summary.isSimulated());
		verifyNoInteractions(bluesky);
		assertTrue(delays.isEmpty());
		assertTrue(checkpointStore.load().stream().noneMatch(ArchivedPost::isPublished));
	}

	@Test
	void checkpointKeepsOriginalTweetFields() throws IOException {
		acceptPosts();
		final ObjectNode original = tweet("1", 1, "hello");
		original.put("retweet_count", "5");
		writeArchive(original);

		importer(configuration().build()).importAll(loadArchive());

		final String checkpoint = new String(Files.readAllBytes(checkpointStore.getCheckpointFile()), StandardCharsets.UTF_8);
		assertTrue(checkpoint.contains("\"retweet_count\": \"5\""));
		assertTrue(checkpoint.contains("\"bsky\": {"));
	}

	private TweetImporter importer(final ImportConfiguration configuration) {
		final PastHandlesRecognizer selfReferenceRecognizer = new PastHandlesRecognizer(List.of("me"));
		return new TweetImporter(configuration, bluesky, new TweetTextCleaner(url -> url, selfReferenceRecognizer),
		    new EmbedResolver(selfReferenceRecognizer, bluesky), new TweetMediaSelector(archiveFolder), new ImageNormalizer(),
		    new RichTextFacetDetector(bluesky), checkpointStore, delays::add);
	}

	private ImportConfiguration.Builder configuration() {
		return ImportConfiguration.builder()
		    .archiveFolder(archiveFolder)
		    .checkpointFile(checkpointStore.getCheckpointFile())
		    .pastHandles(List.of("me"))
		    .apiDelay(API_DELAY);
	}

	/**
	 * Record keys are derived from the creation time, so the same tweet always gets the same URI.
	 */
	private void acceptPosts() {
		doAnswer(invocation -> {
			final PostRecord record = invocation.getArgument(0);
			if (record.text.equals(failingText)) {
				throw new InternalServerErrorException("try again later");
			}
			submitted.add(record);
			final String recordKey = "rkey" + (record.createdAt.getEpochSecond() - TestTweets.START.getEpochSecond());
			return new StrongRef("at://did:plc:me/app.bsky.feed.post/" + recordKey, "cid-" + recordKey);
		}).when(bluesky).createPost(any(PostRecord.class));
	}

	private void acceptBlobs() {
		final int[] uploads = { 0 };
		doAnswer(invocation -> {
			final Blob blob = new Blob();
			blob.ref = new Link("blob" + ++uploads[0]);
			blob.mimeType = invocation.getArgument(1);
			blob.size = ((byte[]) invocation.getArgument(0)).length;
			return blob;
		}).when(bluesky).uploadBlob(any(byte[].class), any(String.class));
	}

	private List<String> submittedTexts() {
		return submitted.stream().map(record -> record.text).collect(Collectors.toList());
	}

	private List<ArchivedPost> loadArchive() {
		return new ArchiveLoader(archiveFolder, checkpointStore).load();
	}

	private void writeArchive(final ObjectNode... tweets) throws IOException {
		Files.write(dataFolder.resolve("tweets.js"), archiveFile(0, tweets).getBytes(StandardCharsets.UTF_8));
	}

	private void writePng(final String filename) throws IOException {
		final Path mediaFolder = Files.createDirectories(dataFolder.resolve("tweets_media"));
		ImageIO.write(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB), "png", mediaFolder.resolve(filename).toFile());
	}

}
