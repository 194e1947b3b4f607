package com.aldaviva.tweet_importer.archive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.net.URI;
import org.junit.jupiter.api.Test;

class PublishResultTest {

	@Test
	void webUrlPointsToBskyApp() {
		final PublishResult result = new PublishResult("at://did:plc:abc123/app.bsky.feed.post/3kxyz", "bafy");

		assertEquals(URI.create("https://bsky.app/profile/did:plc:abc123/post/3kxyz"), result.getWebUrl());
	}

	@Test
	void noWebUrlForUnexpectedUri() {
		assertNull(new PublishResult("https://example.com/post", "bafy").getWebUrl());
		assertNull(new PublishResult(null, null).getWebUrl());
	}

}
