package com.aldaviva.tweet_importer.services.bluesky;

import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Blob;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.PostRecord;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Session;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.StrongRef;

import java.net.PasswordAuthentication;

/**
 * The calls to the Bluesky PDS that importing needs. Every method blocks until the server responds, and throws a JAX-RS
 * {@link jakarta.ws.rs.WebApplicationException} or {@link jakarta.ws.rs.ProcessingException} if the request fails.
 */
public interface BlueskyClient extends AutoCloseable {

	/**
	 * Sign in with a handle/email address and password/app password. Subsequent requests made by this instance use the session's access token.
	 */
	Session signIn(PasswordAuthentication credentials);

	void signOut();

	/**
	 * @param mimeType such as {@code image/jpeg}
	 * @return reference to the uploaded blob, to be put in a record before the server garbage-collects it
	 * @see https://github.com/bluesky-social/atproto/blob/main/lexicons/com/atproto/repo/uploadBlob.json
	 */
	Blob uploadBlob(byte[] data, String mimeType);

	/**
	 * Create an {@code app.bsky.feed.post} record in the signed-in user's repository.
	 * @see https://github.com/bluesky-social/atproto/blob/main/lexicons/com/atproto/repo/createRecord.json
	 */
	StrongRef createPost(PostRecord post);

	/**
	 * @return the DID of the given handle, like {@code did:plc:abc}
	 */
	String resolveHandle(String handle);

	/**
	 * @param repo handle or DID of the post's author
	 * @param recordKey last path segment of the post's AT URI
	 * @return URI and CID of the current version of the post
	 */
	StrongRef getPost(String repo, String recordKey);

	@Override
	void close();

}
