package com.aldaviva.tweet_importer.services.bluesky;

import com.aldaviva.tweet_importer.http.BearerAuthenticationFilter;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Blob;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.CreateRecordRequest;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.PostRecord;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.ResolveHandleResponse;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.Session;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.StrongRef;
import com.aldaviva.tweet_importer.services.bluesky.BlueskySchema.UploadBlobResponse;

import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.net.PasswordAuthentication;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;

public class JerseyBlueskyClient implements BlueskyClient {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(JerseyBlueskyClient.class);

	public static final URI API_BASE = URI.create("https://bsky.social/xrpc/");

	private final Client httpClient;
	private final URI apiBase;
	private final BearerAuthenticationFilter authFilter = new BearerAuthenticationFilter();

	private Session session;

	public JerseyBlueskyClient(final Client httpClient) {
		this(httpClient, API_BASE);
	}

	public JerseyBlueskyClient(final Client httpClient, final URI apiBase) {
		this.httpClient = httpClient;
		this.apiBase = apiBase;
	}

	protected WebTarget target(final String namespaceId) {
		return httpClient.target(apiBase).path(namespaceId).register(authFilter);
	}

	@Override
	public Session signIn(final PasswordAuthentication credentials) {
		final Map<String, String> authenticationRequestBody = new HashMap<>();
		authenticationRequestBody.put("identifier", credentials.getUserName());
		authenticationRequestBody.put("password", new String(credentials.getPassword()));

		LOGGER.debug("Signing in with username {}", credentials.getUserName());
		session = target("com.atproto.server.createSession")
		    .request()
		    .post(Entity.json(authenticationRequestBody), Session.class);

		authFilter.setAccessToken(session.accessJwt);
		LOGGER.debug("Signed in as {} ({})", session.handle, session.did);
		return session;
	}

	@Override
	public void signOut() {
		if (session != null) {
			try (Response response = httpClient.target(apiBase)
			    .path("com.atproto.server.deleteSession")
			    .request()
			    .header("Authorization", "Bearer " + session.refreshJwt) // deleteSession takes the refresh token, not the access token
			    .post(null)) {
				LOGGER.debug("Signed out of Bluesky: {}", response.getStatusInfo());
			}
		}

		session = null;
		authFilter.setAccessToken(null);
	}

	@Override
	public Blob uploadBlob(final byte[] data, final String mimeType) {
		LOGGER.debug("Uploading {} blob ({} bytes)", mimeType, data.length);
		return target("com.atproto.repo.uploadBlob")
		    .request()
		    .post(Entity.entity(data, MediaType.valueOf(mimeType)), UploadBlobResponse.class)
		    .blob;
	}

	@Override
	public StrongRef createPost(final PostRecord post) {
		final CreateRecordRequest requestBody = new CreateRecordRequest();
		requestBody.repo = getSession().did;
		requestBody.collection = BlueskySchema.POST_COLLECTION;
		requestBody.record = post;

		return target("com.atproto.repo.createRecord")
		    .request()
		    .post(Entity.json(requestBody), StrongRef.class);
	}

	@Override
	public String resolveHandle(final String handle) {
		return target("com.atproto.identity.resolveHandle")
		    .queryParam("handle", handle)
		    .request()
		    .get(ResolveHandleResponse.class)
		    .did;
	}

	@Override
	public StrongRef getPost(final String repo, final String recordKey) {
		return target("com.atproto.repo.getRecord")
		    .queryParam("repo", repo)
		    .queryParam("collection", BlueskySchema.POST_COLLECTION)
		    .queryParam("rkey", recordKey)
		    .request()
		    .get(StrongRef.class);
	}

	private Session getSession() {
		if (session == null) {
			throw new IllegalStateException("Not signed in to Bluesky");
		}
		return session;
	}

	@Override
	public void close() {
		signOut();
	}

}
