package com.aldaviva.tweet_importer.http;

import jakarta.ws.rs.client.ClientRequestContext;
import jakarta.ws.rs.client.ClientRequestFilter;
import jakarta.ws.rs.core.HttpHeaders;
import java.io.IOException;
import java.util.Collections;

/**
 * Adds the access token of the current Bluesky session to every XRPC request, except the ones that create a session.
 */
public class BearerAuthenticationFilter implements ClientRequestFilter {

	private volatile String accessToken;

	public void setAccessToken(final String accessToken) {
		this.accessToken = accessToken;
	}

	public boolean isAuthenticated() {
		return accessToken != null;
	}

	@Override
	public void filter(final ClientRequestContext requestContext) throws IOException {
		final String token = accessToken;
		if (token != null && !requestContext.getUri().getPath().endsWith("com.atproto.server.createSession")) {
			requestContext.getHeaders().putIfAbsent(HttpHeaders.AUTHORIZATION, Collections.singletonList("Bearer " + token));
		}
	}

}
