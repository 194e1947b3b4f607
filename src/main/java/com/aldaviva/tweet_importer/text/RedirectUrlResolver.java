package com.aldaviva.tweet_importer.text;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.core.Response;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.glassfish.jersey.client.ClientProperties;

/**
 * Follows HTTP redirects one hop at a time until a non-redirect response, giving up after a fixed amount of time per link. Never throws:
 * any failure resolves to the URL that was passed in.
 */
public class RedirectUrlResolver implements UrlResolver, AutoCloseable {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(RedirectUrlResolver.class);

	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
	private static final int MAX_REDIRECTS = 10;

	private final Client httpClient;
	private final Duration timeout;
	private final AtomicInteger threadCount = new AtomicInteger();
	// one worker per resolution, so a server that ignores the read timeout only holds up its own link
	private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
		final Thread thread = new Thread(runnable, "url-resolver-" + threadCount.incrementAndGet());
		thread.setDaemon(true);
		return thread;
	});

	public RedirectUrlResolver(final Client httpClient) {
		this(httpClient, DEFAULT_TIMEOUT);
	}

	public RedirectUrlResolver(final Client httpClient, final Duration timeout) {
		this.httpClient = httpClient;
		this.timeout = timeout;
	}

	@Override
	public String resolve(final String url) {
		final long deadline = System.nanoTime() + timeout.toNanos();
		final Future<String> resolution = executor.submit(() -> followRedirects(url, deadline));
		try {
			return resolution.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (final TimeoutException e) {
			resolution.cancel(true);
			LOGGER.warn("Timeout resolving url {}", url);
			return url;
		} catch (final ExecutionException e) {
			LOGGER.warn("Error resolving url {}: {}", url, e.getCause().getMessage());
			return url;
		} catch (final InterruptedException e) {
			resolution.cancel(true);
			Thread.currentThread().interrupt();
			return url;
		}
	}

	private String followRedirects(final String url, final long deadline) {
		URI current = URI.create(url);
		for (int hop = 0; hop < MAX_REDIRECTS; hop++) {
			final long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
			if (remainingMillis <= 0) {
				break;
			}

			final URI location;
			try (Response response = httpClient.target(current)
			    .property(ClientProperties.FOLLOW_REDIRECTS, false)
			    .property(ClientProperties.CONNECT_TIMEOUT, (int) remainingMillis)
			    .property(ClientProperties.READ_TIMEOUT, (int) remainingMillis)
			    .request()
			    .head()) {

				if (response.getStatusInfo().getFamily() != Response.Status.Family.REDIRECTION || response.getLocation() == null) {
					break;
				}
				location = response.getLocation();
			} catch (final ProcessingException e) {
				if (hop == 0) {
					throw e;
				}
				LOGGER.debug("Stopped following redirects of {} at {}: {}", url, current, e.getMessage());
				break;
			}

			current = current.resolve(location);
		}
		return current.toString();
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}

}
