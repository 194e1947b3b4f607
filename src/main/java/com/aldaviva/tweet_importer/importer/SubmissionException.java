package com.aldaviva.tweet_importer.importer;

/**
 * Bluesky rejected an image upload or a post, or could not be reached. The import stops, and the next run resumes with the tweet that failed.
 */
public class SubmissionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public SubmissionException(final String message, final Throwable cause) {
		super(message, cause);
	}

}
