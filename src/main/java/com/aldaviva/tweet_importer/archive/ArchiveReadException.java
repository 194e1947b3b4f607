package com.aldaviva.tweet_importer.archive;

/**
 * A required part of the Twitter archive, the checkpoint file, or a media file could not be read or parsed.
 */
public class ArchiveReadException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ArchiveReadException(final String message) {
		super(message);
	}

	public ArchiveReadException(final String message, final Throwable cause) {
		super(message, cause);
	}

}
