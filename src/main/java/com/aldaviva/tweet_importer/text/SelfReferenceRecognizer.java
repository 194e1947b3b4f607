package com.aldaviva.tweet_importer.text;

/**
 * Decides whether a URL points at a tweet written by the person whose archive is being imported.
 */
public interface SelfReferenceRecognizer {

	boolean isSelfReference(String url);

}
