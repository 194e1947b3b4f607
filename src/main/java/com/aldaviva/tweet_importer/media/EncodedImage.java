package com.aldaviva.tweet_importer.media;

public class EncodedImage {

	private final byte[] bytes;
	private final String mimeType;

	public EncodedImage(final byte[] bytes, final String mimeType) {
		this.bytes = bytes;
		this.mimeType = mimeType;
	}

	public byte[] getBytes() {
		return bytes;
	}

	public String getMimeType() {
		return mimeType;
	}

	public int getSize() {
		return bytes.length;
	}

}
