package com.aldaviva.tweet_importer.media;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.Imaging;

/**
 * Shrinks images that are larger than Bluesky's blob size limit.
 */
public class ImageNormalizer {

	private static final org.slf4j.Logger LOGGER = org.slf4j.LoggerFactory.getLogger(ImageNormalizer.class);

	/**
	 * Bluesky rejects image blobs over 1,000,000 bytes.
	 */
	public static final int DEFAULT_MAX_SIZE = 976 * 1024;
	static final float JPEG_QUALITY = 0.8f;
	static final String JPEG_MIME_TYPE = "image/jpeg";

	private final int maxSize;

	public ImageNormalizer() {
		this(DEFAULT_MAX_SIZE);
	}

	public ImageNormalizer(final int maxSize) {
		this.maxSize = maxSize;
	}

	/**
	 * Images that fit are returned unchanged. Larger ones are scaled down so that their area shrinks by the same ratio as their file size needs
	 * to, keeping the aspect ratio, and re-encoded as JPEG.
	 */
	public EncodedImage normalize(final EncodedImage image) {
		if (image.getSize() <= maxSize) {
			return image;
		}

		LOGGER.info(String.format(Locale.US, "Image size %.2fMB exceeds %dKB, resizing...", image.getSize() / 1024.0 / 1024.0, maxSize / 1024));

		try {
			final Dimension originalSize = Imaging.getImageSize(image.getBytes());
			final double scale = Math.sqrt((double) maxSize / image.getSize());
			final int newWidth = Math.max(1, (int) Math.floor(originalSize.width * scale));
			final int newHeight = Math.max(1, (int) Math.floor(originalSize.height * scale));

			final BufferedImage original = ImageIO.read(new ByteArrayInputStream(image.getBytes()));
			if (original == null) {
				throw new IOException("No image reader for " + image.getMimeType());
			}

			final BufferedImage resized = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
			final Graphics2D graphics = resized.createGraphics();
			try {
				graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
				graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
				graphics.setColor(Color.WHITE); // JPEG has no alpha channel
				graphics.fillRect(0, 0, newWidth, newHeight);
				graphics.drawImage(original, 0, 0, newWidth, newHeight, null);
			} finally {
				graphics.dispose();
			}

			final byte[] resizedBytes = encodeJpeg(resized);
			LOGGER.debug("Resized image from {}x{} ({} bytes) to {}x{} ({} bytes)", originalSize.width, originalSize.height, image.getSize(), newWidth,
			    newHeight, resizedBytes.length);
			return new EncodedImage(resizedBytes, JPEG_MIME_TYPE);
		} catch (final ImageReadException | IOException e) {
			throw new RuntimeException("Failed to resize image", e);
		}
	}

	private static byte[] encodeJpeg(final BufferedImage image) throws IOException {
		final Iterator<ImageWriter> writers = ImageIO.getImageWritersByMIMEType(JPEG_MIME_TYPE);
		if (!writers.hasNext()) {
			throw new IOException("No JPEG encoder available");
		}
		final ImageWriter writer = writers.next();

		final ImageWriteParam writeParam = writer.getDefaultWriteParam();
		writeParam.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
		writeParam.setCompressionQuality(JPEG_QUALITY);

		final ByteArrayOutputStream output = new ByteArrayOutputStream();
		try (ImageOutputStream imageOutput = ImageIO.createImageOutputStream(output)) {
			writer.setOutput(imageOutput);
			writer.write(null, new IIOImage(image, null, null), writeParam);
		} finally {
			writer.dispose();
		}
		return output.toByteArray();
	}

}
