package com.aldaviva.tweet_importer.services.bluesky;

import com.aldaviva.tweet_importer.archive.PublishResult;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.xml.bind.annotation.XmlRootElement;
import java.time.Instant;
import java.util.List;

/**
 * Lexicon types for the XRPC calls and records this program uses.
 * @see https://github.com/bluesky-social/atproto/tree/main/lexicons
 */
public final class BlueskySchema {

	public static final String POST_COLLECTION = "app.bsky.feed.post";

	private BlueskySchema() {
	}

	@XmlRootElement
	public static final class Session {
		public String did;
		public String handle;
		public String accessJwt;
		public String refreshJwt;
	}

	@XmlRootElement
	public static final class UploadBlobResponse {
		public Blob blob;
	}

	public static final class Blob {
		@JsonProperty("$type") public String type = "blob";
		public Link ref;
		public String mimeType;
		public long size;
	}

	public static final class Link {
		@JsonProperty("$link") public String link;

		public Link() {
		}

		public Link(final String link) {
			this.link = link;
		}
	}

	/**
	 * {@code com.atproto.repo.strongRef}: points to one version of a record.
	 */
	@XmlRootElement
	public static final class StrongRef {
		public String uri;
		public String cid;

		public StrongRef() {
		}

		public StrongRef(final String uri, final String cid) {
			this.uri = uri;
			this.cid = cid;
		}

		public static StrongRef of(final PublishResult publishResult) {
			return new StrongRef(publishResult.getUri(), publishResult.getCid());
		}
	}

	public static final class CreateRecordRequest {
		public String repo;
		public String collection;
		public Object record;
	}

	@XmlRootElement
	public static final class ResolveHandleResponse {
		public String did;
	}

	public static final class PostRecord {
		@JsonProperty("$type") public String type = POST_COLLECTION;
		public String text;
		@JsonInclude(Include.NON_EMPTY) public List<Facet> facets;
		public Instant createdAt;
		public Embed embed;
		public ReplyRef reply;
	}

	public static final class ReplyRef {
		public StrongRef root;
		public StrongRef parent;

		public ReplyRef() {
		}

		public ReplyRef(final StrongRef root, final StrongRef parent) {
			this.root = root;
			this.parent = parent;
		}
	}

	public interface Embed {
	}

	public static final class ImagesEmbed implements Embed {
		@JsonProperty("$type") public String type = "app.bsky.embed.images";
		public List<Image> images;

		public ImagesEmbed() {
		}

		public ImagesEmbed(final List<Image> images) {
			this.images = images;
		}
	}

	public static final class Image {
		public String alt = "";
		public Blob image;

		public Image() {
		}

		public Image(final Blob image) {
			this.image = image;
		}
	}

	public static final class RecordEmbed implements Embed {
		@JsonProperty("$type") public String type = "app.bsky.embed.record";
		public StrongRef record;

		public RecordEmbed() {
		}

		public RecordEmbed(final StrongRef record) {
			this.record = record;
		}
	}

	/**
	 * Rich text annotation. Offsets are in bytes of the UTF-8 encoded text, end exclusive.
	 */
	public static final class Facet {
		public ByteSlice index;
		public List<FacetFeature> features;

		public Facet() {
		}

		public Facet(final int byteStart, final int byteEnd, final FacetFeature feature) {
			index = new ByteSlice();
			index.byteStart = byteStart;
			index.byteEnd = byteEnd;
			features = List.of(feature);
		}
	}

	public static final class ByteSlice {
		public int byteStart;
		public int byteEnd;
	}

	public interface FacetFeature {
	}

	public static final class MentionFeature implements FacetFeature {
		@JsonProperty("$type") public String type = "app.bsky.richtext.facet#mention";
		public String did;

		public MentionFeature(final String did) {
			this.did = did;
		}
	}

	public static final class LinkFeature implements FacetFeature {
		@JsonProperty("$type") public String type = "app.bsky.richtext.facet#link";
		public String uri;

		public LinkFeature(final String uri) {
			this.uri = uri;
		}
	}

	public static final class TagFeature implements FacetFeature {
		@JsonProperty("$type") public String type = "app.bsky.richtext.facet#tag";
		public String tag;

		public TagFeature(final String tag) {
			this.tag = tag;
		}
	}
}
