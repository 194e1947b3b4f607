package com.aldaviva.tweet_importer.archive;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;

/**
 * Read-only view of the fields of an archived tweet that the importer uses. Every other field of the export is kept untouched by
 * {@link ArchivedPost#getSource()}.
 */
public final class TwitterArchiveSchema {

	private TwitterArchiveSchema() {
	}

	public static final class Tweet {
		public String id;
		@JsonProperty("created_at") public String createdAt;
		@JsonProperty("full_text") public String fullText;
		@JsonProperty("in_reply_to_status_id") public String inReplyToStatusId;
		@JsonProperty("in_reply_to_screen_name") public String inReplyToScreenName;
		public Entities entities;
		@JsonProperty("extended_entities") public Entities extendedEntities;

		public boolean isReply() {
			return inReplyToScreenName != null;
		}

		public List<UrlEntity> getUrls() {
			return entities != null && entities.urls != null ? entities.urls : Collections.emptyList();
		}

		public List<Media> getMedia() {
			return extendedEntities != null && extendedEntities.media != null ? extendedEntities.media : Collections.emptyList();
		}
	}

	public static final class Entities {
		public List<UrlEntity> urls;
		public List<Media> media;
	}

	public static final class UrlEntity {
		public String url;
		@JsonProperty("expanded_url") public String expandedUrl;
	}

	public static final class Media {
		public String type;
		@JsonProperty("media_url") public String mediaUrl;
	}
}
