package com.aldaviva.tweet_importer.http;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.core.util.Separators.Spacing;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.ws.rs.ext.ContextResolver;
import jakarta.ws.rs.ext.Provider;

public abstract class JacksonConfig {

	private JacksonConfig() {
	}

	/**
	 * Writer used for files that people read and diff: the checkpoint file, and the post records printed to the console.
	 * Four-space indentation, with a space only after the colon.
	 */
	public static ObjectWriter prettyWriter() {
		final Separators separators = Separators.createDefaultInstance().withObjectFieldValueSpacing(Spacing.AFTER);
		final DefaultPrettyPrinter prettyPrinter = new DefaultPrettyPrinter()
		    .withSeparators(separators)
		    .withObjectIndenter(new DefaultIndenter("    ", DefaultIndenter.SYS_LF))
		    .withArrayIndenter(new DefaultIndenter("    ", DefaultIndenter.SYS_LF));

		return CustomObjectMapperProvider.OBJECT_MAPPER.writer(prettyPrinter);
	}

	@Provider
	public static class CustomObjectMapperProvider implements ContextResolver<ObjectMapper> {

		public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

		static {
			OBJECT_MAPPER.registerModule(new JavaTimeModule());
			OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
			OBJECT_MAPPER.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);
			OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS); // Bluesky wants ISO-8601 createdAt strings
			OBJECT_MAPPER.setSerializationInclusion(Include.NON_NULL);
		}

		@Override
		public ObjectMapper getContext(final Class<?> type) {
			return OBJECT_MAPPER;
		}
	}
}
