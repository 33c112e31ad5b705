/*
 * Copyright (C) 2025 DI Kernel authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.dikernel.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import io.dikernel.util.Ref;

import java.io.IOException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public final class GsonAdapters {
	public static final String RFC3339 = "RFC3339";

	/**
	 * Time values travel as {@code {"RFC3339": "<timestamp>"}}, always written in UTC.
	 * A plain RFC3339 string is accepted on read as well.
	 */
	public static final TypeAdapter<Instant> INSTANT_JSON = new TypeAdapter<Instant>() {
		@Override
		public void write(JsonWriter out, Instant value) throws IOException {
			if (value == null) {
				out.nullValue();
				return;
			}
			out.beginObject();
			out.name(RFC3339).value(DateTimeFormatter.ISO_INSTANT.format(value));
			out.endObject();
		}

		@Override
		public Instant read(JsonReader in) throws IOException {
			JsonToken token = in.peek();
			if (token == JsonToken.NULL) {
				in.nextNull();
				return null;
			}
			if (token == JsonToken.STRING) {
				return parseTimestamp(in.nextString());
			}
			if (token != JsonToken.BEGIN_OBJECT) {
				throw new JsonParseException("Expected time object or string, got " + token);
			}
			String timestamp = null;
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				if (RFC3339.equals(name) && in.peek() == JsonToken.STRING) {
					timestamp = in.nextString();
				} else {
					in.skipValue();
				}
			}
			in.endObject();
			if (timestamp == null) {
				throw new JsonParseException(RFC3339 + " key not found or not a string");
			}
			return parseTimestamp(timestamp);
		}
	};

	/**
	 * {@code Ref<T>} is written and read as its referent, an empty {@code Ref} as {@code null}.
	 */
	public static final TypeAdapterFactory REF_FACTORY = new TypeAdapterFactory() {
		@SuppressWarnings("unchecked")
		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> typeToken) {
			if (typeToken.getRawType() != Ref.class) {
				return null;
			}
			Type type = typeToken.getType();
			Type referentType = type instanceof ParameterizedType ?
					((ParameterizedType) type).getActualTypeArguments()[0] :
					Object.class;
			TypeAdapter<Object> referentAdapter = (TypeAdapter<Object>) gson.getAdapter(TypeToken.get(referentType));
			return (TypeAdapter<T>) new TypeAdapter<Ref<Object>>() {
				@Override
				public void write(JsonWriter out, Ref<Object> value) throws IOException {
					if (value == null || value.isEmpty()) {
						out.nullValue();
						return;
					}
					referentAdapter.write(out, value.get());
				}

				@Override
				public Ref<Object> read(JsonReader in) throws IOException {
					return Ref.of(referentAdapter.read(in));
				}
			};
		}
	};

	/**
	 * Shared instance: honours {@code @SerializedName}, keeps {@code null} members,
	 * reads untyped numbers as {@code Long} or {@code Double}.
	 */
	public static final Gson GSON = new GsonBuilder()
			.registerTypeAdapter(Instant.class, INSTANT_JSON)
			.registerTypeAdapterFactory(REF_FACTORY)
			.setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
			.serializeNulls()
			.disableHtmlEscaping()
			.create();

	/**
	 * Used for templating, where numbers must be written back exactly as they were read.
	 */
	static final Gson VERBATIM_GSON = new GsonBuilder()
			.setObjectToNumberStrategy(ToNumberPolicy.LAZILY_PARSED_NUMBER)
			.serializeNulls()
			.disableHtmlEscaping()
			.create();

	private GsonAdapters() {
	}

	static Instant parseTimestamp(String timestamp) {
		try {
			return OffsetDateTime.parse(timestamp, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
		} catch (DateTimeParseException e) {
			throw new JsonParseException("Invalid " + RFC3339 + " timestamp: " + timestamp, e);
		}
	}
}
