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

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Type;
import java.util.Map;

import static io.dikernel.json.GsonAdapters.GSON;

/**
 * Converts between loosely typed trees ({@code Map}s, lists, scalars) and typed objects
 * by going through a Gson tree. Field names follow {@code @SerializedName}, time values
 * follow {@link GsonAdapters#INSTANT_JSON}.
 */
public final class StructDecoder {
	public static final Type TREE_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

	private StructDecoder() {
	}

	public static <T> T decode(@Nullable Object from, @NotNull Class<T> type) throws DecodeException {
		return decode(from, (Type) type);
	}

	public static <T> T decode(@Nullable Object from, @NotNull Type type) throws DecodeException {
		try {
			JsonElement tree = GSON.toJsonTree(from);
			return GSON.fromJson(tree, type);
		} catch (JsonParseException | IllegalArgumentException | IllegalStateException e) {
			throw new DecodeException("failed to decode into " + type.getTypeName(), e);
		}
	}

	/**
	 * Generic nested-map form of an object, as used for raw configuration trees.
	 */
	@NotNull
	public static Map<String, Object> toTree(@NotNull Object from) throws DecodeException {
		JsonElement tree;
		try {
			tree = GSON.toJsonTree(from);
		} catch (JsonParseException | IllegalArgumentException e) {
			throw new DecodeException("failed to encode " + from.getClass().getName(), e);
		}
		if (!tree.isJsonObject()) {
			throw new DecodeException("destination must be an object, got " + from.getClass().getName());
		}
		return decode(tree, TREE_TYPE);
	}
}
