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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.dikernel.util.ApplicationSettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static io.dikernel.json.GsonAdapters.GSON;
import static io.dikernel.json.GsonAdapters.VERBATIM_GSON;

/**
 * Expands {@code ${di.<dot.path>}} references in a JSON document before it is parsed.
 * <p>
 * A reference may be written as a string ({@code "cache": "${di.$shared.cache}"}) or bare
 * ({@code "cache": ${di.$shared.cache}}); either way it is replaced with the JSON text of the
 * node found at that path. Paths are resolved against the document with every reference
 * nulled out, so a reference that points at another reference yields {@code null}.
 */
public final class DiReferences {
	private static final Logger logger = LoggerFactory.getLogger(DiReferences.class);

	private static final boolean LOG_PLACEHOLDERS = ApplicationSettings.getBoolean(DiReferences.class, "logPlaceholders", false);

	private static final Pattern REFERENCE = Pattern.compile("[\"']?(\\$\\{di\\.([^}]+)})[\"']?");
	private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{di\\.([^}]+)}");
	private static final Pattern BARE_REFERENCE = Pattern.compile("([:\\[,]\\s*)(\\$\\{di\\.[^}]+})(?=\\s*[,\\]}])");

	private static final TypeAdapter<Map<String, Object>> SKELETON_ADAPTER =
			VERBATIM_GSON.getAdapter(new TypeToken<Map<String, Object>>() {});

	private DiReferences() {
	}

	/**
	 * Returns the document with every reference replaced by the JSON text of its target node.
	 * Nothing is substituted unless every reference resolves.
	 */
	@NotNull
	public static String resolve(@NotNull String json) throws TemplateResolutionException {
		String validJson = quoteBareReferences(json);
		Map<String, Object> skeleton = parseSkeleton(REFERENCE.matcher(validJson).replaceAll("null"));

		Map<String, String> replacements = new LinkedHashMap<>();
		Matcher matcher = REFERENCE.matcher(json);
		while (matcher.find()) {
			String placeholder = matcher.group(1);
			if (replacements.containsKey(placeholder)) {
				continue;
			}
			String path = matcher.group(2);
			Object node;
			try {
				node = extractNode(skeleton, path);
			} catch (NoSuchElementException e) {
				throw TemplateResolutionException.unresolved(placeholder,
						"failed to resolve DI reference " + placeholder + ": " + e.getMessage());
			}
			String nodeJson = VERBATIM_GSON.toJson(node);
			if (LOG_PLACEHOLDERS) {
				logger.debug("{} -> {}", placeholder, nodeJson);
			}
			replacements.put(placeholder, nodeJson);
		}

		if (replacements.isEmpty()) {
			return validJson;
		}

		String result = validJson;
		for (Map.Entry<String, String> entry : replacements.entrySet()) {
			result = result.replace('"' + entry.getKey() + '"', entry.getValue());
			result = result.replace(entry.getKey(), entry.getValue());
		}
		logger.debug("Resolved {} DI references", replacements.size());
		return result;
	}

	/**
	 * Resolves references and parses the result into {@code type}.
	 */
	public static <T> T fromJson(@NotNull String json, @NotNull Class<T> type) throws TemplateResolutionException {
		return fromJson(json, (Type) type);
	}

	public static <T> T fromJson(@NotNull String json, @NotNull Type type) throws TemplateResolutionException {
		String resolved = resolve(json);
		try {
			return GSON.fromJson(resolved, type);
		} catch (JsonParseException e) {
			throw new TemplateResolutionException("failed to parse resolved JSON", e);
		}
	}

	/**
	 * Distinct placeholders of the document, in order of first appearance.
	 */
	@NotNull
	public static List<String> find(@NotNull String json) {
		Set<String> unique = new LinkedHashSet<>();
		Matcher matcher = PLACEHOLDER.matcher(json);
		while (matcher.find()) {
			unique.add(matcher.group());
		}
		return new ArrayList<>(unique);
	}

	/**
	 * Checks that every placeholder of {@code json} resolves against {@code tree}.
	 */
	public static void validate(@NotNull String json, @NotNull Map<String, ?> tree) throws TemplateResolutionException {
		Matcher matcher = PLACEHOLDER.matcher(json);
		while (matcher.find()) {
			try {
				extractNode(tree, matcher.group(1));
			} catch (NoSuchElementException e) {
				throw TemplateResolutionException.unresolved(matcher.group(),
						"invalid DI reference " + matcher.group() + ": " + e.getMessage());
			}
		}
	}

	/**
	 * Walks {@code path} through nested maps. Every segment but the last must name a map.
	 *
	 * @throws NoSuchElementException if a segment is missing or cannot be navigated into
	 */
	@Nullable
	public static Object extractNode(@NotNull Map<String, ?> tree, @NotNull String path) throws NoSuchElementException {
		if (path.isEmpty()) {
			return tree;
		}
		String[] parts = path.split("\\.", -1);
		Map<?, ?> current = tree;
		for (int i = 0; i < parts.length; i++) {
			String part = parts[i];
			if (!current.containsKey(part)) {
				throw new NoSuchElementException("path component '" + part + "' not found in path '" + path + "'");
			}
			Object value = current.get(part);
			if (i == parts.length - 1) {
				return value;
			}
			if (!(value instanceof Map)) {
				throw new NoSuchElementException("path component '" + part + "' is not an object, cannot navigate further in path '" + path + "'");
			}
			current = (Map<?, ?>) value;
		}
		return current;
	}

	static String quoteBareReferences(String json) {
		return BARE_REFERENCE.matcher(json).replaceAll("$1\"$2\"");
	}

	private static Map<String, Object> parseSkeleton(String json) throws TemplateResolutionException {
		try {
			JsonReader reader = new JsonReader(new StringReader(json));
			reader.setLenient(false);
			if (reader.peek() != JsonToken.BEGIN_OBJECT) {
				throw new TemplateResolutionException("failed to parse JSON for DI resolution: document is not an object");
			}
			Map<String, Object> skeleton = SKELETON_ADAPTER.read(reader);
			if (reader.peek() != JsonToken.END_DOCUMENT) {
				throw new TemplateResolutionException("failed to parse JSON for DI resolution: trailing content");
			}
			return skeleton;
		} catch (IOException | JsonParseException | IllegalStateException e) {
			throw new TemplateResolutionException("failed to parse JSON for DI resolution", e);
		}
	}
}
