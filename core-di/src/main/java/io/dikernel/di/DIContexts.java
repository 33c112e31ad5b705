package io.dikernel.di;

import io.dikernel.di.config.Configuration;
import io.dikernel.di.config.MapConfiguration;
import io.dikernel.di.error.ConfigurationLoadException;
import io.dikernel.json.DiReferences;
import io.dikernel.json.StructDecoder;
import io.dikernel.json.TemplateResolutionException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Builds {@link DIContext}s from JSON configuration documents, expanding {@code ${di.<path>}} references first.
 * Extra arguments are handed to {@link DIContext#create}.
 */
public final class DIContexts {
	private static final Logger logger = LoggerFactory.getLogger(DIContexts.class);

	private DIContexts() {
	}

	@NotNull
	public static DIContext fromJson(@NotNull String json, Object... args) throws ConfigurationLoadException {
		Map<String, Object> tree;
		try {
			tree = DiReferences.fromJson(json, StructDecoder.TREE_TYPE);
		} catch (TemplateResolutionException e) {
			throw new ConfigurationLoadException("failed to load configuration: " + e.getMessage(), e);
		}
		return create(new MapConfiguration(tree), args);
	}

	@NotNull
	public static <C extends Configuration> DIContext fromJson(@NotNull String json, @NotNull Class<C> type, Object... args) throws ConfigurationLoadException {
		C configuration;
		try {
			configuration = DiReferences.fromJson(json, type);
		} catch (TemplateResolutionException e) {
			throw new ConfigurationLoadException("failed to load " + type.getName() + ": " + e.getMessage(), e);
		}
		return create(configuration, args);
	}

	@NotNull
	public static DIContext fromFile(@NotNull Path file, Object... args) throws ConfigurationLoadException {
		logger.debug("Loading configuration from {}", file);
		return fromJson(read(file), args);
	}

	@NotNull
	public static <C extends Configuration> DIContext fromFile(@NotNull Path file, @NotNull Class<C> type, Object... args) throws ConfigurationLoadException {
		logger.debug("Loading {} from {}", type.getName(), file);
		return fromJson(read(file), type, args);
	}

	private static String read(Path file) throws ConfigurationLoadException {
		try {
			return new String(Files.readAllBytes(file), UTF_8);
		} catch (IOException e) {
			throw new ConfigurationLoadException("failed to read configuration file " + file, e);
		}
	}

	private static DIContext create(Configuration configuration, Object[] args) throws ConfigurationLoadException {
		Object[] all = Arrays.copyOf(args, args.length + 1);
		all[args.length] = configuration;
		try {
			return DIContext.create(all);
		} catch (IllegalArgumentException e) {
			throw new ConfigurationLoadException("failed to create context: " + e.getMessage(), e);
		}
	}
}
