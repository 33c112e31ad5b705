package io.dikernel.di;

import io.dikernel.di.config.Configuration;
import io.dikernel.json.DecodeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

final class DefaultDIContext implements DIContext {
	@NotNull
	private final ExecutionContext inner;
	@NotNull
	private final Map<String, Object> rawConfiguration;
	@Nullable
	private final Configuration configuration;
	@NotNull
	private final List<String> breadcrumbs;

	private DefaultDIContext(@NotNull ExecutionContext inner, @NotNull Map<String, Object> rawConfiguration,
			@Nullable Configuration configuration, @NotNull List<String> breadcrumbs) {
		this.inner = inner;
		this.rawConfiguration = rawConfiguration;
		this.configuration = configuration;
		this.breadcrumbs = breadcrumbs;
	}

	@SuppressWarnings("unchecked")
	static DIContext create(Object... args) {
		DIContext parent = null;
		ExecutionContext inner = null;
		Configuration configuration = null;
		Map<String, Object> rawConfiguration = null;

		for (Object arg : args) {
			if (arg == null) {
				continue;
			}
			if (arg instanceof DIContext) {
				parent = (DIContext) arg;
			} else if (arg instanceof ExecutionContext) {
				inner = (ExecutionContext) arg;
			} else if (arg instanceof Configuration) {
				configuration = (Configuration) arg;
			} else if (arg instanceof Map) {
				rawConfiguration = (Map<String, Object>) arg;
			} else {
				throw new IllegalArgumentException("Unsupported context argument " + arg.getClass().getName());
			}
		}

		if (parent != null) {
			if (rawConfiguration == null) {
				rawConfiguration = parent.getRawConfiguration();
			}
			if (configuration == null) {
				configuration = parent.getConfiguration();
			}
			if (inner == null) {
				inner = parent.getInner();
			}
		}

		if (inner == null) {
			inner = ExecutionContext.background();
		}

		if (configuration != null) {
			try {
				rawConfiguration = configuration.toRawConfiguration();
			} catch (DecodeException e) {
				throw new IllegalArgumentException("Cannot decode configuration " + configuration.getClass().getName(), e);
			}
		}

		if (rawConfiguration == null) {
			rawConfiguration = new HashMap<>();
		}

		return new DefaultDIContext(inner, rawConfiguration, configuration, new ArrayList<>());
	}

	@NotNull
	@Override
	public Map<String, Object> getRawConfiguration() {
		return unmodifiableMap(rawConfiguration);
	}

	@Nullable
	@Override
	public Configuration getConfiguration() {
		return configuration;
	}

	@NotNull
	@Override
	public ExecutionContext getInner() {
		return inner;
	}

	@NotNull
	@Override
	public DIContext copy() {
		return new DefaultDIContext(inner, rawConfiguration, configuration, new ArrayList<>(breadcrumbs));
	}

	@NotNull
	@Override
	public List<String> getBreadcrumbs() {
		return unmodifiableList(breadcrumbs);
	}

	@Override
	public void appendBreadcrumb(@Nullable InjectionToken token) {
		if (token == null) {
			return;
		}
		breadcrumbs.add(token.value());
	}

	@Override
	public String toString() {
		return "DIContext{breadcrumbs=" + breadcrumbs + ", configuration=" +
				(configuration != null ? configuration.getClass().getSimpleName() : null) + '}';
	}
}
