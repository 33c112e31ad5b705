package io.dikernel.di;

import io.dikernel.di.config.Configuration;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * State shared by the factories of one creation: the configuration tree, the typed
 * {@link Configuration} if any, the breadcrumb trail of tokens and an inner {@link ExecutionContext}.
 * <p>
 * Every creation call works on a {@linkplain #copy() copy}, so breadcrumbs pushed while building
 * one branch of the dependency graph are not seen by its siblings.
 */
public interface DIContext extends ExecutionContext {
	/**
	 * Read-only view of the configuration tree.
	 */
	@NotNull
	Map<String, Object> getRawConfiguration();

	@Nullable
	Configuration getConfiguration();

	@NotNull
	ExecutionContext getInner();

	/**
	 * Shares configuration and inner context, copies breadcrumbs.
	 */
	@NotNull
	DIContext copy();

	@NotNull
	List<String> getBreadcrumbs();

	/**
	 * Does nothing for a {@code null} token.
	 */
	void appendBreadcrumb(@Nullable InjectionToken token);

	@Nullable
	@Override
	default Instant getDeadline() {
		return getInner().getDeadline();
	}

	@Override
	default boolean isCancelled() {
		return getInner().isCancelled();
	}

	@Nullable
	@Override
	default Object getValue(@NotNull Object key) {
		return getInner().getValue(key);
	}

	/**
	 * Builds a context from arguments recognised by kind, in any order: a parent {@link DIContext},
	 * an {@link ExecutionContext}, a {@link Configuration} and a raw configuration {@link Map}.
	 * Whatever is not given is inherited from the parent. With a {@link Configuration}, the raw
	 * tree is always derived from it.
	 *
	 * @throws IllegalArgumentException on an argument of another kind, or a configuration that cannot be decoded
	 */
	@NotNull
	static DIContext create(Object... args) {
		return DefaultDIContext.create(args);
	}
}
