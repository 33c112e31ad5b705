package io.dikernel.di;

import io.dikernel.di.error.DIException;
import org.jetbrains.annotations.Nullable;

/**
 * Untyped factory as stored by a {@link Registry}.
 */
@FunctionalInterface
public interface InstanceFactory {
	Object create(DIContext ctx, RegistryOpts opts, @Nullable Object configuration) throws DIException;
}
