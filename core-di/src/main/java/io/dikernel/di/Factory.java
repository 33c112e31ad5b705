package io.dikernel.di;

import io.dikernel.di.error.DIException;

@FunctionalInterface
public interface Factory<T> {
	T create(DIContext ctx, RegistryOpts opts) throws DIException;
}
