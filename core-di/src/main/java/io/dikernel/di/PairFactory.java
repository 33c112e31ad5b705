package io.dikernel.di;

import io.dikernel.di.error.DIException;

@FunctionalInterface
public interface PairFactory<T, C> {
	T create(DIContext ctx, RegistryOpts opts, C configuration) throws DIException;
}
