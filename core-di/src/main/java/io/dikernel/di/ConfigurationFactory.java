package io.dikernel.di;

import io.dikernel.di.error.DIException;

@FunctionalInterface
public interface ConfigurationFactory {
	Object create(DIContext ctx, RegistryOpts opts) throws DIException;
}
