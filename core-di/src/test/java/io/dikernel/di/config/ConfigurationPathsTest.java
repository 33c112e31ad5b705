package io.dikernel.di.config;

import io.dikernel.di.InjectionToken;
import io.dikernel.di.RegistryOpts;
import io.dikernel.di.error.ConfigurationLookupException;
import org.junit.Test;

import static io.dikernel.di.RegistryOpts.withConfigNode;
import static io.dikernel.di.RegistryOpts.withToken;
import static io.dikernel.di.error.ConfigurationLookupException.Reason.EMPTY_PATH;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public final class ConfigurationPathsTest {
	private static final InjectionToken A = InjectionToken.register("a");

	@Test
	public void tokenAndConfigNode() throws ConfigurationLookupException {
		assertEquals("a.b.c", ConfigurationPaths.assemble(RegistryOpts.create(withToken(A), withConfigNode("b.c"))));
		assertEquals("a.b.c", ConfigurationPaths.assemble(RegistryOpts.create(withToken(A), withConfigNode("b"), withConfigNode("c"))));
	}

	@Test
	public void configNodeOnly() throws ConfigurationLookupException {
		assertEquals("x", ConfigurationPaths.assemble(RegistryOpts.create(withConfigNode("x"))));
	}

	@Test
	public void tokenOnly() throws ConfigurationLookupException {
		assertEquals("a.", ConfigurationPaths.assemble(RegistryOpts.create(withToken(A))));
	}

	@Test
	public void bothEmpty() {
		try {
			ConfigurationPaths.assemble(RegistryOpts.create());
			fail();
		} catch (ConfigurationLookupException e) {
			assertEquals(EMPTY_PATH, e.getReason());
			assertEquals("injection token and config node path cannot be both empty", e.getMessage());
		}
	}
}
