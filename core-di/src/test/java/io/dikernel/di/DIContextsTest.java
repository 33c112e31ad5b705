package io.dikernel.di;

import com.google.gson.annotations.SerializedName;
import io.dikernel.di.config.Configuration;
import io.dikernel.di.config.MapConfiguration;
import io.dikernel.di.error.ConfigurationLoadException;
import io.dikernel.di.error.ConfigurationLookupException;
import io.dikernel.json.TemplateResolutionException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.*;

public final class DIContextsTest {
	private static final String JSON = "{\n" +
			"  \"$shared\": {\"cache\": {\"host\": \"redis\", \"db\": 1}},\n" +
			"  \"sessions\": {\"cache\": \"${di.$shared.cache}\", \"created\": {\"RFC3339\": \"2024-05-06T07:08:09Z\"}},\n" +
			"  \"payments\": {\"cache\": ${di.$shared.cache}}\n" +
			"}";

	@Rule
	public final TemporaryFolder temporaryFolder = new TemporaryFolder();

	@Test
	public void fromJsonResolvesReferences() throws Exception {
		DIContext ctx = DIContexts.fromJson(JSON);

		assertTrue(ctx.getConfiguration() instanceof MapConfiguration);
		Object sessionsCache = ctx.getConfiguration().lookupNode("sessions.cache");
		Object paymentsCache = ctx.getConfiguration().lookupNode("payments.cache");
		assertEquals(sessionsCache, paymentsCache);
		assertEquals("redis", ((Map<?, ?>) sessionsCache).get("host"));
		assertEquals(ctx.getRawConfiguration().get("sessions"), ctx.getConfiguration().lookupNode("sessions"));
	}

	@Test
	public void fromJsonIntoTypedConfiguration() throws Exception {
		ExecutionContext inner = ExecutionContext.withValue(ExecutionContext.background(), "request", "r1");
		DIContext ctx = DIContexts.fromJson(JSON, AppConfig.class, inner);

		AppConfig config = (AppConfig) ctx.getConfiguration();
		assertNotNull(config);
		assertEquals("redis", config.sessions.cache.host);
		assertEquals(1, config.payments.cache.database);
		assertEquals(Instant.parse("2024-05-06T07:08:09Z"), config.sessions.created);
		assertSame(config.sessions.cache, ctx.getConfiguration().lookupNode("sessions.cache"));
		assertEquals("r1", ctx.getValue("request"));
	}

	@Test
	public void unresolvableReference() {
		try {
			DIContexts.fromJson("{\"a\": \"${di.missing.node}\"}");
			fail();
		} catch (ConfigurationLoadException e) {
			assertTrue(e.getCause() instanceof TemplateResolutionException);
			assertEquals("${di.missing.node}", ((TemplateResolutionException) e.getCause()).getPlaceholder());
		}
	}

	@Test
	public void fromFile() throws IOException, ConfigurationLoadException, ConfigurationLookupException {
		Path file = temporaryFolder.newFile("config.json").toPath();
		Files.write(file, JSON.getBytes(UTF_8));

		DIContext ctx = DIContexts.fromFile(file, AppConfig.class);
		assertEquals("redis", ((AppConfig) ctx.getConfiguration()).payments.cache.host);
		Map<?, ?> cache = (Map<?, ?>) DIContexts.fromFile(file).getConfiguration().lookupNode("payments.cache");
		assertEquals("redis", cache.get("host"));
	}

	@Test(expected = ConfigurationLoadException.class)
	public void missingFile() throws ConfigurationLoadException {
		DIContexts.fromFile(temporaryFolder.getRoot().toPath().resolve("missing.json"));
	}

	@Test(expected = ConfigurationLoadException.class)
	public void unsupportedExtraArgument() throws ConfigurationLoadException {
		DIContexts.fromJson("{}", 42);
	}

	static final class AppConfig implements Configuration {
		Section sessions;
		Section payments;
	}

	static final class Section {
		CacheConfig cache;
		Instant created;
	}

	static final class CacheConfig {
		String host;
		@SerializedName("db")
		int database;
	}
}
