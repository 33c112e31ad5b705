package io.dikernel.di.config;

import io.dikernel.di.config.ComplexConfig.ChargebeeConfig;
import io.dikernel.di.config.ComplexConfig.RedisConfig;
import io.dikernel.di.error.ConfigurationLookupException;
import io.dikernel.di.error.ConfigurationLookupException.Reason;
import io.dikernel.json.GsonAdapters;
import io.dikernel.util.Ref;
import org.junit.Before;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static io.dikernel.di.error.ConfigurationLookupException.Reason.*;
import static java.util.Arrays.asList;
import static java.util.Collections.singletonMap;
import static org.junit.Assert.*;

public final class ConfigurationNodesTest {
	private ComplexConfig config;

	@Before
	public void setUp() {
		config = GsonAdapters.GSON.fromJson(ComplexConfig.JSON, ComplexConfig.class);
	}

	@Test
	public void emptyPathReturnsRoot() throws ConfigurationLookupException {
		assertSame(config, ConfigurationNodes.lookup(config, ""));
		assertNull(ConfigurationNodes.lookup(null, ""));
	}

	@Test
	public void fieldByName() throws ConfigurationLookupException {
		assertEquals("qux", ConfigurationNodes.lookup(config, "singleton.cache.user"));
		assertEquals(2, ConfigurationNodes.lookup(config, "singleton.cache.db"));

		RedisConfig cache = (RedisConfig) ConfigurationNodes.lookup(config, "singleton.cache");
		assertEquals("https://redis-staging.example.com:6379", cache.host);
	}

	@Test
	public void fieldBySerializedName() throws ConfigurationLookupException {
		assertEquals("not-singleton", ConfigurationNodes.lookup(config, "payment_business_layer.cache.user"));
		assertEquals("not-singleton", ConfigurationNodes.lookup(config, "paymentBusinessLayer.cache.user"));
		assertEquals("123123abd", ConfigurationNodes.lookup(config, "payment_business_layer.chargebee.private_key"));
		assertEquals("123123abd", ConfigurationNodes.lookup(config, "payment_business_layer.chargebee.privateKeyPem"));
	}

	@Test
	public void refIsDereferencedOnTheWayAndReturnedAtTheEnd() throws ConfigurationLookupException {
		assertEquals("admin@company.com", ConfigurationNodes.lookup(config, "payment_business_layer.chargebee.user"));

		Object chargebee = ConfigurationNodes.lookup(config, "payment_business_layer.chargebee");
		assertTrue(chargebee instanceof Ref);
		assertEquals("admin1234", ((ChargebeeConfig) ((Ref<?>) chargebee).get()).password);
	}

	@Test
	public void nullInPath() {
		config.singleton = null;
		assertFailure(config, "singleton.cache", NIL_IN_PATH);

		config.paymentBusinessLayer.chargebee = new Ref<>();
		assertFailure(config, "payment_business_layer.chargebee.user", NIL_IN_PATH);
	}

	@Test
	public void scalarIsNotNavigable() {
		assertFailure(config, "singleton.cache.user.length", NOT_NAVIGABLE);
		assertFailure(config, "singleton.cache.db.value", NOT_NAVIGABLE);
		assertFailure(singletonMap("list", asList(1, 2)), "list.0", NOT_NAVIGABLE);
	}

	@Test
	public void unknownField() {
		assertFailure(config, "singleton.database", FIELD_NOT_FOUND);
		assertFailure(config, "singleton.", FIELD_NOT_FOUND);
	}

	@Test
	public void maps() throws ConfigurationLookupException {
		Map<String, Object> inner = new HashMap<>();
		inner.put("host", "h");
		inner.put("port", null);
		Map<String, Object> tree = singletonMap("cache", inner);

		assertEquals("h", ConfigurationNodes.lookup(tree, "cache.host"));
		assertNull(ConfigurationNodes.lookup(tree, "cache.port"));
		assertFailure(tree, "cache.port.number", NIL_IN_PATH);
		assertFailure(tree, "cache.user", FIELD_NOT_FOUND);
	}

	private static void assertFailure(Object root, String path, Reason reason) {
		try {
			ConfigurationNodes.lookup(root, path);
			fail("Lookup of '" + path + "' should have failed");
		} catch (ConfigurationLookupException e) {
			assertEquals(reason, e.getReason());
			assertEquals(path, e.getPath());
		}
	}
}
