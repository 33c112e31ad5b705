/*
 * Copyright (C) 2025 DI Kernel authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.dikernel.json;

import com.google.gson.annotations.SerializedName;
import io.dikernel.util.Ref;
import org.junit.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.singletonMap;
import static org.junit.Assert.*;

public class StructDecoderTest {
	@Test
	public void testDecodeMapIntoObject() throws DecodeException {
		Map<String, Object> from = new HashMap<>();
		from.put("database_url", "postgres://localhost/db");
		from.put("max_connections", 100L);
		from.put("created", singletonMap("RFC3339", "2024-05-01T10:15:30.123456789Z"));

		AppConfig config = StructDecoder.decode(from, AppConfig.class);

		assertEquals("postgres://localhost/db", config.databaseUrl);
		assertEquals(100, config.maxConnections);
		assertEquals(Instant.parse("2024-05-01T10:15:30.123456789Z"), config.created);
	}

	@Test
	public void testDecodeAcceptsPlainTimestampWithOffset() throws DecodeException {
		AppConfig config = StructDecoder.decode(singletonMap("created", "2024-05-01T12:15:30+02:00"), AppConfig.class);
		assertEquals(Instant.parse("2024-05-01T10:15:30Z"), config.created);
	}

	@Test
	public void testToTreeUsesSerializedNamesAndTimeObjects() throws DecodeException {
		AppConfig config = new AppConfig();
		config.databaseUrl = "postgres://localhost/db";
		config.maxConnections = 7;
		config.created = Instant.parse("2024-05-01T10:15:30Z");

		Map<String, Object> tree = StructDecoder.toTree(config);

		assertEquals("postgres://localhost/db", tree.get("database_url"));
		assertEquals(7L, tree.get("max_connections"));
		assertEquals(singletonMap("RFC3339", "2024-05-01T10:15:30Z"), tree.get("created"));
	}

	@Test
	public void testTimeObjectWithoutTimestampFails() {
		try {
			StructDecoder.decode(singletonMap("created", singletonMap("other", "x")), AppConfig.class);
			fail("should've failed");
		} catch (DecodeException e) {
			assertTrue(e.getMessage().contains(AppConfig.class.getName()));
		}
	}

	@Test
	public void testRefIsTransparent() throws DecodeException {
		Holder holder = StructDecoder.decode(singletonMap("nested", singletonMap("database_url", "db")), Holder.class);
		assertEquals("db", holder.nested.get().databaseUrl);
		assertNull(holder.missing);

		holder.missing = new Ref<>();
		Map<String, Object> tree = StructDecoder.toTree(holder);
		assertEquals("db", ((Map<?, ?>) tree.get("nested")).get("database_url"));
		assertTrue(tree.containsKey("missing"));
		assertNull(tree.get("missing"));
	}

	@Test(expected = DecodeException.class)
	public void testScalarCannotBecomeTree() throws DecodeException {
		StructDecoder.toTree("just a string");
	}

	static final class AppConfig {
		@SerializedName("database_url")
		String databaseUrl;
		@SerializedName("max_connections")
		int maxConnections;
		Instant created;
	}

	static final class Holder {
		Ref<AppConfig> nested;
		Ref<AppConfig> missing;
	}
}
