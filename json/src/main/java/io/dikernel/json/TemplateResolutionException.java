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

import org.jetbrains.annotations.Nullable;

public class TemplateResolutionException extends Exception {
	@Nullable
	private final String placeholder;

	public TemplateResolutionException(String message) {
		this(message, null, null);
	}

	public TemplateResolutionException(String message, @Nullable Throwable cause) {
		this(message, null, cause);
	}

	private TemplateResolutionException(String message, @Nullable String placeholder, @Nullable Throwable cause) {
		super(message, cause);
		this.placeholder = placeholder;
	}

	public static TemplateResolutionException unresolved(String placeholder, String message) {
		return new TemplateResolutionException(message, placeholder, null);
	}

	/**
	 * The {@code ${di.<path>}} text that could not be resolved, if the failure concerns a single placeholder.
	 */
	@Nullable
	public String getPlaceholder() {
		return placeholder;
	}
}
