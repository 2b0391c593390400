////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.ngast.template;

import com.tomaszrup.ngast.location.LocationSpan;

/**
 * Thrown by the lexer, parser and tree builder when the template source
 * cannot be turned into a tree.
 */
public class TemplateParseException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final transient LocationSpan locationSpan;

	public TemplateParseException(String message, LocationSpan locationSpan) {
		super(message + " (" + locationSpan.printLong() + ")");
		this.locationSpan = locationSpan;
	}

	public LocationSpan getLocationSpan() {
		return locationSpan;
	}
}
