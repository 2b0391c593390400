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

/**
 * The binding syntax of an attribute name: which kind of attribute it
 * declares and the prefix and suffix around the bare name, e.g.
 * {@code [(} and {@code )]} for {@code [(ngModel)]}.
 */
public final class AttributeSyntax {

	public enum Kind {
		TEXT, PROPERTY, EVENT, TWO_WAY, REFERENCE
	}

	private static final AttributeSyntax[] FORMS = {
			new AttributeSyntax(Kind.TWO_WAY, "[(", ")]"),
			new AttributeSyntax(Kind.TWO_WAY, "bindon-", ""),
			new AttributeSyntax(Kind.PROPERTY, "[", "]"),
			new AttributeSyntax(Kind.PROPERTY, "bind-", ""),
			new AttributeSyntax(Kind.EVENT, "(", ")"),
			new AttributeSyntax(Kind.EVENT, "on-", ""),
			new AttributeSyntax(Kind.REFERENCE, "#", ""),
			new AttributeSyntax(Kind.REFERENCE, "ref-", ""),
	};

	private static final AttributeSyntax PLAIN = new AttributeSyntax(Kind.TEXT, "", "");

	private final Kind kind;
	private final String prefix;
	private final String suffix;

	private AttributeSyntax(Kind kind, String prefix, String suffix) {
		this.kind = kind;
		this.prefix = prefix;
		this.suffix = suffix;
	}

	public static AttributeSyntax of(String rawName) {
		for (AttributeSyntax form : FORMS) {
			if (form.matches(rawName)) {
				return form;
			}
		}
		return PLAIN;
	}

	private boolean matches(String rawName) {
		return rawName.length() >= prefix.length() + suffix.length()
				&& rawName.startsWith(prefix)
				&& rawName.endsWith(suffix);
	}

	public Kind getKind() {
		return kind;
	}

	public String getPrefix() {
		return prefix;
	}

	public String getSuffix() {
		return suffix;
	}

	/** {@code [(ngModel)]} gives {@code ngModel}. */
	public String nameOf(String rawName) {
		return rawName.substring(prefix.length(), rawName.length() - suffix.length());
	}

	/** {@code ngModel} gives {@code [(ngModel)]}. */
	public String wrap(String name) {
		return prefix + name + suffix;
	}
}
