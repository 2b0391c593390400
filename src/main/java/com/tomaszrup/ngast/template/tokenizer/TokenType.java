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
package com.tomaszrup.ngast.template.tokenizer;

public enum TokenType {
	/** {@code <name} */
	TAG_OPEN_START,
	/** {@code >} ending a start tag */
	TAG_OPEN_END,
	/** {@code />} */
	TAG_OPEN_END_VOID,
	/** {@code </name>} */
	TAG_CLOSE,
	/** Whitespace between the parts of a start tag. */
	WHITESPACE,
	ATTR_NAME,
	ATTR_EQUALS,
	ATTR_QUOTE,
	ATTR_VALUE,
	TEXT,
	INTERPOLATION_START,
	INTERPOLATION_END,
	COMMENT_START,
	/** Content of a comment. */
	RAW_TEXT,
	COMMENT_END,
	DOC_TYPE,
	EOF;

	/** Readable name for diagnostics, e.g. {@code TagOpenStart}. */
	public String getTypeName() {
		StringBuilder builder = new StringBuilder();
		for (String part : name().split("_")) {
			builder.append(part.charAt(0)).append(part.substring(1).toLowerCase());
		}
		return builder.toString();
	}
}
