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
package com.tomaszrup.ngast.template.ast;

/**
 * How {@link HtmlAst#spanOf(Node, SpanMode)} measures nodes other than
 * elements.
 */
public enum SpanMode {
	/** Leaves cover their rendered text, so they can be the innermost match of a lookup. */
	RENDERED,
	/**
	 * Leaves are zero-width at their start offset and a childless element
	 * without an end tag is zero-width too. Position lookups then never end on
	 * a leaf.
	 */
	DEGENERATE
}
