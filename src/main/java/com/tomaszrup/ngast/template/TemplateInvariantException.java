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
 * Signals a broken construction invariant of a template tree: a node missing
 * from its parent's children, a required token that is not there, an
 * attribute of unknown kind, or an "OrThrow" query without a match. These are
 * defects in the tree, never conditions a caller is expected to recover from.
 */
public class TemplateInvariantException extends IllegalStateException {
	private static final long serialVersionUID = 1L;

	public TemplateInvariantException(String message) {
		super(message);
	}
}
