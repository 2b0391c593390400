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
package com.tomaszrup.ngast.location;

import org.eclipse.lsp4j.Position;

import com.tomaszrup.lsp.utils.Positions;

/**
 * The text buffer of one template file. Every {@link LocationSpan} of the
 * file points into the same instance, so a replacement made through one span
 * is immediately visible through all the others.
 */
public class SourceFile {
	private final String name;
	private final StringBuilder text;

	public SourceFile(String name, String text) {
		this.name = name;
		this.text = new StringBuilder(text);
	}

	public String getName() {
		return name;
	}

	public String getText() {
		return text.toString();
	}

	public int getLength() {
		return text.length();
	}

	public String getText(int start, int end) {
		return text.substring(start, end);
	}

	void replace(int start, int end, String newText) {
		text.replace(start, end, newText);
	}

	public Position getPosition(int offset) {
		return Positions.toPosition(text.toString(), offset);
	}

	@Override
	public String toString() {
		return name;
	}
}
