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
package com.tomaszrup.lsp.utils;

import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Positions}: comparator ordering, validity checks and
 * conversions between offsets and positions in multi-line text.
 */
class PositionsTests {

	private static final String TEXT = "<div>\n  <span>{{x}}</span>\n</div>";

	// ------------------------------------------------------------------
	// COMPARATOR / valid()
	// ------------------------------------------------------------------

	@Test
	void testComparatorDifferentLines() {
		Position earlier = new Position(1, 0);
		Position later = new Position(5, 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(earlier, later) < 0);
		Assertions.assertTrue(Positions.COMPARATOR.compare(later, earlier) > 0);
	}

	@Test
	void testComparatorSameLineDifferentColumns() {
		Assertions.assertTrue(Positions.COMPARATOR.compare(new Position(3, 2), new Position(3, 10)) < 0);
		Assertions.assertEquals(0, Positions.COMPARATOR.compare(new Position(3, 2), new Position(3, 2)));
	}

	@Test
	void testValidRejectsNegativeColumn() {
		Assertions.assertTrue(Positions.valid(new Position(0, 0)));
		Assertions.assertFalse(Positions.valid(new Position(1, -1)));
	}

	// ------------------------------------------------------------------
	// getOffset()
	// ------------------------------------------------------------------

	@Test
	void testGetOffsetFirstLine() {
		Assertions.assertEquals(3, Positions.getOffset(TEXT, new Position(0, 3)));
	}

	@Test
	void testGetOffsetSecondLine() {
		// "<div>\n" is 6 characters, "  <span>" is 8 more
		Assertions.assertEquals(14, Positions.getOffset(TEXT, new Position(1, 8)));
	}

	@Test
	void testGetOffsetPastLineEndIsInvalid() {
		Assertions.assertEquals(-1, Positions.getOffset(TEXT, new Position(0, 6)));
	}

	@Test
	void testGetOffsetMissingLineIsInvalid() {
		Assertions.assertEquals(-1, Positions.getOffset(TEXT, new Position(7, 0)));
	}

	@Test
	void testGetOffsetNullInputs() {
		Assertions.assertEquals(-1, Positions.getOffset(null, new Position(0, 0)));
		Assertions.assertEquals(-1, Positions.getOffset(TEXT, null));
	}

	// ------------------------------------------------------------------
	// toPosition()
	// ------------------------------------------------------------------

	@Test
	void testToPositionStart() {
		Assertions.assertEquals(new Position(0, 0), Positions.toPosition(TEXT, 0));
	}

	@Test
	void testToPositionAfterNewline() {
		Assertions.assertEquals(new Position(1, 0), Positions.toPosition(TEXT, 6));
		Assertions.assertEquals(new Position(1, 8), Positions.toPosition(TEXT, 14));
	}

	@Test
	void testToPositionAtEndOfText() {
		Assertions.assertEquals(new Position(2, 6), Positions.toPosition(TEXT, TEXT.length()));
	}

	@Test
	void testToPositionIsInverseOfGetOffset() {
		for (int offset = 0; offset <= TEXT.length(); offset++) {
			Assertions.assertEquals(offset, Positions.getOffset(TEXT, Positions.toPosition(TEXT, offset)));
		}
	}

	@Test
	void testToPositionOutOfRange() {
		Assertions.assertThrows(IndexOutOfBoundsException.class, () -> Positions.toPosition(TEXT, -1));
		Assertions.assertThrows(IndexOutOfBoundsException.class, () -> Positions.toPosition(TEXT, TEXT.length() + 1));
	}
}
