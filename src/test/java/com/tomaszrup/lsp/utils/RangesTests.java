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
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link Ranges}: containment checks and conversion of offset
 * pairs into ranges.
 */
class RangesTests {

	@Test
	void testContainsPositionAtStart() {
		Range range = new Range(new Position(1, 5), new Position(3, 10));
		Assertions.assertTrue(Ranges.contains(range, new Position(1, 5)));
	}

	@Test
	void testContainsPositionAtEnd() {
		Range range = new Range(new Position(1, 5), new Position(3, 10));
		Assertions.assertTrue(Ranges.contains(range, new Position(3, 10)));
	}

	@Test
	void testContainsPositionBeforeRange() {
		Range range = new Range(new Position(1, 5), new Position(3, 10));
		Assertions.assertFalse(Ranges.contains(range, new Position(1, 3)));
	}

	@Test
	void testContainsPositionAfterRange() {
		Range range = new Range(new Position(1, 5), new Position(1, 10));
		Assertions.assertFalse(Ranges.contains(range, new Position(1, 12)));
	}

	@Test
	void testToRangeSingleLine() {
		Range range = Ranges.toRange("<div></div>", 1, 4);
		Assertions.assertEquals(new Position(0, 1), range.getStart());
		Assertions.assertEquals(new Position(0, 4), range.getEnd());
	}

	@Test
	void testToRangeAcrossLines() {
		Range range = Ranges.toRange("<p>\nhello\n</p>", 2, 10);
		Assertions.assertEquals(new Position(0, 2), range.getStart());
		Assertions.assertEquals(new Position(2, 0), range.getEnd());
	}
}
