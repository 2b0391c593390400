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
package com.tomaszrup.ngast.config;

import java.io.StringReader;
import java.util.Locale;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;

import com.tomaszrup.ngast.template.ast.SpanMode;

class TemplateOptionsParserTests {

	@Test
	void testNonObjectGivesDefaults() {
		Assertions.assertSame(TemplateOptions.DEFAULTS, TemplateOptionsParser.parse((Object) null));
		Assertions.assertSame(TemplateOptions.DEFAULTS, TemplateOptionsParser.parse("[1, 2]"));
	}

	@Test
	void testEmptyObjectGivesDefaultValues() {
		TemplateOptions options = TemplateOptionsParser.parse(new JsonObject());
		Assertions.assertEquals("{{", options.getInterpolationStart());
		Assertions.assertEquals("}}", options.getInterpolationEnd());
		Assertions.assertEquals(SpanMode.RENDERED, options.getSpanMode());
		Assertions.assertNull(options.getLogLevel());
	}

	@Test
	void testCustomInterpolation() {
		TemplateOptions options = TemplateOptionsParser.parse("{\"interpolation\": [\"[[\", \"]]\"]}");
		Assertions.assertEquals("[[", options.getInterpolationStart());
		Assertions.assertEquals("]]", options.getInterpolationEnd());
	}

	@Test
	void testMalformedInterpolationKeepsDefaults() {
		TemplateOptions options = TemplateOptionsParser.parse("{\"interpolation\": [\"[[\"]}");
		Assertions.assertEquals("{{", options.getInterpolationStart());
		options = TemplateOptionsParser.parse("{\"interpolation\": [\"\", \"]]\"]}");
		Assertions.assertEquals("}}", options.getInterpolationEnd());
	}

	@Test
	void testSpanModeIsCaseInsensitive() {
		TemplateOptions options = TemplateOptionsParser.parse(new StringReader("{\"spanMode\": \"degenerate\"}"));
		Assertions.assertEquals(SpanMode.DEGENERATE, options.getSpanMode());
	}

	@Test
	void testSpanModeIgnoresDefaultLocale() {
		Locale previous = Locale.getDefault();
		try {
			Locale.setDefault(new Locale("tr", "TR"));
			TemplateOptions options = TemplateOptionsParser.parse("{\"spanMode\": \"degenerate\"}");
			Assertions.assertEquals(SpanMode.DEGENERATE, options.getSpanMode());
		} finally {
			Locale.setDefault(previous);
		}
	}

	@Test
	void testUnknownSpanModeFallsBackToRendered() {
		TemplateOptions options = TemplateOptionsParser.parse("{\"spanMode\": \"sideways\"}");
		Assertions.assertEquals(SpanMode.RENDERED, options.getSpanMode());
	}

	@Test
	void testLogLevelIsAppliedToLogback() {
		ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
				LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		ch.qos.logback.classic.Level previous = root.getLevel();
		try {
			TemplateOptions options = TemplateOptionsParser.parse("{\"logLevel\": \"ERROR\"}");
			Assertions.assertEquals("ERROR", options.getLogLevel());
			Assertions.assertEquals(ch.qos.logback.classic.Level.ERROR, root.getLevel());
		} finally {
			root.setLevel(previous);
		}
	}

	@Test
	void testUnknownLogLevelLeavesLevelAlone() {
		ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
				LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		ch.qos.logback.classic.Level previous = root.getLevel();
		TemplateOptionsParser.parse("{\"logLevel\": \"LOUD\"}");
		Assertions.assertEquals(previous, root.getLevel());
	}

	@Test
	void testEmptyDelimitersAreRejectedByOptions() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new TemplateOptions("", "}}", SpanMode.RENDERED, null));
	}
}
