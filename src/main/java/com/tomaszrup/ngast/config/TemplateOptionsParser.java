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

import java.io.Reader;
import java.util.Locale;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.ngast.template.ast.SpanMode;

/**
 * Reads {@link TemplateOptions} from a JSON object such as:
 *
 * <pre>{@code
 * {
 *   "interpolation": ["[[", "]]"],
 *   "spanMode": "degenerate",
 *   "logLevel": "DEBUG"
 * }
 * }</pre>
 *
 * <p>Missing or malformed entries keep their defaults; malformed ones are
 * reported with a warning.</p>
 */
public final class TemplateOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(TemplateOptionsParser.class);

    static final String INTERPOLATION_OPTION = "interpolation";
    static final String SPAN_MODE_OPTION = "spanMode";
    static final String LOG_LEVEL_OPTION = "logLevel";

    /**
     * Parse options and apply the log level, if one is given.
     *
     * @return parsed options, or {@link TemplateOptions#DEFAULTS} if the input
     *         is not a {@link JsonObject}
     */
    public static TemplateOptions parse(Object options) {
        if (!(options instanceof JsonObject)) {
            return TemplateOptions.DEFAULTS;
        }
        JsonObject opts = (JsonObject) options;

        String[] interpolation = parseInterpolationOption(opts);
        SpanMode spanMode = parseSpanModeOption(opts);
        String logLevel = null;
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            logLevel = opts.get(LOG_LEVEL_OPTION).getAsString();
            applyLogLevel(logLevel);
        }

        TemplateOptions result = new TemplateOptions(interpolation[0], interpolation[1], spanMode, logLevel);
        logger.debug("Parsed {}", result);
        return result;
    }

    public static TemplateOptions parse(String json) {
        return parse(parseJson(JsonParser.parseString(json), json));
    }

    public static TemplateOptions parse(Reader reader) {
        return parse(parseJson(JsonParser.parseReader(reader), "<reader>"));
    }

    private static JsonElement parseJson(JsonElement element, String source) {
        if (element == null || !element.isJsonObject()) {
            logger.warn("Template options must be a JSON object, got: {}", source);
        }
        return element;
    }

    private static String[] parseInterpolationOption(JsonObject opts) {
        String[] defaults = {TemplateOptions.DEFAULT_INTERPOLATION_START, TemplateOptions.DEFAULT_INTERPOLATION_END};
        if (!opts.has(INTERPOLATION_OPTION)) {
            return defaults;
        }
        JsonElement value = opts.get(INTERPOLATION_OPTION);
        if (!value.isJsonArray() || value.getAsJsonArray().size() != 2) {
            logger.warn("Option '{}' must be an array of two delimiters, got {}", INTERPOLATION_OPTION, value);
            return defaults;
        }
        JsonArray arr = value.getAsJsonArray();
        String start = arr.get(0).isJsonPrimitive() ? arr.get(0).getAsString() : "";
        String end = arr.get(1).isJsonPrimitive() ? arr.get(1).getAsString() : "";
        if (start.isEmpty() || end.isEmpty()) {
            logger.warn("Interpolation delimiters must be non-empty strings, got {}", value);
            return defaults;
        }
        return new String[] {start, end};
    }

    private static SpanMode parseSpanModeOption(JsonObject opts) {
        if (!opts.has(SPAN_MODE_OPTION) || !opts.get(SPAN_MODE_OPTION).isJsonPrimitive()) {
            return SpanMode.RENDERED;
        }
        String name = opts.get(SPAN_MODE_OPTION).getAsString();
        try {
            return SpanMode.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown span mode '{}', using {}", name, SpanMode.RENDERED);
            return SpanMode.RENDERED;
        }
    }

    /**
     * Set the Logback root logger level from a string value. Accepted values
     * (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE. Invalid values are
     * ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger rootLogger = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(rootLogger instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Logging backend is not Logback, ignoring log level '{}'", levelName);
            return;
        }
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger) rootLogger;
        ch.qos.logback.classic.Level previous = root.getLevel();
        root.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private TemplateOptionsParser() {
        // utility class
    }
}
