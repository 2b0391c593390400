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

import com.tomaszrup.ngast.template.ast.SpanMode;

/**
 * Immutable settings for lexing templates and looking up positions in them.
 */
public final class TemplateOptions {
    public static final String DEFAULT_INTERPOLATION_START = "{{";
    public static final String DEFAULT_INTERPOLATION_END = "}}";

    public static final TemplateOptions DEFAULTS = new TemplateOptions(
            DEFAULT_INTERPOLATION_START, DEFAULT_INTERPOLATION_END, SpanMode.RENDERED, null);

    private final String interpolationStart;
    private final String interpolationEnd;
    private final SpanMode spanMode;
    private final String logLevel;

    public TemplateOptions(String interpolationStart, String interpolationEnd, SpanMode spanMode, String logLevel) {
        if (interpolationStart == null || interpolationStart.isEmpty()
                || interpolationEnd == null || interpolationEnd.isEmpty()) {
            throw new IllegalArgumentException("Interpolation delimiters must not be empty");
        }
        this.interpolationStart = interpolationStart;
        this.interpolationEnd = interpolationEnd;
        this.spanMode = spanMode != null ? spanMode : SpanMode.RENDERED;
        this.logLevel = logLevel;
    }

    public String getInterpolationStart() {
        return interpolationStart;
    }

    public String getInterpolationEnd() {
        return interpolationEnd;
    }

    public SpanMode getSpanMode() {
        return spanMode;
    }

    /** Requested Logback root level, or {@code null} to leave logging alone. */
    public String getLogLevel() {
        return logLevel;
    }

    public TemplateOptions withSpanMode(SpanMode mode) {
        return new TemplateOptions(interpolationStart, interpolationEnd, mode, logLevel);
    }

    @Override
    public String toString() {
        return "TemplateOptions{interpolation=" + interpolationStart + "..." + interpolationEnd
                + ", spanMode=" + spanMode + ", logLevel=" + logLevel + "}";
    }
}
