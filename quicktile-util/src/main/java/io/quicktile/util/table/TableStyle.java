package io.quicktile.util.table;

/*
 * Copyright (c) quicktile
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/**
 * Immutable rendering settings for {@link TableFormatter}.
 *
 * @param padChar     fill character used to left-justify header and data cells
 * @param dividerChar fill character of the divider line under the headers
 * @param dataIndent  number of spaces written before every data cell (must be non-negative)
 */
public record TableStyle(char padChar, char dividerChar, int dataIndent) {

    /** Space padding, dashed divider, data cells indented by one. */
    public static final TableStyle DEFAULT = new TableStyle(' ', '-', 1);

    /**
     * Compact constructor with validation.
     */
    public TableStyle {
        if (dataIndent < 0) {
            throw new IllegalArgumentException("Data indent must be non-negative: " + dataIndent);
        }
        if (Character.isISOControl(padChar) || Character.isISOControl(dividerChar)) {
            throw new IllegalArgumentException("Pad and divider characters must be printable");
        }
    }

    public TableStyle withPadChar(char padChar) {
        return new TableStyle(padChar, dividerChar, dataIndent);
    }

    public TableStyle withDividerChar(char dividerChar) {
        return new TableStyle(padChar, dividerChar, dataIndent);
    }

    public TableStyle withDataIndent(int dataIndent) {
        return new TableStyle(padChar, dividerChar, dataIndent);
    }
}
