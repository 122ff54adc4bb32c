package io.quicktile.util;

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

/// Raised when something outside our control, such as the display server connection,
/// fails to initialize.
///
/// The message reported by {@link #getMessage()} carries a fixed annotation so that users
/// reading a log or a terminal can tell the failure is environmental. The unannotated
/// text is available from {@link #getDetail()}.
public class ExternalInitException extends RuntimeException {

    /// Appended to every message produced by this exception.
    public static final String OUTSIDE_CAUSE_NOTE = "(The cause of this error lies outside of QuickTile)";

    /// Creates a new ExternalInitException with the specified message.
    /// @param message The error message
    public ExternalInitException(String message) {
        super(message);
    }

    /// Creates a new ExternalInitException with the specified message and cause.
    /// @param message The error message
    /// @param cause The underlying failure
    public ExternalInitException(String message, Throwable cause) {
        super(message, cause);
    }

    /// Creates a new ExternalInitException taking its message from the cause.
    /// @param cause The underlying failure
    public ExternalInitException(Throwable cause) {
        super(cause);
    }

    /// Gets the message without the outside-cause annotation.
    /// @return The unannotated message, or null if none was given
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return getDetail() + "\n\t" + OUTSIDE_CAUSE_NOTE;
    }
}
