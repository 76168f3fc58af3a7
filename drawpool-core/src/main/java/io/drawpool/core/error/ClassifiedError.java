// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.error;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A raw failure mapped onto the {@link ErrorKind} taxonomy.
 *
 * @param kind            classified kind
 * @param originalMessage raw provider text, kept for diagnostics only
 * @param cause           raw cause, when one was available
 */
public record ClassifiedError(ErrorKind kind, String originalMessage, @Nullable Throwable cause) {

    public ClassifiedError {
        Objects.requireNonNull(kind, "kind");
        originalMessage = originalMessage != null ? originalMessage : "";
    }

    /**
     * The fixed message safe to show to end users.
     */
    public String userMessage() {
        return kind.userMessage();
    }

    @Override
    public String toString() {
        return "ClassifiedError{kind=" + kind + ", code=" + kind.code() + ", originalMessage=" + originalMessage + "}";
    }
}
