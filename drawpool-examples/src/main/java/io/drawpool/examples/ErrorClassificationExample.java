// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.examples;

import io.drawpool.core.error.ClassifiedError;
import io.drawpool.core.error.ErrorClassifier;
import java.util.List;

/**
 * Prints how typical wallet and node error messages are classified and what
 * the user would be shown.
 */
public final class ErrorClassificationExample {

    private ErrorClassificationExample() {
    }

    public static void main(final String[] args) {
        final List<String> samples = List.of(
                "insufficient funds for gas * price + value",
                "max fee per gas less than block base fee: transaction underpriced",
                "nonce too low: next nonce 7, tx nonce 5",
                "replacement transaction underpriced",
                "network request failed",
                "User rejected the request.",
                "execution reverted");
        for (String sample : samples) {
            final ClassifiedError error = ErrorClassifier.classify(sample);
            System.out.printf("%-70s -> %-20s %s%n", sample, error.kind(), error.userMessage());
        }
    }
}
