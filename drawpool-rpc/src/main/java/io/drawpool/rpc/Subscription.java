// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

/**
 * Represents an active subscription to a real-time event stream.
 */
public interface Subscription {
    /**
     * Returns the unique identifier for this subscription.
     */
    String id();

    /**
     * Unsubscribes from the event stream. Calling it more than once is a no-op.
     */
    void unsubscribe();
}
