// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.rpc;

import io.drawpool.core.error.ClassifiedError;
import io.drawpool.core.model.ConfirmationResult;
import io.drawpool.core.types.Hash;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingListener implements TransactionListener {

    final List<String> events = new CopyOnWriteArrayList<>();
    final CompletableFuture<Hash> submitted = new CompletableFuture<>();
    final CompletableFuture<ConfirmationResult> confirmed = new CompletableFuture<>();
    final CompletableFuture<ClassifiedError> failed = new CompletableFuture<>();
    final CompletableFuture<Hash> timedOut = new CompletableFuture<>();

    @Override
    public void onSubmitted(final Hash hash) {
        events.add("submitted");
        submitted.complete(hash);
    }

    @Override
    public void onConfirmed(final ConfirmationResult result) {
        events.add("confirmed");
        confirmed.complete(result);
    }

    @Override
    public void onFailed(final ClassifiedError error) {
        events.add("failed");
        failed.complete(error);
    }

    @Override
    public void onTimedOut(final Hash hash) {
        events.add("timedOut");
        timedOut.complete(hash);
    }
}
