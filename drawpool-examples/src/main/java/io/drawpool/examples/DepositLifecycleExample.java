// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.examples;

import io.drawpool.core.DrawpoolDebug;
import io.drawpool.core.chain.ChainProfile;
import io.drawpool.core.chain.ChainProfiles;
import io.drawpool.core.error.ClassifiedError;
import io.drawpool.core.model.ConfirmationResult;
import io.drawpool.core.model.OperationType;
import io.drawpool.core.model.TransactionRequest;
import io.drawpool.core.model.TransactionStatus;
import io.drawpool.core.types.Address;
import io.drawpool.core.types.Hash;
import io.drawpool.core.types.HexData;
import io.drawpool.core.types.Wei;
import io.drawpool.rpc.ChainProvider;
import io.drawpool.rpc.ChainProviders;
import io.drawpool.rpc.DevModeSimulator;
import io.drawpool.rpc.ExecuteOptions;
import io.drawpool.rpc.JsonRpcChainProvider;
import io.drawpool.rpc.SimulatorConfig;
import io.drawpool.rpc.TransactionExecutor;
import io.drawpool.rpc.TransactionListener;
import io.drawpool.rpc.TransactionRecord;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Walks one prize-pool deposit through estimate, submit and confirm.
 *
 * <p>
 * Runs against the dev-mode simulator unless {@code -Ddrawpool.dev-mode=false}
 * is given, in which case it talks to the node at
 * {@code -Ddrawpool.examples.rpc} (default: local Anvil) and needs an unlocked
 * sender account there.
 *
 * <pre>
 * mvn -pl drawpool-examples exec:java -Dexec.mainClass=io.drawpool.examples.DepositLifecycleExample
 * </pre>
 */
public final class DepositLifecycleExample {

    private static final Address POOL = new Address("0x5FbDB2315678afecb367f032d93F642f64180aa3");
    private static final Address SENDER = new Address("0xf39Fd6e51aad88F6F4ce6aB8827279cffFb92266");

    private DepositLifecycleExample() {
    }

    public static void main(final String[] args) throws InterruptedException {
        DrawpoolDebug.setTxLogging(true);
        if (System.getProperty(ChainProviders.DEV_MODE_PROPERTY) == null) {
            System.setProperty(ChainProviders.DEV_MODE_PROPERTY, "true");
        }
        final ChainProfile chain = ChainProfiles.ANVIL_LOCAL;
        final String rpcUrl = System.getProperty("drawpool.examples.rpc", chain.defaultRpcUrl());

        final ChainProvider provider = ChainProviders.fromSystemProperty(
                () -> JsonRpcChainProvider.http(rpcUrl),
                () -> new DevModeSimulator(SimulatorConfig.builder()
                        .confirmationLatency(Duration.ofSeconds(1))
                        .blockTime(Duration.ofMillis(500))
                        .build()));

        final CountDownLatch done = new CountDownLatch(1);
        final TransactionListener listener = new TransactionListener() {
            @Override
            public void onSubmitted(final Hash hash) {
                System.out.println("Submitted: " + chain.explorerTxUrl(hash.value()));
            }

            @Override
            public void onConfirmed(final ConfirmationResult result) {
                System.out.println("Confirmed: " + result.outcome() + " in block " + result.blockNumber());
                done.countDown();
            }

            @Override
            public void onFailed(final ClassifiedError error) {
                System.out.println("Failed [" + error.kind().code() + "]: " + error.userMessage());
                done.countDown();
            }

            @Override
            public void onTimedOut(final Hash hash) {
                System.out.println("No receipt yet for " + hash.value() + ", check status later");
                done.countDown();
            }
        };

        final TransactionRequest deposit = TransactionRequest.builder()
                .from(SENDER)
                .to(POOL)
                .value(Wei.fromEther(new BigDecimal("0.01")).value())
                .data(HexData.EMPTY)
                .operation(OperationType.DEPOSIT)
                .build();

        try (provider; TransactionExecutor executor = new TransactionExecutor(provider)) {
            final TransactionRecord record = executor.execute(
                    deposit,
                    ExecuteOptions.builder().confirmations(2).timeout(Duration.ofSeconds(30)).listener(listener).build());
            System.out.println("Gas profile: " + record.gasProfile().orElseThrow());

            if (!done.await(45, TimeUnit.SECONDS)) {
                System.out.println("Gave up waiting for a terminal state");
            }
            System.out.println("Final record: " + record);
            record.hash().ifPresent(hash -> {
                final TransactionStatus status = executor.getStatus(hash);
                System.out.println("Status query: " + status.phase());
            });
        }
    }
}
