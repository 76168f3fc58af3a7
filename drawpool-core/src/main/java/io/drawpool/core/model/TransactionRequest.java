// SPDX-License-Identifier: MIT OR Apache-2.0
package io.drawpool.core.model;

import io.drawpool.core.types.Address;
import io.drawpool.core.types.HexData;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Immutable description of a transaction the caller wants submitted.
 *
 * <p>
 * The record deliberately accepts incomplete input (missing sender or target,
 * negative value): completeness is checked by the executor before any network
 * call so that bad input surfaces as a validation failure rather than a
 * construction error deep in caller code.
 *
 * @param from          the connected wallet address, or {@code null} when no
 *                      wallet is connected
 * @param to            the target contract or account
 * @param value         native value to transfer, in wei
 * @param data          call data, never {@code null} ({@link HexData#EMPTY}
 *                      when absent)
 * @param operation     operation tag selecting the fallback gas profile
 * @param correlationId opaque caller-supplied identifier carried through
 *                      records and logs
 */
public record TransactionRequest(
        @Nullable Address from,
        @Nullable Address to,
        BigInteger value,
        HexData data,
        @Nullable OperationType operation,
        String correlationId) {

    public TransactionRequest {
        value = value != null ? value : BigInteger.ZERO;
        data = data != null ? data : HexData.EMPTY;
        Objects.requireNonNull(correlationId, "correlationId");
    }

    public Optional<Address> fromOpt() {
        return Optional.ofNullable(from);
    }

    public Optional<Address> toOpt() {
        return Optional.ofNullable(to);
    }

    public boolean hasData() {
        return !data.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder; a random correlation id is assigned when none is given.
     */
    public static final class Builder {
        private Address from;
        private Address to;
        private BigInteger value = BigInteger.ZERO;
        private HexData data = HexData.EMPTY;
        private OperationType operation;
        private String correlationId;

        private Builder() {}

        public Builder from(final Address from) {
            this.from = from;
            return this;
        }

        public Builder to(final Address to) {
            this.to = to;
            return this;
        }

        public Builder value(final BigInteger value) {
            this.value = value;
            return this;
        }

        public Builder data(final HexData data) {
            this.data = data;
            return this;
        }

        public Builder operation(final OperationType operation) {
            this.operation = operation;
            return this;
        }

        public Builder correlationId(final String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public TransactionRequest build() {
            final String id = correlationId != null ? correlationId : UUID.randomUUID().toString();
            return new TransactionRequest(from, to, value, data, operation, id);
        }
    }
}
