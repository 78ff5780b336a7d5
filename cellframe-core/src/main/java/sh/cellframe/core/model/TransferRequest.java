// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.model;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;
import sh.cellframe.core.types.Address;
import sh.cellframe.core.types.Amount;

/**
 * Parameters of a single fund transfer, as handed to
 * {@link sh.cellframe.core.tx.TransactionAssembler#assemble(TransferRequest)}.
 * <p>
 * Required fields are {@code utxos}, {@code recipient}, {@code amount} and {@code token};
 * the assembler rejects a request missing any of them. The optional pairs
 * ({@code networkFee}/{@code networkFeeAddress}, {@code changeAddress}/{@code changeAmount})
 * only produce an output when both halves are present.
 * <p>
 * The {@code token} ticker is carried for the caller's bookkeeping; it is never
 * written into the transaction outputs.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * TransferRequest request = TransferRequest.builder()
 *     .utxo(UtxoRef.of(prevHash, 0))
 *     .recipient(Address.of(recipient))
 *     .amount(Amount.of("1.0"))
 *     .networkFee(Amount.of("0.002"), Address.of(collector))
 *     .validatorFee(Amount.of("0.001"))
 *     .change(Address.of(self), Amount.of("3.997"))
 *     .token("CELL")
 *     .build();
 * }</pre>
 *
 * @since 0.1.0
 */
public record TransferRequest(
        @Nullable List<UtxoRef> utxos,
        @Nullable Address recipient,
        @Nullable Amount amount,
        @Nullable Amount networkFee,
        @Nullable Address networkFeeAddress,
        @Nullable Amount validatorFee,
        @Nullable Address changeAddress,
        @Nullable Amount changeAmount,
        @Nullable String token) {

    /** Ticker of the native token; callers pass it explicitly, it is not applied by default. */
    public static final String DEFAULT_TOKEN = "CELL";

    public TransferRequest {
        utxos = utxos == null ? null : List.copyOf(utxos);
    }

    public boolean hasNetworkFee() {
        return networkFee != null && networkFeeAddress != null;
    }

    public boolean hasValidatorFee() {
        return validatorFee != null;
    }

    public boolean hasChange() {
        return changeAddress != null && changeAmount != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder for {@link TransferRequest}. */
    public static final class Builder {
        private List<UtxoRef> utxos;
        private Address recipient;
        private Amount amount;
        private Amount networkFee;
        private Address networkFeeAddress;
        private Amount validatorFee;
        private Address changeAddress;
        private Amount changeAmount;
        private String token;

        private Builder() {
        }

        /**
         * Appends one input; inputs keep the order in which they are added.
         *
         * @param utxo the output to spend
         * @return this builder for chaining
         */
        public Builder utxo(final UtxoRef utxo) {
            if (utxos == null) {
                utxos = new ArrayList<>();
            }
            utxos.add(utxo);
            return this;
        }

        /**
         * Replaces the inputs with the given sequence, keeping its order.
         *
         * @param utxos the outputs to spend, may be empty
         * @return this builder for chaining
         */
        public Builder utxos(final List<UtxoRef> utxos) {
            this.utxos = utxos == null ? null : new ArrayList<>(utxos);
            return this;
        }

        public Builder recipient(final Address recipient) {
            this.recipient = recipient;
            return this;
        }

        public Builder amount(final Amount amount) {
            this.amount = amount;
            return this;
        }

        public Builder networkFee(final Amount fee, final Address collector) {
            this.networkFee = fee;
            this.networkFeeAddress = collector;
            return this;
        }

        public Builder validatorFee(final Amount fee) {
            this.validatorFee = fee;
            return this;
        }

        public Builder change(final Address address, final Amount amount) {
            this.changeAddress = address;
            this.changeAmount = amount;
            return this;
        }

        public Builder token(final String token) {
            this.token = token;
            return this;
        }

        public TransferRequest build() {
            return new TransferRequest(
                    utxos,
                    recipient,
                    amount,
                    networkFee,
                    networkFeeAddress,
                    validatorFee,
                    changeAddress,
                    changeAmount,
                    token);
        }
    }
}
