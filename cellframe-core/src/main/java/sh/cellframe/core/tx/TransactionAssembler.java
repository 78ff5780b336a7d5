// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.cellframe.core.DebugLogger;
import sh.cellframe.core.LogFormatter;
import sh.cellframe.core.model.TransferRequest;
import sh.cellframe.core.model.UtxoRef;

/**
 * Turns a {@link TransferRequest} into an unsigned {@link TransactionDraft}.
 * <p>
 * Items are emitted in this order, which the ledger relies on:
 * <ol>
 * <li>one {@code in} per UTXO, in request order</li>
 * <li>the recipient {@code out}</li>
 * <li>the network fee {@code out}, when both fee and collector address are set</li>
 * <li>the validator fee {@code out_cond}, when set</li>
 * <li>the change {@code out}, when both change address and amount are set</li>
 * </ol>
 * An empty UTXO list is accepted; the ledger decides whether such a transaction is valid.
 * <p>
 * Stateless apart from the clock, and safe to share between threads.
 *
 * @since 0.1.0
 */
public final class TransactionAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(TransactionAssembler.class);

    private final Clock clock;

    public TransactionAssembler() {
        this(Clock.systemUTC());
    }

    public TransactionAssembler(final Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Assembles the unsigned transaction.
     *
     * @param request the transfer parameters
     * @return a draft holding the unsigned items and the creation time
     * @throws TxBuilderException        if {@code utxos}, {@code recipient}, {@code amount}
     *                                   or {@code token} is missing
     * @throws BufferAllocationException if the document buffer cannot grow
     */
    public TransactionDraft assemble(final TransferRequest request) {
        validate(request);

        final TransactionItemBuilder builder = new TransactionItemBuilder();
        final List<UtxoRef> utxos = request.utxos();
        for (UtxoRef utxo : utxos) {
            builder.append(TransactionItem.In.from(utxo));
        }
        builder.append(new TransactionItem.Out(request.recipient(), request.amount()));
        if (request.hasNetworkFee()) {
            builder.append(new TransactionItem.Out(request.networkFeeAddress(), request.networkFee()));
        }
        if (request.hasValidatorFee()) {
            builder.append(new TransactionItem.Fee(request.validatorFee()));
        }
        if (request.hasChange()) {
            builder.append(new TransactionItem.Out(request.changeAddress(), request.changeAmount()));
        }

        final long tsCreated = clock.instant().getEpochSecond();
        final int outputs = builder.itemCount() - utxos.size();
        LOG.debug("assembled {} item(s) for token {}", builder.itemCount(), request.token());
        DebugLogger.logTx(LogFormatter.formatTxAssemble(
                utxos.size(), outputs, request.hasValidatorFee(), tsCreated));
        return new TransactionDraft(builder, tsCreated);
    }

    private static void validate(final TransferRequest request) {
        if (request == null) {
            throw new TxBuilderException("transfer request is required");
        }
        if (request.utxos() == null) {
            throw new TxBuilderException("utxos are required");
        }
        if (request.recipient() == null) {
            throw new TxBuilderException("recipient address is required");
        }
        if (request.amount() == null) {
            throw new TxBuilderException("amount is required");
        }
        if (request.token() == null || request.token().isBlank()) {
            throw new TxBuilderException("token is required");
        }
    }
}
