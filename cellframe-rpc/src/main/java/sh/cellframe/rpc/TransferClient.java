// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import java.util.Objects;

import sh.cellframe.core.crypto.TransactionSigner;
import sh.cellframe.core.model.TransferRequest;
import sh.cellframe.core.tx.TransactionAssembler;
import sh.cellframe.core.tx.TransactionDocument;
import sh.cellframe.rpc.internal.RpcUtils;

/**
 * Runs a complete transfer: assemble, sign, submit, decode.
 * <p>
 * Everything happens on the caller thread. The document is finalized before any
 * network traffic, so an assembly or signing failure never reaches the node. No
 * step is retried.
 *
 * <pre>{@code
 * TransferClient client = new TransferClient(new TransactionAssembler(), CellframeRpcClient.create());
 * SubmitResult result = client.send(request, walletSigner, CellframeNetworks.BACKBONE, CellframeNetworks.DEFAULT_CHAIN);
 * }</pre>
 */
public final class TransferClient {
    private final TransactionAssembler assembler;
    private final CellframeRpcClient rpc;

    public TransferClient(final TransactionAssembler assembler, final CellframeRpcClient rpc) {
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.rpc = Objects.requireNonNull(rpc, "rpc");
    }

    /**
     * @param request the transfer parameters
     * @param signer  the wallet signer
     * @param net     network name
     * @param chain   chain name
     * @return the submission outcome
     * @throws sh.cellframe.core.tx.TxBuilderException          if the request is incomplete
     * @throws sh.cellframe.core.tx.BufferAllocationException   if the document cannot be built
     * @throws sh.cellframe.core.error.RpcException             if submission fails
     * @throws sh.cellframe.core.error.RpcDecodingException     if the reply is not a JSON object
     */
    public SubmitResult send(
            final TransferRequest request, final TransactionSigner signer, final String net, final String chain) {
        RpcUtils.requireText(net, "net");
        RpcUtils.requireText(chain, "chain");
        Objects.requireNonNull(signer, "signer");

        final TransactionDocument document = assembler.assemble(request).sign(signer);
        return rpc.submitTransaction(net, chain, document);
    }
}
