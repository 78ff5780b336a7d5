// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.RawValue;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.cellframe.core.DebugLogger;
import sh.cellframe.core.LogFormatter;
import sh.cellframe.core.chain.CellframeNetworks;
import sh.cellframe.core.error.RpcDecodingException;
import sh.cellframe.core.error.RpcException;
import sh.cellframe.core.tx.TransactionDocument;
import sh.cellframe.core.types.Address;
import sh.cellframe.core.types.Hash;
import sh.cellframe.rpc.internal.RpcUtils;

/**
 * Typed access to the Cellframe public RPC.
 * <p>
 * Every operation builds one {@link RpcRequest}, hands it to the {@link RpcTransport}
 * and decodes the reply with {@link RpcResponseDecoder}. The result schema is
 * command-specific and returned as-is. Request ids start at 1 and increase per call.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * CellframeRpcClient rpc = CellframeRpcClient.create();
 * RpcResponse balance = rpc.getBalance(CellframeNetworks.BACKBONE, address, "CELL");
 * }</pre>
 *
 * @since 0.1.0
 */
public final class CellframeRpcClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(CellframeRpcClient.class);

    static final String METHOD_TX_HISTORY = "tx_history";
    static final String METHOD_BLOCK = "block";
    static final String METHOD_WALLET = "wallet";
    static final String METHOD_TX_CREATE_JSON = "tx_create_json";
    static final String SUBCOMMAND_DUMP = "dump";
    static final String SUBCOMMAND_INFO = "info";
    static final String HASH_FIELD = "hash";

    private final RpcTransport transport;
    private final AtomicLong ids = new AtomicLong(1L);

    public CellframeRpcClient(final RpcTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * @return a client for the public endpoint with default timeouts
     */
    public static CellframeRpcClient create() {
        return create(CellframeNetworks.DEFAULT_RPC_URL);
    }

    public static CellframeRpcClient create(final String url) {
        return new CellframeRpcClient(RpcTransport.http(url));
    }

    /**
     * Runs an arbitrary command.
     *
     * @param method     the command
     * @param subcommand the sub-command, {@code null} for none
     * @param arguments  the arguments, {@code null} for none
     * @return the decoded reply
     * @throws RpcException         if the exchange fails
     * @throws RpcDecodingException if the reply is not a JSON object
     */
    public RpcResponse call(final String method, final @Nullable String subcommand, final @Nullable JsonNode arguments) {
        return call(RpcRequest.of(method, subcommand, arguments, ids.getAndIncrement()));
    }

    RpcResponse call(final RpcRequest request) {
        final byte[] body = transport.submit(request);
        return RpcResponseDecoder.decode(body);
    }

    /**
     * Looks up a transaction by hash ({@code tx_history}).
     *
     * @param net    network name, for example {@code Backbone}
     * @param txHash the datum hash
     * @return the decoded reply
     */
    public RpcResponse getTx(final String net, final String txHash) {
        final ObjectNode args = RpcUtils.newObject();
        args.put("net", RpcUtils.requireText(net, "net"));
        args.put("tx", RpcUtils.requireText(txHash, "txHash"));
        return call(METHOD_TX_HISTORY, null, args);
    }

    public RpcResponse getTx(final String net, final Hash txHash) {
        return getTx(net, Objects.requireNonNull(txHash, "txHash").value());
    }

    /**
     * Dumps a block by number ({@code block dump}).
     *
     * @param net      network name
     * @param blockNum block number, non-negative; sent as a decimal string
     * @return the decoded reply
     */
    public RpcResponse getBlock(final String net, final long blockNum) {
        if (blockNum < 0) {
            throw new IllegalArgumentException("blockNum cannot be negative: " + blockNum);
        }
        final ObjectNode args = RpcUtils.newObject();
        args.put("net", RpcUtils.requireText(net, "net"));
        args.put("num", Long.toString(blockNum));
        return call(METHOD_BLOCK, SUBCOMMAND_DUMP, args);
    }

    /**
     * Reads a wallet balance ({@code wallet info}).
     *
     * @param net   network name
     * @param addr  wallet address
     * @param token token ticker, for example {@code CELL}
     * @return the decoded reply
     */
    public RpcResponse getBalance(final String net, final String addr, final String token) {
        final ObjectNode args = RpcUtils.newObject();
        args.put("net", RpcUtils.requireText(net, "net"));
        args.put("addr", RpcUtils.requireText(addr, "addr"));
        args.put("token", RpcUtils.requireText(token, "token"));
        return call(METHOD_WALLET, SUBCOMMAND_INFO, args);
    }

    public RpcResponse getBalance(final String net, final Address addr, final String token) {
        return getBalance(net, Objects.requireNonNull(addr, "addr").value(), token);
    }

    /**
     * Lists the transactions touching an address ({@code tx_history}).
     */
    public RpcResponse getTxHistory(final String net, final String addr) {
        final ObjectNode args = RpcUtils.newObject();
        args.put("net", RpcUtils.requireText(net, "net"));
        args.put("addr", RpcUtils.requireText(addr, "addr"));
        return call(METHOD_TX_HISTORY, null, args);
    }

    /**
     * Submits a finalized transaction ({@code tx_create_json}).
     * <p>
     * The document text is embedded verbatim as {@code tx_obj}, so the node receives
     * exactly the bytes that were signed.
     *
     * @param net      network name
     * @param chain    chain name, usually {@code main}
     * @param document the signed document
     * @return the reply and the datum hash when the node reported one
     */
    public SubmitResult submitTransaction(final String net, final String chain, final TransactionDocument document) {
        Objects.requireNonNull(document, "document");
        final ObjectNode args = RpcUtils.newObject();
        args.put("net", RpcUtils.requireText(net, "net"));
        args.put("chain", RpcUtils.requireText(chain, "chain"));
        args.putRawValue("tx_obj", new RawValue(document.json()));

        DebugLogger.logTx(LogFormatter.formatTxSubmit(net, chain, document.itemCount(), document.toBytes().length));
        final long start = System.nanoTime();
        final RpcResponse response = call(METHOD_TX_CREATE_JSON, null, args);
        final String hash = response.findText(HASH_FIELD);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        if (hash == null) {
            LOG.warn("tx_create_json reply carried no hash (net={}, chain={})", net, chain);
        }
        DebugLogger.logTx(LogFormatter.formatTxHash(hash, durationMicros));
        return new SubmitResult(response, hash);
    }

    @Override
    public void close() {
        transport.close();
    }
}
