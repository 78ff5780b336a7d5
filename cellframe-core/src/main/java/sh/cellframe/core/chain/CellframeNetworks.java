// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.chain;

/**
 * Well-known names and endpoints of the Cellframe public network.
 */
public final class CellframeNetworks {

    /** Public JSON-RPC endpoint. */
    public static final String DEFAULT_RPC_URL = "http://rpc.cellframe.net/connect";

    /** Main network. */
    public static final String BACKBONE = "Backbone";

    /** KelVPN network. */
    public static final String KELVPN = "KelVPN";

    /** Default chain within a network. */
    public static final String DEFAULT_CHAIN = "main";

    /** Native token ticker; network and validator fees are paid in it. */
    public static final String NATIVE_TOKEN = "CELL";

    private CellframeNetworks() {
    }
}
