// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.rpc;

import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a transaction submission.
 *
 * @param response the decoded reply
 * @param hash     the datum hash reported by the node, or {@code null} if the reply carried none
 */
public record SubmitResult(RpcResponse response, @Nullable String hash) {

    public SubmitResult {
        Objects.requireNonNull(response, "response");
    }

    public boolean hasHash() {
        return hash != null;
    }

    public Optional<String> hashIfPresent() {
        return Optional.ofNullable(hash);
    }
}
