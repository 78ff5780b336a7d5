// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * A finalized Cellframe JSON transaction.
 * <p>
 * Instances are only produced by {@link TransactionItemBuilder#build(long)}, so
 * the text always matches the items and is a complete JSON object.
 *
 * @since 0.1.0
 */
public final class TransactionDocument {
    /** Value of the {@code datum_type} field. */
    public static final String DATUM_TYPE = "tx";

    private final List<TransactionItem> items;
    private final long tsCreated;
    private final String json;

    TransactionDocument(final List<TransactionItem> items, final long tsCreated, final String json) {
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
        this.tsCreated = tsCreated;
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * @return the items in document order
     */
    public List<TransactionItem> items() {
        return items;
    }

    /**
     * @return creation time in Unix seconds
     */
    public long tsCreated() {
        return tsCreated;
    }

    /**
     * @return the exact text submitted to the ledger
     */
    public String json() {
        return json;
    }

    public String datumType() {
        return DATUM_TYPE;
    }

    public int itemCount() {
        return items.size();
    }

    /**
     * @return {@code true} if the last item is a signature
     */
    public boolean isSigned() {
        return !items.isEmpty() && items.get(items.size() - 1) instanceof TransactionItem.Sign;
    }

    public byte[] toBytes() {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransactionDocument)) {
            return false;
        }
        final TransactionDocument other = (TransactionDocument) o;
        return tsCreated == other.tsCreated && json.equals(other.json) && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, tsCreated, json);
    }

    @Override
    public String toString() {
        return json;
    }
}
