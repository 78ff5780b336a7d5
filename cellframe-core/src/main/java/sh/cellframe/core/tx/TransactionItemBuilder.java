// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates transaction items into the JSON text of a Cellframe datum.
 * <p>
 * The builder owns a growable byte buffer that starts as {@code {"items":[} and
 * receives each appended item, comma separated. {@link #build(long)} closes the
 * array, adds {@code "ts_created"} and {@code "datum_type"} and hands the text
 * over as a {@link TransactionDocument}. After that, or after a failed allocation,
 * the builder is spent and every further call throws {@link IllegalStateException}.
 * <p>
 * A {@link TransactionItem.Sign} item must be the last one; appending after it fails.
 * <p>
 * Not thread-safe. One instance per transaction.
 *
 * @since 0.1.0
 */
public final class TransactionItemBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(TransactionItemBuilder.class);

    /** Initial buffer size in bytes. */
    static final int INITIAL_CAPACITY = 4096;

    /** Largest array the VM reliably allocates. */
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private static final byte[] OPEN = "{\"items\":[".getBytes(StandardCharsets.US_ASCII);
    private static final byte COMMA = ',';

    private final int maxCapacity;
    private final List<TransactionItem> items = new ArrayList<>();
    private byte[] buffer;
    private int size;

    public TransactionItemBuilder() {
        this(INITIAL_CAPACITY, MAX_CAPACITY);
    }

    TransactionItemBuilder(final int initialCapacity, final int maxCapacity) {
        if (initialCapacity < OPEN.length || maxCapacity < initialCapacity) {
            throw new IllegalArgumentException(
                    "invalid capacities: initial=" + initialCapacity + ", max=" + maxCapacity);
        }
        this.maxCapacity = maxCapacity;
        this.buffer = new byte[initialCapacity];
        write(OPEN);
    }

    /**
     * Appends one item.
     *
     * @param item the item to append
     * @return this builder for chaining
     * @throws TxBuilderException         if a sign item was already appended
     * @throws BufferAllocationException  if the buffer cannot grow
     * @throws IllegalStateException      if the builder was already built or discarded
     */
    public TransactionItemBuilder append(final TransactionItem item) {
        ensureOpen();
        Objects.requireNonNull(item, "item");
        if (!items.isEmpty() && items.get(items.size() - 1) instanceof TransactionItem.Sign) {
            throw new TxBuilderException("sign item must be the last item, cannot append " + item.type());
        }

        final byte[] bytes = TxJson.serialize(item);
        if (!items.isEmpty()) {
            write(COMMA);
        }
        write(bytes);
        items.add(item);
        return this;
    }

    /**
     * @return the number of items appended so far
     */
    public int itemCount() {
        return items.size();
    }

    /**
     * @return an immutable copy of the items appended so far, in order
     */
    public List<TransactionItem> items() {
        return List.copyOf(items);
    }

    /**
     * @return the number of content bytes currently held
     */
    public int byteLength() {
        return size;
    }

    int capacity() {
        return buffer == null ? 0 : buffer.length;
    }

    /**
     * Returns the text {@link #build(long)} would produce right now, leaving the builder open.
     *
     * @param tsCreated creation time in Unix seconds
     * @return the document text
     */
    public String snapshot(final long tsCreated) {
        ensureOpen();
        return new String(buffer, 0, size, StandardCharsets.UTF_8) + trailer(tsCreated);
    }

    /**
     * Closes the document and transfers its content to the returned value.
     *
     * @param tsCreated creation time in Unix seconds
     * @return the finalized document
     * @throws BufferAllocationException if the buffer cannot grow for the trailer
     * @throws IllegalStateException     if the builder was already built or discarded
     */
    public TransactionDocument build(final long tsCreated) {
        ensureOpen();
        write(trailer(tsCreated).getBytes(StandardCharsets.US_ASCII));
        final TransactionDocument document = new TransactionDocument(
                items, tsCreated, new String(buffer, 0, size, StandardCharsets.UTF_8));
        release();
        return document;
    }

    private static String trailer(final long tsCreated) {
        if (tsCreated < 0) {
            throw new IllegalArgumentException("tsCreated cannot be negative: " + tsCreated);
        }
        return "],\"ts_created\":" + tsCreated + ",\"datum_type\":\"" + TransactionDocument.DATUM_TYPE + "\"}";
    }

    private void write(final byte b) {
        ensureCapacity(1);
        buffer[size++] = b;
    }

    private void write(final byte[] bytes) {
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, size, bytes.length);
        size += bytes.length;
    }

    private void ensureCapacity(final int extra) {
        final long required = (long) size + extra;
        if (required <= buffer.length) {
            return;
        }
        if (required > maxCapacity) {
            release();
            throw new BufferAllocationException(
                    "transaction document would exceed " + maxCapacity + " bytes", required);
        }
        final long grown = Math.min(Math.max(buffer.length * 2L, required), maxCapacity);
        try {
            buffer = Arrays.copyOf(buffer, (int) grown);
        } catch (OutOfMemoryError e) {
            release();
            throw new BufferAllocationException("cannot grow transaction buffer to " + grown + " bytes", grown, e);
        }
        LOG.debug("transaction buffer grown to {} bytes", grown);
    }

    private void release() {
        buffer = null;
        size = 0;
    }

    private void ensureOpen() {
        if (buffer == null) {
            throw new IllegalStateException("builder already built or discarded");
        }
    }
}
