// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core.tx;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * Compact item serialization shared by the builder and the items themselves.
 */
final class TxJson {
    private static final JsonFactory FACTORY = new JsonFactory();

    private TxJson() {
    }

    static byte[] serialize(final TransactionItem item) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        try (JsonGenerator generator = FACTORY.createGenerator(out, JsonEncoding.UTF8)) {
            item.writeTo(generator);
        } catch (IOException e) {
            throw new TxBuilderException("Failed to serialize " + item.type() + " item", e);
        }
        return out.toByteArray();
    }
}
