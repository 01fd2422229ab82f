package fr.lapetina.forwarder.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A batch of serialized transactions forwarded to a single destination.
 * Immutable and thread-safe: the wire bytes are copied on the way in.
 */
public record TransactionBatch(
        List<byte[]> wiredTransactions,
        Instant createdAt
) {
    public TransactionBatch {
        Objects.requireNonNull(wiredTransactions, "Transactions are required");
        List<byte[]> copies = new ArrayList<>(wiredTransactions.size());
        for (byte[] transaction : wiredTransactions) {
            copies.add(Objects.requireNonNull(transaction, "Transaction bytes are required").clone());
        }
        wiredTransactions = List.copyOf(copies);
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Creates a batch stamped with the current time.
     */
    public static TransactionBatch of(List<byte[]> wiredTransactions) {
        return new TransactionBatch(wiredTransactions, null);
    }

    public int size() {
        return wiredTransactions.size();
    }

    @Override
    public String toString() {
        return "TransactionBatch{" +
                "size=" + wiredTransactions.size() +
                ", createdAt=" + createdAt +
                '}';
    }
}
