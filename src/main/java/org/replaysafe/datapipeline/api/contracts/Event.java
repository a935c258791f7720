package org.replaysafe.datapipeline.api.contracts;

/**
 * A raw event as validated at the ingestion boundary. Identity fields are kept exactly
 * as they arrived; canonicalization happens in the key deriver.
 *
 * @param partitionId    Partition of the event log the event was read from.
 * @param offset         Offset inside the partition; together with the partition it defines arrival order.
 * @param principalId    Identity field {@code principal_id}.
 * @param eventType      Identity field {@code event_type}.
 * @param eventTimestamp Identity field {@code event_timestamp} as epoch milliseconds or ISO-8601 text.
 * @param sequence       Optional explicit sequence number, {@code null} if absent.
 * @param payload        Payload serialized as compact JSON, never {@code null}.
 */
public record Event(
        int partitionId,
        long offset,
        String principalId,
        String eventType,
        String eventTimestamp,
        Long sequence,
        String payload
) {
}
