package com.address.resolution.api;

import com.address.resolution.core.model.DropReason;
import com.address.resolution.core.model.OutputRecord;

import java.util.List;

/**
 * Result of resolving a batch of addresses.
 *
 * @param inputCount number of addresses submitted
 * @param records    one record per resolved address, in input order
 * @param dropped    the addresses that were left out, in input order
 */
public record BatchResult(
        int inputCount,
        List<OutputRecord> records,
        List<DroppedAddress> dropped
) {
    public BatchResult {
        records = records != null ? List.copyOf(records) : List.of();
        dropped = dropped != null ? List.copyOf(dropped) : List.of();
    }

    public int resolvedCount() {
        return records.size();
    }

    public int droppedCount() {
        return dropped.size();
    }

    public long droppedCount(DropReason reason) {
        return dropped.stream().filter(d -> d.reason() == reason).count();
    }

    @Override
    public String toString() {
        return "BatchResult{input=" + inputCount +
                ", resolved=" + records.size() +
                ", dropped=" + dropped.size() + '}';
    }
}
