package com.address.resolution.api;

import com.address.resolution.core.model.DropReason;

import java.util.Objects;

/**
 * An input address that produced no output record.
 *
 * @param index   position of the address in the batch input
 * @param address the address as given
 * @param reason  why it was dropped
 * @param detail  human-readable cause, for diagnostics
 */
public record DroppedAddress(int index, String address, DropReason reason, String detail) {
    public DroppedAddress {
        Objects.requireNonNull(reason, "reason is required");
    }
}
