package com.syncmirror.protocol;

/**
 * Transmission priority of an outbound message.
 *
 * All HIGH messages leave the queue before any NORMAL, and all NORMAL before any
 * LOW. Priority is local to this client and is not written to the wire.
 */
public enum Priority {
    HIGH,
    NORMAL,
    LOW
}
