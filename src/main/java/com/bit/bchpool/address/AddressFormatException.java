package com.bit.bchpool.address;

import com.bit.bchpool.exception.ErrorType;
import com.bit.bchpool.exception.PoolException;

/**
 * 地址解码失败，reason 指明失败原因
 */
public class AddressFormatException extends PoolException {

    public enum Reason {
        BAD_CHECKSUM,
        BAD_LENGTH,
        UNKNOWN_PREFIX,
        UNKNOWN_VERSION,
        BAD_CHARACTER,
        MIXED_CASE
    }

    private final Reason reason;

    public AddressFormatException(Reason reason, String message) {
        super(ErrorType.ADDRESS_FORMAT_INVALID, reason + " " + message);
        this.reason = reason;
    }

    public AddressFormatException(Reason reason, String message, Throwable cause) {
        super(ErrorType.ADDRESS_FORMAT_INVALID, reason + " " + message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
