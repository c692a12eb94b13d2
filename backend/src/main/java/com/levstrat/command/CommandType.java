package com.levstrat.command;

import com.levstrat.exception.ValidationException;

/** Wire tags of the five command kinds. */
public enum CommandType {
    SUPPLY(0),
    WITHDRAW(1),
    BORROW(2),
    REPAY(3),
    SWAP(4);

    private final int tag;

    CommandType(int tag) {
        this.tag = tag;
    }

    public int tag() {
        return tag;
    }

    public static CommandType fromTag(int tag) {
        for (CommandType t : values()) {
            if (t.tag == tag) return t;
        }
        throw new ValidationException(ValidationException.UNKNOWN_COMMAND, "unknown command tag " + tag);
    }
}
