package org.openphc.patientvault.service;

import lombok.Value;

/**
 * A rejected upload row. The reason never contains the rejected value.
 */
@Value
public class RowError {

    int row;
    String reason;

    public String toMessage() {
        return "Row " + row + ": " + reason;
    }
}
