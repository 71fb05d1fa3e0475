package com.labelrun.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Closed label set. UNKNOWN is the sentinel for any value the classification service returns outside the
 * whitelist; it never reaches the store or an output file.
 */
public enum Label {
    HINDU("Hindu"),
    CHRISTIAN("Christian"),
    MUSLIM("Muslim"),
    UNKNOWN(null);

    private static final List<Label> WHITELIST = Arrays.stream(values())
            .filter(Label::isValid)
            .toList();

    private final String wireName;

    Label(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isValid() {
        return this != UNKNOWN;
    }

    /**
     * Exact, case-sensitive match on the wire name; anything else is UNKNOWN.
     */
    public static Label fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (Label label : WHITELIST) {
            if (label.wireName.equals(value)) {
                return label;
            }
        }
        return UNKNOWN;
    }

    public static List<Label> whitelist() {
        return WHITELIST;
    }
}
