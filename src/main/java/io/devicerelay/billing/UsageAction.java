package io.devicerelay.billing;

import java.util.Locale;

public enum UsageAction {
    COMMAND,
    REFUND,
    COMPENSATION;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
