package com.bridgestats.alert;

import java.util.Objects;

/**
 * Formatted alert. {@link #contentKey()} identifies duplicates.
 */
public record AlertMessage(String title, String body) {

    public AlertMessage {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
    }

    public String contentKey() {
        return title + "\n" + body;
    }
}
