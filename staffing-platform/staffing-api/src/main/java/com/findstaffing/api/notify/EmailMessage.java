package com.findstaffing.api.notify;

import java.util.Objects;

public record EmailMessage(String to, String subject, String html, String text) {

    public EmailMessage {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(subject, "subject");
    }
}
