package com.relaychat.chatserver.broker;

/**
 * Per-broadcast delivery tally. Failed recipients have already been handed to teardown.
 */
public record DeliveryReport(int delivered, int failed) {
    public boolean complete() {
        return failed == 0;
    }
}
