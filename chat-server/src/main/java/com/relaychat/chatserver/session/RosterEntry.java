package com.relaychat.chatserver.session;

public record RosterEntry(String username, String address) {

    /**
     * {@code username(address)} as carried by {@code ULIST} frames.
     */
    public String encode() {
        return username + "(" + address + ")";
    }
}
