package org.operaton.nostrpub.relay;

/**
 * Callbacks of one relay socket. Messages of one socket arrive in order, one at a time.
 */
public interface RelayListener {

    void onMessage(String text);

    void onClosed(int statusCode, String reason);

    void onError(Throwable error);
}
