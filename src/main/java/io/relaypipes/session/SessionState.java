package io.relaypipes.session;

public enum SessionState {
    OPENED,
    CLOSED
}
