package io.relaypipes.writer;

import io.relaypipes.PipesException;

public class ChannelOpenException extends PipesException {

    public ChannelOpenException(String message) {
        super(message);
    }

    public ChannelOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
