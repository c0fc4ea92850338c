package com.herzen.ink.runtime;

/** A rejected playback call. The runtime is left exactly as it was before the call. */
public class StoryRuntimeException extends RuntimeException {
    private final RuntimeErrorCode code;

    public StoryRuntimeException(RuntimeErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public StoryRuntimeException(RuntimeErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public RuntimeErrorCode getCode() {
        return code;
    }
}
