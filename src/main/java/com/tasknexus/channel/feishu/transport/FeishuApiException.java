package com.tasknexus.channel.feishu.transport;

/**
 * Raised when the Feishu open API answers a request with a non-zero code.
 */
public final class FeishuApiException extends RuntimeException
{
    private final int code;
    private final String requestId;

    public FeishuApiException(int code, String message, String requestId) {
        super("Feishu API error " + code + ": " + message + " (request " + requestId + ")");
        this.code = code;
        this.requestId = requestId;
    }

    public FeishuApiException(String message, Throwable cause) {
        super(message, cause);
        this.code = -1;
        this.requestId = null;
    }

    /**
     * Platform error code, or {@code -1} when the request never produced a response.
     */
    public int code() {
        return code;
    }

    public String requestId() {
        return requestId;
    }
}
