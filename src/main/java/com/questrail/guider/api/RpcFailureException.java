package com.questrail.guider.api;

/**
 * The controller answered a call with a JSON-RPC error object.
 *
 * <p>This is an application-level failure reported by the remote side, not a
 * transport problem; the session stays healthy.</p>
 */
public final class RpcFailureException extends GuiderException
{
    private final int code;
    private final String rpcMessage;

    public RpcFailureException(int code, String rpcMessage) {
        super("RPC error: " + code + " - " + rpcMessage);
        this.code = code;
        this.rpcMessage = rpcMessage;
    }

    public int code() {
        return code;
    }

    public String rpcMessage() {
        return rpcMessage;
    }
}
