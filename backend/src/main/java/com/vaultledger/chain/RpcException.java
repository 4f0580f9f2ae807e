package com.vaultledger.chain;

/**
 * Thrown when an RPC call fails (HTTP or JSON-RPC error).
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * True if the error is transient or rate-limit related and the same request may be sent again, possibly to
     * another endpoint.
     */
    public static boolean isTransient(Throwable e) {
        if (e == null) return false;
        String msg = e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("limit exceeded")
                || msg.contains("503") || msg.contains("502") || msg.contains("504")
                || msg.contains("connection refused") || msg.contains("failed to resolve")
                || msg.contains("temporary") || msg.contains("please retry")
                || msg.contains("-32005");
    }

    /**
     * True if the node rejected a transaction because of its nonce; the transaction was not accepted.
     */
    public static boolean isNonceConflict(Throwable e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("nonce too low")
                || msg.contains("nonce has already been used")
                || msg.contains("replacement transaction underpriced")
                || msg.contains("invalid nonce");
    }

    /**
     * True if the node already holds this exact transaction; the earlier broadcast was accepted.
     */
    public static boolean isAlreadyKnown(Throwable e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase();
        return msg.contains("already known")
                || msg.contains("known transaction")
                || msg.contains("already imported");
    }

    /**
     * True if a send failed in a way that leaves its outcome unknown: the node may have accepted the transaction
     * and only the response was lost.
     */
    public static boolean isAmbiguousSend(Throwable e) {
        if (isTransient(e)) return true;
        String msg = e != null && e.getMessage() != null ? e.getMessage().toLowerCase() : "";
        return msg.contains("timeout") || msg.contains("timed out") || msg.contains("connection reset");
    }
}
