package com.example.userload.client;

import java.util.Locale;

import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;

/**
 * Formatting helpers for failed calls.
 */
final class GrpcFailures {

    private GrpcFailures() {
    }

    /**
     * Short message kept with a failed result, e.g. {@code RESOURCE_EXHAUSTED: too many attempts}.
     */
    static String describe(Throwable t) {
        Status status = Status.fromThrowable(t);
        if (status.getCode() == Status.Code.UNKNOWN && !(t instanceof StatusRuntimeException)) {
            return formatThrowable(t);
        }
        String description = status.getDescription();
        return description == null ? status.getCode().name() : status.getCode() + ": " + description;
    }

    static void logFailure(Logger log, String prefix, long failureNumber, long cap, String target, Throwable t) {
        if (!(t instanceof StatusRuntimeException e)) {
            log.warn("{} ({}/{}, target={})", prefix, failureNumber, cap, target, t);
            return;
        }
        Status status = e.getStatus();
        Metadata trailers = e.getTrailers();
        log.warn(String.format(Locale.ROOT,
                "%s (%d/%d, target=%s, code=%s, desc=%s, cause=%s, trailersKeys=%s)",
                prefix,
                failureNumber,
                cap,
                target,
                status.getCode(),
                status.getDescription(),
                formatThrowable(e.getCause()),
                trailers == null ? "null" : trailers.keys()));

        Throwable root = rootCause(e);
        if (root != null && root != e && root != e.getCause()) {
            log.warn("Root cause: {}", formatThrowable(root));
        }
    }

    static String formatThrowable(Throwable t) {
        if (t == null) {
            return "null";
        }
        String msg = t.getMessage();
        return t.getClass().getName() + (msg == null ? "" : (": " + msg));
    }

    static Throwable rootCause(Throwable t) {
        if (t == null) {
            return null;
        }
        Throwable cur = t;
        while (cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
        }
        return cur;
    }
}
