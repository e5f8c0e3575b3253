package dev.toolrpc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging protocol traffic in a consistent format so that client and server logs
 * look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private Wire() {
    }

    public static void rx(String peer, Envelope envelope, String json) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX peer={} kind={} id={} method={} json={}",
                peer,
                kind(envelope),
                envelope.id(),
                envelope.method(),
                truncate(json, 200));
        }
    }

    public static void tx(String peer, Envelope envelope, String json) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX peer={} kind={} id={} method={} json={}",
                peer,
                kind(envelope),
                envelope.id(),
                envelope.method(),
                truncate(json, 200));
        }
    }

    private static String kind(Envelope envelope) {
        if (envelope.isRequest()) {
            return "request";
        }
        return envelope.isError() ? "error" : "response";
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
