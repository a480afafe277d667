package com.wildtrack.ats.parser;

import com.wildtrack.errors.WildtrackException;

/**
 * The vendor returned something that cannot be read: XML that is not well-formed, a missing
 * {@code DataSet} wrapper, or a row that fails field validation.  Usually means the vendor
 * changed its protocol, so it is never retried.
 */
public class MalformedResponseException extends WildtrackException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final transient ParseContext context;

    public MalformedResponseException(String message, ParseContext context, Throwable cause) {
        super(message + (cause != null && cause.getMessage() != null ? ", Error: " + cause.getMessage() : ""), cause);
        this.statusCode = 422;
        this.context = context;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ParseContext getContext() {
        return context;
    }
}
