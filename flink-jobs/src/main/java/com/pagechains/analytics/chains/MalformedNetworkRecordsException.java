package com.pagechains.analytics.chains;

/**
 * Raised when a page load's request records violate a structural precondition, so no forest
 * can be built without guessing.
 */
public class MalformedNetworkRecordsException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        MISSING_REQUEST_ID("missing_request_id"),
        DUPLICATE_REQUEST_ID("duplicate_request_id"),
        ROOT_NOT_FOUND("root_not_found"),
        ROOT_HAS_INITIATOR("root_has_initiator"),
        REDIRECT_CYCLE("redirect_cycle"),
        REDIRECT_DESTINATION_CLAIMED("redirect_destination_claimed");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    private final Reason reason;

    public MalformedNetworkRecordsException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
