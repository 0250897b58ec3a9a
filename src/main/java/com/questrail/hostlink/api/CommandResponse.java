package com.questrail.hostlink.api;

import java.util.Objects;

/**
 * CommandResponse
 * -----------------------------------------------------------------------------
 * The outcome of executing one {@link Command}.
 *
 * <p>Only reliable-origin commands ever have their response delivered; for lossy
 * commands the serializer still produces one, but it is handed to a no-op
 * responder and reported to observability only.</p>
 *
 * @param status  success or error
 * @param result  handler result for {@link Status#SUCCESS}; may be {@code null}
 * @param message error description for {@link Status#ERROR}; {@code null} otherwise
 */
public record CommandResponse(Status status, Object result, String message) {

    public enum Status {
        SUCCESS("success"),
        ERROR("error");

        private final String wireName;

        Status(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Status fromWireName(String wireName) {
            for (Status s : values()) {
                if (s.wireName.equals(wireName)) {
                    return s;
                }
            }
            throw new IllegalArgumentException("Unknown response status: " + wireName);
        }
    }

    public CommandResponse {
        Objects.requireNonNull(status, "status");
        if (status == Status.ERROR) {
            Objects.requireNonNull(message, "message");
        }
    }

    public static CommandResponse success(Object result) {
        return new CommandResponse(Status.SUCCESS, result, null);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(Status.ERROR, null, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
