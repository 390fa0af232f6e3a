package io.eventrelay.broker;

/**
 * Why a broker session ended.
 */
public enum DropReason {
    /** The consumer asked for the stop. */
    USER_INITIATED,
    CONNECTION_CLOSED,
    SERVER_ERROR,
    SUBSCRIBER_ERROR,
    NOT_FOUND,
    ACCESS_DENIED,
    MAX_SUBSCRIBERS_REACHED,
    UNKNOWN;

    public boolean isUserInitiated() {
        return this == USER_INITIATED;
    }
}
