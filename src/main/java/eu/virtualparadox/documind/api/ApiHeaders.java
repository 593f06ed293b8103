package eu.virtualparadox.documind.api;

import org.apache.commons.lang3.StringUtils;

/**
 * Request headers shared by the REST controllers. Authentication happens upstream; the gateway
 * forwards the authenticated user id in {@link #OWNER_ID}.
 */
public final class ApiHeaders {

    public static final String OWNER_ID = "X-Owner-Id";

    private ApiHeaders() {
        // prevent instantiation
    }

    /**
     * Returns the owner id, rejecting a blank header value.
     *
     * @throws IllegalArgumentException if {@code ownerId} is blank
     */
    public static String requireOwner(final String ownerId) {
        if (StringUtils.isBlank(ownerId)) {
            throw new IllegalArgumentException(OWNER_ID + " header must not be blank");
        }
        return ownerId;
    }
}
