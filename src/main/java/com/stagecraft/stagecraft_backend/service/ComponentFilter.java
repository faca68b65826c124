package com.stagecraft.stagecraft_backend.service;

/**
 * Optional filters for the component list. Null or blank fields do not filter.
 * {@code hasOutput} accepts "true" or "false"; anything else is ignored.
 */
public record ComponentFilter(String stage, String language, String outputType, String hasOutput) {

    public static ComponentFilter none() {
        return new ComponentFilter(null, null, null, null);
    }
}
