package com.funnelscope.service.core.config;

/** A breakdown attribution that has no defined meaning for the funnel it is combined with. */
public class UnsupportedFunnelSourceException extends IllegalArgumentException {
    private final String attribution;

    public UnsupportedFunnelSourceException(String attribution, String message) {
        super(message);
        this.attribution = attribution;
    }

    public String attribution() {
        return attribution;
    }
}
