package com.funnelscope.service.core.funnel.engine;

public class FunnelCancelledException extends IllegalStateException {
    private final long actorsProcessed;

    public FunnelCancelledException(String reason, long actorsProcessed) {
        super("Funnel computation cancelled after " + actorsProcessed + " actors: " + reason);
        this.actorsProcessed = actorsProcessed;
    }

    public long actorsProcessed() {
        return actorsProcessed;
    }
}
