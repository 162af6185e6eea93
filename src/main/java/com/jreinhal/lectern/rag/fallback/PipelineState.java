package com.jreinhal.lectern.rag.fallback;

import java.util.EnumSet;
import java.util.Set;

/**
 * Request-scoped pipeline states. {@link #RESPONDED} and {@link #ERROR_RESPONDED} are
 * terminal. Any live state may move to {@link #ERROR_RESPONDED}, and to {@link #RETRIEVE}
 * when the fallback chain restarts with a weaker strategy.
 */
public enum PipelineState {
    CLASSIFY,
    ROUTE,
    RETRIEVE,
    DECOMPOSE,
    ASSEMBLE,
    GENERATE,
    RESPONDED,
    ERROR_RESPONDED;

    public boolean isTerminal() {
        return this == RESPONDED || this == ERROR_RESPONDED;
    }

    public boolean canMoveTo(PipelineState next) {
        if (this.isTerminal()) {
            return false;
        }
        if (next == ERROR_RESPONDED || (next == RETRIEVE && this != CLASSIFY)) {
            return true;
        }
        return this.successors().contains(next);
    }

    private Set<PipelineState> successors() {
        switch (this) {
            case CLASSIFY:
                return EnumSet.of(ROUTE, RESPONDED);
            case ROUTE:
                return EnumSet.of(RETRIEVE, RESPONDED);
            case RETRIEVE:
                return EnumSet.of(DECOMPOSE, ASSEMBLE, RESPONDED);
            case DECOMPOSE:
                return EnumSet.of(ASSEMBLE, RESPONDED);
            case ASSEMBLE:
                return EnumSet.of(GENERATE);
            case GENERATE:
                return EnumSet.of(RESPONDED);
            default:
                return EnumSet.noneOf(PipelineState.class);
        }
    }
}
