package com.jreinhal.lectern.rag.fallback;

import com.jreinhal.lectern.rag.strategy.Strategy;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one request through the pipeline.
 *
 * <p>Each strategy attempt gets an id from {@link #beginAttempt}. A stage that outlives
 * its timeout keeps running on its worker thread, so transitions and layer updates
 * carrying a superseded attempt id are dropped.</p>
 */
public final class PipelineRun {
    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);
    private final String correlationId;
    private final Consumer<String> layerListener;
    private final List<String> trail = new ArrayList<>();
    private PipelineState state = PipelineState.CLASSIFY;
    private int currentAttempt;

    public PipelineRun(String correlationId, Consumer<String> layerListener) {
        this.correlationId = correlationId;
        this.layerListener = layerListener != null ? layerListener : label -> { };
    }

    public String correlationId() {
        return this.correlationId;
    }

    public synchronized PipelineState state() {
        return this.state;
    }

    public synchronized void advance(PipelineState next) {
        this.move(next);
    }

    public synchronized int beginAttempt(Strategy strategy) {
        this.move(PipelineState.RETRIEVE);
        this.currentAttempt++;
        this.trail.add("attempt " + this.currentAttempt + ": " + strategy);
        return this.currentAttempt;
    }

    /**
     * @return false when {@code attemptId} has been superseded and the transition was dropped
     */
    public synchronized boolean advance(int attemptId, PipelineState next) {
        if (attemptId != this.currentAttempt) {
            log.debug("[{}] Dropping {} from superseded attempt {}", this.correlationId, next, attemptId);
            return false;
        }
        this.move(next);
        return true;
    }

    public synchronized void layer(String label) {
        this.layerListener.accept(label);
    }

    public synchronized void layer(int attemptId, String label) {
        if (attemptId == this.currentAttempt && !this.state.isTerminal()) {
            this.layerListener.accept(label);
        }
    }

    public synchronized void note(String entry) {
        this.trail.add(entry);
    }

    public synchronized String reasoning() {
        return String.join("; ", this.trail);
    }

    private void move(PipelineState next) {
        if (!this.state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal pipeline transition " + this.state + " -> " + next);
        }
        log.debug("[{}] {} -> {}", this.correlationId, this.state, next);
        this.state = next;
    }
}
