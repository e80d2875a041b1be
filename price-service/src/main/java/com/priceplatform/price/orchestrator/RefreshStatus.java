package com.priceplatform.price.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.priceplatform.common.model.RefreshProgress;
import com.priceplatform.common.model.RefreshResult;
import com.priceplatform.common.model.RefreshState;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live status of one refresh run, written by the run itself and by
 * {@link RefreshOrchestrator#cancel(String)}, read by pollers.
 *
 * <p>State moves only forward. Transitions are compare-and-set so a cancel racing
 * the run's completion has exactly one winner; a cancelled run stays cancelled
 * even though its partial results are attached afterwards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefreshStatus {

    private final String  requestId;
    private final Instant startTime;
    private final boolean forceRefresh;

    private final AtomicReference<RefreshState> state = new AtomicReference<>(RefreshState.PENDING);

    private volatile RefreshProgress progress;
    private volatile Instant         endTime;
    private volatile String          error;
    private volatile RefreshResult   results;

    public RefreshStatus(String requestId, int total, boolean forceRefresh, Instant startTime) {
        this.requestId    = requestId;
        this.forceRefresh = forceRefresh;
        this.startTime    = startTime;
        this.progress     = RefreshProgress.initial(total);
    }

    // ── transitions ────────────────────────────────────────────────────────

    boolean markInProgress() {
        return state.compareAndSet(RefreshState.PENDING, RefreshState.IN_PROGRESS);
    }

    boolean cancel(Instant at) {
        if (state.compareAndSet(RefreshState.IN_PROGRESS, RefreshState.CANCELLED)) {
            this.endTime = at;
            return true;
        }
        return false;
    }

    void complete(RefreshResult result, Instant at) {
        this.results  = result;
        this.progress = progress.withCounts(result.success(), result.failed());
        if (state.compareAndSet(RefreshState.IN_PROGRESS, RefreshState.COMPLETED)) {
            this.endTime = at;
        }
    }

    void fail(String message, Instant at) {
        this.error = message;
        RefreshState previous = state.getAndUpdate(s -> s.isActive() ? RefreshState.FAILED : s);
        if (previous.isActive()) {
            this.endTime = at;
        }
    }

    void onSymbol(String symbol)              { this.progress = progress.withCurrentSymbol(symbol); }
    void onBatchComplete(int ok, int failed)  { this.progress = progress.withCounts(ok, failed); }

    // ── accessors ──────────────────────────────────────────────────────────

    public String          getRequestId()    { return requestId; }
    public RefreshState    getStatus()       { return state.get(); }
    public RefreshProgress getProgress()     { return progress; }
    public Instant         getStartTime()    { return startTime; }
    public Instant         getEndTime()      { return endTime; }
    public String          getError()        { return error; }
    public RefreshResult   getResults()      { return results; }
    public boolean         isForceRefresh()  { return forceRefresh; }

    @JsonIgnore
    public boolean isCancelled() {
        return state.get() == RefreshState.CANCELLED;
    }

    @JsonIgnore
    public boolean isActive() {
        return state.get().isActive();
    }
}
