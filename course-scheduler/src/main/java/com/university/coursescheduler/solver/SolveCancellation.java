package com.university.coursescheduler.solver;

/**
 * Caller-held handle for aborting a running pipeline. Once cancelled it stays
 * cancelled: the solve in flight is interrupted and every later solve reports
 * {@link SolveStatus#ABORTED} without running.
 */
public class SolveCancellation {

    private boolean cancelled;
    private Runnable interrupt;

    public static SolveCancellation none() {
        return new SolveCancellation();
    }

    public synchronized void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        if (interrupt != null) {
            interrupt.run();
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers the hook that interrupts the backend's current solve. Runs it
     * immediately if cancellation already happened.
     */
    synchronized void attach(Runnable solverInterrupt) {
        this.interrupt = solverInterrupt;
        if (cancelled) {
            solverInterrupt.run();
        }
    }

    synchronized void detach() {
        this.interrupt = null;
    }
}
