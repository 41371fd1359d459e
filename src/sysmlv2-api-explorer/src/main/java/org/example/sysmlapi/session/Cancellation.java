package org.example.sysmlapi.session;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for long operations. Checked between
 * iterations only: requests already issued still complete.
 */
public class Cancellation {

    public static final Cancellation NONE = new Cancellation() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("NONE cannot be cancelled");
        }
    };

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
