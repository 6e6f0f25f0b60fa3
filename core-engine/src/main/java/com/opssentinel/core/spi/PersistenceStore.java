package com.opssentinel.core.spi;

import com.opssentinel.core.model.AnomalyAlert;
import com.opssentinel.core.model.ResponseExecution;

/**
 * Best-effort durable audit of alerts and executions.
 *
 * <p>
 * Callers log and swallow any {@link RuntimeException} thrown here;
 * in-memory state stays authoritative.
 * </p>
 *
 * @since 1.0.0
 */
public interface PersistenceStore {

    void persistAlert(AnomalyAlert alert);

    void persistExecution(ResponseExecution execution);

    /**
     * @return a store that discards every record
     */
    static PersistenceStore noop() {
        return NoopPersistenceStore.INSTANCE;
    }

    /** Store that keeps nothing. */
    final class NoopPersistenceStore implements PersistenceStore {

        static final NoopPersistenceStore INSTANCE = new NoopPersistenceStore();

        private NoopPersistenceStore() {
        }

        @Override
        public void persistAlert(AnomalyAlert alert) {
            // discarded
        }

        @Override
        public void persistExecution(ResponseExecution execution) {
            // discarded
        }
    }
}
