package com.catagent.actions;

import java.util.List;
import java.util.Optional;

public interface ActionRecordStore {

    void insert(ActionExecutionRecord record);

    /**
     * Replaces the stored record only if its current status equals {@code expected}.
     * Returns false when another caller already moved it.
     */
    boolean transition(ActionExecutionRecord updated, ActionStatus expected);

    Optional<ActionExecutionRecord> find(String userId, String recordId);

    List<ActionExecutionRecord> listPending(String userId);

    List<ActionExecutionRecord> history(String userId, HistoryFilter filter);
}
