package com.catagent.actions;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryActionRecordStore implements ActionRecordStore {

    private final ConcurrentHashMap<String, ActionExecutionRecord> records = new ConcurrentHashMap<>();

    @Override
    public void insert(ActionExecutionRecord record) {
        if (records.putIfAbsent(record.id(), record) != null) {
            throw new IllegalStateException("Duplicate record: " + record.id());
        }
    }

    @Override
    public boolean transition(ActionExecutionRecord updated, ActionStatus expected) {
        var result = records.computeIfPresent(updated.id(),
            (id, current) -> current.status() == expected ? updated : current);
        return result == updated;
    }

    @Override
    public Optional<ActionExecutionRecord> find(String userId, String recordId) {
        return Optional.ofNullable(records.get(recordId)).filter(r -> r.userId().equals(userId));
    }

    @Override
    public List<ActionExecutionRecord> listPending(String userId) {
        return records.values().stream()
            .filter(r -> r.userId().equals(userId) && r.status() == ActionStatus.PENDING_CONFIRMATION)
            .sorted(Comparator.comparing(ActionExecutionRecord::createdAt).reversed())
            .toList();
    }

    @Override
    public List<ActionExecutionRecord> history(String userId, HistoryFilter filter) {
        return records.values().stream()
            .filter(r -> r.userId().equals(userId) && filter.matches(r))
            .sorted(Comparator.comparing(ActionExecutionRecord::createdAt).reversed())
            .limit(filter.limit())
            .toList();
    }
}
