package com.catagent.shared.error;

import java.util.Map;

public class ActionNotPendingException extends CatAgentException {
    public ActionNotPendingException(String recordId) {
        super(ErrorCode.ACTION_NOT_PENDING, "Pending action not found or already processed",
                Map.of("id", recordId));
    }
}
