package com.catagent.actions.parse;

import java.util.List;

public record ParsedResponse(String displayText, List<ProposedAction> actions) {

    public boolean hasActions() {
        return !actions.isEmpty();
    }
}
