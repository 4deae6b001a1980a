package com.catagent.agent;

import com.catagent.auth.CurrentUser;
import com.catagent.providers.ModelInfo;
import com.catagent.providers.ProviderSelection;

import java.util.List;
import java.util.Map;

/**
 * Everything resolved before the model is called: credential, quota check, model and prompt.
 */
public record PreparedChat(
    CurrentUser user,
    ProviderSelection selection,
    ModelInfo model,
    List<Map<String, Object>> messages,
    String conversationId
) {
    public boolean usesOwnKey() {
        return selection.usesOwnKey();
    }
}
