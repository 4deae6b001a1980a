package com.catagent.actions;

public interface ActionHandler {
    /** Performs the mutation and returns a short summary. Failures are thrown. */
    String execute(ActionContext ctx);
}
