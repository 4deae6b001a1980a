package com.catagent.actions;

import java.util.List;
import java.util.Optional;

public record ActionDefinition(
    String id,
    String name,
    String description,
    ActionCategory category,
    RiskLevel riskLevel,
    boolean mandatoryConfirmation,
    List<ActionParameter> parameters,
    String entityType,
    EntityOperation operation,
    String valueParameter,
    boolean enabled
) {
    public Optional<ActionParameter> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public boolean hasValueParameter() {
        return valueParameter != null;
    }
}
