package com.catagent.actions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.catagent.actions.ActionCategory.COMMUNICATION;
import static com.catagent.actions.ActionCategory.CONTEXT;
import static com.catagent.actions.ActionCategory.ENTITY_MANAGEMENT;
import static com.catagent.actions.ActionCategory.ORGANIZATION;
import static com.catagent.actions.ActionCategory.PAYMENTS;
import static com.catagent.actions.ActionParameter.Type.BOOLEAN;
import static com.catagent.actions.ActionParameter.Type.ENTITY_ID;
import static com.catagent.actions.ActionParameter.Type.NUMBER;
import static com.catagent.actions.ActionParameter.Type.SATS;
import static com.catagent.actions.ActionParameter.Type.STRING;
import static com.catagent.actions.ActionParameter.Type.USER_ID;
import static com.catagent.actions.ActionParameter.optional;
import static com.catagent.actions.ActionParameter.required;
import static com.catagent.actions.EntityOperation.CREATE;
import static com.catagent.actions.EntityOperation.PUBLISH;
import static com.catagent.actions.EntityOperation.UPDATE;
import static com.catagent.actions.RiskLevel.HIGH;
import static com.catagent.actions.RiskLevel.LOW;
import static com.catagent.actions.RiskLevel.MEDIUM;

/**
 * Process-wide, immutable registry of everything the assistant may do. High-risk actions
 * always need an explicit confirmation, whatever the user's grant says.
 */
public class ActionCatalog {

    private final Map<String, ActionDefinition> actions = new LinkedHashMap<>();

    public ActionCatalog() {
        this(defaultActions());
    }

    public ActionCatalog(List<ActionDefinition> definitions) {
        for (var def : definitions) {
            if (actions.putIfAbsent(def.id(), def) != null) {
                throw new IllegalArgumentException("Duplicate action: " + def.id());
            }
        }
    }

    public Optional<ActionDefinition> find(String actionId) {
        return Optional.ofNullable(actionId).map(actions::get);
    }

    public List<ActionDefinition> all() {
        return List.copyOf(actions.values());
    }

    public List<ActionDefinition> enabled() {
        return actions.values().stream().filter(ActionDefinition::enabled).toList();
    }

    public List<ActionDefinition> byCategory(ActionCategory category) {
        return actions.values().stream()
            .filter(a -> a.category() == category && a.enabled())
            .toList();
    }

    private static ActionDefinition define(String id, String name, String description, ActionCategory category,
                                           RiskLevel risk, String entityType, EntityOperation operation,
                                           String valueParameter, List<ActionParameter> parameters) {
        return new ActionDefinition(id, name, description, category, risk, risk == HIGH, parameters,
            entityType, operation, valueParameter, true);
    }

    private static List<ActionDefinition> defaultActions() {
        var publish = optional("publish", BOOLEAN, "Publish immediately", false);
        return List.of(
            define("create_product", "Create Product", "Create a new product listing for sale",
                ENTITY_MANAGEMENT, MEDIUM, "product", CREATE, null, List.of(
                    required("title", STRING, "Product title"),
                    optional("description", STRING, "Product description"),
                    required("price_sats", SATS, "Price in sats"),
                    optional("category", STRING, "Product category"),
                    publish)),
            define("create_service", "Create Service", "Create a new service offering",
                ENTITY_MANAGEMENT, MEDIUM, "service", CREATE, null, List.of(
                    required("title", STRING, "Service title"),
                    optional("description", STRING, "Service description"),
                    optional("hourly_rate_sats", SATS, "Hourly rate in sats"),
                    optional("fixed_price_sats", SATS, "Fixed price in sats"),
                    optional("duration_minutes", NUMBER, "Service duration"),
                    publish)),
            define("create_project", "Create Project", "Create a crowdfunding project with a funding goal",
                ENTITY_MANAGEMENT, MEDIUM, "project", CREATE, null, List.of(
                    required("title", STRING, "Project title"),
                    optional("description", STRING, "Project description"),
                    required("goal_sats", SATS, "Funding goal in sats"),
                    optional("category", STRING, "Project category"),
                    publish)),
            define("create_cause", "Create Cause", "Create an ongoing cause for supporters",
                ENTITY_MANAGEMENT, MEDIUM, "cause", CREATE, null, List.of(
                    required("title", STRING, "Cause title"),
                    optional("description", STRING, "Cause description"),
                    optional("category", STRING, "Cause category"),
                    publish)),
            define("create_event", "Create Event", "Create an event or meetup",
                ENTITY_MANAGEMENT, MEDIUM, "event", CREATE, null, List.of(
                    required("title", STRING, "Event title"),
                    optional("description", STRING, "Event description"),
                    required("start_date", STRING, "Event start date/time"),
                    required("location", STRING, "Event location"),
                    publish)),
            define("update_entity", "Update Entity", "Update an existing product, service, project, cause, or event",
                ENTITY_MANAGEMENT, MEDIUM, null, UPDATE, null, List.of(
                    required("entity_type", STRING, "Type of entity"),
                    required("entity_id", ENTITY_ID, "Entity ID to update"),
                    required("updates", STRING, "Fields to update (JSON)"))),
            define("publish_entity", "Publish Entity", "Make a draft entity live and visible",
                ENTITY_MANAGEMENT, MEDIUM, null, PUBLISH, null, List.of(
                    required("entity_type", STRING, "Type of entity"),
                    required("entity_id", ENTITY_ID, "Entity ID to publish"))),

            define("post_to_timeline", "Post to Timeline", "Create a public post on your timeline",
                COMMUNICATION, MEDIUM, "post", CREATE, null, List.of(
                    required("content", STRING, "Post content"),
                    optional("entity_id", ENTITY_ID, "Entity to link/promote"))),
            define("send_message", "Send Message", "Send a private message to another user",
                COMMUNICATION, HIGH, "message", CREATE, null, List.of(
                    required("recipient_id", USER_ID, "User to message"),
                    required("content", STRING, "Message content"))),
            define("reply_to_message", "Reply to Message", "Reply to a message in an existing conversation",
                COMMUNICATION, MEDIUM, "message", CREATE, null, List.of(
                    required("conversation_id", STRING, "Conversation ID"),
                    required("content", STRING, "Reply content"))),

            define("send_payment", "Send Payment", "Send Bitcoin to another user or lightning address",
                PAYMENTS, HIGH, "payment", CREATE, "amount_sats", List.of(
                    required("amount_sats", SATS, "Amount in sats"),
                    required("recipient", STRING, "Username or lightning address"),
                    optional("memo", STRING, "Payment memo"))),
            define("fund_project", "Fund Project", "Contribute Bitcoin to a project",
                PAYMENTS, HIGH, "contribution", CREATE, "amount_sats", List.of(
                    required("project_id", ENTITY_ID, "Project to fund"),
                    required("amount_sats", SATS, "Amount in sats"),
                    optional("message", STRING, "Support message"))),

            define("create_organization", "Create Organization", "Create a new organization or group",
                ORGANIZATION, MEDIUM, "organization", CREATE, null, List.of(
                    required("name", STRING, "Organization name"),
                    optional("description", STRING, "Description"),
                    optional("type", STRING, "Organization type"))),
            define("invite_to_organization", "Invite to Organization", "Invite a user to join your organization",
                ORGANIZATION, MEDIUM, "organization_member", CREATE, null, List.of(
                    required("organization_id", ENTITY_ID, "Organization ID"),
                    required("user_id", USER_ID, "User to invite"),
                    optional("role", STRING, "Role in organization", "member"))),

            define("add_context", "Add Context", "Add new context document for My Cat to know about",
                CONTEXT, LOW, "document", CREATE, null, List.of(
                    required("title", STRING, "Document title"),
                    required("content", STRING, "Document content"),
                    optional("document_type", STRING, "Type of document", "notes"))),
            new ActionDefinition("set_reminder", "Set Reminder", "Set a reminder for yourself",
                CONTEXT, LOW, false, List.of(
                    required("message", STRING, "Reminder message"),
                    required("when", STRING, "When to remind")),
                "reminder", CREATE, null, false)
        );
    }
}
