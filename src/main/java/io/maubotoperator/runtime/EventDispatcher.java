package io.maubotoperator.runtime;

import io.maubotoperator.action.AccountActionHandler;
import io.maubotoperator.action.ActionResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Routes hook and action names to their handlers through two fixed tables.
 */
public final class EventDispatcher {
    public static final List<String> HOOKS = List.of(
            "install",
            "upgrade-charm",
            "config-changed",
            "maubot-pebble-ready",
            "postgresql-relation-joined",
            "postgresql-relation-changed",
            "postgresql-relation-departed",
            "postgresql-relation-broken",
            "database-created",
            "endpoints-changed",
            "ingress-ready",
            "ingress-revoked",
            "matrix-auth-relation-changed",
            "matrix-auth-relation-departed",
            "matrix-auth-request-processed",
            "logging-relation-changed",
            "logging-relation-departed",
            "logging-endpoint-changed"
    );

    private final Map<String, Function<String, ReconcileOutcome>> hooks;
    private final Map<String, Function<Map<String, String>, ActionResult>> actions;

    public EventDispatcher(Reconciler reconciler, AccountActionHandler actionHandler) {
        Map<String, Function<String, ReconcileOutcome>> hookTable = new LinkedHashMap<>();
        for (String hook : HOOKS) {
            hookTable.put(hook, reconciler::reconcile);
        }
        Map<String, Function<Map<String, String>, ActionResult>> actionTable = new LinkedHashMap<>();
        actionTable.put(AccountActionHandler.CREATE_ADMIN, params -> actionHandler.createAdmin(params.get("name")));
        actionTable.put(AccountActionHandler.REGISTER_CLIENT_ACCOUNT, params -> actionHandler.registerClientAccount(
                params.get("admin-name"),
                params.get("admin-password"),
                params.get("account-name")
        ));
        this.hooks = Collections.unmodifiableMap(hookTable);
        this.actions = Collections.unmodifiableMap(actionTable);
    }

    public ReconcileOutcome dispatchHook(String hook) {
        Function<String, ReconcileOutcome> handler = hooks.get(normalize(hook));
        if (handler == null) {
            throw new IllegalArgumentException("Unknown hook: " + hook);
        }
        return handler.apply(normalize(hook));
    }

    public ActionResult dispatchAction(String action, Map<String, String> params) {
        Function<Map<String, String>, ActionResult> handler = actions.get(normalize(action));
        if (handler == null) {
            throw new IllegalArgumentException("Unknown action: " + action);
        }
        return handler.apply(params == null ? Map.of() : params);
    }

    public Set<String> hookNames() {
        return hooks.keySet();
    }

    public Set<String> actionNames() {
        return actions.keySet();
    }

    private static String normalize(String raw) {
        return raw == null ? "" : raw.trim().replace('_', '-');
    }
}
