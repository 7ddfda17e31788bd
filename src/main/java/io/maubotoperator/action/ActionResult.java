package io.maubotoperator.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ActionResult(
        String action,
        boolean success,
        Map<String, String> results,
        ActionFailure failure,
        String error
) {
    public ActionResult {
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public static ActionResult ok(String action, Map<String, String> results) {
        return new ActionResult(action, true, results, null, null);
    }

    public static ActionResult fail(String action, ActionFailure failure, String error) {
        return new ActionResult(action, false, Map.of(), failure, error);
    }

    /**
     * Result map as handed back to the invoker; failures carry only the {@code error} key.
     */
    public Map<String, String> output() {
        Map<String, String> out = new LinkedHashMap<>(results);
        if (!success) {
            out.put("error", error == null ? "" : error);
        }
        return out;
    }
}
