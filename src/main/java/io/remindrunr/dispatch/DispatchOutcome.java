package io.remindrunr.dispatch;

/**
 * Result of a single dispatch.
 *
 * @param succeeded whether the side effect completed
 * @param error     failure description, null on success
 */
public record DispatchOutcome(boolean succeeded, String error) {

    public static DispatchOutcome success() {
        return new DispatchOutcome(true, null);
    }

    public static DispatchOutcome failure(String error) {
        return new DispatchOutcome(false, error == null || error.isBlank() ? "Unknown error" : error);
    }
}
