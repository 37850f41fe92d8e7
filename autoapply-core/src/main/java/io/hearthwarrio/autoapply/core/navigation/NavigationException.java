package io.hearthwarrio.autoapply.core.navigation;

/**
 * Terminal failure of a page: no actionable control left, or no progress after every fallback.
 */
public class NavigationException extends RuntimeException {

    public NavigationException(String message) {
        super(message);
    }

    public NavigationException(String message, Throwable cause) {
        super(message, cause);
    }
}
