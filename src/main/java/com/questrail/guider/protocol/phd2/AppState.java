package com.questrail.guider.protocol.phd2;

import java.util.Optional;

/**
 * Application state reported by the controller, both by {@code get_app_state}
 * and by {@code AppState} notifications.
 */
public enum AppState
{
    STOPPED("Stopped"),
    SELECTED("Selected"),
    CALIBRATING("Calibrating"),
    GUIDING("Guiding"),
    LOST_LOCK("LostLock"),
    PAUSED("Paused"),
    LOOPING("Looping");

    private final String wireName;

    AppState(String wireName)
    {
        this.wireName = wireName;
    }

    public String wireName()
    {
        return wireName;
    }

    public static Optional<AppState> fromWireName(String name)
    {
        for (AppState s : values()) {
            if (s.wireName.equals(name)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
