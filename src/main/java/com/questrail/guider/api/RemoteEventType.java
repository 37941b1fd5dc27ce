package com.questrail.guider.api;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Event tags the guiding controller is known to emit in the {@code "Event"}
 * field of its notifications.
 *
 * <p>{@link #UNKNOWN} covers every tag this client does not recognise; such
 * notifications are still delivered, with their original name and payload.</p>
 */
public enum RemoteEventType
{
    VERSION("Version", EventPayload.Version.class),
    APP_STATE("AppState", EventPayload.AppStateChanged.class),
    LOCK_POSITION_SET("LockPositionSet", EventPayload.LockPositionSet.class),
    LOCK_POSITION_LOST("LockPositionLost"),
    LOCK_POSITION_SHIFT_LIMIT_REACHED("LockPositionShiftLimitReached"),
    START_CALIBRATION("StartCalibration"),
    CALIBRATING("Calibrating", EventPayload.Calibrating.class),
    CALIBRATION_COMPLETE("CalibrationComplete", EventPayload.CalibrationComplete.class),
    CALIBRATION_FAILED("CalibrationFailed", EventPayload.CalibrationFailed.class),
    CALIBRATION_DATA_FLIPPED("CalibrationDataFlipped", EventPayload.CalibrationDataFlipped.class),
    STAR_SELECTED("StarSelected", EventPayload.StarSelected.class),
    STAR_LOST("StarLost", EventPayload.StarLost.class),
    LOOPING_EXPOSURES("LoopingExposures", EventPayload.LoopingExposures.class),
    LOOPING_EXPOSURES_STOPPED("LoopingExposuresStopped"),
    START_GUIDING("StartGuiding"),
    GUIDE_STEP("GuideStep", EventPayload.GuideStep.class),
    GUIDING_DITHERED("GuidingDithered", EventPayload.GuidingDithered.class),
    GUIDING_STOPPED("GuidingStopped"),
    PAUSED("Paused"),
    RESUMED("Resumed"),
    SETTLE_BEGIN("SettleBegin"),
    SETTLING("Settling", EventPayload.Settling.class),
    SETTLE_DONE("SettleDone", EventPayload.SettleDone.class),
    GUIDE_PARAM_CHANGE("GuideParamChange", EventPayload.GuideParamChange.class),
    CONFIGURATION_CHANGE("ConfigurationChange"),
    ALERT("Alert", EventPayload.Alert.class),
    UNKNOWN("");

    private static final Map<String, RemoteEventType> BY_WIRE_NAME = Arrays.stream(values())
            .filter(t -> t != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(RemoteEventType::wireName, Function.identity()));

    private final String wireName;
    private final Class<? extends EventPayload> payloadType;

    RemoteEventType(String wireName) {
        this(wireName, null);
    }

    RemoteEventType(String wireName, Class<? extends EventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    /** The tag as it appears on the wire. Empty for {@link #UNKNOWN}. */
    public String wireName() {
        return wireName;
    }

    /** Typed view of this notification's fields, if it has any. */
    public Optional<Class<? extends EventPayload>> payloadType() {
        return Optional.ofNullable(payloadType);
    }

    /**
     * Resolve a wire tag. Never fails: unrecognised tags map to {@link #UNKNOWN}.
     */
    public static RemoteEventType fromWireName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return BY_WIRE_NAME.getOrDefault(name, UNKNOWN);
    }
}
