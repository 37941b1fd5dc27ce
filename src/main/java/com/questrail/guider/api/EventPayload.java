package com.questrail.guider.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Typed view of a controller notification's fields.
 *
 * <p>Obtained from {@link GuiderEvent.RemoteEvent#typedPayload()} or
 * {@link GuiderEvent.RemoteEvent#payloadAs(Class)}; the raw JSON stays
 * available on the event. Fields the controller marks optional are boxed and
 * {@code null} when absent. Fields this client does not model are ignored.</p>
 *
 * <p>Notifications that carry no fields of their own ({@code Paused},
 * {@code StartGuiding}, ...) and unknown tags have no typed view.</p>
 */
public sealed interface EventPayload
{
    /** {@code Version}: first message of every session. */
    record Version(@JsonProperty("PHDVersion") String phdVersion,
                   @JsonProperty("PHDSubver") String phdSubversion,
                   @JsonProperty("MsgVersion") Integer messageVersion,
                   @JsonProperty("OverlapSupport") Boolean overlapSupport) implements EventPayload {}

    /** {@code AppState}: the controller's current state, as a wire name. */
    record AppStateChanged(@JsonProperty("State") String state) implements EventPayload {}

    /** {@code LockPositionSet}. */
    record LockPositionSet(@JsonProperty("X") double x,
                           @JsonProperty("Y") double y) implements EventPayload {}

    /** {@code StarSelected}. */
    record StarSelected(@JsonProperty("X") double x,
                        @JsonProperty("Y") double y) implements EventPayload {}

    /** {@code Calibrating}: one calibration step. */
    record Calibrating(@JsonProperty("Mount") String mount,
                       @JsonProperty("dir") String direction,
                       @JsonProperty("dist") double distance,
                       @JsonProperty("dx") double dx,
                       @JsonProperty("dy") double dy,
                       @JsonProperty("pos") List<Double> position,
                       @JsonProperty("step") int step,
                       @JsonProperty("State") String state) implements EventPayload {}

    record CalibrationComplete(@JsonProperty("Mount") String mount) implements EventPayload {}

    record CalibrationFailed(@JsonProperty("Reason") String reason) implements EventPayload {}

    record CalibrationDataFlipped(@JsonProperty("Mount") String mount) implements EventPayload {}

    record LoopingExposures(@JsonProperty("Frame") long frame) implements EventPayload {}

    /**
     * {@code GuideStep}: one guide frame. Distances are in pixels, durations
     * in milliseconds.
     */
    record GuideStep(@JsonProperty("Frame") long frame,
                     @JsonProperty("Time") double time,
                     @JsonProperty("Mount") String mount,
                     @JsonProperty("dx") double dx,
                     @JsonProperty("dy") double dy,
                     @JsonProperty("RADistanceRaw") Double raDistanceRaw,
                     @JsonProperty("DECDistanceRaw") Double decDistanceRaw,
                     @JsonProperty("RADistanceGuide") Double raDistanceGuide,
                     @JsonProperty("DECDistanceGuide") Double decDistanceGuide,
                     @JsonProperty("RADuration") Integer raDuration,
                     @JsonProperty("RADirection") String raDirection,
                     @JsonProperty("DECDuration") Integer decDuration,
                     @JsonProperty("DECDirection") String decDirection,
                     @JsonProperty("StarMass") Double starMass,
                     @JsonProperty("SNR") Double snr,
                     @JsonProperty("HFD") Double hfd,
                     @JsonProperty("AvgDist") Double averageDistance,
                     @JsonProperty("RALimited") Boolean raLimited,
                     @JsonProperty("DecLimited") Boolean decLimited,
                     @JsonProperty("ErrorCode") Integer errorCode) implements EventPayload {}

    record GuidingDithered(@JsonProperty("dx") double dx,
                           @JsonProperty("dy") double dy) implements EventPayload {}

    /** {@code StarLost}: the guide star could not be found in a frame. */
    record StarLost(@JsonProperty("Frame") long frame,
                    @JsonProperty("Time") double time,
                    @JsonProperty("StarMass") double starMass,
                    @JsonProperty("SNR") double snr,
                    @JsonProperty("AvgDist") Double averageDistance,
                    @JsonProperty("ErrorCode") Integer errorCode,
                    @JsonProperty("Status") String status) implements EventPayload {}

    /** {@code Settling}: progress towards a settle target. */
    record Settling(@JsonProperty("Distance") double distance,
                    @JsonProperty("Time") double time,
                    @JsonProperty("SettleTime") double settleTime,
                    @JsonProperty("StarLocked") boolean starLocked) implements EventPayload {}

    /**
     * {@code SettleDone}. {@code status} is 0 on success; {@code error} is set
     * otherwise.
     */
    record SettleDone(@JsonProperty("Status") int status,
                      @JsonProperty("Error") String error) implements EventPayload
    {
        public boolean succeeded() {
            return status == 0;
        }
    }

    /** {@code GuideParamChange}: the value keeps whatever JSON type it has. */
    record GuideParamChange(@JsonProperty("Name") String name,
                            @JsonProperty("Value") JsonNode value) implements EventPayload {}

    /** {@code Alert}: a message the controller shows its user. */
    record Alert(@JsonProperty("Msg") String message,
                 @JsonProperty("Type") String type) implements EventPayload {}
}
