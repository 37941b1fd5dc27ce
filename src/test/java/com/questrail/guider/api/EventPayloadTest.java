package com.questrail.guider.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventPayloadTest
 * -----------------------------------------------------------------------------
 * Binding of notification lines, as the controller writes them, onto the
 * typed payload records.
 */
class EventPayloadTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static GuiderEvent.RemoteEvent event(String line) throws Exception {
        JsonNode payload = MAPPER.readTree(line);
        String name = payload.get("Event").asText();
        return new GuiderEvent.RemoteEvent(Instant.EPOCH, RemoteEventType.fromWireName(name), name, payload);
    }

    @Test
    void guideStepBindsEveryReportedField() throws Exception {
        GuiderEvent.RemoteEvent e = event("{\"Event\":\"GuideStep\",\"Timestamp\":1351285911.616,\"Host\":\"ML\",\"Inst\":1,"
                + "\"Frame\":117,\"Time\":31.416,\"Mount\":\"Mount\",\"dx\":-0.144,\"dy\":0.088,"
                + "\"RADistanceRaw\":-0.125,\"DECDistanceRaw\":0.103,\"RADistanceGuide\":-0.1,\"DECDistanceGuide\":0.09,"
                + "\"RADuration\":84,\"RADirection\":\"West\",\"DECDuration\":0,\"DECDirection\":\"North\","
                + "\"StarMass\":14054,\"SNR\":58.46,\"HFD\":2.31,\"AvgDist\":0.17,\"RALimited\":true}");

        EventPayload.GuideStep step = e.payloadAs(EventPayload.GuideStep.class).orElseThrow();

        assertEquals(117, step.frame());
        assertEquals(31.416, step.time());
        assertEquals("Mount", step.mount());
        assertEquals(-0.144, step.dx());
        assertEquals(0.088, step.dy());
        assertEquals(-0.125, step.raDistanceRaw());
        assertEquals(84, step.raDuration());
        assertEquals("West", step.raDirection());
        assertEquals("North", step.decDirection());
        assertEquals(14054.0, step.starMass());
        assertEquals(58.46, step.snr());
        assertEquals(2.31, step.hfd());
        assertEquals(Boolean.TRUE, step.raLimited());
        assertNull(step.decLimited(), "absent optional field");
        assertNull(step.errorCode());
        assertEquals(step, e.typedPayload().orElseThrow());
    }

    @Test
    void settleDoneReportsFailure() throws Exception {
        EventPayload.SettleDone ok = event("{\"Event\":\"SettleDone\",\"Status\":0}")
                .payloadAs(EventPayload.SettleDone.class).orElseThrow();
        EventPayload.SettleDone failed = event("{\"Event\":\"SettleDone\",\"Status\":1,\"Error\":\"timed-out waiting for guider to settle\"}")
                .payloadAs(EventPayload.SettleDone.class).orElseThrow();

        assertTrue(ok.succeeded());
        assertNull(ok.error());
        assertFalse(failed.succeeded());
        assertEquals("timed-out waiting for guider to settle", failed.error());
    }

    @Test
    void calibratingKeepsPositionList() throws Exception {
        EventPayload.Calibrating c = (EventPayload.Calibrating) event("{\"Event\":\"Calibrating\",\"Mount\":\"Mount\","
                + "\"dir\":\"West\",\"dist\":12.5,\"dx\":10.0,\"dy\":-7.5,\"pos\":[512.2,384.9],\"step\":3,"
                + "\"State\":\"Calibrating RA\"}").typedPayload().orElseThrow();

        assertEquals("West", c.direction());
        assertEquals(List.of(512.2, 384.9), c.position());
        assertEquals(3, c.step());
        assertEquals("Calibrating RA", c.state());
    }

    @Test
    void alertAndGuideParamChangeBind() throws Exception {
        EventPayload.Alert alert = event("{\"Event\":\"Alert\",\"Msg\":\"Star lost - mass changed\",\"Type\":\"warning\"}")
                .payloadAs(EventPayload.Alert.class).orElseThrow();
        EventPayload.GuideParamChange change = event("{\"Event\":\"GuideParamChange\",\"Name\":\"Dither scale\",\"Value\":1.5}")
                .payloadAs(EventPayload.GuideParamChange.class).orElseThrow();

        assertEquals("Star lost - mass changed", alert.message());
        assertEquals("warning", alert.type());
        assertEquals("Dither scale", change.name());
        assertEquals(1.5, change.value().doubleValue());
    }

    @Test
    void noTypedViewForFieldlessOrUnknownNotifications() throws Exception {
        assertEquals(Optional.empty(), event("{\"Event\":\"Paused\"}").typedPayload());
        assertEquals(Optional.empty(), event("{\"Event\":\"FutureThing\",\"Answer\":42}").typedPayload());
    }

    @Test
    void askingForAnotherEventsRecordIsEmpty() throws Exception {
        GuiderEvent.RemoteEvent e = event("{\"Event\":\"StarLost\",\"Frame\":5,\"Time\":1.5,\"StarMass\":0,\"SNR\":0,"
                + "\"Status\":\"Star lost\"}");

        assertEquals(Optional.empty(), e.payloadAs(EventPayload.GuideStep.class));
        assertEquals("Star lost", e.payloadAs(EventPayload.StarLost.class).orElseThrow().status());
    }

    @Test
    void wronglyTypedFieldIsRejected() throws Exception {
        GuiderEvent.RemoteEvent e = event("{\"Event\":\"LoopingExposures\",\"Frame\":\"first\"}");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, e::typedPayload);
        assertTrue(ex.getMessage().contains("LoopingExposures"), ex.getMessage());
    }
}
