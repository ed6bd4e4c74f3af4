package in.sessiongate.session;

import in.sessiongate.domain.message.MessageKind;
import in.sessiongate.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SessionMetrics.
 *
 * Tests:
 * - Send counters per kind and last ids
 * - Timeline coalescing inside the minimum interval
 * - Forced samples and the timeline bound
 */
class SessionMetricsTest {

    private MutableClock clock;
    private StatusLedger ledger;
    private RateWindow rateWindow;
    private SessionMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        ledger = new StatusLedger("test", 600_000, clock, null, null);
        rateWindow = new RateWindow(20, 15_000, clock);
        metrics = new SessionMetrics(clock);
    }

    @Test
    void testSendCounters() {
        metrics.recordSent("m1", MessageKind.TEXT);
        metrics.recordSent("m2", MessageKind.TEXT);
        metrics.recordSent("m3", MessageKind.POLL);
        metrics.recordStatus("m2", StatusCodes.READ);

        assertEquals(3, metrics.getSent());
        assertEquals(2L, metrics.getSentByType().get(MessageKind.TEXT.wire()));
        assertEquals(1L, metrics.getSentByType().get(MessageKind.POLL.wire()));
        assertEquals(0L, metrics.getSentByType().get(MessageKind.IMAGE.wire()), "Every kind is reported");
        assertEquals(new SessionMetrics.Last("m3", "m2", StatusCodes.READ), metrics.getLast());
    }

    @Test
    void testTimelineCoalescesWithinInterval() {
        ledger.trackSent("m1");
        metrics.recordSent("m1", MessageKind.TEXT);
        metrics.snapshot(ledger, rateWindow, false);
        long firstTs = clock.millis();

        clock.advance(60_000);
        ledger.trackSent("m2");
        metrics.recordSent("m2", MessageKind.TEXT);
        metrics.snapshot(ledger, rateWindow, false);

        List<SessionMetrics.TimelinePoint> timeline = metrics.getTimeline();
        assertEquals(1, timeline.size(), "Second sample inside the interval updates the first");
        assertEquals(firstTs, timeline.get(0).ts, "Coalesced sample keeps its timestamp");
        assertEquals(2, timeline.get(0).sent);
        assertEquals(2, timeline.get(0).pending);
    }

    @Test
    void testForcedSnapshotAppends() {
        metrics.snapshot(ledger, rateWindow, false);
        clock.advance(1_000);
        ledger.trackSent("m1");
        ledger.applyStatus("m1", StatusCodes.DELIVERED);

        metrics.snapshot(ledger, rateWindow, true);

        List<SessionMetrics.TimelinePoint> timeline = metrics.getTimeline();
        assertEquals(2, timeline.size(), "Forced sample appends");
        assertEquals(clock.millis(), timeline.get(1).ts);
        assertEquals(1, timeline.get(1).delivered, "Delivered is cumulative across finalized entries");
    }

    @Test
    void testTimelineBounded() {
        for (int i = 0; i < SessionMetrics.TIMELINE_MAX + 20; i++) {
            metrics.snapshot(ledger, rateWindow, false);
            clock.advance(SessionMetrics.TIMELINE_MIN_INTERVAL_MS);
        }

        assertEquals(SessionMetrics.TIMELINE_MAX, metrics.getTimeline().size());
    }
}
