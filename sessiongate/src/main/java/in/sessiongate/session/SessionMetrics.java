package in.sessiongate.session;

import in.sessiongate.domain.message.MessageKind;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Send counters and a bounded timeline of status snapshots for one session.
 */
public class SessionMetrics {

    public static final int TIMELINE_MAX = 288;
    public static final long TIMELINE_MIN_INTERVAL_MS = 5 * 60_000;

    /**
     * One timeline sample. pending and serverAck are live counts; the rest are cumulative.
     */
    public static final class TimelinePoint {
        public long ts;
        public String iso;
        public long sent;
        public long pending;
        public long serverAck;
        public long delivered;
        public long read;
        public long played;
        public long failed;
        public int rateInWindow;

        TimelinePoint copy() {
            TimelinePoint p = new TimelinePoint();
            p.ts = ts;
            p.iso = iso;
            p.sent = sent;
            p.pending = pending;
            p.serverAck = serverAck;
            p.delivered = delivered;
            p.read = read;
            p.played = played;
            p.failed = failed;
            p.rateInWindow = rateInWindow;
            return p;
        }
    }

    public record Last(String sentId, String lastStatusId, Integer lastStatusCode) {}

    private final Clock clock;

    private long sent = 0;
    private final Map<MessageKind, Long> sentByType = new EnumMap<>(MessageKind.class);
    private String lastSentId;
    private String lastStatusId;
    private Integer lastStatusCode;
    private final Deque<TimelinePoint> timeline = new ArrayDeque<>();

    public SessionMetrics(Clock clock) {
        this.clock = clock;
        for (MessageKind kind : MessageKind.values()) {
            sentByType.put(kind, 0L);
        }
    }

    public synchronized void recordSent(String messageId, MessageKind kind) {
        sent++;
        sentByType.merge(kind, 1L, Long::sum);
        lastSentId = messageId;
    }

    public synchronized void recordStatus(String messageId, int status) {
        lastStatusId = messageId;
        lastStatusCode = status;
    }

    /**
     * Update the latest sample when it is younger than the minimum interval;
     * otherwise (or when forced) append a new one.
     */
    public synchronized void snapshot(StatusLedger ledger, RateWindow rateWindow, boolean force) {
        long now = clock.millis();
        TimelinePoint point = new TimelinePoint();
        point.sent = sent;
        point.pending = ledger.liveCount(StatusCodes.PENDING);
        point.serverAck = ledger.liveCount(StatusCodes.SERVER_ACK);
        point.delivered = cumulative(ledger, StatusCodes.DELIVERED);
        point.read = cumulative(ledger, StatusCodes.READ);
        point.played = cumulative(ledger, StatusCodes.PLAYED);
        point.failed = cumulative(ledger, StatusCodes.FAILED);
        point.rateInWindow = rateWindow.inWindow();

        TimelinePoint last = timeline.peekLast();
        if (last != null && now - last.ts < TIMELINE_MIN_INTERVAL_MS) {
            point.ts = last.ts;
            point.iso = last.iso;
            timeline.pollLast();
            timeline.addLast(point);
            if (!force) return;
            point = point.copy();
        }

        point.ts = now;
        point.iso = Instant.ofEpochMilli(now).toString();
        timeline.addLast(point);
        while (timeline.size() > TIMELINE_MAX) {
            timeline.pollFirst();
        }
    }

    private static long cumulative(StatusLedger ledger, int status) {
        return ledger.liveCount(status) + ledger.totalCount(status);
    }

    public synchronized long getSent() {
        return sent;
    }

    public synchronized Map<String, Long> getSentByType() {
        Map<String, Long> result = new LinkedHashMap<>();
        sentByType.forEach((kind, count) -> result.put(kind.wire(), count));
        return result;
    }

    public synchronized Last getLast() {
        return new Last(lastSentId, lastStatusId, lastStatusCode);
    }

    public synchronized List<TimelinePoint> getTimeline() {
        List<TimelinePoint> copy = new ArrayList<>(timeline.size());
        for (TimelinePoint p : timeline) {
            copy.add(p.copy());
        }
        return copy;
    }
}
