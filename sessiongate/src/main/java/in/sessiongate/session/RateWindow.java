package in.sessiongate.session;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window send admission for one session.
 * A rejected send is final; nothing is queued.
 */
public class RateWindow {

    private final int maxSends;
    private final long windowMs;
    private final Clock clock;

    private final Deque<Long> sentAt = new ArrayDeque<>();

    public RateWindow(int maxSends, long windowMs, Clock clock) {
        if (maxSends <= 0) {
            throw new IllegalArgumentException("Max sends must be positive");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("Window must be positive");
        }
        this.maxSends = maxSends;
        this.windowMs = windowMs;
        this.clock = clock;
    }

    /**
     * Admit one send, recording its timestamp on success.
     */
    public synchronized boolean allow() {
        long now = clock.millis();
        prune(now);
        if (sentAt.size() >= maxSends) {
            return false;
        }
        sentAt.addLast(now);
        return true;
    }

    public synchronized int inWindow() {
        prune(clock.millis());
        return sentAt.size();
    }

    public int getMaxSends() {
        return maxSends;
    }

    public long getWindowMs() {
        return windowMs;
    }

    // a send exactly windowMs old still counts
    private void prune(long now) {
        while (!sentAt.isEmpty() && now - sentAt.peekFirst() > windowMs) {
            sentAt.removeFirst();
        }
    }
}
