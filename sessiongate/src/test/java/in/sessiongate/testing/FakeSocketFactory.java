package in.sessiongate.testing;

import in.sessiongate.socket.SessionSocket;
import in.sessiongate.socket.SessionSocketFactory;
import in.sessiongate.socket.SessionSocketListener;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every socket it creates, per session, in creation order.
 */
public final class FakeSocketFactory implements SessionSocketFactory {

    private final Map<String, List<FakeSocket>> created = new ConcurrentHashMap<>();
    public volatile RuntimeException failWith;

    @Override
    public SessionSocket create(String sessionId, Path credentialsDir, SessionSocketListener listener) {
        RuntimeException failure = failWith;
        if (failure != null) {
            throw failure;
        }
        FakeSocket socket = new FakeSocket(sessionId, listener);
        created.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(socket);
        return socket;
    }

    public List<FakeSocket> sockets(String sessionId) {
        return created.getOrDefault(sessionId, List.of());
    }

    public int count(String sessionId) {
        return sockets(sessionId).size();
    }

    public FakeSocket latest(String sessionId) {
        List<FakeSocket> list = sockets(sessionId);
        if (list.isEmpty()) {
            throw new IllegalStateException("no socket created for " + sessionId);
        }
        return list.get(list.size() - 1);
    }
}
