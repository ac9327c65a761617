package com.example.filedrop.web;

import com.example.filedrop.core.Settings;
import com.example.filedrop.session.FakeTransport;
import com.example.filedrop.session.Session;
import com.example.filedrop.session.SessionRegistry;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.eclipse.jetty.websocket.api.RemoteEndpoint;
import org.eclipse.jetty.websocket.api.WriteCallback;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JettyTransportTest {

    /**
     * Jetty session whose writes only complete when the test says so, like a
     * peer that has stopped reading.
     */
    private static final class StalledSocket implements InvocationHandler {
        final List<String> written = new ArrayList<>();
        final List<WriteCallback> pending = new ArrayList<>();
        volatile boolean open = true;
        volatile Integer closeCode;
        final org.eclipse.jetty.websocket.api.Session session;
        final RemoteEndpoint remote;

        StalledSocket() {
            ClassLoader cl = getClass().getClassLoader();
            session = (org.eclipse.jetty.websocket.api.Session) Proxy.newProxyInstance(
                    cl, new Class<?>[]{org.eclipse.jetty.websocket.api.Session.class}, this);
            remote = (RemoteEndpoint) Proxy.newProxyInstance(cl, new Class<?>[]{RemoteEndpoint.class}, this);
        }

        @Override
        public synchronized Object invoke(Object proxy, Method method, Object[] args) {
            switch (method.getName()) {
                case "isOpen":
                    return open;
                case "getRemote":
                    return remote;
                case "getRemoteAddress":
                    return new InetSocketAddress("192.168.1.9", 40000);
                case "close":
                    if (args != null && args.length == 2) closeCode = (Integer) args[0];
                    open = false;
                    return null;
                case "sendString":
                    written.add((String) args[0]);
                    pending.add((WriteCallback) args[1]);
                    return null;
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "equals":
                    return proxy == args[0];
                case "toString":
                    return "stalled socket";
                default:
                    throw new UnsupportedOperationException(method.getName());
            }
        }

        void completeNext() {
            WriteCallback cb;
            synchronized (this) {
                cb = pending.remove(0);
            }
            cb.writeSuccess();
        }

        void failNext() {
            WriteCallback cb;
            synchronized (this) {
                cb = pending.remove(0);
            }
            cb.writeFailed(new IOException("connection reset"));
        }

        synchronized List<String> written() {
            return new ArrayList<>(written);
        }
    }

    @Test
    public void stalledPeerDoesNotHoldUpTheRegistry() throws Exception {
        SessionRegistry registry = new SessionRegistry();
        StalledSocket stalled = new StalledSocket();
        HubSocket.JettyTransport slow = new HubSocket.JettyTransport(stalled.session, false);
        registry.register("dev-slow", "Slow", true, false, slow, null);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Session> first = pool.submit(() ->
                    registry.register("dev-a", "A", true, false, FakeTransport.remote("192.168.1.10"), null));
            Future<Session> second = pool.submit(() ->
                    registry.register("dev-b", "B", true, false, FakeTransport.remote("192.168.1.11"), null));

            assertNotNull(first.get(2, TimeUnit.SECONDS));
            assertNotNull(second.get(2, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(3, registry.size());
        assertTrue(slow.isOpen());
        // only the first roster is on the wire; the rest wait their turn
        assertEquals(1, stalled.written().size());
    }

    @Test
    public void framesGoOutOneAtATimeInOrder() throws Exception {
        StalledSocket socket = new StalledSocket();
        HubSocket.JettyTransport t = new HubSocket.JettyTransport(socket.session, false);

        t.send("{\"n\":1}");
        t.send("{\"n\":2}");
        t.send("{\"n\":3}");
        assertEquals(1, socket.written().size());

        socket.completeNext();
        socket.completeNext();
        socket.completeNext();

        List<String> written = socket.written();
        assertEquals(3, written.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i + 1, JsonParser.parseString(written.get(i)).getAsJsonObject().get("n").getAsInt());
        }
    }

    @Test
    public void peerThatNeverReadsIsCutOff() throws Exception {
        StalledSocket socket = new StalledSocket();
        HubSocket.JettyTransport t = new HubSocket.JettyTransport(socket.session, false);

        // one frame in flight plus a full queue
        for (int i = 0; i <= Settings.MAX_OUTBOUND_FRAMES; i++) {
            t.send("frame " + i);
        }
        try {
            t.send("one too many");
            fail("expected IOException");
        } catch (IOException expected) {
            assertTrue(expected.getMessage().contains("not reading"));
        }
        try {
            t.send("after overflow");
            fail("expected IOException");
        } catch (IOException expected) {
            assertEquals("Connection closed", expected.getMessage());
        }
    }

    @Test
    public void failedWriteClosesTheConnection() throws Exception {
        StalledSocket socket = new StalledSocket();
        HubSocket.JettyTransport t = new HubSocket.JettyTransport(socket.session, false);

        t.send("first");
        t.send("second");
        socket.failNext();

        assertFalse(t.isOpen());
        assertEquals(Integer.valueOf(Settings.CLOSE_SEND_FAILED), socket.closeCode);
        assertEquals(1, socket.written().size());
    }
}
