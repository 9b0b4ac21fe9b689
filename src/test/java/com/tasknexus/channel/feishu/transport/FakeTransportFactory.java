package com.tasknexus.channel.feishu.transport;

import com.tasknexus.channel.feishu.config.FeishuCredentials;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test-only {@link FeishuTransportFactory} producing {@link FakeLongConnection}s
 * and a shared {@link RecordingMessageSender}.
 */
public final class FakeTransportFactory implements FeishuTransportFactory {

    private final RecordingMessageSender sender = new RecordingMessageSender();
    private final List<FakeLongConnection> connections = new CopyOnWriteArrayList<>();
    private final BlockingQueue<FakeLongConnection> opened = new LinkedBlockingQueue<>();
    private final AtomicInteger openCalls = new AtomicInteger();
    private final AtomicInteger senderCalls = new AtomicInteger();

    private volatile Throwable openFailure;
    private volatile Exception connectFailure;
    private volatile CountDownLatch connectGate;
    private volatile String openThreadName;

    @Override
    public LongConnection openConnection(FeishuCredentials credentials, InboundEventListener listener) throws Exception {
        openCalls.incrementAndGet();
        openThreadName = Thread.currentThread().getName();
        Throwable failure = openFailure;
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        if (failure != null) {
            throw (Exception) failure;
        }
        FakeLongConnection connection = new FakeLongConnection(listener, connectFailure, connectGate);
        connections.add(connection);
        opened.add(connection);
        return connection;
    }

    @Override
    public MessageSender createSender(FeishuCredentials credentials) {
        senderCalls.incrementAndGet();
        return sender;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Fail {@code openConnection} with a checked exception or an {@link Error}.
     */
    public void failOpenWith(Throwable failure) {
        this.openFailure = failure;
    }

    public void failConnectWith(Exception failure) {
        this.connectFailure = failure;
    }

    /**
     * Make {@code connect()} block until the returned latch is released.
     */
    public CountDownLatch holdConnect() {
        CountDownLatch gate = new CountDownLatch(1);
        this.connectGate = gate;
        return gate;
    }

    /**
     * Wait for the next connection opened by the supervisor.
     */
    public FakeLongConnection awaitConnection() throws InterruptedException {
        FakeLongConnection connection = opened.poll(5, TimeUnit.SECONDS);
        if (connection == null) {
            throw new AssertionError("no connection opened within 5s");
        }
        return connection;
    }

    public List<FakeLongConnection> connections() {
        return List.copyOf(connections);
    }

    public RecordingMessageSender sender() {
        return sender;
    }

    public int openCalls() {
        return openCalls.get();
    }

    public int senderCalls() {
        return senderCalls.get();
    }

    public String openThreadName() {
        return openThreadName;
    }
}
