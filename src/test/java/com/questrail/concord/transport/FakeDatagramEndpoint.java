package com.questrail.concord.transport;

import com.questrail.concord.codec.ChannelFrame;
import com.questrail.concord.codec.impl.ChannelFraming;

import java.net.SocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory {@link DatagramEndpoint} for transport tests.
 *
 * <p>Outbound datagrams are captured in send order. Inbound datagrams are
 * pushed by the test, either as raw bytes or as a channel frame.</p>
 */
public final class FakeDatagramEndpoint implements DatagramEndpoint {

    /** One captured outbound datagram. */
    public record Outbound(SocketAddress remote, byte[] datagram) {
        public ChannelFrame frame() {
            return ChannelFraming.decode(datagram)
                    .orElseThrow(() -> new AssertionError("outbound datagram is not channel-framed"));
        }
    }

    private final List<Outbound> outbound = new CopyOnWriteArrayList<>();
    private volatile DatagramEndpointListener listener;
    private volatile boolean running;

    @Override
    public void setListener(DatagramEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        running = true;
        listener().onTransportUp();
    }

    @Override
    public void stop() {
        running = false;
        listener().onTransportDown(null);
    }

    @Override
    public void send(SocketAddress remote, byte[] payload) {
        outbound.add(new Outbound(Objects.requireNonNull(remote, "remote"), payload.clone()));
    }

    public void receive(SocketAddress from, byte[] datagram) {
        listener().onDatagram(Objects.requireNonNull(from, "from"), datagram.clone());
    }

    public void receiveFrame(SocketAddress from, String channel, byte[] payload) {
        receive(from, ChannelFraming.encode(new ChannelFrame(channel, payload)));
    }

    /** Socket failure as the Netty endpoint would report it. */
    public void crash(Throwable cause) {
        running = false;
        listener().onTransportDown(Objects.requireNonNull(cause, "cause"));
    }

    public boolean isRunning() {
        return running;
    }

    public List<Outbound> outbound() {
        return List.copyOf(outbound);
    }

    public List<SocketAddress> destinations() {
        return outbound.stream().map(Outbound::remote).collect(Collectors.toList());
    }

    private DatagramEndpointListener listener() {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("setListener was never called");
        }
        return l;
    }
}
