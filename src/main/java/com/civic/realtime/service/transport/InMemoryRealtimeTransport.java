package com.civic.realtime.service.transport;

import com.civic.realtime.service.model.ChangeEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Loopback transport that fans published changes out to in-process channels.
 *
 * Used as the default transport when no hosted backend is wired in, and by
 * tests to inject channel faults.
 */
@Slf4j
public class InMemoryRealtimeTransport implements RealtimeTransport {

    private final List<InMemoryChannel> channels = new CopyOnWriteArrayList<>();
    private final List<BroadcastPayload> broadcasts = new CopyOnWriteArrayList<>();
    private final AtomicInteger pendingCreationFailures = new AtomicInteger();
    private final AtomicBoolean autoAcknowledge = new AtomicBoolean(true);
    private final AtomicBoolean failOnRemove = new AtomicBoolean(false);
    private final AtomicInteger channelsCreated = new AtomicInteger();
    private final AtomicInteger channelsRemoved = new AtomicInteger();

    @Override
    public ChannelHandle channel(String name) {
        if (pendingCreationFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new TransportException("Simulated channel creation failure: " + name);
        }
        InMemoryChannel channel = new InMemoryChannel(name);
        channels.add(channel);
        channelsCreated.incrementAndGet();
        log.debug("Channel created: {}", name);
        return channel;
    }

    @Override
    public void removeChannel(ChannelHandle handle) {
        if (!(handle instanceof InMemoryChannel channel)) {
            throw new IllegalArgumentException("Foreign channel handle: " + handle);
        }
        if (failOnRemove.get()) {
            throw new TransportException("Simulated failure removing channel " + channel.name());
        }
        if (channels.remove(channel)) {
            channelsRemoved.incrementAndGet();
            channel.close();
            log.debug("Channel removed: {}", channel.name());
        }
    }

    /**
     * Publishes a change to every open channel listening to its table.
     *
     * @return number of listener invocations
     */
    public int publish(ChangeEvent<Map<String, Object>> event) {
        int delivered = 0;
        for (InMemoryChannel channel : channels) {
            delivered += channel.deliver(event);
        }
        log.debug("Published {} on {} to {} listeners", event.kind(), event.table(), delivered);
        return delivered;
    }

    /**
     * Reports a status on every open channel whose name matches, or on all channels when name is null.
     */
    public void simulateStatus(String channelName, ChannelStatus status, Throwable error) {
        for (InMemoryChannel channel : channels) {
            if (channelName == null || channelName.equals(channel.name())) {
                channel.reportStatus(status, error);
            }
        }
    }

    /**
     * Makes the next {@code count} channel creations throw a recoverable {@link TransportException}.
     */
    public void failChannelCreation(int count) {
        pendingCreationFailures.set(count);
    }

    public void setAutoAcknowledge(boolean enabled) {
        autoAcknowledge.set(enabled);
    }

    public void setFailOnRemove(boolean enabled) {
        failOnRemove.set(enabled);
    }

    public List<String> openChannelNames() {
        return channels.stream().map(InMemoryChannel::name).toList();
    }

    public List<BroadcastPayload> broadcasts() {
        return new ArrayList<>(broadcasts);
    }

    public int channelsCreated() {
        return channelsCreated.get();
    }

    public int channelsRemoved() {
        return channelsRemoved.get();
    }

    private record ChangeBinding(String table, RowFilter filter,
                                 Consumer<ChangeEvent<Map<String, Object>>> callback) {
    }

    private class InMemoryChannel implements ChannelHandle {

        private final String name;
        private final List<ChangeBinding> bindings = new CopyOnWriteArrayList<>();
        private volatile ChannelStatusListener statusListener;
        private volatile boolean closed;

        InMemoryChannel(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ChannelHandle onChange(String table, String filter,
                                      Consumer<ChangeEvent<Map<String, Object>>> callback) {
            bindings.add(new ChangeBinding(table, RowFilter.parse(filter), callback));
            return this;
        }

        @Override
        public ChannelHandle subscribe(ChannelStatusListener listener) {
            this.statusListener = listener;
            if (autoAcknowledge.get()) {
                listener.onStatus(ChannelStatus.SUBSCRIBED, null);
            }
            return this;
        }

        @Override
        public void send(BroadcastPayload payload) {
            if (closed) {
                throw new TransportException("Channel closed: " + name);
            }
            broadcasts.add(payload);
        }

        int deliver(ChangeEvent<Map<String, Object>> event) {
            if (closed || statusListener == null) return 0;
            int delivered = 0;
            for (ChangeBinding binding : bindings) {
                if (binding.table().equals(event.table()) && binding.filter().matches(event.latestRecord())) {
                    binding.callback().accept(event);
                    delivered++;
                }
            }
            return delivered;
        }

        void reportStatus(ChannelStatus status, Throwable error) {
            ChannelStatusListener listener = statusListener;
            if (listener != null) {
                listener.onStatus(status, error);
            }
        }

        void close() {
            closed = true;
            reportStatus(ChannelStatus.CLOSED, null);
        }

        @Override
        public String toString() {
            return "InMemoryChannel[" + name + "]";
        }
    }
}
