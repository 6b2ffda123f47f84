package com.suhana.stream;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

/**
 * Adaptive batching encoder: buffers text fragments and seals them into NDJSON packets.
 *
 * After each fragment, and on every {@link #flushIfDue()} call, the buffer is flushed if it holds
 * {@code maxTokens} fragments, {@code maxBytes} UTF-8 bytes, or if {@code maxDelayMs} passed since
 * the last flush. The end of the source flushes whatever remains. An empty buffer never produces
 * a packet, and empty fragments are ignored.
 *
 * Not thread-safe: {@link #offer}, {@link #flushIfDue} and {@link #finish} must be called from one
 * thread or serialized by the caller.
 */
public class StreamEncoder {
    private static final Logger logger = LoggerFactory.getLogger(StreamEncoder.class);

    private final StreamSession session;
    private final BatchingPolicy policy;
    private final LongSupplier nanoClock;

    private final Counter packets;
    private final Counter bytesOut;

    private final StringBuilder buffer = new StringBuilder();
    private int bufferedTokens;
    private int bufferedBytes;
    private long lastFlushNanos;

    public StreamEncoder(byte[] sharedSecret, String conversationId) {
        this(new StreamSession(sharedSecret, conversationId), BatchingPolicy.defaults(), System::nanoTime, null);
    }

    public StreamEncoder(byte[] sharedSecret, String conversationId, BatchingPolicy policy) {
        this(new StreamSession(sharedSecret, conversationId), policy, System::nanoTime, null);
    }

    /**
     * @param nanoClock monotonic time source in nanoseconds
     * @param metrics   meter registry; null for a private in-memory registry
     */
    public StreamEncoder(StreamSession session, BatchingPolicy policy, LongSupplier nanoClock, MeterRegistry metrics) {
        this.session = Objects.requireNonNull(session, "session");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");

        MeterRegistry registry = (metrics != null) ? metrics : new SimpleMeterRegistry();
        this.packets = registry.counter("suhana.stream.packets");
        this.bytesOut = registry.counter("suhana.stream.bytes");

        this.lastFlushNanos = nanoClock.getAsLong();
    }

    /**
     * Buffers one fragment.
     *
     * @return the packet line if this fragment triggered a flush
     */
    public Optional<String> offer(String fragment) {
        Objects.requireNonNull(fragment, "fragment");
        if (!fragment.isEmpty()) {
            buffer.append(fragment);
            bufferedTokens++;
            bufferedBytes += utf8Length(fragment);
        }
        return flushIfDue();
    }

    /** Evaluates the flush triggers without adding anything; for host timers. */
    public Optional<String> flushIfDue() {
        long now = nanoClock.getAsLong();
        if (policy.sizeReached(bufferedTokens, bufferedBytes)) {
            return flush(now);
        } else if (policy.delayReached(now - lastFlushNanos)) {
            return flush(now);
        }
        return Optional.empty();
    }

    /** Flushes whatever is buffered; call once the source is exhausted. */
    public Optional<String> finish() {
        return flush(nanoClock.getAsLong());
    }

    /**
     * Lazily encodes {@code source}. Each {@code next()} pulls fragments only until the next
     * packet is ready, so packets become visible while the source is still producing.
     */
    public Iterator<String> encode(Iterator<String> source) {
        Objects.requireNonNull(source, "source");
        return new Iterator<>() {
            private String pending;
            private boolean finished;

            @Override
            public boolean hasNext() {
                while (pending == null && !finished) {
                    if (source.hasNext()) {
                        pending = offer(source.next()).orElse(null);
                    } else {
                        finished = true;
                        pending = finish().orElse(null);
                    }
                }
                return pending != null;
            }

            @Override
            public String next() {
                if (!hasNext()) throw new NoSuchElementException();
                String line = pending;
                pending = null;
                return line;
            }
        };
    }

    /** Push-style variant of {@link #encode}: hands each packet line to {@code sink} as soon as it is sealed. */
    public void stream(Iterator<String> source, Consumer<String> sink) {
        Objects.requireNonNull(sink, "sink");
        Iterator<String> lines = encode(source);
        while (lines.hasNext()) {
            sink.accept(lines.next());
        }
    }

    public StreamSession getSession() {
        return session;
    }

    private Optional<String> flush(long now) {
        if (bufferedTokens == 0) return Optional.empty();

        String text = buffer.toString();
        int size = bufferedBytes;
        int tokens = bufferedTokens;
        buffer.setLength(0);
        bufferedTokens = 0;
        bufferedBytes = 0;
        lastFlushNanos = now;

        Packet packet = session.seal(text);
        packets.increment();
        bytesOut.increment(size);
        logger.debug("Flushed packet seq={} ({} fragments, {} bytes)", packet.getSeq(), tokens, size);
        return Optional.of(PacketCodec.toLine(packet));
    }

    private static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }
}
