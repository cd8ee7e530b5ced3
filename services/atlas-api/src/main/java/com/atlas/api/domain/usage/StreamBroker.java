package com.atlas.api.domain.usage;

import com.atlas.eventmodel.StreamMessage;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Consumer-group stream operations the usage pipeline needs from a broker.
 * <p>
 * Every method surfaces transport failures as {@link StreamConnectionException}.
 */
public interface StreamBroker {

    /**
     * Creates {@code group} on {@code stream} starting from the beginning, creating the stream if
     * absent. An existing group is left untouched.
     */
    void ensureGroup(String stream, String group);

    /**
     * Reads up to {@code count} never-delivered entries per stream for {@code consumer}, blocking
     * at most {@code block} when none are available.
     *
     * @return entries grouped by stream in the order given, empty on timeout
     * @throws MissingConsumerGroupException if {@code group} is missing on any of the streams
     */
    List<StreamMessage> readGroup(String group, String consumer, List<String> streams, int count, Duration block);

    /** Acknowledges one entry so it leaves the group's pending list. */
    void ack(String stream, String group, String messageId);

    /**
     * Appends an entry.
     *
     * @return the broker-assigned entry id
     */
    String publish(String stream, Map<String, String> fields);
}
