package com.atlas.api.infrastructure.redis;

import com.atlas.api.domain.usage.MissingConsumerGroupException;
import com.atlas.api.domain.usage.StreamBroker;
import com.atlas.api.domain.usage.StreamConnectionException;
import com.atlas.eventmodel.StreamMessage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.StreamEntryID;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.params.XAddParams;
import redis.clients.jedis.params.XReadGroupParams;
import redis.clients.jedis.resps.StreamEntry;

/**
 * {@link StreamBroker} on Redis Streams through a {@link JedisPool}.
 * <p>
 * Each call borrows a connection for its own duration. Blocking reads hold their connection for
 * up to the block interval, so the pool must allow one more connection than there are consumers.
 */
public class RedisStreamBroker implements StreamBroker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamBroker.class);
    private static final String BUSYGROUP = "BUSYGROUP";
    private static final String NOGROUP = "NOGROUP";

    private final JedisPool pool;

    public RedisStreamBroker(JedisPool pool) {
        this.pool = pool;
    }

    @Override
    public void ensureGroup(String stream, String group) {
        try (Jedis jedis = pool.getResource()) {
            jedis.xgroupCreate(stream, group, new StreamEntryID(), true);
            log.info("Created consumer group {} on {}", group, stream);
        } catch (JedisDataException e) {
            if (e.getMessage() == null || !e.getMessage().startsWith(BUSYGROUP)) {
                throw e;
            }
            log.debug("Consumer group {} already exists on {}", group, stream);
        } catch (JedisConnectionException e) {
            throw new StreamConnectionException("Cannot create group " + group + " on " + stream, e);
        }
    }

    @Override
    public List<StreamMessage> readGroup(String group, String consumer, List<String> streams, int count,
                                         Duration block) {
        Map<String, StreamEntryID> offsets = new LinkedHashMap<>();
        for (String stream : streams) {
            offsets.put(stream, StreamEntryID.UNRECEIVED_ENTRY);
        }
        XReadGroupParams params = XReadGroupParams.xReadGroupParams()
                .count(count)
                .block((int) block.toMillis());

        List<Map.Entry<String, List<StreamEntry>>> response;
        try (Jedis jedis = pool.getResource()) {
            response = jedis.xreadGroup(group, consumer, params, offsets);
        } catch (JedisConnectionException e) {
            throw new StreamConnectionException("Stream read failed", e);
        } catch (JedisDataException e) {
            if (e.getMessage() != null && e.getMessage().startsWith(NOGROUP)) {
                throw new MissingConsumerGroupException("Group " + group + " missing on " + streams, e);
            }
            throw e;
        }
        if (response == null) {
            return List.of();
        }

        List<StreamMessage> messages = new ArrayList<>();
        for (Map.Entry<String, List<StreamEntry>> perStream : response) {
            for (StreamEntry entry : perStream.getValue()) {
                messages.add(new StreamMessage(perStream.getKey(), entry.getID().toString(), entry.getFields()));
            }
        }
        return messages;
    }

    @Override
    public void ack(String stream, String group, String messageId) {
        try (Jedis jedis = pool.getResource()) {
            jedis.xack(stream, group, new StreamEntryID(messageId));
        } catch (JedisConnectionException e) {
            throw new StreamConnectionException("Ack failed for " + messageId, e);
        }
    }

    @Override
    public String publish(String stream, Map<String, String> fields) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.xadd(stream, XAddParams.xAddParams(), fields).toString();
        } catch (JedisConnectionException e) {
            throw new StreamConnectionException("Publish to " + stream + " failed", e);
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
