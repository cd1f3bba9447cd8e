package io.shardsync.server.feed;

import io.shardsync.core.ChangeEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalChangeFeedTest {

    private static final class Recorder implements ChangeListener {
        final List<ChangeEvent> events = new ArrayList<>();
        final List<Throwable> terminations = new ArrayList<>();

        @Override
        public void onChange(ChangeEvent event) {
            events.add(event);
        }

        @Override
        public void onTerminated(Throwable cause) {
            terminations.add(cause);
        }
    }

    @Test
    void every_subscriber_sees_published_events() {
        LocalChangeFeed feed = new LocalChangeFeed();
        Recorder a = new Recorder();
        Recorder b = new Recorder();
        feed.subscribe(a);
        feed.subscribe(b);

        feed.publish(ChangeEvent.updated("_users"));

        assertEquals(List.of(ChangeEvent.updated("_users")), a.events);
        assertEquals(List.of(ChangeEvent.updated("_users")), b.events);
    }

    @Test
    void failing_listener_does_not_block_others() {
        LocalChangeFeed feed = new LocalChangeFeed();
        feed.subscribe(new ChangeListener() {
            @Override
            public void onChange(ChangeEvent event) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onTerminated(Throwable cause) {
            }
        });
        Recorder ok = new Recorder();
        feed.subscribe(ok);

        assertDoesNotThrow(() -> feed.publish(ChangeEvent.deleted("db")));
        assertEquals(1, ok.events.size());
    }

    @Test
    void closed_subscription_receives_nothing_and_is_not_terminated() {
        LocalChangeFeed feed = new LocalChangeFeed();
        Recorder r = new Recorder();
        Subscription sub = feed.subscribe(r);

        sub.close();
        sub.close();
        feed.publish(ChangeEvent.updated("_dbs"));
        feed.terminate(new IllegalStateException("gone"));

        assertTrue(r.events.isEmpty());
        assertTrue(r.terminations.isEmpty());
        assertEquals(0, feed.subscriberCount());
    }

    @Test
    void terminate_drops_subscribers_and_reports_cause() {
        LocalChangeFeed feed = new LocalChangeFeed();
        Recorder r = new Recorder();
        feed.subscribe(r);
        IllegalStateException cause = new IllegalStateException("feed restarted");

        feed.terminate(cause);

        assertEquals(List.of(cause), r.terminations);
        assertEquals(0, feed.subscriberCount());
    }
}
