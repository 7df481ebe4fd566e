package pfl.domain.alert;

import com.google.common.util.concurrent.MoreExecutors;
import org.joda.time.DateTime;
import org.joda.time.DateTimeUtils;
import org.joda.time.LocalTime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pfl.common.EChannel;
import pfl.common.ESeverity;
import pfl.common.EventTypes;
import pfl.dal.AlertConfig;
import pfl.dal.db.AlertPreference;
import pfl.dal.db.AlertPreferenceRepository;
import pfl.dal.db.AlertRecord;
import pfl.dal.db.AlertRepository;
import pfl.dal.db.TestDatabase;
import pfl.domain.event.Event;
import pfl.domain.event.InMemoryEventBus;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Tests for AlertDispatcher against in-memory H2 with recording channels
 * @since 19/01/2026
 */
class AlertDispatcherTest {

    private static final long NOON = new DateTime(2026, 1, 20, 12, 0).getMillis();
    private static final long LATE_EVENING = new DateTime(2026, 1, 20, 23, 30).getMillis();

    private DataSource dataSource;
    private AlertRepository alertRepository;
    private AlertPreferenceRepository preferenceRepository;
    private InMemoryEventBus eventBus;
    private List<Event> dispatched;
    private RecordingChannel email;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.create();
        alertRepository = new AlertRepository(dataSource);
        preferenceRepository = new AlertPreferenceRepository(dataSource);
        eventBus = new InMemoryEventBus();
        dispatched = new ArrayList<>();
        eventBus.subscribe(EventTypes.ALERT_DISPATCHED, dispatched::add);
        email = new RecordingChannel(EChannel.EMAIL);
    }

    @AfterEach
    void tearDown() {
        DateTimeUtils.setCurrentMillisSystem();
    }

    @Test
    @DisplayName("Should store one broadcast record when nobody is registered")
    void shouldStoreBroadcastRecord() {
        // Given
        DateTimeUtils.setCurrentMillisFixed(NOON);
        AlertDispatcher dispatcher = dispatcher(quietOff(), Set.of(email), MoreExecutors.newDirectExecutorService());

        // When
        List<AlertRecord> stored = dispatcher.dispatch(alert("Print Complete: benchy (Mini)"));

        // Then
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).userId()).isNull();
        assertThat(stored.get(0).createdAt()).isEqualTo(NOON);
        assertThat(dispatched).hasSize(1);
        assertThat(dispatched.get(0).getBoolean("quiet_suppressed", true)).isFalse();
    }

    @Test
    @DisplayName("Should give in-app to users without preferences and email to those who asked")
    void shouldRouteByPreference() {
        // Given
        DateTimeUtils.setCurrentMillisFixed(NOON);
        long alice = preferenceRepository.insertUser("alice", "alice@example.com");
        long bob = preferenceRepository.insertUser("bob", "bob@example.com");
        preferenceRepository.savePreference(new AlertPreference(alice, AlertEventSubscriber.PRINT_FAILED, false, true, false));
        AlertDispatcher dispatcher = dispatcher(quietOff(), Set.of(email), MoreExecutors.newDirectExecutorService());

        // When
        List<AlertRecord> stored = dispatcher.dispatch(alert("Print Failed: benchy (Mini)"));

        // Then
        assertThat(stored).extracting(AlertRecord::userId).containsExactly(bob);
        assertThat(email.delivered).extracting(Recipient::userId).containsExactly(alice);
        assertThat(email.delivered.get(0).address()).isEqualTo("alice@example.com");
    }

    @Test
    @DisplayName("Should drop a repeat of the same alert within the dedup window")
    void shouldDeduplicate() {
        // Given
        DateTimeUtils.setCurrentMillisFixed(NOON);
        AlertDispatcher dispatcher = dispatcher(quietOff(), Set.of(email), MoreExecutors.newDirectExecutorService());
        dispatcher.dispatch(alert("Printer Offline: Mini"));

        // When
        DateTimeUtils.setCurrentMillisFixed(NOON + 60_000);
        List<AlertRecord> repeat = dispatcher.dispatch(alert("Printer Offline: Mini"));
        DateTimeUtils.setCurrentMillisFixed(NOON + 6 * 60_000);
        List<AlertRecord> later = dispatcher.dispatch(alert("Printer Offline: Mini"));

        // Then
        assertThat(repeat).isEmpty();
        assertThat(later).hasSize(1);
        assertThat(dispatched).hasSize(2);
    }

    @Test
    @DisplayName("Should still suppress at exactly five minutes and allow a second alert at 5:01")
    void shouldHonourDedupWindowBoundary() {
        // Given
        DateTimeUtils.setCurrentMillisFixed(NOON);
        AlertDispatcher dispatcher = dispatcher(quietOff(), Set.of(email), MoreExecutors.newDirectExecutorService());
        dispatcher.dispatch(alert("Printer Offline: Mini"));

        // When
        DateTimeUtils.setCurrentMillisFixed(NOON + 5 * 60_000);
        List<AlertRecord> atWindowEnd = dispatcher.dispatch(alert("Printer Offline: Mini"));
        DateTimeUtils.setCurrentMillisFixed(NOON + 5 * 60_000 + 1_000);
        List<AlertRecord> afterWindow = dispatcher.dispatch(alert("Printer Offline: Mini"));

        // Then
        assertThat(atWindowEnd).isEmpty();
        assertThat(afterWindow).hasSize(1);
    }

    @Test
    @DisplayName("Should store one record when the same alert is dispatched concurrently")
    void shouldDeduplicateConcurrentDispatches() throws Exception {
        // Given
        DateTimeUtils.setCurrentMillisFixed(NOON);
        AlertDispatcher dispatcher = dispatcher(quietOff(), Set.of(email), MoreExecutors.newDirectExecutorService());
        int threads = 8;
        CyclicBarrier barrier = new CyclicBarrier(threads);
        ExecutorService workers = Executors.newFixedThreadPool(threads);

        try {
            // When
            List<Future<List<AlertRecord>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(workers.submit(() -> {
                    barrier.await(5, TimeUnit.SECONDS);
                    return dispatcher.dispatch(alert("Print Failed: benchy (Mini)"));
                }));
            }
            int stored = 0;
            for (Future<List<AlertRecord>> result : results) {
                stored += result.get(10, TimeUnit.SECONDS).size();
            }

            // Then
            assertThat(stored).isEqualTo(1);
            assertThat(alertRepository.findForUser(null, 50)).hasSize(1);
        } finally {
            workers.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should restore the interrupt flag when a delivery is interrupted")
    void shouldRestoreInterruptOnDelivery() {
        // Given
        DateTimeUtils.setCurrentMillisFixed(NOON);
        long alice = preferenceRepository.insertUser("alice", "alice@example.com");
        preferenceRepository.savePreference(new AlertPreference(alice, AlertEventSubscriber.PRINT_FAILED, true, true, false));
        INotificationChannel interrupted = new INotificationChannel() {
            @Override
            public EChannel getChannel() {
                return EChannel.EMAIL;
            }

            @Override
            public void deliver(AlertRequest alert, Recipient recipient) throws InterruptedException {
                throw new InterruptedException("delivery pool shutting down");
            }
        };
        AlertDispatcher dispatcher = dispatcher(quietOff(), Set.of(interrupted), MoreExecutors.newDirectExecutorService());

        // When
        List<AlertRecord> stored = dispatcher.dispatch(alert("Print Failed: benchy (Mini)"));

        // Then
        assertThat(Thread.interrupted()).isTrue();
        assertThat(stored).hasSize(1);
    }

    @Test
    @DisplayName("Should hold external delivery during quiet hours and list the alert in the digest")
    void shouldHoldDuringQuietHours() {
        // Given
        DateTimeUtils.setCurrentMillisFixed(LATE_EVENING);
        long alice = preferenceRepository.insertUser("alice", "alice@example.com");
        preferenceRepository.savePreference(new AlertPreference(alice, AlertEventSubscriber.PRINT_FAILED, true, true, false));
        AlertConfig quiet = new AlertConfig(300_000, true, new LocalTime(22, 0), new LocalTime(7, 0), 2, 5_000);
        AlertDispatcher dispatcher = dispatcher(quiet, Set.of(email), MoreExecutors.newDirectExecutorService());

        // When
        List<AlertRecord> stored = dispatcher.dispatch(alert("Print Failed: benchy (Mini)"));

        // Then
        assertThat(stored).hasSize(1);
        assertThat(stored.get(0).quietSuppressed()).isTrue();
        assertThat(email.delivered).isEmpty();

        // When
        DateTimeUtils.setCurrentMillisFixed(new DateTime(2026, 1, 21, 8, 0).getMillis());
        List<AlertRecord> digest = dispatcher.getQuietDigest();

        // Then
        assertThat(digest).extracting(AlertRecord::title).containsExactly("Print Failed: benchy (Mini)");
    }

    @Test
    @DisplayName("Should deliver to healthy channels when another channel fails")
    void shouldIsolateFailingChannel() throws InterruptedException {
        // Given
        DateTimeUtils.setCurrentMillisFixed(NOON);
        long alice = preferenceRepository.insertUser("alice", "alice@example.com");
        preferenceRepository.savePreference(new AlertPreference(alice, AlertEventSubscriber.PRINT_FAILED, true, true, true));
        RecordingChannel push = new RecordingChannel(EChannel.PUSH);
        push.failure = new IllegalStateException("push service unavailable");
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            AlertDispatcher dispatcher = dispatcher(quietOff(), Set.of(email, push), pool);

            // When
            dispatcher.dispatch(alert("Print Failed: benchy (Mini)"));

            // Then
            await().atMost(Duration.ofSeconds(5)).until(() -> email.delivered.size() == 1 && push.attempts == 1);
        } finally {
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private AlertDispatcher dispatcher(AlertConfig config, Set<INotificationChannel> channels, ExecutorService pool) {
        return new AlertDispatcher(alertRepository, preferenceRepository, channels, config, eventBus, pool);
    }

    private static AlertConfig quietOff() {
        return AlertConfig.defaults();
    }

    private static AlertRequest alert(String title) {
        String type = title.startsWith("Printer Offline") ? AlertEventSubscriber.PRINTER_OFFLINE : AlertEventSubscriber.PRINT_FAILED;
        return AlertRequest.of(type, ESeverity.CRITICAL, title, "Job failed on Mini at 42% progress.", "p1");
    }

    private static final class RecordingChannel implements INotificationChannel {
        private final EChannel channel;
        private final List<Recipient> delivered = Collections.synchronizedList(new ArrayList<>());
        private volatile RuntimeException failure;
        private volatile int attempts;

        private RecordingChannel(EChannel channel) {
            this.channel = channel;
        }

        @Override
        public EChannel getChannel() {
            return channel;
        }

        @Override
        public synchronized void deliver(AlertRequest alert, Recipient recipient) {
            attempts++;
            if (failure != null) {
                throw failure;
            }
            delivered.add(recipient);
        }
    }
}
