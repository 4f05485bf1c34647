package net.tenure.app;

import net.tenure.core.engine.ElectionEngine;
import net.tenure.core.event.ElectionEvent;
import net.tenure.core.event.ElectionEvent.ElectionStarted;
import net.tenure.core.event.ElectionEvent.LeaderElected;
import net.tenure.core.event.ElectionEvent.LeaderLost;
import net.tenure.core.event.ElectionEvent.NodeCrashed;
import net.tenure.core.model.BackendKind;
import net.tenure.core.model.NodeStatus;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.main.keep-alive=false",
        "spring.datasource.url=jdbc:h2:mem:tenure-flow;DB_CLOSE_DELAY=-1",
        "tenure.election.competition-jitter=50ms",
        "tenure.election.follower-backoff=250ms",
        "tenure.election.heartbeat-interval=50ms",
        "tenure.election.lease-duration=300ms",
        "tenure.election.auto-start=B"
})
@Import(ElectionFlowIntegrationTest.Collector.class)
@TestMethodOrder(MethodOrderer.MethodName.class)
class ElectionFlowIntegrationTest {

    /** Listens the way an application would: election events arrive as Spring events. */
    static class Collector {
        final List<ElectionEvent> events = new CopyOnWriteArrayList<>();

        @EventListener
        void on(ElectionEvent e) { events.add(e); }
    }

    @Autowired ElectionEngine engine;
    @Autowired JdbcTemplate jdbc;
    @Autowired Collector collector;

    @AfterEach
    void tearDown() {
        engine.stopElection();
    }

    private List<ElectionEvent> events() {
        return new ArrayList<>(collector.events);
    }

    @Test
    void a1_autoStartedTtlElection_survivesALeaderCrash() {
        // 1) auto-start elected somebody on the ttl-key backend
        Awaitility.await().atMost(Duration.ofSeconds(10))
                .until(() -> engine.currentLeader().isPresent());
        assertThat(events()).contains(new ElectionStarted(BackendKind.TTL_KEY));
        String first = engine.currentLeader().orElseThrow().id();

        // the lease row is in the database
        assertThat(jdbc.queryForObject("SELECT KEY_VALUE FROM TB_LEASE_KEY WHERE KEY_NAME = 'leader'", String.class))
                .isEqualTo(first);

        // 2) crash the leader: crashed, lost, then someone else
        int mark = collector.events.size();
        engine.crashNode(first);

        Awaitility.await().atMost(Duration.ofSeconds(10))
                .until(() -> engine.currentLeader().filter(l -> !l.id().equals(first)).isPresent());
        String second = engine.currentLeader().orElseThrow().id();

        List<ElectionEvent> after = events().subList(mark, collector.events.size());
        assertThat(after.indexOf(new NodeCrashed(first)))
                .isLessThan(after.indexOf(new LeaderLost(first)));
        assertThat(after.indexOf(new LeaderLost(first)))
                .isLessThan(after.indexOf(new LeaderElected(second)));
        assertThat(engine.nodes()).filteredOn(n -> n.status() == NodeStatus.CRASHED).hasSize(1);
    }

    @Test
    void a2_conditionalWriteElection_storesTheLeaderDocument() {
        engine.resetElection();
        engine.startElection("A");

        Awaitility.await().atMost(Duration.ofSeconds(10))
                .until(() -> engine.currentLeader().isPresent());
        String leader = engine.currentLeader().orElseThrow().id();

        Awaitility.await().atMost(Duration.ofSeconds(2)).untilAsserted(() ->
                assertThat(jdbc.queryForObject(
                        "SELECT OWNER_ID FROM TB_LEASE_DOCUMENT WHERE ID = 'current-leader'", String.class))
                        .isEqualTo(leader));
        assertThat(engine.nodes()).filteredOn(n -> n.status() == NodeStatus.LEADER).hasSize(1);
    }
}
