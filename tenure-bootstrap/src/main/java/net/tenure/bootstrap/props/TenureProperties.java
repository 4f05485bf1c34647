package net.tenure.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("tenure")
public class TenureProperties {
    private Nodes nodes = new Nodes();
    private Election election = new Election();
    private Store store = new Store();

    public Nodes getNodes() {
        return nodes;
    }

    public void setNodes(Nodes nodes) {
        this.nodes = nodes;
    }

    public Election getElection() {
        return election;
    }

    public void setElection(Election election) {
        this.election = election;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public static class Nodes {
        private int count = 5;
        private String idPrefix = "node-";

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public String getIdPrefix() {
            return idPrefix;
        }

        public void setIdPrefix(String idPrefix) {
            this.idPrefix = idPrefix;
        }
    }

    public static class Election {
        private Duration competitionJitter = Duration.ofSeconds(2);
        private Duration followerBackoff = Duration.ofSeconds(5);
        private Duration heartbeatInterval = Duration.ofSeconds(3);
        private Duration leaseDuration = Duration.ofSeconds(10);
        /** Backend to start with once the application is ready ("A" or "B"); unset = wait for a command. */
        private String autoStart;

        public Duration getCompetitionJitter() {
            return competitionJitter;
        }

        public void setCompetitionJitter(Duration competitionJitter) {
            this.competitionJitter = competitionJitter;
        }

        public Duration getFollowerBackoff() {
            return followerBackoff;
        }

        public void setFollowerBackoff(Duration followerBackoff) {
            this.followerBackoff = followerBackoff;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public String getAutoStart() {
            return autoStart;
        }

        public void setAutoStart(String autoStart) {
            this.autoStart = autoStart;
        }
    }

    public static class Store {
        /** memory | jdbc */
        private String type = "memory";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }
}
