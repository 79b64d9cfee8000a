package ai.eigloo.workgraph.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * WorkGraph service settings.
 */
@ConfigurationProperties(prefix = "workgraph")
@Validated
public class WorkGraphProperties {

    @Valid
    private final Events events = new Events();
    @Valid
    private final Hierarchy hierarchy = new Hierarchy();
    private final Index index = new Index();

    public Events getEvents() {
        return events;
    }

    public Hierarchy getHierarchy() {
        return hierarchy;
    }

    public Index getIndex() {
        return index;
    }

    public static class Events {

        @NotBlank
        private String topic = "workgraph-events";
        private boolean enabled = true;
        @NotBlank
        private String clientId = "workgraph-service";
        @Pattern(regexp = "all|0|1|-1")
        private String acks = "all";
        @Min(0)
        private int retries = 3;

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getAcks() {
            return acks;
        }

        public void setAcks(String acks) {
            this.acks = acks;
        }

        public int getRetries() {
            return retries;
        }

        public void setRetries(int retries) {
            this.retries = retries;
        }
    }

    public static class Hierarchy {

        @Min(1)
        private int maxChainDepth = 100;

        public int getMaxChainDepth() {
            return maxChainDepth;
        }

        public void setMaxChainDepth(int maxChainDepth) {
            this.maxChainDepth = maxChainDepth;
        }
    }

    public static class Index {

        private boolean loadOnStartup = true;

        public boolean isLoadOnStartup() {
            return loadOnStartup;
        }

        public void setLoadOnStartup(boolean loadOnStartup) {
            this.loadOnStartup = loadOnStartup;
        }
    }
}
