package world.willfrog.storeagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from {@code store-agent.*}.
 */
@Data
@ConfigurationProperties(prefix = "store-agent")
public class StoreAgentProperties {

    private Scheduler scheduler = new Scheduler();

    private Run run = new Run();

    private Action action = new Action();

    private Dispatch dispatch = new Dispatch();

    private Events events = new Events();

    private Notification notification = new Notification();

    private Timeouts timeouts = new Timeouts();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String tickCron = "0 * * * * *";
        /** Upper bound on due (store, agent) pairs picked up by one tick. */
        private int batchSize = 200;
        private int batchConcurrency = 4;
    }

    @Data
    public static class Run {
        /** TTL of the single-flight lock; must exceed the longest expected run. */
        private long lockTtlSeconds = 900;
        private long staleAfterMinutes = 60;
        private int reconcileBatchSize = 100;
        private String reconcileCron = "30 */5 * * * *";
    }

    @Data
    public static class Action {
        private long staleExecutingMinutes = 30;
    }

    @Data
    public static class Dispatch {
        /** inline: execute on the local pool; kafka: publish action ids for the listener. */
        private String mode = "inline";
        private String topic = "store_agent_action_execute";
        private String consumerGroup = "store-agent-action-executor";
        private boolean producerEnabled = true;
        private boolean consumerEnabled = true;
    }

    @Data
    public static class Events {
        private String topic = "store_domain_event";
        private String consumerGroup = "store-agent-event-dispatcher";
        private boolean consumerEnabled = true;
    }

    @Data
    public static class Notification {
        private String topic = "store_notification";
        private boolean producerEnabled = true;
    }

    @Data
    public static class Timeouts {
        private long connectorSeconds = 30;
        private long priceSearchSeconds = 15;
        private long generativeSeconds = 60;
    }

    public boolean isKafkaDispatch() {
        return "kafka".equalsIgnoreCase(dispatch.getMode());
    }
}
