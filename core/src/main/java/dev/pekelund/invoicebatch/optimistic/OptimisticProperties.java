package dev.pekelund.invoicebatch.optimistic;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "invoice.optimistic")
public class OptimisticProperties {

    /**
     * Age after which an unconfirmed operation is rolled back.
     */
    private Duration operationTimeout = Duration.ofSeconds(30);

    /**
     * How often pending operations are checked for expiry.
     */
    private Duration sweepInterval = Duration.ofSeconds(5);

    public Duration getOperationTimeout() {
        return operationTimeout;
    }

    public void setOperationTimeout(Duration operationTimeout) {
        this.operationTimeout = operationTimeout;
    }

    public Duration getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
        this.sweepInterval = sweepInterval;
    }
}
