package crewdesk.workflow.cascade;

import crewdesk.workflow.config.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically expires crew offers nobody answered within the offer timeout.
 */
public class OfferTimeoutSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OfferTimeoutSweeper.class);

    private final AssignmentCascade cascade;
    private final WorkflowConfig config;

    public OfferTimeoutSweeper(AssignmentCascade cascade, WorkflowConfig config) {
        this.cascade = cascade;
        this.config = config;
    }

    @Override
    public void run() {
        if (!config.hasOfferTimeout()) {
            return;
        }
        int expired = cascade.expireStaleOffers(config.offerTimeout());
        if (expired > 0) {
            log.info("Offer sweep expired {} offer(s)", expired);
        }
    }
}
