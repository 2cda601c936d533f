package callcampaign;

import callcampaign.client.CallClientException;

import java.util.Objects;

/**
 * Thrown by {@link CampaignRunner#runToCompletion} when the calling service rejected the
 * credentials and the run stopped early.
 *
 * <p>The partial {@link #report()} still holds one result per contact; contacts not reached are
 * {@link FinalStatus#CANCELLED}.
 */
public class CampaignAbortedException extends RuntimeException {

    private final CampaignReport report;

    /**
     * @param report the partial report of the aborted run
     * @param cause  the authentication failure
     */
    public CampaignAbortedException(CampaignReport report, CallClientException cause) {
        super("Campaign " + Objects.requireNonNull(report, "report").campaignId()
            + " aborted: " + cause.getMessage(), cause);
        this.report = report;
    }

    public CampaignReport report() {
        return report;
    }

    @Override
    public synchronized CallClientException getCause() {
        return (CallClientException) super.getCause();
    }
}
