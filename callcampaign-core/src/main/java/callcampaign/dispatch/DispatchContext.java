package callcampaign.dispatch;

import callcampaign.CampaignRun;
import callcampaign.CancellationToken;
import callcampaign.client.CallClient;
import callcampaign.client.CallClientException;
import callcampaign.phone.PhoneNumberNormalizer;
import callcampaign.ratelimit.RateLimiter;
import callcampaign.spi.MetricsExporter;
import callcampaign.transcript.TranscriptSummarizer;

import java.util.function.Consumer;

/**
 * Collaborators shared by every contact task of one run.
 */
record DispatchContext(
    CampaignRun run,
    CallClient callClient,
    PhoneNumberNormalizer normalizer,
    RateLimiter rateLimiter,
    TranscriptSummarizer summarizer,
    MetricsExporter metrics,
    CancellationToken token,
    Consumer<CallClientException> abortHandler) {
}
