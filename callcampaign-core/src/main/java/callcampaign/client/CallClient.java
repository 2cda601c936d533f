package callcampaign.client;

import callcampaign.NormalizedPhone;
import callcampaign.ScriptConfig;

import java.util.Optional;

/**
 * Boundary to the external calling service. The only component that touches the network.
 *
 * <p>Implementations must be thread-safe: dispatch workers call them concurrently.
 *
 * @see CallClientException
 */
public interface CallClient {

    /**
     * Places a call.
     *
     * @param phone  the number to call
     * @param script the rendered script for this contact
     * @return a handle for polling the call
     * @throws CallClientException with kind {@code SERVICE_UNAVAILABLE}, {@code AUTH_ERROR},
     *     {@code RATE_LIMITED} or {@code REQUEST_REJECTED}
     */
    CallHandle initiate(NormalizedPhone phone, ScriptConfig script);

    /**
     * Reads the current remote status. Idempotent; has no effect beyond reading remote state.
     *
     * @param handle a handle returned by {@link #initiate}
     * @return the current status
     * @throws CallClientException if the status cannot be read
     */
    RemoteCallStatus pollStatus(CallHandle handle);

    /**
     * Fetches the transcript of a completed call. Only valid after {@link #pollStatus} returned
     * {@link RemoteCallStatus#SUCCEEDED}.
     *
     * @param handle a handle returned by {@link #initiate}
     * @return the transcript, or empty if the service recorded none
     * @throws CallClientException if the transcript cannot be read
     */
    Optional<String> fetchTranscript(CallHandle handle);

    /**
     * Fetches the transcript and connected length of a completed call. Same preconditions as
     * {@link #fetchTranscript}.
     *
     * <p>The default implementation delegates to {@link #fetchTranscript} and reports an unknown
     * length; clients that get both in one request should override it.
     *
     * @param handle a handle returned by {@link #initiate}
     * @return the call details
     * @throws CallClientException if the details cannot be read
     */
    default CallDetails fetchDetails(CallHandle handle) {
        return CallDetails.ofTranscript(fetchTranscript(handle));
    }
}
