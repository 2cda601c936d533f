package callcampaign.spring.boot;

import callcampaign.NormalizedPhone;
import callcampaign.ScriptConfig;
import callcampaign.client.CallClient;
import callcampaign.client.CallHandle;
import callcampaign.client.RemoteCallStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Call client whose calls all complete with a confirming transcript. */
class StubCallClient implements CallClient {
  final List<ScriptConfig> scripts = new CopyOnWriteArrayList<>();
  private final AtomicInteger ids = new AtomicInteger();

  @Override
  public CallHandle initiate(NormalizedPhone phone, ScriptConfig script) {
    scripts.add(script);
    return new CallHandle("call-" + ids.incrementAndGet(), phone, Instant.now());
  }

  @Override
  public RemoteCallStatus pollStatus(CallHandle handle) {
    return RemoteCallStatus.SUCCEEDED;
  }

  @Override
  public Optional<String> fetchTranscript(CallHandle handle) {
    return Optional.of("Yes, I will be there.");
  }
}
