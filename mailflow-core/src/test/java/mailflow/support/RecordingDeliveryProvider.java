package mailflow.support;

import mailflow.spi.DeliveryException;
import mailflow.spi.DeliveryProvider;
import mailflow.spi.DeliveryReceipt;
import mailflow.spi.MessageContent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records every message it is asked to send. Can be told to fail the next N calls.
 */
public class RecordingDeliveryProvider implements DeliveryProvider {
  public record Sent(String recipient, MessageContent content) {
  }

  private final List<Sent> sent = new CopyOnWriteArrayList<>();
  private final AtomicInteger failuresLeft = new AtomicInteger();
  private final AtomicInteger calls = new AtomicInteger();

  public void failNext(int times) {
    failuresLeft.set(times);
  }

  @Override
  public DeliveryReceipt send(String recipient, MessageContent content) throws DeliveryException {
    int call = calls.incrementAndGet();
    if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new DeliveryException("provider unavailable (call " + call + ")");
    }
    sent.add(new Sent(recipient, content));
    return new DeliveryReceipt("msg-" + call);
  }

  public List<Sent> sent() {
    return sent;
  }

  public int calls() {
    return calls.get();
  }
}
