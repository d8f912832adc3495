package express.mvp.conduit.stream;

import express.mvp.conduit.error.ConnectionException;
import java.util.ArrayList;
import java.util.List;

/** Records every {@link ConnectionObserver} callback. */
final class RecordingObserver implements ConnectionObserver {

    final List<ConnectionException> errors = new ArrayList<>();
    final List<Integer> reconnectAttempts = new ArrayList<>();
    final List<Long> reconnectDelays = new ArrayList<>();
    final List<String> closes = new ArrayList<>();
    int reconnected;

    @Override
    public void onReconnecting(int attempt, long delayMillis) {
        reconnectAttempts.add(attempt);
        reconnectDelays.add(delayMillis);
    }

    @Override
    public void onReconnected() {
        reconnected++;
    }

    @Override
    public void onClosed(int code, String reason) {
        closes.add(code + " " + reason);
    }

    @Override
    public void onError(ConnectionException error) {
        errors.add(error);
    }

    long errorCount(ConnectionException.Reason reason) {
        return errors.stream().filter(e -> e.reason() == reason).count();
    }
}
