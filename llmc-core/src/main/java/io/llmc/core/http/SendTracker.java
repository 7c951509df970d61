package io.llmc.core.http;

import java.util.concurrent.atomic.AtomicBoolean;
import okhttp3.Call;
import okhttp3.EventListener;

/**
 * Records whether request headers started going out on the wire. A POST that fails before that point has sent
 * nothing and may be retried.
 */
final class SendTracker extends EventListener {
    static final EventListener.Factory FACTORY = call -> {
        State state = call.request().tag(State.class);
        return state == null ? EventListener.NONE : new SendTracker(state);
    };

    private final State state;

    private SendTracker(State state) {
        this.state = state;
    }

    @Override
    public void requestHeadersStart(Call call) {
        state.sent.set(true);
    }

    static final class State {
        private final AtomicBoolean sent = new AtomicBoolean(false);

        boolean sent() {
            return sent.get();
        }
    }
}
