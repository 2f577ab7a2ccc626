package io.memqueue.broker.callback;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
@UtilityClass
class CallbackRunner {

    void runWave(final List<Runnable> wave) {
        for (final Runnable callback : wave) {
            try {
                callback.run();
            } catch (final RuntimeException e) {
                log.error("Producer ack callback failed", e);
            }
        }
    }
}
